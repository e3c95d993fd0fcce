package com.example.annotation.progress.controller;

import com.example.annotation.progress.model.response.DashboardResponse;
import com.example.annotation.progress.model.response.NavigatorProgressResponse;
import com.example.annotation.progress.service.ProgressService;
import com.example.annotation.security.annotation.ResolvedCaller;
import com.example.annotation.security.context.CallerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressService progressService;

    @GetMapping("/navigators")
    public Flux<NavigatorProgressResponse> navigatorProgress(@ResolvedCaller CallerContext caller) {
        return progressService.navigatorProgress(caller);
    }

    @GetMapping("/me")
    public Mono<DashboardResponse> dashboard(@ResolvedCaller CallerContext caller) {
        return progressService.dashboard(caller);
    }
}
