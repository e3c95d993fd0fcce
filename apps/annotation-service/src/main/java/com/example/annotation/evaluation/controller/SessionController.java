package com.example.annotation.evaluation.controller;

import com.example.annotation.common.exception.InvalidArgumentException;
import com.example.annotation.evaluation.model.SessionStatus;
import com.example.annotation.evaluation.model.request.CompleteSessionRequest;
import com.example.annotation.evaluation.model.request.OverallScoreRequest;
import com.example.annotation.evaluation.model.request.StartSessionRequest;
import com.example.annotation.evaluation.model.response.SessionResponse;
import com.example.annotation.evaluation.service.SessionManager;
import com.example.annotation.security.annotation.ResolvedCaller;
import com.example.annotation.security.context.CallerContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionManager sessionManager;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<SessionResponse> startSession(
            @ResolvedCaller CallerContext caller,
            @Valid @RequestBody StartSessionRequest request) {

        log.debug("POST /sessions - caller: {}, case: {}", caller.callerId(), request.caseId());
        return sessionManager.startSession(caller, request);
    }

    @GetMapping
    public Flux<SessionResponse> listSessions(
            @ResolvedCaller CallerContext caller,
            @RequestParam(required = false) String navigatorId,
            @RequestParam(required = false) String status) {

        SessionStatus parsed = SessionStatus.fromValue(status);
        if (status != null && parsed == null) {
            return Flux.error(new InvalidArgumentException("status", "Unknown session status: " + status));
        }
        return sessionManager.listSessions(caller, navigatorId, parsed);
    }

    @GetMapping("/{sessionId}")
    public Mono<SessionResponse> getSession(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId) {

        return sessionManager.getSession(caller, sessionId);
    }

    @PutMapping("/{sessionId}/overall-score")
    public Mono<SessionResponse> submitOverallScore(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @RequestBody OverallScoreRequest request) {

        log.debug("PUT /sessions/{}/overall-score - caller: {}", sessionId, caller.callerId());
        return sessionManager.submitOverallScore(caller, sessionId, request.overallFieldAuthenticity());
    }

    @PostMapping("/{sessionId}/complete")
    public Mono<SessionResponse> completeSession(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @RequestBody(required = false) CompleteSessionRequest request) {

        log.debug("POST /sessions/{}/complete - caller: {}", sessionId, caller.callerId());
        return sessionManager.completeSession(caller, sessionId,
                request != null ? request.overallFieldAuthenticity() : null);
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteSession(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId) {

        log.debug("DELETE /sessions/{} - caller: {}", sessionId, caller.callerId());
        return sessionManager.deleteSession(caller, sessionId);
    }
}
