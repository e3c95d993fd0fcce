package com.example.annotation.cases.controller;

import com.example.annotation.cases.model.request.CaseRequest;
import com.example.annotation.cases.model.request.ImportCasesRequest;
import com.example.annotation.cases.model.response.CaseResponse;
import com.example.annotation.cases.model.response.ImportCasesResponse;
import com.example.annotation.cases.service.CaseCatalogService;
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
@RequestMapping("/api/v1/cases")
@RequiredArgsConstructor
public class CaseController {

    private final CaseCatalogService caseCatalogService;

    @GetMapping
    public Flux<CaseResponse> listCases(@ResolvedCaller CallerContext caller) {
        log.debug("GET /cases - caller: {}", caller.callerId());
        return caseCatalogService.listCases(caller);
    }

    @GetMapping("/{caseId}")
    public Mono<CaseResponse> getCase(
            @ResolvedCaller CallerContext caller,
            @PathVariable String caseId) {

        return caseCatalogService.getCase(caller, caseId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<CaseResponse> createCase(
            @ResolvedCaller CallerContext caller,
            @Valid @RequestBody CaseRequest request) {

        log.debug("POST /cases - caller: {}, label: {}", caller.callerId(), request.label());
        return caseCatalogService.createCase(caller, request);
    }

    @PostMapping("/import")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ImportCasesResponse> importCases(
            @ResolvedCaller CallerContext caller,
            @Valid @RequestBody ImportCasesRequest request) {

        log.debug("POST /cases/import - caller: {}, batch: {}, size: {}",
                caller.callerId(), request.batchId(), request.cases().size());
        return caseCatalogService.importCases(caller, request);
    }

    @PutMapping("/{caseId}")
    public Mono<CaseResponse> updateCase(
            @ResolvedCaller CallerContext caller,
            @PathVariable String caseId,
            @Valid @RequestBody CaseRequest request) {

        return caseCatalogService.updateCase(caller, caseId, request);
    }

    @DeleteMapping("/{caseId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteCase(
            @ResolvedCaller CallerContext caller,
            @PathVariable String caseId) {

        log.debug("DELETE /cases/{} - caller: {}", caseId, caller.callerId());
        return caseCatalogService.deleteCase(caller, caseId);
    }
}
