package com.example.annotation.cases.service;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.service.AccessPolicyService;
import com.example.annotation.cases.document.SyntheticCaseDoc;
import com.example.annotation.cases.model.request.CaseRequest;
import com.example.annotation.cases.model.request.ImportCasesRequest;
import com.example.annotation.cases.model.response.CaseResponse;
import com.example.annotation.cases.model.response.ImportCasesResponse;
import com.example.annotation.cases.repository.SyntheticCaseRepository;
import com.example.annotation.common.exception.InvalidArgumentException;
import com.example.annotation.common.exception.NotFoundException;
import com.example.annotation.common.util.RetryUtils;
import com.example.annotation.common.util.StringSanitizer;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.config.PayloadNumberConverters;
import com.example.annotation.evaluation.service.SessionCascade;
import com.example.annotation.observability.metrics.EvaluationMetrics;
import com.example.annotation.security.context.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Case Catalog. Navigators read; only administrators author.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CaseCatalogService {

    private static final String RESOURCE = "SyntheticCase";
    private static final String ALL = "*";
    private static final String DEFAULT_BATCH = "manual";

    private final SyntheticCaseRepository caseRepository;
    private final AccessPolicyService accessPolicyService;
    private final SessionCascade sessionCascade;
    private final TransactionalOperator transactionalOperator;
    private final EvaluationMetrics metrics;
    private final AnnotationProperties properties;

    public Flux<CaseResponse> listCases(CallerContext caller) {
        return accessPolicyService.authorize(caller, ResourceAttributes.syntheticCase(ALL), Action.SELECT)
                .thenMany(Flux.defer(caseRepository::findAllByOrderByCreatedAtAsc))
                .map(CaseResponse::from);
    }

    /**
     * Every navigator may read every case, so a missing case is reported as not found.
     */
    public Mono<CaseResponse> getCase(CallerContext caller, String caseId) {
        return accessPolicyService.authorize(caller, ResourceAttributes.syntheticCase(caseId), Action.SELECT)
                .then(Mono.defer(() -> caseRepository.findById(caseId)))
                .switchIfEmpty(Mono.error(new NotFoundException(RESOURCE, caseId)))
                .map(CaseResponse::from);
    }

    public Mono<CaseResponse> createCase(CallerContext caller, CaseRequest request) {
        return accessPolicyService.authorize(caller, ResourceAttributes.syntheticCase("new"), Action.INSERT)
                .then(Mono.fromCallable(() -> {
                    if (request.label() == null || request.label().isBlank()) {
                        throw new InvalidArgumentException("label", "Label is required");
                    }
                    return toDocument(request, batchOrDefault(request.batchId()), request.label().trim());
                }))
                .flatMap(caseRepository::insert)
                .doOnNext(saved -> metrics.recordCasesCreated(1))
                .map(CaseResponse::from)
                .doOnSuccess(resp -> log.info("Created case: id={}, label={}",
                        resp.id(), StringSanitizer.forLog(resp.label())));
    }

    /**
     * Inserts a batch in one transaction. Unlabelled cases get {@code Case_<position>}.
     */
    public Mono<ImportCasesResponse> importCases(CallerContext caller, ImportCasesRequest request) {
        return accessPolicyService.authorize(caller, ResourceAttributes.syntheticCase("import"), Action.INSERT)
                .then(Mono.fromCallable(() -> {
                    List<SyntheticCaseDoc> docs = new ArrayList<>(request.cases().size());
                    for (int i = 0; i < request.cases().size(); i++) {
                        CaseRequest item = request.cases().get(i);
                        String label = item.label() != null && !item.label().isBlank()
                                ? item.label().trim()
                                : "Case_" + (i + 1);
                        docs.add(toDocument(item, request.batchId(), label));
                    }
                    return docs;
                }))
                .flatMap(docs -> transactionalOperator.transactional(
                        Flux.defer(() -> caseRepository.insert(docs)).map(SyntheticCaseDoc::getId).collectList()))
                .map(ids -> new ImportCasesResponse(request.batchId(), ids.size(), ids))
                .doOnNext(resp -> metrics.recordCasesCreated(resp.imported()))
                .doOnSuccess(resp -> log.info("Imported {} cases into batch={}",
                        resp.imported(), StringSanitizer.forLog(resp.batchId())))
                .doOnError(e -> log.error("Failed to import batch={}: {}",
                        StringSanitizer.forLog(request.batchId()), e.getMessage()));
    }

    /**
     * Admin only. Null fields are left unchanged.
     */
    public Mono<CaseResponse> updateCase(CallerContext caller, String caseId, CaseRequest request) {
        return accessPolicyService.authorize(caller, ResourceAttributes.syntheticCase(caseId), Action.UPDATE)
                .then(Mono.defer(() -> caseRepository.findById(caseId)))
                .switchIfEmpty(Mono.error(new NotFoundException(RESOURCE, caseId)))
                .flatMap(existing -> {
                    requireStorablePayloads(request);
                    if (request.batchId() != null) {
                        existing.setBatchId(request.batchId());
                    }
                    if (request.label() != null && !request.label().isBlank()) {
                        existing.setLabel(request.label().trim());
                    }
                    if (request.narrativeSummary() != null) {
                        existing.setNarrativeSummary(request.narrativeSummary());
                    }
                    if (request.format1StateLog() != null) {
                        existing.setFormat1StateLog(request.format1StateLog());
                    }
                    if (request.format2Triples() != null) {
                        existing.setFormat2Triples(request.format2Triples());
                    }
                    if (request.format3RlScenario() != null) {
                        existing.setFormat3RlScenario(request.format3RlScenario());
                    }
                    return caseRepository.save(existing);
                })
                .map(CaseResponse::from)
                .doOnSuccess(resp -> log.info("Updated case: id={}", resp.id()));
    }

    /**
     * Admin only. Deletes the case, its sessions and their ratings in one transaction.
     * A session started on this case at the same time conflicts on the case document,
     * so the delete reruns and sweeps it up, or the start fails.
     */
    public Mono<Void> deleteCase(CallerContext caller, String caseId) {
        return accessPolicyService.authorize(caller, ResourceAttributes.syntheticCase(caseId), Action.DELETE)
                .then(Mono.defer(() -> transactionalOperator.transactional(
                                caseRepository.findById(caseId)
                                        .switchIfEmpty(Mono.error(new NotFoundException(RESOURCE, caseId)))
                                        .flatMap(existing -> sessionCascade.deleteSessionsForCase(caseId)
                                                .then(Mono.defer(() -> caseRepository.deleteById(caseId)))
                                                .thenReturn(existing))))
                        .retryWhen(RetryUtils.transientTransactionRetry(
                                properties.getStore().getTransientRetryAttempts(),
                                Duration.ofMillis(properties.getStore().getTransientRetryBackoffMillis()),
                                "Case " + caseId + " changed during delete, please retry")))
                .doOnNext(deleted -> metrics.recordCaseDeleted())
                .doOnSuccess(deleted -> log.info("Deleted case: id={}", StringSanitizer.forLog(caseId)))
                .doOnError(e -> log.warn("Failed to delete case={}: {}", StringSanitizer.forLog(caseId), e.getMessage()))
                .then();
    }

    private static SyntheticCaseDoc toDocument(CaseRequest request, String batchId, String label) {
        requireStorablePayloads(request);
        return SyntheticCaseDoc.builder()
                .batchId(batchId)
                .label(label)
                .narrativeSummary(request.narrativeSummary() != null ? request.narrativeSummary() : "")
                .format1StateLog(payloadOrEmpty(request.format1StateLog()))
                .format2Triples(payloadOrEmpty(request.format2Triples()))
                .format3RlScenario(payloadOrEmpty(request.format3RlScenario()))
                .build();
    }

    private static void requireStorablePayloads(CaseRequest request) {
        requireStorableNumbers(request.format1StateLog(), "format1StateLog");
        requireStorableNumbers(request.format2Triples(), "format2Triples");
        requireStorableNumbers(request.format3RlScenario(), "format3RlScenario");
    }

    /**
     * Payloads are stored verbatim, so every number must fit decimal128 exactly.
     */
    private static void requireStorableNumbers(Object node, String field) {
        if (node instanceof Map<?, ?> map) {
            map.values().forEach(value -> requireStorableNumbers(value, field));
        } else if (node instanceof Collection<?> items) {
            items.forEach(value -> requireStorableNumbers(value, field));
        } else if (node instanceof BigDecimal || node instanceof BigInteger) {
            BigDecimal value = node instanceof BigInteger big ? new BigDecimal(big) : (BigDecimal) node;
            try {
                PayloadNumberConverters.toDecimal128(value);
            } catch (NumberFormatException e) {
                throw new InvalidArgumentException(field, "Numbers are limited to 34 significant digits");
            }
        }
    }

    private static Object payloadOrEmpty(Object payload) {
        return payload != null ? payload : List.of();
    }

    private static String batchOrDefault(String batchId) {
        return batchId != null && !batchId.isBlank() ? batchId : DEFAULT_BATCH;
    }
}
