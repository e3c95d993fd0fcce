package com.example.annotation.progress.service;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.service.AccessPolicyService;
import com.example.annotation.cases.document.SyntheticCaseDoc;
import com.example.annotation.cases.repository.SyntheticCaseRepository;
import com.example.annotation.common.util.StringSanitizer;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.evaluation.document.EvaluationSessionDoc;
import com.example.annotation.evaluation.model.SessionStatus;
import com.example.annotation.evaluation.repository.EvaluationSessionRepository;
import com.example.annotation.profile.document.ProfileDoc;
import com.example.annotation.profile.model.Role;
import com.example.annotation.profile.repository.ProfileRepository;
import com.example.annotation.progress.model.response.DashboardResponse;
import com.example.annotation.progress.model.response.NavigatorProgressResponse;
import com.example.annotation.security.context.CallerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read models for the admin progress table and the navigator dashboard.
 */
@Slf4j
@Service
public class ProgressService {

    private static final Pattern LABEL_NUMBER = Pattern.compile("(\\d+)");
    private static final String UNKNOWN_CASE = "Unknown case";

    private final ProfileRepository profileRepository;
    private final SyntheticCaseRepository caseRepository;
    private final EvaluationSessionRepository sessionRepository;
    private final AccessPolicyService accessPolicyService;
    private final int previewLength;

    public ProgressService(ProfileRepository profileRepository,
                           SyntheticCaseRepository caseRepository,
                           EvaluationSessionRepository sessionRepository,
                           AccessPolicyService accessPolicyService,
                           AnnotationProperties properties) {
        this.profileRepository = profileRepository;
        this.caseRepository = caseRepository;
        this.sessionRepository = sessionRepository;
        this.accessPolicyService = accessPolicyService;
        this.previewLength = properties.getDashboard().getSummaryPreviewLength();
    }

    /**
     * Admin only: completed, in-progress and remaining counts for every navigator.
     */
    public Flux<NavigatorProgressResponse> navigatorProgress(CallerContext caller) {
        return accessPolicyService.authorize(caller, ResourceAttributes.profiles(), Action.SELECT)
                .then(Mono.defer(caseRepository::count))
                .flatMapMany(totalCases -> profileRepository.findByRoleOrderByFullNameAsc(Role.NAVIGATOR)
                        .concatMap(navigator -> progressFor(navigator, totalCases)));
    }

    private Mono<NavigatorProgressResponse> progressFor(ProfileDoc navigator, long totalCases) {
        return Mono.zip(
                        sessionRepository.countByNavigatorIdAndStatus(navigator.getId(), SessionStatus.COMPLETED),
                        sessionRepository.countByNavigatorIdAndStatus(navigator.getId(), SessionStatus.IN_PROGRESS))
                .map(counts -> new NavigatorProgressResponse(
                        navigator.getId(),
                        navigator.getFullName(),
                        counts.getT1(),
                        counts.getT2(),
                        totalCases - counts.getT1() - counts.getT2(),
                        totalCases));
    }

    /**
     * The caller's own queue: sessions in progress, cases not yet started and completed sessions.
     * Requires read access to the catalog.
     */
    public Mono<DashboardResponse> dashboard(CallerContext caller) {
        String navigatorId = caller.callerId();

        return accessPolicyService.authorize(caller, ResourceAttributes.syntheticCase("*"), Action.SELECT)
                .then(Mono.defer(() -> Mono.zip(
                        profileRepository.findById(navigatorId)
                                .map(ProfileDoc::getFullName)
                                .defaultIfEmpty(""),
                        caseRepository.findAllByOrderByCreatedAtAsc().collectList(),
                        sessionRepository.findByNavigatorIdOrderByCreatedAtDesc(navigatorId).collectList())))
                .map(tuple -> buildDashboard(navigatorId, tuple.getT1(), tuple.getT2(), tuple.getT3()))
                .doOnSuccess(resp -> log.debug("Dashboard for navigator={}: inProgress={}, pending={}, completed={}",
                        StringSanitizer.forLog(navigatorId),
                        resp.inProgress().size(), resp.pending().size(), resp.completed().size()));
    }

    private DashboardResponse buildDashboard(String navigatorId, String navigatorName,
                                             List<SyntheticCaseDoc> cases,
                                             List<EvaluationSessionDoc> sessions) {
        Map<String, SyntheticCaseDoc> casesById = cases.stream()
                .collect(Collectors.toMap(SyntheticCaseDoc::getId, Function.identity(), (a, b) -> a));
        Map<String, EvaluationSessionDoc> sessionsByCase = sessions.stream()
                .collect(Collectors.toMap(EvaluationSessionDoc::getCaseId, Function.identity(), (a, b) -> a));

        List<DashboardResponse.Entry> pending = cases.stream()
                .filter(c -> !sessionsByCase.containsKey(c.getId()))
                .sorted(Comparator.comparingLong(c -> labelNumber(c.getLabel())))
                .map(c -> new DashboardResponse.Entry(
                        c.getId(), c.getLabel(), null, null,
                        StringSanitizer.preview(c.getNarrativeSummary(), previewLength), null))
                .toList();

        return new DashboardResponse(
                navigatorId,
                navigatorName,
                sessionEntries(sessions, casesById, SessionStatus.IN_PROGRESS),
                pending,
                sessionEntries(sessions, casesById, SessionStatus.COMPLETED));
    }

    private List<DashboardResponse.Entry> sessionEntries(List<EvaluationSessionDoc> sessions,
                                                         Map<String, SyntheticCaseDoc> casesById,
                                                         SessionStatus status) {
        return sessions.stream()
                .filter(s -> s.getStatus() == status)
                .sorted(Comparator.comparingLong(s -> labelNumber(labelOf(s, casesById))))
                .map(s -> {
                    SyntheticCaseDoc c = casesById.get(s.getCaseId());
                    String summary = c != null
                            ? StringSanitizer.preview(c.getNarrativeSummary(), previewLength)
                            : UNKNOWN_CASE;
                    return new DashboardResponse.Entry(
                            s.getCaseId(), labelOf(s, casesById), s.getId(), s.getStatus(), summary, s.getCompletedAt());
                })
                .toList();
    }

    private static String labelOf(EvaluationSessionDoc session, Map<String, SyntheticCaseDoc> casesById) {
        if (session.getCaseLabel() != null && !session.getCaseLabel().isEmpty()) {
            return session.getCaseLabel();
        }
        SyntheticCaseDoc c = casesById.get(session.getCaseId());
        return c != null ? c.getLabel() : "";
    }

    /**
     * First run of digits in the label, so {@code Case_2} sorts before {@code Case_10}. 0 when absent.
     */
    static long labelNumber(String label) {
        if (label == null) {
            return 0;
        }
        Matcher m = LABEL_NUMBER.matcher(label);
        if (!m.find()) {
            return 0;
        }
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
