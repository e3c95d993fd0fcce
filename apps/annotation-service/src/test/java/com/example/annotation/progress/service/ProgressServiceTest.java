package com.example.annotation.progress.service;

import com.example.annotation.authz.service.AccessPolicyService;
import com.example.annotation.cases.document.SyntheticCaseDoc;
import com.example.annotation.cases.repository.SyntheticCaseRepository;
import com.example.annotation.common.exception.ForbiddenException;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.evaluation.model.SessionStatus;
import com.example.annotation.evaluation.repository.EvaluationSessionRepository;
import com.example.annotation.profile.model.Role;
import com.example.annotation.profile.repository.ProfileRepository;
import com.example.annotation.progress.model.response.DashboardResponse;
import com.example.annotation.util.AccessPolicyTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static com.example.annotation.util.CallerContextTestBuilder.aCallerWithoutProfile;
import static com.example.annotation.util.CallerContextTestBuilder.anAdmin;
import static com.example.annotation.util.CallerContextTestBuilder.navigatorOne;
import static com.example.annotation.util.SessionDocTestBuilder.aSession;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ProgressService")
class ProgressServiceTest {

    @Mock
    private ProfileRepository profileRepository;

    @Mock
    private SyntheticCaseRepository caseRepository;

    @Mock
    private EvaluationSessionRepository sessionRepository;

    private ProgressService progressService;

    @BeforeEach
    void setUp() {
        AccessPolicyTestSupport.stubStandardProfiles(profileRepository);
        AccessPolicyService accessPolicyService = AccessPolicyTestSupport.accessPolicyService(
                profileRepository, AccessPolicyTestSupport.metrics());

        AnnotationProperties properties = new AnnotationProperties();
        properties.getDashboard().setSummaryPreviewLength(10);

        progressService = new ProgressService(profileRepository, caseRepository, sessionRepository,
                accessPolicyService, properties);
    }

    @Nested
    @DisplayName("navigatorProgress")
    class NavigatorProgress {

        @Test
        @DisplayName("should compute remaining as total minus completed minus in progress")
        void shouldComputeCounts() {
            when(caseRepository.count()).thenReturn(Mono.just(10L));
            when(profileRepository.findByRoleOrderByFullNameAsc(Role.NAVIGATOR)).thenReturn(Flux.just(
                    AccessPolicyTestSupport.profile("nav-1", Role.NAVIGATOR, "Nora"),
                    AccessPolicyTestSupport.profile("nav-2", Role.NAVIGATOR, "Ned")));
            when(sessionRepository.countByNavigatorIdAndStatus("nav-1", SessionStatus.COMPLETED)).thenReturn(Mono.just(4L));
            when(sessionRepository.countByNavigatorIdAndStatus("nav-1", SessionStatus.IN_PROGRESS)).thenReturn(Mono.just(1L));
            when(sessionRepository.countByNavigatorIdAndStatus("nav-2", SessionStatus.COMPLETED)).thenReturn(Mono.just(0L));
            when(sessionRepository.countByNavigatorIdAndStatus("nav-2", SessionStatus.IN_PROGRESS)).thenReturn(Mono.just(0L));

            StepVerifier.create(progressService.navigatorProgress(anAdmin()))
                    .assertNext(p -> {
                        assertThat(p.navigatorId()).isEqualTo("nav-1");
                        assertThat(p.completed()).isEqualTo(4);
                        assertThat(p.inProgress()).isEqualTo(1);
                        assertThat(p.remaining()).isEqualTo(5);
                    })
                    .assertNext(p -> assertThat(p.remaining()).isEqualTo(10))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should be reserved for admins")
        void shouldForbidNavigators() {
            StepVerifier.create(progressService.navigatorProgress(navigatorOne()))
                    .expectError(ForbiddenException.class)
                    .verify();

            verify(caseRepository, never()).count();
        }
    }

    @Nested
    @DisplayName("dashboard")
    class Dashboard {

        @Test
        @DisplayName("should split cases into in progress, pending and completed ordered by label number")
        void shouldBuildDashboard() {
            when(caseRepository.findAllByOrderByCreatedAtAsc()).thenReturn(Flux.just(
                    caseDoc("c10", "Case_10", "Tenth narrative that is long"),
                    caseDoc("c2", "Case_2", "Second"),
                    caseDoc("c1", "Case_1", "First"),
                    caseDoc("c3", "Case_3", "Third")));
            when(sessionRepository.findByNavigatorIdOrderByCreatedAtDesc("nav-1")).thenReturn(Flux.just(
                    aSession().withId("S3").withCaseId("c3").withCaseLabel("Case_3").completed().build(),
                    aSession().withId("S1").withCaseId("c1").withCaseLabel("Case_1").build()));

            StepVerifier.create(progressService.dashboard(navigatorOne()))
                    .assertNext(dashboard -> {
                        assertThat(dashboard.navigatorName()).isEqualTo("Nora Navigator");
                        assertThat(dashboard.inProgress()).extracting(DashboardResponse.Entry::sessionId)
                                .containsExactly("S1");
                        assertThat(dashboard.pending()).extracting(DashboardResponse.Entry::caseLabel)
                                .containsExactly("Case_2", "Case_10");
                        assertThat(dashboard.completed()).extracting(DashboardResponse.Entry::caseId)
                                .containsExactly("c3");
                        assertThat(dashboard.pending().get(1).summary()).isEqualTo("Tenth narr...");
                        assertThat(dashboard.pending().get(0).summary()).isEqualTo("Second...");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should require read access to the catalog")
        void shouldForbidWithoutProfile() {
            StepVerifier.create(progressService.dashboard(
                            aCallerWithoutProfile()))
                    .expectError(ForbiddenException.class)
                    .verify();

            verify(caseRepository, never()).findAllByOrderByCreatedAtAsc();
            verify(sessionRepository, never()).findByNavigatorIdOrderByCreatedAtDesc(anyString());
        }
    }

    @Test
    @DisplayName("should sort labels by their first number")
    void shouldExtractLabelNumber() {
        assertThat(ProgressService.labelNumber("Case_12")).isEqualTo(12);
        assertThat(ProgressService.labelNumber("Special")).isZero();
        assertThat(ProgressService.labelNumber(null)).isZero();
    }

    private static SyntheticCaseDoc caseDoc(String id, String label, String summary) {
        return SyntheticCaseDoc.builder().id(id).label(label).narrativeSummary(summary).build();
    }
}
