package com.example.annotation.evaluation.service;

import com.example.annotation.authz.service.AccessPolicyService;
import com.example.annotation.cases.document.SyntheticCaseDoc;
import com.example.annotation.cases.repository.SyntheticCaseRepository;
import com.example.annotation.common.exception.ConflictException;
import com.example.annotation.common.exception.ForbiddenException;
import com.example.annotation.common.exception.InvalidArgumentException;
import com.example.annotation.common.exception.InvalidStateException;
import com.example.annotation.common.exception.NotFoundException;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.evaluation.document.EvaluationSessionDoc;
import com.example.annotation.evaluation.model.SessionStatus;
import com.example.annotation.evaluation.model.request.StartSessionRequest;
import com.example.annotation.evaluation.repository.EvaluationSessionRepository;
import com.example.annotation.observability.metrics.EvaluationMetrics;
import com.example.annotation.profile.repository.ProfileRepository;
import com.example.annotation.util.AccessPolicyTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import com.mongodb.MongoException;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.annotation.util.CallerContextTestBuilder.anAdmin;
import static com.example.annotation.util.CallerContextTestBuilder.navigatorOne;
import static com.example.annotation.util.CallerContextTestBuilder.navigatorTwo;
import static com.example.annotation.util.SessionDocTestBuilder.aSession;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("SessionManager")
class SessionManagerTest {

    @Mock
    private EvaluationSessionRepository sessionRepository;

    @Mock
    private SyntheticCaseRepository caseRepository;

    @Mock
    private ProfileRepository profileRepository;

    @Mock
    private SessionCascade sessionCascade;

    @Mock
    private TransactionalOperator transactionalOperator;

    private SessionManager sessionManager;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        AccessPolicyTestSupport.stubStandardProfiles(profileRepository);
        EvaluationMetrics metrics = AccessPolicyTestSupport.metrics();
        AccessPolicyService accessPolicyService = AccessPolicyTestSupport.accessPolicyService(profileRepository, metrics);

        when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
        when(caseRepository.findById("case-x")).thenReturn(Mono.just(SyntheticCaseDoc.builder()
                .id("case-x").label("Case_7").narrativeSummary("A patient").build()));
        when(caseRepository.findById("missing-case")).thenReturn(Mono.empty());
        when(caseRepository.touchRevision(anyString())).thenReturn(Mono.just(0L));
        when(caseRepository.touchRevision("case-x")).thenReturn(Mono.just(1L));
        when(profileRepository.touchRevision(anyString())).thenReturn(Mono.just(0L));
        when(profileRepository.touchRevision("nav-1")).thenReturn(Mono.just(1L));
        when(profileRepository.touchRevision("nav-2")).thenReturn(Mono.just(1L));

        AnnotationProperties properties = new AnnotationProperties();
        properties.getStore().setTransientRetryAttempts(2);
        properties.getStore().setTransientRetryBackoffMillis(1);

        sessionManager = new SessionManager(sessionRepository, caseRepository, profileRepository,
                accessPolicyService, sessionCascade, transactionalOperator, metrics, properties);
    }

    @Nested
    @DisplayName("startSession")
    class StartSession {

        @Test
        @DisplayName("should create an in-progress session with denormalized labels")
        void shouldStartSession() {
            when(sessionRepository.insert(any(EvaluationSessionDoc.class)))
                    .thenAnswer(inv -> {
                        EvaluationSessionDoc doc = inv.getArgument(0);
                        doc.setId("S1");
                        return Mono.just(doc);
                    });

            StepVerifier.create(sessionManager.startSession(navigatorOne(), new StartSessionRequest("case-x", null)))
                    .assertNext(resp -> {
                        assertThat(resp.id()).isEqualTo("S1");
                        assertThat(resp.status()).isEqualTo(SessionStatus.IN_PROGRESS);
                        assertThat(resp.completedAt()).isNull();
                        assertThat(resp.navigatorId()).isEqualTo("nav-1");
                        assertThat(resp.navigatorName()).isEqualTo("Nora Navigator");
                        assertThat(resp.caseLabel()).isEqualTo("Case_7");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should allow one session per case and navigator while other navigators may start their own")
        void shouldEnforceOneSessionPerCaseAndNavigator() {
            when(sessionRepository.insert(any(EvaluationSessionDoc.class)))
                    .thenAnswer(inv -> Mono.just(inv.getArgument(0)))
                    .thenReturn(Mono.error(new DuplicateKeyException("E11000 case_navigator_uq")))
                    .thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(sessionManager.startSession(navigatorOne(), new StartSessionRequest("case-x", null)))
                    .assertNext(resp -> assertThat(resp.status()).isEqualTo(SessionStatus.IN_PROGRESS))
                    .verifyComplete();

            StepVerifier.create(sessionManager.startSession(navigatorOne(), new StartSessionRequest("case-x", null)))
                    .expectError(ConflictException.class)
                    .verify();

            StepVerifier.create(sessionManager.startSession(navigatorTwo(), new StartSessionRequest("case-x", null)))
                    .assertNext(resp -> assertThat(resp.navigatorId()).isEqualTo("nav-2"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should forbid a navigator starting a session for someone else")
        void shouldForbidStartingForOthers() {
            StepVerifier.create(sessionManager.startSession(navigatorOne(), new StartSessionRequest("case-x", "nav-2")))
                    .expectError(ForbiddenException.class)
                    .verify();

            verify(sessionRepository, never()).insert(any(EvaluationSessionDoc.class));
        }

        @Test
        @DisplayName("should let an admin start a session on behalf of a navigator")
        void shouldAllowAdminOnBehalf() {
            ArgumentCaptor<EvaluationSessionDoc> captor = ArgumentCaptor.forClass(EvaluationSessionDoc.class);
            when(sessionRepository.insert(captor.capture())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(sessionManager.startSession(anAdmin(), new StartSessionRequest("case-x", "nav-2")))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(captor.getValue().getNavigatorId()).isEqualTo("nav-2");
        }

        @Test
        @DisplayName("should report a missing case as not found")
        void shouldFailForMissingCase() {
            StepVerifier.create(sessionManager.startSession(navigatorOne(), new StartSessionRequest("missing-case", null)))
                    .expectError(NotFoundException.class)
                    .verify();

            verify(sessionRepository, never()).insert(any(EvaluationSessionDoc.class));
        }

        @Test
        @DisplayName("should report a missing navigator profile as not found to an admin")
        void shouldFailForMissingNavigator() {
            StepVerifier.create(sessionManager.startSession(anAdmin(), new StartSessionRequest("case-x", "nav-9")))
                    .expectError(NotFoundException.class)
                    .verify();

            verify(sessionRepository, never()).insert(any(EvaluationSessionDoc.class));
        }

        @Test
        @DisplayName("should bump the case and navigator inside the insert transaction")
        void shouldTouchParentsBeforeInsert() {
            when(sessionRepository.insert(any(EvaluationSessionDoc.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(sessionManager.startSession(navigatorOne(), new StartSessionRequest("case-x", null)))
                    .expectNextCount(1)
                    .verifyComplete();

            InOrder inOrder = inOrder(profileRepository, caseRepository, sessionRepository);
            inOrder.verify(profileRepository).touchRevision("nav-1");
            inOrder.verify(caseRepository).touchRevision("case-x");
            inOrder.verify(sessionRepository).insert(any(EvaluationSessionDoc.class));
            verify(transactionalOperator).transactional(any(Mono.class));
        }

        @Test
        @DisplayName("should not insert when the case is deleted between authorization and the write")
        void shouldNotOrphanSessionWhenCaseDeletedConcurrently() {
            // Case was readable when the request arrived; the delete committed first.
            when(caseRepository.touchRevision("case-x")).thenReturn(Mono.just(0L));

            StepVerifier.create(sessionManager.startSession(navigatorOne(), new StartSessionRequest("case-x", null)))
                    .expectError(NotFoundException.class)
                    .verify();

            verify(sessionRepository, never()).insert(any(EvaluationSessionDoc.class));
        }

        @Test
        @DisplayName("should rerun the start after a write conflict with a concurrent delete")
        void shouldRetryAfterConflictWithDelete() {
            AtomicInteger attempts = new AtomicInteger();
            when(caseRepository.touchRevision("case-x")).thenReturn(Mono.defer(() -> {
                if (attempts.incrementAndGet() == 1) {
                    return Mono.error(writeConflict());
                }
                return Mono.just(1L);
            }));
            when(sessionRepository.insert(any(EvaluationSessionDoc.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(sessionManager.startSession(navigatorOne(), new StartSessionRequest("case-x", null)))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(attempts.get()).isEqualTo(2);
            verify(sessionRepository).insert(any(EvaluationSessionDoc.class));
        }

        @Test
        @DisplayName("should surface a conflict when the parent keeps changing")
        void shouldSurfaceConflictWhenRetriesExhausted() {
            when(caseRepository.touchRevision("case-x")).thenReturn(Mono.error(writeConflict()));

            StepVerifier.create(sessionManager.startSession(navigatorOne(), new StartSessionRequest("case-x", null)))
                    .expectError(ConflictException.class)
                    .verify();

            verify(sessionRepository, never()).insert(any(EvaluationSessionDoc.class));
        }
    }

    @Nested
    @DisplayName("getSession")
    class GetSession {

        @Test
        @DisplayName("should return the session to its owner and to admins")
        void shouldReturnToOwnerAndAdmin() {
            when(sessionRepository.findById("S")).thenReturn(Mono.just(aSession().build()));

            StepVerifier.create(sessionManager.getSession(navigatorOne(), "S"))
                    .assertNext(resp -> assertThat(resp.id()).isEqualTo("S"))
                    .verifyComplete();
            StepVerifier.create(sessionManager.getSession(anAdmin(), "S"))
                    .expectNextCount(1)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should hide existence: foreign and missing sessions are both forbidden for navigators")
        void shouldHideExistence() {
            when(sessionRepository.findById("S")).thenReturn(Mono.just(aSession().build()));
            when(sessionRepository.findById("ghost")).thenReturn(Mono.empty());

            StepVerifier.create(sessionManager.getSession(navigatorTwo(), "S"))
                    .expectError(ForbiddenException.class)
                    .verify();
            StepVerifier.create(sessionManager.getSession(navigatorTwo(), "ghost"))
                    .expectError(ForbiddenException.class)
                    .verify();
        }

        @Test
        @DisplayName("should tell admins that a session does not exist")
        void shouldReportNotFoundToAdmin() {
            when(sessionRepository.findById("ghost")).thenReturn(Mono.empty());

            StepVerifier.create(sessionManager.getSession(anAdmin(), "ghost"))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("submitOverallScore")
    class SubmitOverallScore {

        @ParameterizedTest
        @ValueSource(ints = {0, 6, -1})
        @DisplayName("should reject scores outside 1..5")
        void shouldRejectOutOfRange(int score) {
            StepVerifier.create(sessionManager.submitOverallScore(navigatorOne(), "S", score))
                    .expectError(InvalidArgumentException.class)
                    .verify();

            verify(sessionRepository, never()).findById(anyString());
            verify(sessionRepository, never()).setOverallScoreIfInProgress(any(), anyInt(), any());
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 5})
        @DisplayName("should accept the boundary scores")
        void shouldAcceptBoundaries(int score) {
            when(sessionRepository.findById("S")).thenReturn(
                    Mono.just(aSession().build()),
                    Mono.just(aSession().withOverallFieldAuthenticity(score).build()));
            when(sessionRepository.setOverallScoreIfInProgress(eq("S"), eq(score), any(Instant.class)))
                    .thenReturn(Mono.just(1L));

            StepVerifier.create(sessionManager.submitOverallScore(navigatorOne(), "S", score))
                    .assertNext(resp -> assertThat(resp.overallFieldAuthenticity()).isEqualTo(score))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject a missing score")
        void shouldRejectNull() {
            StepVerifier.create(sessionManager.submitOverallScore(navigatorOne(), "S", null))
                    .expectError(InvalidArgumentException.class)
                    .verify();

            verify(sessionRepository, never()).findById(anyString());
        }

        @Test
        @DisplayName("should fail with invalid state when the conditional update matches nothing")
        void shouldFailWhenSessionCompleted() {
            when(sessionRepository.findById("S")).thenReturn(Mono.just(aSession().completed().build()));
            when(sessionRepository.setOverallScoreIfInProgress(eq("S"), eq(4), any(Instant.class)))
                    .thenReturn(Mono.just(0L));

            StepVerifier.create(sessionManager.submitOverallScore(navigatorOne(), "S", 4))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(InvalidStateException.class);
                        assertThat(((InvalidStateException) error).getCurrentStatus()).isEqualTo("completed");
                    })
                    .verify();
        }
    }

    @Nested
    @DisplayName("completeSession")
    class CompleteSession {

        @Test
        @DisplayName("should stamp completedAt on completion and reject later score submissions")
        void shouldCompleteThenRejectWrites() {
            EvaluationSessionDoc open = aSession().build();
            EvaluationSessionDoc done = aSession().completed().build();
            when(sessionRepository.findById("S")).thenReturn(Mono.just(open), Mono.just(done), Mono.just(done), Mono.just(done));
            when(sessionRepository.completeIfInProgress(eq("S"), any(Instant.class))).thenReturn(Mono.just(1L));
            when(sessionRepository.setOverallScoreIfInProgress(eq("S"), eq(3), any(Instant.class)))
                    .thenReturn(Mono.just(0L));

            StepVerifier.create(sessionManager.completeSession(navigatorOne(), "S", null))
                    .assertNext(resp -> {
                        assertThat(resp.status()).isEqualTo(SessionStatus.COMPLETED);
                        assertThat(resp.completedAt()).isNotNull();
                    })
                    .verifyComplete();

            StepVerifier.create(sessionManager.submitOverallScore(navigatorOne(), "S", 3))
                    .expectError(InvalidStateException.class)
                    .verify();
        }

        @Test
        @DisplayName("should fail a second completion with invalid state")
        void shouldRejectDoubleCompletion() {
            when(sessionRepository.findById("S")).thenReturn(Mono.just(aSession().completed().build()));
            when(sessionRepository.completeIfInProgress(eq("S"), any(Instant.class))).thenReturn(Mono.just(0L));

            StepVerifier.create(sessionManager.completeSession(navigatorOne(), "S", null))
                    .expectError(InvalidStateException.class)
                    .verify();
        }

        @Test
        @DisplayName("should write an optional score in the same update as the transition")
        void shouldCompleteWithScore() {
            when(sessionRepository.findById("S")).thenReturn(
                    Mono.just(aSession().build()),
                    Mono.just(aSession().withOverallFieldAuthenticity(5).completed().build()));
            when(sessionRepository.completeWithScoreIfInProgress(eq("S"), eq(5), any(Instant.class)))
                    .thenReturn(Mono.just(1L));

            StepVerifier.create(sessionManager.completeSession(navigatorOne(), "S", 5))
                    .assertNext(resp -> assertThat(resp.overallFieldAuthenticity()).isEqualTo(5))
                    .verifyComplete();

            verify(sessionRepository, never()).completeIfInProgress(any(), any());
        }

        @Test
        @DisplayName("should forbid completing another navigator's session")
        void shouldForbidForeignCompletion() {
            when(sessionRepository.findById("S")).thenReturn(Mono.just(aSession().build()));

            StepVerifier.create(sessionManager.completeSession(navigatorTwo(), "S", null))
                    .expectError(ForbiddenException.class)
                    .verify();

            verify(sessionRepository, never()).completeIfInProgress(any(), any());
        }
    }

    @Nested
    @DisplayName("listSessions")
    class ListSessions {

        @Test
        @DisplayName("should scope navigators to their own sessions")
        void shouldScopeToOwnSessions() {
            when(sessionRepository.findByNavigatorIdOrderByCreatedAtDesc("nav-1"))
                    .thenReturn(Flux.just(aSession().build()));

            StepVerifier.create(sessionManager.listSessions(navigatorOne(), null, null))
                    .expectNextCount(1)
                    .verifyComplete();

            verify(sessionRepository, never()).findAllByOrderByCreatedAtDesc();
        }

        @Test
        @DisplayName("should forbid a navigator listing someone else's sessions")
        void shouldForbidForeignListing() {
            StepVerifier.create(sessionManager.listSessions(navigatorOne(), "nav-2", null))
                    .expectError(ForbiddenException.class)
                    .verify();
        }

        @Test
        @DisplayName("should let admins list every session")
        void shouldListAllForAdmin() {
            when(sessionRepository.findAllByOrderByCreatedAtDesc()).thenReturn(Flux.just(
                    aSession().build(),
                    aSession().withId("S2").withNavigatorId("nav-2").build()));

            StepVerifier.create(sessionManager.listSessions(anAdmin(), null, null))
                    .expectNextCount(2)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("deleteSession")
    class DeleteSession {

        @Test
        @DisplayName("should cascade to ratings inside a transaction")
        void shouldCascade() {
            when(sessionRepository.findById("S")).thenReturn(Mono.just(aSession().build()));
            when(sessionCascade.deleteSession("S")).thenReturn(Mono.empty());

            StepVerifier.create(sessionManager.deleteSession(navigatorOne(), "S"))
                    .verifyComplete();

            verify(sessionCascade).deleteSession("S");
        }

        @Test
        @DisplayName("should forbid deletion by another navigator")
        void shouldForbidForeignDeletion() {
            when(sessionRepository.findById("S")).thenReturn(Mono.just(aSession().build()));

            StepVerifier.create(sessionManager.deleteSession(navigatorTwo(), "S"))
                    .expectError(ForbiddenException.class)
                    .verify();

            verify(sessionCascade, never()).deleteSession(any());
        }
    }

    private static MongoException writeConflict() {
        MongoException conflict = new MongoException(112, "WriteConflict");
        conflict.addLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL);
        return conflict;
    }
}
