package com.example.annotation.profile.service;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.service.AccessPolicyService;
import com.example.annotation.common.exception.AlreadyExistsException;
import com.example.annotation.common.exception.ForbiddenException;
import com.example.annotation.common.exception.InvalidArgumentException;
import com.example.annotation.common.exception.NotFoundException;
import com.example.annotation.common.util.RetryUtils;
import com.example.annotation.common.util.StringSanitizer;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.evaluation.service.SessionCascade;
import com.example.annotation.observability.metrics.EvaluationMetrics;
import com.example.annotation.profile.document.ProfileDoc;
import com.example.annotation.profile.model.Role;
import com.example.annotation.profile.model.request.CreateProfileRequest;
import com.example.annotation.profile.model.request.UpdateProfileRequest;
import com.example.annotation.profile.model.response.ProfileResponse;
import com.example.annotation.profile.repository.ProfileRepository;
import com.example.annotation.security.context.CallerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Profile provisioning and administration.
 */
@Slf4j
@Service
public class ProfileService {

    private static final String RESOURCE = "Profile";
    private static final Pattern PIN_PATTERN = Pattern.compile("^[0-9]{4}$");

    private final ProfileRepository profileRepository;
    private final AccessPolicyService accessPolicyService;
    private final SessionCascade sessionCascade;
    private final TransactionalOperator transactionalOperator;
    private final EvaluationMetrics metrics;
    private final List<String> bootstrapAdmins;
    private final int retryAttempts;
    private final Duration retryBackoff;

    public ProfileService(ProfileRepository profileRepository,
                          AccessPolicyService accessPolicyService,
                          SessionCascade sessionCascade,
                          TransactionalOperator transactionalOperator,
                          EvaluationMetrics metrics,
                          AnnotationProperties properties) {
        this.profileRepository = profileRepository;
        this.accessPolicyService = accessPolicyService;
        this.sessionCascade = sessionCascade;
        this.transactionalOperator = transactionalOperator;
        this.metrics = metrics;
        this.bootstrapAdmins = properties.getProfiles().getBootstrapAdmins();
        this.retryAttempts = properties.getStore().getTransientRetryAttempts();
        this.retryBackoff = Duration.ofMillis(properties.getStore().getTransientRetryBackoffMillis());
    }

    /**
     * Creates a profile. Callers create their own; admins may create any.
     * A second profile for the same id fails on the {@code _id} key.
     */
    public Mono<ProfileResponse> createProfile(CallerContext caller, CreateProfileRequest request) {
        String targetId = request.id() != null && !request.id().isBlank() ? request.id().trim() : caller.callerId();

        return Mono.fromCallable(() -> {
                    validateId(targetId);
                    validateFullName(request.fullName());
                    validatePin(request.pin());
                    return Role.fromValue(request.role());
                })
                .flatMap(role -> accessPolicyService.authorize(caller, ResourceAttributes.profile(targetId), Action.INSERT)
                        .flatMap(subject -> {
                            if (role == Role.ADMIN && !subject.isAdmin() && !bootstrapAdmins.contains(targetId)) {
                                return Mono.error(new ForbiddenException(
                                        "Admin profiles are provisioned by an administrator",
                                        caller.callerId(), "ADMIN_PROVISIONING"));
                            }
                            ProfileDoc doc = ProfileDoc.builder()
                                    .id(targetId)
                                    .role(role)
                                    .fullName(request.fullName().trim())
                                    .pin(request.pin())
                                    .createdAt(Instant.now())
                                    .build();
                            return profileRepository.insert(doc);
                        }))
                .onErrorMap(DuplicateKeyException.class, e -> new AlreadyExistsException(RESOURCE, targetId))
                .doOnNext(saved -> metrics.recordProfileCreated(saved.getRole().value()))
                .map(ProfileResponse::from)
                .doOnSuccess(resp -> log.info("Created profile: id={}, role={}",
                        StringSanitizer.forLog(resp.id()), resp.role()))
                .doOnError(e -> log.warn("Failed to create profile for caller={}: {}",
                        StringSanitizer.forLog(caller.callerId()), e.getMessage()));
    }

    public Mono<ProfileResponse> getProfile(CallerContext caller, String profileId) {
        return accessPolicyService.authorize(caller, ResourceAttributes.profile(profileId), Action.SELECT)
                .then(Mono.defer(() -> profileRepository.findById(profileId)))
                .switchIfEmpty(Mono.error(new NotFoundException(RESOURCE, profileId)))
                .map(ProfileResponse::from);
    }

    public Mono<ProfileResponse> getOwnProfile(CallerContext caller) {
        return getProfile(caller, caller.callerId());
    }

    /**
     * Admin only.
     *
     * @param role optional filter
     */
    public Flux<ProfileResponse> listProfiles(CallerContext caller, @Nullable Role role) {
        return accessPolicyService.authorize(caller, ResourceAttributes.profiles(), Action.SELECT)
                .thenMany(Flux.defer(() -> role != null
                        ? profileRepository.findByRoleOrderByFullNameAsc(role)
                        : profileRepository.findAllByOrderByFullNameAsc()))
                .map(ProfileResponse::from);
    }

    /**
     * Admin only; ownership never grants profile updates.
     */
    public Mono<ProfileResponse> updateProfile(CallerContext caller, String profileId, UpdateProfileRequest request) {
        return accessPolicyService.authorize(caller, ResourceAttributes.profile(profileId), Action.UPDATE)
                .then(Mono.fromCallable(() -> {
                    if (request.fullName() != null) {
                        validateFullName(request.fullName());
                    }
                    validatePin(request.pin());
                    return request.role() != null ? Role.fromValue(request.role()) : null;
                }).then(Mono.defer(() -> profileRepository.findById(profileId))))
                .switchIfEmpty(Mono.error(new NotFoundException(RESOURCE, profileId)))
                .flatMap(existing -> {
                    if (request.role() != null) {
                        existing.setRole(Role.fromValue(request.role()));
                    }
                    if (request.fullName() != null) {
                        existing.setFullName(request.fullName().trim());
                    }
                    if (request.pin() != null) {
                        existing.setPin(request.pin());
                    }
                    return profileRepository.save(existing);
                })
                .map(ProfileResponse::from)
                .doOnSuccess(resp -> log.info("Updated profile: id={}, role={}",
                        StringSanitizer.forLog(resp.id()), resp.role()));
    }

    /**
     * Admin only. Removes the profile with all sessions and ratings it owns, in one transaction.
     * A session started for this navigator at the same time conflicts on the profile document,
     * so the delete reruns and sweeps it up, or the start fails.
     */
    public Mono<Void> deleteProfile(CallerContext caller, String profileId) {
        return accessPolicyService.authorize(caller, ResourceAttributes.profile(profileId), Action.DELETE)
                .then(Mono.defer(() -> transactionalOperator.transactional(
                                profileRepository.findById(profileId)
                                        .switchIfEmpty(Mono.error(new NotFoundException(RESOURCE, profileId)))
                                        .flatMap(existing -> sessionCascade.deleteSessionsForNavigator(profileId)
                                                .then(Mono.defer(() -> profileRepository.deleteById(profileId)))
                                                .thenReturn(existing))))
                        .retryWhen(RetryUtils.transientTransactionRetry(retryAttempts, retryBackoff,
                                "Profile " + profileId + " changed during delete, please retry")))
                .doOnSuccess(deleted -> log.info("Deleted profile: id={}", StringSanitizer.forLog(profileId)))
                .doOnError(e -> log.warn("Failed to delete profile={}: {}",
                        StringSanitizer.forLog(profileId), e.getMessage()))
                .then();
    }

    private static void validateId(String id) {
        if (!StringSanitizer.isSafeId(id)) {
            throw new InvalidArgumentException("id", "Profile id is malformed");
        }
    }

    private static void validateFullName(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            throw new InvalidArgumentException("fullName", "Full name is required");
        }
    }

    private static void validatePin(String pin) {
        if (pin != null && !PIN_PATTERN.matcher(pin).matches()) {
            throw new InvalidArgumentException("pin", "PIN must be exactly four digits");
        }
    }
}
