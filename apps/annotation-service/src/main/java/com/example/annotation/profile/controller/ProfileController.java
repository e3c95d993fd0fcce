package com.example.annotation.profile.controller;

import com.example.annotation.profile.model.Role;
import com.example.annotation.profile.model.request.CreateProfileRequest;
import com.example.annotation.profile.model.request.UpdateProfileRequest;
import com.example.annotation.profile.model.response.ProfileResponse;
import com.example.annotation.profile.service.ProfileService;
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
@RequestMapping("/api/v1/profiles")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileService profileService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ProfileResponse> createProfile(
            @ResolvedCaller CallerContext caller,
            @Valid @RequestBody CreateProfileRequest request) {

        log.debug("POST /profiles - caller: {}, role: {}", caller.callerId(), request.role());
        return profileService.createProfile(caller, request);
    }

    @GetMapping("/me")
    public Mono<ProfileResponse> getOwnProfile(@ResolvedCaller CallerContext caller) {
        return profileService.getOwnProfile(caller);
    }

    @GetMapping("/{profileId}")
    public Mono<ProfileResponse> getProfile(
            @ResolvedCaller CallerContext caller,
            @PathVariable String profileId) {

        return profileService.getProfile(caller, profileId);
    }

    @GetMapping
    public Flux<ProfileResponse> listProfiles(
            @ResolvedCaller CallerContext caller,
            @RequestParam(required = false) String role) {

        log.debug("GET /profiles - caller: {}, role: {}", caller.callerId(), role);
        if (role == null) {
            return profileService.listProfiles(caller, null);
        }
        return Mono.fromCallable(() -> Role.fromValue(role))
                .flatMapMany(parsed -> profileService.listProfiles(caller, parsed));
    }

    @PutMapping("/{profileId}")
    public Mono<ProfileResponse> updateProfile(
            @ResolvedCaller CallerContext caller,
            @PathVariable String profileId,
            @Valid @RequestBody UpdateProfileRequest request) {

        log.debug("PUT /profiles/{} - caller: {}", profileId, caller.callerId());
        return profileService.updateProfile(caller, profileId, request);
    }

    @DeleteMapping("/{profileId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteProfile(
            @ResolvedCaller CallerContext caller,
            @PathVariable String profileId) {

        log.debug("DELETE /profiles/{} - caller: {}", profileId, caller.callerId());
        return profileService.deleteProfile(caller, profileId);
    }
}
