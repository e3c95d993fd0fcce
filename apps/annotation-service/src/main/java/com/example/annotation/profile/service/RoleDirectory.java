package com.example.annotation.profile.service;

import com.example.annotation.common.exception.NotFoundException;
import com.example.annotation.profile.document.ProfileDoc;
import com.example.annotation.profile.model.Role;
import com.example.annotation.profile.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Single source of truth for a caller's role. Reads the profile store on every call.
 */
@Component
@RequiredArgsConstructor
public class RoleDirectory {

    private final ProfileRepository profileRepository;

    public Mono<Role> resolveRole(String callerId) {
        return findRole(callerId)
                .switchIfEmpty(Mono.error(new NotFoundException("Profile", callerId)));
    }

    /**
     * @return the role, or empty when the caller has no profile
     */
    public Mono<Role> findRole(String callerId) {
        return profileRepository.findById(callerId)
                .map(ProfileDoc::getRole);
    }
}
