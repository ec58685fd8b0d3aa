package com.example.villages.user.service;

import com.example.villages.authz.model.UserRole;
import com.example.villages.authz.model.Viewer;
import com.example.villages.common.exception.UnknownUserException;
import com.example.villages.common.util.StringSanitizer;
import com.example.villages.user.document.UserDoc;
import com.example.villages.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Resolves user IDs to the role and family facts authorization decisions need.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserDirectory {

    private final UserRepository userRepository;

    /**
     * Errors with {@link UnknownUserException} when the ID is invalid or not found.
     */
    @NonNull
    public Mono<Viewer> findViewer(String userId) {
        if (!StringSanitizer.isValidUserId(userId)) {
            return Mono.error(new UnknownUserException(userId));
        }
        return userRepository.findById(userId)
                .map(UserDirectory::toViewer)
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("User not found: userId={}", StringSanitizer.forLog(userId));
                    return Mono.error(new UnknownUserException(userId));
                }));
    }

    /**
     * The user's family ID, or empty when the user has none or does not exist.
     */
    @NonNull
    public Mono<String> findFamilyId(String userId) {
        return userRepository.findById(userId)
                .flatMap(user -> Mono.justOrEmpty(user.getFamilyId()))
                .filter(familyId -> !familyId.isBlank());
    }

    static Viewer toViewer(UserDoc user) {
        UserRole role = user.getRole() != null ? user.getRole() : UserRole.MEMBER;
        return new Viewer(user.getId(), role, user.getFamilyId(), user.getFamilyRole());
    }
}
