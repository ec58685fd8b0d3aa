package com.example.villages.common.exception;

import lombok.Getter;

/**
 * The caller's user ID does not resolve to a known user.
 */
@Getter
public class UnknownUserException extends RuntimeException {

    private final String userId;

    public UnknownUserException(String userId) {
        super("Unknown user");
        this.userId = userId;
    }
}
