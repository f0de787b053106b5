package com.jz.guard.guard.lock;

public class IdentityLockException extends RuntimeException {

    public IdentityLockException(String message) {
        super(message);
    }

    public IdentityLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
