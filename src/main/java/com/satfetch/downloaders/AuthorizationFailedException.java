package com.satfetch.downloaders;

public class AuthorizationFailedException extends TransferException {

    public AuthorizationFailedException(String message) {
        super(message);
    }

    public AuthorizationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
