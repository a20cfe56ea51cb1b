package com.satfetch.downloaders;

public class ObjectNotFoundException extends TransferException {

    public ObjectNotFoundException(String message) {
        super(message);
    }

    public ObjectNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
