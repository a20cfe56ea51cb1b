package com.satfetch.downloaders;

public class TransferCancelledException extends TransferException {

    public TransferCancelledException(String message) {
        super(message);
    }
}
