package com.satfetch.events;

@FunctionalInterface
public interface ProgressListener {

    void onEvent(ProgressEvent event);
}
