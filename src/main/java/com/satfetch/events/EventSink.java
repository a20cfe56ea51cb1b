package com.satfetch.events;

@FunctionalInterface
public interface EventSink {

    EventSink NOOP = event -> { };

    void emit(ProgressEvent event);
}
