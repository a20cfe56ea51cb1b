package com.satfetch.reporters;

import com.satfetch.events.ProgressEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimpleProgressReporterTest {

    @Test
    void countsTaskOutcomesPerBatch() {
        SimpleProgressReporter reporter = new SimpleProgressReporter();

        reporter.onEvent(ProgressEvent.batchStarted("b1", 3, "download"));
        reporter.onEvent(ProgressEvent.taskCreated("download_a", "download"));
        reporter.onEvent(ProgressEvent.taskDuration("download_a", 100));
        reporter.onEvent(ProgressEvent.taskProgress("download_a", 100));
        reporter.onEvent(ProgressEvent.taskCompleted("download_a", true, null));
        reporter.onEvent(ProgressEvent.taskCompleted("download_b", false, "failed: HTTP 500"));
        reporter.onEvent(ProgressEvent.taskCompleted("download_c", true, null));
        reporter.onEvent(ProgressEvent.batchCompleted("b1", 2, 1));

        assertEquals(2, reporter.completedCount());
        assertEquals(1, reporter.failedCount());
    }

    @Test
    void newBatchResetsCounters() {
        SimpleProgressReporter reporter = new SimpleProgressReporter();
        reporter.onEvent(ProgressEvent.batchStarted("b1", 1, "download"));
        reporter.onEvent(ProgressEvent.taskCompleted("download_a", false, "failed: timed out"));

        reporter.onEvent(ProgressEvent.batchStarted("b2", 1, "download"));

        assertEquals(0, reporter.failedCount());
        assertEquals(0, reporter.completedCount());
    }
}
