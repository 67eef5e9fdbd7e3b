package com.example.imageguard;

/**
 * One-way notifications for a presentation layer. Callbacks run on pipeline threads and must return
 * quickly; exceptions they throw are logged and otherwise ignored.
 */
public interface PipelineListener {

    default void taskAdmitted(FileTask task) {
    }

    default void taskRejected(FileTask task, TaskQueue.Admission admission) {
    }

    default void taskCompleted(SanitizationResult result) {
    }

    default void scanFinished(ScanSummary summary) {
    }

    static PipelineListener noop() {
        return new PipelineListener() {
        };
    }
}
