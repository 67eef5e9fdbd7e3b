package com.example.imageguard;

/**
 * Terminal outcome of one orchestrator run.
 *
 * @param reachedState last non-terminal state reached before the run ended
 */
public record SanitizationResult(
        FileTask task,
        TaskState state,
        TaskState reachedState,
        PhaseResult metadataPhase,
        PhaseResult pixelPhase,
        BackupRecord backup,
        String cleanedFingerprint,
        FailureReason failureReason,
        String detail,
        QuarantineEntry quarantine
) {
    public static SanitizationResult committed(FileTask task,
                                               PhaseResult metadataPhase,
                                               PhaseResult pixelPhase,
                                               BackupRecord backup,
                                               String cleanedFingerprint) {
        return new SanitizationResult(task, TaskState.COMMITTED, TaskState.PIXEL_CLEANED, metadataPhase, pixelPhase,
                backup, cleanedFingerprint, null, null, null);
    }

    public static SanitizationResult failed(FileTask task,
                                            TaskState reachedState,
                                            PhaseResult metadataPhase,
                                            PhaseResult pixelPhase,
                                            BackupRecord backup,
                                            FailureReason reason,
                                            String detail,
                                            QuarantineEntry quarantine) {
        return new SanitizationResult(task, TaskState.FAILED, reachedState, metadataPhase, pixelPhase,
                backup, null, reason, detail, quarantine);
    }

    public boolean isSuccess() {
        return state == TaskState.COMMITTED;
    }
}
