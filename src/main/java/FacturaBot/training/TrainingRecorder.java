package FacturaBot.training;

/**
 * Write-only sink for processed documents, used for offline retraining.
 * Callers treat it as fire-and-forget.
 */
@FunctionalInterface
public interface TrainingRecorder {

    void record(TrainingExample example);

    static TrainingRecorder disabled() {
        return example -> { };
    }
}
