package dev.devanks.energy.rollup.exception;

/**
 * Raised when another run took over a checkpoint while this run was still writing to it.
 */
public class StaleCheckpointException extends AggregationException {
    public StaleCheckpointException(String jobId, long expectedGeneration, long actualGeneration) {
        super(String.format("Checkpoint %s was claimed by run generation %d while generation %d was running.",
                jobId, actualGeneration, expectedGeneration));
    }

    public StaleCheckpointException(String message) {
        super(message);
    }
}
