package io.crabcity.auth.event;

import io.crabcity.auth.config.AuthConf;
import lombok.NonNull;
import lombok.Value;

/**
 * When the storage layer should sign a checkpoint.
 */
@Value
public class CheckpointPolicy {

    long interval;

    public CheckpointPolicy(long interval) {
        if (interval <= 0) {
            throw new IllegalArgumentException("checkpoint interval must be positive: " + interval);
        }
        this.interval = interval;
    }

    public static CheckpointPolicy from(@NonNull AuthConf conf) {
        return new CheckpointPolicy(conf.getCheckpointInterval());
    }

    /**
     * True for every {@code interval}-th event id, never for the genesis event 0.
     */
    public boolean isDue(long eventId) {
        return eventId != 0 && Long.remainderUnsigned(eventId, interval) == 0;
    }
}
