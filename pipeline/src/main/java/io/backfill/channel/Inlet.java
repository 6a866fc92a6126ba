package io.backfill.channel;

import java.util.Optional;

/**
 * Receiving end of a stage connection.
 */
public interface Inlet<T> {
    /**
     * Block until a unit is available and take it, acknowledging it to the sender.
     * Returns empty once the sender completed and every unit was taken.
     */
    Optional<T> receive() throws Exception;
}
