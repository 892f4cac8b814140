package org.ashby.plot.generate;

import java.util.concurrent.atomic.AtomicBoolean;

import org.ashby.plot.api.GenerationCancelledException;

/**
 * Cancellation flag shared by all generations of one batch.
 * <p>
 * Generations only look at the flag at checkpoints between data source calls; a query that is
 * already running is never interrupted.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** A token that is never cancelled, for single plot runs. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Checkpoint.
     *
     * @param plotName name of the plot being generated
     * @throws GenerationCancelledException if the token was cancelled
     */
    public void throwIfCancelled(String plotName) throws GenerationCancelledException {
        if (cancelled.get()) {
            throw new GenerationCancelledException(plotName);
        }
    }
}
