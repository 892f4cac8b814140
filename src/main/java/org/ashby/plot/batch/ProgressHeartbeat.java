package org.ashby.plot.batch;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs "still generating" at a fixed interval while one plot is being generated.
 * <p>
 * Bound to a try-with-resources block around the generation, so the timer stops on every exit
 * path.
 */
public class ProgressHeartbeat implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressHeartbeat.class);

    private final String plotName;
    private final long startNanos = System.nanoTime();
    private final AtomicInteger beats = new AtomicInteger();
    private final ScheduledExecutorService timer;

    public ProgressHeartbeat(String plotName, Duration interval) {
        this.plotName = plotName;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-" + plotName);
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, interval.toMillis());
        timer.scheduleAtFixedRate(this::beat, millis, millis, TimeUnit.MILLISECONDS);
    }

    private void beat() {
        beats.incrementAndGet();
        long elapsed = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - startNanos);
        log.info("Still generating plot '{}' ({}s elapsed)", plotName, elapsed);
    }

    public int getBeatCount() {
        return beats.get();
    }

    public boolean isStopped() {
        return timer.isShutdown();
    }

    @Override
    public void close() {
        timer.shutdownNow();
    }
}
