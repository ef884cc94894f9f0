package ch.so.arp.rag.hybrid.learning;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

/**
 * Runs {@link TemporalDecayManager#sweep} at a fixed rate. The task is started
 * and cancelled with the application context and can be stopped on its own.
 */
public class DecayScheduler implements SmartLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(DecayScheduler.class);

    private final TemporalDecayManager decayManager;
    private final TaskScheduler taskScheduler;
    private final Duration interval;
    private final Clock clock;
    private ScheduledFuture<?> scheduledSweep;

    public DecayScheduler(TemporalDecayManager decayManager, TaskScheduler taskScheduler, Duration interval,
            Clock clock) {
        this.decayManager = Objects.requireNonNull(decayManager, "decayManager");
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized void start() {
        if (scheduledSweep != null) {
            return;
        }
        scheduledSweep = taskScheduler.scheduleAtFixedRate(this::runSweep, clock.instant().plus(interval), interval);
        LOGGER.info("Scheduled decay sweep every {}", interval);
    }

    @Override
    public synchronized void stop() {
        if (scheduledSweep != null) {
            scheduledSweep.cancel(false);
            scheduledSweep = null;
            LOGGER.info("Cancelled decay sweep");
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return scheduledSweep != null;
    }

    void runSweep() {
        try {
            decayManager.sweep(clock.instant());
        } catch (RuntimeException ex) {
            LOGGER.error("Decay sweep failed, retrying at the next interval", ex);
        }
    }
}
