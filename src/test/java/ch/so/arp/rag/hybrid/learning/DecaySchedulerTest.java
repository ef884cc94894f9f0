package ch.so.arp.rag.hybrid.learning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

class DecaySchedulerTest {

    private static final Instant NOW = Instant.parse("2026-01-05T08:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final TemporalDecayManager decayManager = mock(TemporalDecayManager.class);
    private final TaskScheduler taskScheduler = mock(TaskScheduler.class);
    private final ScheduledFuture<?> future = mock(ScheduledFuture.class);

    @Test
    void schedulesAndCancelsTheSweep() {
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class),
                any(Duration.class));
        DecayScheduler scheduler = new DecayScheduler(decayManager, taskScheduler, Duration.ofDays(1), clock);

        scheduler.start();

        assertThat(scheduler.isRunning()).isTrue();
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(NOW.plus(Duration.ofDays(1))),
                eq(Duration.ofDays(1)));

        scheduler.stop();

        assertThat(scheduler.isRunning()).isFalse();
        verify(future).cancel(false);
    }

    @Test
    void failedSweepDoesNotEscape() {
        when(decayManager.sweep(NOW)).thenThrow(new IllegalStateException("database down"));
        DecayScheduler scheduler = new DecayScheduler(decayManager, taskScheduler, Duration.ofDays(1), clock);

        assertThatCode(scheduler::runSweep).doesNotThrowAnyException();
        verify(decayManager).sweep(NOW);
    }
}
