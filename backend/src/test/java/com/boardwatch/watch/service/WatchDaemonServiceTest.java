package com.boardwatch.watch.service;

import com.boardwatch.config.WatchProperties;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WatchDaemonServiceTest {

    @Test
    void disabledDaemonSchedulesNothing() {
        ScheduledExecutorService executor = Mockito.mock(ScheduledExecutorService.class);
        WatchDaemonService daemon = new WatchDaemonService(Mockito.mock(WatchJobRunner.class), new WatchProperties(), executor);

        daemon.startIfEnabled();

        verify(executor, never()).scheduleWithFixedDelay(any(), anyLong(), anyLong(), any());
        assertThat(daemon.isRunning()).isFalse();
    }

    @Test
    void enabledDaemonPollsWithFixedDelayAndStartsOnce() {
        WatchProperties properties = new WatchProperties();
        properties.getDaemon().setEnabled(true);
        properties.getDaemon().setPollIntervalSeconds(120);
        ScheduledExecutorService executor = Mockito.mock(ScheduledExecutorService.class);
        ScheduledFuture<?> future = Mockito.mock(ScheduledFuture.class);
        doReturn(future).when(executor).scheduleWithFixedDelay(any(), eq(0L), eq(120L), eq(TimeUnit.SECONDS));
        WatchDaemonService daemon = new WatchDaemonService(Mockito.mock(WatchJobRunner.class), properties, executor);

        daemon.startIfEnabled();
        daemon.start();

        verify(executor, times(1)).scheduleWithFixedDelay(any(), eq(0L), eq(120L), eq(TimeUnit.SECONDS));
        assertThat(daemon.isRunning()).isTrue();

        daemon.stopOnShutdown();
        verify(future).cancel(false);
        assertThat(daemon.isRunning()).isFalse();
    }

    @Test
    void pollSurvivesRunnerException() {
        WatchJobRunner runner = Mockito.mock(WatchJobRunner.class);
        when(runner.run()).thenThrow(new IllegalStateException("boom"));
        WatchDaemonService daemon = new WatchDaemonService(runner, new WatchProperties(), Mockito.mock(ScheduledExecutorService.class));

        daemon.pollOnce();

        verify(runner).run();
    }
}
