package com.github.spud.worksession.domain.session;

import com.github.spud.worksession.application.config.SessionTrackingProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Periodically closes sessions that have been idle longer than the configured threshold.
 * <p>
 * The transition itself is one conditional bulk update in the store, so a sweep racing an
 * explicit end leaves each session closed exactly once. After {@link #stop()} returns no further
 * sweep writes are issued.
 */
@Slf4j
@Component
public class SessionTimeoutSweeper implements SmartLifecycle {

  private final SessionStore sessionStore;
  private final SessionTracker tracker;
  private final SessionTrackingProperties properties;
  private final TaskScheduler taskScheduler;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final Object tickLock = new Object();

  private volatile boolean running;
  private ScheduledFuture<?> scheduled;
  private long quietTicks;

  public SessionTimeoutSweeper(
    SessionStore sessionStore,
    SessionTracker tracker,
    SessionTrackingProperties properties,
    @Qualifier("sessionSweepScheduler") TaskScheduler taskScheduler,
    MeterRegistry meterRegistry,
    Clock clock) {
    this.sessionStore = sessionStore;
    this.tracker = tracker;
    this.properties = properties;
    this.taskScheduler = taskScheduler;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    SessionTrackingProperties.TimeoutConfig timeout = properties.getTimeout();
    if (!timeout.isEnabled()) {
      log.info("Session timeout sweeper disabled");
      return;
    }
    Duration interval = timeout.getSweepInterval();
    if (interval.isZero() || interval.isNegative()) {
      log.warn("Session timeout sweeper not started: invalid sweep interval {}", interval);
      return;
    }
    running = true;
    scheduled = taskScheduler.scheduleWithFixedDelay(this::safeSweep, interval);
    log.info("Session timeout sweeper started: idleThreshold={}, interval={}",
      timeout.getIdleThreshold(), interval);
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    if (scheduled != null) {
      scheduled.cancel(false);
      scheduled = null;
    }
    // wait out a sweep that is already past its running check
    synchronized (tickLock) {
      log.info("Session timeout sweeper stopped");
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /**
   * Run one sweep now, regardless of the schedule.
   *
   * @return ids of the sessions this sweep timed out
   */
  public List<UUID> sweepOnce() {
    synchronized (tickLock) {
      return sweep();
    }
  }

  private void safeSweep() {
    synchronized (tickLock) {
      if (!running) {
        return;
      }
      String result = "quiet";
      try {
        if (!sweep().isEmpty()) {
          result = "timed_out";
        }
      } catch (Exception e) {
        result = "error";
        log.error("Session timeout sweep failed; retrying next interval", e);
      } finally {
        meterRegistry.counter("session.sweep.ticks", "result", result).increment();
      }
    }
  }

  private List<UUID> sweep() {
    OffsetDateTime now = OffsetDateTime.now(clock);
    Duration threshold = properties.getTimeout().getIdleThreshold();
    tracker.retryPendingFlushes();
    List<UUID> timedOut = sessionStore.timeoutIdleSessions(now.minus(threshold), now);

    if (timedOut.isEmpty()) {
      quietTicks++;
      int every = Math.max(1, properties.getTimeout().getQuietLogEvery());
      if (quietTicks % every == 0) {
        log.info("Session timeout sweeper alive: no idle sessions over {} in the last {} sweeps",
          threshold, quietTicks);
      } else {
        log.debug("Session timeout sweep: nothing to time out");
      }
      return timedOut;
    }

    quietTicks = 0;
    meterRegistry.counter("session.sweep.timed_out").increment(timedOut.size());
    log.info("Timed out {} idle session(s) after {} of inactivity: {}", timedOut.size(),
      threshold, timedOut);
    tracker.onSessionsTimedOut(timedOut);
    return timedOut;
  }
}
