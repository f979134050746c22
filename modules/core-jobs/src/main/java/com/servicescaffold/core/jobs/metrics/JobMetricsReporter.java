package com.servicescaffold.core.jobs.metrics;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/** Logs a per-event-type job summary at a fixed interval. */
public class JobMetricsReporter implements SmartLifecycle {
  private static final Logger log = LoggerFactory.getLogger(JobMetricsReporter.class);

  private final JobMetrics metrics;
  private final Duration interval;
  private ScheduledExecutorService scheduler;
  private volatile boolean running;

  public JobMetricsReporter(JobMetrics metrics, Duration interval) {
    this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    this.interval = Objects.requireNonNull(interval, "interval must not be null");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactory() {
              @Override
              public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, "job-metrics-reporter");
                thread.setDaemon(true);
                return thread;
              }
            });
    long periodMs = interval.toMillis();
    scheduler.scheduleAtFixedRate(this::report, periodMs, periodMs, TimeUnit.MILLISECONDS);
    running = true;
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    scheduler.shutdownNow();
    scheduler = null;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /** Logs one line per event type seen so far. Returns the number of lines written. */
  public int report() {
    List<JobTypeStats> snapshot;
    try {
      snapshot = metrics.snapshot();
    } catch (RuntimeException ex) {
      log.warn("Failed to collect job metrics", ex);
      return 0;
    }
    for (JobTypeStats stats : snapshot) {
      log.info(
          "Job metrics event_type={} started={} completed={} failed={} retries={} deadlettered={} mean_duration_ms={}",
          stats.eventType(),
          stats.started(),
          stats.completed(),
          stats.failed(),
          stats.retries(),
          stats.deadLettered(),
          String.format(Locale.ROOT, "%.1f", stats.meanDurationMs()));
    }
    return snapshot.size();
  }
}
