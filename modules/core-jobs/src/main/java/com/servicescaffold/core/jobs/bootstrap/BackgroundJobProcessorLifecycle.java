package com.servicescaffold.core.jobs.bootstrap;

import com.servicescaffold.core.jobs.processor.BackgroundJobProcessor;
import com.servicescaffold.infra.eventbus.config.EventBusLifecycle;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Drains the job processor on shutdown. Stops after the subscribers and before the event bus
 * closes, so jobs finishing inside the grace period can still publish their dead letters.
 */
public class BackgroundJobProcessorLifecycle implements SmartLifecycle {
  public static final int PHASE = EventBusLifecycle.PHASE + 1000;

  private static final Logger log = LoggerFactory.getLogger(BackgroundJobProcessorLifecycle.class);

  private final BackgroundJobProcessor processor;
  private volatile boolean running;

  public BackgroundJobProcessorLifecycle(BackgroundJobProcessor processor) {
    this.processor = Objects.requireNonNull(processor, "processor must not be null");
  }

  @Override
  public void start() {
    running = true;
  }

  @Override
  public void stop() {
    running = false;
    log.info("Draining background jobs before the event bus closes");
    processor.close();
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return PHASE;
  }
}
