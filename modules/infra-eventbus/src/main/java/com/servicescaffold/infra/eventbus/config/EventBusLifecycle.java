package com.servicescaffold.infra.eventbus.config;

import com.servicescaffold.infra.eventbus.IntegrationEventBus;
import java.util.Objects;
import org.springframework.context.SmartLifecycle;

/**
 * Declares the exchanges before subscribers start and closes the bus after they stop.
 */
public class EventBusLifecycle implements SmartLifecycle {
  /** Runs ahead of every default-phase lifecycle bean, so it stops last. */
  public static final int PHASE = Integer.MIN_VALUE + 1000;

  private final IntegrationEventBus eventBus;
  private volatile boolean running;

  public EventBusLifecycle(IntegrationEventBus eventBus) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
  }

  @Override
  public void start() {
    eventBus.initialize();
    running = true;
  }

  @Override
  public void stop() {
    running = false;
    eventBus.close();
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
