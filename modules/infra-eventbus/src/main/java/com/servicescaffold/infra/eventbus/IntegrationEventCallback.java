package com.servicescaffold.infra.eventbus;

import com.servicescaffold.core.events.IntegrationEvent;
import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface IntegrationEventCallback<T extends IntegrationEvent> {
  CompletionStage<?> onEvent(T event) throws Exception;
}
