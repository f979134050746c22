package com.servicescaffold.core.jobs.processor;

import java.time.Duration;
import java.util.UUID;

public record JobResult(UUID eventId, String eventType, int attempts, Duration elapsed) {}
