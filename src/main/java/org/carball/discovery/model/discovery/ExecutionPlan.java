package org.carball.discovery.model.discovery;

import java.time.Duration;
import java.util.List;

public record ExecutionPlan(List<ExecutionStep> steps, Duration totalTime, int parallelism) {}
