package org.carball.discovery.client;

public record PerformanceInfo(long inspectedCount, long wallClockTimeMillis) {}
