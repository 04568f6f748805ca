package org.carball.discovery.model.schema;

public record ValueFrequency(String value, long count, double frequency) {}
