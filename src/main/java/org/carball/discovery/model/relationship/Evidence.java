package org.carball.discovery.model.relationship;

public record Evidence(String type, Object value, double confidence, String description) {}
