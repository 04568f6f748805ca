package org.carball.discovery.model.discovery;

public enum ProfileDepth {
    BASIC,
    STANDARD,
    FULL;

    public static ProfileDepth fromName(String name) {
        for (ProfileDepth depth : values()) {
            if (depth.name().equalsIgnoreCase(name)) {
                return depth;
            }
        }
        throw new IllegalArgumentException("Unknown profile depth: " + name);
    }
}
