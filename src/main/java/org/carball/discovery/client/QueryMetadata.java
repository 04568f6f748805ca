package org.carball.discovery.client;

import java.util.List;

public record QueryMetadata(List<String> eventTypes, List<String> messages, List<Object> contents) {

    public static QueryMetadata empty() {
        return new QueryMetadata(List.of(), List.of(), List.of());
    }
}
