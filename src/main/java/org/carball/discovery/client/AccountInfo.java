package org.carball.discovery.client;

public record AccountInfo(String accountId, int dataRetentionDays, int maxResultsPerQuery) {}
