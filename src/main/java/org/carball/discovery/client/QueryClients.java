package org.carball.discovery.client;

import org.carball.discovery.config.DiscoveryConfig;

/**
 * Builds the client stack the engine talks to.
 */
public final class QueryClients {

    private QueryClients() {
    }

    /**
     * HTTP transport wrapped with rate limiting, retries and a circuit breaker.
     */
    public static ResilientQueryClient create(DiscoveryConfig config) {
        return ResilientQueryClient.wrap(new NrdbHttpClient(config), config);
    }

    /**
     * Any transport (for example {@link MockQueryClient}) behind the same resilience layer.
     */
    public static ResilientQueryClient resilient(QueryClient transport, DiscoveryConfig config) {
        return ResilientQueryClient.wrap(transport, config);
    }
}
