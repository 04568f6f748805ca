package org.carball.discovery.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.config.DiscoveryConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sends NRQL to the account query endpoint over HTTPS and parses the JSON response.
 */
@Slf4j
public class NrdbHttpClient implements QueryClient {

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String apiKey;
    private final String accountId;
    private final Duration timeout;

    public NrdbHttpClient(DiscoveryConfig config) {
        config.validateCredentials();
        this.apiKey = config.getApiKey();
        this.accountId = config.getAccountId();
        this.timeout = config.getQueryTimeout();
        this.endpoint = URI.create(stripTrailingSlash(config.getBaseUrl())
                + "/v1/accounts/" + accountId + "/query");
        this.objectMapper = createObjectMapper();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        log.info("NRDB client targeting account {} at {}", accountId, endpoint);
    }

    @Override
    public QueryResult query(String nrql) throws QueryException {
        log.debug("Executing NRQL: {}", nrql);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(endpoint)
                    .timeout(timeout)
                    .header("Api-Key", apiKey)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(Map.of("nrql", nrql))))
                    .build();
        } catch (JsonProcessingException e) {
            throw new PermanentQueryException("Could not encode query: " + nrql, e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientQueryException("NRDB query timeout after " + timeout, e);
        } catch (IOException e) {
            throw new TransientQueryException("NRDB connection failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryCancelledException("Interrupted while waiting for NRDB", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw ErrorClassifier.forStatus(response.statusCode(), abbreviate(response.body()));
        }
        return parseResponse(objectMapper, response.body());
    }

    @Override
    public AccountInfo getAccountInfo() {
        return new AccountInfo(accountId, 30, 2000);
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Parses {@code results}, {@code metadata} and {@code performanceInfo} from a response body.
     */
    static QueryResult parseResponse(ObjectMapper mapper, String body) throws QueryException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PermanentQueryException("Malformed NRDB response", e);
        }
        if (root == null || !root.isObject()) {
            throw new PermanentQueryException("Malformed NRDB response: expected a JSON object");
        }
        if (root.hasNonNull("error")) {
            throw new PermanentQueryException("NRDB rejected query: " + root.get("error").asText());
        }

        List<Map<String, Object>> results = new ArrayList<>();
        JsonNode resultsNode = root.get("results");
        if (resultsNode != null && resultsNode.isArray()) {
            for (JsonNode row : resultsNode) {
                results.add(mapper.convertValue(row, ROW_TYPE));
            }
        }

        QueryMetadata metadata = QueryMetadata.empty();
        JsonNode metadataNode = root.get("metadata");
        if (metadataNode != null && metadataNode.isObject()) {
            List<Object> contents = new ArrayList<>();
            JsonNode contentsNode = metadataNode.get("contents");
            if (contentsNode != null && contentsNode.isArray()) {
                contentsNode.forEach(node -> contents.add(mapper.convertValue(node, Object.class)));
            }
            metadata = new QueryMetadata(textList(metadataNode.get("eventTypes")),
                    textList(metadataNode.get("messages")), contents);
        }

        PerformanceInfo performanceInfo = null;
        JsonNode performanceNode = root.get("performanceInfo");
        if (performanceNode != null && performanceNode.isObject()) {
            performanceInfo = new PerformanceInfo(
                    performanceNode.path("inspectedCount").asLong(),
                    performanceNode.path("wallClockTime").asLong());
        }

        return new QueryResult(results, metadata, performanceInfo);
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
