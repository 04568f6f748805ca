package org.carball.discovery.client;

import org.carball.discovery.model.discovery.DiscoveryFilter;
import org.carball.discovery.model.sample.TimeRange;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Executes NRQL against a single account. Credentials and account scoping are fixed at construction.
 */
public interface QueryClient {

    QueryResult query(String nrql) throws QueryException;

    /**
     * Lists event types, optionally restricted by a wildcard pattern and a minimum record count.
     */
    default List<String> getEventTypes(EventTypeFilter filter) throws QueryException {
        String nrql = "SHOW EVENT TYPES";
        if (filter.lookback() != null) {
            nrql += " SINCE " + Math.max(1, filter.lookback().toMinutes()) + " minutes ago";
        }

        QueryResult result = query(nrql);
        List<String> eventTypes = new ArrayList<>();
        for (Map<String, Object> row : result.results()) {
            Object single = row.get("eventType");
            if (single != null) {
                eventTypes.add(single.toString());
            }
            // NRDB returns all types as one list in the first row
            if (row.get("eventTypes") instanceof Collection<?> many) {
                many.forEach(type -> eventTypes.add(type.toString()));
            }
        }

        List<String> filtered = new ArrayList<>();
        for (String eventType : eventTypes) {
            if (filter.pattern() != null && !DiscoveryFilter.matchesPattern(eventType, filter.pattern())) {
                continue;
            }
            if (filter.minRecordCount() > 0 && countRecords(eventType, null) < filter.minRecordCount()) {
                continue;
            }
            filtered.add(eventType);
        }
        return filtered;
    }

    /**
     * Counts records of one event type, over the given range or the store's default window when null.
     */
    default long countRecords(String eventType, TimeRange timeRange) throws QueryException {
        String nrql = "SELECT count(*) FROM " + quote(eventType);
        if (timeRange != null) {
            nrql += " " + timeRange.toNrql();
        }
        return query(nrql).firstLong("count");
    }

    /**
     * Backtick-quotes an event type or attribute name so dots, dashes and keywords survive in NRQL.
     */
    static String quote(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("NRQL identifier must not be blank");
        }
        if (identifier.indexOf('`') >= 0) {
            throw new IllegalArgumentException("NRQL identifier must not contain a backtick: " + identifier);
        }
        return "`" + identifier + "`";
    }

    default AccountInfo getAccountInfo() {
        return new AccountInfo(null, 30, 2000);
    }
}
