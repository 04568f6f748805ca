package org.carball.discovery.model.schema;

import lombok.Getter;

@Getter
public enum SemanticType {
    IDENTIFIER("identifier"),
    EMAIL("email"),
    URL("url"),
    IP_ADDRESS("ip_address"),
    USER_AGENT("user_agent"),
    CURRENCY("currency"),
    COUNTRY("country"),
    LAT_LONG("lat_long"),
    DURATION("duration"),
    PERCENTAGE("percentage"),
    FILE_PATH("file_path"),
    JSON_OBJECT("json_object"),
    TIMESTAMP("timestamp"),
    CUSTOM("custom");

    private final String value;

    SemanticType(String value) {
        this.value = value;
    }
}
