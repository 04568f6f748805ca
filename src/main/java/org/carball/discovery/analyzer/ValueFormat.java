package org.carball.discovery.analyzer;

import lombok.Getter;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Recognizable string formats, checked in declaration order.
 */
@Getter
public enum ValueFormat {
    EMAIL("email", "^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$"),
    URL("url", "^(https?|ftp)://[^\\s/$.?#][^\\s]*$"),
    IP_ADDRESS("ip_address",
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$"
                    + "|^([0-9A-Fa-f]{1,4}:){7}[0-9A-Fa-f]{1,4}$"),
    UUID("uuid", "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$"),
    JSON("json", "^\\s*(\\{.*\\}|\\[.*\\])\\s*$"),
    TIMESTAMP("timestamp", null),
    PERCENTAGE("percentage", "^-?\\d+(\\.\\d+)?\\s?%$"),
    CURRENCY("currency", "^[$€£¥]\\s?-?\\d{1,3}(,?\\d{3})*(\\.\\d+)?$"),
    FILE_PATH("file_path", "^(/[^/\\s]+)+/?$|^[A-Za-z]:\\\\[^\\s]*$"),
    NUMERIC_STRING("numeric_string", "^-?\\d+(\\.\\d+)?$"),
    GENERAL("general_string", null);

    private final String value;
    private final Pattern pattern;

    ValueFormat(String value, String regex) {
        this.value = value;
        this.pattern = regex == null ? null : Pattern.compile(regex, Pattern.DOTALL);
    }

    public boolean matches(String text) {
        if (this == TIMESTAMP) {
            return isIsoTimestamp(text);
        }
        if (this == GENERAL) {
            return true;
        }
        return pattern.matcher(text).matches();
    }

    public static ValueFormat classify(String text) {
        for (ValueFormat format : values()) {
            if (format.matches(text)) {
                return format;
            }
        }
        return GENERAL;
    }

    static boolean isIsoTimestamp(String text) {
        if (text.length() < 20 || text.length() > 35 || !Character.isDigit(text.charAt(0))) {
            return false;
        }
        try {
            Instant.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
