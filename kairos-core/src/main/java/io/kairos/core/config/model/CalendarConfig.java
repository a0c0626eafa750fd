package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CalendarConfig(
    boolean enabled,
    String defaultCalendarId,
    String defaultTimezone,
    String command,
    int commandTimeoutSeconds,
    Map<String, ProductCalendar> products
) {

    public CalendarConfig {
        products = products == null ? Map.of() : Map.copyOf(products);
    }

    public static CalendarConfig defaults() {
        return new CalendarConfig(true, "primary", "UTC", "gog", 30, Map.of());
    }

    public Map<String, String> productCalendarIds() {
        Map<String, String> ids = new LinkedHashMap<>();
        products.forEach((productId, product) -> {
            if (product != null && product.calendarId() != null && !product.calendarId().isBlank()) {
                ids.put(productId, product.calendarId());
            }
        });
        return ids;
    }

    public CalendarConfig withCommand(String value) {
        return new CalendarConfig(enabled, defaultCalendarId, defaultTimezone, value, commandTimeoutSeconds, products);
    }
}
