package pro.kaleert.schedimport.util;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps registration-page day abbreviations ({@code M}, {@code TH}, {@code M-W-F}, ...)
 * to full weekday names.
 */
public class DayExpander {

    private static final Map<String, List<String>> DAYS = Map.ofEntries(
            Map.entry("M-W", List.of("Monday", "Wednesday")),
            Map.entry("T-TH", List.of("Tuesday", "Thursday")),
            Map.entry("M-W-F", List.of("Monday", "Wednesday", "Friday")),
            Map.entry("MON", List.of("Monday")),
            Map.entry("M", List.of("Monday")),
            Map.entry("TUE", List.of("Tuesday")),
            Map.entry("T", List.of("Tuesday")),
            Map.entry("WED", List.of("Wednesday")),
            Map.entry("W", List.of("Wednesday")),
            Map.entry("THUR", List.of("Thursday")),
            Map.entry("THU", List.of("Thursday")),
            Map.entry("TH", List.of("Thursday")),
            Map.entry("FRI", List.of("Friday")),
            Map.entry("F", List.of("Friday")),
            Map.entry("SAT", List.of("Saturday")),
            Map.entry("SUN", List.of("Sunday"))
    );

    /**
     * Unknown tokens are not rejected: they come back uppercased as a single "day".
     */
    public static List<String> expand(String token) {
        if (token == null || token.isBlank()) return Collections.emptyList();
        String d = token.trim().toUpperCase(Locale.ROOT);
        return DAYS.getOrDefault(d, List.of(d));
    }

    public static boolean isDayToken(String token) {
        if (token == null) return false;
        return DAYS.containsKey(token.trim().toUpperCase(Locale.ROOT));
    }
}
