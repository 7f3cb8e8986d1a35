package pro.kaleert.schedimport.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TextNormalizer {

    private static final Pattern COURSE_CODE_PATTERN = Pattern.compile("^[A-Z]{2,4}\\s?\\d{4}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_INT_PATTERN = Pattern.compile("^\\s*(\\d+)");
    private static final String PLACEHOLDER = "-";

    public static String collapseWhitespace(String input) {
        if (input == null) return "";
        return input.replace('\u00A0', ' ').trim().replaceAll("\\s+", " ");
    }

    public static boolean isCourseCode(String input) {
        return input != null && COURSE_CODE_PATTERN.matcher(collapseWhitespace(input)).matches();
    }

    public static String cleanVenue(String venue) {
        if (venue == null) return "";
        String v = venue.trim();
        return v.equals(PLACEHOLDER) ? "" : v;
    }

    /** Leading integer of the value; zero, missing or unparseable gives the fallback. */
    public static int parseCreditHour(String input, int fallback) {
        if (input == null) return fallback;
        Matcher m = LEADING_INT_PATTERN.matcher(input);
        if (!m.find()) return fallback;
        try {
            int value = Integer.parseInt(m.group(1));
            return value == 0 ? fallback : value;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
