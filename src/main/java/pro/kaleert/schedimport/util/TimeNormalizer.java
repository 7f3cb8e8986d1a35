package pro.kaleert.schedimport.util;

import pro.kaleert.schedimport.model.MeetingTime;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses registration-page time ranges such as {@code "8.30 - 9.50 AM"}.
 * <p>
 * The AM/PM marker is written once, after the end time. The start takes the
 * same marker, except when the marker is PM and the start is numerically
 * larger than the end: {@code "11.00 - 1.30 PM"} runs from 11:00 AM to 1:30 PM.
 */
public class TimeNormalizer {

    private static final Pattern RANGE_PATTERN =
            Pattern.compile("(\\d+\\.?\\d*)\\s*-\\s*(\\d+\\.?\\d*)\\s*(AM|PM)", Pattern.CASE_INSENSITIVE);

    private static final String PLACEHOLDER = "-";

    public static MeetingTime normalize(String token) {
        if (token == null || token.isBlank() || token.trim().equals(PLACEHOLDER)) {
            return MeetingTime.UNPARSEABLE;
        }

        Matcher m = RANGE_PATTERN.matcher(token);
        if (!m.find()) {
            return MeetingTime.UNPARSEABLE;
        }

        String startRaw = m.group(1);
        String endRaw = m.group(2);
        boolean isPm = m.group(3).toUpperCase(Locale.ROOT).equals("PM");

        boolean startIsPm = isPm;
        if (isPm && Double.parseDouble(startRaw) > Double.parseDouble(endRaw)) {
            startIsPm = false;
        }

        try {
            return new MeetingTime(to24Hour(startRaw, startIsPm), to24Hour(endRaw, isPm));
        } catch (NumberFormatException e) {
            return MeetingTime.UNPARSEABLE;
        }
    }

    // "8.30" is hour 8, minute 30; the dot is not a decimal point
    private static String to24Hour(String value, boolean pm) {
        String[] parts = value.split("\\.", -1);
        int hours = Integer.parseInt(parts[0]);
        int minutes = parts.length > 1 && !parts[1].isEmpty() ? Integer.parseInt(parts[1]) : 0;

        if (pm && hours != 12) hours += 12;
        if (!pm && hours == 12) hours = 0;

        return String.format("%02d:%02d", hours, minutes);
    }
}
