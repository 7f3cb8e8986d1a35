package pro.kaleert.schedimport.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One weekly meeting of a course section on a single weekday.
 */
@Value
@Builder(toBuilder = true)
public class ScheduleEntry {
    String code;
    String section;
    String title;
    int creditHour;
    String day;
    String startTime;
    String endTime;
    String venue;
    String lecturer;

    public List<String> getDays() {
        return List.of(day);
    }

    /** Course code without whitespace, e.g. {@code CSC4303}. */
    public String getCompactCode() {
        return code == null ? null : code.replaceAll("\\s+", "");
    }
}
