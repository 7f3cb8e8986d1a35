package pro.kaleert.schedimport.service.parser;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import pro.kaleert.schedimport.model.ScheduleEntry;
import pro.kaleert.schedimport.util.DayExpander;
import pro.kaleert.schedimport.util.TextNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Meetings of one course section, collected row by row and flattened into
 * one {@link ScheduleEntry} per weekday.
 */
@Slf4j
@Getter
public class ScheduleBlock {

    private final String code;
    private final String section;
    private final String title;
    private final int creditHour;
    private final List<ScheduleRow> rows = new ArrayList<>();

    public ScheduleBlock(String code, String section, String title, int creditHour) {
        this.code = TextNormalizer.collapseWhitespace(code);
        this.section = section;
        this.title = title;
        this.creditHour = creditHour;
    }

    public void addRow(ScheduleRow row) {
        rows.add(row);
    }

    public List<ScheduleRow> getRows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * A row without a lecturer takes the last lecturer named above it in this block.
     * Rows without a start time or a day are dropped.
     */
    public List<ScheduleEntry> flatten() {
        List<ScheduleEntry> entries = new ArrayList<>();
        String primaryLecturer = "";

        for (ScheduleRow row : rows) {
            String lecturer = row.lecturer() == null ? "" : row.lecturer().trim();
            if (!lecturer.isEmpty()) primaryLecturer = lecturer;

            List<String> days = DayExpander.expand(row.dayToken());
            if (!row.time().isParsed() || days.isEmpty()) {
                log.debug("Skipping {} {} row: day='{}', time={}", code, section, row.dayToken(), row.time());
                continue;
            }

            ScheduleEntry template = ScheduleEntry.builder()
                    .code(code)
                    .section(section)
                    .title(title)
                    .creditHour(creditHour)
                    .startTime(row.time().start())
                    .endTime(row.time().end())
                    .venue(TextNormalizer.cleanVenue(row.venue()))
                    .lecturer(lecturer.isEmpty() ? primaryLecturer : lecturer)
                    .build();

            for (String day : days) {
                entries.add(template.toBuilder().day(day).build());
            }
        }
        return entries;
    }
}
