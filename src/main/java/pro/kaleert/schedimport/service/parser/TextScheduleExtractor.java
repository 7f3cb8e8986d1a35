package pro.kaleert.schedimport.service.parser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import pro.kaleert.schedimport.config.ImporterProperties;
import pro.kaleert.schedimport.model.ScheduleEntry;
import pro.kaleert.schedimport.util.DayExpander;
import pro.kaleert.schedimport.util.TextNormalizer;
import pro.kaleert.schedimport.util.TimeNormalizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses a schedule copied out of the registration page as tab-separated text.
 * <p>
 * Course header lines ({@code code, section, title..., credit}) open a block;
 * the meeting lines under them ({@code day, ..., time, venue, lecturer}) are
 * buffered until the next header or the end of input.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TextScheduleExtractor {

    private static final Pattern TAB_SPLIT = Pattern.compile("\\t+");
    private static final Pattern SECTION_PATTERN = Pattern.compile("^\\d+$");
    private static final Pattern MERIDIEM_PATTERN = Pattern.compile("AM|PM", Pattern.CASE_INSENSITIVE);
    private static final List<String> NOISE_MARKERS = List.of("PREV", "NEXT", "INTERNATIONAL");

    private final ImporterProperties properties;

    public List<ScheduleEntry> extract(String text) {
        if (text == null) return Collections.emptyList();

        ScanState state = new ScanState();
        for (String rawLine : text.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty() || isNoise(line)) continue;
            scanLine(state, line);
        }
        flush(state);

        log.debug("Text schedule: {} entries", state.entries.size());
        return state.entries;
    }

    private void scanLine(ScanState state, String line) {
        List<String> parts = Arrays.stream(TAB_SPLIT.split(line))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.toList());

        if (isCourseHeader(parts)) {
            flush(state);
            state.current = new ScheduleBlock(
                    parts.get(0),
                    parts.get(1),
                    String.join(" ", parts.subList(2, parts.size() - 1)),
                    TextNormalizer.parseCreditHour(parts.get(parts.size() - 1), properties.getDefaultCreditHour()));
            return;
        }

        if (state.current == null || parts.size() < 2 || !DayExpander.isDayToken(parts.get(0))) {
            log.debug("Ignoring line: {}", line);
            return;
        }

        int timeIdx = findTimeField(parts);
        if (timeIdx <= 0) return;

        state.current.addRow(new ScheduleRow(
                parts.get(0),
                TimeNormalizer.normalize(parts.get(timeIdx)),
                fieldOrEmpty(parts, timeIdx + 1),
                fieldOrEmpty(parts, timeIdx + 2)));
    }

    /** Emits the open block, if any, and closes it. */
    void flush(ScanState state) {
        if (state.current != null) {
            state.entries.addAll(state.current.flatten());
            state.current = null;
        }
    }

    private boolean isNoise(String line) {
        if (line.startsWith("Code") || line.startsWith("Day")) return true;
        return NOISE_MARKERS.stream().anyMatch(line::contains);
    }

    private boolean isCourseHeader(List<String> parts) {
        return parts.size() >= 4
                && TextNormalizer.isCourseCode(parts.get(0))
                && SECTION_PATTERN.matcher(parts.get(1)).matches();
    }

    private int findTimeField(List<String> parts) {
        for (int i = 0; i < parts.size(); i++) {
            if (MERIDIEM_PATTERN.matcher(parts.get(i)).find()) return i;
        }
        return -1;
    }

    private String fieldOrEmpty(List<String> parts, int index) {
        return index < parts.size() ? parts.get(index) : "";
    }

    static class ScanState {
        final List<ScheduleEntry> entries = new ArrayList<>();
        ScheduleBlock current;
    }
}
