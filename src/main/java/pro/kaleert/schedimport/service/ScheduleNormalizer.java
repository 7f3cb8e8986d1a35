package pro.kaleert.schedimport.service;

import org.springframework.stereotype.Service;
import pro.kaleert.schedimport.model.ScheduleBundle;
import pro.kaleert.schedimport.model.ScheduleEntry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class ScheduleNormalizer {

    public ScheduleBundle normalize(List<ScheduleEntry> entries) {
        List<ScheduleEntry> unique = deduplicate(entries);
        return new ScheduleBundle(unique, venues(unique));
    }

    /**
     * Keeps the first entry for each (code, section, day, start time).
     */
    public List<ScheduleEntry> deduplicate(List<ScheduleEntry> entries) {
        Set<MeetingKey> seen = new HashSet<>();
        List<ScheduleEntry> result = new ArrayList<>();
        for (ScheduleEntry entry : entries) {
            if (seen.add(MeetingKey.of(entry))) {
                result.add(entry);
            }
        }
        return result;
    }

    public List<String> venues(List<ScheduleEntry> entries) {
        return entries.stream()
                .map(ScheduleEntry::getVenue)
                .filter(Objects::nonNull)
                .filter(v -> !v.isEmpty())
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    private record MeetingKey(String code, String section, String day, String startTime) {
        static MeetingKey of(ScheduleEntry e) {
            return new MeetingKey(e.getCode(), e.getSection(), e.getDay(), e.getStartTime());
        }
    }
}
