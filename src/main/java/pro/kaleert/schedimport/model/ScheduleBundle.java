package pro.kaleert.schedimport.model;

import java.util.List;
import java.util.stream.Collectors;

public record ScheduleBundle(
    List<ScheduleEntry> entries,
    List<String> venues
) {
    public ScheduleBundle {
        entries = List.copyOf(entries);
        venues = List.copyOf(venues);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<ScheduleEntry> entriesAt(String venue) {
        return entries.stream()
                .filter(e -> e.getVenue().equals(venue))
                .collect(Collectors.toList());
    }
}
