package pro.kaleert.schedimport.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import pro.kaleert.schedimport.model.ScheduleBundle;
import pro.kaleert.schedimport.model.ScheduleEntry;
import pro.kaleert.schedimport.service.parser.HtmlScheduleExtractor;
import pro.kaleert.schedimport.service.parser.TableNotFoundException;
import pro.kaleert.schedimport.service.parser.TextScheduleExtractor;

import java.util.List;

/**
 * Entry point of the ingestion pipeline: extract, deduplicate, collect venues.
 * <p>
 * An empty bundle means the input was readable but held no meetings;
 * {@link TableNotFoundException} means the HTML had no schedule table at all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleImportService {

    private final HtmlScheduleExtractor htmlExtractor;
    private final TextScheduleExtractor textExtractor;
    private final ScheduleNormalizer normalizer;

    public ScheduleBundle importFrom(InputMode mode, String input) {
        return switch (mode) {
            case HTML -> importHtml(input);
            case TEXT -> importText(input);
        };
    }

    public ScheduleBundle importHtml(String html) {
        ScheduleBundle bundle = finish(htmlExtractor.extract(html));
        if (bundle.isEmpty()) {
            log.warn("No courses found in HTML. The page structure may have changed.");
        }
        return bundle;
    }

    public ScheduleBundle importText(String text) {
        ScheduleBundle bundle = finish(textExtractor.extract(text));
        if (bundle.isEmpty()) {
            log.warn("Could not parse any schedule data from text. Check the format.");
        }
        return bundle;
    }

    private ScheduleBundle finish(List<ScheduleEntry> parsed) {
        ScheduleBundle bundle = normalizer.normalize(parsed);
        int dropped = parsed.size() - bundle.entries().size();
        if (dropped > 0) {
            log.debug("Dropped {} duplicate entries", dropped);
        }
        log.info("Parsed {} schedule entries from {} venues", bundle.entries().size(), bundle.venues().size());
        return bundle;
    }
}
