package pro.kaleert.schedimport.service.parser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;
import pro.kaleert.schedimport.config.ImporterProperties;
import pro.kaleert.schedimport.model.ScheduleEntry;
import pro.kaleert.schedimport.util.TextNormalizer;
import pro.kaleert.schedimport.util.TimeNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the schedule table of a registration page.
 * <p>
 * Each course row has five cells: code, section, title, credit hour and a
 * nested table with one row per meeting (day, time, venue, lecturer).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HtmlScheduleExtractor {

    private static final int COURSE_CELLS = 5;
    private static final int MEETING_CELLS = 4;

    private final ImporterProperties properties;

    public List<ScheduleEntry> extract(String html) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        Element scheduleTable = findScheduleTable(doc);

        List<ScheduleEntry> entries = new ArrayList<>();
        Elements rows = scheduleTable.select("tr");

        for (int i = properties.getHtml().getHeaderRows(); i < rows.size(); i++) {
            ScheduleBlock block = readCourseRow(rows.get(i));
            if (block != null) {
                entries.addAll(block.flatten());
            }
        }

        log.debug("HTML schedule table: {} rows, {} entries", rows.size(), entries.size());
        return entries;
    }

    private Element findScheduleTable(Document doc) {
        for (Element table : doc.select("table")) {
            String text = table.text();
            if (text.contains("Code") && text.contains("Sect")) {
                return table;
            }
        }
        throw new TableNotFoundException();
    }

    private ScheduleBlock readCourseRow(Element row) {
        Elements cells = row.select("td");
        if (cells.size() < COURSE_CELLS) return null;

        String code = cells.get(0).text().trim();
        if (!TextNormalizer.isCourseCode(code)) {
            log.debug("Skipping row with code '{}'", code);
            return null;
        }

        ScheduleBlock block = new ScheduleBlock(
                code,
                cells.get(1).text().trim(),
                cells.get(2).text().trim(),
                TextNormalizer.parseCreditHour(cells.get(3).text(), properties.getDefaultCreditHour()));

        Element nestedTable = cells.get(4).selectFirst("table");
        if (nestedTable == null) return block;

        for (Element meetingRow : nestedTable.select("tr")) {
            Elements meetingCells = meetingRow.select("td");
            if (meetingCells.size() < MEETING_CELLS) continue;

            block.addRow(new ScheduleRow(
                    meetingCells.get(0).text().trim(),
                    TimeNormalizer.normalize(meetingCells.get(1).text().trim()),
                    meetingCells.get(2).text().trim(),
                    meetingCells.get(3).text().trim()));
        }
        return block;
    }
}
