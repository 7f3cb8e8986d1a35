package pro.kaleert.schedimport.command;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import pro.kaleert.schedimport.model.ScheduleBundle;
import pro.kaleert.schedimport.model.ScheduleEntry;
import pro.kaleert.schedimport.service.InputMode;
import pro.kaleert.schedimport.service.ScheduleImportService;
import pro.kaleert.schedimport.service.parser.TableNotFoundException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@code --html=<file>} or {@code --text=<file>}: parse a saved schedule and log the result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportCommand implements ApplicationRunner {

    static final String HTML_OPTION = "html";
    static final String TEXT_OPTION = "text";

    private final ScheduleImportService importService;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(HTML_OPTION)) {
            execute(InputMode.HTML, firstValue(args, HTML_OPTION));
        } else if (args.containsOption(TEXT_OPTION)) {
            execute(InputMode.TEXT, firstValue(args, TEXT_OPTION));
        } else {
            log.info("Nothing to import. Usage: --html=<page.html> or --text=<schedule.txt>");
        }
    }

    ScheduleBundle execute(InputMode mode, String file) {
        String input = read(Path.of(file));
        try {
            ScheduleBundle bundle = importService.importFrom(mode, input);
            for (ScheduleEntry e : bundle.entries()) {
                log.info("{} [{}] {} {}-{} {} | {} | {}",
                        e.getCode(), e.getSection(), e.getDay(), e.getStartTime(), e.getEndTime(),
                        e.getVenue().isEmpty() ? "-" : e.getVenue(), e.getLecturer(), e.getTitle());
            }
            if (!bundle.venues().isEmpty()) {
                log.info("Venues: {}", String.join(", ", bundle.venues()));
            }
            return bundle;
        } catch (TableNotFoundException e) {
            log.error("Import of {} failed: {}", file, e.getMessage());
            return null;
        }
    }

    private String firstValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new IllegalArgumentException("--" + option + " needs a file path");
        }
        return values.get(0);
    }

    private String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + path, e);
        }
    }
}
