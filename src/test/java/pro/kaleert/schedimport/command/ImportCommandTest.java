package pro.kaleert.schedimport.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;
import pro.kaleert.schedimport.Fixtures;
import pro.kaleert.schedimport.config.ImporterProperties;
import pro.kaleert.schedimport.model.ScheduleBundle;
import pro.kaleert.schedimport.service.InputMode;
import pro.kaleert.schedimport.service.ScheduleImportService;
import pro.kaleert.schedimport.service.ScheduleNormalizer;
import pro.kaleert.schedimport.service.parser.HtmlScheduleExtractor;
import pro.kaleert.schedimport.service.parser.TextScheduleExtractor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImportCommandTest {

    @TempDir
    Path tempDir;

    private ImportCommand command;

    @BeforeEach
    void setUp() {
        ImporterProperties properties = new ImporterProperties();
        command = new ImportCommand(new ScheduleImportService(
                new HtmlScheduleExtractor(properties),
                new TextScheduleExtractor(properties),
                new ScheduleNormalizer()));
    }

    @Test
    void importsTextFile() throws IOException {
        Path file = write("schedule.txt", Fixtures.load("schedule.txt"));

        ScheduleBundle bundle = command.execute(InputMode.TEXT, file.toString());

        assertThat(bundle.entries()).hasSize(5);
    }

    @Test
    void runDispatchesOnOption() throws IOException {
        Path file = write("schedule.html", Fixtures.load("schedule.html"));

        assertThatCode(() -> command.run(new DefaultApplicationArguments("--html=" + file)))
                .doesNotThrowAnyException();
        assertThatCode(() -> command.run(new DefaultApplicationArguments()))
                .doesNotThrowAnyException();
    }

    @Test
    void missingScheduleTableIsReportedNotThrown() throws IOException {
        Path file = write("empty.html", "<html><body>maintenance</body></html>");

        assertThat(command.execute(InputMode.HTML, file.toString())).isNull();
    }

    @Test
    void unreadableFileFails() {
        String missing = tempDir.resolve("missing.txt").toString();

        assertThatThrownBy(() -> command.execute(InputMode.TEXT, missing))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void optionWithoutPathFails() {
        assertThatThrownBy(() -> command.run(new DefaultApplicationArguments("--text")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
