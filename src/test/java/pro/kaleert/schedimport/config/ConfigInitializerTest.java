package pro.kaleert.schedimport.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.support.GenericApplicationContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigInitializerTest {

    @TempDir
    Path tempDir;

    @Test
    void externalFileTakesPrecedence() throws IOException {
        Path file = tempDir.resolve(ConfigInitializer.CONFIG_FILENAME);
        Files.writeString(file, "importer:\n  default-credit-hour: 4\n");

        try (GenericApplicationContext context = new GenericApplicationContext()) {
            new ConfigInitializer(file.toFile()).initialize(context);

            assertThat(context.getEnvironment().getProperty("importer.default-credit-hour")).isEqualTo("4");
        }
    }

    @Test
    void missingFileLeavesEnvironmentAlone() {
        try (GenericApplicationContext context = new GenericApplicationContext()) {
            new ConfigInitializer(tempDir.resolve("absent.yml").toFile()).initialize(context);

            assertThat(context.getEnvironment().getPropertySources().contains("external-yaml-config")).isFalse();
        }
    }
}
