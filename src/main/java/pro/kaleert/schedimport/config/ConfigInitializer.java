package pro.kaleert.schedimport.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Puts an optional {@code importer.yml} from the working directory in front of
 * the bundled {@code application.yml}.
 */
@Slf4j
public class ConfigInitializer implements ApplicationContextInitializer<ConfigurableApplicationContext> {

    static final String CONFIG_FILENAME = "importer.yml";

    private final File configFile;

    public ConfigInitializer() {
        this(new File(System.getProperty("user.dir"), CONFIG_FILENAME));
    }

    ConfigInitializer(File configFile) {
        this.configFile = configFile;
    }

    @Override
    public void initialize(ConfigurableApplicationContext applicationContext) {
        if (!configFile.exists()) {
            log.debug("No external {} found, using bundled defaults", CONFIG_FILENAME);
            return;
        }
        log.info("Found external configuration file: {}", configFile.getAbsolutePath());
        loadExternalConfig(applicationContext, configFile);
    }

    private void loadExternalConfig(ConfigurableApplicationContext context, File file) {
        try {
            YamlPropertySourceLoader loader = new YamlPropertySourceLoader();
            Resource fileResource = new FileSystemResource(file);
            List<PropertySource<?>> sources = loader.load("external-yaml-config", fileResource);

            if (!sources.isEmpty()) {
                context.getEnvironment().getPropertySources().addFirst(sources.get(0));
                log.info("Loaded external configuration from {}", file.getName());
            }
        } catch (IOException e) {
            log.error("Failed to load external config file", e);
            throw new RuntimeException("Could not load " + CONFIG_FILENAME, e);
        }
    }
}
