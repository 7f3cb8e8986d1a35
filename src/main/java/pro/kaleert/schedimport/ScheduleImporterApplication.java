package pro.kaleert.schedimport;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import pro.kaleert.schedimport.config.ConfigInitializer;

@SpringBootApplication
public class ScheduleImporterApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(ScheduleImporterApplication.class)
                .initializers(new ConfigInitializer())
                .run(args);
    }
}
