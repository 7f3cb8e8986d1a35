package pro.kaleert.schedimport.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "importer")
public class ImporterProperties {

    /** Credit hour used when the page leaves it blank or unreadable. */
    private int defaultCreditHour = 3;

    private Html html = new Html();

    @Data
    public static class Html {
        /** Leading rows of the schedule table that hold column titles. */
        private int headerRows = 2;
    }
}
