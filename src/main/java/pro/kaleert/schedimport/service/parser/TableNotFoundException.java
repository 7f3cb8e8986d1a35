package pro.kaleert.schedimport.service.parser;

/**
 * Thrown when an HTML document has no table that looks like a class schedule.
 */
public class TableNotFoundException extends RuntimeException {

    public TableNotFoundException() {
        super("Could not find schedule table in the HTML");
    }
}
