package pro.kaleert.schedimport.model;

/**
 * Start and end of one meeting as 24-hour {@code HH:MM} strings.
 * Both are set or both are null.
 */
public record MeetingTime(String start, String end) {

    public static final MeetingTime UNPARSEABLE = new MeetingTime(null, null);

    public MeetingTime {
        if ((start == null) != (end == null)) {
            throw new IllegalArgumentException("start and end must both be set or both be null");
        }
    }

    public boolean isParsed() {
        return start != null;
    }
}
