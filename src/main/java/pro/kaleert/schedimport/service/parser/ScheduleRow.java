package pro.kaleert.schedimport.service.parser;

import pro.kaleert.schedimport.model.MeetingTime;

/**
 * One meeting line of a course block before day expansion.
 */
public record ScheduleRow(
    String dayToken,
    MeetingTime time,
    String venue,
    String lecturer
) {}
