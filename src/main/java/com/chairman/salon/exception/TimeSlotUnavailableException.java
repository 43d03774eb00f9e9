package com.chairman.salon.exception;

import lombok.Getter;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * The requested window overlaps at least one booked appointment. Callers should
 * offer another time rather than retry.
 * <p>
 * {@code start}/{@code end} are the requested window. {@code occupiedStart} and
 * {@code occupiedEnd} span the appointments in the way, when they are known.
 */
@Getter
public class TimeSlotUnavailableException extends SchedulerException {

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("hh:mm a", Locale.US);

    private final LocalDateTime start;
    private final LocalDateTime end;
    private final List<Long> conflictingIds;
    private final LocalDateTime occupiedStart;
    private final LocalDateTime occupiedEnd;

    public TimeSlotUnavailableException(LocalDateTime start, LocalDateTime end, List<Long> conflictingIds) {
        this(start, end, conflictingIds, null, null);
    }

    public TimeSlotUnavailableException(LocalDateTime start, LocalDateTime end, List<Long> conflictingIds,
                                        LocalDateTime occupiedStart, LocalDateTime occupiedEnd) {
        super("Time slot from " + start.format(CLOCK) + " to " + end.format(CLOCK) + " is not available");
        this.start = start;
        this.end = end;
        this.conflictingIds = List.copyOf(conflictingIds);
        this.occupiedStart = occupiedStart;
        this.occupiedEnd = occupiedEnd;
    }
}
