package com.starscape.contacts.features.contacts.app;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.Month;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The calendar days from {@code start} to {@code start + days}, both inclusive.
 * In non-leap years a February 29 birthday is celebrated on February 28.
 */
public final class BirthdayWindow {
    
    private static final MonthDay LEAP_DAY = MonthDay.of(Month.FEBRUARY, 29);
    
    private final LocalDate start;
    private final LocalDate end;
    
    private BirthdayWindow(LocalDate start, int days) {
        if (days < 0) {
            throw new IllegalArgumentException("Window length must not be negative");
        }
        this.start = start;
        this.end = start.plusDays(days);
    }
    
    public static BirthdayWindow starting(LocalDate start, int days) {
        return new BirthdayWindow(start, days);
    }
    
    public LocalDate getStart() {
        return start;
    }
    
    public LocalDate getEnd() {
        return end;
    }
    
    /**
     * Calendar days in the window encoded as {@code month * 100 + day}, ready for a birthday query.
     */
    public Set<Integer> monthDays() {
        Set<Integer> result = new LinkedHashSet<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            result.add(encode(day.getMonthValue(), day.getDayOfMonth()));
            if (day.getMonth() == Month.FEBRUARY && day.getDayOfMonth() == 28 && !day.isLeapYear()) {
                result.add(encode(LEAP_DAY.getMonthValue(), LEAP_DAY.getDayOfMonth()));
            }
        }
        return result;
    }
    
    /**
     * The first celebration of {@code birthday} on or after the window start.
     */
    public LocalDate nextOccurrence(LocalDate birthday) {
        MonthDay monthDay = MonthDay.from(birthday);
        LocalDate candidate = monthDay.atYear(start.getYear());
        if (candidate.isBefore(start)) {
            candidate = monthDay.atYear(start.getYear() + 1);
        }
        return candidate;
    }
    
    public boolean contains(LocalDate birthday) {
        return !nextOccurrence(birthday).isAfter(end);
    }
    
    static int encode(int month, int day) {
        return month * 100 + day;
    }
}
