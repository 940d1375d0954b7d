package com.barcache.service.calendar;

import com.barcache.core.model.DateRange;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Exchange trading days: weekdays that are not listed holidays.
 */
public class TradingCalendar {

    private final Set<LocalDate> holidays;

    public TradingCalendar(Collection<LocalDate> holidays) {
        this.holidays = Set.copyOf(holidays);
    }

    public static TradingCalendar weekdaysOnly() {
        return new TradingCalendar(List.of());
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY && !holidays.contains(date);
    }

    public LocalDate lastTradingDayOnOrBefore(LocalDate date) {
        LocalDate d = date;
        // A year of consecutive holidays would be a configuration error
        for (int i = 0; i < 366 && !isTradingDay(d); i++) {
            d = d.minusDays(1);
        }
        return d;
    }

    /**
     * Trading days strictly after {@code start} up to and including {@code end}.
     * Zero when end is not after start.
     */
    public int tradingDaysBetween(LocalDate start, LocalDate end) {
        int count = 0;
        for (LocalDate d = start.plusDays(1); !d.isAfter(end); d = d.plusDays(1)) {
            if (isTradingDay(d)) count++;
        }
        return count;
    }

    public List<LocalDate> tradingDays(DateRange range) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = range.from(); !d.isAfter(range.to()); d = d.plusDays(1)) {
            if (isTradingDay(d)) days.add(d);
        }
        return days;
    }

    public Set<LocalDate> getHolidays() {
        return holidays;
    }
}
