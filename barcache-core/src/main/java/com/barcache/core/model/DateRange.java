package com.barcache.core.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive range of calendar dates.
 */
public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must be <= to: " + from + " > " + to);
        }
    }

    public static DateRange of(LocalDate from, LocalDate to) {
        return new DateRange(from, to);
    }

    public static DateRange singleDay(LocalDate day) {
        return new DateRange(day, day);
    }

    /**
     * Number of calendar days in the range, both ends included.
     */
    public long days() {
        return ChronoUnit.DAYS.between(from, to) + 1;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && !date.isAfter(to);
    }

    public boolean containsRange(DateRange other) {
        return !other.from.isBefore(from) && !other.to.isAfter(to);
    }

    public boolean overlaps(DateRange other) {
        return !from.isAfter(other.to) && !other.from.isAfter(to);
    }

    /**
     * True when the two ranges overlap or touch (one ends the day before the other starts).
     */
    public boolean overlapsOrAdjacent(DateRange other) {
        return !from.isAfter(other.to.plusDays(1)) && !other.from.isAfter(to.plusDays(1));
    }

    public DateRange merge(DateRange other) {
        LocalDate start = from.isBefore(other.from) ? from : other.from;
        LocalDate end = to.isAfter(other.to) ? to : other.to;
        return new DateRange(start, end);
    }

    /**
     * Split into consecutive chunks of at most {@code maxDays} days each.
     * Providers reject historical requests spanning more than a fixed window.
     */
    public List<DateRange> splitByDays(int maxDays) {
        if (maxDays <= 0) {
            throw new IllegalArgumentException("maxDays must be positive");
        }
        List<DateRange> chunks = new ArrayList<>();
        LocalDate cursor = from;
        while (!cursor.isAfter(to)) {
            LocalDate chunkEnd = cursor.plusDays(maxDays - 1L);
            if (chunkEnd.isAfter(to)) {
                chunkEnd = to;
            }
            chunks.add(new DateRange(cursor, chunkEnd));
            cursor = chunkEnd.plusDays(1);
        }
        return chunks;
    }

    /**
     * Merge overlapping or adjacent ranges into a sorted, non-overlapping list.
     */
    public static List<DateRange> mergeAll(List<DateRange> ranges) {
        if (ranges.size() < 2) {
            return new ArrayList<>(ranges);
        }
        List<DateRange> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparing(DateRange::from));

        List<DateRange> merged = new ArrayList<>();
        DateRange current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            DateRange next = sorted.get(i);
            if (current.overlapsOrAdjacent(next)) {
                current = current.merge(next);
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }

    @Override
    public String toString() {
        return "[" + from + " .. " + to + "]";
    }
}
