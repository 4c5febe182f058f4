package com.umitunal.elric.trigger;

import com.umitunal.elric.core.Trigger;
import com.umitunal.elric.core.TriggerType;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.TreeSet;

/**
 * Six-field cron rule evaluated in UTC: {@code second minute hour day-of-month month day-of-week}.
 *
 * Each field accepts {@code *}, single values, ranges ({@code 1-5}), lists ({@code 1,3})
 * and steps ({@code *}{@code /15}, {@code 0-30/10}). Day-of-week uses 0-7 with both 0 and 7
 * meaning Sunday. When both day fields are restricted a day matches if either does.
 */
public class CronTrigger implements Trigger {
    // Give up after this many years without a match (e.g. "0 0 0 30 2 *").
    private static final int SEARCH_YEARS = 5;

    private final String expression;
    private final long startTime;
    private final Field seconds;
    private final Field minutes;
    private final Field hours;
    private final Field days;
    private final Field months;
    private final Field daysOfWeek;

    /**
     * @param expression six-field cron expression
     * @param startTime earliest instant the first fire may happen at (millis since epoch)
     * @throws IllegalArgumentException if the expression is malformed
     */
    public CronTrigger(String expression, long startTime) {
        this.expression = Objects.requireNonNull(expression, "expression").trim();
        this.startTime = startTime;

        String[] parts = this.expression.split("\\s+");
        if (parts.length != 6) {
            throw new IllegalArgumentException("Cron expression must have 6 fields: " + expression);
        }
        this.seconds = Field.parse(parts[0], 0, 59);
        this.minutes = Field.parse(parts[1], 0, 59);
        this.hours = Field.parse(parts[2], 0, 23);
        this.days = Field.parse(parts[3], 1, 31);
        this.months = Field.parse(parts[4], 1, 12);
        this.daysOfWeek = Field.parse(parts[5], 0, 7);
    }

    @Override
    public OptionalLong nextFireTime(OptionalLong previousFireTime, long referenceTime) {
        long from;
        if (previousFireTime.isPresent()) {
            from = Math.floorDiv(previousFireTime.getAsLong(), 1000L) * 1000L + 1000L;
        } else {
            from = Math.floorDiv(startTime + 999L, 1000L) * 1000L;
        }
        return search(LocalDateTime.ofEpochSecond(from / 1000L, 0, ZoneOffset.UTC));
    }

    private OptionalLong search(LocalDateTime from) {
        LocalDateTime limit = from.plusYears(SEARCH_YEARS);
        LocalDateTime time = from;

        while (time.isBefore(limit)) {
            if (!months.matches(time.getMonthValue())) {
                time = time.withDayOfMonth(1).toLocalDate().atStartOfDay().plusMonths(1);
                continue;
            }
            if (!dayMatches(time)) {
                time = time.toLocalDate().atStartOfDay().plusDays(1);
                continue;
            }
            if (!hours.matches(time.getHour())) {
                time = time.withMinute(0).withSecond(0).plusHours(1);
                continue;
            }
            if (!minutes.matches(time.getMinute())) {
                time = time.withSecond(0).plusMinutes(1);
                continue;
            }
            if (!seconds.matches(time.getSecond())) {
                time = time.plusSeconds(1);
                continue;
            }
            return OptionalLong.of(time.toEpochSecond(ZoneOffset.UTC) * 1000L);
        }
        return OptionalLong.empty();
    }

    private boolean dayMatches(LocalDateTime time) {
        int dow = time.getDayOfWeek().getValue() % 7; // Sunday=0
        boolean domMatches = days.matches(time.getDayOfMonth());
        boolean dowMatches = daysOfWeek.matches(dow);

        if (days.isWildcard() && daysOfWeek.isWildcard()) {
            return true;
        } else if (days.isWildcard()) {
            return dowMatches;
        } else if (daysOfWeek.isWildcard()) {
            return domMatches;
        }
        return domMatches || dowMatches;
    }

    @Override
    public TriggerType getType() {
        return TriggerType.CRON;
    }

    public String getExpression() { return expression; }
    public long getStartTime() { return startTime; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronTrigger)) return false;
        CronTrigger that = (CronTrigger) o;
        return startTime == that.startTime && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, startTime);
    }

    @Override
    public String toString() {
        return String.format("CronTrigger{expression='%s', start=%d}", expression, startTime);
    }

    private static final class Field {
        private final boolean wildcard;
        private final TreeSet<Integer> values;

        private Field(boolean wildcard, TreeSet<Integer> values) {
            this.wildcard = wildcard;
            this.values = values;
        }

        static Field parse(String token, int min, int max) {
            token = token.toLowerCase(Locale.ROOT);
            if ("*".equals(token) || "?".equals(token)) {
                return new Field(true, new TreeSet<>());
            }
            TreeSet<Integer> values = new TreeSet<>();
            for (String part : token.split(",")) {
                values.addAll(parsePart(part, min, max));
            }
            if (values.isEmpty()) {
                throw new IllegalArgumentException("Cron field matches nothing: " + token);
            }
            return new Field(false, values);
        }

        private static List<Integer> parsePart(String part, int min, int max) {
            String[] stepSplit = part.split("/");
            if (stepSplit.length > 2) {
                throw new IllegalArgumentException("Invalid cron step: " + part);
            }
            String range = stepSplit[0];
            int step = stepSplit.length > 1 ? parseNumber(stepSplit[1], part) : 1;
            if (step <= 0) {
                throw new IllegalArgumentException("Cron step must be positive: " + part);
            }

            int start;
            int end;
            if ("*".equals(range)) {
                start = min;
                end = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-");
                if (bounds.length != 2) {
                    throw new IllegalArgumentException("Invalid cron range: " + part);
                }
                start = parseNumber(bounds[0], part);
                end = parseNumber(bounds[1], part);
            } else {
                start = parseNumber(range, part);
                end = stepSplit.length > 1 ? max : start;
            }
            if (start < min || end > max || start > end) {
                throw new IllegalArgumentException(
                        String.format("Cron value out of range [%d-%d]: %s", min, max, part));
            }

            List<Integer> out = new ArrayList<>();
            for (int v = start; v <= end; v += step) {
                out.add(max == 7 && v == 7 ? 0 : v);
            }
            return out;
        }

        private static int parseNumber(String text, String part) {
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid cron value: " + part, e);
            }
        }

        boolean isWildcard() {
            return wildcard;
        }

        boolean matches(int value) {
            return wildcard || values.contains(value);
        }
    }
}
