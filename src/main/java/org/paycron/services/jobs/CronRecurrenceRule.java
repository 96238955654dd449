package org.paycron.services.jobs;

import org.paycron.exceptions.ConfigurationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.Year;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cron rule backed by Quartz. Six fields (seconds first) or seven (year last),
 * evaluated in UTC.
 *
 * Quartz needs one of day-of-month / day-of-week to be {@code ?}. A {@code *}
 * in either field is turned into {@code ?}. When both fields carry values, a
 * fire time must match both: the rule is split into a day-of-month expression
 * and a day-of-week expression and only instants both accept are emitted.
 */
public final class CronRecurrenceRule implements RecurrenceRule {

    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");
    private static final int DAY_OF_MONTH = 3;
    private static final int DAY_OF_WEEK = 5;
    private static final int YEAR = 6;

    /** Quartz stops searching about a century ahead. */
    static final int MAX_YEAR = Year.now(ZoneOffset.UTC).getValue() + 100;

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private final String expression;
    private final CronExpression primary;
    private final CronExpression secondary;

    private CronRecurrenceRule(String expression, CronExpression primary, CronExpression secondary) {
        this.expression = expression;
        this.primary = primary;
        this.secondary = secondary;
    }

    public static CronRecurrenceRule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Empty cron expression");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 6 && fields.length != 7) {
            throw new ConfigurationException("Cron expression must have 6 or 7 fields (seconds first, optional year): " + expression);
        }
        if (fields.length == 7) {
            checkYearRange(expression, fields[YEAR]);
        }

        String dom = fields[DAY_OF_MONTH];
        String dow = fields[DAY_OF_WEEK];
        if (isWildcard(dow)) {
            return new CronRecurrenceRule(expression, compile(expression, withDays(fields, dom, "?")), null);
        }
        if (isWildcard(dom)) {
            return new CronRecurrenceRule(expression, compile(expression, withDays(fields, "?", dow)), null);
        }
        return new CronRecurrenceRule(expression,
                compile(expression, withDays(fields, dom, "?")),
                compile(expression, withDays(fields, "?", dow)));
    }

    private static boolean isWildcard(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static String withDays(String[] fields, String dom, String dow) {
        String[] copy = fields.clone();
        copy[DAY_OF_MONTH] = dom;
        copy[DAY_OF_WEEK] = dow;
        return String.join(" ", copy);
    }

    private static CronExpression compile(String original, String normalized) {
        try {
            CronExpression cron = new CronExpression(normalized);
            cron.setTimeZone(UTC);
            return cron;
        } catch (ParseException e) {
            throw new ConfigurationException("Invalid cron expression '" + original + "': " + e.getMessage(), e);
        }
    }

    private static void checkYearRange(String expression, String yearField) {
        Matcher m = NUMBER.matcher(yearField);
        while (m.find()) {
            // increments after '/' are step sizes, not years
            if (m.start() > 0 && yearField.charAt(m.start() - 1) == '/') continue;
            long year = Long.parseLong(m.group());
            if (year > MAX_YEAR) {
                throw new ConfigurationException("Cron expression '" + expression + "' uses year " + year
                        + ", schedules can only reach " + MAX_YEAR);
            }
        }
    }

    @Override
    public Iterator<Instant> upcoming(Instant from) {
        return new Iterator<>() {
            private Date next = nextAfter(Date.from(from));

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public Instant next() {
                if (next == null) {
                    throw new NoSuchElementException("No further fire time for " + expression);
                }
                Date current = next;
                next = nextAfter(current);
                return current.toInstant();
            }
        };
    }

    /** First instant strictly after {@code after} accepted by both expressions. */
    private Date nextAfter(Date after) {
        Date candidate = primary.getNextValidTimeAfter(after);
        if (secondary == null) {
            return candidate;
        }
        while (candidate != null) {
            // fire times are whole seconds, so one second back makes the search inclusive
            Date other = secondary.getNextValidTimeAfter(new Date(candidate.getTime() - 1000));
            if (other == null || other.equals(candidate)) {
                return other;
            }
            candidate = primary.getNextValidTimeAfter(new Date(other.getTime() - 1000));
        }
        return null;
    }

    @Override
    public String toString() {
        return expression;
    }
}
