package com.programmersdiary.moltby.cron;

import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A validated five-field cron schedule (minute, hour, day-of-month, month, day-of-week).
 * Schedules are always evaluated in UTC.
 */
public final class CronSchedule {

    public static final ZoneId ZONE = ZoneOffset.UTC;

    private static final String[] FIELD_NAMES = {"minute", "hour", "day-of-month", "month", "day-of-week"};
    private static final int[] FIELD_MIN = {0, 0, 1, 1, 0};
    private static final int[] FIELD_MAX = {59, 23, 31, 12, 6};

    private final String expression;
    private final CronExpression cronExpression;

    private CronSchedule(String expression, CronExpression cronExpression) {
        this.expression = expression;
        this.cronExpression = cronExpression;
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        var fields = expression.trim().split("\\s+");
        if (fields.length != FIELD_NAMES.length) {
            throw new IllegalArgumentException(
                    "Cron expression must have 5 fields but has " + fields.length + ": " + expression);
        }
        for (int i = 0; i < fields.length; i++) {
            validateField(fields[i], i);
        }
        // Spring reads a bare * in day-of-week as 1-7, which shifts stepped weekdays
        fields[4] = fields[4].replace("*/", "0-6/");
        // Spring expressions carry a leading seconds field
        var springExpression = "0 " + String.join(" ", fields);
        return new CronSchedule(expression.trim(), CronExpression.parse(springExpression));
    }

    public String expression() {
        return expression;
    }

    public Instant nextFireAfter(Instant instant) {
        var next = cronExpression.next(instant.atZone(ZONE));
        return next != null ? next.toInstant() : null;
    }

    public CronTrigger trigger() {
        return new CronTrigger(cronExpression.toString(), ZONE);
    }

    @Override
    public String toString() {
        return expression;
    }

    private static void validateField(String field, int index) {
        for (var item : field.split(",", -1)) {
            if (item.isEmpty()) {
                throw invalid(index, field);
            }
            var range = item;
            var slash = item.indexOf('/');
            if (slash >= 0) {
                int step = parseNumber(item.substring(slash + 1), index, field);
                if (step < 1) {
                    throw invalid(index, field);
                }
                range = item.substring(0, slash);
            }
            if ("*".equals(range)) {
                continue;
            }
            var dash = range.indexOf('-');
            if (dash >= 0) {
                int low = parseNumber(range.substring(0, dash), index, field);
                int high = parseNumber(range.substring(dash + 1), index, field);
                checkBounds(low, index, field);
                checkBounds(high, index, field);
                if (low > high) {
                    throw invalid(index, field);
                }
            } else {
                checkBounds(parseNumber(range, index, field), index, field);
            }
        }
    }

    private static int parseNumber(String text, int index, String field) {
        if (text.isEmpty() || text.length() > 2 || !text.chars().allMatch(Character::isDigit)) {
            throw invalid(index, field);
        }
        return Integer.parseInt(text);
    }

    private static void checkBounds(int value, int index, String field) {
        if (value < FIELD_MIN[index] || value > FIELD_MAX[index]) {
            throw invalid(index, field);
        }
    }

    private static IllegalArgumentException invalid(int index, String field) {
        return new IllegalArgumentException("Invalid " + FIELD_NAMES[index] + " field: '" + field + "'");
    }
}
