package com.cybershieldx.agent.schedule;

import org.springframework.scheduling.support.CronExpression;

/**
 * Parses scan schedules. Five-field Unix expressions get a leading seconds field.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    /**
     * @throws IllegalArgumentException if the expression is not a valid cron expression
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be empty");
        }
        return CronExpression.parse(normalize(expression));
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static String normalize(String expression) {
        String trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            return trimmed;
        }
        String[] fields = trimmed.split("\\s+");
        return fields.length == 5 ? "0 " + String.join(" ", fields) : trimmed;
    }
}
