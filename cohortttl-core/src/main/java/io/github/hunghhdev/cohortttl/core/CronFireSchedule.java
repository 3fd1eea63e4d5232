package io.github.hunghhdev.cohortttl.core;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import org.springframework.scheduling.support.CronExpression;

/**
 * Cron-driven schedule, evaluated in UTC. Accepts Spring's 6-field form (seconds first) and the classic
 * 5-field form, which fires at second zero.
 */
public final class CronFireSchedule implements FireSchedule {

    private final String expression;
    private final CronExpression cron;

    private CronFireSchedule(String expression, CronExpression cron) {
        this.expression = expression;
        this.cron = cron;
    }

    static CronFireSchedule parse(String expression) {
        String normalized = expression.trim().split("\\s+").length == 5 ? "0 " + expression.trim() : expression.trim();
        try {
            return new CronFireSchedule(expression, CronExpression.parse(normalized));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    @Override
    public Instant nextFireAfter(Instant instant) {
        ZonedDateTime next = cron.next(instant.atZone(ZoneOffset.UTC));
        if (next == null) {
            throw new IllegalStateException("Cron expression '" + expression + "' never fires again");
        }
        return next.toInstant();
    }

    @Override
    public String toString() {
        return "cron " + expression;
    }
}
