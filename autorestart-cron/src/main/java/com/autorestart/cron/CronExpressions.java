package com.autorestart.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Five-field crontab expressions (minute hour day-of-month month day-of-week).
 */
public final class CronExpressions {

    private CronExpressions() {
    }

    static final int FIELD_COUNT = 5;

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    /**
     * Trim and collapse runs of whitespace to single spaces.
     */
    public static String normalize(String expression) {
        return expression == null ? "" : expression.trim().replaceAll("\\s+", " ");
    }

    /**
     * Parse and validate an expression.
     *
     * @throws SchedulingError if the expression is empty, does not have
     *                         exactly five fields, or a field is out of range
     */
    public static Cron parse(String expression) {
        String normalized = normalize(expression);
        if (normalized.isEmpty()) {
            throw new SchedulingError("Cron expression is empty");
        }
        int fields = normalized.split(" ").length;
        if (fields != FIELD_COUNT) {
            throw new SchedulingError("Cron expression must have 5 fields (minute hour day month weekday), got "
                    + fields + ": '" + expression + "'");
        }
        try {
            return PARSER.parse(normalized).validate();
        } catch (IllegalArgumentException e) {
            throw new SchedulingError("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    /**
     * First execution strictly after {@code after}, in {@code after}'s zone.
     */
    public static Optional<ZonedDateTime> nextAfter(Cron cron, ZonedDateTime after) {
        return ExecutionTime.forCron(cron).nextExecution(after);
    }
}
