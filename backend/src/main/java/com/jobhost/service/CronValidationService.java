package com.jobhost.service;

import org.quartz.CronExpression;
import org.springframework.stereotype.Service;

import java.text.ParseException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Validates cron expressions in Quartz syntax (seconds first, {@code ?} in one of the day
 * fields) and lists upcoming fire times in the server's time zone.
 */
@Service
public class CronValidationService {

    public static final int DEFAULT_COUNT = 5;
    static final int MAX_COUNT = 100;

    public boolean isValid(String cronExpression) {
        return cronExpression != null && !cronExpression.isBlank()
                && CronExpression.isValidExpression(cronExpression.trim());
    }

    /** @throws IllegalArgumentException with a readable reason when the expression is invalid */
    public void validate(String cronExpression) {
        parse(cronExpression);
    }

    public List<LocalDateTime> nextFireTimes(String cronExpression, int count) {
        return nextFireTimes(cronExpression, count, new Date());
    }

    List<LocalDateTime> nextFireTimes(String cronExpression, int count, Date after) {
        if (count < 1 || count > MAX_COUNT) {
            throw new IllegalArgumentException("Count must be between 1 and " + MAX_COUNT);
        }
        CronExpression cron = parse(cronExpression);
        List<LocalDateTime> fireTimes = new ArrayList<>(count);
        Date next = after;
        for (int i = 0; i < count; i++) {
            next = cron.getNextValidTimeAfter(next);
            if (next == null) break;
            fireTimes.add(LocalDateTime.ofInstant(next.toInstant(), ZoneId.systemDefault()));
        }
        return fireTimes;
    }

    private CronExpression parse(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new IllegalArgumentException("Cron expression cannot be empty");
        }
        try {
            return new CronExpression(cronExpression.trim());
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + cronExpression + "': " + e.getMessage(), e);
        }
    }
}
