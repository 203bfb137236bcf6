package com.jobhost.service;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronValidationServiceTest {

    private final CronValidationService service = new CronValidationService();

    @Test
    void isValid_acceptsQuartzSyntaxOnly() {
        assertTrue(service.isValid("0 0/5 * * * ?"));
        assertTrue(service.isValid("0 15 10 ? * MON-FRI"));
        assertFalse(service.isValid("*/5 * * * *"));
        assertFalse(service.isValid(""));
        assertFalse(service.isValid(null));
    }

    @Test
    void validate_explainsTheProblem() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> service.validate("0 0 25 * * ?"));
        assertTrue(e.getMessage().startsWith("Invalid cron expression"));

        assertThrows(IllegalArgumentException.class, () -> service.validate("   "));
    }

    @Test
    void nextFireTimes_areConsecutive() {
        Date after = Date.from(LocalDateTime.of(2030, 1, 1, 10, 2).atZone(ZoneId.systemDefault()).toInstant());

        List<LocalDateTime> times = service.nextFireTimes("0 0/15 * * * ?", 3, after);

        assertEquals(List.of(
                LocalDateTime.of(2030, 1, 1, 10, 15),
                LocalDateTime.of(2030, 1, 1, 10, 30),
                LocalDateTime.of(2030, 1, 1, 10, 45)), times);
    }

    @Test
    void nextFireTimes_stopsWhenExpressionIsExhausted() {
        Date after = Date.from(LocalDateTime.of(2030, 1, 1, 0, 0).atZone(ZoneId.systemDefault()).toInstant());

        List<LocalDateTime> times = service.nextFireTimes("0 0 12 1 1 ? 2031", 5, after);

        assertEquals(List.of(LocalDateTime.of(2031, 1, 1, 12, 0)), times);
    }

    @Test
    void nextFireTimes_rejectsBadCount() {
        assertThrows(IllegalArgumentException.class, () -> service.nextFireTimes("0 0 * * * ?", 0));
        assertThrows(IllegalArgumentException.class, () -> service.nextFireTimes("0 0 * * * ?", 1000));
    }
}
