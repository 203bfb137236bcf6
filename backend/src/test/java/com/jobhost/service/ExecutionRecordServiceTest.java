package com.jobhost.service;

import com.jobhost.exception.NotFoundException;
import com.jobhost.model.ExecutionRecord;
import com.jobhost.model.enums.ExecutionStatus;
import com.jobhost.repository.ExecutionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionRecordServiceTest {

    private ExecutionRecordRepository repository;
    private ExecutionRecordService service;

    @BeforeEach
    void setUp() {
        repository = mock(ExecutionRecordRepository.class);
        when(repository.save(any(ExecutionRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        service = new ExecutionRecordService(repository);
    }

    @Test
    void open_createsRunningRecord() {
        UUID jobId = UUID.randomUUID();

        ExecutionRecord record = service.open(jobId, "fire-7");

        assertEquals(jobId, record.getJobId());
        assertEquals("fire-7", record.getFireInstanceId());
        assertEquals(ExecutionStatus.RUNNING, record.getStatus());
        assertNotNull(record.getStartTime());
        assertNull(record.getEndTime());
    }

    @Test
    void close_setsTerminalStatusAndEndTime() {
        ExecutionRecord running = running();

        ExecutionRecord closed = service.close(running.getId(), ExecutionStatus.FAILED, "broken");

        assertEquals(ExecutionStatus.FAILED, closed.getStatus());
        assertEquals("broken", closed.getErrorMessage());
        assertNotNull(closed.getEndTime());
    }

    @Test
    void close_truncatesLongErrors() {
        ExecutionRecord running = running();

        ExecutionRecord closed = service.close(running.getId(), ExecutionStatus.FAILED, "x".repeat(5000));

        assertEquals(4000, closed.getErrorMessage().length());
    }

    @Test
    void close_refusesClosedRecord() {
        ExecutionRecord record = running();
        record.setStatus(ExecutionStatus.SUCCESS);

        assertThrows(IllegalStateException.class,
                () -> service.close(record.getId(), ExecutionStatus.FAILED, null));
        verify(repository, never()).save(any());
    }

    @Test
    void close_refusesNonTerminalStatus() {
        assertThrows(IllegalArgumentException.class,
                () -> service.close(UUID.randomUUID(), ExecutionStatus.RUNNING, null));
    }

    @Test
    void close_failsForUnknownRecord() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.close(id, ExecutionStatus.SUCCESS, null));
    }

    private ExecutionRecord running() {
        ExecutionRecord record = ExecutionRecord.builder()
                .id(UUID.randomUUID())
                .jobId(UUID.randomUUID())
                .fireInstanceId("fire-1")
                .startTime(LocalDateTime.now())
                .build();
        when(repository.findById(record.getId())).thenReturn(Optional.of(record));
        return record;
    }
}
