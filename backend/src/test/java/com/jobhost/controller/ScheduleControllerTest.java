package com.jobhost.controller;

import com.jobhost.dto.ScheduleResponse;
import com.jobhost.exception.NotFoundException;
import com.jobhost.exception.SchedulerSyncException;
import com.jobhost.service.ScheduleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ScheduleController.class)
class ScheduleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScheduleService scheduleService;

    @Test
    void create_returnsCreated() throws Exception {
        UUID id = UUID.randomUUID();
        when(scheduleService.create(any())).thenReturn(ScheduleResponse.builder()
                .id(id).name("hourly").cronExpression("0 0 * * * ?").active(true).build());

        mockMvc.perform(post("/api/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"hourly\",\"cronExpression\":\"0 0 * * * ?\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    void create_rejectsBlankName() throws Exception {
        mockMvc.perform(post("/api/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\",\"cronExpression\":\"0 0 * * * ?\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.name").exists());

        verifyNoInteractions(scheduleService);
    }

    @Test
    void create_mapsInvalidCronToBadRequest() throws Exception {
        when(scheduleService.create(any()))
                .thenThrow(new IllegalArgumentException("Invalid cron expression 'nope'"));

        mockMvc.perform(post("/api/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"bad\",\"cronExpression\":\"nope\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid cron expression 'nope'"));
    }

    @Test
    void findById_mapsMissingScheduleToNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(scheduleService.findById(id)).thenThrow(new NotFoundException("Schedule not found: " + id));

        mockMvc.perform(get("/api/schedules/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Schedule not found: " + id));
    }

    @Test
    void pause_mapsSchedulerFailureToServerError() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new SchedulerSyncException("Failed to pause triggers", new RuntimeException("down")))
                .when(scheduleService).pause(id);

        mockMvc.perform(post("/api/schedules/{id}/pause", id))
                .andExpect(status().isInternalServerError());
    }
}
