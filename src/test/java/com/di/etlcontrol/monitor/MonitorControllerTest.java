package com.di.etlcontrol.monitor;

import com.di.etlcontrol.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Test cases for MonitorController.
 */
@DisplayName("MonitorController Tests")
class MonitorControllerTest {

    private EtlRun etlRun;
    private MutableClock clock;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-17T09:30:00Z"));
        etlRun = new EtlRun("20261017T093000-0badcafe", clock.instant(), new ProgressTracker(), new EventLog(clock));
        MonitorProperties properties = new MonitorProperties();
        properties.setDefaultEventLimit(2);
        MappingJackson2HttpMessageConverter converter =
                new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json().build());
        mockMvc = MockMvcBuilders.standaloneSetup(new MonitorController(etlRun, properties))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(converter)
                .build();
    }

    @Test
    @DisplayName("Should return the run id")
    void testGetEtlId() throws Exception {
        mockMvc.perform(get("/api/etl-id"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("20261017T093000-0badcafe"));
    }

    @Test
    @DisplayName("Should return an empty list while waiting")
    void testGetIndices_Waiting() throws Exception {
        mockMvc.perform(get("/api/indices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("Should expose name, current and final for each relation")
    void testGetIndices() throws Exception {
        etlRun.getProgressTracker().setFinal("public.orders", 4);
        etlRun.getProgressTracker().advance("public.orders");

        mockMvc.perform(get("/api/indices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value("public.orders"))
                .andExpect(jsonPath("$[0].current").value(1))
                .andExpect(jsonPath("$[0].final").value(4));
    }

    @Test
    @DisplayName("Should set the final index and advance through the write endpoints")
    void testSetFinalAndAdvance() throws Exception {
        mockMvc.perform(put("/api/indices/public.orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"final\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.final").value(2));

        mockMvc.perform(post("/api/indices/public.orders/advance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current").value(1));

        mockMvc.perform(post("/api/indices/public.orders/advance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"delta\": 5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current").value(2));
    }

    @Test
    @DisplayName("Should reject a negative final index with 400")
    void testSetFinal_Negative() throws Exception {
        mockMvc.perform(put("/api/indices/public.orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"final\": -1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Should append events and return the newest with ISO timestamps")
    void testEvents() throws Exception {
        etlRun.getEventLog().append("public.orders", "extract", "start");
        etlRun.getEventLog().append("public.orders", "extract", "finish");

        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\": \"public.orders\", \"step\": \"copy\", \"event\": \"start\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.step").value("copy"));

        mockMvc.perform(get("/api/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].event").value("finish"))
                .andExpect(jsonPath("$[1].step").value("copy"))
                .andExpect(jsonPath("$[1].timestamp").value("2026-10-17T09:30:00Z"))
                .andExpect(jsonPath("$[1].elapsed").value(0.0));

        mockMvc.perform(get("/api/events").param("limit", "10"))
                .andExpect(jsonPath("$", hasSize(3)));
    }

    @Test
    @DisplayName("Should reject a blank event with 400")
    void testAppendEvent_Blank() throws Exception {
        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\": \"public.orders\", \"step\": \"copy\", \"event\": \" \"}"))
                .andExpect(status().isBadRequest());
        org.junit.jupiter.api.Assertions.assertEquals(0, etlRun.getEventLog().size());
    }

    @Test
    @DisplayName("Should reject a non-numeric limit with 400")
    void testGetEvents_NonNumericLimit() throws Exception {
        mockMvc.perform(get("/api/events").param("limit", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("VALIDATION_ERROR"));
    }
}
