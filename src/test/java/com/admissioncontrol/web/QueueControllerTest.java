package com.admissioncontrol.web;

import com.admissioncontrol.client.OutboundRequest;
import com.admissioncontrol.queue.QueueStatus;
import com.admissioncontrol.queue.RequestQueue;
import com.admissioncontrol.queue.RequestResult;
import com.admissioncontrol.storage.StorageException;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class QueueControllerTest {

    @Mock
    private RequestQueue requestQueue;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new QueueController(requestQueue))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should accept a request for asynchronous execution")
    void shouldSubmitRequest() throws Exception {
        when(requestQueue.submit(any())).thenReturn("req-1");

        mockMvc.perform(post("/api/queue/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"GET\",\"url\":\"https://api.close.com/api/v1/lead/\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value("req-1"));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(requestQueue).submit(payload.capture());
        assertEquals("https://api.close.com/api/v1/lead/", ((OutboundRequest) payload.getValue()).getUrl());
    }

    @Test
    @DisplayName("Should answer 400 for a request without url")
    void shouldRequireUrl() throws Exception {
        mockMvc.perform(post("/api/queue/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"GET\"}"))
                .andExpect(status().isBadRequest());

        verify(requestQueue, never()).submit(any());
    }

    @Test
    @DisplayName("Should answer 400 for a request with a null method")
    void shouldRequireMethod() throws Exception {
        mockMvc.perform(post("/api/queue/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":null,\"url\":\"https://api.close.com/api/v1/lead/\"}"))
                .andExpect(status().isBadRequest());

        verify(requestQueue, never()).submit(any());
    }

    @Test
    @DisplayName("Should answer 503 when the queue cannot be written")
    void shouldReportStoreFailure() throws Exception {
        when(requestQueue.submit(any())).thenThrow(new StorageException("down"));

        mockMvc.perform(post("/api/queue/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://api.close.com/api/v1/lead/\"}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("Should return a finished result and 404 for unknown ids")
    void shouldReturnResult() throws Exception {
        when(requestQueue.findResult("done")).thenReturn(Optional.of(RequestResult.builder()
                .id("done")
                .status(RequestResult.Status.COMPLETED)
                .value(TextNode.valueOf("ok"))
                .attempts(1)
                .build()));
        when(requestQueue.findResult("unknown")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/queue/requests/done"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.value").value("ok"))
                .andExpect(jsonPath("$.success").doesNotExist());

        mockMvc.perform(get("/api/queue/requests/unknown"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should report queue status")
    void shouldReportStatus() throws Exception {
        when(requestQueue.status()).thenReturn(QueueStatus.builder()
                .queueName("close_api")
                .queued(3)
                .processing(1)
                .running(true)
                .build());

        mockMvc.perform(get("/api/queue/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queueName").value("close_api"))
                .andExpect(jsonPath("$.queued").value(3))
                .andExpect(jsonPath("$.running").value(true));
    }
}
