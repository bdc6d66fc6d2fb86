package com.mediasync.mediaserver.api;

import com.mediasync.common.refresh.queue.CoalescingRefreshQueue;
import com.mediasync.common.refresh.queue.DrainResult;
import com.mediasync.mediaserver.application.LibraryRefreshScheduler;
import com.mediasync.mediaserver.application.LibraryUpdateService;
import com.mediasync.mediaserver.application.ValidationFailure;
import com.mediasync.mediaserver.client.MediaServerException;
import com.mediasync.mediaserver.domain.Series;
import com.mediasync.mediaserver.endpoint.EndpointRegistry;
import com.mediasync.mediaserver.endpoint.MediaServerEndpoint;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EndpointController.class)
class EndpointControllerTest {

    private static final MediaServerEndpoint DEN = new MediaServerEndpoint("den", "10.0.0.5", 32400, false, "",
            "tok", true, null, null);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EndpointRegistry endpoints;
    @MockBean
    private CoalescingRefreshQueue<MediaServerEndpoint, Series> queue;
    @MockBean
    private LibraryRefreshScheduler scheduler;
    @MockBean
    private LibraryUpdateService libraryUpdateService;

    @Test
    void listsEndpointsWithQueueState() throws Exception {
        when(endpoints.all()).thenReturn(List.of(DEN));
        when(queue.pendingCount(DEN)).thenReturn(2);
        when(queue.isDraining(DEN)).thenReturn(true);

        mockMvc.perform(get("/api/v1/endpoints"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("den"))
                .andExpect(jsonPath("$[0].key").value("10.0.0.5:32400"))
                .andExpect(jsonPath("$[0].baseUrl").value("http://10.0.0.5:32400"))
                .andExpect(jsonPath("$[0].pending").value(2))
                .andExpect(jsonPath("$[0].draining").value(true));
    }

    @Test
    void testReportsFailures() throws Exception {
        when(endpoints.find("den")).thenReturn(Optional.of(DEN));
        when(libraryUpdateService.test(DEN))
                .thenReturn(List.of(new ValidationFailure("authToken", "Authentication with the media server failed")));

        mockMvc.perform(post("/api/v1/endpoints/den/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.failures[0].field").value("authToken"));
    }

    @Test
    void testOfUnknownEndpointIsNotFound() throws Exception {
        when(endpoints.find("nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/endpoints/nope/test"))
                .andExpect(status().isNotFound());
        verifyNoInteractions(libraryUpdateService);
    }

    @Test
    void refreshDrainsQueue() throws Exception {
        when(endpoints.find("den")).thenReturn(Optional.of(DEN));
        when(scheduler.processQueue(DEN)).thenReturn(DrainResult.drained(1, 2, 0));

        mockMvc.perform(post("/api/v1/endpoints/den/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DRAINED"))
                .andExpect(jsonPath("$.batches").value(1))
                .andExpect(jsonPath("$.items").value(2));
    }

    @Test
    void refreshFailureIsBadGateway() throws Exception {
        when(endpoints.find("den")).thenReturn(Optional.of(DEN));
        when(scheduler.processQueue(DEN)).thenThrow(new MediaServerException("media server request failed"));

        mockMvc.perform(post("/api/v1/endpoints/den/refresh"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("media_server_error"));
    }
}
