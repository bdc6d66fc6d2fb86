package com.mediasync.mediaserver;

import com.mediasync.mediaserver.client.LibrarySection;
import com.mediasync.mediaserver.client.MediaServerClient;
import com.mediasync.mediaserver.endpoint.MediaServerEndpoint;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "media-server.refresh.interval-ms=3600000",
        "media-server.kafka.enabled=false",
        "media-server.endpoints[0].name=local",
        "media-server.endpoints[0].host=media.test",
        "media-server.endpoints[0].port=32400",
        "media-server.endpoints[0].auth-token=tok"
})
@AutoConfigureMockMvc
class MediaServerServiceApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MediaServerClient client;

    @Test
    void repeatedNotificationsCoalesceIntoOneRefresh() throws Exception {
        when(client.getShowSections(any(MediaServerEndpoint.class)))
                .thenReturn(List.of(new LibrarySection("2", "TV", List.of("/tv"))));

        String body = "{\"seriesId\":5,\"title\":\"Show\",\"path\":\"/tv/Show\"}";
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/internal/notifications/download")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isAccepted());
        }

        mockMvc.perform(get("/api/v1/endpoints"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].key").value("media.test:32400"))
                .andExpect(jsonPath("$[0].pending").value(1));

        mockMvc.perform(post("/api/v1/endpoints/local/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DRAINED"))
                .andExpect(jsonPath("$.batches").value(1))
                .andExpect(jsonPath("$.items").value(1));

        verify(client, times(1)).refreshPath(any(MediaServerEndpoint.class), eq("2"), eq("/tv/Show"));

        mockMvc.perform(post("/api/v1/endpoints/local/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DRAINED"))
                .andExpect(jsonPath("$.batches").value(0));
    }
}
