package com.edustream.studio.endpoint;

import com.edustream.studio.dto.PlatformStatus;
import com.edustream.studio.dto.PublishRequest;
import com.edustream.studio.dto.PublishResponse;
import com.edustream.studio.dto.QueueAllResponse;
import com.edustream.studio.dto.QueueResponse;
import com.edustream.studio.dto.QueueStatus;
import com.edustream.studio.exception.GlobalExceptionHandler;
import com.edustream.studio.exception.PublishFailedException;
import com.edustream.studio.model.ScheduleStatus;
import com.edustream.studio.service.PublishService;
import com.edustream.studio.service.SchedulePlannerService;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class PublishControllerTest {

    private MockMvc mockMvc;

    @Mock
    private PublishService publishService;

    @Mock
    private SchedulePlannerService schedulePlannerService;

    @InjectMocks
    private PublishController publishController;

    @BeforeEach
    public void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(publishController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json()
                        .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS).build()))
                .build();
    }

    @Test
    public void testGetPlatforms() throws Exception {
        Mockito.when(publishService.platforms()).thenReturn(List.of(
                new PlatformStatus("twitter", true, "Twitter/X"),
                new PlatformStatus("youtube", false, "YouTube Shorts")));

        mockMvc.perform(get("/api/publish/platforms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].platform").value("twitter"))
                .andExpect(jsonPath("$[0].configured").value(true))
                .andExpect(jsonPath("$[1].configured").value(false));
    }

    @Test
    public void testPublish() throws Exception {
        Mockito.when(publishService.publishNow(any(PublishRequest.class))).thenReturn(new PublishResponse(
                true, "twitter", "https://twitter.com/i/web/status/1", "1", "Successfully published to Twitter/X!"));

        mockMvc.perform(post("/api/publish/publish")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_id\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.post_id").value("1"));
    }

    @Test
    public void testPublishWithoutContentId() throws Exception {
        mockMvc.perform(post("/api/publish/publish")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platform\": \"twitter\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Content id is required"));
    }

    @Test
    public void testPublishFailureIsServerError() throws Exception {
        Mockito.when(publishService.publishNow(any(PublishRequest.class)))
                .thenThrow(new PublishFailedException("Failed to publish to Twitter/X: 403", null));

        mockMvc.perform(post("/api/publish/publish")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_id\": 3}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Failed to publish to Twitter/X: 403"));
    }

    @Test
    public void testQueue() throws Exception {
        LocalDateTime at = LocalDateTime.of(2026, 3, 1, 14, 0);
        Mockito.when(schedulePlannerService.queue(3L, "twitter", at))
                .thenReturn(new QueueResponse("Queued for publishing at " + at, 8L, at, "msg-1"));

        mockMvc.perform(post("/api/publish/queue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_id\": 3, \"scheduled_at\": \"2026-03-01T14:00:00\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.schedule_id").value(8))
                .andExpect(jsonPath("$.sqs_message_id").value("msg-1"))
                .andExpect(jsonPath("$.scheduled_at").value("2026-03-01T14:00:00"));
    }

    @Test
    public void testQueueContentNotReady() throws Exception {
        Mockito.when(schedulePlannerService.queue(eq(3L), eq("twitter"), isNull()))
                .thenThrow(new IllegalStateException("Content is not ready for queuing. Status: generating"));

        mockMvc.perform(post("/api/publish/queue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_id\": 3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Content is not ready for queuing. Status: generating"));
    }

    @Test
    public void testQueueAll() throws Exception {
        Mockito.when(schedulePlannerService.queueAllReady())
                .thenReturn(new QueueAllResponse("Queued 3 items for publishing", 3));

        mockMvc.perform(post("/api/publish/queue-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queued_count").value(3));
    }

    @Test
    public void testQueueStatus() throws Exception {
        Mockito.when(schedulePlannerService.queueStatus()).thenReturn(new QueueStatus(List.of(
                new QueueStatus.PendingItem(3L, 8L, LocalDateTime.of(2026, 3, 1, 14, 0), ScheduleStatus.PENDING)), 1));

        mockMvc.perform(get("/api/publish/queue-status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending_items[0].schedule_id").value(8))
                .andExpect(jsonPath("$.sqs_approximate_count").value(1));
    }
}
