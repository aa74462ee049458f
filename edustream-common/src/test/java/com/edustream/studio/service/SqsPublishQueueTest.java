package com.edustream.studio.service;

import com.edustream.studio.dto.PublishJob;
import com.edustream.studio.dto.ReceivedJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesResponse;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SqsPublishQueueTest {

    private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123/edustream-publish";
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Mock
    private SqsClient sqsClient;

    private SqsPublishQueue queue;

    @BeforeEach
    void setUp() {
        queue = new SqsPublishQueue(sqsClient, QUEUE_URL, 20, 300,
                Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    private static PublishJob job(LocalDateTime scheduledAt) {
        return new PublishJob(4L, 9L, "twitter", "caption", "diagram-4.png", scheduledAt, NOW);
    }

    @Test
    void delaySeconds_shouldOnlyUseNativeDelayInsideSqsWindow() {
        assertEquals(0, queue.delaySeconds(null));
        assertEquals(0, queue.delaySeconds(NOW.minusMinutes(3)));
        assertEquals(300, queue.delaySeconds(NOW.plusMinutes(5)));
        assertEquals(900, queue.delaySeconds(NOW.plusMinutes(15)));
        assertEquals(0, queue.delaySeconds(NOW.plusMinutes(16)));
    }

    @Test
    void enqueue_shouldSendSnakeCaseBodyWithDelay() {
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
                .thenReturn(SendMessageResponse.builder().messageId("msg-1").build());

        String messageId = queue.enqueue(job(NOW.plusMinutes(10)));

        assertEquals("msg-1", messageId);
        ArgumentCaptor<SendMessageRequest> request = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsClient).sendMessage(request.capture());
        assertEquals(QUEUE_URL, request.getValue().queueUrl());
        assertEquals(600, request.getValue().delaySeconds());
        String body = request.getValue().messageBody();
        assertTrue(body.contains("\"content_id\":4"), body);
        assertTrue(body.contains("\"schedule_id\":9"), body);
        assertTrue(body.contains("\"scheduled_at\":\"2026-03-01T10:10:00\""), body);
    }

    @Test
    void receive_shouldParseJobsAndFlagUnreadableBodies() {
        String body = "{\"content_id\": 4, \"schedule_id\": 9, \"platform\": \"twitter\", \"caption\": \"c\","
                + " \"image_path\": \"diagram-4.png\", \"scheduled_at\": \"2026-03-01T09:00:00\", \"extra\": 1}";
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class))).thenReturn(ReceiveMessageResponse.builder()
                .messages(
                        Message.builder().messageId("m1").receiptHandle("rh-1").body(body).build(),
                        Message.builder().messageId("m2").receiptHandle("rh-2").body("not json").build(),
                        Message.builder().messageId("m3").receiptHandle("rh-3").body("{\"platform\": \"twitter\"}").build())
                .build());

        List<ReceivedJob> received = queue.receive(10);

        assertEquals(3, received.size());
        PublishJob parsed = received.get(0).job();
        assertEquals(4L, parsed.contentId());
        assertEquals(9L, parsed.scheduleId());
        assertEquals(LocalDateTime.of(2026, 3, 1, 9, 0), parsed.scheduledAt());
        assertTrue(parsed.isDue(NOW));
        assertFalse(received.get(1).isReadable());
        assertFalse(received.get(2).isReadable());
        assertEquals("rh-2", received.get(1).receiptHandle());

        ArgumentCaptor<ReceiveMessageRequest> request = ArgumentCaptor.forClass(ReceiveMessageRequest.class);
        verify(sqsClient).receiveMessage(request.capture());
        assertEquals(10, request.getValue().maxNumberOfMessages());
        assertEquals(20, request.getValue().waitTimeSeconds());
        assertEquals(300, request.getValue().visibilityTimeout());
    }

    @Test
    void delete_shouldUseReceiptHandle() {
        queue.delete("rh-1");

        ArgumentCaptor<DeleteMessageRequest> request = ArgumentCaptor.forClass(DeleteMessageRequest.class);
        verify(sqsClient).deleteMessage(request.capture());
        assertEquals("rh-1", request.getValue().receiptHandle());
    }

    @Test
    void approximateDepth_shouldReadQueueAttribute() {
        when(sqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class))).thenReturn(
                GetQueueAttributesResponse.builder()
                        .attributes(Map.of(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES, "7"))
                        .build());

        assertEquals(7L, queue.approximateDepth());
    }

    @Test
    void enqueue_shouldFail_WhenNotConfigured() {
        SqsPublishQueue unconfigured = new SqsPublishQueue(null, "", 20, 300, Clock.systemUTC());

        assertFalse(unconfigured.isConfigured());
        assertThrows(IllegalStateException.class, () -> unconfigured.enqueue(job(NOW)));
    }
}
