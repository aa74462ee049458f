package com.edustream.studio.service;

import com.edustream.studio.dto.PublishJob;
import com.edustream.studio.dto.ReceivedJob;
import com.edustream.studio.util.AwsCredentials;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class SqsPublishQueue implements PublishQueue {

    /** SQS refuses DelaySeconds above 15 minutes. */
    static final long MAX_DELAY_SECONDS = 900;

    private final SqsClient sqsClient;
    private final String queueUrl;
    private final int waitSeconds;
    private final int visibilityTimeout;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Autowired
    public SqsPublishQueue(
            @Value("${app.queue.url:}") String queueUrl,
            @Value("${app.queue.endpoint:}") String endpoint,
            @Value("${app.aws.region:us-east-1}") String region,
            @Value("${app.aws.access-key:}") String accessKey,
            @Value("${app.aws.secret-key:}") String secretKey,
            @Value("${app.queue.wait-seconds:20}") int waitSeconds,
            @Value("${app.queue.visibility-timeout:300}") int visibilityTimeout,
            Clock clock) {
        this(buildClient(queueUrl, endpoint, region, accessKey, secretKey),
                queueUrl, waitSeconds, visibilityTimeout, clock);
    }

    SqsPublishQueue(SqsClient sqsClient, String queueUrl, int waitSeconds, int visibilityTimeout, Clock clock) {
        this.sqsClient = sqsClient;
        this.queueUrl = queueUrl;
        this.waitSeconds = waitSeconds;
        this.visibilityTimeout = visibilityTimeout;
        this.clock = clock;
    }

    private static SqsClient buildClient(String queueUrl, String endpoint, String region,
                                         String accessKey, String secretKey) {
        if (queueUrl == null || queueUrl.isBlank()) {
            log.warn("app.queue.url is not set, scheduled publishing is disabled");
            return null;
        }
        SqsClientBuilder builder = SqsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(AwsCredentials.provider(accessKey, secretKey));
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    @Override
    public boolean isConfigured() {
        return sqsClient != null;
    }

    @Override
    public String enqueue(PublishJob job) {
        requireConfigured();
        String body;
        try {
            body = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize publish job for content " + job.contentId(), e);
        }

        SendMessageResponse response = sqsClient.sendMessage(SendMessageRequest.builder()
                .queueUrl(queueUrl)
                .messageBody(body)
                .delaySeconds(delaySeconds(job.scheduledAt()))
                .build());
        log.info("Enqueued content {} (MessageId: {})", job.contentId(), response.messageId());
        return response.messageId();
    }

    /**
     * Native delay is only used when the target is inside the SQS window; later jobs are
     * delivered right away and held back by the worker's due check.
     */
    int delaySeconds(LocalDateTime scheduledAt) {
        if (scheduledAt == null) {
            return 0;
        }
        long gap = Duration.between(LocalDateTime.now(clock), scheduledAt).getSeconds();
        return gap > 0 && gap <= MAX_DELAY_SECONDS ? (int) gap : 0;
    }

    @Override
    public List<ReceivedJob> receive(int maxMessages) {
        requireConfigured();
        List<Message> messages = sqsClient.receiveMessage(ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(maxMessages)
                .waitTimeSeconds(waitSeconds)
                .visibilityTimeout(visibilityTimeout)
                .build()).messages();

        List<ReceivedJob> received = new ArrayList<>(messages.size());
        for (Message message : messages) {
            received.add(new ReceivedJob(message.receiptHandle(), message.messageId(), parse(message)));
        }
        return received;
    }

    private PublishJob parse(Message message) {
        try {
            PublishJob job = objectMapper.readValue(message.body(), PublishJob.class);
            if (job.contentId() == null) {
                log.error("Message {} has no content_id", message.messageId());
                return null;
            }
            return job;
        } catch (JsonProcessingException e) {
            log.error("Unreadable message {}: {}", message.messageId(), e.getOriginalMessage());
            return null;
        }
    }

    @Override
    public void delete(String receiptHandle) {
        requireConfigured();
        sqsClient.deleteMessage(DeleteMessageRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(receiptHandle)
                .build());
    }

    @Override
    public long approximateDepth() {
        requireConfigured();
        String count = sqsClient.getQueueAttributes(GetQueueAttributesRequest.builder()
                        .queueUrl(queueUrl)
                        .attributeNames(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES)
                        .build())
                .attributes()
                .get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES);
        return count != null ? Long.parseLong(count) : 0L;
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new IllegalStateException("Publish queue is not configured. Set app.queue.url");
        }
    }
}
