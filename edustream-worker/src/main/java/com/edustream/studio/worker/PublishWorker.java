package com.edustream.studio.worker;

import com.edustream.studio.dto.PublishJob;
import com.edustream.studio.dto.PublishResult;
import com.edustream.studio.dto.ReceivedJob;
import com.edustream.studio.model.Platform;
import com.edustream.studio.service.PublishOutcomeService;
import com.edustream.studio.service.PublishOutcomeService.ScheduleState;
import com.edustream.studio.service.PublishQueue;
import com.edustream.studio.service.SocialPublisher;
import com.edustream.studio.service.SocialPublisherRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Long-polls the publish queue and posts each job once its scheduled time has come.
 * <p>
 * A job that is not yet due, or whose schedule record is not visible yet, is left on the queue
 * untouched and comes back after the visibility timeout. Every job that reached a terminal
 * outcome is deleted, whether it published, failed or could not be read. The loop runs on one
 * thread; stopping it lets the current message finish.
 */
@Service
@Slf4j
public class PublishWorker {

    private final PublishQueue publishQueue;
    private final PublishOutcomeService outcomeService;
    private final SocialPublisherRegistry publisherRegistry;
    private final Clock clock;
    private final int maxMessages;
    private final long errorBackoffMs;
    private final Duration missingScheduleGrace;

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "publish-worker"));
    private volatile boolean running;

    public PublishWorker(PublishQueue publishQueue,
                         PublishOutcomeService outcomeService,
                         SocialPublisherRegistry publisherRegistry,
                         Clock clock,
                         @Value("${app.worker.max-messages:1}") int maxMessages,
                         @Value("${app.worker.error-backoff-ms:5000}") long errorBackoffMs,
                         @Value("${app.worker.missing-schedule-grace-minutes:60}") long missingScheduleGraceMinutes) {
        this.publishQueue = publishQueue;
        this.outcomeService = outcomeService;
        this.publisherRegistry = publisherRegistry;
        this.clock = clock;
        this.maxMessages = maxMessages;
        this.errorBackoffMs = errorBackoffMs;
        this.missingScheduleGrace = Duration.ofMinutes(missingScheduleGraceMinutes);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!publishQueue.isConfigured()) {
            log.error("Publish queue is not configured. Set app.queue.url; worker not started");
            return;
        }
        if (!publisherRegistry.isConfigured(Platform.TWITTER)) {
            log.warn("Twitter is not configured. Publishing will fail");
        }
        running = true;
        executor.execute(this::pollLoop);
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping publish worker");
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Publish worker did not stop within 60s");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    public boolean isRunning() {
        return running;
    }

    void pollLoop() {
        log.info("Starting publish poll loop");
        while (running) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                log.error("Error in poll loop, backing off {} ms", errorBackoffMs, e);
                if (!backOff()) {
                    break;
                }
            } catch (Error e) {
                log.error("Publish poll loop stopped by a fatal error", e);
                running = false;
                throw e;
            }
        }
        log.info("Publish poll loop stopped");
    }

    /** Receives one batch and handles every message in it. */
    public int pollOnce() {
        List<ReceivedJob> messages = publishQueue.receive(maxMessages);
        for (ReceivedJob message : messages) {
            log.info("Received message {}", message.messageId());
            if (handle(message)) {
                publishQueue.delete(message.receiptHandle());
                log.info("Deleted message {}", message.messageId());
            }
        }
        return messages.size();
    }

    /**
     * @return whether the message is done with and should be deleted
     */
    boolean handle(ReceivedJob message) {
        if (!message.isReadable()) {
            log.warn("Message {} has an unreadable body, dropping it", message.messageId());
            return true;
        }
        PublishJob job = message.job();

        LocalDateTime now = LocalDateTime.now(clock);
        if (!job.isDue(now)) {
            log.info("Content {} scheduled for {} ({}s from now), skipping", job.contentId(), job.scheduledAt(),
                    Duration.between(now, job.scheduledAt()).toSeconds());
            return false;
        }

        ScheduleState scheduleState = outcomeService.scheduleState(job);
        if (scheduleState == ScheduleState.FINALIZED) {
            log.info("Schedule {} for content {} was already handled, dropping duplicate",
                    job.scheduleId(), job.contentId());
            return true;
        }
        if (scheduleState == ScheduleState.MISSING) {
            if (job.enqueuedAt() != null && job.enqueuedAt().plus(missingScheduleGrace).isBefore(now)) {
                log.warn("Schedule {} for content {} never appeared, dropping job enqueued at {}",
                        job.scheduleId(), job.contentId(), job.enqueuedAt());
                return true;
            }
            log.info("Schedule {} for content {} is not visible yet, leaving job on the queue",
                    job.scheduleId(), job.contentId());
            return false;
        }

        Optional<SocialPublisher> publisher = Platform.fromValue(job.platform()).flatMap(publisherRegistry::find);
        if (publisher.isEmpty()) {
            log.warn("Unsupported platform: {}", job.platform());
            outcomeService.recordFailure(job, "Unsupported platform: " + job.platform());
            return true;
        }

        log.info("Publishing content {} to {}", job.contentId(), job.platform());
        try {
            PublishResult result = publisher.get().postImage(job.imagePath(), job.caption(), null);
            log.info("Published content {}: {}", job.contentId(), result.url());
            outcomeService.recordSuccess(job, result);
        } catch (Exception e) {
            log.error("Failed to publish content {}", job.contentId(), e);
            outcomeService.recordFailure(job, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        return true;
    }

    private boolean backOff() {
        try {
            Thread.sleep(errorBackoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
