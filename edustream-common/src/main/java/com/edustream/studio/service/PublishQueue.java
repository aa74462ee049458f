package com.edustream.studio.service;

import com.edustream.studio.dto.PublishJob;
import com.edustream.studio.dto.ReceivedJob;

import java.util.List;

/**
 * Durable at-least-once channel for publish jobs. A received job stays hidden for the
 * visibility timeout and comes back unless it is deleted.
 */
public interface PublishQueue {

    boolean isConfigured();

    /** @return the transport's message id */
    String enqueue(PublishJob job);

    List<ReceivedJob> receive(int maxMessages);

    void delete(String receiptHandle);

    long approximateDepth();
}
