package com.edustream.studio.dto;

/**
 * A message taken off the publish queue. {@code job} is null when the body could not be read.
 */
public record ReceivedJob(String receiptHandle, String messageId, PublishJob job) {
    public boolean isReadable() {
        return job != null;
    }
}
