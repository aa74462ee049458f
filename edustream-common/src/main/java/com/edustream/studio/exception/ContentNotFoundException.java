package com.edustream.studio.exception;

public class ContentNotFoundException extends RuntimeException {
    public ContentNotFoundException(Long contentId) {
        super("Content not found: " + contentId);
    }
}
