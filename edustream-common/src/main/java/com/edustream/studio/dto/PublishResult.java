package com.edustream.studio.dto;

public record PublishResult(String postId, String url, String text) {
}
