package com.edustream.studio.dto;

public record PlatformStatus(String platform, boolean configured, String name) {
}
