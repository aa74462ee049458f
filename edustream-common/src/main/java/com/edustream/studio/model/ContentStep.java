package com.edustream.studio.model;

public record ContentStep(String text, String highlight) {
}
