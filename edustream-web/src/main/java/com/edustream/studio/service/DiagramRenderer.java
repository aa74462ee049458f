package com.edustream.studio.service;

import java.util.List;

/**
 * Turns a script's diagram description into an image artifact.
 */
public interface DiagramRenderer {

    /**
     * Renders the diagram and stores it.
     *
     * @param options       lettered answer options to draw, or {@code null} for formats without options
     * @param correctAnswer the correct letter; renderers must not reveal it in the image
     * @return the storage reference of the rendered image
     */
    String renderFromDescription(String title, String description, List<String> options, String correctAnswer);
}
