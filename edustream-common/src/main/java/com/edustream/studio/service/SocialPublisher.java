package com.edustream.studio.service;

import com.edustream.studio.dto.PublishResult;
import com.edustream.studio.model.Platform;

import java.util.List;

/**
 * Transport to one social platform. Any failure (auth, network, rate limit, missing image)
 * is thrown; callers treat every kind the same way.
 */
public interface SocialPublisher {

    Platform platform();

    boolean isConfigured();

    PublishResult postImage(String imagePath, String caption, List<String> hashtags);
}
