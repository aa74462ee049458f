package com.edustream.studio.service;

import com.edustream.studio.model.Platform;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class SocialPublisherRegistry {

    private final Map<Platform, SocialPublisher> publishers = new EnumMap<>(Platform.class);

    public SocialPublisherRegistry(List<SocialPublisher> publishers) {
        publishers.forEach(p -> this.publishers.put(p.platform(), p));
    }

    public Optional<SocialPublisher> find(Platform platform) {
        return Optional.ofNullable(publishers.get(platform));
    }

    public boolean isSupported(Platform platform) {
        return publishers.containsKey(platform);
    }

    public boolean isConfigured(Platform platform) {
        return find(platform).map(SocialPublisher::isConfigured).orElse(false);
    }
}
