package com.edustream.studio.service;

import com.edustream.studio.model.AppSetting;
import com.edustream.studio.repository.AppSettingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runtime settings stored in {@code app_settings}. Values are read on every call so a change
 * affects the next planning decision without a restart.
 */
@Service
@Slf4j
public class AppConfigService {
    static final String PUBLISH_INTERVAL_MINUTES = "publish_interval_minutes";

    private final AppSettingRepository appSettingRepository;
    private final int defaultIntervalMinutes;

    public AppConfigService(AppSettingRepository appSettingRepository,
                            @Value("${app.publish.interval-minutes:120}") int defaultIntervalMinutes) {
        this.appSettingRepository = appSettingRepository;
        this.defaultIntervalMinutes = defaultIntervalMinutes;
    }

    public int getPublishIntervalMinutes() {
        try {
            var setting = appSettingRepository.findById(PUBLISH_INTERVAL_MINUTES);
            if (setting.isPresent()) {
                int value = Integer.parseInt(setting.get().getValue().trim());
                if (value > 0) {
                    return value;
                }
                log.warn("Ignoring non-positive publish interval {}", value);
            }
        } catch (Exception e) {
            log.warn("Failed to fetch publish interval, using default {}", defaultIntervalMinutes, e);
        }
        return defaultIntervalMinutes;
    }

    public void setPublishIntervalMinutes(int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Publish interval must be a positive number of minutes");
        }
        appSettingRepository.save(new AppSetting(PUBLISH_INTERVAL_MINUTES, String.valueOf(minutes)));
        log.info("Publish interval set to {} minutes", minutes);
    }
}
