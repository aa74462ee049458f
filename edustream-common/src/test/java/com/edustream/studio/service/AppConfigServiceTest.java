package com.edustream.studio.service;

import com.edustream.studio.model.AppSetting;
import com.edustream.studio.repository.AppSettingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AppConfigServiceTest {

    @Mock
    private AppSettingRepository appSettingRepository;

    private AppConfigService appConfigService;

    @BeforeEach
    void setUp() {
        appConfigService = new AppConfigService(appSettingRepository, 120);
    }

    @Test
    void getPublishIntervalMinutes_shouldReadStoredValue() {
        when(appSettingRepository.findById(AppConfigService.PUBLISH_INTERVAL_MINUTES))
                .thenReturn(Optional.of(new AppSetting(AppConfigService.PUBLISH_INTERVAL_MINUTES, " 45 ")));

        assertEquals(45, appConfigService.getPublishIntervalMinutes());
    }

    @Test
    void getPublishIntervalMinutes_shouldUseDefault_WhenMissingOrInvalid() {
        when(appSettingRepository.findById(AppConfigService.PUBLISH_INTERVAL_MINUTES))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(new AppSetting(AppConfigService.PUBLISH_INTERVAL_MINUTES, "soon")))
                .thenReturn(Optional.of(new AppSetting(AppConfigService.PUBLISH_INTERVAL_MINUTES, "0")));

        assertEquals(120, appConfigService.getPublishIntervalMinutes());
        assertEquals(120, appConfigService.getPublishIntervalMinutes());
        assertEquals(120, appConfigService.getPublishIntervalMinutes());
    }

    @Test
    void getPublishIntervalMinutes_shouldUseDefault_WhenStoreUnavailable() {
        when(appSettingRepository.findById(anyString())).thenThrow(new DataAccessResourceFailureException("down"));

        assertEquals(120, appConfigService.getPublishIntervalMinutes());
    }

    @Test
    void setPublishIntervalMinutes_shouldUpsertSetting() {
        appConfigService.setPublishIntervalMinutes(30);

        ArgumentCaptor<AppSetting> saved = ArgumentCaptor.forClass(AppSetting.class);
        verify(appSettingRepository).save(saved.capture());
        assertEquals(AppConfigService.PUBLISH_INTERVAL_MINUTES, saved.getValue().getKey());
        assertEquals("30", saved.getValue().getValue());
    }

    @Test
    void setPublishIntervalMinutes_shouldRejectNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> appConfigService.setPublishIntervalMinutes(0));
        verifyNoInteractions(appSettingRepository);
    }
}
