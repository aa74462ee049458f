package com.edustream.studio.endpoint;

import com.edustream.studio.exception.GlobalExceptionHandler;
import com.edustream.studio.service.AppConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class SettingsControllerTest {

    private MockMvc mockMvc;

    @Mock
    private AppConfigService appConfigService;

    @InjectMocks
    private SettingsController settingsController;

    @BeforeEach
    public void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(settingsController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void testGetPublishInterval() throws Exception {
        Mockito.when(appConfigService.getPublishIntervalMinutes()).thenReturn(120);

        mockMvc.perform(get("/api/settings/publish-interval"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.minutes").value(120));
    }

    @Test
    public void testSetPublishInterval() throws Exception {
        mockMvc.perform(put("/api/settings/publish-interval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minutes\": 45}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.minutes").value(45));

        Mockito.verify(appConfigService).setPublishIntervalMinutes(45);
    }

    @Test
    public void testSetPublishIntervalRejectsZero() throws Exception {
        mockMvc.perform(put("/api/settings/publish-interval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minutes\": 0}"))
                .andExpect(status().isBadRequest());

        Mockito.verify(appConfigService, Mockito.never()).setPublishIntervalMinutes(anyInt());
    }
}
