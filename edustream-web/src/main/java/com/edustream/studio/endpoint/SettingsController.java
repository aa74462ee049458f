package com.edustream.studio.endpoint;

import com.edustream.studio.dto.ApiResponse;
import com.edustream.studio.dto.PublishIntervalRequest;
import com.edustream.studio.service.AppConfigService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    private final AppConfigService appConfigService;

    public SettingsController(AppConfigService appConfigService) {
        this.appConfigService = appConfigService;
    }

    @GetMapping("/publish-interval")
    public ResponseEntity<Map<String, Integer>> getPublishInterval() {
        return ResponseEntity.ok(Map.of("minutes", appConfigService.getPublishIntervalMinutes()));
    }

    @PutMapping("/publish-interval")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> setPublishInterval(
            @Valid @RequestBody PublishIntervalRequest request) {
        appConfigService.setPublishIntervalMinutes(request.getMinutes());
        return ResponseEntity.ok(ApiResponse.ok("Publish interval updated",
                Map.of("minutes", request.getMinutes())));
    }
}
