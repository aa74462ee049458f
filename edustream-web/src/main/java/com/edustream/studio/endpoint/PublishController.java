package com.edustream.studio.endpoint;

import com.edustream.studio.dto.PlatformStatus;
import com.edustream.studio.dto.PublishHistoryEntry;
import com.edustream.studio.dto.PublishRequest;
import com.edustream.studio.dto.PublishResponse;
import com.edustream.studio.dto.QueueAllResponse;
import com.edustream.studio.dto.QueueRequest;
import com.edustream.studio.dto.QueueResponse;
import com.edustream.studio.dto.QueueStatus;
import com.edustream.studio.service.PublishService;
import com.edustream.studio.service.SchedulePlannerService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/publish")
public class PublishController {

    private final PublishService publishService;
    private final SchedulePlannerService schedulePlannerService;

    public PublishController(PublishService publishService, SchedulePlannerService schedulePlannerService) {
        this.publishService = publishService;
        this.schedulePlannerService = schedulePlannerService;
    }

    @GetMapping("/platforms")
    public ResponseEntity<List<PlatformStatus>> getPlatforms() {
        return ResponseEntity.ok(publishService.platforms());
    }

    @PostMapping("/publish")
    public ResponseEntity<PublishResponse> publish(@Valid @RequestBody PublishRequest request) {
        return ResponseEntity.ok(publishService.publishNow(request));
    }

    @GetMapping("/history/{contentId}")
    public ResponseEntity<List<PublishHistoryEntry>> getHistory(@PathVariable Long contentId) {
        return ResponseEntity.ok(publishService.history(contentId));
    }

    @PostMapping("/queue")
    public ResponseEntity<QueueResponse> queue(@Valid @RequestBody QueueRequest request) {
        return ResponseEntity.ok(schedulePlannerService.queue(
                request.getContentId(), request.getPlatform(), request.getScheduledAt()));
    }

    @PostMapping("/queue-all")
    public ResponseEntity<QueueAllResponse> queueAll() {
        return ResponseEntity.ok(schedulePlannerService.queueAllReady());
    }

    @GetMapping("/queue-status")
    public ResponseEntity<QueueStatus> getQueueStatus() {
        return ResponseEntity.ok(schedulePlannerService.queueStatus());
    }
}
