package com.edustream.studio.endpoint;

import com.edustream.studio.dto.BatchGenerateRequest;
import com.edustream.studio.dto.GenerateRequest;
import com.edustream.studio.dto.GenerateResponse;
import com.edustream.studio.dto.GenerationStatus;
import com.edustream.studio.service.GenerationService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/generate")
public class GenerateController {

    private final GenerationService generationService;

    public GenerateController(GenerationService generationService) {
        this.generationService = generationService;
    }

    @PostMapping("/single")
    public ResponseEntity<GenerateResponse> generateSingle(@Valid @RequestBody GenerateRequest request) {
        return ResponseEntity.ok(generationService.submit(request));
    }

    @PostMapping("/batch")
    public ResponseEntity<List<GenerateResponse>> generateBatch(@Valid @RequestBody BatchGenerateRequest request) {
        return ResponseEntity.ok(generationService.submitBatch(request.getTopics()));
    }

    @GetMapping("/status/{contentId}")
    public ResponseEntity<GenerationStatus> getStatus(@PathVariable Long contentId) {
        return ResponseEntity.ok(generationService.status(contentId));
    }
}
