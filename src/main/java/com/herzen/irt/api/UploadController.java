package com.herzen.irt.api;

import com.herzen.irt.jobs.JobModels.UploadResponse;
import com.herzen.irt.service.SessionAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api")
public class UploadController {
    private final SessionAnalysisService sessionService;

    public UploadController(SessionAnalysisService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping("/upload")
    public ResponseEntity<UploadResponse> upload(@RequestParam("file") MultipartFile file) throws IOException {
        String content = new String(file.getBytes(), StandardCharsets.UTF_8);
        return ResponseEntity.ok(sessionService.upload(file.getOriginalFilename(), content));
    }
}
