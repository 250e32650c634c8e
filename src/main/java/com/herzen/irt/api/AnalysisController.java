package com.herzen.irt.api;

import com.herzen.irt.jobs.JobModels.StatusRecord;
import com.herzen.irt.service.SessionAnalysisService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class AnalysisController {
    private final SessionAnalysisService sessionService;

    public AnalysisController(SessionAnalysisService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping("/analysis/{sessionId}")
    public ResponseEntity<?> analysis(@PathVariable String sessionId) {
        return sessionService.result(sessionId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.ACCEPTED).body(sessionService.status(sessionId)));
    }

    @GetMapping("/status/{sessionId}")
    public ResponseEntity<StatusRecord> status(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.status(sessionId));
    }

    @GetMapping("/export/csv/{sessionId}")
    public ResponseEntity<String> exportCsv(@PathVariable String sessionId) {
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=irt_analysis_" + sessionId + ".csv")
                .body(sessionService.exportCsv(sessionId));
    }

    @GetMapping("/export/json/{sessionId}")
    public ResponseEntity<String> exportJson(@PathVariable String sessionId) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=irt_analysis_" + sessionId + ".json")
                .body(sessionService.exportJson(sessionId));
    }
}
