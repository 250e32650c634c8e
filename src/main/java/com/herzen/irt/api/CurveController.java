package com.herzen.irt.api;

import com.herzen.irt.analysis.AnalysisModels;
import com.herzen.irt.service.SessionAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class CurveController {
    private final SessionAnalysisService sessionService;

    public CurveController(SessionAnalysisService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping("/icc/{sessionId}")
    public ResponseEntity<AnalysisModels.ResponseCurveResponse> icc(@PathVariable String sessionId,
                                                                    @RequestParam(name = "item_id", required = false) String itemId) {
        return ResponseEntity.ok(sessionService.itemCurve(sessionId, itemId));
    }

    @GetMapping("/iif/{sessionId}")
    public ResponseEntity<AnalysisModels.ItemInformationResponse> iif(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.itemInformation(sessionId));
    }

    @GetMapping("/tif/{sessionId}")
    public ResponseEntity<AnalysisModels.TestInformationResponse> tif(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.testInformation(sessionId));
    }
}
