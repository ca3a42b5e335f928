package com.adlanda.mediphant.controller;

import com.adlanda.mediphant.history.BoundedHistoryLog;
import com.adlanda.mediphant.model.HistoryItem;
import com.adlanda.mediphant.model.HistoryRecordRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for the recent interaction-check history.
 */
@RestController
@RequestMapping("/api/history")
public class HistoryController {

    private final BoundedHistoryLog historyLog;

    public HistoryController(BoundedHistoryLog historyLog) {
        this.historyLog = historyLog;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list() {
        return ResponseEntity.ok(Map.of("history", historyLog.list()));
    }

    /**
     * Records a completed interaction check. Called by the interaction checker.
     */
    @PostMapping
    public ResponseEntity<HistoryItem> record(@Valid @RequestBody HistoryRecordRequest request) {
        HistoryItem item = historyLog.record(
                request.medA().trim(), request.medB().trim(), request.risky(), request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(item);
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clear() {
        historyLog.clear();
        return ResponseEntity.ok(Map.of("message", "History cleared successfully"));
    }
}
