package org.pokersight.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.pokersight.dto.AnalysisResult;
import org.pokersight.dto.TableSnapshot;
import org.pokersight.dto.TournamentSummaryDto;
import org.pokersight.service.poker.engine.AnalysisEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisEngine engine;

    @PostMapping("/{sessionId}/snapshots")
    public ResponseEntity<AnalysisResult> submit(@PathVariable String sessionId,
                                                 @Valid @RequestBody TableSnapshot snapshot) {
        return ResponseEntity.ok(engine.analyze(sessionId, snapshot));
    }

    @GetMapping("/{sessionId}/tournament")
    public ResponseEntity<TournamentSummaryDto> tournament(@PathVariable String sessionId) {
        TournamentSummaryDto summary = engine.tournament(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown session"));
        return ResponseEntity.ok(summary);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<?> close(@PathVariable String sessionId) {
        if (!engine.close(sessionId)) throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown session");
        return ResponseEntity.noContent().build();
    }
}
