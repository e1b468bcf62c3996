package com.oracle.deepsearch.controller;

import com.oracle.deepsearch.core.Session;
import com.oracle.deepsearch.core.SessionState;
import com.oracle.deepsearch.model.ResearchRequest;
import com.oracle.deepsearch.model.ResearchResponse;
import com.oracle.deepsearch.model.SessionStatus;
import com.oracle.deepsearch.service.ResearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

    private final ResearchService researchService;

    @PostMapping
    public ResponseEntity<ResearchResponse> research(@Valid @RequestBody ResearchRequest request) {
        log.info("Received research request");
        ResearchResponse response = researchService.research(request);
        if (response.getState() == SessionState.ERROR && response.getRounds().isEmpty()
                && response.getResults() == null) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/sessions")
    public ResponseEntity<SessionStatus> startResearch(@Valid @RequestBody ResearchRequest request) {
        log.info("Received background research request");
        SessionStatus status = researchService.startResearch(request);
        if (status.getState() == SessionState.ERROR) {
            return ResponseEntity.badRequest().body(status);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(status);
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionStatus> status(@PathVariable String sessionId) {
        return researchService.getStatus(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/sessions/{sessionId}/results")
    public ResponseEntity<ResearchResponse> results(@PathVariable String sessionId,
                                                    @RequestParam(value = "verbose", defaultValue = "false") boolean verbose) {
        Optional<Session> session = researchService.getSession(sessionId);
        if (session.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        ResearchResponse response = researchService.toResponse(session.get(), verbose, null);
        if (!session.get().getState().isTerminal()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Spring AI Deep Search"
        ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(Map.of(
            "error", message,
            "type", "ValidationError"
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception e) {
        log.error("Unhandled exception: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of(
                "error", String.valueOf(e.getMessage()),
                "type", e.getClass().getSimpleName()
            ));
    }
}
