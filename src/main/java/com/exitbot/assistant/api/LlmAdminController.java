package com.exitbot.assistant.api;

import com.exitbot.assistant.cache.CacheStats;
import com.exitbot.assistant.resilience.CircuitStatus;
import com.exitbot.assistant.service.InterviewAssistantService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operational endpoints for the LLM layer.
 *
 * GET    /api/v1/llm/circuit/{provider}        breaker state and failure count
 * POST   /api/v1/llm/circuit/{provider}/reset  force the breaker CLOSED
 * GET    /api/v1/llm/cache/stats               hit/miss/eviction counters per provider
 * DELETE /api/v1/llm/cache                     drop all cached responses
 */
@RestController
@RequestMapping("/api/v1/llm")
@RequiredArgsConstructor
public class LlmAdminController {

    private final InterviewAssistantService assistantService;

    @GetMapping("/circuit/{provider}")
    public ResponseEntity<CircuitStatus> getCircuitStatus(@PathVariable String provider) {
        return ResponseEntity.ok(assistantService.getCircuitStatus(provider));
    }

    @PostMapping("/circuit/{provider}/reset")
    public ResponseEntity<CircuitStatus> resetCircuit(@PathVariable String provider) {
        assistantService.resetCircuit(provider);
        return ResponseEntity.ok(assistantService.getCircuitStatus(provider));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<List<CacheStats>> getCacheStats() {
        return ResponseEntity.ok(assistantService.cacheStats());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        assistantService.clearCache();
        return ResponseEntity.noContent().build();
    }
}
