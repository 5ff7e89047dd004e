package com.codeforge.orchestrator.api;

import com.codeforge.orchestrator.resilience.BreakerSnapshot;
import com.codeforge.orchestrator.resilience.CircuitBreakerRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * GET  /breakers                  : state of every provider breaker
 * POST /breakers/{provider}/reset : force a breaker closed
 */
@RestController
@RequestMapping("/breakers")
public class BreakerController {

    private final CircuitBreakerRegistry breakers;

    public BreakerController(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @GetMapping
    public Map<String, BreakerSnapshot> list() {
        return breakers.snapshot();
    }

    @PostMapping("/{provider}/reset")
    public ResponseEntity<Void> reset(@PathVariable String provider) {
        return breakers.reset(provider)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
