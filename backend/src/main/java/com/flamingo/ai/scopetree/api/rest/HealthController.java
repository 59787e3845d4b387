package com.flamingo.ai.scopetree.api.rest;

import com.flamingo.ai.scopetree.service.dispatch.ScopeTreeBuilderRouter;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final ScopeTreeBuilderRouter builderRouter;

  /** Returns liveness along with the registered builders in routing order. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "scope-tree");
    health.put("builders", builderRouter.builderNames());
    return ResponseEntity.ok(health);
  }
}
