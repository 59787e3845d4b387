package com.flamingo.ai.scopetree.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.scopetree.api.dto.request.BuildScopeTreeRequest;
import com.flamingo.ai.scopetree.api.rest.HealthController;
import com.flamingo.ai.scopetree.api.rest.ScopeTreeController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests that pin the public REST paths.
 *
 * <ul>
 *   <li>POST /api/scope-tree - Build a scope tree
 *   <li>POST /api/scope-tree/outline - Build an indented outline
 *   <li>GET /health - Liveness and registered builders
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("ScopeTreeController API contract")
  class ScopeTreeControllerContract {

    @Test
    @DisplayName("should be mapped to /api/scope-tree")
    void shouldBeMappedToApiScopeTree() {
      RequestMapping mapping = ScopeTreeController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/scope-tree");
    }

    @Test
    @DisplayName("should expose the outline under /outline")
    void shouldExposeOutline() throws NoSuchMethodException {
      PostMapping mapping =
          ScopeTreeController.class
              .getMethod("outline", BuildScopeTreeRequest.class)
              .getAnnotation(PostMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/outline");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
