package com.flamingo.ai.scopetree.service.support;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NodeIdRegistry Tests")
class NodeIdRegistryTest {

  @Test
  @DisplayName("should return the candidate the first time it is claimed")
  void shouldReturnCandidate_whenFresh() {
    NodeIdRegistry registry = new NodeIdRegistry();

    assertThat(registry.claim("a.ts:0-5")).isEqualTo("a.ts:0-5");
    assertThat(registry.collisions()).isZero();
  }

  @Test
  @DisplayName("should suffix repeated candidates so every id is unique")
  void shouldSuffix_whenCandidateRepeats() {
    NodeIdRegistry registry = new NodeIdRegistry();

    String first = registry.claim("a.ts:0-5");
    String second = registry.claim("a.ts:0-5");
    String third = registry.claim("a.ts:0-5");

    assertThat(first).isEqualTo("a.ts:0-5");
    assertThat(second).isEqualTo("a.ts:0-5#1");
    assertThat(third).isEqualTo("a.ts:0-5#2");
    assertThat(registry.collisions()).isEqualTo(2);
  }

  @Test
  @DisplayName("should not share ids between registries")
  void shouldBeIndependentPerRegistry() {
    new NodeIdRegistry().claim("x");

    assertThat(new NodeIdRegistry().claim("x")).isEqualTo("x");
  }
}
