package com.flamingo.ai.scopetree.service.support;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out tree-unique node ids for a single build.
 *
 * <p>One instance per call; never shared between builds.
 */
public final class NodeIdRegistry {

  private final Set<String> issued = new HashSet<>();
  private int collisions;

  /** Returns {@code candidate}, or {@code candidate#n} when it was already issued. */
  public String claim(String candidate) {
    String id = candidate;
    while (!issued.add(id)) {
      collisions++;
      id = candidate + "#" + collisions;
    }
    return id;
  }

  public int collisions() {
    return collisions;
  }
}
