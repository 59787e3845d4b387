package com.flamingo.ai.scopetree.service.outline;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;

/**
 * One line of a rendered outline.
 *
 * @param id node id
 * @param depth distance from the root, which has depth 0
 * @param category node category
 * @param label display label from {@link ScopeNodeLabelFormatter}
 * @param value aggregated node value
 */
public record OutlineEntry(String id, int depth, NodeCategory category, String label, long value) {

  /** The label indented by two spaces per level. */
  public String indented() {
    return "  ".repeat(depth) + label;
  }
}
