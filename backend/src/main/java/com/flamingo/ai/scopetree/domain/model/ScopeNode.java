package com.flamingo.ai.scopetree.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One syntactically meaningful region of a source file.
 *
 * <p>Builders and pipeline passes mutate nodes while a tree is being produced. Once the tree is
 * returned to a caller it is treated as an inert value.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "category", "label", "loc", "source", "value", "children", "meta"})
public class ScopeNode {

  private String id;
  private NodeCategory category;
  private String label;
  private SourceRange loc;
  private String source;

  @Builder.Default private long value = 1;

  @Builder.Default private List<ScopeNode> children = new ArrayList<>();

  @JsonInclude(JsonInclude.Include.NON_NULL)
  private ScopeNodeMeta meta;

  public void addChild(ScopeNode child) {
    children.add(child);
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  /** Counts this node and all of its descendants. */
  public int countNodes() {
    int count = 0;
    List<ScopeNode> stack = new ArrayList<>();
    stack.add(this);
    while (!stack.isEmpty()) {
      ScopeNode node = stack.remove(stack.size() - 1);
      count++;
      stack.addAll(node.children);
    }
    return count;
  }

  @Override
  public String toString() {
    return category.getDisplayName() + "(" + label + ")";
  }
}
