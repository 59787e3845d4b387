package com.flamingo.ai.scopetree.service.pipeline;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.Position;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.domain.model.SourceRange;
import java.util.ArrayList;
import java.util.List;

/** Hand-built trees for exercising single passes. */
final class PipelineTestTrees {

  private PipelineTestTrees() {}

  static ScopeNode root(ScopeNode... children) {
    return node("file.ts", NodeCategory.PROGRAM, "file.ts", 1, 1, children);
  }

  static ScopeNode node(
      String id,
      NodeCategory category,
      String label,
      int startLine,
      int endLine,
      ScopeNode... children) {
    return ScopeNode.builder()
        .id(id)
        .category(category)
        .label(label)
        .loc(new SourceRange(new Position(startLine, 0), new Position(endLine, 0)))
        .source("")
        .children(new ArrayList<>(List.of(children)))
        .build();
  }

  /** Leaf spanning one line from column 0 to {@code endColumn}. */
  static ScopeNode line(String id, NodeCategory category, String label, int line, int endColumn) {
    return ScopeNode.builder()
        .id(id)
        .category(category)
        .label(label)
        .loc(new SourceRange(new Position(line, 0), new Position(line, endColumn)))
        .source("")
        .build();
  }

  static ScopeNode leaf(String id, NodeCategory category, String label) {
    return node(id, category, label, 1, 1);
  }

  static List<String> ids(List<ScopeNode> nodes) {
    return nodes.stream().map(ScopeNode::getId).toList();
  }
}
