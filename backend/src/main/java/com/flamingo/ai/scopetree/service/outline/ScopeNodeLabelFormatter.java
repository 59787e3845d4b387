package com.flamingo.ai.scopetree.service.outline;

import com.flamingo.ai.scopetree.domain.enums.CollapseKind;
import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.domain.model.ScopeNodeMeta;
import com.flamingo.ai.scopetree.domain.model.SourceRange;
import org.springframework.stereotype.Component;

/**
 * Derives the human-facing label of a node for outlines. The node's own {@code label} is never
 * changed.
 */
@Component
public class ScopeNodeLabelFormatter {

  static final String COLLAPSED_ARROW = "() => { ... }";

  public String format(ScopeNode node) {
    String label = node.getLabel() == null ? "" : node.getLabel();
    String display =
        switch (node.getCategory()) {
          case MODULE -> "module " + label;
          case CLASS -> "class " + label;
          case REACT_COMPONENT -> "<" + label + ">";
          case FUNCTION -> label + "()";
          case ARROW_FUNCTION -> arrowLabel(node, label);
          case BLOCK -> "Block".equals(label) ? "{ Block }" : label;
          case TYPE_ALIAS -> "type " + label;
          case INTERFACE -> "interface " + label;
          case LITERAL -> literalLabel(node, label);
          case SYNTHETIC_GROUP -> label + " (" + node.getChildren().size() + ")";
          default -> label.isEmpty() ? node.getCategory().getDisplayName() : label;
        };
    if (node.getCategory() == NodeCategory.SYNTHETIC_GROUP
        || node.getCategory() == NodeCategory.PROGRAM
        || node.getLoc() == null) {
      return display;
    }
    return display + " " + lineSuffix(node.getLoc());
  }

  private static String arrowLabel(ScopeNode node, String label) {
    ScopeNodeMeta meta = node.getMeta();
    if (meta != null && meta.getCollapsed() == CollapseKind.ARROW_FUNCTION) {
      return meta.getCall() != null ? "() => " + meta.getCall() : COLLAPSED_ARROW;
    }
    return label.isEmpty() ? "Arrow Function" : label;
  }

  /** String literals are shown quoted even when the label holds the bare text. */
  private static String literalLabel(ScopeNode node, String label) {
    String source = node.getSource() == null ? "" : node.getSource();
    boolean stringLiteral =
        source.startsWith("'") || source.startsWith("\"") || source.startsWith("`");
    if (!stringLiteral || isQuoted(label)) {
      return label;
    }
    return "'" + label + "'";
  }

  private static boolean isQuoted(String label) {
    if (label.length() < 2) {
      return false;
    }
    char first = label.charAt(0);
    return (first == '\'' || first == '"' || first == '`')
        && label.charAt(label.length() - 1) == first;
  }

  private static String lineSuffix(SourceRange loc) {
    int start = loc.start().line();
    int end = loc.end().line();
    return start == end ? "[" + start + "]" : "[" + start + "-" + end + "]";
  }
}
