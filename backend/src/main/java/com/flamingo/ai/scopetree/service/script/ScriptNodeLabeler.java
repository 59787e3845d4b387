package com.flamingo.ai.scopetree.service.script;

import static com.flamingo.ai.scopetree.service.script.ScriptSource.anonymousToken;
import static com.flamingo.ai.scopetree.service.script.ScriptSource.field;
import static com.flamingo.ai.scopetree.service.script.ScriptSource.firstNamedChild;
import static com.flamingo.ai.scopetree.service.script.ScriptSource.isType;
import static com.flamingo.ai.scopetree.service.script.ScriptSource.namedChildren;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.ScopeNodeMeta;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import java.util.ArrayList;
import java.util.List;
import org.treesitter.TSNode;

/** Display labels and meta payloads for script nodes. */
final class ScriptNodeLabeler {

  static final String ARROW_FUNCTION_LABEL = "() => {}";

  private static final int CALLEE_MAX = 50;
  private static final int RETURN_EXPRESSION_MAX = 30;

  private final ScriptSource source;
  private final ScriptNodeClassifier classifier;

  ScriptNodeLabeler(ScriptSource source, ScriptNodeClassifier classifier) {
    this.source = source;
    this.classifier = classifier;
  }

  String label(TSNode node, NodeCategory category) {
    String type = node.getType();
    return switch (category) {
      case FUNCTION, ARROW_FUNCTION, REACT_COMPONENT, REACT_HOOK ->
          "call_expression".equals(type) ? calleeLabel(node) : functionLabel(node, category);
      case CLASS -> orDefault(classifier.declaredName(node), "class");
      case MODULE -> unquote(source.text(field(node, "name")));
      case BLOCK -> "Block";
      case VARIABLE -> source.text(field(node, "name"));
      case CALL -> calleeLabel(node);
      case JSX_ELEMENT_DOM, JSX_ELEMENT_CUSTOM, JSX -> "<" + classifier.jsxTagName(node) + ">";
      case IMPORT -> importLabel(node);
      case TYPE_ALIAS, INTERFACE -> source.text(field(node, "name"));
      case RETURN_STATEMENT -> returnLabel(node);
      case ASSIGNMENT -> assignmentLabel(node);
      case CONTROL_FLOW -> controlFlowLabel(node);
      case LITERAL -> source.text(node);
      case COMMENT ->
          ScopeNodes.truncateWithin(ScopeNodes.firstLine(source.text(node)), CALLEE_MAX);
      default -> type;
    };
  }

  ScopeNodeMeta meta(TSNode node, NodeCategory category) {
    String type = node.getType();
    if (category == NodeCategory.REACT_HOOK) {
      if ("call_expression".equals(type)) {
        return ScopeNodeMeta.builder()
            .hookName(classifier.calleeIdentifier(node))
            .hookCall(Boolean.TRUE)
            .build();
      }
      return ScopeNodeMeta.builder().hookName(classifier.declaredName(node)).build();
    }
    if (category == NodeCategory.REACT_COMPONENT) {
      return ScopeNodeMeta.builder().props(parameterNames(node)).build();
    }
    if (category == NodeCategory.VARIABLE) {
      TSNode value = field(node, "value");
      return value == null ? null : ScopeNodeMeta.builder().initializer(source.text(value)).build();
    }
    return null;
  }

  private String functionLabel(TSNode node, NodeCategory category) {
    String name = classifier.declaredName(node);
    if ("arrow_function".equals(node.getType())) {
      if (category == NodeCategory.ARROW_FUNCTION || name == null) {
        return ARROW_FUNCTION_LABEL;
      }
      return name;
    }
    return orDefault(name, "function");
  }

  private String calleeLabel(TSNode call) {
    String callee = ScopeNodes.firstLine(source.text(field(call, "function")));
    return ScopeNodes.truncateWithin(callee, CALLEE_MAX);
  }

  private String importLabel(TSNode node) {
    TSNode specifier = field(node, "source");
    if (specifier == null) {
      specifier = findString(node);
    }
    if (specifier == null) {
      return "Import";
    }
    return ScopeNodes.basename(unquote(source.text(specifier)));
  }

  private TSNode findString(TSNode node) {
    for (TSNode child : namedChildren(node)) {
      if (isType(child, "string")) {
        return child;
      }
      TSNode nested = findString(child);
      if (nested != null) {
        return nested;
      }
    }
    return null;
  }

  private String returnLabel(TSNode node) {
    TSNode expression = firstNamedChild(node);
    if (expression == null) {
      return "return";
    }
    return "return " + ScopeNodes.truncate(source.text(expression), RETURN_EXPRESSION_MAX);
  }

  private String assignmentLabel(TSNode node) {
    TSNode operatorNode = field(node, "operator");
    String operator = operatorNode != null ? source.text(operatorNode) : "=";
    return source.text(field(node, "left"))
        + " "
        + operator
        + " "
        + source.text(field(node, "right"));
  }

  private String controlFlowLabel(TSNode node) {
    return switch (node.getType()) {
      case "while_statement" -> "while";
      case "do_statement" -> "do";
      case "switch_statement" -> "switch";
      case "switch_case" -> {
        TSNode value = field(node, "value");
        yield value == null ? "case" : "case " + source.text(value);
      }
      case "switch_default" -> "default";
      default -> node.getType();
    };
  }

  private List<String> parameterNames(TSNode node) {
    List<String> names = new ArrayList<>();
    TSNode single = field(node, "parameter");
    if (single != null) {
      names.add(source.text(single));
      return names;
    }
    TSNode parameters = field(node, "parameters");
    if (parameters == null) {
      return names;
    }
    for (TSNode parameter : namedChildren(parameters)) {
      if (isType(parameter, "comment")) {
        continue;
      }
      TSNode pattern = field(parameter, "pattern");
      if (pattern == null && isType(parameter, "assignment_pattern")) {
        pattern = field(parameter, "left");
      }
      names.add(source.text(pattern != null ? pattern : parameter));
    }
    return names;
  }

  /** Operator token of a for-in/of header, read from the field or from the anonymous token. */
  static String iterationOperator(TSNode loop, ScriptSource source) {
    TSNode operator = field(loop, "operator");
    if (operator != null) {
      return source.text(operator);
    }
    String token = anonymousToken(loop, "of", "in");
    return token != null ? token : "of";
  }

  static String unquote(String text) {
    String trimmed = text.trim();
    if (trimmed.length() >= 2) {
      char first = trimmed.charAt(0);
      char last = trimmed.charAt(trimmed.length() - 1);
      if ((first == '\'' || first == '"' || first == '`') && first == last) {
        return trimmed.substring(1, trimmed.length() - 1);
      }
    }
    return trimmed;
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isEmpty() ? fallback : value;
  }
}
