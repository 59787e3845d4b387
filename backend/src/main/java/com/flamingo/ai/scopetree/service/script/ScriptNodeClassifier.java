package com.flamingo.ai.scopetree.service.script;

import static com.flamingo.ai.scopetree.service.script.ScriptSource.field;
import static com.flamingo.ai.scopetree.service.script.ScriptSource.firstNamedChild;
import static com.flamingo.ai.scopetree.service.script.ScriptSource.isType;
import static com.flamingo.ai.scopetree.service.script.ScriptSource.namedChildren;
import static com.flamingo.ai.scopetree.service.script.ScriptSource.parent;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import java.util.Set;
import org.treesitter.TSNode;

/**
 * Decides which tree-sitter nodes become scope tree nodes, and with which category.
 *
 * <p>Nodes without a category are walked transparently.
 */
final class ScriptNodeClassifier {

  static final Set<String> FUNCTION_TYPES =
      Set.of(
          "function_declaration",
          "generator_function_declaration",
          "function_expression",
          "function",
          "generator_function",
          "method_definition",
          "function_signature");

  static final Set<String> CLASS_TYPES =
      Set.of("class_declaration", "class", "abstract_class_declaration");

  static final Set<String> JSX_ELEMENT_TYPES =
      Set.of("jsx_element", "jsx_self_closing_element", "jsx_fragment");

  private static final Set<String> GENERIC_CONTROL_FLOW_TYPES =
      Set.of(
          "while_statement", "do_statement", "switch_statement", "switch_case", "switch_default");

  private static final Set<String> LITERAL_TYPES = Set.of("string", "number", "true", "false");

  private final ScriptSource source;

  ScriptNodeClassifier(ScriptSource source) {
    this.source = source;
  }

  /** Category for {@code node}, or {@code null} when it is not materialized. */
  NodeCategory categorize(TSNode node) {
    String type = node.getType();
    if (FUNCTION_TYPES.contains(type)) {
      return ReactConstructClassifier.classify(
          new ConstructShape(ConstructShape.Kind.FUNCTION, declaredName(node), returnsJsx(node)));
    }
    if ("arrow_function".equals(type)) {
      return ReactConstructClassifier.classify(
          new ConstructShape(
              ConstructShape.Kind.ARROW_FUNCTION, declaredName(node), returnsJsx(node)));
    }
    if (CLASS_TYPES.contains(type)) {
      return ReactConstructClassifier.classify(
          new ConstructShape(ConstructShape.Kind.CLASS, declaredName(node), rendersJsx(node)));
    }
    if ("call_expression".equals(type)) {
      return ReactConstructClassifier.classify(ConstructShape.call(calleeIdentifier(node)));
    }
    if ("jsx_element".equals(type) || "jsx_self_closing_element".equals(type)) {
      String tag = jsxTagName(node);
      if (tag.isEmpty()) {
        return NodeCategory.JSX;
      }
      return Character.isLowerCase(tag.charAt(0))
          ? NodeCategory.JSX_ELEMENT_DOM
          : NodeCategory.JSX_ELEMENT_CUSTOM;
    }
    if (GENERIC_CONTROL_FLOW_TYPES.contains(type)) {
      return NodeCategory.CONTROL_FLOW;
    }
    if (LITERAL_TYPES.contains(type)) {
      return NodeCategory.LITERAL;
    }
    return switch (type) {
      case "jsx_fragment" -> NodeCategory.JSX;
      case "internal_module", "module" -> NodeCategory.MODULE;
      case "statement_block" -> NodeCategory.BLOCK;
      case "variable_declarator" -> NodeCategory.VARIABLE;
      case "import_statement" -> NodeCategory.IMPORT;
      case "type_alias_declaration" -> NodeCategory.TYPE_ALIAS;
      case "interface_declaration" -> NodeCategory.INTERFACE;
      case "return_statement" -> NodeCategory.RETURN_STATEMENT;
      case "assignment_expression", "augmented_assignment_expression" -> NodeCategory.ASSIGNMENT;
      case "comment" -> NodeCategory.COMMENT;
      default -> null;
    };
  }

  /**
   * Own name of a declaration, or the name it is bound to by {@code const X = ...} or {@code X =
   * ...}.
   */
  String declaredName(TSNode node) {
    TSNode name = field(node, "name");
    if (name != null) {
      return source.text(name);
    }
    TSNode parent = parent(node);
    if (parent == null) {
      return null;
    }
    if (isType(parent, "variable_declarator") || isType(parent, "assignment_expression")) {
      TSNode binding = field(parent, isType(parent, "variable_declarator") ? "name" : "left");
      if (binding != null && isType(binding, "identifier")) {
        return source.text(binding);
      }
    }
    return null;
  }

  /** Identifier a call resolves to: the callee itself, or the property of a member callee. */
  String calleeIdentifier(TSNode call) {
    TSNode callee = field(call, "function");
    if (callee == null) {
      return null;
    }
    if (isType(callee, "member_expression")) {
      TSNode property = field(callee, "property");
      return property == null ? null : source.text(property);
    }
    return isType(callee, "identifier") ? source.text(callee) : null;
  }

  String jsxTagName(TSNode element) {
    TSNode tagHolder = element;
    if (isType(element, "jsx_element")) {
      tagHolder = field(element, "open_tag");
      if (tagHolder == null) {
        return "";
      }
    }
    TSNode name = field(tagHolder, "name");
    return name == null ? "" : source.text(name);
  }

  /** Whether a function-like body returns JSX, directly or from a top-level return. */
  static boolean returnsJsx(TSNode function) {
    TSNode body = field(function, "body");
    if (body == null) {
      return false;
    }
    if (!isType(body, "statement_block")) {
      return isJsx(body);
    }
    for (TSNode statement : namedChildren(body)) {
      if (isType(statement, "return_statement") && isJsx(firstNamedChild(statement))) {
        return true;
      }
    }
    return false;
  }

  /** Whether any method of a class returns JSX. */
  static boolean rendersJsx(TSNode classNode) {
    TSNode body = field(classNode, "body");
    if (body == null) {
      return false;
    }
    for (TSNode member : namedChildren(body)) {
      if (isType(member, "method_definition") && returnsJsx(member)) {
        return true;
      }
    }
    return false;
  }

  static boolean isJsx(TSNode expression) {
    TSNode current = expression;
    while (isType(current, "parenthesized_expression")) {
      current = firstNamedChild(current);
    }
    return current != null && JSX_ELEMENT_TYPES.contains(current.getType());
  }
}
