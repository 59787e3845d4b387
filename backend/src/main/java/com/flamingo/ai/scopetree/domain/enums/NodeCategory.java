package com.flamingo.ai.scopetree.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Closed set of categories a scope tree node can carry. */
public enum NodeCategory {
  /** Root of every tree. */
  PROGRAM("Program"),

  // Script grammar
  MODULE("Module"),
  CLASS("Class"),
  FUNCTION("Function"),
  ARROW_FUNCTION("ArrowFunction"),
  BLOCK("Block"),
  CONTROL_FLOW("ControlFlow"),
  CONDITIONAL_BLOCK("ConditionalBlock"),
  IF_CLAUSE("IfClause"),
  ELSE_IF_CLAUSE("ElseIfClause"),
  ELSE_CLAUSE("ElseClause"),
  VARIABLE("Variable"),
  CALL("Call"),
  REACT_COMPONENT("ReactComponent"),
  REACT_HOOK("ReactHook"),
  JSX("JSX"),
  JSX_ELEMENT_DOM("JSXElementDOM"),
  JSX_ELEMENT_CUSTOM("JSXElementCustom"),
  IMPORT("Import"),
  TYPE_ALIAS("TypeAlias"),
  INTERFACE("Interface"),
  RETURN_STATEMENT("ReturnStatement"),
  ASSIGNMENT("Assignment"),
  LITERAL("Literal"),
  COMMENT("Comment"),

  /** Engine-inserted cluster of adjacent siblings. */
  SYNTHETIC_GROUP("SyntheticGroup"),

  // Stylesheet grammar
  CSS_RULE("CssRule"),
  CSS_AT_RULE("CssAtRule"),
  CSS_MEDIA_QUERY("CssMediaQuery"),
  CSS_KEYFRAME_RULE("CssKeyframeRule"),
  CSS_MIXIN("CssMixin"),
  CSS_FUNCTION("CssFunction"),
  CSS_VARIABLE("CssVariable"),
  CSS_PROPERTY("CssProperty"),
  CSS_COMMENT("CssComment"),
  CSS_IMPORT("CssImport"),
  CSS_EXTEND("CssExtend"),
  CSS_INCLUDE("CssInclude"),
  CSS_CONTROL_DIRECTIVE("CssControlDirective"),
  CSS_BLOCK("CssBlock"),

  // Markup grammar
  MARKDOWN_HEADING("MarkdownHeading"),
  MARKDOWN_PARAGRAPH("MarkdownParagraph"),
  MARKDOWN_BLOCKQUOTE("MarkdownBlockquote"),
  MARKDOWN_CODE_BLOCK("MarkdownCodeBlock"),
  MARKDOWN_LIST("MarkdownList"),
  MARKDOWN_LIST_ITEM("MarkdownListItem"),
  MARKDOWN_TABLE("MarkdownTable"),
  MARKDOWN_IMAGE("MarkdownImage"),
  MARKDOWN_THEMATIC_BREAK("MarkdownThematicBreak"),

  OTHER("Other");

  private final String displayName;

  NodeCategory(String displayName) {
    this.displayName = displayName;
  }

  /** Name used in the serialized tree. */
  @JsonValue
  public String getDisplayName() {
    return displayName;
  }

  public boolean isComment() {
    return this == COMMENT || this == CSS_COMMENT;
  }

  public boolean isImport() {
    return this == IMPORT || this == CSS_IMPORT;
  }

  public boolean isTypeDefinition() {
    return this == TYPE_ALIAS || this == INTERFACE;
  }
}
