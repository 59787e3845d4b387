package com.flamingo.ai.scopetree.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.scopetree.domain.enums.CollapseKind;
import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Category-specific payload attached to a {@link ScopeNode}.
 *
 * <p>Fields are grouped by the category family that sets them; unset fields stay {@code null} and
 * are left out of the serialized form. Use {@link #toBuilder()} to add fields to an existing meta.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScopeNodeMeta {

  // Conditional clauses and loops
  String condition;
  String loopKind;
  String initializer;
  String increment;
  String iterationVariable;
  String iterable;

  // Components and hooks
  String hookName;
  Boolean hookCall;
  List<String> props;

  // Flattening provenance
  CollapseKind collapsed;
  NodeCategory originalCategory;
  String call;

  // Synthetic groups
  Boolean syntheticGroup;
  Integer contains;
  List<NodeCategory> memberCategories;

  // Markup
  Integer depth;
  String lang;
  Boolean ordered;

  // Stylesheet
  String selector;
  String property;
  String propertyValue;
  String variableName;
  String variableValue;
  Boolean customProperty;
  String mixinName;
  String functionName;
  String parameters;
  String directive;
  String expression;
  String animationName;

  /** Returns a builder seeded from {@code meta}, or an empty one when it is {@code null}. */
  public static ScopeNodeMetaBuilder from(ScopeNodeMeta meta) {
    return meta == null ? builder() : meta.toBuilder();
  }
}
