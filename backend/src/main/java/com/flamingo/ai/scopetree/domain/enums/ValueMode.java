package com.flamingo.ai.scopetree.domain.enums;

/**
 * How node weights are aggregated for a tree.
 *
 * <p>Script and stylesheet trees use different parent formulas. Changing either one changes the
 * relative node areas a treemap renders, so they are kept apart per builder.
 */
public enum ValueMode {
  /** Leaf = 1, parent = 1 + sum of children. */
  SELF_PLUS_CHILDREN,

  /** Leaf = 1, parent = sum of children. */
  CHILDREN_ONLY,

  /** Weights already carry aggregated text length; the pipeline leaves them untouched. */
  SOURCE_LENGTH
}
