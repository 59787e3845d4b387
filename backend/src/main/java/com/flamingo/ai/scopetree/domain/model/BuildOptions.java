package com.flamingo.ai.scopetree.domain.model;

import lombok.Builder;

/**
 * Toggles that parameterize filtering and post-processing for one build.
 *
 * @param includeComments keep comment nodes
 * @param includeImports keep import nodes
 * @param includeTypes keep type alias and interface nodes
 * @param includeLiterals keep literal nodes
 * @param flattenTree run the flattening pass at all
 * @param flattenBlocks hoist and fold plain blocks
 * @param flattenArrowFunctions fold short arrow functions
 * @param createSyntheticGroups cluster adjacent imports and type definitions
 */
@Builder(toBuilder = true)
public record BuildOptions(
    boolean includeComments,
    boolean includeImports,
    boolean includeTypes,
    boolean includeLiterals,
    boolean flattenTree,
    boolean flattenBlocks,
    boolean flattenArrowFunctions,
    boolean createSyntheticGroups) {

  /** Options used when a caller supplies none. */
  public static BuildOptions defaults() {
    return new BuildOptions(false, true, true, false, true, true, true, true);
  }
}
