package com.flamingo.ai.scopetree.api.dto.request;

import com.flamingo.ai.scopetree.domain.model.BuildOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-request build option overrides; {@code null} fields keep the configured default. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildOptionsRequest {

  private Boolean includeComments;
  private Boolean includeImports;
  private Boolean includeTypes;
  private Boolean includeLiterals;
  private Boolean flattenTree;
  private Boolean flattenBlocks;
  private Boolean flattenArrowFunctions;
  private Boolean createSyntheticGroups;

  /** Overlays the fields set on this request onto {@code defaults}. */
  public BuildOptions applyTo(BuildOptions defaults) {
    return new BuildOptions(
        or(includeComments, defaults.includeComments()),
        or(includeImports, defaults.includeImports()),
        or(includeTypes, defaults.includeTypes()),
        or(includeLiterals, defaults.includeLiterals()),
        or(flattenTree, defaults.flattenTree()),
        or(flattenBlocks, defaults.flattenBlocks()),
        or(flattenArrowFunctions, defaults.flattenArrowFunctions()),
        or(createSyntheticGroups, defaults.createSyntheticGroups()));
  }

  private static boolean or(Boolean override, boolean fallback) {
    return override != null ? override : fallback;
  }
}
