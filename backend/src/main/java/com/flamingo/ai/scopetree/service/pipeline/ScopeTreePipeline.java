package com.flamingo.ai.scopetree.service.pipeline;

import com.flamingo.ai.scopetree.domain.enums.ValueMode;
import com.flamingo.ai.scopetree.domain.model.BuildOptions;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Post-processing applied to every raw tree: filtering, flattening, synthetic grouping, then value
 * aggregation. Aggregation always runs last so weights reflect the final shape.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScopeTreePipeline {

  private final NodeFilter nodeFilter;
  private final TreeFlattener treeFlattener;
  private final SyntheticGrouper syntheticGrouper;
  private final ValueAggregator valueAggregator;

  /** Builds a pipeline from fresh passes, for callers outside a Spring context. */
  public static ScopeTreePipeline standard() {
    return new ScopeTreePipeline(
        new NodeFilter(), new TreeFlattener(), new SyntheticGrouper(), new ValueAggregator());
  }

  /**
   * Processes {@code root} in place.
   *
   * @param root raw tree from a builder
   * @param fileText text the tree was built from
   * @param options build options
   * @param valueMode weighting used by the builder that produced the tree
   * @return the same root
   */
  public ScopeNode process(
      ScopeNode root, String fileText, BuildOptions options, ValueMode valueMode) {
    nodeFilter.filter(root, options);
    if (options.flattenTree()) {
      treeFlattener.flatten(root, options);
    }
    if (options.createSyntheticGroups()) {
      syntheticGrouper.group(root, fileText);
    }
    valueAggregator.aggregate(root, valueMode);
    log.debug("Post-processed {} ({} nodes)", root.getId(), root.countNodes());
    return root;
  }
}
