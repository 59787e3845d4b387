package com.flamingo.ai.scopetree.service.dispatch;

import com.flamingo.ai.scopetree.domain.enums.ValueMode;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;

/**
 * Grammar-specific strategy that turns the text of one file into a raw scope tree.
 *
 * <p>Builders produce the tree before post-processing: filtering, flattening, grouping and value
 * aggregation are applied afterwards by {@link
 * com.flamingo.ai.scopetree.service.pipeline.ScopeTreePipeline}. {@link ScopeTreeService} depends
 * only on this interface, through {@link ScopeTreeBuilderRouter}.
 *
 * <p>To support another grammar, register a new implementation as a Spring bean with an {@code
 * @Order} ahead of the script builder, which accepts every extension.
 *
 * <p>Implementations are stateless and safe to call concurrently; all per-call state lives in the
 * call.
 */
public interface ScopeTreeBuilder {

  /**
   * Builds the raw tree for a file.
   *
   * <p>Malformed input never fails the call; the builder returns the best tree it can.
   *
   * @param filePath path used for node ids and the root label
   * @param fileText complete file contents
   * @return root node with category Program and id {@code filePath}
   */
  ScopeNode build(String filePath, String fileText);

  /**
   * Returns {@code true} if this builder handles files with the given extension.
   *
   * @param extension lower-case extension without the dot, empty when the file has none
   * @return {@code true} if supported
   */
  boolean supports(String extension);

  /** How the pipeline aggregates node values for trees from this builder. */
  ValueMode valueMode();

  /** Short name used in logs and metrics. */
  String name();
}
