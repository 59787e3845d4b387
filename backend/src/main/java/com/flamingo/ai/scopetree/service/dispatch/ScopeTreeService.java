package com.flamingo.ai.scopetree.service.dispatch;

import com.flamingo.ai.scopetree.domain.model.BuildOptions;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import java.util.concurrent.CompletableFuture;

/** Entry point for building the scope tree of one source file. */
public interface ScopeTreeService {

  /**
   * Builds and post-processes the scope tree of a file.
   *
   * @param filePath path of the file; its extension selects the builder
   * @param fileText file contents, or {@code null} to read the file from disk as UTF-8
   * @param options build options, or {@code null} for the configured defaults
   * @return root of the finished tree
   * @throws com.flamingo.ai.scopetree.exception.SourceReadException if the text must be read from
   *     disk and cannot be
   * @throws com.flamingo.ai.scopetree.exception.UnsupportedSourceException if {@code filePath} is
   *     blank
   */
  ScopeNode buildScopeTree(String filePath, String fileText, BuildOptions options);

  /** Same as {@link #buildScopeTree} but runs on the {@code scopeTreeExecutor} pool. */
  CompletableFuture<ScopeNode> buildScopeTreeAsync(
      String filePath, String fileText, BuildOptions options);

  /** Options applied when a caller passes none. */
  BuildOptions defaultOptions();
}
