package com.flamingo.ai.scopetree.service.dispatch;

import com.flamingo.ai.scopetree.config.ScopeTreeProperties;
import com.flamingo.ai.scopetree.domain.model.BuildOptions;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.exception.SourceReadException;
import com.flamingo.ai.scopetree.exception.UnsupportedSourceException;
import com.flamingo.ai.scopetree.service.pipeline.ScopeTreePipeline;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/** Routes a file to its builder and runs the post-processing pipeline on the result. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScopeTreeServiceImpl implements ScopeTreeService {

  private final ScopeTreeBuilderRouter router;
  private final ScopeTreePipeline pipeline;
  private final ScopeTreeProperties properties;
  private final MeterRegistry meterRegistry;

  @Override
  public ScopeNode buildScopeTree(String filePath, String fileText, BuildOptions options) {
    if (filePath == null || filePath.isBlank()) {
      throw new UnsupportedSourceException("A file path is required to build a scope tree");
    }
    String text = fileText != null ? fileText : readSource(filePath);
    BuildOptions effective = options != null ? options : defaultOptions();
    ScopeTreeBuilder builder = router.route(ScopeNodes.extension(filePath));

    Timer.Sample sample = Timer.start(meterRegistry);
    ScopeNode root = builder.build(filePath, text);
    pipeline.process(root, text, effective, builder.valueMode());
    long nanos =
        sample.stop(
            Timer.builder("scope_tree.build")
                .description("Time to build and post-process a scope tree")
                .tag("builder", builder.name())
                .register(meterRegistry));

    log.info(
        "Built scope tree for {} with the {} builder: {} nodes in {} ms",
        filePath,
        builder.name(),
        root.countNodes(),
        TimeUnit.NANOSECONDS.toMillis(nanos));
    return root;
  }

  @Override
  @Async("scopeTreeExecutor")
  public CompletableFuture<ScopeNode> buildScopeTreeAsync(
      String filePath, String fileText, BuildOptions options) {
    return CompletableFuture.completedFuture(buildScopeTree(filePath, fileText, options));
  }

  @Override
  public BuildOptions defaultOptions() {
    return properties.getDefaults().toBuildOptions();
  }

  private String readSource(String filePath) {
    try {
      return Files.readString(Path.of(filePath), StandardCharsets.UTF_8);
    } catch (IOException | InvalidPathException e) {
      log.warn("Cannot read source file {}: {}", filePath, e.getMessage());
      throw new SourceReadException(filePath, e);
    }
  }
}
