package com.flamingo.ai.scopetree.service.dispatch;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a file extension to the highest-priority {@link ScopeTreeBuilder} that supports it.
 *
 * <p>Builders are injected by Spring in {@code @Order} order (ascending): markdown, then
 * stylesheet, then the script builder, which accepts every extension.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScopeTreeBuilderRouter {

  private final List<ScopeTreeBuilder> builders;

  /**
   * Returns the first builder that supports the given extension.
   *
   * @param extension lower-case extension without the dot
   * @return selected builder, never null while the script builder is registered
   * @throws IllegalStateException if no builder supports the extension
   */
  public ScopeTreeBuilder route(String extension) {
    ScopeTreeBuilder builder =
        builders.stream()
            .filter(b -> b.supports(extension))
            .findFirst()
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "No ScopeTreeBuilder found for extension: '" + extension + "'"));
    log.debug("Routed extension '{}' to the {} builder", extension, builder.name());
    return builder;
  }

  /** Names of the registered builders in routing order. */
  public List<String> builderNames() {
    return builders.stream().map(ScopeTreeBuilder::name).toList();
  }
}
