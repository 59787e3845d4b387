package com.flamingo.ai.scopetree.config;

import com.flamingo.ai.scopetree.domain.model.BuildOptions;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for scope tree builds. */
@Configuration
@ConfigurationProperties(prefix = "scope-tree")
@Getter
@Setter
public class ScopeTreeProperties {

  private Defaults defaults = new Defaults();
  private Executor executor = new Executor();

  /** Upper bound for an asynchronous REST build before the request times out. */
  private Duration requestTimeout = Duration.ofSeconds(30);

  /** Build options applied when a caller supplies none. */
  @Getter
  @Setter
  public static class Defaults {
    private boolean includeComments = false;
    private boolean includeImports = true;
    private boolean includeTypes = true;
    private boolean includeLiterals = false;
    private boolean flattenTree = true;
    private boolean flattenBlocks = true;
    private boolean flattenArrowFunctions = true;
    private boolean createSyntheticGroups = true;

    public BuildOptions toBuildOptions() {
      return BuildOptions.builder()
          .includeComments(includeComments)
          .includeImports(includeImports)
          .includeTypes(includeTypes)
          .includeLiterals(includeLiterals)
          .flattenTree(flattenTree)
          .flattenBlocks(flattenBlocks)
          .flattenArrowFunctions(flattenArrowFunctions)
          .createSyntheticGroups(createSyntheticGroups)
          .build();
    }
  }

  @Getter
  @Setter
  public static class Executor {
    private int corePoolSize = 2;
    private int maxPoolSize = 8;
    private int queueCapacity = 100;
  }
}
