package com.flamingo.ai.scopetree.api.rest;

import com.flamingo.ai.scopetree.api.dto.request.BuildScopeTreeRequest;
import com.flamingo.ai.scopetree.api.dto.response.OutlineResponse;
import com.flamingo.ai.scopetree.domain.model.BuildOptions;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.service.dispatch.ScopeTreeService;
import com.flamingo.ai.scopetree.service.outline.OutlineEntry;
import com.flamingo.ai.scopetree.service.outline.ScopeTreeOutlineRenderer;
import io.micrometer.core.annotation.Timed;
import jakarta.validation.Valid;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for scope tree builds. */
@RestController
@RequestMapping("/api/scope-tree")
@RequiredArgsConstructor
public class ScopeTreeController {

  private final ScopeTreeService scopeTreeService;
  private final ScopeTreeOutlineRenderer outlineRenderer;

  /** Builds the full scope tree of a file. */
  @PostMapping
  @Timed(value = "api.scope_tree.build", description = "Time to answer a scope tree request")
  public CompletableFuture<ResponseEntity<ScopeNode>> buildScopeTree(
      @Valid @RequestBody BuildScopeTreeRequest request) {
    return scopeTreeService
        .buildScopeTreeAsync(request.getFilePath(), request.getFileText(), optionsOf(request))
        .thenApply(ResponseEntity::ok);
  }

  /** Builds the scope tree of a file and returns it as a flat, indented outline. */
  @PostMapping("/outline")
  @Timed(value = "api.scope_tree.outline", description = "Time to answer an outline request")
  public CompletableFuture<ResponseEntity<OutlineResponse>> outline(
      @Valid @RequestBody BuildScopeTreeRequest request) {
    return scopeTreeService
        .buildScopeTreeAsync(request.getFilePath(), request.getFileText(), optionsOf(request))
        .thenApply(
            root -> {
              List<OutlineEntry> entries = outlineRenderer.render(root);
              return ResponseEntity.ok(
                  OutlineResponse.builder()
                      .filePath(request.getFilePath())
                      .totalValue(root.getValue())
                      .nodeCount(entries.size())
                      .entries(entries)
                      .build());
            });
  }

  private BuildOptions optionsOf(BuildScopeTreeRequest request) {
    BuildOptions defaults = scopeTreeService.defaultOptions();
    return request.getOptions() == null ? defaults : request.getOptions().applyTo(defaults);
  }
}
