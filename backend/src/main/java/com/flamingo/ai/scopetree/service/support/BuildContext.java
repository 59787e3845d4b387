package com.flamingo.ai.scopetree.service.support;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.domain.model.ScopeNodeMeta;
import com.flamingo.ai.scopetree.domain.model.SourceRange;
import lombok.Getter;

/**
 * Per-call state for one build: the file, its text, position lookup and the id registry.
 *
 * <p>Created by a builder at the start of a call and dropped when the call returns.
 */
@Getter
public final class BuildContext {

  private final String filePath;
  private final String text;
  private final LineIndex lineIndex;
  private final NodeIdRegistry ids = new NodeIdRegistry();

  public BuildContext(String filePath, String text) {
    this.filePath = filePath;
    this.text = text;
    this.lineIndex = new LineIndex(text);
  }

  /** Creates the Program root spanning the whole text. */
  public ScopeNode createRoot() {
    return ScopeNode.builder()
        .id(ids.claim(filePath))
        .category(NodeCategory.PROGRAM)
        .label(ScopeNodes.basename(filePath))
        .loc(new SourceRange(lineIndex.positionOf(0), lineIndex.endPosition()))
        .source(text)
        .build();
  }

  /** Creates a node whose source is exactly the text between two char offsets. */
  public ScopeNode createNode(NodeCategory category, String label, int start, int end) {
    return createNode(category, label, start, end, null);
  }

  public ScopeNode createNode(
      NodeCategory category, String label, int start, int end, ScopeNodeMeta meta) {
    return ScopeNode.builder()
        .id(ids.claim(filePath + ":" + start + "-" + end))
        .category(category)
        .label(label)
        .loc(rangeOf(start, end))
        .source(text.substring(start, end))
        .meta(meta)
        .build();
  }

  public SourceRange rangeOf(int start, int end) {
    return new SourceRange(lineIndex.positionOf(start), lineIndex.positionOf(end));
  }

  public String slice(int start, int end) {
    return text.substring(start, end);
  }
}
