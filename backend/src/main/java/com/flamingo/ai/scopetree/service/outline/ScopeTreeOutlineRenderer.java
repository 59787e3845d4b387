package com.flamingo.ai.scopetree.service.outline;

import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Flattens a scope tree into outline entries in document order. */
@Component
@RequiredArgsConstructor
public class ScopeTreeOutlineRenderer {

  private final ScopeNodeLabelFormatter formatter;

  private record Pending(ScopeNode node, int depth) {}

  public List<OutlineEntry> render(ScopeNode root) {
    List<OutlineEntry> entries = new ArrayList<>();
    Deque<Pending> pending = new ArrayDeque<>();
    pending.push(new Pending(root, 0));
    while (!pending.isEmpty()) {
      Pending current = pending.pop();
      ScopeNode node = current.node();
      entries.add(
          new OutlineEntry(
              node.getId(),
              current.depth(),
              node.getCategory(),
              formatter.format(node),
              node.getValue()));
      List<ScopeNode> children = node.getChildren();
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(new Pending(children.get(i), current.depth() + 1));
      }
    }
    return entries;
  }

  /** Renders the outline as newline-separated, indented text. */
  public String renderText(ScopeNode root) {
    return render(root).stream().map(OutlineEntry::indented).collect(Collectors.joining("\n"));
  }
}
