package com.flamingo.ai.scopetree.service.pipeline;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.BuildOptions;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Removes nodes whose category the options exclude.
 *
 * <p>Children of a removed node are spliced, in order, into the position the node held, so they
 * end up under the nearest surviving ancestor. The root is never removed.
 */
@Component
@Slf4j
public class NodeFilter {

  /** Filters {@code root} in place and returns the number of removed nodes. */
  public int filter(ScopeNode root, BuildOptions options) {
    int[] removed = {0};
    ScopeNodes.postOrder(
        root,
        node -> {
          if (node.getChildren().stream().noneMatch(child -> isExcluded(child, options))) {
            return;
          }
          List<ScopeNode> kept = new ArrayList<>();
          for (ScopeNode child : node.getChildren()) {
            if (isExcluded(child, options)) {
              kept.addAll(child.getChildren());
              removed[0]++;
            } else {
              kept.add(child);
            }
          }
          node.setChildren(kept);
        });
    log.debug("Filter removed {} node(s) from {}", removed[0], root.getId());
    return removed[0];
  }

  static boolean isExcluded(ScopeNode node, BuildOptions options) {
    NodeCategory category = node.getCategory();
    if (category.isComment()) {
      return !options.includeComments();
    }
    if (category.isImport()) {
      return !options.includeImports();
    }
    if (category.isTypeDefinition()) {
      return !options.includeTypes();
    }
    if (category == NodeCategory.LITERAL) {
      return !options.includeLiterals();
    }
    return false;
  }
}
