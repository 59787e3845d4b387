package com.flamingo.ai.scopetree.service.pipeline;

import com.flamingo.ai.scopetree.domain.enums.CollapseKind;
import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.BuildOptions;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.domain.model.ScopeNodeMeta;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Folds low-information wrappers, bottom-up.
 *
 * <ul>
 *   <li>A node whose only child is a plain block adopts that block's children.
 *   <li>A plain block holding only variables and at most one return is marked collapsed.
 *   <li>A short arrow function is marked collapsed, with the label of the call it is passed to,
 *       or else the first call inside it. Shortness is judged after the block is hoisted.
 * </ul>
 *
 * <p>Collapsed nodes stay in the tree; only their {@code meta} records the collapse.
 */
@Component
@Slf4j
public class TreeFlattener {

  static final String PLAIN_BLOCK_LABEL = "Block";

  private static final int MAX_COLLAPSED_ARROW_STATEMENTS = 3;

  public void flatten(ScopeNode root, BuildOptions options) {
    if (!options.flattenTree()) {
      return;
    }
    ScopeNodes.postOrder(
        root,
        node -> {
          if (options.flattenBlocks()) {
            if (node != root) {
              hoistSingleBlock(node);
            }
            if (isCollapsibleBlock(node)) {
              collapse(node, CollapseKind.BLOCK, null);
            }
          }
          if (options.flattenArrowFunctions() && isCollapsibleArrow(node)) {
            collapse(node, CollapseKind.ARROW_FUNCTION, firstCallLabel(node));
          }
          if (isCallSite(node)) {
            attributeArrowsToCall(node);
          }
        });
  }

  private static void hoistSingleBlock(ScopeNode node) {
    if (node.getChildren().size() == 1 && isPlainBlock(node.getChildren().get(0))) {
      node.setChildren(new ArrayList<>(node.getChildren().get(0).getChildren()));
    }
  }

  private static boolean isCollapsibleBlock(ScopeNode node) {
    if (!isPlainBlock(node)) {
      return false;
    }
    int returns = 0;
    for (ScopeNode child : node.getChildren()) {
      if (child.getCategory() == NodeCategory.RETURN_STATEMENT) {
        returns++;
      } else if (child.getCategory() != NodeCategory.VARIABLE) {
        return false;
      }
    }
    return returns <= 1;
  }

  /** Evaluated after the arrow's own block has been hoisted, when block flattening is on. */
  private static boolean isCollapsibleArrow(ScopeNode node) {
    if (node.getCategory() != NodeCategory.ARROW_FUNCTION) {
      return false;
    }
    List<ScopeNode> children = node.getChildren();
    if (children.size() == 1 && isPlainBlock(children.get(0))) {
      return children.get(0).getChildren().size() <= MAX_COLLAPSED_ARROW_STATEMENTS;
    }
    return children.size() <= 1;
  }

  /** Calls and hook calls; hook declarations are not call sites. */
  static boolean isCallSite(ScopeNode node) {
    if (node.getCategory() == NodeCategory.CALL) {
      return true;
    }
    ScopeNodeMeta meta = node.getMeta();
    return node.getCategory() == NodeCategory.REACT_HOOK
        && meta != null
        && Boolean.TRUE.equals(meta.getHookCall());
  }

  private static void attributeArrowsToCall(ScopeNode call) {
    for (ScopeNode child : call.getChildren()) {
      ScopeNodeMeta meta = child.getMeta();
      if (meta != null && meta.getCollapsed() == CollapseKind.ARROW_FUNCTION) {
        child.setMeta(meta.toBuilder().call(call.getLabel()).build());
      }
    }
  }

  private static String firstCallLabel(ScopeNode arrow) {
    String[] found = {null};
    for (ScopeNode child : arrow.getChildren()) {
      ScopeNodes.preOrder(
          child,
          node -> {
            if (found[0] == null && isCallSite(node)) {
              found[0] = node.getLabel();
            }
          });
      if (found[0] != null) {
        break;
      }
    }
    return found[0];
  }

  private static void collapse(ScopeNode node, CollapseKind kind, String call) {
    node.setMeta(
        ScopeNodeMeta.from(node.getMeta())
            .collapsed(kind)
            .originalCategory(node.getCategory())
            .call(call)
            .build());
    log.trace("Collapsed {} as {}", node.getId(), kind);
  }

  static boolean isPlainBlock(ScopeNode node) {
    return node.getCategory() == NodeCategory.BLOCK && PLAIN_BLOCK_LABEL.equals(node.getLabel());
  }
}
