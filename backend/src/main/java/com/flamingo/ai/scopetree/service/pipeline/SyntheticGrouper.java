package com.flamingo.ai.scopetree.service.pipeline;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.domain.model.ScopeNodeMeta;
import com.flamingo.ai.scopetree.domain.model.SourceRange;
import com.flamingo.ai.scopetree.service.support.LineIndex;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Clusters runs of adjacent imports, or of adjacent type definitions, into SyntheticGroup nodes.
 *
 * <p>Runs bottom-up over every level of the tree. A run needs at least two members.
 */
@Component
@Slf4j
public class SyntheticGrouper {

  static final String IMPORTS_LABEL = "Imports";
  static final String TYPE_DEFS_LABEL = "Type defs";

  private static final int MIN_GROUP_SIZE = 2;

  /** Groups in place; returns the number of groups created. */
  public int group(ScopeNode root, String fileText) {
    LineIndex lines = new LineIndex(fileText);
    int[] created = {0};
    ScopeNodes.postOrder(
        root,
        node -> {
          if (node.getChildren().size() < MIN_GROUP_SIZE) {
            return;
          }
          List<ScopeNode> grouped = new ArrayList<>();
          List<ScopeNode> run = new ArrayList<>();
          String runLabel = null;
          for (ScopeNode child : node.getChildren()) {
            String label = groupLabel(child.getCategory());
            if (runLabel != null && !runLabel.equals(label)) {
              created[0] += flush(node, runLabel, run, grouped, fileText, lines);
            }
            if (label == null) {
              grouped.add(child);
            } else {
              run.add(child);
            }
            runLabel = label;
          }
          if (runLabel != null) {
            created[0] += flush(node, runLabel, run, grouped, fileText, lines);
          }
          node.setChildren(grouped);
        });
    if (created[0] > 0) {
      log.debug("Created {} synthetic group(s) in {}", created[0], root.getId());
    }
    return created[0];
  }

  static String groupLabel(NodeCategory category) {
    if (category.isImport()) {
      return IMPORTS_LABEL;
    }
    if (category.isTypeDefinition()) {
      return TYPE_DEFS_LABEL;
    }
    return null;
  }

  private static int flush(
      ScopeNode parent,
      String label,
      List<ScopeNode> run,
      List<ScopeNode> grouped,
      String fileText,
      LineIndex lines) {
    int created = 0;
    if (run.size() >= MIN_GROUP_SIZE) {
      grouped.add(createGroup(parent, label, run, fileText, lines));
      created = 1;
    } else {
      grouped.addAll(run);
    }
    run.clear();
    return created;
  }

  private static ScopeNode createGroup(
      ScopeNode parent, String label, List<ScopeNode> members, String fileText, LineIndex lines) {
    ScopeNode first = members.get(0);
    ScopeNode last = members.get(members.size() - 1);
    int start = lines.offsetOf(first.getLoc().start());
    int end = Math.max(start, lines.offsetOf(last.getLoc().end()));
    return ScopeNode.builder()
        .id("synthetic:" + parent.getId() + ":" + label + ":" + first.getId())
        .category(NodeCategory.SYNTHETIC_GROUP)
        .label(label)
        .loc(new SourceRange(first.getLoc().start(), last.getLoc().end()))
        .source(fileText.substring(start, end))
        .children(new ArrayList<>(members))
        .meta(
            ScopeNodeMeta.builder()
                .syntheticGroup(Boolean.TRUE)
                .contains(members.size())
                .memberCategories(members.stream().map(ScopeNode::getCategory).toList())
                .build())
        .build();
  }
}
