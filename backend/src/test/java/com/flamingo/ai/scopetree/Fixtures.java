package com.flamingo.ai.scopetree;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.service.support.LineIndex;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** Test fixtures and tree helpers shared by builder tests. */
public final class Fixtures {

  private Fixtures() {}

  /** Reads {@code fixtures/<name>} from the test classpath. */
  public static String read(String name) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IllegalArgumentException("Missing fixture: " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Every node of the tree in pre-order, root first. */
  public static List<ScopeNode> allNodes(ScopeNode root) {
    List<ScopeNode> nodes = new ArrayList<>();
    ScopeNodes.preOrder(root, nodes::add);
    return nodes;
  }

  public static List<ScopeNode> nodesOf(ScopeNode root, NodeCategory category) {
    return allNodes(root).stream().filter(n -> n.getCategory() == category).toList();
  }

  public static List<NodeCategory> categories(List<ScopeNode> nodes) {
    return nodes.stream().map(ScopeNode::getCategory).toList();
  }

  public static List<String> labels(List<ScopeNode> nodes) {
    return nodes.stream().map(ScopeNode::getLabel).toList();
  }

  /** Asserts that each non-root node's source is exactly the text its range covers. */
  public static void assertSourcesMatchText(ScopeNode root, String text) {
    LineIndex lines = new LineIndex(text);
    for (ScopeNode node : allNodes(root)) {
      if (node == root) {
        assertThat(node.getSource()).isEqualTo(text);
        continue;
      }
      int start = lines.offsetOf(node.getLoc().start());
      int end = lines.offsetOf(node.getLoc().end());
      assertThat(node.getSource())
          .as("source of %s", node.getId())
          .isEqualTo(text.substring(start, end));
    }
  }

  /** Asserts that ids are unique across the tree. */
  public static void assertUniqueIds(ScopeNode root) {
    List<String> ids = allNodes(root).stream().map(ScopeNode::getId).toList();
    assertThat(ids).doesNotHaveDuplicates();
  }
}
