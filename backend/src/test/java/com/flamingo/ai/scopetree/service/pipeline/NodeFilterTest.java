package com.flamingo.ai.scopetree.service.pipeline;

import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.ids;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.leaf;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.node;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.root;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.BuildOptions;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NodeFilter Tests")
class NodeFilterTest {

  private NodeFilter filter;

  @BeforeEach
  void setUp() {
    filter = new NodeFilter();
  }

  @Test
  @DisplayName("should drop comments and literals with default options")
  void shouldDropCommentsAndLiterals_withDefaults() {
    ScopeNode tree =
        root(
            leaf("c1", NodeCategory.COMMENT, "// note"),
            node("f", NodeCategory.FUNCTION, "f", 1, 3, leaf("l", NodeCategory.LITERAL, "1")),
            leaf("i", NodeCategory.IMPORT, "react"));

    int removed = filter.filter(tree, BuildOptions.defaults());

    assertThat(removed).isEqualTo(2);
    assertThat(ids(tree.getChildren())).containsExactly("f", "i");
    assertThat(tree.getChildren().get(0).getChildren()).isEmpty();
  }

  @Test
  @DisplayName("should splice children of removed nodes into the parent in order")
  void shouldSpliceChildren_whenNodeRemoved() {
    ScopeNode tree =
        root(
            leaf("a", NodeCategory.VARIABLE, "a"),
            node(
                "t",
                NodeCategory.TYPE_ALIAS,
                "T",
                2,
                4,
                leaf("x", NodeCategory.CALL, "x"),
                leaf("y", NodeCategory.CALL, "y")),
            leaf("b", NodeCategory.VARIABLE, "b"));

    filter.filter(tree, BuildOptions.defaults().toBuilder().includeTypes(false).build());

    assertThat(ids(tree.getChildren())).containsExactly("a", "x", "y", "b");
  }

  @Test
  @DisplayName("should keep everything when every include flag is on")
  void shouldKeepEverything_whenAllIncluded() {
    ScopeNode tree =
        root(
            leaf("c", NodeCategory.CSS_COMMENT, "/* c */"),
            leaf("i", NodeCategory.CSS_IMPORT, "@import 'a'"),
            leaf("l", NodeCategory.LITERAL, "'s'"));
    BuildOptions all =
        BuildOptions.defaults().toBuilder().includeComments(true).includeLiterals(true).build();

    assertThat(filter.filter(tree, all)).isZero();
    assertThat(tree.getChildren()).hasSize(3);
  }

  @Test
  @DisplayName("should remove nested excluded nodes at every depth")
  void shouldRemoveNestedExcludedNodes() {
    ScopeNode tree =
        root(
            node(
                "outer",
                NodeCategory.COMMENT,
                "c",
                1,
                5,
                node(
                    "inner",
                    NodeCategory.COMMENT,
                    "c2",
                    2,
                    4,
                    leaf("v", NodeCategory.VARIABLE, "v"))));

    filter.filter(tree, BuildOptions.defaults());

    assertThat(ids(tree.getChildren())).containsExactly("v");
  }
}
