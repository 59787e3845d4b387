package com.flamingo.ai.scopetree.service.pipeline;

import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.leaf;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.node;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.root;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.enums.ValueMode;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ValueAggregator Tests")
class ValueAggregatorTest {

  private final ValueAggregator aggregator = new ValueAggregator();

  private ScopeNode sampleTree() {
    return root(
        node(
            "f",
            NodeCategory.FUNCTION,
            "f",
            1,
            5,
            leaf("a", NodeCategory.VARIABLE, "a"),
            leaf("r", NodeCategory.RETURN_STATEMENT, "return a")),
        leaf("b", NodeCategory.VARIABLE, "b"));
  }

  @Test
  @DisplayName("should weigh parents as one plus their children for script trees")
  void shouldAddSelf_whenSelfPlusChildren() {
    ScopeNode tree = sampleTree();

    aggregator.aggregate(tree, ValueMode.SELF_PLUS_CHILDREN);

    assertThat(tree.getChildren().get(0).getValue()).isEqualTo(3);
    assertThat(tree.getChildren().get(1).getValue()).isEqualTo(1);
    assertThat(tree.getValue()).isEqualTo(5);
  }

  @Test
  @DisplayName("should weigh parents as the sum of their children for stylesheet trees")
  void shouldSumChildren_whenChildrenOnly() {
    ScopeNode tree = sampleTree();

    aggregator.aggregate(tree, ValueMode.CHILDREN_ONLY);

    assertThat(tree.getChildren().get(0).getValue()).isEqualTo(2);
    assertThat(tree.getValue()).isEqualTo(3);
  }

  @Test
  @DisplayName("should leave builder weights alone for source-length trees")
  void shouldKeepValues_whenSourceLength() {
    ScopeNode tree = sampleTree();
    tree.setValue(42);

    aggregator.aggregate(tree, ValueMode.SOURCE_LENGTH);

    assertThat(tree.getValue()).isEqualTo(42);
  }

  @Test
  @DisplayName("should reset stale leaf values to one")
  void shouldResetLeaves() {
    ScopeNode tree = root(leaf("a", NodeCategory.VARIABLE, "a"));
    tree.getChildren().get(0).setValue(99);

    aggregator.aggregate(tree, ValueMode.SELF_PLUS_CHILDREN);

    assertThat(tree.getChildren().get(0).getValue()).isEqualTo(1);
    assertThat(tree.getValue()).isEqualTo(2);
  }
}
