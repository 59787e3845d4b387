package com.flamingo.ai.scopetree.service.pipeline;

import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.ids;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.line;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.node;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.root;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.Position;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SyntheticGrouper Tests")
class SyntheticGrouperTest {

  private static final String TEXT =
      "import a from 'a';\n"
          + "import b from 'b';\n"
          + "type T = string;\n"
          + "interface I {}\n"
          + "const x = 1;\n";

  private final SyntheticGrouper grouper = new SyntheticGrouper();

  @Nested
  @DisplayName("Grouping adjacent siblings")
  class Adjacent {

    @Test
    @DisplayName("should group consecutive imports and consecutive type definitions separately")
    void shouldGroupImportsAndTypes() {
      ScopeNode tree =
          root(
              line("i1", NodeCategory.IMPORT, "a", 1, 18),
              line("i2", NodeCategory.IMPORT, "b", 2, 18),
              line("t", NodeCategory.TYPE_ALIAS, "T", 3, 16),
              line("n", NodeCategory.INTERFACE, "I", 4, 14),
              line("x", NodeCategory.VARIABLE, "x", 5, 12));

      int created = grouper.group(tree, TEXT);

      assertThat(created).isEqualTo(2);
      assertThat(tree.getChildren()).hasSize(3);
      ScopeNode imports = tree.getChildren().get(0);
      assertThat(imports.getCategory()).isEqualTo(NodeCategory.SYNTHETIC_GROUP);
      assertThat(imports.getLabel()).isEqualTo("Imports");
      assertThat(imports.getId()).isEqualTo("synthetic:file.ts:Imports:i1");
      assertThat(ids(imports.getChildren())).containsExactly("i1", "i2");
      assertThat(imports.getSource()).isEqualTo("import a from 'a';\nimport b from 'b';");
      assertThat(imports.getLoc().start()).isEqualTo(new Position(1, 0));
      assertThat(imports.getLoc().end()).isEqualTo(new Position(2, 18));
      assertThat(imports.getMeta().getSyntheticGroup()).isTrue();
      assertThat(imports.getMeta().getContains()).isEqualTo(2);
      assertThat(imports.getMeta().getMemberCategories())
          .containsExactly(NodeCategory.IMPORT, NodeCategory.IMPORT);

      ScopeNode types = tree.getChildren().get(1);
      assertThat(types.getLabel()).isEqualTo("Type defs");
      assertThat(ids(types.getChildren())).containsExactly("t", "n");
      assertThat(tree.getChildren().get(2).getId()).isEqualTo("x");
    }

    @Test
    @DisplayName("should not group a single import")
    void shouldNotGroupSingleImport() {
      ScopeNode tree =
          root(
              line("i1", NodeCategory.IMPORT, "a", 1, 18),
              line("x", NodeCategory.VARIABLE, "x", 5, 12));

      assertThat(grouper.group(tree, TEXT)).isZero();
      assertThat(ids(tree.getChildren())).containsExactly("i1", "x");
    }

    @Test
    @DisplayName("should not merge imports separated by another node")
    void shouldNotMergeAcrossInterruptions() {
      ScopeNode tree =
          root(
              line("i1", NodeCategory.IMPORT, "a", 1, 18),
              line("x", NodeCategory.VARIABLE, "x", 5, 12),
              line("i2", NodeCategory.IMPORT, "b", 2, 18));

      assertThat(grouper.group(tree, TEXT)).isZero();
      assertThat(ids(tree.getChildren())).containsExactly("i1", "x", "i2");
    }
  }

  @Test
  @DisplayName("should group inside nested scopes too")
  void shouldGroupNestedScopes() {
    ScopeNode module =
        node(
            "m",
            NodeCategory.MODULE,
            "M",
            1,
            5,
            line("t", NodeCategory.TYPE_ALIAS, "T", 3, 16),
            line("n", NodeCategory.INTERFACE, "I", 4, 14));
    ScopeNode tree = root(module);

    assertThat(grouper.group(tree, TEXT)).isEqualTo(1);
    assertThat(module.getChildren()).hasSize(1);
    assertThat(module.getChildren().get(0).getId()).isEqualTo("synthetic:m:Type defs:t");
  }
}
