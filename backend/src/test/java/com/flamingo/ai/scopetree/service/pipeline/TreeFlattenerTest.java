package com.flamingo.ai.scopetree.service.pipeline;

import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.ids;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.leaf;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.node;
import static com.flamingo.ai.scopetree.service.pipeline.PipelineTestTrees.root;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.scopetree.domain.enums.CollapseKind;
import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.BuildOptions;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.domain.model.ScopeNodeMeta;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TreeFlattener Tests")
class TreeFlattenerTest {

  private final TreeFlattener flattener = new TreeFlattener();

  private static ScopeNode block(String id, ScopeNode... children) {
    return node(id, NodeCategory.BLOCK, "Block", 1, 5, children);
  }

  private static ScopeNode function(ScopeNode... children) {
    return node("f", NodeCategory.FUNCTION, "f", 1, 5, children);
  }

  @Nested
  @DisplayName("Block flattening")
  class Blocks {

    @Test
    @DisplayName("should hoist the children of a function's only block")
    void shouldHoistSingleBlock() {
      ScopeNode function =
          node(
              "f",
              NodeCategory.FUNCTION,
              "f",
              1,
              5,
              block(
                  "b",
                  leaf("a", NodeCategory.VARIABLE, "a"),
                  leaf("c", NodeCategory.CALL, "log")));
      ScopeNode tree = root(function);

      flattener.flatten(tree, BuildOptions.defaults());

      assertThat(ids(function.getChildren())).containsExactly("a", "c");
    }

    @Test
    @DisplayName("should keep named blocks such as finally")
    void shouldKeepNamedBlocks() {
      ScopeNode finallyBlock =
          node("fin", NodeCategory.BLOCK, "finally", 3, 4, leaf("c", NodeCategory.CALL, "close"));
      ScopeNode tryNode = node("t", NodeCategory.CONTROL_FLOW, "try", 1, 4, finallyBlock);
      ScopeNode tree = root(tryNode);

      flattener.flatten(tree, BuildOptions.defaults());

      assertThat(ids(tryNode.getChildren())).containsExactly("fin");
    }

    @Test
    @DisplayName("should mark a block of declarations and one return as collapsed")
    void shouldCollapseDeclarationBlock() {
      ScopeNode inner =
          block(
              "b",
              leaf("a", NodeCategory.VARIABLE, "a"),
              leaf("r", NodeCategory.RETURN_STATEMENT, "return a"));
      ScopeNode tree = root(function(inner, leaf("x", NodeCategory.CALL, "x")));

      flattener.flatten(tree, BuildOptions.defaults());

      assertThat(inner.getMeta().getCollapsed()).isEqualTo(CollapseKind.BLOCK);
      assertThat(inner.getMeta().getOriginalCategory()).isEqualTo(NodeCategory.BLOCK);
    }

    @Test
    @DisplayName("should leave blocks alone when flattenBlocks is off")
    void shouldNotHoist_whenFlattenBlocksOff() {
      ScopeNode function = function(block("b", leaf("a", NodeCategory.VARIABLE, "a")));
      ScopeNode tree = root(function);

      flattener.flatten(tree, BuildOptions.defaults().toBuilder().flattenBlocks(false).build());

      assertThat(ids(function.getChildren())).containsExactly("b");
      assertThat(function.getChildren().get(0).getMeta()).isNull();
    }
  }

  @Nested
  @DisplayName("Arrow function flattening")
  class Arrows {

    @Test
    @DisplayName("should collapse a short callback and attribute it to the enclosing call")
    void shouldCollapseCallbackArrow() {
      ScopeNode arrow =
          node(
              "arrow",
              NodeCategory.ARROW_FUNCTION,
              "() => {}",
              2,
              4,
              block("b", leaf("inner", NodeCategory.CALL, "console.log")));
      ScopeNode call = node("call", NodeCategory.CALL, "items.forEach", 1, 5, arrow);
      ScopeNode tree = root(call);

      flattener.flatten(tree, BuildOptions.defaults());

      assertThat(arrow.getMeta().getCollapsed()).isEqualTo(CollapseKind.ARROW_FUNCTION);
      assertThat(arrow.getMeta().getCall()).isEqualTo("items.forEach");
      assertThat(ids(arrow.getChildren())).containsExactly("inner");
    }

    @Test
    @DisplayName("should use the first inner call when the arrow is not a call argument")
    void shouldUseFirstInnerCall() {
      ScopeNode arrow =
          node(
              "arrow",
              NodeCategory.ARROW_FUNCTION,
              "handler",
              1,
              3,
              leaf("inner", NodeCategory.CALL, "setOpen"));
      ScopeNode tree = root(arrow);

      flattener.flatten(tree, BuildOptions.defaults());

      assertThat(arrow.getMeta().getCall()).isEqualTo("setOpen");
    }

    @Test
    @DisplayName("should not collapse an arrow whose body has more than three statements")
    void shouldNotCollapseLongArrow() {
      ScopeNode arrow =
          node(
              "arrow",
              NodeCategory.ARROW_FUNCTION,
              "() => {}",
              1,
              9,
              block(
                  "b",
                  leaf("1", NodeCategory.CALL, "a"),
                  leaf("2", NodeCategory.CALL, "b"),
                  leaf("3", NodeCategory.CALL, "c"),
                  leaf("4", NodeCategory.CALL, "d")));
      ScopeNode tree = root(arrow);

      flattener.flatten(tree, BuildOptions.defaults());

      assertThat(arrow.getMeta()).isNull();
      assertThat(arrow.getChildren()).hasSize(4);
    }

    @Test
    @DisplayName("should judge an arrow by its hoisted statements when blocks are flattened")
    void shouldJudgeArrowAfterHoist() {
      ScopeNode arrow =
          node(
              "arrow",
              NodeCategory.ARROW_FUNCTION,
              "() => {}",
              1,
              5,
              block(
                  "b",
                  leaf("1", NodeCategory.CALL, "a"),
                  leaf("2", NodeCategory.CALL, "b"),
                  leaf("3", NodeCategory.CALL, "c")));
      ScopeNode tree = root(arrow);

      flattener.flatten(tree, BuildOptions.defaults());

      assertThat(arrow.getMeta()).isNull();
      assertThat(ids(arrow.getChildren())).containsExactly("1", "2", "3");
    }

    @Test
    @DisplayName("should collapse an arrow with up to three statements when blocks are kept")
    void shouldCollapseShortBlockArrow_whenFlattenBlocksOff() {
      ScopeNode arrow =
          node(
              "arrow",
              NodeCategory.ARROW_FUNCTION,
              "() => {}",
              1,
              5,
              block(
                  "b",
                  leaf("1", NodeCategory.CALL, "a"),
                  leaf("2", NodeCategory.CALL, "b"),
                  leaf("3", NodeCategory.CALL, "c")));
      ScopeNode tree = root(arrow);

      flattener.flatten(tree, BuildOptions.defaults().toBuilder().flattenBlocks(false).build());

      assertThat(arrow.getMeta().getCollapsed()).isEqualTo(CollapseKind.ARROW_FUNCTION);
      assertThat(arrow.getMeta().getCall()).isEqualTo("a");
      assertThat(ids(arrow.getChildren())).containsExactly("b");
    }

    @Test
    @DisplayName("should attribute an arrow to a hook call but not to a hook declaration")
    void shouldAttributeOnlyToHookCalls() {
      ScopeNode effectArrow =
          node(
              "effect",
              NodeCategory.ARROW_FUNCTION,
              "() => {}",
              2,
              2,
              leaf("sub", NodeCategory.CALL, "subscribe"));
      ScopeNode effect =
          node("useEffect", NodeCategory.REACT_HOOK, "useEffect", 2, 2, effectArrow);
      effect.setMeta(ScopeNodeMeta.builder().hookName("useEffect").hookCall(true).build());

      ScopeNode handler =
          node(
              "handler",
              NodeCategory.ARROW_FUNCTION,
              "() => {}",
              5,
              5,
              leaf("inc", NodeCategory.CALL, "setCount"));
      ScopeNode declaration =
          node("useCounter", NodeCategory.REACT_HOOK, "useCounter", 1, 6, effect, handler);
      declaration.setMeta(ScopeNodeMeta.builder().hookName("useCounter").build());
      ScopeNode tree = root(declaration);

      flattener.flatten(tree, BuildOptions.defaults());

      assertThat(effectArrow.getMeta().getCall()).isEqualTo("useEffect");
      assertThat(handler.getMeta().getCollapsed()).isEqualTo(CollapseKind.ARROW_FUNCTION);
      assertThat(handler.getMeta().getCall()).isEqualTo("setCount");
    }

    @Test
    @DisplayName("should not collapse arrows when flattenArrowFunctions is off")
    void shouldNotCollapse_whenArrowFlatteningOff() {
      ScopeNode arrow = node("arrow", NodeCategory.ARROW_FUNCTION, "() => {}", 1, 1);
      ScopeNode tree = root(arrow);

      flattener.flatten(
          tree, BuildOptions.defaults().toBuilder().flattenArrowFunctions(false).build());

      assertThat(arrow.getMeta()).isNull();
    }
  }

  @Test
  @DisplayName("should do nothing when flattenTree is off")
  void shouldDoNothing_whenFlattenTreeOff() {
    ScopeNode function = function(block("b", leaf("a", NodeCategory.VARIABLE, "a")));
    ScopeNode tree = root(function);

    flattener.flatten(tree, BuildOptions.defaults().toBuilder().flattenTree(false).build());

    assertThat(ids(function.getChildren())).containsExactly("b");
  }
}
