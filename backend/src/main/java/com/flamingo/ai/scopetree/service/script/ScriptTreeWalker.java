package com.flamingo.ai.scopetree.service.script;

import static com.flamingo.ai.scopetree.service.script.ScriptSource.field;
import static com.flamingo.ai.scopetree.service.script.ScriptSource.isType;
import static com.flamingo.ai.scopetree.service.script.ScriptSource.namedChildren;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.domain.model.ScopeNodeMeta;
import com.flamingo.ai.scopetree.service.support.BuildContext;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.treesitter.TSNode;

/**
 * Turns one tree-sitter syntax tree into a scope tree.
 *
 * <p>The walk is pre-order over an explicit stack. Frames are either a syntax node to visit under
 * a scope parent, or an already built scope node to attach once the frames before it are done, so
 * children always land in source order.
 */
@Slf4j
final class ScriptTreeWalker {

  private interface Frame {}

  private record Visit(TSNode node, ScopeNode parent) implements Frame {}

  private record Attach(ScopeNode node, ScopeNode parent, List<TSNode> body) implements Frame {}

  private final BuildContext context;
  private final ScriptSource source;
  private final ScriptNodeClassifier classifier;
  private final ScriptNodeLabeler labeler;
  private final Deque<Frame> frames = new ArrayDeque<>();
  private int errorRegions;

  ScriptTreeWalker(BuildContext context) {
    this.context = context;
    this.source = new ScriptSource(context.getText());
    this.classifier = new ScriptNodeClassifier(source);
    this.labeler = new ScriptNodeLabeler(source, classifier);
  }

  ScopeNode walk(TSNode program) {
    ScopeNode root = context.createRoot();
    pushAll(namedChildren(program), root);
    while (!frames.isEmpty()) {
      Frame frame = frames.pop();
      if (frame instanceof Attach attach) {
        attach.parent().addChild(attach.node());
        pushAll(attach.body(), attach.node());
      } else if (frame instanceof Visit visit) {
        visit(visit.node(), visit.parent());
      }
    }
    if (errorRegions > 0) {
      log.warn(
          "Syntax errors in {}: {} region(s) walked on a best-effort basis",
          context.getFilePath(),
          errorRegions);
    }
    return root;
  }

  private void visit(TSNode node, ScopeNode parent) {
    switch (node.getType()) {
      case "if_statement" -> visitIfChain(node, parent);
      case "try_statement" -> visitTry(node, parent);
      case "for_statement" -> visitFor(node, parent);
      case "for_in_statement" -> visitForIn(node, parent);
      default -> visitGeneric(node, parent);
    }
  }

  private void visitGeneric(TSNode node, ScopeNode parent) {
    if ("ERROR".equals(node.getType())) {
      errorRegions++;
    }
    NodeCategory category = classifier.categorize(node);
    if (category == null || source.isZeroWidth(node)) {
      pushAll(namedChildren(node), parent);
      return;
    }
    ScopeNode scopeNode =
        context.createNode(
            category,
            labeler.label(node, category),
            source.start(node),
            source.end(node),
            labeler.meta(node, category));
    parent.addChild(scopeNode);
    if (category != NodeCategory.LITERAL && category != NodeCategory.COMMENT) {
      pushAll(namedChildren(node), scopeNode);
    }
  }

  /** Collapses an if / else if / else chain into one ConditionalBlock. */
  private void visitIfChain(TSNode first, ScopeNode parent) {
    List<TSNode> links = new ArrayList<>();
    TSNode elseBody = null;
    TSNode current = first;
    while (current != null) {
      links.add(current);
      TSNode alternative = field(current, "alternative");
      TSNode next = alternative == null ? null : ScriptSource.firstNamedChild(alternative);
      if (isType(next, "if_statement")) {
        current = next;
      } else {
        elseBody = next;
        current = null;
      }
    }

    TSNode lastBranch = elseBody != null ? elseBody : consequence(links.get(links.size() - 1));
    int chainEnd = lastBranch != null ? source.end(lastBranch) : source.end(first);
    List<ScopeNode> clauses = new ArrayList<>();
    List<List<TSNode>> bodies = new ArrayList<>();
    boolean degenerate = links.size() == 1 && elseBody == null;
    ScopeNode block = null;
    if (!degenerate) {
      block = context.createNode(NodeCategory.CONDITIONAL_BLOCK, "", source.start(first), chainEnd);
    }

    for (int i = 0; i < links.size(); i++) {
      TSNode link = links.get(i);
      TSNode consequence = consequence(link);
      String condition = conditionText(link);
      NodeCategory category = i == 0 ? NodeCategory.IF_CLAUSE : NodeCategory.ELSE_IF_CLAUSE;
      String label = (i == 0 ? "if (" : "else if (") + condition + ")";
      int end = consequence != null ? source.end(consequence) : source.end(link);
      clauses.add(
          context.createNode(
              category,
              label,
              source.start(link),
              end,
              ScopeNodeMeta.builder().condition(condition).build()));
      bodies.add(statementsOf(consequence));
    }
    if (elseBody != null) {
      clauses.add(
          context.createNode(
              NodeCategory.ELSE_CLAUSE, "else", source.start(elseBody), source.end(elseBody)));
      bodies.add(statementsOf(elseBody));
    }

    if (degenerate) {
      frames.push(new Attach(clauses.get(0), parent, bodies.get(0)));
      return;
    }
    block.setLabel(conditionalLabel(clauses));
    for (int i = clauses.size() - 1; i >= 0; i--) {
      frames.push(new Attach(clauses.get(i), block, bodies.get(i)));
    }
    parent.addChild(block);
  }

  private void visitTry(TSNode node, ScopeNode parent) {
    ScopeNode tryNode =
        context.createNode(
            NodeCategory.CONTROL_FLOW, "try", source.start(node), source.end(node));
    parent.addChild(tryNode);

    TSNode handler = field(node, "handler");
    TSNode finalizer = field(node, "finalizer");
    if (finalizer != null) {
      TSNode finallyBody = field(finalizer, "body");
      TSNode span = finallyBody != null ? finallyBody : finalizer;
      ScopeNode finallyNode =
          context.createNode(NodeCategory.BLOCK, "finally", source.start(span), source.end(span));
      frames.push(new Attach(finallyNode, tryNode, statementsOf(finallyBody)));
    }
    if (handler != null) {
      ScopeNode catchNode =
          context.createNode(
              NodeCategory.CONTROL_FLOW, "catch", source.start(handler), source.end(handler));
      frames.push(new Attach(catchNode, tryNode, statementsOf(field(handler, "body"))));
    }
    pushAll(statementsOf(field(node, "body")), tryNode);
  }

  private void visitFor(TSNode node, ScopeNode parent) {
    String initializer = headerPart(field(node, "initializer"));
    String condition = headerPart(field(node, "condition"));
    String increment = headerPart(field(node, "increment"));
    ScopeNodeMeta meta =
        ScopeNodeMeta.builder()
            .loopKind("for")
            .initializer(initializer)
            .condition(condition)
            .increment(increment)
            .build();
    String label = "for (" + initializer + "; " + condition + "; " + increment + ")";
    emitLoop(node, parent, label, meta);
  }

  private void visitForIn(TSNode node, ScopeNode parent) {
    TSNode kind = field(node, "kind");
    String variable =
        (kind != null ? source.text(kind) + " " : "") + source.text(field(node, "left")).trim();
    String iterable = source.text(field(node, "right")).trim();
    String operator = ScriptNodeLabeler.iterationOperator(node, source);
    ScopeNodeMeta meta =
        ScopeNodeMeta.builder()
            .loopKind("for-" + operator)
            .iterationVariable(variable)
            .iterable(iterable)
            .build();
    emitLoop(node, parent, "for (" + variable + " " + operator + " " + iterable + ")", meta);
  }

  private void emitLoop(TSNode node, ScopeNode parent, String label, ScopeNodeMeta meta) {
    ScopeNode loop =
        context.createNode(
            NodeCategory.CONTROL_FLOW, label, source.start(node), source.end(node), meta);
    parent.addChild(loop);
    pushAll(statementsOf(field(node, "body")), loop);
  }

  /** Statements of a block, or the single statement itself. */
  private static List<TSNode> statementsOf(TSNode statement) {
    if (statement == null) {
      return List.of();
    }
    if (isType(statement, "statement_block")) {
      return namedChildren(statement);
    }
    return List.of(statement);
  }

  private static TSNode consequence(TSNode ifStatement) {
    return field(ifStatement, "consequence");
  }

  private String conditionText(TSNode ifStatement) {
    String text = source.text(field(ifStatement, "condition")).trim();
    if (text.startsWith("(") && text.endsWith(")")) {
      text = text.substring(1, text.length() - 1).trim();
    }
    return text;
  }

  private String headerPart(TSNode part) {
    if (part == null) {
      return "";
    }
    String text = source.text(part).trim();
    if (text.endsWith(";")) {
      text = text.substring(0, text.length() - 1).trim();
    }
    return ScopeNodes.collapseWhitespace(text);
  }

  private static String conditionalLabel(List<ScopeNode> clauses) {
    Set<String> kinds = new LinkedHashSet<>();
    for (ScopeNode clause : clauses) {
      switch (clause.getCategory()) {
        case IF_CLAUSE -> kinds.add("if");
        case ELSE_IF_CLAUSE -> kinds.add("else if");
        case ELSE_CLAUSE -> kinds.add("else");
        default -> {}
      }
    }
    return String.join("/", kinds);
  }

  private void pushAll(List<TSNode> nodes, ScopeNode parent) {
    for (int i = nodes.size() - 1; i >= 0; i--) {
      frames.push(new Visit(nodes.get(i), parent));
    }
  }
}
