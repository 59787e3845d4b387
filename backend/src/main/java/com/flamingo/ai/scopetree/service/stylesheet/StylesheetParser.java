package com.flamingo.ai.scopetree.service.stylesheet;

import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.AMPERSAND;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.COLON;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.COMMENT;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.CUSTOM_PROPERTY;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.HASH;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.IDENTIFIER;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.KEYWORD;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.LBRACE;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.LPAREN;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.RBRACE;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.RPAREN;
import static com.flamingo.ai.scopetree.service.stylesheet.StylesheetTokenType.SEMICOLON;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.domain.model.ScopeNodeMeta;
import com.flamingo.ai.scopetree.service.support.BuildContext;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Descent parser from stylesheet tokens to scope nodes.
 *
 * <p>One instance parses one file. Open blocks live on an explicit stack of frames, so nesting
 * depth is bounded by the heap rather than the call stack. Every parse routine either consumes at
 * least one token or returns {@link Step#NONE} to {@link #parseInto}, which then skips a token, so
 * the parser terminates on any token stream. Rules and at-rules with a block take the block's
 * children directly; no CssBlock node is emitted for them.
 */
final class StylesheetParser {

  static final String ANONYMOUS_RULE = "Anonymous Rule";

  private static final int COMMENT_LABEL_MAX = 50;

  private enum Shape {
    DECLARATION,
    NESTED_RULE,
    NONE
  }

  private record Lookahead(Shape shape, int colonIndex) {
    static final Lookahead NONE = new Lookahead(Shape.NONE, -1);
    static final Lookahead NESTED_RULE = new Lookahead(Shape.NESTED_RULE, -1);
  }

  /** A rule or at-rule whose node is created once its extent is known. */
  private record Header(NodeCategory category, String label, int start, ScopeNodeMeta meta) {}

  /** Outcome of one parse routine: a finished node, a header whose block was opened, or none. */
  private record Step(ScopeNode node, Header opened) {
    static final Step NONE = new Step(null, null);

    static Step of(ScopeNode node) {
      return node == null ? NONE : new Step(node, null);
    }
  }

  /** An open block; the stylesheet itself is the frame without a header. */
  private record Frame(Header header, List<ScopeNode> children) {
    boolean topLevel() {
      return header == null;
    }
  }

  private record Value(String text, int end) {}

  private final BuildContext context;
  private final List<StylesheetToken> tokens;
  private final boolean scss;
  private int position;

  StylesheetParser(BuildContext context, List<StylesheetToken> tokens, boolean scss) {
    this.context = context;
    this.tokens = tokens;
    this.scss = scss;
  }

  void parseStylesheet(ScopeNode root) {
    Deque<Frame> frames = new ArrayDeque<>();
    frames.push(new Frame(null, root.getChildren()));
    while (hasMore()) {
      Frame frame = frames.peek();
      StylesheetToken token = current();
      switch (token.type()) {
        case RBRACE -> {
          position++;
          if (!frame.topLevel()) {
            close(frames, token.end());
          }
        }
        case COMMENT -> {
          frame.children().add(comment(token));
          position++;
        }
        case AT_KEYWORD -> parseInto(frames, this::parseAtRule);
        case LBRACE -> {
          if (frame.topLevel()) {
            parseInto(frames, this::parseRule);
          } else {
            skipBraces();
          }
        }
        case VARIABLE -> {
          if (frame.topLevel() || scss) {
            parseInto(frames, this::parseVariable);
          } else {
            parseInto(frames, this::parseDeclarationOrNestedRule);
          }
        }
        case CUSTOM_PROPERTY -> {
          if (frame.topLevel()) {
            parseInto(frames, this::parseVariable);
          } else {
            parseInto(frames, this::parseDeclarationOrNestedRule);
          }
        }
        default -> {
          if (frame.topLevel()) {
            parseInto(frames, this::parseRule);
          } else {
            parseInto(frames, this::parseDeclarationOrNestedRule);
          }
        }
      }
    }
    while (!frames.peek().topLevel()) {
      close(frames, previousEnd());
    }
  }

  /**
   * Runs {@code routine}, keeps its node or opens its block, and skips one token if it made no
   * progress.
   */
  private void parseInto(Deque<Frame> frames, Supplier<Step> routine) {
    int before = position;
    Step step = routine.get();
    if (step.node() != null) {
      frames.peek().children().add(step.node());
    }
    if (step.opened() != null) {
      frames.push(new Frame(step.opened(), new ArrayList<>()));
    }
    if (position == before) {
      position++;
    }
  }

  // Blocks

  /** Closes the innermost block at {@code end} and hands its node to the enclosing frame. */
  private void close(Deque<Frame> frames, int end) {
    Frame frame = frames.pop();
    Header header = frame.header();
    ScopeNode node =
        context.createNode(header.category(), header.label(), header.start(), end, header.meta());
    frame.children().forEach(node::addChild);
    frames.peek().children().add(node);
  }

  /**
   * Opens the header's block when one follows; otherwise finishes the node at its terminating
   * semicolon or at the last consumed token.
   */
  private Step withBody(
      NodeCategory category, String label, StylesheetToken first, ScopeNodeMeta meta) {
    if (hasMore() && current().is(LBRACE)) {
      position++;
      return new Step(null, new Header(category, label, first.start(), meta));
    }
    int end = previousEnd();
    if (hasMore() && current().is(SEMICOLON)) {
      end = current().end();
      position++;
    }
    return Step.of(context.createNode(category, label, first.start(), end, meta));
  }

  // Rules and declarations

  private Step parseRule() {
    int startIndex = position;
    StylesheetToken first = current();
    scanToBoundary();
    if (!hasMore() || !current().is(LBRACE)) {
      position = startIndex;
      return Step.NONE;
    }
    String selector = joinTokens(startIndex, position);
    return withBody(
        NodeCategory.CSS_RULE,
        selector.isEmpty() ? ANONYMOUS_RULE : selector,
        first,
        ScopeNodeMeta.builder().selector(selector).build());
  }

  private Step parseDeclarationOrNestedRule() {
    Lookahead ahead = lookahead();
    return switch (ahead.shape()) {
      case DECLARATION -> Step.of(parseDeclaration(ahead.colonIndex()));
      case NESTED_RULE -> parseRule();
      case NONE -> Step.NONE;
    };
  }

  /**
   * Decides whether the tokens at the cursor start a declaration or a nested rule.
   *
   * <p>A colon seen before any other token except {@code &} is a pseudo-class colon. Any later
   * colon outside parens, braces and interpolation is a declaration colon, unless an opening
   * brace that is not an interpolation follows it before the next semicolon or closing brace.
   */
  private Lookahead lookahead() {
    int parens = 0;
    int braces = 0;
    boolean atStart = true;
    for (int i = position; i < tokens.size(); i++) {
      StylesheetToken token = tokens.get(i);
      switch (token.type()) {
        case LPAREN -> parens++;
        case RPAREN -> parens = Math.max(0, parens - 1);
        case LBRACE -> {
          if (braces == 0 && parens == 0 && !opensInterpolation(i)) {
            return Lookahead.NESTED_RULE;
          }
          braces++;
        }
        case RBRACE -> {
          if (braces == 0) {
            return Lookahead.NONE;
          }
          braces--;
        }
        case COLON -> {
          if (parens == 0 && braces == 0) {
            if (!atStart) {
              return afterColon(i);
            }
            atStart = false;
          }
        }
        case SEMICOLON -> {
          if (parens == 0 && braces == 0) {
            return Lookahead.NONE;
          }
        }
        default -> {}
      }
      if (!token.is(AMPERSAND) && !token.is(COLON)) {
        atStart = false;
      }
    }
    return Lookahead.NONE;
  }

  private Lookahead afterColon(int colonIndex) {
    for (int i = colonIndex + 1; i < tokens.size(); i++) {
      StylesheetToken token = tokens.get(i);
      if (token.is(LBRACE) && !opensInterpolation(i)) {
        return Lookahead.NESTED_RULE;
      }
      if (token.is(SEMICOLON) || token.is(RBRACE)) {
        break;
      }
    }
    return new Lookahead(Shape.DECLARATION, colonIndex);
  }

  private ScopeNode parseDeclaration(int colonIndex) {
    StylesheetToken first = current();
    String property = joinTokens(position, colonIndex);
    position = colonIndex + 1;
    Value value = scanValue(tokens.get(colonIndex).end());
    return context.createNode(
        NodeCategory.CSS_PROPERTY,
        property + ": " + value.text(),
        first.start(),
        value.end(),
        ScopeNodeMeta.builder()
            .property(property)
            .propertyValue(value.text())
            .customProperty(first.is(CUSTOM_PROPERTY) ? Boolean.TRUE : null)
            .build());
  }

  private Step parseVariable() {
    StylesheetToken name = current();
    if (position + 1 >= tokens.size() || !tokens.get(position + 1).is(COLON)) {
      return Step.NONE;
    }
    position += 2;
    Value value = scanValue(tokens.get(position - 1).end());
    return Step.of(
        context.createNode(
            NodeCategory.CSS_VARIABLE,
            name.value() + ": " + value.text(),
            name.start(),
            value.end(),
            ScopeNodeMeta.builder()
                .variableName(name.value())
                .variableValue(value.text())
                .customProperty(name.is(CUSTOM_PROPERTY) ? Boolean.TRUE : null)
                .build()));
  }

  /**
   * Reads a value up to a semicolon at depth zero, which is consumed, or up to the closing brace
   * of the enclosing block, which is not.
   */
  private Value scanValue(int endSoFar) {
    int valueStart = position;
    int valueEnd = position;
    int end = endSoFar;
    int parens = 0;
    int braces = 0;
    while (hasMore()) {
      StylesheetToken token = current();
      if (token.is(SEMICOLON) && parens == 0 && braces == 0) {
        end = token.end();
        position++;
        break;
      }
      if (token.is(RBRACE)) {
        if (braces == 0) {
          break;
        }
        braces--;
      } else if (token.is(LBRACE)) {
        braces++;
      } else if (token.is(LPAREN)) {
        parens++;
      } else if (token.is(RPAREN)) {
        parens = Math.max(0, parens - 1);
      }
      end = token.end();
      position++;
      valueEnd = position;
    }
    return new Value(joinTokens(valueStart, valueEnd), end);
  }

  // At-rules

  private Step parseAtRule() {
    StylesheetToken keyword = current();
    position++;
    String name = keyword.value().toLowerCase(Locale.ROOT);
    return switch (name) {
      case "@mixin" -> parseCallable(keyword, NodeCategory.CSS_MIXIN);
      case "@function" -> parseCallable(keyword, NodeCategory.CSS_FUNCTION);
      case "@include" -> parseStatement(keyword, NodeCategory.CSS_INCLUDE);
      case "@extend" -> parseStatement(keyword, NodeCategory.CSS_EXTEND);
      case "@import", "@use", "@forward" -> parseStatement(keyword, NodeCategory.CSS_IMPORT);
      case "@media" -> parseMedia(keyword);
      case "@for", "@each", "@while", "@if", "@else" -> parseControlDirective(keyword);
      default ->
          name.endsWith("keyframes") ? parseKeyframes(keyword) : parseGenericAtRule(keyword);
    };
  }

  private Step parseCallable(StylesheetToken keyword, NodeCategory category) {
    if (!hasMore() || !(current().is(IDENTIFIER) || current().is(KEYWORD))) {
      return parseGenericAtRule(keyword);
    }
    String name = current().value();
    position++;
    String parameters = "";
    if (hasMore() && current().is(LPAREN)) {
      int from = position;
      skipParens();
      parameters = joinTokens(from, position);
    }
    scanToBoundary();
    ScopeNodeMeta.ScopeNodeMetaBuilder meta =
        ScopeNodeMeta.builder().parameters(parameters.isEmpty() ? null : parameters);
    if (category == NodeCategory.CSS_MIXIN) {
      meta.mixinName(name);
    } else {
      meta.functionName(name);
    }
    return withBody(category, keyword.value() + " " + name + parameters, keyword, meta.build());
  }

  private Step parseStatement(StylesheetToken keyword, NodeCategory category) {
    int from = position - 1;
    scanToBoundary();
    return withBody(category, joinTokens(from, position), keyword, null);
  }

  private Step parseMedia(StylesheetToken keyword) {
    String condition = header();
    return withBody(
        NodeCategory.CSS_MEDIA_QUERY,
        spaced(keyword.value(), condition),
        keyword,
        ScopeNodeMeta.builder().condition(condition).build());
  }

  private Step parseKeyframes(StylesheetToken keyword) {
    String animationName = header();
    return withBody(
        NodeCategory.CSS_KEYFRAME_RULE,
        spaced(keyword.value(), animationName),
        keyword,
        ScopeNodeMeta.builder().animationName(animationName).build());
  }

  private Step parseControlDirective(StylesheetToken keyword) {
    String expression = header();
    return withBody(
        NodeCategory.CSS_CONTROL_DIRECTIVE,
        spaced(keyword.value(), expression),
        keyword,
        ScopeNodeMeta.builder().directive(keyword.value()).expression(expression).build());
  }

  private Step parseGenericAtRule(StylesheetToken keyword) {
    scanToBoundary();
    String label = context.slice(keyword.start(), previousEnd()).trim();
    return withBody(NodeCategory.CSS_AT_RULE, label, keyword, null);
  }

  /** Reads the tokens after an at-keyword up to its block or semicolon. */
  private String header() {
    int from = position;
    scanToBoundary();
    return joinTokens(from, position);
  }

  // Cursor helpers

  /**
   * Advances to the next {@code {}, {@code ;} or {@code }} outside parens and brackets, skipping
   * interpolations. Semicolons and closing braces stop the scan at any paren depth.
   */
  private void scanToBoundary() {
    int depth = 0;
    while (hasMore()) {
      if (opensInterpolation(position + 1)) {
        skipInterpolation();
        continue;
      }
      StylesheetToken token = current();
      switch (token.type()) {
        case LPAREN, LBRACKET -> depth++;
        case RPAREN, RBRACKET -> depth = Math.max(0, depth - 1);
        case SEMICOLON, RBRACE -> {
          return;
        }
        case LBRACE -> {
          if (depth == 0) {
            return;
          }
        }
        default -> {}
      }
      position++;
    }
  }

  /** Skips {@code #{...}} starting at the hash. */
  private void skipInterpolation() {
    position += 2;
    int depth = 1;
    while (hasMore() && depth > 0) {
      if (current().is(LBRACE)) {
        depth++;
      } else if (current().is(RBRACE)) {
        depth--;
      }
      position++;
    }
  }

  private void skipParens() {
    int depth = 0;
    while (hasMore()) {
      StylesheetToken token = current();
      if (token.is(LPAREN)) {
        depth++;
      } else if (token.is(RPAREN)) {
        depth--;
      } else if (token.is(LBRACE) || token.is(SEMICOLON) || token.is(RBRACE)) {
        return;
      }
      position++;
      if (depth == 0) {
        return;
      }
    }
  }

  private void skipBraces() {
    int depth = 0;
    while (hasMore()) {
      StylesheetToken token = current();
      position++;
      if (token.is(LBRACE)) {
        depth++;
      } else if (token.is(RBRACE) && --depth == 0) {
        return;
      }
    }
  }

  /** Whether the token at {@code index} is a brace directly preceded by {@code #}. */
  private boolean opensInterpolation(int index) {
    if (index <= 0 || index >= tokens.size()) {
      return false;
    }
    StylesheetToken brace = tokens.get(index);
    StylesheetToken hash = tokens.get(index - 1);
    return brace.is(LBRACE) && hash.is(HASH) && hash.end() == brace.start();
  }

  /**
   * Concatenates token values in {@code [from, to)}, skipping comments, with one space wherever
   * the source had a gap.
   */
  private String joinTokens(int from, int to) {
    StringBuilder text = new StringBuilder();
    int previousEnd = -1;
    for (int i = from; i < to && i < tokens.size(); i++) {
      StylesheetToken token = tokens.get(i);
      if (token.is(COMMENT)) {
        continue;
      }
      if (previousEnd >= 0 && token.start() > previousEnd) {
        text.append(' ');
      }
      text.append(token.value());
      previousEnd = token.end();
    }
    return text.toString().trim();
  }

  private ScopeNode comment(StylesheetToken token) {
    String label =
        ScopeNodes.truncateWithin(
            ScopeNodes.firstLine(token.value().trim()), COMMENT_LABEL_MAX);
    return context.createNode(NodeCategory.CSS_COMMENT, label, token.start(), token.end());
  }

  private static String spaced(String keyword, String rest) {
    return rest.isEmpty() ? keyword : keyword + " " + rest;
  }

  private boolean hasMore() {
    return position < tokens.size();
  }

  private StylesheetToken current() {
    return tokens.get(position);
  }

  private int previousEnd() {
    return position > 0 ? tokens.get(Math.min(position, tokens.size()) - 1).end() : 0;
  }
}
