package com.flamingo.ai.scopetree.service.markdown;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.enums.ValueMode;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.domain.model.ScopeNodeMeta;
import com.flamingo.ai.scopetree.domain.model.SourceRange;
import com.flamingo.ai.scopetree.service.dispatch.ScopeTreeBuilder;
import com.flamingo.ai.scopetree.service.support.BuildContext;
import com.flamingo.ai.scopetree.service.support.LineIndex;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.SourceSpan;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Builds scope trees for Markdown documents.
 *
 * <p>Only block-level structure is materialized: headings, paragraphs, blockquotes, code blocks,
 * lists, list items, tables, images and thematic breaks. Headings nest by depth through a stack of
 * open heading contexts; other blocks hang under their nearest materialized block ancestor, or
 * under the innermost open heading.
 *
 * <p>After the tree is built, every node below the root carries its own text followed by the
 * aggregated text of its children, one per line, and its value is the length of that text.
 */
@Component
@Order(10)
@Slf4j
public class MarkdownScopeTreeBuilder implements ScopeTreeBuilder {

  private static final Set<String> EXTENSIONS = Set.of("md", "mdx", "markdown");

  private static final Parser PARSER =
      Parser.builder()
          .extensions(List.of(TablesExtension.create()))
          .includeSourceSpans(IncludeSourceSpans.BLOCKS_AND_INLINES)
          .build();

  private record HeadingContext(ScopeNode node, int depth) {}

  @Override
  public ScopeNode build(String filePath, String fileText) {
    BuildContext context = new BuildContext(filePath, fileText);
    ScopeNode root = context.createRoot();
    root.setValue(fileText.length());

    Node document = PARSER.parse(fileText);
    Map<Node, ScopeNode> materialized = new IdentityHashMap<>();
    Deque<HeadingContext> headings = new ArrayDeque<>();
    headings.push(new HeadingContext(root, 0));
    int counter = 0;

    Deque<Node> pending = new ArrayDeque<>();
    pushChildren(document, pending);
    while (!pending.isEmpty()) {
      Node node = pending.pop();
      pushChildren(node, pending);

      NodeCategory category = MarkdownLabeler.categorize(node);
      if (category == null || node.getSourceSpans().isEmpty()) {
        continue;
      }
      int start = startOffset(node, context.getLineIndex());
      int end = Math.min(endOffset(node, context.getLineIndex()), fileText.length());
      if (end <= start) {
        continue;
      }
      ScopeNode scopeNode = createNode(context, node, category, start, end, counter++);
      materialized.put(node, scopeNode);

      if (node instanceof Heading heading) {
        while (headings.size() > 1 && headings.peek().depth() >= heading.getLevel()) {
          headings.pop();
        }
        headings.peek().node().addChild(scopeNode);
        headings.push(new HeadingContext(scopeNode, heading.getLevel()));
      } else {
        ScopeNode parent = blockAncestor(node, materialized);
        (parent != null ? parent : headings.peek().node()).addChild(scopeNode);
      }
    }

    for (ScopeNode child : root.getChildren()) {
      ScopeNodes.postOrder(child, MarkdownScopeTreeBuilder::aggregateSource);
    }
    log.debug("Materialized {} markdown blocks in {}", counter, filePath);
    return root;
  }

  @Override
  public boolean supports(String extension) {
    return EXTENSIONS.contains(extension);
  }

  @Override
  public ValueMode valueMode() {
    return ValueMode.SOURCE_LENGTH;
  }

  @Override
  public String name() {
    return "markdown";
  }

  private static ScopeNode createNode(
      BuildContext context, Node node, NodeCategory category, int start, int end, int counter) {
    SourceRange loc = context.rangeOf(start, end);
    String source = context.slice(start, end);
    String id =
        String.join(
            ":",
            context.getFilePath(),
            String.valueOf(loc.start().line()),
            String.valueOf(loc.start().column()),
            String.valueOf(counter));
    return ScopeNode.builder()
        .id(context.getIds().claim(id))
        .category(category)
        .label(MarkdownLabeler.label(node, category))
        .loc(loc)
        .source(source)
        .value(source.length())
        .meta(metaOf(node, category))
        .build();
  }

  private static ScopeNodeMeta metaOf(Node node, NodeCategory category) {
    return switch (category) {
      case MARKDOWN_HEADING -> ScopeNodeMeta.builder().depth(((Heading) node).getLevel()).build();
      case MARKDOWN_CODE_BLOCK -> {
        String lang = MarkdownLabeler.languageOf(node);
        yield lang == null ? null : ScopeNodeMeta.builder().lang(lang).build();
      }
      case MARKDOWN_LIST -> ScopeNodeMeta.builder().ordered(node instanceof OrderedList).build();
      default -> null;
    };
  }

  /** Nearest materialized ancestor that is not a heading, or {@code null}. */
  private static ScopeNode blockAncestor(Node node, Map<Node, ScopeNode> materialized) {
    for (Node ancestor = node.getParent(); ancestor != null; ancestor = ancestor.getParent()) {
      ScopeNode candidate = materialized.get(ancestor);
      if (candidate != null && candidate.getCategory() != NodeCategory.MARKDOWN_HEADING) {
        return candidate;
      }
    }
    return null;
  }

  private static void aggregateSource(ScopeNode node) {
    if (!node.hasChildren()) {
      return;
    }
    StringBuilder aggregated = new StringBuilder(node.getSource());
    for (ScopeNode child : node.getChildren()) {
      if (!child.getSource().isEmpty()) {
        aggregated.append('\n').append(child.getSource());
      }
    }
    node.setSource(aggregated.toString());
    node.setValue(aggregated.length());
  }

  private static void pushChildren(Node node, Deque<Node> pending) {
    for (Node child = node.getLastChild(); child != null; child = child.getPrevious()) {
      pending.push(child);
    }
  }

  private static int startOffset(Node node, LineIndex lines) {
    SourceSpan first = node.getSourceSpans().get(0);
    return lines.offsetOf(first.getLineIndex(), first.getColumnIndex());
  }

  private static int endOffset(Node node, LineIndex lines) {
    List<SourceSpan> spans = node.getSourceSpans();
    SourceSpan last = spans.get(spans.size() - 1);
    return lines.offsetOf(last.getLineIndex(), last.getColumnIndex()) + last.getLength();
  }
}
