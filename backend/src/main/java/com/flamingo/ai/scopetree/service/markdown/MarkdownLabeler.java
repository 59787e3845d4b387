package com.flamingo.ai.scopetree.service.markdown;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;

/** Categories and labels for the commonmark block types that become scope nodes. */
final class MarkdownLabeler {

  private static final int PARAGRAPH_PREVIEW = 30;
  private static final int BLOCKQUOTE_PREVIEW = 15;
  private static final int LIST_ITEM_PREVIEW = 20;

  private MarkdownLabeler() {}

  /** Category of an allow-listed node, or {@code null} for everything else. */
  static NodeCategory categorize(Node node) {
    if (node instanceof Heading) {
      return NodeCategory.MARKDOWN_HEADING;
    } else if (node instanceof Paragraph) {
      return NodeCategory.MARKDOWN_PARAGRAPH;
    } else if (node instanceof BlockQuote) {
      return NodeCategory.MARKDOWN_BLOCKQUOTE;
    } else if (node instanceof FencedCodeBlock || node instanceof IndentedCodeBlock) {
      return NodeCategory.MARKDOWN_CODE_BLOCK;
    } else if (node instanceof BulletList || node instanceof OrderedList) {
      return NodeCategory.MARKDOWN_LIST;
    } else if (node instanceof ListItem) {
      return NodeCategory.MARKDOWN_LIST_ITEM;
    } else if (node instanceof TableBlock) {
      return NodeCategory.MARKDOWN_TABLE;
    } else if (node instanceof Image) {
      return NodeCategory.MARKDOWN_IMAGE;
    } else if (node instanceof ThematicBreak) {
      return NodeCategory.MARKDOWN_THEMATIC_BREAK;
    }
    return null;
  }

  static String label(Node node, NodeCategory category) {
    return switch (category) {
      case MARKDOWN_HEADING -> "H" + ((Heading) node).getLevel() + ": " + textOf(node);
      case MARKDOWN_PARAGRAPH -> preview(node, PARAGRAPH_PREVIEW, "Paragraph");
      case MARKDOWN_BLOCKQUOTE -> preview(node, BLOCKQUOTE_PREVIEW, "Blockquote");
      case MARKDOWN_LIST_ITEM -> preview(node, LIST_ITEM_PREVIEW, "List Item");
      case MARKDOWN_CODE_BLOCK -> {
        String lang = languageOf(node);
        yield lang == null ? "Code Block" : "Code (" + lang + ")";
      }
      case MARKDOWN_LIST -> listLabel(node);
      case MARKDOWN_TABLE -> "Table";
      case MARKDOWN_IMAGE -> imageLabel((Image) node);
      case MARKDOWN_THEMATIC_BREAK -> "---";
      default -> category.getDisplayName();
    };
  }

  /** First word of a fenced block's info string, or {@code null}. */
  static String languageOf(Node node) {
    if (node instanceof FencedCodeBlock fenced && fenced.getInfo() != null) {
      String info = fenced.getInfo().trim();
      if (!info.isEmpty()) {
        return info.split("\\s+", 2)[0];
      }
    }
    return null;
  }

  private static String listLabel(Node list) {
    String kind = list instanceof OrderedList ? "Ordered List" : "Unordered List";
    Node firstItem = list.getFirstChild();
    String first = firstItem == null ? "" : textOf(firstItem);
    return first.isEmpty() ? kind : kind + ": " + ScopeNodes.truncate(first, LIST_ITEM_PREVIEW);
  }

  private static String imageLabel(Image image) {
    String alt = textOf(image);
    if (!alt.isEmpty()) {
      return alt;
    }
    String title = image.getTitle();
    return title == null || title.isBlank() ? "Image" : title;
  }

  private static String preview(Node node, int max, String fallback) {
    String text = textOf(node);
    return text.isEmpty() ? fallback : ScopeNodes.truncate(text, max);
  }

  /** Plain text of the inline content under {@code node}, whitespace collapsed. */
  static String textOf(Node node) {
    StringBuilder text = new StringBuilder();
    collectText(node, text);
    return ScopeNodes.collapseWhitespace(text.toString());
  }

  private static void collectText(Node node, StringBuilder text) {
    if (node instanceof Text literal) {
      text.append(literal.getLiteral());
    } else if (node instanceof Code code) {
      text.append(code.getLiteral());
    } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
      text.append(' ');
    } else {
      for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
        collectText(child, text);
        if (child.getNext() != null && child instanceof Paragraph) {
          text.append(' ');
        }
      }
    }
  }
}
