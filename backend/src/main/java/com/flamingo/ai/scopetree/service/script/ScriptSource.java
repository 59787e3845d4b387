package com.flamingo.ai.scopetree.service.script;

import com.flamingo.ai.scopetree.service.support.Utf8OffsetMapper;
import java.util.ArrayList;
import java.util.List;
import org.treesitter.TSNode;

/**
 * Source text of one script file, seen through tree-sitter nodes.
 *
 * <p>Tree-sitter reports byte offsets into the modified UTF-8 text it receives over JNI; every
 * offset handed out here is a Java char offset.
 */
final class ScriptSource {

  private final String text;
  private final Utf8OffsetMapper offsets;

  ScriptSource(String text) {
    this.text = text;
    this.offsets = new Utf8OffsetMapper(text);
  }

  String text() {
    return text;
  }

  int start(TSNode node) {
    return offsets.toCharOffset(node.getStartByte());
  }

  int end(TSNode node) {
    return offsets.toCharOffset(node.getEndByte());
  }

  boolean isZeroWidth(TSNode node) {
    return node.getStartByte() == node.getEndByte();
  }

  String text(TSNode node) {
    if (node == null) {
      return "";
    }
    return text.substring(start(node), end(node));
  }

  /** Field child, or {@code null} when the field is absent. */
  static TSNode field(TSNode node, String name) {
    TSNode child = node.getChildByFieldName(name);
    return child == null || child.isNull() ? null : child;
  }

  /** Named children in source order, read through {@code getChild} and filtered on isNamed. */
  static List<TSNode> namedChildren(TSNode node) {
    int count = node.getChildCount();
    List<TSNode> children = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      TSNode child = node.getChild(i);
      if (child != null && !child.isNull() && child.isNamed()) {
        children.add(child);
      }
    }
    return children;
  }

  /** First named child that is not a comment. */
  static TSNode firstNamedChild(TSNode node) {
    for (TSNode child : namedChildren(node)) {
      if (!"comment".equals(child.getType())) {
        return child;
      }
    }
    return null;
  }

  /** First anonymous token child whose text is one of {@code candidates}. */
  static String anonymousToken(TSNode node, String... candidates) {
    int count = node.getChildCount();
    for (int i = 0; i < count; i++) {
      TSNode child = node.getChild(i);
      if (child == null || child.isNull() || child.isNamed()) {
        continue;
      }
      for (String candidate : candidates) {
        if (candidate.equals(child.getType())) {
          return candidate;
        }
      }
    }
    return null;
  }

  static TSNode parent(TSNode node) {
    TSNode parent = node.getParent();
    return parent == null || parent.isNull() ? null : parent;
  }

  static boolean isType(TSNode node, String type) {
    return node != null && type.equals(node.getType());
  }
}
