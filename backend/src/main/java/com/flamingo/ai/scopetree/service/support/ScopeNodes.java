package com.flamingo.ai.scopetree.service.support;

import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.function.Consumer;

/** Traversal and text helpers shared by builders and pipeline passes. */
public final class ScopeNodes {

  private static final String ELLIPSIS = "...";

  private ScopeNodes() {}

  /**
   * Visits every node after all of its descendants, using an explicit stack.
   *
   * <p>The visitor may replace the children list of the node it is given; descendants have already
   * been visited by then.
   */
  public static void postOrder(ScopeNode root, Consumer<ScopeNode> visitor) {
    Deque<ScopeNode> pending = new ArrayDeque<>();
    Deque<ScopeNode> ordered = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      ScopeNode node = pending.pop();
      ordered.push(node);
      for (ScopeNode child : node.getChildren()) {
        pending.push(child);
      }
    }
    while (!ordered.isEmpty()) {
      visitor.accept(ordered.pop());
    }
  }

  /** Visits every node before its descendants, in source order. */
  public static void preOrder(ScopeNode root, Consumer<ScopeNode> visitor) {
    Deque<ScopeNode> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      ScopeNode node = pending.pop();
      visitor.accept(node);
      for (int i = node.getChildren().size() - 1; i >= 0; i--) {
        pending.push(node.getChildren().get(i));
      }
    }
  }

  /** Keeps the first {@code max} chars and appends an ellipsis when anything was cut. */
  public static String truncate(String text, int max) {
    if (text.length() <= max) {
      return text;
    }
    return text.substring(0, max) + ELLIPSIS;
  }

  /** Cuts to {@code max - 3} chars plus an ellipsis, so the result never exceeds {@code max}. */
  public static String truncateWithin(String text, int max) {
    if (text.length() <= max) {
      return text;
    }
    return text.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
  }

  public static String firstLine(String text) {
    int newline = text.indexOf('\n');
    String line = newline < 0 ? text : text.substring(0, newline);
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }

  public static String collapseWhitespace(String text) {
    return text.replaceAll("\\s+", " ").trim();
  }

  /** Lower-case extension of a file path without the dot, or empty when there is none. */
  public static String extension(String path) {
    String name = basename(path);
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  /** Last path segment of a file path or module specifier. */
  public static String basename(String path) {
    String trimmed = path;
    while (trimmed.length() > 1 && (trimmed.endsWith("/") || trimmed.endsWith("\\"))) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
    return slash < 0 ? trimmed : trimmed.substring(slash + 1);
  }
}
