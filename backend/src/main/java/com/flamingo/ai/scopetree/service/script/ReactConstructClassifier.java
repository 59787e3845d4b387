package com.flamingo.ai.scopetree.service.script;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import java.util.regex.Pattern;

/**
 * Naming and shape rules for component-like and hook-like constructs.
 *
 * <p>The rules are purely syntactic. A capitalized function that returns JSX is a component, a
 * {@code useX} function or call is a hook. Misclassifications are expected and accepted.
 */
public final class ReactConstructClassifier {

  private static final Pattern HOOK_NAME = Pattern.compile("^use[A-Z]");

  private ReactConstructClassifier() {}

  public static NodeCategory classify(ConstructShape shape) {
    return switch (shape.kind()) {
      case CALL -> isHookName(shape.name()) ? NodeCategory.REACT_HOOK : NodeCategory.CALL;
      case FUNCTION -> classifyFunction(shape, NodeCategory.FUNCTION);
      case ARROW_FUNCTION -> classifyFunction(shape, NodeCategory.ARROW_FUNCTION);
      case CLASS -> isComponent(shape) ? NodeCategory.REACT_COMPONENT : NodeCategory.CLASS;
    };
  }

  public static boolean isHookName(String name) {
    return name != null && HOOK_NAME.matcher(name).find();
  }

  private static NodeCategory classifyFunction(ConstructShape shape, NodeCategory fallback) {
    if (isComponent(shape)) {
      return NodeCategory.REACT_COMPONENT;
    }
    if (isHookName(shape.name())) {
      return NodeCategory.REACT_HOOK;
    }
    return fallback;
  }

  private static boolean isComponent(ConstructShape shape) {
    String name = shape.name();
    return shape.returnsJsx()
        && name != null
        && !name.isEmpty()
        && Character.isUpperCase(name.charAt(0));
  }
}
