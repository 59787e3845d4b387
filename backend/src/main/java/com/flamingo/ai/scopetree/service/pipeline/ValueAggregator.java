package com.flamingo.ai.scopetree.service.pipeline;

import com.flamingo.ai.scopetree.domain.enums.ValueMode;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import org.springframework.stereotype.Component;

/**
 * Recomputes node weights over the final tree shape.
 *
 * <p>Leaves weigh 1. With {@link ValueMode#SELF_PLUS_CHILDREN} a parent weighs 1 plus the sum of
 * its children; with {@link ValueMode#CHILDREN_ONLY} it weighs the sum alone. {@link
 * ValueMode#SOURCE_LENGTH} trees keep the weights their builder computed.
 */
@Component
public class ValueAggregator {

  public void aggregate(ScopeNode root, ValueMode mode) {
    if (mode == ValueMode.SOURCE_LENGTH) {
      return;
    }
    long self = mode == ValueMode.SELF_PLUS_CHILDREN ? 1 : 0;
    ScopeNodes.postOrder(
        root,
        node -> {
          if (!node.hasChildren()) {
            node.setValue(1);
            return;
          }
          long sum = self;
          for (ScopeNode child : node.getChildren()) {
            sum += child.getValue();
          }
          node.setValue(sum);
        });
  }
}
