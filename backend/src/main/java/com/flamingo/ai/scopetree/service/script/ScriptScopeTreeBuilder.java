package com.flamingo.ai.scopetree.service.script;

import com.flamingo.ai.scopetree.domain.enums.ValueMode;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.service.dispatch.ScopeTreeBuilder;
import com.flamingo.ai.scopetree.service.support.BuildContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.treesitter.TSTree;

/**
 * Builds scope trees for JavaScript, TypeScript and their JSX variants.
 *
 * <p>Catch-all builder: unknown extensions are parsed with the same grammar.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@Slf4j
public class ScriptScopeTreeBuilder implements ScopeTreeBuilder {

  @Override
  public ScopeNode build(String filePath, String fileText) {
    log.debug("Parsing {} as a script", filePath);
    TSTree tree = ScriptGrammar.parse(fileText);
    return new ScriptTreeWalker(new BuildContext(filePath, fileText)).walk(tree.getRootNode());
  }

  @Override
  public boolean supports(String extension) {
    return true;
  }

  @Override
  public ValueMode valueMode() {
    return ValueMode.SELF_PLUS_CHILDREN;
  }

  @Override
  public String name() {
    return "script";
  }
}
