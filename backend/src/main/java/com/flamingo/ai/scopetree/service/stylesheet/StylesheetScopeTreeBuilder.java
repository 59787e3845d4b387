package com.flamingo.ai.scopetree.service.stylesheet;

import com.flamingo.ai.scopetree.domain.enums.ValueMode;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.service.dispatch.ScopeTreeBuilder;
import com.flamingo.ai.scopetree.service.support.BuildContext;
import com.flamingo.ai.scopetree.service.support.ScopeNodes;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Builds scope trees for CSS and SCSS with the hand-written tokenizer and parser. */
@Component
@Order(20)
@Slf4j
public class StylesheetScopeTreeBuilder implements ScopeTreeBuilder {

  private static final Set<String> EXTENSIONS = Set.of("css", "scss");

  @Override
  public ScopeNode build(String filePath, String fileText) {
    boolean scss = "scss".equals(ScopeNodes.extension(filePath));
    BuildContext context = new BuildContext(filePath, fileText);
    List<StylesheetToken> tokens = new StylesheetTokenizer(fileText, scss).tokenize();
    log.debug("Tokenized {} into {} tokens", filePath, tokens.size());

    ScopeNode root = context.createRoot();
    new StylesheetParser(context, tokens, scss).parseStylesheet(root);
    return root;
  }

  @Override
  public boolean supports(String extension) {
    return EXTENSIONS.contains(extension);
  }

  @Override
  public ValueMode valueMode() {
    return ValueMode.CHILDREN_ONLY;
  }

  @Override
  public String name() {
    return "stylesheet";
  }
}
