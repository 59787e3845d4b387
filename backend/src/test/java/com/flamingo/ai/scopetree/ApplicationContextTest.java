package com.flamingo.ai.scopetree;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.scopetree.domain.enums.NodeCategory;
import com.flamingo.ai.scopetree.domain.model.ScopeNode;
import com.flamingo.ai.scopetree.service.dispatch.ScopeTreeBuilderRouter;
import com.flamingo.ai.scopetree.service.dispatch.ScopeTreeService;
import com.flamingo.ai.scopetree.service.pipeline.ScopeTreePipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Integration test that verifies the Spring application context loads with every builder. */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Autowired private ScopeTreeBuilderRouter router;

  @Autowired private ScopeTreeService scopeTreeService;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
    assertThat(applicationContext.getBean(ScopeTreePipeline.class)).isNotNull();
  }

  @Test
  @DisplayName("Builders should be registered in routing order")
  void buildersShouldBeOrdered() {
    assertThat(router.builderNames()).containsExactly("markdown", "stylesheet", "script");
  }

  @Test
  @DisplayName("Asynchronous builds should complete through the service proxy")
  void shouldBuildThroughProxy() throws Exception {
    ScopeNode root =
        scopeTreeService
            .buildScopeTreeAsync("notes.md", "# One\n\ntext\n", null)
            .get();

    assertThat(root.getChildren()).hasSize(1);
    assertThat(root.getChildren().get(0).getCategory()).isEqualTo(NodeCategory.MARKDOWN_HEADING);
  }
}
