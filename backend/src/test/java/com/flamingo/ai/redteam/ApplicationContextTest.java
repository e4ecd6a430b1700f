package com.flamingo.ai.redteam;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.redteam.service.analysis.LegislativeAnalysisService;
import com.flamingo.ai.redteam.service.graph.GraphBuilderService;
import com.flamingo.ai.redteam.service.loophole.LoopholeDetector;
import com.flamingo.ai.redteam.service.uslm.parsing.UslmDocumentParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies the Spring application context wires the analysis pipeline. */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(UslmDocumentParser.class)).isNotNull();
    assertThat(applicationContext.getBean(GraphBuilderService.class)).isNotNull();
    assertThat(applicationContext.getBean(LoopholeDetector.class)).isNotNull();
    assertThat(applicationContext.getBean(LegislativeAnalysisService.class)).isNotNull();
  }
}
