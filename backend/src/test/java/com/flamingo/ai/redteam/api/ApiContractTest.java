package com.flamingo.ai.redteam.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.redteam.api.rest.AnalysisController;
import java.lang.reflect.Method;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests that pin the HTTP surface:
 *
 * <ul>
 *   <li>POST /api/analysis - Analyse a batch of documents
 *   <li>POST /api/analysis/validate - Validate one document
 * </ul>
 */
class ApiContractTest {

  @Test
  @DisplayName("AnalysisController should be mapped to /api/analysis")
  void shouldBeMappedToApiAnalysis() {
    RequestMapping mapping = AnalysisController.class.getAnnotation(RequestMapping.class);
    assertThat(mapping).isNotNull();
    assertThat(mapping.value()).containsExactly("/api/analysis");
  }

  @Test
  @DisplayName("AnalysisController should expose analyse and validate POST endpoints")
  void shouldExposePostEndpoints() {
    assertThat(Arrays.stream(AnalysisController.class.getDeclaredMethods()))
        .filteredOn(method -> method.isAnnotationPresent(PostMapping.class))
        .extracting(Method::getName)
        .containsExactlyInAnyOrder("analyze", "validate");

    PostMapping validate =
        Arrays.stream(AnalysisController.class.getDeclaredMethods())
            .filter(method -> method.getName().equals("validate"))
            .findFirst()
            .orElseThrow()
            .getAnnotation(PostMapping.class);
    assertThat(validate.value()).containsExactly("/validate");
  }
}
