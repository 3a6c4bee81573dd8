package com.flamingo.ai.cliniclists;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.cliniclists.service.category.CategoryExtractionService;
import com.flamingo.ai.cliniclists.service.document.SourceDocumentService;
import com.flamingo.ai.cliniclists.service.index.ClinicalRecordIndex;
import com.flamingo.ai.cliniclists.service.index.UnavailableClinicalRecordIndex;
import com.flamingo.ai.cliniclists.service.lists.CategoryListService;
import com.flamingo.ai.cliniclists.service.segmentation.RecordExtractorRouter;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads without external services. The chat model is
 * mocked and Elasticsearch stays disabled, so the unavailable index is wired in.
 */
@SpringBootTest(properties = "lists.storage.base-path=target/test-objects")
class ApplicationContextTest {

  // Requires an API key
  @MockitoBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(SourceDocumentService.class)).isNotNull();
    assertThat(applicationContext.getBean(CategoryExtractionService.class)).isNotNull();
    assertThat(applicationContext.getBean(CategoryListService.class)).isNotNull();
    assertThat(applicationContext.getBean(RecordExtractorRouter.class)).isNotNull();
  }

  @Test
  @DisplayName("Record index should be unavailable when Elasticsearch is disabled")
  void recordIndexShouldBeUnavailable_whenElasticsearchDisabled() {
    ClinicalRecordIndex index = applicationContext.getBean(ClinicalRecordIndex.class);

    assertThat(index).isInstanceOf(UnavailableClinicalRecordIndex.class);
    assertThat(index.isAvailable()).isFalse();
  }
}
