package com.flamingo.ai.cliniclists.config;

import com.flamingo.ai.cliniclists.agent.CategoryExtractionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agent interfaces declare their prompt with @UserMessage; implementations are generated with
 * AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Category extraction agent listing the {@code ###} headings of an assembled document. */
  @Bean
  public CategoryExtractionAgent categoryExtractionAgent(ChatModel chatModel) {
    return AiServices.builder(CategoryExtractionAgent.class).chatModel(chatModel).build();
  }
}
