package com.flamingo.ai.factcheck.config;

import com.flamingo.ai.factcheck.agent.EvidenceSufficiencyAgent;
import com.flamingo.ai.factcheck.agent.SafetyReviewAgent;
import com.flamingo.ai.factcheck.agent.VerdictSynthesisAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the pipeline's AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: agent interfaces declare @SystemMessage/@UserMessage prompts, concrete
 * implementations are built with AiServices.builder(). Agents return raw text; the calling service
 * owns parsing and defaults.
 */
@Configuration
public class AiAgentConfig {

  /** Judges whether retrieved evidence is sufficient to verify a claim. */
  @Bean
  public EvidenceSufficiencyAgent evidenceSufficiencyAgent(ChatModel chatModel) {
    return AiServices.builder(EvidenceSufficiencyAgent.class).chatModel(chatModel).build();
  }

  /** Writes the structured verdict, evidence list, citations and explanation. */
  @Bean
  public VerdictSynthesisAgent verdictSynthesisAgent(ChatModel chatModel) {
    return AiServices.builder(VerdictSynthesisAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public SafetyReviewAgent safetyReviewAgent(ChatModel chatModel) {
    return AiServices.builder(SafetyReviewAgent.class).chatModel(chatModel).build();
  }
}
