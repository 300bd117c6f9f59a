package com.flamingo.ai.factcheck.service.retrieval;

/** Whether local evidence is too weak, with the statistics behind the decision. */
public record WebSearchDecision(
    boolean searchWeb, int localCount, double averageRelevance, double maxRelevance, String reason) {}
