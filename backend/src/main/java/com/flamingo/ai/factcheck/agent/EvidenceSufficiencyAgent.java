package com.flamingo.ai.factcheck.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for judging whether retrieved evidence is enough to verify a claim.
 *
 * <p>The prompt is deliberately permissive: evidence on the same topic counts as sufficient even
 * without a direct factual match.
 */
public interface EvidenceSufficiencyAgent {

  @SystemMessage(
      """
        You evaluate the quality and sufficiency of evidence for fact-checking news claims.

        Rules:
        1. If the documents are RELEVANT to the topic of the claim, answer SUFFICIENT.
        2. Do not require direct evidence. Indirect evidence is acceptable.
        3. Documents about the same subject (e.g. vaccines, health, climate) are SUFFICIENT.
        4. Combine general knowledge with the documents when judging.
        5. Be permissive whenever there is thematic relevance.

        Examples:
        - Claim "Vaccines cause autism" + documents on "vaccines are safe" = SUFFICIENT
        - Claim "Global warming is real" + documents on "climate change" = SUFFICIENT
        - Claim "Exercise improves health" + documents on "COVID vaccines" = INSUFFICIENT

        Reply with exactly these three lines:
        DECISION: SUFFICIENT | INSUFFICIENT | CONTRADICTORY
        CONFIDENCE: a number between 0.0 and 1.0
        REASONING: one paragraph explaining the decision
        """)
  @UserMessage(
      """
        Claim to verify: "{{claim}}"

        Documents found:
        {{documents}}

        Is there enough evidence to verify this claim?
        """)
  String assess(@V("claim") String claim, @V("documents") String documents);
}
