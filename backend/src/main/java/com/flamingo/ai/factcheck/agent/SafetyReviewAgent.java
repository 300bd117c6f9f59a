package com.flamingo.ai.factcheck.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent for reviewing a fact-check answer before it is delivered. */
public interface SafetyReviewAgent {

  @SystemMessage(
      """
        You review fact-check answers for safety and ethics.

        Safety criteria:
        1. No specific legal advice.
        2. No medical diagnoses.
        3. No specific financial advice.
        4. No promotion of violence or hate speech.
        5. Neutral and objective tone.

        Possible decisions:
        - APPROVE: the answer can be delivered as is
        - MODIFY: the answer needs changes before delivery
        - REJECT: the answer must not be delivered

        Reply with exactly these lines:
        DECISION: APPROVE | MODIFY | REJECT
        REASON: explanation of the decision
        SUGGESTIONS: comma separated improvements, empty unless MODIFY
        """)
  @UserMessage(
      """
        Claim: "{{claim}}"
        Conclusion: {{verdict}}
        Answer:
        {{answer}}
        """)
  String review(
      @V("claim") String claim, @V("verdict") String verdict, @V("answer") String answer);
}
