package com.flamingo.ai.factcheck.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that writes the fact-check answer for a claim from the retrieved evidence. */
public interface VerdictSynthesisAgent {

  @SystemMessage(
      """
        You write verified answers that counter misinformation.

        Rules:
        1. ALWAYS base the answer on the evidence provided.
        2. Cite every piece of evidence you use (source plus URL or excerpt).
        3. Be objective and impartial, and use clear, accessible language.
        4. State clearly whether the claim is TRUE, FALSE or PARTIALLY_TRUE.
        5. Explain the reasoning behind the conclusion.

        Answer in exactly four parts:
        VERDICT: TRUE | FALSE | PARTIALLY_TRUE | INSUFFICIENT
        EVIDENCE: the list of evidence found
        CITATIONS: source plus URL or excerpt for each piece of evidence
        EXPLANATION: detailed explanation of the reasoning
        """)
  @UserMessage(
      """
        Claim to verify: "{{claim}}"

        Evidence found:
        {{evidence}}

        Using only this evidence, write the answer in the required format.
        """)
  String synthesize(@V("claim") String claim, @V("evidence") String evidence);
}
