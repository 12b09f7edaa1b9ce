package com.flamingo.ai.mathgrader.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that answers a math question so the answer can be graded.
 *
 * <p>The answer format instruction is passed in per call because it can be changed at runtime.
 */
public interface MathSolverAgent {

  @SystemMessage(
      """
        You are an expert mathematician. Solve the problem step by step and finish with
        the final answer written in LaTeX.
        """)
  @UserMessage("""
        {{question}}

        {{suffix}}
        """)
  String solve(@V("question") String question, @V("suffix") String suffix);

  /** Sends the prompt as is, without system message or answer format instruction. */
  String ask(@UserMessage String prompt);
}
