package com.squareup.tspan;

import edu.stanford.nlp.ling.CoreLabel;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A set of utility functions for using rules with CoreNLP. This is broken
 * out so that CoreNLP is not strictly necessary in the runtime classpath in order
 * to use the library.
 */
public class CoreNLPUtils {

  /**
   * Wrap a list of CoreNLP tokens as input tokens.
   *
   * @param sentence A list of CoreLabels, representing a sentence, or other span of text.
   *
   * @return The input tokens, one per CoreLabel.
   */
  public static List<CoreLabelInputToken> tokens(List<CoreLabel> sentence) {
    return sentence.stream().map(CoreLabelInputToken::new).collect(Collectors.toList());
  }

  /**
   * A helper for {@link RuleRegistry#call(List)} for matching a list of CoreNLP tokens.
   *
   * @param registry The rules to match.
   * @param sentence A list of CoreLabels, representing a sentence, or other span of text
   *                 to match against.
   *
   * @return The matches of the registry against the sentence.
   */
  public static List<Match> call(RuleRegistry registry, List<CoreLabel> sentence) {
    return registry.call(tokens(sentence));
  }
}
