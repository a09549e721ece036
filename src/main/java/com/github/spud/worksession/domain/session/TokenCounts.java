package com.github.spud.worksession.domain.session;

/**
 * Token usage of a session. {@code total} is always {@code input + output}.
 */
public record TokenCounts(long input, long output, long total) {

  public static final TokenCounts ZERO = new TokenCounts(0, 0, 0);

  public TokenCounts {
    if (total != input + output) {
      throw new IllegalArgumentException(
        "total must equal input + output: " + input + " + " + output + " != " + total);
    }
  }

  public static TokenCounts of(long input, long output) {
    return new TokenCounts(input, output, input + output);
  }
}
