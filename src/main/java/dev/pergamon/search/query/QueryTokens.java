package dev.pergamon.search.query;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Whitespace tokenisation shared by query analysis, retrieval and relevance scoring. */
public final class QueryTokens {

  /** Any run of Unicode whitespace, including U+3000 and U+00A0. */
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private QueryTokens() {}

  /**
   * Splits text on Unicode whitespace.
   *
   * @param text the text to split
   * @return the non-empty tokens in order; empty if {@code text} holds only whitespace
   */
  public static List<String> split(String text) {
    List<String> tokens = new ArrayList<>();
    for (String token : WHITESPACE.split(text)) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }
}
