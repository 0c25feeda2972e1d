package com.flamingo.ai.stap.service.cache;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Produces canonical cache keys from raw query strings so that trivially different inputs
 * ("Hello!", " hello ") share one cache slot.
 *
 * <p>Steps: lowercase, drop everything that is neither a word character nor whitespace, collapse
 * whitespace runs to a single space, trim. A {@code null} query is treated as the empty string. An
 * input that normalizes to {@code ""} is still a valid key.
 */
public final class QueryNormalizer {

  private static final Pattern NON_WORD =
      Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private QueryNormalizer() {}

  /**
   * Normalizes a raw query into a cache key.
   *
   * @param rawQuery the query as typed by the user, may be {@code null}
   * @return the normalized key, never {@code null}
   */
  public static String normalize(String rawQuery) {
    if (rawQuery == null || rawQuery.isEmpty()) {
      return "";
    }
    String lowered = rawQuery.toLowerCase(Locale.ROOT);
    String stripped = NON_WORD.matcher(lowered).replaceAll("");
    return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
  }
}
