package org.allenai.academicreader;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Whitespace-token counting and truncation.
 */
public final class Words {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private Words() { }

  private static String[] split(final String text) {
    final String trimmed = text.trim();
    return trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
  }

  public static int count(final String text) {
    return split(text).length;
  }

  /**
   * Cuts text down to its first {@code limit} words joined by single spaces and appends the
   * marker. Text within the limit is returned unchanged.
   */
  public static String truncate(final String text, final int limit, final String marker) {
    final String[] words = split(text);
    if (words.length <= limit)
      return text;
    return String.join(" ", Arrays.asList(words).subList(0, limit)) + marker;
  }
}
