package org.allenai.academicreader;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.regex.Pattern;

/**
 * In-text citation patterns. Every pattern is run over the whole text, so the order only decides
 * which of two mentions starting at the same offset is listed first.
 */
public class CitationPatterns {
  public static final String AUTHOR = "\\p{Lu}\\p{Ll}+";
  public static final String YEAR = "\\d{4}[a-z]?";

  public static final List<Pattern> DEFAULT_PATTERNS = ImmutableList.of(
    // (Smith et al., 2020)
    Pattern.compile("\\((" + AUTHOR + " et al\\.?, " + YEAR + ")\\)"),
    // (Smith & Jones, 2020)
    Pattern.compile("\\((" + AUTHOR + " & " + AUTHOR + ", " + YEAR + ")\\)"),
    // (Smith, 2020)
    Pattern.compile("\\((" + AUTHOR + ", " + YEAR + ")\\)"),
    // [1]
    Pattern.compile("\\[(\\d+)\\]"),
    // [1-3]
    Pattern.compile("\\[(\\d+)-(\\d+)\\]"),
    // [1, 2, 3]
    Pattern.compile("\\[(\\d+,\\s*\\d+(?:,\\s*\\d+)*)\\]"));

  private CitationPatterns() { }
}
