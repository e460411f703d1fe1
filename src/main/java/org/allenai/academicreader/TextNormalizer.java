package org.allenai.academicreader;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Repairs the spacing damage text extraction leaves behind. Rules run in list order and the
 * order matters: later rules assume whitespace has already been collapsed.
 *
 * With the default rules normalizing is idempotent: no rule can produce input that an earlier
 * rule would still rewrite.
 */
public class TextNormalizer {
  @Value
  public static class Rule {
    Pattern pattern;
    String replacement;

    public static Rule of(final String regex, final String replacement) {
      return new Rule(Pattern.compile(regex), replacement);
    }

    public String apply(final String text) {
      return pattern.matcher(text).replaceAll(replacement);
    }
  }

  public static final List<Rule> DEFAULT_RULES = ImmutableList.of(
    Rule.of("\\s+", " "),
    // missing inter-word space: "wordWord"
    Rule.of("(?<=\\p{Ll})(?=\\p{Lu})", " "),
    // hyphen-broken word: "exam- ple"
    Rule.of("(?<=\\w)-\\s+(?=\\p{Ll})", ""),
    Rule.of("\\s+(?=[.,;:])", ""),
    Rule.of("\\n\\s*\\n", "\n\n"));

  private final List<Rule> rules;

  public TextNormalizer() {
    this(DEFAULT_RULES);
  }

  public TextNormalizer(final List<Rule> rules) {
    this.rules = ImmutableList.copyOf(rules);
  }

  public String normalize(final String text) {
    String s = text;
    for (final Rule rule : rules)
      s = rule.apply(s);
    return s.trim();
  }

  /**
   * Normalizes every line on its own. The result has exactly as many lines as the input, so line
   * numbers computed on it refer to the same lines of the original.
   */
  public String normalizeLines(final String text) {
    final String[] lines = text.split("\n", -1);
    final StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < lines.length; i++) {
      if (i > 0)
        sb.append('\n');
      sb.append(normalize(lines[i]));
    }
    return sb.toString();
  }
}
