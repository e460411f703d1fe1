package org.allenai.academicreader;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls mathematical notation out of running text into a side list, leaving
 * {@code [MATH_FORMULA_n]} placeholders behind.
 *
 * Patterns are applied one after the other, each against the text as rewritten by the ones
 * before it, so the order of the pattern list is part of the output contract.
 */
public class MathFormulaIsolator {
  public static final List<Pattern> DEFAULT_PATTERNS = ImmutableList.of(
    Pattern.compile("\\$[^$]+\\$"), // inline
    Pattern.compile("\\$\\$[^$]+\\$\\$"), // display
    Pattern.compile("\\\\begin\\{equation\\}.*?\\\\end\\{equation\\}", Pattern.DOTALL),
    Pattern.compile("\\\\begin\\{align\\}.*?\\\\end\\{align\\}", Pattern.DOTALL),
    Pattern.compile("[∑∏∫∮∆∇α-ωΑ-Ω≤≥≠±∞]"));

  private final List<Pattern> patterns;

  public MathFormulaIsolator() {
    this(DEFAULT_PATTERNS);
  }

  public MathFormulaIsolator(final List<Pattern> patterns) {
    this.patterns = ImmutableList.copyOf(patterns);
  }

  public static String placeholder(final int n) {
    return "[MATH_FORMULA_" + n + "]";
  }

  /**
   * Appends every formula found in {@code text} to {@code formulas} and returns the rewritten
   * text. Placeholder numbers continue from the current size of {@code formulas}, so one list can
   * collect the formulas of several blocks.
   */
  public String isolate(final String text, final List<String> formulas) {
    String current = text;
    for (final Pattern p : patterns) {
      final Matcher m = p.matcher(current);
      final StringBuffer sb = new StringBuffer();
      while (m.find()) {
        formulas.add(m.group());
        m.appendReplacement(sb, Matcher.quoteReplacement(placeholder(formulas.size())));
      }
      m.appendTail(sb);
      current = sb.toString();
    }
    return current;
  }
}
