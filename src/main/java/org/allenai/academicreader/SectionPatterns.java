package org.allenai.academicreader;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Header patterns per section name. Each pattern is matched case-insensitively against a trimmed
 * line, anchored at the start of the line but not at its end, so numbered headers such as
 * "3. Methodology and Data" match too.
 */
public class SectionPatterns {
  private final Map<SectionName, List<Pattern>> patterns;

  public SectionPatterns(final Map<SectionName, List<String>> regexes) {
    patterns = new EnumMap<>(SectionName.class);
    for (final Map.Entry<SectionName, List<String>> e : regexes.entrySet()) {
      patterns.put(e.getKey(), e.getValue().stream()
        .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
        .collect(ImmutableList.toImmutableList()));
    }
  }

  private static List<String> list(final String... regexes) {
    return Arrays.asList(regexes);
  }

  public static SectionPatterns defaults() {
    final Map<SectionName, List<String>> m = new EnumMap<>(SectionName.class);
    m.put(SectionName.ABSTRACT, list(
      "^ABSTRACT\\s*$", "^Abstract\\s*$",
      "^\\d+\\.\\s*ABSTRACT", "^\\d+\\.\\s*Abstract"));
    m.put(SectionName.INTRODUCTION, list(
      "^INTRODUCTION\\s*$", "^Introduction\\s*$",
      "^\\d+\\.\\s*INTRODUCTION", "^\\d+\\.\\s*Introduction"));
    m.put(SectionName.METHODS, list(
      "^METHODS?\\s*$", "^Methods?\\s*$", "^METHODOLOGY\\s*$", "^Methodology\\s*$",
      "^\\d+\\.\\s*METHODS?", "^\\d+\\.\\s*Methods?", "^\\d+\\.\\s*METHODOLOGY", "^\\d+\\.\\s*Methodology"));
    m.put(SectionName.RESULTS, list(
      "^RESULTS?\\s*$", "^Results?\\s*$", "^FINDINGS\\s*$", "^Findings\\s*$",
      "^\\d+\\.\\s*RESULTS?", "^\\d+\\.\\s*Results?", "^\\d+\\.\\s*FINDINGS", "^\\d+\\.\\s*Findings"));
    m.put(SectionName.DISCUSSION, list(
      "^DISCUSSION\\s*$", "^Discussion\\s*$",
      "^\\d+\\.\\s*DISCUSSION", "^\\d+\\.\\s*Discussion"));
    m.put(SectionName.CONCLUSION, list(
      "^CONCLUSIONS?\\s*$", "^Conclusions?\\s*$",
      "^\\d+\\.\\s*CONCLUSIONS?", "^\\d+\\.\\s*Conclusions?"));
    m.put(SectionName.REFERENCES, list(
      "^REFERENCES\\s*$", "^References\\s*$", "^BIBLIOGRAPHY\\s*$", "^Bibliography\\s*$",
      "^\\d+\\.\\s*REFERENCES", "^\\d+\\.\\s*References"));
    return new SectionPatterns(m);
  }

  public List<Pattern> patternsFor(final SectionName name) {
    return patterns.getOrDefault(name, Collections.emptyList());
  }

  /**
   * Returns the first section name, in {@link SectionName} order, with a pattern matching the
   * line, or null.
   */
  public SectionName match(final String line) {
    for (final SectionName name : SectionName.values()) {
      for (final Pattern p : patternsFor(name)) {
        if (p.matcher(line).lookingAt())
          return name;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return patterns.entrySet().stream()
      .map(e -> e.getKey().key() + "=" + e.getValue().size())
      .collect(Collectors.joining(", ", "SectionPatterns(", ")"));
  }
}
