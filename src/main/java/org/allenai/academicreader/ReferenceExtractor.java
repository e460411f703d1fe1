package org.allenai.academicreader;

import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.allenai.academicreader.ReferencePatterns.FieldPattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns the content of a references section into {@link ReferenceEntry}s.
 *
 * Works in two passes. Segmentation groups lines into entries: a line that starts with "[n]",
 * "n." or "Surname," opens a new entry, any other line continues the current one. Parsing then
 * pulls fields out of each entry. Entries shorter than the minimum length are noise (page
 * numbers, running heads) and are skipped; numbering counts only the entries that are kept.
 */
@Slf4j
public class ReferenceExtractor {
  public static final int DEFAULT_MIN_LENGTH = 20;
  public static final long DEFAULT_REGEX_TIMEOUT_MS = 1000;

  private final ReferencePatterns patterns;
  private final int minLength;
  private final long regexTimeoutMs;

  public ReferenceExtractor() {
    this(ReferencePatterns.defaults(), DEFAULT_MIN_LENGTH, DEFAULT_REGEX_TIMEOUT_MS);
  }

  public ReferenceExtractor(final ReferencePatterns patterns, final int minLength, final long regexTimeoutMs) {
    this.patterns = patterns;
    this.minLength = minLength;
    this.regexTimeoutMs = regexTimeoutMs;
  }

  public List<ReferenceEntry> extract(final String sectionContent) {
    final List<ReferenceEntry> out = new ArrayList<>();
    for (final String raw : segment(sectionContent)) {
      final ReferenceEntry entry = parse(raw, out.size() + 1);
      if (entry != null)
        out.add(entry);
    }
    log.debug("Extracted {} references", out.size());
    return out;
  }

  @VisibleForTesting
  List<String> segment(final String sectionContent) {
    final List<String> lines = Arrays.stream(sectionContent.split("\n"))
      .map(String::trim)
      .filter(l -> !l.isEmpty())
      .collect(Collectors.toList());

    final List<String> entries = new ArrayList<>();
    StringBuilder current = null;
    for (final String line : lines) {
      if (startsEntry(line)) {
        if (current != null)
          entries.add(current.toString());
        current = new StringBuilder(line);
      } else if (current != null) {
        current.append(' ').append(line);
      } else {
        // continuation with nothing to continue: treat it as an entry of its own
        current = new StringBuilder(line);
      }
    }
    if (current != null)
      entries.add(current.toString());
    return entries;
  }

  private boolean startsEntry(final String line) {
    for (final Pattern p : patterns.getEntryStarts()) {
      if (p.matcher(line).lookingAt())
        return true;
    }
    return false;
  }

  private String stripNumberMarker(final String s) {
    String out = s;
    for (final Pattern p : patterns.getNumberMarkers())
      out = p.matcher(out).replaceFirst("");
    return out;
  }

  private static String trimTrailingPunctuation(final String s) {
    return s.replaceAll("[.,;]+$", "");
  }

  /**
   * Parses one segmented entry. Returns null for entries too short to be a reference.
   */
  @VisibleForTesting
  ReferenceEntry parse(final String rawText, final int referenceNumber) {
    final String text = rawText.trim();
    if (text.length() < minLength)
      return null;

    val builder = ReferenceEntry.builder()
      .referenceNumber(referenceNumber)
      .rawText(text);

    final Matcher year = patterns.getYear().matcher(text);
    if (year.find()) {
      builder.year(year.group("year"));
      builder.authorsRaw(stripNumberMarker(text.substring(0, year.start()).trim()).trim());
    }

    final Matcher doi = patterns.getDoi().matcher(text);
    if (doi.find())
      builder.doi(trimTrailingPunctuation(doi.group(1)));

    final Matcher url = patterns.getUrl().matcher(text);
    if (url.find())
      builder.url(trimTrailingPunctuation(url.group()));

    final String body = stripNumberMarker(text);
    for (final FieldPattern fp : patterns.getFieldPatterns()) {
      try {
        final Matcher m = RegexWithTimeout.matcher(fp.getPattern(), body, regexTimeoutMs);
        if (!m.lookingAt())
          continue;
        if (fp.getFields().contains("title"))
          builder.title(orEmpty(m.group("title")).trim());
        if (fp.getFields().contains("journal"))
          builder.journal(orEmpty(m.group("journal")).trim());
        if (fp.getFields().contains("volume"))
          builder.volume(orEmpty(m.group("volume")));
        if (fp.getFields().contains("issue"))
          builder.issue(orEmpty(m.group("issue")));
        if (fp.getFields().contains("pages"))
          builder.pages(orEmpty(m.group("pages")).replaceAll("\\s+", ""));
        break;
      } catch (final RegexWithTimeout.RegexTimeout e) {
        log.warn("Gave up matching reference {} against {}", referenceNumber, fp.getPattern().pattern());
      }
    }
    return builder.build();
  }

  private static String orEmpty(final String s) {
    return s == null ? "" : s;
  }
}
