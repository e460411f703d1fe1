package org.allenai.academicreader;

import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds in-text citation mentions.
 *
 * Mentions are unique by their literal text: a second "(Smith, 2020)" further down the document
 * is dropped and only the earliest one is reported.
 */
@Slf4j
public class CitationExtractor {
  public static final int DEFAULT_CONTEXT_WIDTH = 50;

  private final List<Pattern> patterns;
  private final int contextWidth;

  public CitationExtractor() {
    this(CitationPatterns.DEFAULT_PATTERNS, DEFAULT_CONTEXT_WIDTH);
  }

  public CitationExtractor(final List<Pattern> patterns, final int contextWidth) {
    this.patterns = ImmutableList.copyOf(patterns);
    this.contextWidth = contextWidth;
  }

  public List<CitationMention> findMentions(final String text) {
    final List<CitationMention> pool = new ArrayList<>();
    for (final Pattern p : patterns) {
      final Matcher m = p.matcher(text);
      while (m.find()) {
        final String citation = m.group();
        final int start = m.start();
        final int contextStart = Math.max(0, start - contextWidth);
        final int contextEnd = Math.min(text.length(), m.end() + contextWidth);
        pool.add(new CitationMention(
          citation,
          start,
          text.substring(contextStart, contextEnd),
          CitationType.classify(citation)));
      }
    }

    // List.sort is stable, so mentions at the same offset keep pattern order
    pool.sort(Comparator.comparingInt(CitationMention::getPosition));
    final Set<String> seen = new HashSet<>();
    final List<CitationMention> out = new ArrayList<>();
    for (final CitationMention mention : pool) {
      if (seen.add(mention.getCitationText()))
        out.add(mention);
    }
    log.debug("Found {} citation matches, {} distinct", pool.size(), out.size());
    return out;
  }
}
