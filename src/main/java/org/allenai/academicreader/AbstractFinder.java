package org.allenai.academicreader;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Finds the abstract: the content of the abstract section when there is one, otherwise the first
 * of the opening paragraphs whose length and vocabulary look like an abstract.
 */
public class AbstractFinder {
  public static final List<String> DEFAULT_KEYWORDS =
    ImmutableList.of("study", "research", "analysis", "investigation");

  private final int paragraphsToScan;
  private final int minWords;
  private final int maxWords;
  private final List<String> keywords;

  public AbstractFinder() {
    this(5, 50, 300, DEFAULT_KEYWORDS);
  }

  /**
   * @param minWords exclusive lower bound on the words of a fallback paragraph
   * @param maxWords exclusive upper bound on the words of a fallback paragraph
   */
  public AbstractFinder(final int paragraphsToScan, final int minWords, final int maxWords, final List<String> keywords) {
    this.paragraphsToScan = paragraphsToScan;
    this.minWords = minWords;
    this.maxWords = maxWords;
    this.keywords = ImmutableList.copyOf(keywords);
  }

  public AbstractExtraction find(final DetectedSections sections, final String documentText) {
    final Section section = sections.get(SectionName.ABSTRACT);
    if (section != null)
      return new AbstractExtraction(section.getContent(), section.getWordCount(), true, AbstractExtraction.METHOD_SECTION);

    final List<String> paragraphs = Arrays.asList(documentText.split("\n\n"));
    for (final String para : paragraphs.subList(0, Math.min(paragraphsToScan, paragraphs.size()))) {
      final int words = Words.count(para);
      if (words <= minWords || words >= maxWords)
        continue;
      final String lower = para.toLowerCase(Locale.ROOT);
      if (keywords.stream().anyMatch(lower::contains))
        return new AbstractExtraction(para.trim(), words, true, AbstractExtraction.METHOD_HEURISTIC);
    }
    return AbstractExtraction.notFound();
  }
}
