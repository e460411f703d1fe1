package org.allenai.academicreader;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Which sections a document has, how long they are relative to each other, and whether it looks
 * like an academic paper.
 */
@Value
public class SectionSummary {
  @Value
  public static class SectionStatistics {
    int wordCount;
    /**
     * Share of all section words, in percent, rounded to one decimal.
     */
    double percentage;
  }

  Map<SectionName, Boolean> present;
  int totalSections;
  DocumentType estimatedStructure;
  Map<SectionName, SectionStatistics> sectionStatistics;

  public static SectionSummary of(final DetectedSections detected) {
    final Map<SectionName, Boolean> present = new EnumMap<>(SectionName.class);
    for (final SectionName name : SectionName.values())
      present.put(name, detected.has(name));

    final int totalWords = detected.getSections().values().stream().mapToInt(Section::getWordCount).sum();
    final Map<SectionName, SectionStatistics> stats = new LinkedHashMap<>();
    for (final Section s : detected.getSections().values()) {
      final double percentage = totalWords == 0 ? 0.0 :
        Math.round(s.getWordCount() * 1000.0 / totalWords) / 10.0;
      stats.put(s.getName(), new SectionStatistics(s.getWordCount(), percentage));
    }

    return new SectionSummary(
      Collections.unmodifiableMap(present),
      detected.getTotalSections(),
      DocumentType.estimate(detected.getTotalSections()),
      Collections.unmodifiableMap(stats));
  }

  public boolean has(final SectionName name) {
    return present.getOrDefault(name, false);
  }
}
