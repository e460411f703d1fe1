package org.allenai.academicreader;

import lombok.Value;

@Value
public class CitationSummary {
  int totalCitations;
  int totalReferences;
  CitationStyle citationStyle;
  boolean hasBibliography;
  boolean heavilyCited;
  ReferenceYears referenceYears;

  /**
   * @param heavilyCitedThreshold a document with more mentions than this is heavily cited
   * @param recentSince first year that counts as recent
   */
  public static CitationSummary of(
    final CitationReport report,
    final int heavilyCitedThreshold,
    final int recentSince
  ) {
    return new CitationSummary(
      report.getCitationCount(),
      report.getReferenceCount(),
      report.getCitationStyle(),
      report.getReferenceCount() > 0,
      report.getCitationCount() > heavilyCitedThreshold,
      ReferenceYears.of(report.getReferences(), recentSince));
  }
}
