package org.allenai.academicreader;

import lombok.Value;

import java.util.List;

@Value
public class CitationReport {
  List<CitationMention> inTextCitations;
  List<ReferenceEntry> references;
  int citationCount;
  int referenceCount;
  CitationStyle citationStyle;

  public static CitationReport of(final List<CitationMention> mentions, final List<ReferenceEntry> references) {
    return new CitationReport(
      mentions,
      references,
      mentions.size(),
      references.size(),
      CitationStyle.detect(mentions));
  }
}
