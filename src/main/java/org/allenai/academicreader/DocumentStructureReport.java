package org.allenai.academicreader;

import lombok.Value;

@Value
public class DocumentStructureReport {
  SectionSummary sections;
  CitationSummary citations;
}
