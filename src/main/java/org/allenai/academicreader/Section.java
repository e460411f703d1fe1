package org.allenai.academicreader;

import lombok.Builder;
import lombok.Value;

/**
 * A named section of a document. {@code lineStart} is the line after the header and
 * {@code lineEnd} the last line before the next header (or the last line of the document), both
 * indices into the lines of the text the detector ran on.
 */
@Builder
@Value
public class Section {
  SectionName name;
  String content;
  int lineStart;
  int lineEnd;
  int wordCount;
}
