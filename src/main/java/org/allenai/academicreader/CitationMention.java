package org.allenai.academicreader;

import lombok.Value;

/**
 * One in-text citation. {@code position} is a character offset into the text the mention was
 * found in; {@code context} is the text around it.
 */
@Value
public class CitationMention {
  String citationText;
  int position;
  String context;
  CitationType type;
}
