package org.allenai.academicreader;

import lombok.Builder;
import lombok.Value;

/**
 * A sentence-aligned slice of document text. {@code pageStart} is the page of its first sentence
 * and {@code pageEnd} the page where it was closed, so a chunk may span pages.
 */
@Builder
@Value
public class Chunk {
  int chunkId;
  String text;
  int pageStart;
  int pageEnd;
  int wordCount;
}
