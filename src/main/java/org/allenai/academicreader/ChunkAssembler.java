package org.allenai.academicreader;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Packs page text into chunks of whole sentences.
 *
 * Sentences are added greedily; a chunk is closed as soon as the next sentence would push it
 * past the character budget. The budget is a soft ceiling: a single sentence longer than the
 * budget becomes a chunk of its own rather than being cut.
 *
 * A chunk closed because the next sentence did not fit ends on that sentence's page, so it can
 * end on a page it has no text from. The last chunk ends on the last page it has text from.
 */
@Slf4j
public class ChunkAssembler {
  public static final int DEFAULT_CHUNK_SIZE = 1000;

  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

  private final int chunkSize;

  public ChunkAssembler() {
    this(DEFAULT_CHUNK_SIZE);
  }

  public ChunkAssembler(final int chunkSize) {
    Preconditions.checkArgument(chunkSize > 0, "Chunk size must be positive, was %s", chunkSize);
    this.chunkSize = chunkSize;
  }

  public List<Chunk> assemble(final List<ProcessedPage> pages) {
    final List<Chunk> chunks = new ArrayList<>();
    final StringBuilder buffer = new StringBuilder();
    int bufferStartPage = -1;
    int bufferEndPage = -1;

    for (final ProcessedPage page : pages) {
      final int pageNumber = page.getPageNumber();
      for (final String raw : SENTENCE_BOUNDARY.split(page.getProcessedText())) {
        final String sentence = raw.trim();
        if (sentence.isEmpty())
          continue;

        if (buffer.length() > 0 && buffer.length() + 1 + sentence.length() > chunkSize) {
          // closed on the page of the sentence that did not fit
          chunks.add(toChunk(chunks.size(), buffer.toString(), bufferStartPage, pageNumber));
          buffer.setLength(0);
        }
        if (buffer.length() == 0) {
          bufferStartPage = pageNumber;
        } else {
          buffer.append(' ');
        }
        buffer.append(sentence);
        bufferEndPage = pageNumber;
      }
    }
    if (buffer.length() > 0)
      chunks.add(toChunk(chunks.size(), buffer.toString(), bufferStartPage, bufferEndPage));

    log.debug("Assembled {} chunks of at most {} characters from {} pages", chunks.size(), chunkSize, pages.size());
    return chunks;
  }

  private static Chunk toChunk(final int id, final String text, final int pageStart, final int pageEnd) {
    return Chunk.builder()
      .chunkId(id)
      .text(text)
      .pageStart(pageStart)
      .pageEnd(pageEnd)
      .wordCount(Words.count(text))
      .build();
  }
}
