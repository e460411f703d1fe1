package org.allenai.academicreader.pdfapi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The document engine the structuring pipeline reads from. Implementations own rendering, raw
 * text extraction and block layout; the pipeline treats them as a black box.
 *
 * Missing files surface as {@link java.io.FileNotFoundException}, pages out of range as
 * {@link NoSuchPageException}. Neither is retried by callers.
 */
public interface DocumentEngine {
  PDFDoc getDocument(Path path) throws IOException;

  /**
   * Raw text of the whole document, pages separated by a blank line.
   */
  String getRawText(Path path) throws IOException;

  String getRawText(Path path, int page) throws IOException;

  /**
   * Text blocks of one page, in engine order.
   */
  List<TextBlock> getPageBlocks(Path path, int page) throws IOException;
}
