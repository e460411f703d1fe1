package org.allenai.academicreader.pdfapi;

import java.io.IOException;

/**
 * Thrown by a {@link DocumentEngine} when a page index is outside of the document.
 */
public class NoSuchPageException extends IOException {
  public final int page;
  public final int pageCount;

  public NoSuchPageException(final int page, final int pageCount) {
    super(String.format("Page %d not found in document with %d pages", page, pageCount));
    this.page = page;
    this.pageCount = pageCount;
  }
}
