package org.allenai.academicreader.pdfapi;

import lombok.Builder;
import lombok.Data;

/**
 * Information-dictionary fields plus a few facts about the file itself. Any of the string fields
 * may be empty; pdf creation programs are inconsistent about what they fill in.
 */
@Builder
@Data
public class PDFMetadata {
  public final String title;
  public final String author;
  public final String subject;
  public final String creator;
  public final String producer;
  public final boolean encrypted;
  public final long fileSize;
}
