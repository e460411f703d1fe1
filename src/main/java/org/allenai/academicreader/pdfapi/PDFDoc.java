package org.allenai.academicreader.pdfapi;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Handle on a loaded document. Only exposes what the structuring pipeline needs from the engine.
 */
@Data
@Builder
public class PDFDoc {
  public final Path path;
  public final int pageCount;
  public final PDFMetadata meta;
}
