package org.allenai.academicreader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.allenai.academicreader.pdfapi.DocumentEngine;
import org.allenai.academicreader.pdfapi.PDFBoxDocumentEngine;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runs one operation on one PDF and prints the result as JSON.
 *
 * Usage: {@code AcademicReaderMain <command> <pdf> [page | chunkSize]}
 */
@Slf4j
public class AcademicReaderMain {
  private static final String USAGE =
    "Usage: AcademicReaderMain <command> <pdf> [page | chunkSize]\n" +
    "Commands: metadata, sections, key-sections, abstract, section-summary, citations,\n" +
    "          citation-summary, structure, text, chunks";

  static ObjectWriter jsonWriter() {
    return new ObjectMapper()
      .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING)
      .writer()
      .withDefaultPrettyPrinter();
  }

  static Object run(final DocumentEngine engine, final String command, final Path pdf, final String arg)
    throws IOException {
    final AcademicReader reader = new AcademicReader(engine);
    switch (command) {
      case "metadata":
        return engine.getDocument(pdf);
      case "sections":
        return reader.detectSections(pdf);
      case "key-sections":
        return reader.extractKeySections(pdf);
      case "abstract":
        return reader.extractAbstract(pdf);
      case "section-summary":
        return reader.getSectionSummary(pdf);
      case "citations":
        return reader.extractCitations(pdf);
      case "citation-summary":
        return reader.getCitationSummary(pdf);
      case "structure":
        return reader.analyzeDocumentStructure(pdf);
      case "text":
        return arg == null ? reader.extractAcademicText(pdf) : reader.extractAcademicText(pdf, Integer.parseInt(arg));
      case "chunks":
        return arg == null ? reader.chunkAcademicContent(pdf) : reader.chunkAcademicContent(pdf, Integer.parseInt(arg));
      default:
        throw new IllegalArgumentException("Unknown command: " + command + "\n" + USAGE);
    }
  }

  @SneakyThrows
  public static void main(String[] args) {
    if (args.length < 2) {
      System.err.println(USAGE);
      System.exit(1);
    }
    final Path pdf = Paths.get(args[1]);
    final String arg = args.length > 2 ? args[2] : null;
    try (PDFBoxDocumentEngine engine = new PDFBoxDocumentEngine()) {
      log.info("Running {} on {}", args[0], pdf);
      final Object result = run(engine, args[0], pdf, arg);
      System.out.println(jsonWriter().writeValueAsString(result));
    }
  }
}
