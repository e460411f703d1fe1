package org.allenai.academicreader;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a document into named sections by scanning it line by line for section headers.
 *
 * The scan is a two-state machine: either no section is open, or one is open and collecting
 * lines. A header closes the open section and opens a new one; any other line goes to the open
 * section, or is dropped if none is open yet. Blank lines are skipped and sections that never
 * collected a line are not reported.
 */
@Slf4j
public class SectionDetector {
  private final SectionPatterns patterns;

  public SectionDetector() {
    this(SectionPatterns.defaults());
  }

  public SectionDetector(final SectionPatterns patterns) {
    this.patterns = patterns;
  }

  public List<Section> detect(final String text) {
    final String[] lines = text.split("\n", -1);
    final List<Section> out = new ArrayList<>();

    SectionName current = null;
    int headerLine = -1;
    final List<String> content = new ArrayList<>();

    for (int i = 0; i < lines.length; i++) {
      final String line = lines[i].trim();
      if (line.isEmpty())
        continue;

      final SectionName detected = patterns.match(line);
      if (detected != null) {
        if (current != null)
          close(out, current, content, headerLine + 1, i - 1);
        current = detected;
        headerLine = i;
        content.clear();
      } else if (current != null) {
        content.add(line);
      }
    }
    if (current != null)
      close(out, current, content, headerLine + 1, lines.length - 1);

    log.debug("Detected {} sections in {} lines", out.size(), lines.length);
    return out;
  }

  private static void close(
    final List<Section> out,
    final SectionName name,
    final List<String> content,
    final int lineStart,
    final int lineEnd
  ) {
    if (content.isEmpty())
      return;
    final String joined = String.join("\n", content).trim();
    out.add(Section.builder()
      .name(name)
      .content(joined)
      .lineStart(lineStart)
      .lineEnd(lineEnd)
      .wordCount(Words.count(joined))
      .build());
  }
}
