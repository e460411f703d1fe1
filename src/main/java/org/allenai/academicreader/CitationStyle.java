package org.allenai.academicreader;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public enum CitationStyle {
  NUMBERED("numbered"),
  APA_HARVARD("apa_harvard"),
  MIXED("mixed"),
  UNKNOWN("unknown");

  private final String key;

  CitationStyle(final String key) {
    this.key = key;
  }

  /**
   * The majority mention type wins; a tie between numbered and author-year mentions is mixed.
   */
  public static CitationStyle detect(final List<CitationMention> mentions) {
    if (mentions.isEmpty())
      return UNKNOWN;
    final long numbered = mentions.stream().filter(m -> m.getType() == CitationType.NUMBERED).count();
    final long authorYear = mentions.stream().filter(m -> m.getType() == CitationType.AUTHOR_YEAR).count();
    if (numbered > authorYear)
      return NUMBERED;
    if (authorYear > numbered)
      return APA_HARVARD;
    return MIXED;
  }

  @JsonValue
  public String key() {
    return key;
  }

  @Override
  public String toString() {
    return key;
  }
}
