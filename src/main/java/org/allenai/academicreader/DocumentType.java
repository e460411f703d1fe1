package org.allenai.academicreader;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentType {
  ACADEMIC_PAPER,
  OTHER_DOCUMENT;

  /**
   * Documents with at least this many recognized sections count as academic papers.
   */
  public static final int MIN_ACADEMIC_SECTIONS = 4;

  public static DocumentType estimate(final int sectionCount) {
    return sectionCount >= MIN_ACADEMIC_SECTIONS ? ACADEMIC_PAPER : OTHER_DOCUMENT;
  }

  @JsonValue
  public String key() {
    return name().toLowerCase();
  }

  @Override
  public String toString() {
    return key();
  }
}
