package org.allenai.academicreader;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Pattern;

public enum CitationType {
  NUMBERED,
  AUTHOR_YEAR,
  OTHER;

  private static final Pattern NUMBERED_START = Pattern.compile("\\[\\d");
  private static final Pattern AUTHOR_YEAR_START = Pattern.compile("\\(\\p{Lu}");

  /**
   * Classifies a mention by how it starts: "[" and a digit is numbered, "(" and a capital letter
   * is author-year.
   */
  public static CitationType classify(final String citation) {
    if (NUMBERED_START.matcher(citation).lookingAt())
      return NUMBERED;
    if (AUTHOR_YEAR_START.matcher(citation).lookingAt())
      return AUTHOR_YEAR;
    return OTHER;
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
