package org.allenai.academicreader;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of section names the detector recognizes, in the order their header patterns
 * are checked.
 */
public enum SectionName {
  ABSTRACT,
  INTRODUCTION,
  METHODS,
  RESULTS,
  DISCUSSION,
  CONCLUSION,
  REFERENCES;

  @JsonValue
  public String key() {
    return name().toLowerCase();
  }

  @Override
  public String toString() {
    return key();
  }
}
