package org.allenai.academicreader;

import lombok.Value;

import java.util.List;

@Value
public class AcademicText {
  String fullText;
  List<ProcessedPage> pages;
  int totalPages;
}
