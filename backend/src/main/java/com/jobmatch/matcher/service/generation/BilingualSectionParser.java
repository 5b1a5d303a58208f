package com.jobmatch.matcher.service.generation;

import org.springframework.stereotype.Component;

import lombok.Value;

/**
 * Extracts the English and French sections from a response laid out as {@code ### English
 * Version} followed by {@code ### Version Française}. A missing section comes back empty.
 */
@Component
public class BilingualSectionParser {

  static final String SECTION_MARKER = "### ";
  static final String ENGLISH_HEADING = "English Version";
  static final String FRENCH_HEADING = "Version Française";

  public BilingualText parse(String markdown) {
    if (markdown == null || markdown.isEmpty()) {
      return BilingualText.EMPTY;
    }
    String english = "";
    String french = "";
    for (String section : markdown.split(SECTION_MARKER, -1)) {
      if (section.startsWith(ENGLISH_HEADING)) {
        english = body(section, ENGLISH_HEADING);
      } else if (section.startsWith(FRENCH_HEADING)) {
        french = body(section, FRENCH_HEADING);
      }
    }
    return new BilingualText(english, french);
  }

  private static String body(String section, String heading) {
    int newline = section.indexOf('\n', heading.length());
    if (newline < 0) {
      return "";
    }
    return section.substring(newline + 1).strip();
  }

  /** English and French renderings of one generated answer. */
  @Value
  public static class BilingualText {
    public static final BilingualText EMPTY = new BilingualText("", "");

    String english;
    String french;
  }
}
