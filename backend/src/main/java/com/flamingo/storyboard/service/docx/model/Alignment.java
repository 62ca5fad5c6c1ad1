package com.flamingo.storyboard.service.docx.model;

/** Normalized horizontal alignment of a paragraph. */
public enum Alignment {
  LEFT,
  CENTER,
  RIGHT,
  JUSTIFY;

  /**
   * Maps a {@code w:jc} value to an alignment. {@code both} is the WordprocessingML spelling of
   * justified text. Values are matched exactly; every other or missing value is {@link #LEFT}.
   */
  public static Alignment fromJustification(String value) {
    if (value == null) {
      return LEFT;
    }
    return switch (value) {
      case "center" -> CENTER;
      case "right" -> RIGHT;
      case "both", "justify" -> JUSTIFY;
      default -> LEFT;
    };
  }
}
