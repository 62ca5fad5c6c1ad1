package com.flamingo.storyboard.service.docx.model;

/**
 * Properties derived from a paragraph's {@code w:pPr} block.
 *
 * @param alignment horizontal alignment
 * @param firstLineIndent first-line indent in twentieths of a point, {@code 0} when absent
 * @param heading whether the paragraph style marks it as a heading
 */
public record ParagraphProperties(Alignment alignment, int firstLineIndent, boolean heading) {

  public static final ParagraphProperties DEFAULT =
      new ParagraphProperties(Alignment.LEFT, 0, false);

  public boolean hasFirstLineIndent() {
    return firstLineIndent > 0;
  }
}
