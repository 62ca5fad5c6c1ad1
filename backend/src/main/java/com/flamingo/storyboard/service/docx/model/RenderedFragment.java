package com.flamingo.storyboard.service.docx.model;

import java.util.List;

/**
 * Inline content of one run together with the emphasis wrapping it.
 *
 * @param segments content in document order
 * @param emphasis active emphasis kinds, outermost first
 */
public record RenderedFragment(List<InlineSegment> segments, List<Emphasis> emphasis) {

  public RenderedFragment {
    segments = List.copyOf(segments);
    emphasis = List.copyOf(emphasis);
  }

  public static RenderedFragment of(InlineSegment... segments) {
    return new RenderedFragment(List.of(segments), List.of());
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  /**
   * Returns {@code true} if this fragment renders to nothing but whitespace. Indents, breaks and
   * emphasis markup all count as visible content.
   */
  public boolean isBlank() {
    if (!emphasis.isEmpty()) {
      return segments.isEmpty();
    }
    for (InlineSegment segment : segments) {
      if (!(segment instanceof InlineSegment.Text text) || !isWhitespace(text.value())) {
        return false;
      }
    }
    return true;
  }

  private static boolean isWhitespace(String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (!Character.isWhitespace(c) && !Character.isSpaceChar(c)) {
        return false;
      }
    }
    return true;
  }
}
