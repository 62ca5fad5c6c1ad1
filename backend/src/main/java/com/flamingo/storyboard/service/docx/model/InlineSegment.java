package com.flamingo.storyboard.service.docx.model;

/** One piece of inline content inside a rendered run. */
public interface InlineSegment {

  /** Literal, unescaped text from a {@code w:t} element. */
  record Text(String value) implements InlineSegment {}

  /** Fixed-width indent, produced for tab markers and first-line indents. */
  record Indent() implements InlineSegment {}

  /** Hard line break. */
  record LineBreak() implements InlineSegment {}

  Indent INDENT = new Indent();

  LineBreak LINE_BREAK = new LineBreak();
}
