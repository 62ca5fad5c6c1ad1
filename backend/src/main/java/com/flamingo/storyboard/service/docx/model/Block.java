package com.flamingo.storyboard.service.docx.model;

import java.util.List;

/** A block element of the converted document. One paragraph node yields exactly one block. */
public interface Block {

  /** Inline content of the block, in document order. */
  List<RenderedFragment> content();

  /** A heading; alignment and indent never apply. */
  record Heading(List<RenderedFragment> content) implements Block {
    public Heading {
      content = List.copyOf(content);
    }
  }

  /**
   * A body paragraph.
   *
   * @param alignment alignment class, {@link Alignment#LEFT} meaning none
   * @param indented whether a first-line indent was applied to the content
   * @param content inline content, including the leading indent when {@code indented}
   */
  record Paragraph(Alignment alignment, boolean indented, List<RenderedFragment> content)
      implements Block {
    public Paragraph {
      content = List.copyOf(content);
    }
  }
}
