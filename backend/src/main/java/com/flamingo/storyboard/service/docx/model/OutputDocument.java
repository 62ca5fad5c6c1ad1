package com.flamingo.storyboard.service.docx.model;

import java.util.List;

/**
 * Ordered block sequence produced from one DOCX package.
 *
 * @param blocks blocks in the order their paragraphs appear in the document body
 */
public record OutputDocument(List<Block> blocks) {

  public OutputDocument {
    blocks = List.copyOf(blocks);
  }

  public int size() {
    return blocks.size();
  }
}
