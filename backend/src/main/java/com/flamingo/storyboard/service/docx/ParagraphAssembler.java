package com.flamingo.storyboard.service.docx;

import com.flamingo.storyboard.service.docx.model.Block;
import com.flamingo.storyboard.service.docx.model.InlineSegment;
import com.flamingo.storyboard.service.docx.model.OutputDocument;
import com.flamingo.storyboard.service.docx.model.ParagraphProperties;
import com.flamingo.storyboard.service.docx.model.RenderedFragment;
import com.flamingo.storyboard.service.docx.xml.XmlElement;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns the paragraphs of a parsed document part into an {@link OutputDocument}.
 *
 * <p>Every {@code w:p} under {@code w:body} becomes exactly one {@link Block}, in document order.
 * Paragraphs inside tables and text boxes are included; the table structure itself is not.
 */
@Component
@RequiredArgsConstructor
public class ParagraphAssembler {

  private final PropertyExtractor propertyExtractor;
  private final RunRenderer runRenderer;

  /**
   * Assembles all body paragraphs of the document rooted at {@code documentElement}.
   *
   * @param documentElement the {@code w:document} root element
   * @return the converted document, empty if there is no {@code w:body}
   */
  public OutputDocument assembleDocument(XmlElement documentElement) {
    List<Block> blocks = new ArrayList<>();
    documentElement
        .child("body")
        .ifPresent(
            body -> {
              for (XmlElement paragraph : body.descendants("p")) {
                blocks.add(assembleParagraph(paragraph));
              }
            });
    return new OutputDocument(blocks);
  }

  /** Converts a single {@code w:p} element into a block. */
  public Block assembleParagraph(XmlElement paragraph) {
    ParagraphProperties properties = propertyExtractor.paragraphProperties(paragraph);

    List<RenderedFragment> content = new ArrayList<>();
    for (XmlElement run : runsOf(paragraph)) {
      RenderedFragment fragment =
          runRenderer.render(run, propertyExtractor.runProperties(run));
      if (!fragment.isEmpty()) {
        content.add(fragment);
      }
    }

    if (properties.heading()) {
      return new Block.Heading(content);
    }

    boolean indented = properties.hasFirstLineIndent() && !isBlank(content);
    if (indented) {
      content.add(0, RenderedFragment.of(InlineSegment.INDENT));
    }
    if (content.isEmpty()) {
      content.add(RenderedFragment.of(InlineSegment.LINE_BREAK));
    }
    return new Block.Paragraph(properties.alignment(), indented, content);
  }

  /**
   * Runs whose closest enclosing paragraph is {@code paragraph}: direct runs plus runs wrapped in
   * hyperlinks, insertions or smart tags, but not runs of a nested text-box paragraph.
   */
  private List<XmlElement> runsOf(XmlElement paragraph) {
    List<XmlElement> runs = new ArrayList<>();
    // explicit stack: wrapper nesting depth is unbounded in well-formed input
    Deque<XmlElement> pending = new ArrayDeque<>();
    pushChildren(paragraph, pending);
    while (!pending.isEmpty()) {
      XmlElement element = pending.pop();
      if (element.is("r")) {
        runs.add(element);
      } else if (!element.is("p")) {
        pushChildren(element, pending);
      }
    }
    return runs;
  }

  private static void pushChildren(XmlElement parent, Deque<XmlElement> pending) {
    List<XmlElement> children = parent.children();
    for (int i = children.size() - 1; i >= 0; i--) {
      pending.push(children.get(i));
    }
  }

  private static boolean isBlank(List<RenderedFragment> content) {
    return content.stream().allMatch(RenderedFragment::isBlank);
  }
}
