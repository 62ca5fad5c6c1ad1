package com.flamingo.storyboard.service.docx;

import com.flamingo.storyboard.service.docx.model.Alignment;
import com.flamingo.storyboard.service.docx.model.Block;
import com.flamingo.storyboard.service.docx.model.Emphasis;
import com.flamingo.storyboard.service.docx.model.InlineSegment;
import com.flamingo.storyboard.service.docx.model.OutputDocument;
import com.flamingo.storyboard.service.docx.model.RenderedFragment;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Serializes an {@link OutputDocument} into the rich-text editor's HTML dialect.
 *
 * <ul>
 *   <li>headings → {@code <h1>}
 *   <li>paragraphs → {@code <p>} with an optional {@code ql-align-*} class
 *   <li>indents and tabs → four non-breaking spaces
 *   <li>breaks → {@code <br>}
 * </ul>
 *
 * <p>Text is escaped here and nowhere else.
 */
@Component
public class QuillHtmlWriter {

  static final String INDENT = "&nbsp;&nbsp;&nbsp;&nbsp;";
  static final String LINE_BREAK = "<br>";

  private static final Map<Alignment, String> ALIGNMENT_CLASSES =
      Map.of(
          Alignment.CENTER, "ql-align-center",
          Alignment.RIGHT, "ql-align-right",
          Alignment.JUSTIFY, "ql-align-justify");

  public String write(OutputDocument document) {
    StringBuilder html = new StringBuilder();
    for (Block block : document.blocks()) {
      writeBlock(block, html);
    }
    return html.toString();
  }

  private void writeBlock(Block block, StringBuilder html) {
    if (block instanceof Block.Heading heading) {
      html.append("<h1>");
      writeInline(heading.content(), html);
      html.append("</h1>");
    } else if (block instanceof Block.Paragraph paragraph) {
      html.append("<p");
      String cssClass = ALIGNMENT_CLASSES.get(paragraph.alignment());
      if (cssClass != null) {
        html.append(" class=\"").append(cssClass).append('"');
      }
      html.append('>');
      writeInline(paragraph.content(), html);
      html.append("</p>");
    }
  }

  private void writeInline(List<RenderedFragment> fragments, StringBuilder html) {
    for (RenderedFragment fragment : fragments) {
      List<Emphasis> emphasis = fragment.emphasis();
      for (Emphasis e : emphasis) {
        html.append('<').append(e.tag()).append('>');
      }
      for (InlineSegment segment : fragment.segments()) {
        writeSegment(segment, html);
      }
      for (int i = emphasis.size() - 1; i >= 0; i--) {
        html.append("</").append(emphasis.get(i).tag()).append('>');
      }
    }
  }

  private void writeSegment(InlineSegment segment, StringBuilder html) {
    if (segment instanceof InlineSegment.Text text) {
      html.append(HtmlUtils.htmlEscape(text.value(), StandardCharsets.UTF_8.name()));
    } else if (segment instanceof InlineSegment.Indent) {
      html.append(INDENT);
    } else if (segment instanceof InlineSegment.LineBreak) {
      html.append(LINE_BREAK);
    }
  }
}
