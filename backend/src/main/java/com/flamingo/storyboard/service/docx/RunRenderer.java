package com.flamingo.storyboard.service.docx;

import com.flamingo.storyboard.service.docx.model.Emphasis;
import com.flamingo.storyboard.service.docx.model.InlineSegment;
import com.flamingo.storyboard.service.docx.model.RenderedFragment;
import com.flamingo.storyboard.service.docx.model.RunProperties;
import com.flamingo.storyboard.service.docx.xml.XmlElement;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders the content of a {@code w:r} element into a {@link RenderedFragment}.
 *
 * <p>Text ({@code w:t}), tabs ({@code w:tab}) and breaks ({@code w:br}) are kept in document order.
 * Everything else a run may hold (drawings, field codes, footnote references, the {@code w:rPr}
 * block itself) is skipped.
 */
@Component
public class RunRenderer {

  private static final RenderedFragment EMPTY = new RenderedFragment(List.of(), List.of());

  public RenderedFragment render(XmlElement run, RunProperties properties) {
    List<InlineSegment> segments = new ArrayList<>();
    for (XmlElement child : run.children()) {
      if (!child.inNamespace()) {
        continue;
      }
      switch (child.localName()) {
        case "t" -> {
          String text = child.text();
          if (!text.isEmpty()) {
            segments.add(new InlineSegment.Text(text));
          }
        }
        case "tab" -> segments.add(InlineSegment.INDENT);
        case "br" -> segments.add(InlineSegment.LINE_BREAK);
        default -> {
          // unsupported run content
        }
      }
    }

    // No emphasis on an empty run, it would only produce empty tags.
    if (segments.isEmpty()) {
      return EMPTY;
    }
    return new RenderedFragment(segments, Emphasis.activeIn(properties));
  }
}
