package com.flamingo.storyboard.service.docx;

import com.flamingo.storyboard.service.docx.model.Alignment;
import com.flamingo.storyboard.service.docx.model.ParagraphProperties;
import com.flamingo.storyboard.service.docx.model.RunProperties;
import com.flamingo.storyboard.service.docx.xml.XmlElement;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Derives {@link ParagraphProperties} from {@code w:pPr} and {@link RunProperties} from {@code
 * w:rPr}.
 *
 * <p>Heading detection is a case-insensitive substring match on the paragraph style id, so custom
 * styles such as {@code "Heading Centered"} are headings too.
 */
@Component
public class PropertyExtractor {

  private static final String HEADING_STYLE_MARKER = "heading";

  private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

  public ParagraphProperties paragraphProperties(XmlElement paragraph) {
    Optional<XmlElement> pPr = paragraph.child("pPr");
    if (pPr.isEmpty()) {
      return ParagraphProperties.DEFAULT;
    }
    XmlElement properties = pPr.get();

    Alignment alignment =
        properties
            .child("jc")
            .flatMap(jc -> jc.attribute("val"))
            .map(Alignment::fromJustification)
            .orElse(Alignment.LEFT);

    int firstLineIndent =
        properties
            .child("ind")
            .flatMap(ind -> ind.attribute("firstLine"))
            .map(PropertyExtractor::parseIndent)
            .orElse(0);

    boolean heading =
        properties
            .child("pStyle")
            .flatMap(style -> style.attribute("val"))
            .map(style -> style.toLowerCase(Locale.ROOT).contains(HEADING_STYLE_MARKER))
            .orElse(false);

    return new ParagraphProperties(alignment, firstLineIndent, heading);
  }

  public RunProperties runProperties(XmlElement run) {
    Optional<XmlElement> rPr = run.child("rPr");
    if (rPr.isEmpty()) {
      return RunProperties.PLAIN;
    }
    XmlElement properties = rPr.get();
    return new RunProperties(
        isOn(properties, "b", "0"),
        isOn(properties, "i", "0"),
        isOn(properties, "u", "none"),
        isOn(properties, "strike", "0"));
  }

  // Present without a w:val counts as on.
  private static boolean isOn(XmlElement properties, String name, String offValue) {
    return properties
        .child(name)
        .map(toggle -> !toggle.attribute("val").map(offValue::equals).orElse(false))
        .orElse(false);
  }

  /**
   * Parses the leading integer of a {@code w:firstLine} value. Unparseable values yield {@code 0},
   * negative values are clamped to {@code 0} and oversized values saturate.
   */
  @VisibleForTesting
  static int parseIndent(String value) {
    Matcher matcher = LEADING_INTEGER.matcher(value);
    if (!matcher.find()) {
      return 0;
    }
    String digits = matcher.group(1);
    Long parsed = Longs.tryParse(digits.startsWith("+") ? digits.substring(1) : digits);
    if (parsed == null) {
      return digits.startsWith("-") ? 0 : Integer.MAX_VALUE;
    }
    return Math.max(0, Ints.saturatedCast(parsed));
  }
}
