package com.flamingo.storyboard.service.docx.model;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Character emphasis kinds, declared from outermost to innermost wrapping order.
 *
 * <p>Adding a new emphasis kind means adding one constant here.
 */
public enum Emphasis {
  BOLD("strong", RunProperties::bold),
  ITALIC("em", RunProperties::italic),
  UNDERLINE("u", RunProperties::underline),
  STRIKE("s", RunProperties::strike);

  private final String tag;
  private final Predicate<RunProperties> flag;

  Emphasis(String tag, Predicate<RunProperties> flag) {
    this.tag = tag;
    this.flag = flag;
  }

  /** HTML element name used to wrap text with this emphasis. */
  public String tag() {
    return tag;
  }

  /** Emphasis kinds switched on in {@code properties}, outermost first. */
  public static List<Emphasis> activeIn(RunProperties properties) {
    return Arrays.stream(values()).filter(e -> e.flag.test(properties)).toList();
  }
}
