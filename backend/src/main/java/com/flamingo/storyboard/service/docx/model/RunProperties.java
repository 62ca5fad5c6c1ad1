package com.flamingo.storyboard.service.docx.model;

/** Character emphasis derived from a run's {@code w:rPr} block. */
public record RunProperties(boolean bold, boolean italic, boolean underline, boolean strike) {

  public static final RunProperties PLAIN = new RunProperties(false, false, false, false);
}
