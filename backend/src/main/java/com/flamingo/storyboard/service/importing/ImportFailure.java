package com.flamingo.storyboard.service.importing;

import com.flamingo.storyboard.domain.enums.ImportErrorKind;

/**
 * A package that could not be converted.
 *
 * @param fileName display name of the package
 * @param kind failure classification
 * @param message user-facing description
 */
public record ImportFailure(String fileName, ImportErrorKind kind, String message) {}
