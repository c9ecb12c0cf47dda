/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The HTML parser reported errors and the {@link HtmlParser} is configured to fail on them.
 */
public final class HtmlDiagnosticsException extends HtmlParseException {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  private final ImmutableList<String> diagnostics;

  /**
   * Constructor.
   *
   * @param diagnostics the messages in the order they have been reported, at least one
   */
  public HtmlDiagnosticsException(final List<String> diagnostics) {
    super(message(diagnostics));
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  private static String message(final List<String> diagnostics) {
    checkArgument(!diagnostics.isEmpty(), "At least one diagnostic is required.");
    return String.format("HTML parser reported %d error(s), first: %s", diagnostics.size(), diagnostics.get(0));
  }

  /**
   * Get the diagnostics.
   *
   * @return the messages in the order they have been reported
   */
  public List<String> getDiagnostics() {
    return diagnostics;
  }
}
