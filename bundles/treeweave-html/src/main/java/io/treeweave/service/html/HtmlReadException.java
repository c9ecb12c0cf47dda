/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import java.io.IOException;

/**
 * The HTML input could not be read.
 */
public final class HtmlReadException extends HtmlParseException {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /**
   * Constructor.
   *
   * @param cause the failure of the underlying reader
   */
  public HtmlReadException(final IOException cause) {
    super("Failed to read HTML input: " + cause.getMessage(), cause);
  }

  @Override
  public synchronized IOException getCause() {
    return (IOException) super.getCause();
  }
}
