/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import io.treeweave.exception.TreeweaveException;

/**
 * Failure of {@link HtmlParser}, raised before the target tree has been touched.
 */
public abstract class HtmlParseException extends TreeweaveException {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  protected HtmlParseException(final String message) {
    super(message);
  }

  protected HtmlParseException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
