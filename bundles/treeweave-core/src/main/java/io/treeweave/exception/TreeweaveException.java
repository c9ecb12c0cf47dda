/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.exception;

/**
 * Exception to hold all relevant failures upcoming from TreeWeave.
 */
public class TreeweaveException extends Exception {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /**
   * Constructor to encapsulate parsing.
   *
   * @param throwable to encapsulate
   */
  public TreeweaveException(final Throwable throwable) {
    super(throwable);
  }

  public TreeweaveException(final String message) {
    super(message);
  }

  public TreeweaveException(final String message, final Object... args) {
    super(String.format(message, args));
  }

  /**
   * Constructor
   *
   * @param message message as string
   * @param throwable the cause
   */
  public TreeweaveException(final String message, final Throwable throwable) {
    super(message, throwable);
  }
}
