/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.exception;

/**
 * Thrown if a mutation would violate the structure of a tree, for instance appending a second
 * element to a document node or appending a node which already has a parent.
 */
public final class TreeStructureException extends TreeweaveException {

  private static final long serialVersionUID = 1L;

  public TreeStructureException(final String message, final Object... args) {
    super(message, args);
  }
}
