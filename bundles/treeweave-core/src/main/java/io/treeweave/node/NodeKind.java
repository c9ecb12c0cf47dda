/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.node;

/**
 * Enumeration for the different node kinds of a tree.
 */
public enum NodeKind {

  /**
   * Node kind is element.
   */
  ELEMENT,

  /**
   * Node kind is text.
   */
  TEXT,

  /**
   * Node kind is comment.
   */
  COMMENT,

  /**
   * Node kind is document root.
   */
  DOCUMENT;

  /**
   * Determines if nodes of this kind may have children.
   *
   * @return {@code true} for documents and elements
   */
  public boolean isStructural() {
    return this == DOCUMENT || this == ELEMENT;
  }
}
