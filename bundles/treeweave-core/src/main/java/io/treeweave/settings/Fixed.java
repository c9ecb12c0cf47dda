/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.settings;

/**
 * Fixed constants for TreeWeave trees. These constants should never be changed.
 */
public enum Fixed {

  /** Null key for nodes. */
  NULL_NODE_KEY(-1L),

  /** Null key for names and namespaces. */
  NULL_NAME_KEY(-1L);

  /**
   * Standard property.
   */
  private final long standardProperty;

  /**
   * Private constructor.
   *
   * @param property property to set
   */
  Fixed(final long property) {
    standardProperty = property;
  }

  /**
   * Getting the property.
   *
   * @return the prop
   */
  public long getStandardProperty() {
    return standardProperty;
  }
}
