/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.node.xml;

import io.treeweave.node.NodeKind;
import org.checkerframework.checker.index.qual.NonNegative;

import static java.util.Objects.requireNonNull;

/**
 * Text node. Its value is a growable buffer, so that adjacent character data can be merged into a
 * single node.
 */
public final class TextNode extends AbstractStructNode {

  private final StringBuilder value;

  public TextNode(final @NonNegative long nodeKey, final String value) {
    super(nodeKey);
    this.value = new StringBuilder(requireNonNull(value));
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TEXT;
  }

  public String getValue() {
    return value.toString();
  }

  public void setValue(final String value) {
    this.value.setLength(0);
    this.value.append(requireNonNull(value));
  }

  /**
   * Append character data at the end of the current value.
   *
   * @param data the data to append
   */
  public void appendValue(final CharSequence data) {
    value.append(requireNonNull(data));
  }

  public int length() {
    return value.length();
  }
}
