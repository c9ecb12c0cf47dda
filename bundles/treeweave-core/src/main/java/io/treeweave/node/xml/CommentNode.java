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
 * Comment node.
 */
public final class CommentNode extends AbstractStructNode {

  private final String value;

  public CommentNode(final @NonNegative long nodeKey, final String value) {
    super(nodeKey);
    this.value = requireNonNull(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.COMMENT;
  }

  public String getValue() {
    return value;
  }
}
