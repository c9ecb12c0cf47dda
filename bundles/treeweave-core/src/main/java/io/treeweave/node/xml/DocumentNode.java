/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.node.xml;

import io.treeweave.node.NodeKind;
import org.checkerframework.checker.index.qual.NonNegative;

/**
 * Root of a tree. Holds at most one element child, the document element.
 */
public final class DocumentNode extends AbstractStructNode {

  public DocumentNode(final @NonNegative long nodeKey) {
    super(nodeKey);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DOCUMENT;
  }
}
