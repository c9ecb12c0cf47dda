/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.node.xml;

import io.treeweave.node.NodeKind;
import org.checkerframework.checker.index.qual.NonNegative;

/**
 * Element node, which is identified by an interned name key and carries its attributes.
 */
public final class ElementNode extends AbstractStructNode {

  /** Key of the qualified name (local name and namespace). */
  private final int nameKey;

  /** Attributes of the element, in insertion order. */
  private final Attributes attributes;

  /**
   * Constructor.
   *
   * @param nodeKey the unique key of the node
   * @param nameKey the key of the element name
   */
  public ElementNode(final @NonNegative long nodeKey, final int nameKey) {
    super(nodeKey);
    this.nameKey = nameKey;
    this.attributes = new Attributes();
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ELEMENT;
  }

  public int getNameKey() {
    return nameKey;
  }

  public Attributes getAttributes() {
    return attributes;
  }
}
