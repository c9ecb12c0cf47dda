/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.node.xml;

import com.google.common.base.MoreObjects;
import io.treeweave.node.NodeKind;
import io.treeweave.settings.Fixed;
import org.checkerframework.checker.index.qual.NonNegative;

/**
 * Skeletal node which stores the structural pointers of a node: its parent, its first and last
 * child and its left and right sibling. Absent pointers hold {@link Fixed#NULL_NODE_KEY}.
 */
public abstract class AbstractStructNode {

  private static final long NULL_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** Key of this node. */
  private final long nodeKey;

  private long parentKey = NULL_KEY;

  private long firstChildKey = NULL_KEY;

  private long lastChildKey = NULL_KEY;

  private long leftSiblingKey = NULL_KEY;

  private long rightSiblingKey = NULL_KEY;

  private long childCount;

  /**
   * Constructor.
   *
   * @param nodeKey the unique key of the node
   */
  protected AbstractStructNode(final @NonNegative long nodeKey) {
    this.nodeKey = nodeKey;
  }

  /**
   * Get the kind of the node.
   *
   * @return the node kind
   */
  public abstract NodeKind getKind();

  public long getNodeKey() {
    return nodeKey;
  }

  public long getParentKey() {
    return parentKey;
  }

  public void setParentKey(final long parentKey) {
    this.parentKey = parentKey;
  }

  public boolean hasParent() {
    return parentKey != NULL_KEY;
  }

  public long getFirstChildKey() {
    return firstChildKey;
  }

  public void setFirstChildKey(final long firstChildKey) {
    this.firstChildKey = firstChildKey;
  }

  public boolean hasFirstChild() {
    return firstChildKey != NULL_KEY;
  }

  public long getLastChildKey() {
    return lastChildKey;
  }

  public void setLastChildKey(final long lastChildKey) {
    this.lastChildKey = lastChildKey;
  }

  public boolean hasLastChild() {
    return lastChildKey != NULL_KEY;
  }

  public long getLeftSiblingKey() {
    return leftSiblingKey;
  }

  public void setLeftSiblingKey(final long leftSiblingKey) {
    this.leftSiblingKey = leftSiblingKey;
  }

  public boolean hasLeftSibling() {
    return leftSiblingKey != NULL_KEY;
  }

  public long getRightSiblingKey() {
    return rightSiblingKey;
  }

  public void setRightSiblingKey(final long rightSiblingKey) {
    this.rightSiblingKey = rightSiblingKey;
  }

  public boolean hasRightSibling() {
    return rightSiblingKey != NULL_KEY;
  }

  public long getChildCount() {
    return childCount;
  }

  public void incrementChildCount() {
    childCount++;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("kind", getKind())
                      .add("nodeKey", nodeKey)
                      .add("parentKey", parentKey)
                      .add("firstChildKey", firstChildKey)
                      .add("lastChildKey", lastChildKey)
                      .add("leftSiblingKey", leftSiblingKey)
                      .add("rightSiblingKey", rightSiblingKey)
                      .toString();
  }
}
