/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html.source;

import java.util.List;

/**
 * Read-only view of a node of a parsed HTML DOM.
 *
 * <p>
 * A node may be reachable through more than one reference, so the DOM is not necessarily a tree.
 * Two views of the same underlying node return the same {@link #identity()}; structurally equal
 * but distinct nodes return different identities.
 * </p>
 */
public interface SourceNode {

  SourceNodeKind kind();

  /**
   * Get the reference identity of the underlying node. Only compared with {@code ==}.
   *
   * @return the identity object
   */
  Object identity();

  /**
   * Get the character data of a text or comment node.
   *
   * @return the content, the empty string for other kinds
   */
  String value();

  /**
   * Get the namespace URI of an element.
   *
   * @return the URI, the empty string if the element is in no namespace or the node is no element
   */
  String namespaceURI();

  /**
   * Get the local name of an element.
   *
   * @return the local name, the empty string if the node is no element
   */
  String localName();

  /**
   * Get the attributes of an element in source order.
   *
   * @return the attributes, empty if the node is no element
   */
  List<SourceAttribute> attributes();

  /**
   * Get the children in document order.
   *
   * @return the children
   */
  List<SourceNode> children();
}
