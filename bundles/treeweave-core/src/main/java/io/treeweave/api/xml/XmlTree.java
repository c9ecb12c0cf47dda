/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.api.xml;

import io.treeweave.exception.TreeStructureException;
import io.treeweave.node.NodeKind;
import io.treeweave.node.xml.Attributes;
import io.treeweave.node.xml.CommentNode;
import io.treeweave.node.xml.ElementNode;
import io.treeweave.node.xml.TextNode;
import io.treeweave.settings.Fixed;
import it.unimi.dsi.fastutil.longs.LongList;

/**
 * A mutable, namespace-aware XML tree. Nodes are addressed by {@code long} node keys, names and
 * namespaces by interned {@code int} keys. Navigation methods return
 * {@link Fixed#NULL_NODE_KEY} if the requested node does not exist.
 *
 * <p>
 * Implementations are not thread-safe. A tree must only be mutated by one thread at a time.
 * </p>
 */
public interface XmlTree {

  // --- Node creation
  // ----------------------------------------------------------

  /**
   * Create a new, detached document node.
   *
   * @return the key of the document node
   */
  long newDocument();

  /**
   * Create a new, detached element node.
   *
   * @param nameKey key of the element name, as returned by {@link #addName(String, int)}
   * @return the key of the element node
   */
  long newElement(int nameKey);

  /**
   * Create a new, detached text node.
   *
   * @param value the initial text
   * @return the key of the text node
   */
  long newText(String value);

  /**
   * Create a new, detached comment node.
   *
   * @param value the comment text
   * @return the key of the comment node
   */
  long newComment(String value);

  /**
   * Append a detached node as the last child of a parent.
   *
   * @param parentKey the key of the parent, which must be a document or an element
   * @param childKey the key of the node to append
   * @throws TreeStructureException if the resulting tree would not be well-formed
   */
  void append(long parentKey, long childKey) throws TreeStructureException;

  // --- Navigation
  // ----------------------------------------------------------

  long firstChild(long nodeKey);

  long lastChild(long nodeKey);

  long nextSibling(long nodeKey);

  long previousSibling(long nodeKey);

  long parent(long nodeKey);

  /**
   * Get the children of a node in document order.
   *
   * @param nodeKey the key of the node
   * @return the keys of the children
   */
  LongList children(long nodeKey);

  /**
   * Get the document element of a document node.
   *
   * @param documentKey the key of the document node
   * @return the key of the single element child or {@link Fixed#NULL_NODE_KEY}
   */
  long documentElement(long documentKey);

  // --- Node access
  // ----------------------------------------------------------

  NodeKind getKind(long nodeKey);

  boolean isDocument(long nodeKey);

  boolean isElement(long nodeKey);

  boolean isText(long nodeKey);

  boolean isComment(long nodeKey);

  /**
   * Get a text node. The returned node is live, changes to its value are changes to the tree.
   *
   * @param nodeKey the key of a text node
   * @return the text node
   * @throws IllegalArgumentException if the node is not a text node
   */
  TextNode getText(long nodeKey);

  CommentNode getComment(long nodeKey);

  ElementNode getElement(long nodeKey);

  /**
   * Get the mutable attribute storage of an element.
   *
   * @param elementKey the key of an element node
   * @return the attributes of the element
   * @throws IllegalArgumentException if the node is not an element
   */
  Attributes attributes(long elementKey);

  // --- Names and namespaces
  // ----------------------------------------------------------

  /**
   * Intern a namespace URI.
   *
   * @param uri the namespace URI
   * @return the namespace key, the same key for the same URI
   */
  int addNamespace(String uri);

  /**
   * Get the key which denotes "no namespace".
   *
   * @return the key of the empty namespace
   */
  int noNamespace();

  /**
   * Get the URI of a namespace key.
   *
   * @param namespaceKey the namespace key
   * @return the URI, the empty string for {@link #noNamespace()}
   */
  String namespaceForKey(int namespaceKey);

  /**
   * Intern a name, that is a local name in a namespace.
   *
   * @param localName the local name
   * @param namespaceKey the namespace key
   * @return the name key, the same key for the same pair
   */
  int addName(String localName, int namespaceKey);

  int namespaceForName(int nameKey);

  String localNameForName(int nameKey);
}
