/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.access.xml;

import io.treeweave.api.xml.XmlTree;
import io.treeweave.exception.TreeStructureException;
import io.treeweave.index.name.Names;
import io.treeweave.node.NodeKind;
import io.treeweave.node.xml.AbstractStructNode;
import io.treeweave.node.xml.Attributes;
import io.treeweave.node.xml.CommentNode;
import io.treeweave.node.xml.DocumentNode;
import io.treeweave.node.xml.ElementNode;
import io.treeweave.node.xml.TextNode;
import io.treeweave.settings.Constants;
import io.treeweave.settings.Fixed;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * In-memory {@link XmlTree}. Nodes live in an array indexed by their node key; names and
 * namespaces are interned in {@link Names} dictionaries owned by the tree.
 */
public final class XmlTreeImpl implements XmlTree {

  private static final long NULL_NODE_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** Node store, the node key is the index. */
  private final ObjectArrayList<AbstractStructNode> nodes;

  /** Namespace URIs. */
  private final Names namespaces;

  /** Local names of elements and attributes. */
  private final Names localNames;

  /** Qualified names, keyed by namespace key and local name. */
  private final Names qualifiedNames;

  /** Maps a qualified name key to its namespace key. */
  private final Int2IntMap nameToNamespace;

  /** Maps a qualified name key to its local name key. */
  private final Int2IntMap nameToLocalName;

  /** Key of the empty namespace. */
  private final int noNamespaceKey;

  /**
   * Constructor.
   */
  public XmlTreeImpl() {
    nodes = new ObjectArrayList<>(Constants.INITIAL_NODE_CAPACITY);
    namespaces = Names.getInstance();
    localNames = Names.getInstance();
    qualifiedNames = Names.getInstance();
    nameToNamespace = new Int2IntOpenHashMap();
    nameToLocalName = new Int2IntOpenHashMap();
    noNamespaceKey = namespaces.setName(Constants.NULL_NAMESPACE_URI);
  }

  @Override
  public long newDocument() {
    return add(new DocumentNode(nodes.size()));
  }

  @Override
  public long newElement(final int nameKey) {
    checkArgument(qualifiedNames.containsKey(nameKey), "Unknown name key: %s", nameKey);
    return add(new ElementNode(nodes.size(), nameKey));
  }

  @Override
  public long newText(final String value) {
    return add(new TextNode(nodes.size(), value));
  }

  @Override
  public long newComment(final String value) {
    return add(new CommentNode(nodes.size(), value));
  }

  private long add(final AbstractStructNode node) {
    nodes.add(node);
    return node.getNodeKey();
  }

  @Override
  public void append(final long parentKey, final long childKey) throws TreeStructureException {
    final AbstractStructNode parent = node(parentKey);
    final AbstractStructNode child = node(childKey);

    if (!parent.getKind().isStructural()) {
      throw new TreeStructureException("Node %s of kind %s cannot have children.", parentKey, parent.getKind());
    }
    if (child.getKind() == NodeKind.DOCUMENT) {
      throw new TreeStructureException("Document node %s cannot be appended.", childKey);
    }
    if (child.hasParent() || parentKey == childKey) {
      throw new TreeStructureException("Node %s is already attached.", childKey);
    }
    if (parent.getKind() == NodeKind.DOCUMENT && child.getKind() == NodeKind.ELEMENT
        && documentElement(parentKey) != NULL_NODE_KEY) {
      throw new TreeStructureException("Document node %s already has a document element.", parentKey);
    }

    if (parent.hasLastChild()) {
      final AbstractStructNode lastChild = node(parent.getLastChildKey());
      lastChild.setRightSiblingKey(childKey);
      child.setLeftSiblingKey(lastChild.getNodeKey());
    } else {
      parent.setFirstChildKey(childKey);
    }
    parent.setLastChildKey(childKey);
    parent.incrementChildCount();
    child.setParentKey(parentKey);
  }

  @Override
  public long firstChild(final long nodeKey) {
    return node(nodeKey).getFirstChildKey();
  }

  @Override
  public long lastChild(final long nodeKey) {
    return node(nodeKey).getLastChildKey();
  }

  @Override
  public long nextSibling(final long nodeKey) {
    return node(nodeKey).getRightSiblingKey();
  }

  @Override
  public long previousSibling(final long nodeKey) {
    return node(nodeKey).getLeftSiblingKey();
  }

  @Override
  public long parent(final long nodeKey) {
    return node(nodeKey).getParentKey();
  }

  @Override
  public LongList children(final long nodeKey) {
    final AbstractStructNode node = node(nodeKey);
    final LongList children = new LongArrayList((int) node.getChildCount());
    for (long key = node.getFirstChildKey(); key != NULL_NODE_KEY; key = node(key).getRightSiblingKey()) {
      children.add(key);
    }
    return children;
  }

  @Override
  public long documentElement(final long documentKey) {
    final AbstractStructNode document = node(documentKey);
    checkArgument(document.getKind() == NodeKind.DOCUMENT, "Node %s is not a document node.", documentKey);
    for (long key = document.getFirstChildKey(); key != NULL_NODE_KEY; key = node(key).getRightSiblingKey()) {
      if (isElement(key)) {
        return key;
      }
    }
    return NULL_NODE_KEY;
  }

  @Override
  public NodeKind getKind(final long nodeKey) {
    return node(nodeKey).getKind();
  }

  @Override
  public boolean isDocument(final long nodeKey) {
    return getKind(nodeKey) == NodeKind.DOCUMENT;
  }

  @Override
  public boolean isElement(final long nodeKey) {
    return getKind(nodeKey) == NodeKind.ELEMENT;
  }

  @Override
  public boolean isText(final long nodeKey) {
    return getKind(nodeKey) == NodeKind.TEXT;
  }

  @Override
  public boolean isComment(final long nodeKey) {
    return getKind(nodeKey) == NodeKind.COMMENT;
  }

  @Override
  public TextNode getText(final long nodeKey) {
    return node(nodeKey, NodeKind.TEXT, TextNode.class);
  }

  @Override
  public CommentNode getComment(final long nodeKey) {
    return node(nodeKey, NodeKind.COMMENT, CommentNode.class);
  }

  @Override
  public ElementNode getElement(final long nodeKey) {
    return node(nodeKey, NodeKind.ELEMENT, ElementNode.class);
  }

  @Override
  public Attributes attributes(final long elementKey) {
    return getElement(elementKey).getAttributes();
  }

  @Override
  public int addNamespace(final String uri) {
    return namespaces.setName(requireNonNull(uri));
  }

  @Override
  public int noNamespace() {
    return noNamespaceKey;
  }

  @Override
  public String namespaceForKey(final int namespaceKey) {
    final String uri = namespaces.getName(namespaceKey);
    checkArgument(uri != null, "Unknown namespace key: %s", namespaceKey);
    return uri;
  }

  @Override
  public int addName(final String localName, final int namespaceKey) {
    requireNonNull(localName);
    checkArgument(namespaces.containsKey(namespaceKey), "Unknown namespace key: %s", namespaceKey);

    // The namespace key never contains the separator, so the composite is unambiguous.
    final int nameKey = qualifiedNames.setName(namespaceKey + "|" + localName);
    if (!nameToNamespace.containsKey(nameKey)) {
      nameToNamespace.put(nameKey, namespaceKey);
      nameToLocalName.put(nameKey, localNames.setName(localName));
    }
    return nameKey;
  }

  @Override
  public int namespaceForName(final int nameKey) {
    checkArgument(nameToNamespace.containsKey(nameKey), "Unknown name key: %s", nameKey);
    return nameToNamespace.get(nameKey);
  }

  @Override
  public String localNameForName(final int nameKey) {
    checkArgument(nameToLocalName.containsKey(nameKey), "Unknown name key: %s", nameKey);
    return localNames.getName(nameToLocalName.get(nameKey));
  }

  /**
   * Get the number of nodes created in this tree, attached or not.
   *
   * @return the number of nodes
   */
  public int getNodeCount() {
    return nodes.size();
  }

  private AbstractStructNode node(final long nodeKey) {
    checkArgument(nodeKey >= 0 && nodeKey < nodes.size(), "Node key %s does not exist.", nodeKey);
    return nodes.get((int) nodeKey);
  }

  private <T extends AbstractStructNode> T node(final long nodeKey, final NodeKind kind, final Class<T> clazz) {
    final AbstractStructNode node = node(nodeKey);
    checkArgument(node.getKind() == kind, "Node %s is not of kind %s but %s.", nodeKey, kind, node.getKind());
    return clazz.cast(node);
  }
}
