/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html.source;

import com.google.common.collect.ImmutableList;
import org.w3c.dom.Attr;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import java.util.List;

import static com.google.common.base.Strings.nullToEmpty;
import static java.util.Objects.requireNonNull;

/**
 * {@link SourceNode} over a W3C DOM node, as produced by the validator.nu HTML parser. Views are
 * created on demand; the identity of a view is the wrapped DOM node.
 */
public final class W3cSourceNode implements SourceNode {

  private final Node node;

  private final SourceNodeKind kind;

  private W3cSourceNode(final Node node, final SourceNodeKind kind) {
    this.node = node;
    this.kind = kind;
  }

  /**
   * Create a view of a DOM node.
   *
   * @param node the DOM node
   * @return the view
   * @throws IllegalArgumentException if the DOM node kind has no counterpart, for instance an
   *         entity reference
   */
  public static W3cSourceNode of(final Node node) {
    return new W3cSourceNode(node, kindOf(requireNonNull(node)));
  }

  private static SourceNodeKind kindOf(final Node node) {
    return switch (node.getNodeType()) {
      case Node.DOCUMENT_NODE -> SourceNodeKind.DOCUMENT;
      case Node.DOCUMENT_FRAGMENT_NODE -> SourceNodeKind.FRAGMENT;
      case Node.DOCUMENT_TYPE_NODE -> SourceNodeKind.DOCTYPE;
      case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> SourceNodeKind.TEXT;
      case Node.COMMENT_NODE -> SourceNodeKind.COMMENT;
      case Node.ELEMENT_NODE -> SourceNodeKind.ELEMENT;
      case Node.PROCESSING_INSTRUCTION_NODE -> SourceNodeKind.PROCESSING_INSTRUCTION;
      default -> throw new IllegalArgumentException("DOM node type not supported: " + node.getNodeType());
    };
  }

  @Override
  public SourceNodeKind kind() {
    return kind;
  }

  @Override
  public Object identity() {
    return node;
  }

  @Override
  public String value() {
    if (kind == SourceNodeKind.TEXT || kind == SourceNodeKind.COMMENT) {
      return nullToEmpty(node.getNodeValue());
    }
    return "";
  }

  @Override
  public String namespaceURI() {
    return kind == SourceNodeKind.ELEMENT ? nullToEmpty(node.getNamespaceURI()) : "";
  }

  @Override
  public String localName() {
    return kind == SourceNodeKind.ELEMENT ? localName(node) : "";
  }

  @Override
  public List<SourceAttribute> attributes() {
    if (kind != SourceNodeKind.ELEMENT) {
      return List.of();
    }
    final NamedNodeMap attributes = node.getAttributes();
    final ImmutableList.Builder<SourceAttribute> builder = ImmutableList.builderWithExpectedSize(attributes.getLength());
    for (int i = 0, length = attributes.getLength(); i < length; i++) {
      final Attr attribute = (Attr) attributes.item(i);
      builder.add(new SourceAttribute(nullToEmpty(attribute.getNamespaceURI()),
                                      localName(attribute),
                                      nullToEmpty(attribute.getValue())));
    }
    return builder.build();
  }

  @Override
  public List<SourceNode> children() {
    final ImmutableList.Builder<SourceNode> builder = ImmutableList.builder();
    for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
      builder.add(of(child));
    }
    return builder.build();
  }

  // Nodes created without namespace support only carry a node name.
  private static String localName(final Node node) {
    final String localName = node.getLocalName();
    return localName != null ? localName : node.getNodeName();
  }

  @Override
  public String toString() {
    return kind + "[" + node.getNodeName() + "]";
  }
}
