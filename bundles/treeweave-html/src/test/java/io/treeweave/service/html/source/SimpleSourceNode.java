/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html.source;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Hand-built {@link SourceNode} for tests. Children are mutable, so shared nodes and cycles can be
 * modelled, and the identity can be shared between distinct instances.
 */
public final class SimpleSourceNode implements SourceNode {

  private final SourceNodeKind kind;

  private final String value;

  private final String namespaceURI;

  private final String localName;

  private final List<SourceAttribute> attributes = new ArrayList<>();

  private final List<SourceNode> children = new ArrayList<>();

  private Object identity = this;

  private SimpleSourceNode(final SourceNodeKind kind, final String value, final String namespaceURI,
      final String localName) {
    this.kind = kind;
    this.value = value;
    this.namespaceURI = namespaceURI;
    this.localName = localName;
  }

  public static SimpleSourceNode document(final SourceNode... children) {
    return new SimpleSourceNode(SourceNodeKind.DOCUMENT, "", "", "").add(children);
  }

  public static SimpleSourceNode fragment(final SourceNode... children) {
    return new SimpleSourceNode(SourceNodeKind.FRAGMENT, "", "", "").add(children);
  }

  public static SimpleSourceNode doctype() {
    return new SimpleSourceNode(SourceNodeKind.DOCTYPE, "", "", "");
  }

  public static SimpleSourceNode processingInstruction() {
    return new SimpleSourceNode(SourceNodeKind.PROCESSING_INSTRUCTION, "", "", "");
  }

  public static SimpleSourceNode text(final String value) {
    return new SimpleSourceNode(SourceNodeKind.TEXT, requireNonNull(value), "", "");
  }

  public static SimpleSourceNode comment(final String value) {
    return new SimpleSourceNode(SourceNodeKind.COMMENT, requireNonNull(value), "", "");
  }

  public static SimpleSourceNode element(final String namespaceURI, final String localName,
      final SourceNode... children) {
    return new SimpleSourceNode(SourceNodeKind.ELEMENT, "", requireNonNull(namespaceURI), requireNonNull(localName))
        .add(children);
  }

  public SimpleSourceNode add(final SourceNode... nodes) {
    children.addAll(List.of(nodes));
    return this;
  }

  public SimpleSourceNode attribute(final String namespaceURI, final String localName, final String value) {
    attributes.add(new SourceAttribute(namespaceURI, localName, value));
    return this;
  }

  /**
   * Let this node report the identity of another node.
   *
   * @param other the node to share the identity with
   * @return this node
   */
  public SimpleSourceNode sameIdentityAs(final SourceNode other) {
    identity = other.identity();
    return this;
  }

  @Override
  public SourceNodeKind kind() {
    return kind;
  }

  @Override
  public Object identity() {
    return identity;
  }

  @Override
  public String value() {
    return value;
  }

  @Override
  public String namespaceURI() {
    return namespaceURI;
  }

  @Override
  public String localName() {
    return localName;
  }

  @Override
  public List<SourceAttribute> attributes() {
    return attributes;
  }

  @Override
  public List<SourceNode> children() {
    return children;
  }

  @Override
  public String toString() {
    return kind + "[" + localName + "]";
  }
}
