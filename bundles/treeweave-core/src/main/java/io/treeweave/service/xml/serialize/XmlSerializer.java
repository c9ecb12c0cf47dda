/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.xml.serialize;

import io.treeweave.api.xml.XmlTree;
import io.treeweave.node.NodeKind;
import io.treeweave.node.xml.Attributes;
import io.treeweave.settings.Constants;
import io.treeweave.settings.Fixed;
import io.treeweave.utils.LogWrapper;
import io.treeweave.utils.XmlToken;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.longs.LongList;
import org.checkerframework.checker.index.qual.NonNegative;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Serializes a subtree of an {@link XmlTree} as XML. The traversal uses an explicit stack, so
 * arbitrarily deep trees can be written.
 *
 * <p>
 * Elements are written unprefixed; whenever the namespace of an element differs from the default
 * namespace in scope, a default namespace declaration is emitted. Attributes in a namespace get a
 * prefix ({@code xml}, {@code xlink} or a generated {@code ns<N>}), declared on the element.
 * Namespace declarations of the source document, that is attributes in the {@code xmlns} namespace
 * or named {@code xmlns}, are not written, as the serializer emits its own declarations.
 * </p>
 */
public final class XmlSerializer {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(XmlSerializer.class));

  private static final long NULL_NODE_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

  /** The tree to serialize. */
  private final XmlTree tree;

  /** Root node key of subtree to serialize. */
  private final long startNodeKey;

  /** Serialize XML declaration. */
  private final boolean emitXMLDeclaration;

  /** Indent output. */
  private final boolean indent;

  /** Number of spaces to indent. */
  private final int indentSpaces;

  /**
   * Builder to build an {@link XmlSerializer} instance.
   */
  public static final class Builder {

    private final XmlTree tree;

    private final long startNodeKey;

    private boolean emitXMLDeclaration;

    private boolean indent;

    private int indentSpaces = 2;

    /**
     * Constructor.
     *
     * @param tree the tree to serialize
     * @param startNodeKey key of the root of the subtree to serialize
     */
    public Builder(final XmlTree tree, final @NonNegative long startNodeKey) {
      this.tree = requireNonNull(tree);
      checkArgument(startNodeKey >= 0, "Start node key must be non negative: %s", startNodeKey);
      this.startNodeKey = startNodeKey;
    }

    /**
     * Emit an XML declaration.
     *
     * @return this builder instance
     */
    public Builder emitXMLDeclaration() {
      emitXMLDeclaration = true;
      return this;
    }

    /**
     * Indent element-only content.
     *
     * @return this builder instance
     */
    public Builder prettyPrint() {
      indent = true;
      return this;
    }

    /**
     * Number of spaces per indentation level (default: 2).
     *
     * @param spaces number of spaces
     * @return this builder instance
     */
    public Builder indentSpaces(final @NonNegative int spaces) {
      checkArgument(spaces >= 0, "Indentation must be non negative: %s", spaces);
      indentSpaces = spaces;
      return this;
    }

    public XmlSerializer build() {
      return new XmlSerializer(this);
    }
  }

  private XmlSerializer(final Builder builder) {
    tree = builder.tree;
    startNodeKey = builder.startNodeKey;
    emitXMLDeclaration = builder.emitXMLDeclaration;
    indent = builder.indent;
    indentSpaces = builder.indentSpaces;
  }

  /**
   * Namespace bindings in scope of an element.
   *
   * @param defaultNamespace URI of the default namespace
   * @param prefixes prefixes bound to URIs
   */
  private record Scope(String defaultNamespace, Map<String, String> prefixes) {
    static Scope root() {
      final Map<String, String> prefixes = new HashMap<>();
      prefixes.put(Constants.XML_NAMESPACE_URI, "xml");
      return new Scope(Constants.NULL_NAMESPACE_URI, prefixes);
    }
  }

  /**
   * Pending work of the traversal.
   *
   * @param nodeKey the node
   * @param endTag {@code true} if the end tag of the element has to be written
   * @param scope bindings in scope of the node's parent, or of the element itself for end tags
   * @param depth the nesting depth
   * @param indented {@code true} if the node starts on its own line
   */
  private record Frame(long nodeKey, boolean endTag, Scope scope, int depth, boolean indented) {
  }

  /**
   * Serialize the subtree to a string.
   *
   * @return the XML text
   */
  public String serializeToString() {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      serialize(out);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString(Constants.DEFAULT_ENCODING);
  }

  /**
   * Serialize the subtree as UTF-8 encoded XML. The stream is flushed but not closed.
   *
   * @param out the stream to write to
   * @throws IOException if writing fails
   */
  public void serialize(final OutputStream out) throws IOException {
    requireNonNull(out);
    final long time = System.nanoTime();
    final Writer writer = new BufferedWriter(new OutputStreamWriter(out, Constants.DEFAULT_ENCODING), 4096);

    if (emitXMLDeclaration) {
      writer.write(XML_DECLARATION);
    }
    boolean startOfOutput = !emitXMLDeclaration;

    final Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(startNodeKey, false, Scope.root(), 0, emitXMLDeclaration && indent));

    while (!stack.isEmpty()) {
      final Frame frame = stack.pop();

      if (frame.endTag()) {
        if (frame.indented()) {
          newLine(writer, frame.depth());
        }
        writer.write("</");
        writer.write(tree.localNameForName(tree.getElement(frame.nodeKey()).getNameKey()));
        writer.write('>');
        continue;
      }

      final NodeKind kind = tree.getKind(frame.nodeKey());
      if (kind == NodeKind.DOCUMENT) {
        pushChildren(stack, frame.nodeKey(), frame.scope(), frame.depth(), indent);
        continue;
      }

      if (frame.indented() && !startOfOutput) {
        newLine(writer, frame.depth());
      }
      startOfOutput = false;

      switch (kind) {
        case ELEMENT -> {
          final Scope scope = emitStartTag(writer, frame.nodeKey(), frame.scope());
          if (tree.firstChild(frame.nodeKey()) == NULL_NODE_KEY) {
            writer.write("/>");
          } else {
            writer.write('>');
            final boolean indentChildren = indent && !hasTextChild(frame.nodeKey());
            stack.push(new Frame(frame.nodeKey(), true, scope, frame.depth(), indentChildren));
            pushChildren(stack, frame.nodeKey(), scope, frame.depth() + 1, indentChildren);
          }
        }
        case TEXT -> writer.write(XmlToken.escapeContent(tree.getText(frame.nodeKey()).getValue()));
        case COMMENT -> {
          writer.write("<!--");
          writer.write(tree.getComment(frame.nodeKey()).getValue());
          writer.write("-->");
        }
        default -> throw new IllegalStateException("Node kind not known!");
      }
    }

    writer.flush();
    LOGWRAPPER.debug("Serialized subtree of node {} in {} ms.", startNodeKey, (System.nanoTime() - time) / 1_000_000);
  }

  private void pushChildren(final Deque<Frame> stack, final long nodeKey, final Scope scope, final int depth,
      final boolean indented) {
    final LongList children = tree.children(nodeKey);
    for (int i = children.size() - 1; i >= 0; i--) {
      stack.push(new Frame(children.getLong(i), false, scope, depth, indented));
    }
  }

  private boolean hasTextChild(final long nodeKey) {
    for (long key = tree.firstChild(nodeKey); key != NULL_NODE_KEY; key = tree.nextSibling(key)) {
      if (tree.isText(key)) {
        return true;
      }
    }
    return false;
  }

  // Writes "<name" plus declarations and attributes and returns the scope of the element.
  private Scope emitStartTag(final Writer writer, final long elementKey, final Scope parentScope) throws IOException {
    final int nameKey = tree.getElement(elementKey).getNameKey();
    final String uri = tree.namespaceForKey(tree.namespaceForName(nameKey));

    writer.write('<');
    writer.write(tree.localNameForName(nameKey));

    String defaultNamespace = parentScope.defaultNamespace();
    if (!uri.equals(defaultNamespace)) {
      writeAttribute(writer, "xmlns", uri);
      defaultNamespace = uri;
    }

    Map<String, String> prefixes = parentScope.prefixes();
    final Attributes attributes = tree.attributes(elementKey);
    final StringBuilder attributeText = new StringBuilder();
    final IntList nameKeys = attributes.nameKeys();
    for (int i = 0, size = nameKeys.size(); i < size; i++) {
      final int attributeNameKey = nameKeys.getInt(i);
      final String attributeUri = tree.namespaceForKey(tree.namespaceForName(attributeNameKey));
      final String localName = tree.localNameForName(attributeNameKey);

      if (isNamespaceDeclaration(attributeUri, localName)) {
        continue;
      }

      final String qualifiedName;
      if (attributeUri.isEmpty()) {
        qualifiedName = localName;
      } else {
        String prefix = prefixes.get(attributeUri);
        if (prefix == null) {
          if (prefixes == parentScope.prefixes()) {
            prefixes = new HashMap<>(prefixes);
          }
          prefix = newPrefix(attributeUri, prefixes);
          prefixes.put(attributeUri, prefix);
          writeAttribute(writer, "xmlns:" + prefix, attributeUri);
        }
        qualifiedName = prefix + ":" + localName;
      }

      attributeText.append(' ').append(qualifiedName).append("=\"");
      attributeText.append(XmlToken.escapeAttribute(requireNonNull(attributes.get(attributeNameKey))));
      attributeText.append('"');
    }
    writer.write(attributeText.toString());

    return new Scope(defaultNamespace, prefixes);
  }

  private static boolean isNamespaceDeclaration(final String uri, final String localName) {
    return Constants.XMLNS_NAMESPACE_URI.equals(uri)
        || (uri.isEmpty() && (localName.equals("xmlns") || localName.startsWith("xmlns:")));
  }

  private static String newPrefix(final String uri, final Map<String, String> prefixes) {
    if (Constants.XLINK_NAMESPACE_URI.equals(uri) && !prefixes.containsValue("xlink")) {
      return "xlink";
    }
    int counter = 0;
    while (prefixes.containsValue("ns" + counter)) {
      counter++;
    }
    return "ns" + counter;
  }

  private static void writeAttribute(final Writer writer, final String name, final String value) throws IOException {
    writer.write(' ');
    writer.write(name);
    writer.write("=\"");
    writer.write(XmlToken.escapeAttribute(value));
    writer.write('"');
  }

  private void newLine(final Writer writer, final int depth) throws IOException {
    writer.write('\n');
    for (int i = 0, spaces = depth * indentSpaces; i < spaces; i++) {
      writer.write(' ');
    }
  }
}
