/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import io.treeweave.api.xml.XmlTree;
import io.treeweave.exception.TreeStructureException;
import io.treeweave.node.xml.Attributes;
import io.treeweave.service.html.source.SourceAttribute;
import io.treeweave.service.html.source.SourceNode;
import io.treeweave.service.html.source.SourceNodeKind;
import io.treeweave.settings.Fixed;
import io.treeweave.utils.LogWrapper;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Converts a parsed HTML DOM into an {@link XmlTree}.
 *
 * <p>
 * The DOM is walked depth-first in document order with an explicit work list, so the nesting depth
 * of the input does not affect the call stack. Documents are not materialized, doctypes and
 * processing instructions are dropped, adjacent text is merged into one text node and every
 * element name is resolved against the namespaces of the target tree.
 * </p>
 *
 * <p>
 * A source node which is reachable through more than one reference is converted only once; later
 * visits skip the node and its subtree. This also terminates the walk on cyclic input.
 * </p>
 *
 * <p>
 * An instance is bound to one target tree and is not thread-safe.
 * </p>
 */
public final class DomConverter {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(DomConverter.class));

  private static final long NULL_NODE_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** The target tree. */
  private final XmlTree tree;

  /** Namespace keys of the target tree. */
  private final NamespaceInterner namespaces;

  /** Source nodes visited during the current pass. */
  private final NodeIdentityGuard guard;

  /** Determines if comments are converted. */
  private final boolean includeComments;

  /**
   * A source node waiting to be converted below a target parent.
   *
   * @param node the source node
   * @param targetParent key of the target parent
   */
  private record Task(SourceNode node, long targetParent) {
  }

  /**
   * Constructor, comments are converted.
   *
   * @param tree the target tree
   */
  public DomConverter(final XmlTree tree) {
    this(tree, true);
  }

  /**
   * Constructor.
   *
   * @param tree the target tree
   * @param includeComments determines if comments are converted or dropped
   */
  public DomConverter(final XmlTree tree, final boolean includeComments) {
    this.tree = requireNonNull(tree);
    this.includeComments = includeComments;
    namespaces = new NamespaceInterner(tree);
    guard = new NodeIdentityGuard();
  }

  /**
   * Convert a source document into a new document of the target tree. If the conversion yields an
   * empty document, the first element or text among the direct children of the source document is
   * converted under a fresh document instead. A {@link SourceNodeKind#FRAGMENT} is always converted
   * that way; further top-level nodes of the fragment are not converted.
   *
   * @param document the source document
   * @return the key of the target document node
   * @throws IllegalStateException if the target tree rejects a mutation
   */
  public long convertDocument(final SourceNode document) {
    requireNonNull(document);
    final long time = System.nanoTime();
    final long documentKey = tree.newDocument();

    int converted = 0;
    if (document.kind() != SourceNodeKind.FRAGMENT) {
      try {
        converted = convert(document, documentKey);
      } finally {
        clearVisited();
      }
    }

    final long resultKey;
    if (tree.firstChild(documentKey) == NULL_NODE_KEY) {
      resultKey = new FragmentRootResolver(tree, this).resolve(document, documentKey);
    } else {
      resultKey = documentKey;
    }

    if (LOGWRAPPER.isDebugEnabled()) {
      LOGWRAPPER.debug("Converted {} source nodes into document {} in {} ms.",
                       converted,
                       resultKey,
                       (System.nanoTime() - time) / 1_000_000);
    }
    return resultKey;
  }

  /**
   * Convert a source node and its descendants and append the result below a target node. Source
   * nodes seen before during the current pass are skipped.
   *
   * @param root the source node to start with
   * @param targetParent key of the target node to append to
   * @return the number of source nodes which have been visited for the first time
   * @throws IllegalStateException if the target tree rejects a mutation
   */
  int convert(final SourceNode root, final long targetParent) {
    final Deque<Task> work = new ArrayDeque<>();
    work.push(new Task(requireNonNull(root), targetParent));
    int visited = 0;

    while (!work.isEmpty()) {
      final Task task = work.pop();
      final SourceNode node = task.node();

      if (!guard.markIfNew(node)) {
        LOGWRAPPER.debug("Skipping revisited source node {}.", node);
        continue;
      }
      visited++;

      final long targetKey;
      switch (node.kind()) {
        case DOCUMENT, FRAGMENT -> targetKey = task.targetParent();
        case DOCTYPE, PROCESSING_INSTRUCTION -> {
          continue;
        }
        case TEXT -> {
          final long lastChild = tree.lastChild(task.targetParent());
          if (lastChild != NULL_NODE_KEY && tree.isText(lastChild)) {
            tree.getText(lastChild).appendValue(node.value());
            guard.record(node, lastChild);
            continue;
          }
          targetKey = tree.newText(node.value());
          append(task.targetParent(), targetKey);
        }
        case COMMENT -> {
          if (!includeComments) {
            continue;
          }
          targetKey = tree.newComment(node.value());
          append(task.targetParent(), targetKey);
        }
        case ELEMENT -> targetKey = convertElement(node, task.targetParent());
        default -> throw new IllegalStateException("Source node kind not known: " + node.kind());
      }

      guard.record(node, targetKey);

      final List<SourceNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        work.push(new Task(children.get(i), targetKey));
      }
    }

    return visited;
  }

  private long convertElement(final SourceNode node, final long targetParent) {
    final int nameKey = tree.addName(node.localName(), namespaces.intern(node.namespaceURI()));
    final long elementKey = tree.newElement(nameKey);
    append(targetParent, elementKey);

    final List<SourceAttribute> sourceAttributes = node.attributes();
    if (sourceAttributes.isEmpty()) {
      return elementKey;
    }

    // Resolve all names before the attribute storage of the element is touched.
    final IntList nameKeys = new IntArrayList(sourceAttributes.size());
    final List<String> values = new ArrayList<>(sourceAttributes.size());
    for (final SourceAttribute attribute : sourceAttributes) {
      nameKeys.add(tree.addName(attribute.localName(), namespaces.intern(attribute.namespaceURI())));
      values.add(attribute.value());
    }

    final Attributes attributes = tree.attributes(elementKey);
    for (int i = 0, size = nameKeys.size(); i < size; i++) {
      attributes.insert(nameKeys.getInt(i), values.get(i));
    }

    return elementKey;
  }

  private void append(final long parentKey, final long childKey) {
    try {
      tree.append(parentKey, childKey);
    } catch (final TreeStructureException e) {
      throw new IllegalStateException("Converted DOM is not a well-formed tree: " + e.getMessage(), e);
    }
  }

  /**
   * Forget all source nodes visited so far.
   */
  void clearVisited() {
    guard.clear();
  }
}
