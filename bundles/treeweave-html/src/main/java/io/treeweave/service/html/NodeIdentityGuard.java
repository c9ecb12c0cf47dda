/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import io.treeweave.service.html.source.SourceNode;
import io.treeweave.settings.Fixed;
import it.unimi.dsi.fastutil.objects.Reference2LongMap;
import it.unimi.dsi.fastutil.objects.Reference2LongOpenHashMap;

/**
 * Remembers which source nodes have been converted, and into which target node. Keys are compared
 * by reference identity of {@link SourceNode#identity()}, never by content.
 *
 * <p>
 * The mapping is only meaningful while the source DOM is alive and unmodified. It is cleared at
 * the end of every conversion pass and must not be consulted afterwards.
 * </p>
 */
final class NodeIdentityGuard {

  private static final long NULL_NODE_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  private final Reference2LongMap<Object> visited;

  NodeIdentityGuard() {
    visited = new Reference2LongOpenHashMap<>();
    visited.defaultReturnValue(NULL_NODE_KEY);
  }

  /**
   * Mark a node as visited.
   *
   * @param node the source node
   * @return {@code true} if this is the first visit, {@code false} if the node has been marked
   *         before
   */
  boolean markIfNew(final SourceNode node) {
    final Object identity = node.identity();
    if (visited.containsKey(identity)) {
      return false;
    }
    visited.put(identity, NULL_NODE_KEY);
    return true;
  }

  /**
   * Record the target node a source node has been converted into.
   *
   * @param node the source node
   * @param targetKey the key of the target node
   */
  void record(final SourceNode node, final long targetKey) {
    visited.put(node.identity(), targetKey);
  }

  /**
   * Get the target node of a visited source node.
   *
   * @param node the source node
   * @return the key of the target node, or {@link Fixed#NULL_NODE_KEY} if the node is unknown or
   *         did not produce a target node
   */
  long targetOf(final SourceNode node) {
    return visited.getLong(node.identity());
  }

  void clear() {
    visited.clear();
  }

  boolean isEmpty() {
    return visited.isEmpty();
  }

  int size() {
    return visited.size();
  }
}
