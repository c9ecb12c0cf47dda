/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import io.treeweave.service.html.source.SimpleSourceNode;
import io.treeweave.settings.Fixed;
import org.junit.jupiter.api.Test;

import static io.treeweave.service.html.source.SimpleSourceNode.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class NodeIdentityGuardTest {

  private static final long NULL_NODE_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  @Test
  void testMarkIfNew() {
    final NodeIdentityGuard guard = new NodeIdentityGuard();
    final SimpleSourceNode node = text("a");

    assertTrue(guard.markIfNew(node));
    assertFalse(guard.markIfNew(node));
    assertEquals(NULL_NODE_KEY, guard.targetOf(node));
  }

  @Test
  void testIdentityNotEquality() {
    final NodeIdentityGuard guard = new NodeIdentityGuard();
    final SimpleSourceNode first = text("same");
    final SimpleSourceNode second = text("same");

    assertTrue(guard.markIfNew(first));
    assertTrue(guard.markIfNew(second), "equal content is a different node");
    assertFalse(guard.markIfNew(text("other").sameIdentityAs(first)), "a shared identity is the same node");
    assertEquals(2, guard.size());
  }

  @Test
  void testRecordAndClear() {
    final NodeIdentityGuard guard = new NodeIdentityGuard();
    final SimpleSourceNode node = text("a");
    guard.markIfNew(node);

    guard.record(node, 7L);
    assertEquals(7L, guard.targetOf(node));

    guard.clear();
    assertTrue(guard.isEmpty());
    assertEquals(NULL_NODE_KEY, guard.targetOf(node));
    assertTrue(guard.markIfNew(node));
  }
}
