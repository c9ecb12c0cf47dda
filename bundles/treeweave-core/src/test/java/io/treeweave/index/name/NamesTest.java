/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.index.name;

import io.treeweave.settings.Fixed;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class NamesTest {

  @Test
  void whenIndexExistsForAnotherString_createNewIndex() {
    final var names = Names.getInstance();

    // "FB" and "Ea" share the same hash code.
    final var fbIndex = names.setName("FB");
    final var eaIndex = names.setName("Ea");

    assertNotEquals(fbIndex, eaIndex);
    assertEquals("FB", names.getName(fbIndex));
    assertEquals("Ea", names.getName(eaIndex));
  }

  @Test
  void whenIndexExistsForSameString_createNoNewIndex() {
    final var names = Names.getInstance();

    final var first = names.setName("FB");
    final var second = names.setName("FB");

    assertEquals(first, second);
    assertEquals(1, names.size());
  }

  @Test
  void whenNameIsSet_getKeyReturnsKey() {
    final var names = Names.getInstance();

    final var index = names.setName("body");

    assertEquals(index, names.getKey("body"));
    assertTrue(names.containsKey(index));
  }

  @Test
  void whenNameIsNotSet_lookupsReturnNothing() {
    final var names = Names.getInstance();

    assertNull(names.getName(42));
    assertFalse(names.containsKey(42));
    assertEquals((int) Fixed.NULL_NAME_KEY.getStandardProperty(), names.getKey("body"));
  }

  @Test
  void whenProbedKeyIsTaken_probingContinues() {
    final var names = Names.getInstance();

    final var fbIndex = names.setName("FB");
    final var eaIndex = names.setName("Ea");
    // The hash code of "FC" is the key "Ea" has been moved to.
    final var fcIndex = names.setName("FC");

    assertEquals("FB".hashCode(), fbIndex);
    assertEquals("FB".hashCode() + 1, eaIndex);
    assertEquals("FB".hashCode() + 2, fcIndex);
    assertEquals("FC", names.getName(fcIndex));
  }
}
