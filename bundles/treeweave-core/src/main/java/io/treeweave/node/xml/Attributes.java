/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.node.xml;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Attribute storage of an element. Maps name keys to values and keeps the insertion order; storing
 * a value under a name which is already present replaces the value but keeps the position.
 */
public final class Attributes {

  private final Int2ObjectLinkedOpenHashMap<String> values = new Int2ObjectLinkedOpenHashMap<>();

  /**
   * Insert or replace an attribute.
   *
   * @param nameKey the key of the attribute name
   * @param value the attribute value
   * @return the previous value, or {@code null} if the attribute is new
   */
  public @Nullable String insert(final int nameKey, final String value) {
    return values.put(nameKey, requireNonNull(value));
  }

  public @Nullable String get(final int nameKey) {
    return values.get(nameKey);
  }

  public boolean contains(final int nameKey) {
    return values.containsKey(nameKey);
  }

  public @Nullable String remove(final int nameKey) {
    return values.remove(nameKey);
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /**
   * Get the name keys in insertion order.
   *
   * @return a copy of the name keys
   */
  public IntList nameKeys() {
    return new IntArrayList(values.keySet());
  }
}
