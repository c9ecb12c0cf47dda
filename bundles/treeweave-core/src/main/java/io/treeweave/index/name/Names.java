/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.index.name;

import io.treeweave.settings.Fixed;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Names dictionary. Interns strings to compact {@code int} keys, which are derived from the hash
 * code of the string and shifted on collisions. Keys are stable for the lifetime of the instance
 * and the dictionary never shrinks.
 */
public final class Names {

  private static final int NULL_KEY = (int) Fixed.NULL_NAME_KEY.getStandardProperty();

  /**
   * Map the key of a name to its name.
   */
  private final Int2ObjectMap<String> nameMap;

  /**
   * Map a name to its key.
   */
  private final Object2IntMap<String> keyMap;

  /**
   * Constructor creating a new dictionary.
   */
  private Names() {
    nameMap = new Int2ObjectOpenHashMap<>();
    keyMap = new Object2IntOpenHashMap<>();
    keyMap.defaultReturnValue(NULL_KEY);
  }

  /**
   * Create name key given a name. Returns the existing key if the name has been added before.
   *
   * @param name name to create key for
   * @return generated key
   */
  public int setName(final String name) {
    requireNonNull(name);

    final int existingKey = keyMap.getInt(name);
    if (existingKey != NULL_KEY) {
      return existingKey;
    }

    final int hashKey = name.hashCode();
    final int newKey = isTaken(hashKey) ? getNewKey(hashKey) : hashKey;

    nameMap.put(newKey, name);
    keyMap.put(name, newKey);

    return newKey;
  }

  private int getNewKey(final int key) {
    int newKey = key;

    while (isTaken(newKey) && newKey != Integer.MAX_VALUE)
      newKey++;

    if (isTaken(newKey)) {
      newKey = Integer.MIN_VALUE;
      while (isTaken(newKey) && newKey < key)
        newKey++;
    }

    if (isTaken(newKey))
      throw new IllegalStateException("Key is not unique.");

    return newKey;
  }

  private boolean isTaken(final int key) {
    return key == NULL_KEY || nameMap.containsKey(key);
  }

  /**
   * Get the name for the key.
   *
   * @param key the key to look up
   * @return the string the key maps to, or {@code null} if no mapping exists
   */
  public @Nullable String getName(final int key) {
    return nameMap.get(key);
  }

  /**
   * Get the key of a name.
   *
   * @param name the name to look up
   * @return the key, or {@link Fixed#NULL_NAME_KEY} if the name has not been added
   */
  public int getKey(final String name) {
    return keyMap.getInt(requireNonNull(name));
  }

  /**
   * Determines if a key has been handed out by this dictionary.
   *
   * @param key the key to check
   * @return {@code true} if the key maps to a name
   */
  public boolean containsKey(final int key) {
    return nameMap.containsKey(key);
  }

  /**
   * Get the number of names.
   *
   * @return number of interned names
   */
  public int size() {
    return nameMap.size();
  }

  /**
   * Get a new instance.
   *
   * @return new instance of {@link Names}
   */
  public static Names getInstance() {
    return new Names();
  }
}
