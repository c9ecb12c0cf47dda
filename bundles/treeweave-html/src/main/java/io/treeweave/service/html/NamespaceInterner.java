/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import io.treeweave.api.xml.XmlTree;
import io.treeweave.settings.Constants;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Maps namespace URIs to the namespace keys of a target tree. An instance belongs to one
 * conversion and is seeded with the namespaces HTML content uses.
 */
final class NamespaceInterner {

  /** Namespaces every HTML5 DOM may contain. */
  static final List<String> WELL_KNOWN_NAMESPACES = List.of(Constants.HTML_NAMESPACE_URI,
                                                            Constants.MATHML_NAMESPACE_URI,
                                                            Constants.SVG_NAMESPACE_URI,
                                                            Constants.XLINK_NAMESPACE_URI,
                                                            Constants.XML_NAMESPACE_URI,
                                                            Constants.XMLNS_NAMESPACE_URI);

  private final XmlTree tree;

  private final Object2IntMap<String> namespaceKeys;

  /**
   * Constructor.
   *
   * @param tree the target tree, which has to outlive the interner
   */
  NamespaceInterner(final XmlTree tree) {
    this.tree = requireNonNull(tree);
    namespaceKeys = new Object2IntOpenHashMap<>(WELL_KNOWN_NAMESPACES.size() * 2);
    for (final String uri : WELL_KNOWN_NAMESPACES) {
      namespaceKeys.put(uri, tree.addNamespace(uri));
    }
  }

  /**
   * Get the namespace key of a URI, adding the namespace to the tree if it is unknown.
   *
   * @param uri the namespace URI
   * @return the key of the namespace, {@link XmlTree#noNamespace()} for the empty URI
   */
  int intern(final String uri) {
    if (uri.isEmpty()) {
      return tree.noNamespace();
    }
    if (namespaceKeys.containsKey(uri)) {
      return namespaceKeys.getInt(uri);
    }
    final int namespaceKey = tree.addNamespace(uri);
    namespaceKeys.put(uri, namespaceKey);
    return namespaceKey;
  }

  int size() {
    return namespaceKeys.size();
  }
}
