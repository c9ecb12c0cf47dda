/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.settings;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Interface to hold all constants of the node layer.
 */
public final class Constants {

  /**
   * Private constructor.
   */
  private Constants() {
    // Cannot be instantiated.
    throw new AssertionError("May not be instantiated!");
  }

  // --- Varia
  // ------------------------------------------------------------------

  /** Default internal encoding. */
  public static final Charset DEFAULT_ENCODING = StandardCharsets.UTF_8;

  /** The empty namespace URI, that is "no namespace". */
  public static final String NULL_NAMESPACE_URI = "";

  /** Initial capacity of the node store of a tree. */
  public static final int INITIAL_NODE_CAPACITY = 64;

  // --- Well-known namespaces
  // ----------------------------------------------------------

  /** HTML (XHTML) namespace URI. */
  public static final String HTML_NAMESPACE_URI = "http://www.w3.org/1999/xhtml";

  /** MathML namespace URI. */
  public static final String MATHML_NAMESPACE_URI = "http://www.w3.org/1998/Math/MathML";

  /** SVG namespace URI. */
  public static final String SVG_NAMESPACE_URI = "http://www.w3.org/2000/svg";

  /** XLink namespace URI. */
  public static final String XLINK_NAMESPACE_URI = "http://www.w3.org/1999/xlink";

  /** Namespace URI bound to the {@code xml} prefix. */
  public static final String XML_NAMESPACE_URI = "http://www.w3.org/XML/1998/namespace";

  /** Namespace URI of namespace declaration attributes. */
  public static final String XMLNS_NAMESPACE_URI = "http://www.w3.org/2000/xmlns/";
}
