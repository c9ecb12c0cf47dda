/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html.source;

import static java.util.Objects.requireNonNull;

/**
 * An attribute of a source element.
 *
 * @param namespaceURI the namespace URI, the empty string for no namespace
 * @param localName the local name
 * @param value the attribute value
 */
public record SourceAttribute(String namespaceURI, String localName, String value) {
  public SourceAttribute {
    requireNonNull(namespaceURI);
    requireNonNull(localName);
    requireNonNull(value);
  }
}
