/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import io.treeweave.api.xml.XmlTree;
import io.treeweave.service.html.source.SourceNode;
import io.treeweave.service.html.source.SourceNodeKind;
import io.treeweave.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Recovers a root when converting a source document produced an empty target document. The first
 * element or text among the direct children of the source document is converted below a new
 * target document. Any further top-level siblings are not recovered.
 */
final class FragmentRootResolver {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(FragmentRootResolver.class));

  private final XmlTree tree;

  private final DomConverter converter;

  FragmentRootResolver(final XmlTree tree, final DomConverter converter) {
    this.tree = requireNonNull(tree);
    this.converter = requireNonNull(converter);
  }

  /**
   * Resolve the root of a source document.
   *
   * @param sourceDocument the source document the first pass started with
   * @param emptyDocumentKey the key of the empty target document of the first pass
   * @return the key of a new target document holding the recovered root, or
   *         {@code emptyDocumentKey} if the source document has no element or text child
   */
  long resolve(final SourceNode sourceDocument, final long emptyDocumentKey) {
    converter.clearVisited();

    for (final SourceNode child : sourceDocument.children()) {
      if (child.kind() != SourceNodeKind.ELEMENT && child.kind() != SourceNodeKind.TEXT) {
        continue;
      }

      final long documentKey = tree.newDocument();
      try {
        converter.convert(child, documentKey);
      } finally {
        converter.clearVisited();
      }
      LOGWRAPPER.debug("Recovered {} root of source document below new document {}.", child.kind(), documentKey);
      return documentKey;
    }

    LOGWRAPPER.debug("Source document has no element or text child, keeping empty document {}.", emptyDocumentKey);
    return emptyDocumentKey;
  }
}
