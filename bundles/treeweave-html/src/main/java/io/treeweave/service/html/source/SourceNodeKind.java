/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html.source;

/**
 * Kinds of nodes of a parsed HTML DOM.
 */
public enum SourceNodeKind {
  DOCUMENT,

  /** A snippet without document shell, possibly with several top-level nodes. */
  FRAGMENT,

  DOCTYPE,

  TEXT,

  COMMENT,

  ELEMENT,

  PROCESSING_INSTRUCTION
}
