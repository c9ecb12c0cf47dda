/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.access.xml;

import io.treeweave.exception.TreeStructureException;
import io.treeweave.node.NodeKind;
import io.treeweave.settings.Constants;
import io.treeweave.settings.Fixed;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test {@link XmlTreeImpl}.
 */
final class XmlTreeImplTest {

  private static final long NULL_NODE_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  private XmlTreeImpl tree;

  private int htmlNamespace;

  @BeforeEach
  void setUp() {
    tree = new XmlTreeImpl();
    htmlNamespace = tree.addNamespace(Constants.HTML_NAMESPACE_URI);
  }

  @Test
  void testAppendLinksSiblings() throws TreeStructureException {
    final long document = tree.newDocument();
    final long html = tree.newElement(tree.addName("html", htmlNamespace));
    final long head = tree.newElement(tree.addName("head", htmlNamespace));
    final long body = tree.newElement(tree.addName("body", htmlNamespace));

    tree.append(document, html);
    tree.append(html, head);
    tree.append(html, body);

    assertEquals(html, tree.documentElement(document));
    assertEquals(document, tree.parent(html));
    assertEquals(head, tree.firstChild(html));
    assertEquals(body, tree.lastChild(html));
    assertEquals(body, tree.nextSibling(head));
    assertEquals(head, tree.previousSibling(body));
    assertEquals(NULL_NODE_KEY, tree.previousSibling(head));
    assertEquals(NULL_NODE_KEY, tree.nextSibling(body));
    assertEquals(LongArrayList.of(head, body), tree.children(html));
    assertEquals(4, tree.getNodeCount());
  }

  @Test
  void testTypedAccess() throws TreeStructureException {
    final long document = tree.newDocument();
    final long text = tree.newText("a");
    final long comment = tree.newComment(" note ");
    tree.append(document, text);
    tree.append(document, comment);

    assertTrue(tree.isDocument(document));
    assertTrue(tree.isText(text));
    assertTrue(tree.isComment(comment));
    assertEquals(NodeKind.TEXT, tree.getKind(text));
    assertEquals(" note ", tree.getComment(comment).getValue());
    assertEquals(NULL_NODE_KEY, tree.documentElement(document));

    tree.getText(text).appendValue("b");
    assertEquals("ab", tree.getText(text).getValue());

    assertThrows(IllegalArgumentException.class, () -> tree.getElement(text));
    assertThrows(IllegalArgumentException.class, () -> tree.firstChild(99));
  }

  @Test
  void testAppendToLeafFails() {
    final long text = tree.newText("a");
    final long comment = tree.newComment("c");

    assertThrows(TreeStructureException.class, () -> tree.append(text, comment));
    assertThrows(TreeStructureException.class, () -> tree.append(comment, text));
  }

  @Test
  void testAppendDocumentFails() {
    final long document = tree.newDocument();
    final long element = tree.newElement(tree.addName("div", htmlNamespace));

    assertThrows(TreeStructureException.class, () -> tree.append(element, document));
    assertThrows(TreeStructureException.class, () -> tree.append(document, tree.newDocument()));
  }

  @Test
  void testAppendAttachedNodeFails() throws TreeStructureException {
    final long first = tree.newElement(tree.addName("div", htmlNamespace));
    final long second = tree.newElement(tree.addName("div", htmlNamespace));
    final long text = tree.newText("a");
    tree.append(first, text);

    assertThrows(TreeStructureException.class, () -> tree.append(second, text));
    assertThrows(TreeStructureException.class, () -> tree.append(first, first));
    assertEquals(NULL_NODE_KEY, tree.firstChild(second));
  }

  @Test
  void testDocumentAcceptsOneElement() throws TreeStructureException {
    final int nameKey = tree.addName("html", htmlNamespace);
    final long document = tree.newDocument();
    tree.append(document, tree.newElement(nameKey));
    tree.append(document, tree.newText("after"));

    assertThrows(TreeStructureException.class, () -> tree.append(document, tree.newElement(nameKey)));
    assertEquals(2, tree.children(document).size());
  }

  @Test
  void testNames() {
    final int svgNamespace = tree.addNamespace(Constants.SVG_NAMESPACE_URI);

    final int htmlTitle = tree.addName("title", htmlNamespace);
    final int svgTitle = tree.addName("title", svgNamespace);
    final int plainTitle = tree.addName("title", tree.noNamespace());

    assertNotEquals(htmlTitle, svgTitle);
    assertNotEquals(htmlTitle, plainTitle);
    assertEquals(htmlTitle, tree.addName("title", htmlNamespace));
    assertEquals(svgNamespace, tree.namespaceForName(svgTitle));
    assertEquals("title", tree.localNameForName(svgTitle));
    assertEquals(Constants.SVG_NAMESPACE_URI, tree.namespaceForKey(svgNamespace));
    assertEquals("", tree.namespaceForKey(tree.noNamespace()));
    assertEquals(htmlNamespace, tree.addNamespace(Constants.HTML_NAMESPACE_URI));
    assertEquals(tree.noNamespace(), tree.addNamespace(""));
  }

  @Test
  void testUnknownKeysAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> tree.newElement(12345));
    assertThrows(IllegalArgumentException.class, () -> tree.addName("p", 12345));
    assertThrows(IllegalArgumentException.class, () -> tree.localNameForName(12345));
  }

  @Test
  void testAttributesKeepInsertionOrder() {
    final long element = tree.newElement(tree.addName("a", htmlNamespace));
    final int href = tree.addName("href", tree.noNamespace());
    final int id = tree.addName("id", tree.noNamespace());

    tree.attributes(element).insert(href, "x");
    tree.attributes(element).insert(id, "y");
    tree.attributes(element).insert(href, "z");

    assertEquals(2, tree.attributes(element).size());
    assertEquals(href, tree.attributes(element).nameKeys().getInt(0));
    assertEquals("z", tree.attributes(element).get(href));
    assertFalse(tree.attributes(element).contains(tree.addName("class", tree.noNamespace())));
  }
}
