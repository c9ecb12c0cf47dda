/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html.source;

import io.treeweave.settings.Constants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class W3cSourceNodeTest {

  private Document document;

  @BeforeEach
  void setUp() throws ParserConfigurationException {
    final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    document = factory.newDocumentBuilder().newDocument();
  }

  @Test
  void testKinds() {
    final Element html = document.createElementNS(Constants.HTML_NAMESPACE_URI, "html");
    document.appendChild(document.createProcessingInstruction("target", "data"));
    document.appendChild(html);
    html.appendChild(document.createTextNode("a"));
    html.appendChild(document.createCDATASection("b"));
    html.appendChild(document.createComment("c"));

    final SourceNode source = W3cSourceNode.of(document);
    assertEquals(SourceNodeKind.DOCUMENT, source.kind());
    assertEquals(SourceNodeKind.PROCESSING_INSTRUCTION, source.children().get(0).kind());

    final SourceNode element = source.children().get(1);
    assertEquals(SourceNodeKind.ELEMENT, element.kind());
    assertEquals("html", element.localName());
    assertEquals(Constants.HTML_NAMESPACE_URI, element.namespaceURI());

    final List<SourceNode> children = element.children();
    assertEquals(SourceNodeKind.TEXT, children.get(0).kind());
    assertEquals(SourceNodeKind.TEXT, children.get(1).kind());
    assertEquals("b", children.get(1).value());
    assertEquals(SourceNodeKind.COMMENT, children.get(2).kind());
    assertEquals("c", children.get(2).value());
    assertEquals("", element.value());
  }

  @Test
  void testFragmentKind() {
    assertEquals(SourceNodeKind.FRAGMENT, W3cSourceNode.of(document.createDocumentFragment()).kind());
  }

  @Test
  void testUnsupportedKind() {
    assertThrows(IllegalArgumentException.class, () -> W3cSourceNode.of(document.createAttribute("a")));
  }

  @Test
  void testAttributes() {
    final Element element = document.createElementNS(null, "a");
    element.setAttributeNS(Constants.XLINK_NAMESPACE_URI, "xlink:href", "#x");
    element.setAttributeNS(null, "id", "i");

    final List<SourceAttribute> attributes = W3cSourceNode.of(element).attributes();

    assertEquals(2, attributes.size());
    assertTrue(attributes.contains(new SourceAttribute(Constants.XLINK_NAMESPACE_URI, "href", "#x")));
    assertTrue(attributes.contains(new SourceAttribute("", "id", "i")));
    assertEquals("", W3cSourceNode.of(element).namespaceURI());
  }

  @Test
  void testIdentityIsTheDomNode() {
    final Element element = document.createElementNS(null, "p");
    document.appendChild(element);

    final W3cSourceNode first = W3cSourceNode.of(element);
    final SourceNode second = W3cSourceNode.of(document).children().get(0);

    assertNotSame(first, second);
    assertSame(first.identity(), second.identity());
  }
}
