/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import org.junit.jupiter.api.Test;
import org.xml.sax.SAXParseException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class DiagnosticsCollectorTest {

  private static SAXParseException exception(final String message, final int line, final int column) {
    return new SAXParseException(message, null, null, line, column);
  }

  @Test
  void testErrorsAreCollectedInOrder() {
    final DiagnosticsCollector collector = new DiagnosticsCollector();

    collector.warning(exception("ignored", 1, 1));
    collector.error(exception("first", 1, 5));
    collector.fatalError(exception("second", 2, 3));

    assertEquals(List.of("1:5: first", "2:3: second"), collector.getMessages());
  }

  @Test
  void testMessagesAreReadOnly() {
    final DiagnosticsCollector collector = new DiagnosticsCollector();
    assertTrue(collector.isEmpty());

    assertThrows(UnsupportedOperationException.class, () -> collector.getMessages().add("x"));
  }

  @Test
  void testDiagnosticsExceptionNeedsMessages() {
    assertThrows(IllegalArgumentException.class, () -> new HtmlDiagnosticsException(List.of()));

    final HtmlDiagnosticsException e = new HtmlDiagnosticsException(List.of("1:1: a", "2:2: b"));
    assertEquals(List.of("1:1: a", "2:2: b"), e.getDiagnostics());
    assertTrue(e.getMessage().contains("1:1: a"));
  }
}
