/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import io.treeweave.utils.LogWrapper;
import org.slf4j.LoggerFactory;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the errors reported by the HTML parser instead of aborting the parse. Warnings are only
 * logged.
 */
final class DiagnosticsCollector implements ErrorHandler {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(DiagnosticsCollector.class));

  private final List<String> messages = new ArrayList<>();

  @Override
  public void warning(final SAXParseException exception) {
    LOGWRAPPER.debug("HTML parser warning: {}", format(exception));
  }

  @Override
  public void error(final SAXParseException exception) {
    messages.add(format(exception));
  }

  @Override
  public void fatalError(final SAXParseException exception) {
    messages.add(format(exception));
  }

  /**
   * Add a message which has not been reported through this handler.
   *
   * @param message the message
   */
  void add(final String message) {
    messages.add(message);
  }

  boolean isEmpty() {
    return messages.isEmpty();
  }

  /**
   * Get the collected messages.
   *
   * @return an unmodifiable view, in reporting order
   */
  List<String> getMessages() {
    return Collections.unmodifiableList(messages);
  }

  static String format(final SAXParseException exception) {
    return exception.getLineNumber() + ":" + exception.getColumnNumber() + ": " + exception.getMessage();
  }
}
