/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.service.html;

import io.treeweave.api.xml.XmlTree;
import io.treeweave.service.html.source.W3cSourceNode;
import io.treeweave.settings.Constants;
import io.treeweave.utils.LogWrapper;
import nu.validator.htmlparser.common.XmlViolationPolicy;
import nu.validator.htmlparser.dom.HtmlDocumentBuilder;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;

import static java.util.Objects.requireNonNull;

/**
 * Parses HTML with the validator.nu HTML5 parser and converts the resulting DOM into a new
 * document of an {@link XmlTree}.
 *
 * <p>
 * Instances are immutable. Every call uses its own parser and converter, so an instance can be
 * shared between threads as long as each thread parses into its own tree.
 * </p>
 */
public final class HtmlParser {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(HtmlParser.class));

  /** System property holding the default of {@link Builder#failOnDiagnostics(boolean)}. */
  public static final String FAIL_ON_DIAGNOSTICS_PROPERTY = "treeweave.html.failOnDiagnostics";

  /** Determines if parser errors abort the parse. */
  private final boolean failOnDiagnostics;

  /** Determines if comments are converted. */
  private final boolean includeComments;

  /**
   * Builder to build an {@link HtmlParser} instance.
   */
  public static final class Builder {

    private boolean failOnDiagnostics = Boolean.getBoolean(FAIL_ON_DIAGNOSTICS_PROPERTY);

    private boolean includeComments = true;

    /**
     * Fail with an {@link HtmlDiagnosticsException} if the HTML parser reports errors. If not set,
     * the system property {@value #FAIL_ON_DIAGNOSTICS_PROPERTY} decides.
     *
     * @param failOnDiagnostics {@code true} to fail, {@code false} to log the errors and proceed
     * @return this builder instance
     */
    public Builder failOnDiagnostics(final boolean failOnDiagnostics) {
      this.failOnDiagnostics = failOnDiagnostics;
      return this;
    }

    /**
     * Determines if comments are converted (default: {@code true}).
     *
     * @param includeComments {@code false} to drop comments
     * @return this builder instance
     */
    public Builder includeComments(final boolean includeComments) {
      this.includeComments = includeComments;
      return this;
    }

    public HtmlParser build() {
      return new HtmlParser(this);
    }
  }

  private HtmlParser(final Builder builder) {
    failOnDiagnostics = builder.failOnDiagnostics;
    includeComments = builder.includeComments;
  }

  /**
   * Get a parser with the default settings.
   *
   * @return a new parser
   */
  public static HtmlParser newInstance() {
    return new Builder().build();
  }

  /**
   * Parse an HTML string into a new document of the given tree.
   *
   * @param tree the target tree
   * @param html the HTML text
   * @return the key of the new document node
   * @throws HtmlParseException if the input cannot be read, or if the parser reports errors and is
   *         configured to fail on them
   */
  public long parse(final XmlTree tree, final String html) throws HtmlParseException {
    requireNonNull(html);
    return parse(tree, new InputSource(new StringReader(html)));
  }

  /**
   * Parse UTF-8 encoded HTML into a new document of the given tree. The stream is not closed.
   *
   * @param tree the target tree
   * @param in the HTML input
   * @return the key of the new document node
   * @throws HtmlParseException if the input cannot be read, or if the parser reports errors and is
   *         configured to fail on them
   */
  public long parse(final XmlTree tree, final InputStream in) throws HtmlParseException {
    requireNonNull(in);
    return parse(tree, new InputSource(new InputStreamReader(in, Constants.DEFAULT_ENCODING)));
  }

  private long parse(final XmlTree tree, final InputSource input) throws HtmlParseException {
    requireNonNull(tree);
    LOGWRAPPER.debug("Start parsing HTML.");
    final long time = System.nanoTime();

    final Document document = parseDom(input);
    final long parsed = System.nanoTime();

    final long documentKey = new DomConverter(tree, includeComments).convertDocument(W3cSourceNode.of(document));

    if (LOGWRAPPER.isDebugEnabled()) {
      LOGWRAPPER.debug("Parsed HTML in {} ms, converted it into document {} in {} ms.",
                       (parsed - time) / 1_000_000,
                       documentKey,
                       (System.nanoTime() - parsed) / 1_000_000);
    }
    return documentKey;
  }

  private Document parseDom(final InputSource input) throws HtmlParseException {
    final DiagnosticsCollector diagnostics = new DiagnosticsCollector();

    final Document document;
    try {
      document = newDocumentBuilder(diagnostics).parse(input);
    } catch (final IOException e) {
      throw new HtmlReadException(e);
    } catch (final SAXException e) {
      // Only raised if the parser gives up, the document is lost.
      diagnostics.add(String.valueOf(e.getMessage()));
      throw new HtmlDiagnosticsException(diagnostics.getMessages());
    }

    if (!diagnostics.isEmpty()) {
      if (failOnDiagnostics) {
        throw new HtmlDiagnosticsException(diagnostics.getMessages());
      }
      for (final String message : diagnostics.getMessages()) {
        LOGWRAPPER.warn("HTML parser error: {}", message);
      }
    }
    return document;
  }

  /**
   * Create a document builder which keeps comments and reports errors to the given handler.
   *
   * @param diagnostics the error handler
   * @return the document builder
   * @throws IOException never for the empty input used to initialize the builder
   * @throws SAXException if the parser rejects the empty input
   */
  private static HtmlDocumentBuilder newDocumentBuilder(final DiagnosticsCollector diagnostics)
      throws IOException, SAXException {
    final HtmlDocumentBuilder builder = new HtmlDocumentBuilder(XmlViolationPolicy.ALTER_INFOSET);
    builder.setIgnoringComments(false);

    // The builder creates its driver on the first parse and hands it a null error handler, so the
    // handler only sticks once the driver exists.
    builder.parse(new InputSource(new StringReader("")));
    builder.setErrorHandler(diagnostics);
    return builder;
  }
}
