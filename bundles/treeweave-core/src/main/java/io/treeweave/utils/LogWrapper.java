/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.utils;

import org.slf4j.Logger;

import static java.util.Objects.requireNonNull;

/**
 * Provides some logging helper methods.
 */
public final class LogWrapper {

  /** Logger. */
  private final Logger logger;

  /**
   * Constructor.
   *
   * @param logger logger
   */
  public LogWrapper(final Logger logger) {
    this.logger = requireNonNull(logger);
  }


  /**
   * Log debugging information.
   *
   * @param message Message to log.
   * @param objects objects for data
   */
  public void debug(final String message, final Object... objects) {
    if (logger.isDebugEnabled()) {
      logger.debug(message, objects);
    }
  }


  /**
   * Warn information.
   *
   * @param message Message to log.
   * @param objects objects for data
   */
  public void warn(final String message, final Object... objects) {
    if (logger.isWarnEnabled()) {
      logger.warn(message, objects);
    }
  }

  /**
   * Determines if debug output is going to be written, for callers which have to compute
   * expensive arguments such as timings.
   *
   * @return {@code true} if the debug level is enabled
   */
  public boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
