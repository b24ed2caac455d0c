package com.verlumen.chrono.execution;

/**
 * Raised at startup when worker, adapter or pipeline configuration is unusable. Always fatal and
 * always thrown before any connection is attempted.
 */
public final class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
