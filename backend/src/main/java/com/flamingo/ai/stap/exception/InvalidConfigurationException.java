package com.flamingo.ai.stap.exception;

/**
 * Thrown at construction time when a cache or context setting is out of range. Fatal: the
 * application refuses to start rather than silently clamping the value.
 */
public class InvalidConfigurationException extends RuntimeException {

  private final String property;

  public InvalidConfigurationException(String property, String message) {
    super("Invalid configuration '" + property + "': " + message);
    this.property = property;
  }

  public InvalidConfigurationException(String property, String message, Throwable cause) {
    super("Invalid configuration '" + property + "': " + message, cause);
    this.property = property;
  }

  public String getProperty() {
    return property;
  }
}
