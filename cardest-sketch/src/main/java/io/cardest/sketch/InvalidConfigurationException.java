package io.cardest.sketch;

/**
 * Thrown when an estimator is requested with a register count (or a name) it cannot be built from.
 */
public class InvalidConfigurationException extends SketchException
{
  public InvalidConfigurationException(String message)
  {
    super(message);
  }

  public InvalidConfigurationException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
