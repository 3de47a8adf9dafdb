package io.cardest.sketch;

/**
 * Base class of every failure reported by the estimators in this package.
 */
public class SketchException extends RuntimeException
{
  public SketchException(String message)
  {
    super(message);
  }

  public SketchException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
