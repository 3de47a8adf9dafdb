package io.cardest.sketch;

public class DeserializationException extends SketchException
{
  public DeserializationException(String message)
  {
    super(message);
  }

  public DeserializationException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
