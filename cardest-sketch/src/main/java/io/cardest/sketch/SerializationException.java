package io.cardest.sketch;

public class SerializationException extends SketchException
{
  public SerializationException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
