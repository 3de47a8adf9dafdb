package io.cardest.sketch;

public class IncompatibleEstimatorsException extends SketchException
{
  private final int thisRegisterCount;
  private final int thatRegisterCount;

  public IncompatibleEstimatorsException(int thisRegisterCount, int thatRegisterCount)
  {
    super(String.format(
        "number of registers doesn't match: %d != %d",
        thisRegisterCount,
        thatRegisterCount
    ));
    this.thisRegisterCount = thisRegisterCount;
    this.thatRegisterCount = thatRegisterCount;
  }

  public int getThisRegisterCount()
  {
    return thisRegisterCount;
  }

  public int getThatRegisterCount()
  {
    return thatRegisterCount;
  }
}
