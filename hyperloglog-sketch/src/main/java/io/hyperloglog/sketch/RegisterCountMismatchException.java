package io.hyperloglog.sketch;

/**
 * Thrown when merging estimators built with different precisions.
 */
public class RegisterCountMismatchException extends IllegalArgumentException
{
  private final int registerCount;
  private final int otherRegisterCount;

  public RegisterCountMismatchException(int registerCount, int otherRegisterCount)
  {
    super(String.format("number of registers doesn't match: %,d != %,d", registerCount, otherRegisterCount));
    this.registerCount = registerCount;
    this.otherRegisterCount = otherRegisterCount;
  }

  public int getRegisterCount()
  {
    return registerCount;
  }

  public int getOtherRegisterCount()
  {
    return otherRegisterCount;
  }
}
