package asl.ammonia.fit;

/**
 * Thrown when a flattened parameter vector and its name vector have different lengths.
 */
public class LengthMismatchException extends IllegalArgumentException {

  private static final long serialVersionUID = 6403381150719734871L;

  public LengthMismatchException(int valueCount, int nameCount) {
    super("Wrong array lengths! " + valueCount + " parameter values but " + nameCount
        + " parameter names");
  }
}
