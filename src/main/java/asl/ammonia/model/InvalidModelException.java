package asl.ammonia.model;

/**
 * Thrown when a synthesized spectrum goes negative, which cannot happen for a physically
 * consistent set of parameters.
 */
public class InvalidModelException extends RuntimeException {

  private static final long serialVersionUID = -3215476718932457621L;

  public InvalidModelException(String message) {
    super(message);
  }
}
