package asl.ammonia.fit;

/**
 * Thrown when the optimizer ends without converging. The message is the optimizer's own.
 */
public class SolverFailureException extends Exception {

  private static final long serialVersionUID = 2286203944154911873L;

  private final OptimizerResult.Status status;

  public SolverFailureException(OptimizerResult.Status status, String message) {
    super(message);
    this.status = status;
  }

  public OptimizerResult.Status getStatus() {
    return status;
  }
}
