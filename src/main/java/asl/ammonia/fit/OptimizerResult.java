package asl.ammonia.fit;

/**
 * Outcome of an {@link Optimizer} run.
 */
public class OptimizerResult {

  /**
   * Whether the solver reached convergence
   */
  public enum Status {
    CONVERGED, MAX_ITERATIONS, FAILED
  }

  private final Status status;
  private final double[] point;
  private final double[] sigma;
  private final double chiSquare;
  private final int iterations;
  private final int evaluations;
  private final String message;

  /**
   * @param status Convergence status
   * @param point Full parameter vector at the end of the run
   * @param sigma Per-parameter standard errors, or null if none could be computed
   * @param chiSquare Sum of squared residuals at point
   * @param iterations Solver iterations performed
   * @param evaluations Residual evaluations performed by the solver
   * @param message Human-readable description of how the run ended
   */
  public OptimizerResult(Status status, double[] point, double[] sigma, double chiSquare,
      int iterations, int evaluations, String message) {
    this.status = status;
    this.point = point;
    this.sigma = sigma;
    this.chiSquare = chiSquare;
    this.iterations = iterations;
    this.evaluations = evaluations;
    this.message = message;
  }

  public Status getStatus() {
    return status;
  }

  public boolean isConverged() {
    return status == Status.CONVERGED;
  }

  public double[] getPoint() {
    return point.clone();
  }

  /**
   * @return Standard error of each parameter, or null if the covariance was not available
   */
  public double[] getSigma() {
    return sigma == null ? null : sigma.clone();
  }

  public double getChiSquare() {
    return chiSquare;
  }

  public int getIterations() {
    return iterations;
  }

  public int getEvaluations() {
    return evaluations;
  }

  public String getMessage() {
    return message;
  }
}
