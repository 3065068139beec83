package asl.ammonia.fit;

import java.util.List;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;

/**
 * Nonlinear least-squares solver used by {@link MultiComponentFitter}. Implementations minimize
 * the sum of squares of the residual function over every parameter that is not fixed, keeping
 * each parameter inside its enabled bounds and honoring per-parameter step limits where they can.
 *
 * Implementations report failure through the status of the returned result rather than by
 * throwing; exceptions raised by the residual function itself are passed through unchanged.
 */
public interface Optimizer {

  /**
   * Find the parameters minimizing the sum of squared residuals
   *
   * @param residualFunction Function taking the full parameter vector (fixed entries included)
   * to the vector of residuals
   * @param parameters Starting values, bounds, fixed flags and step hints for every parameter
   * @return Best-fit point, uncertainties and convergence status
   */
  OptimizerResult optimize(MultivariateVectorFunction residualFunction,
      List<ParameterInfo> parameters);
}
