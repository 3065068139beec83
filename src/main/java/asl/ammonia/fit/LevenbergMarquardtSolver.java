package asl.ammonia.fit;

import asl.ammonia.input.Configuration;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * {@link Optimizer} backed by the Apache Commons least-squares solver with a
 * Levenberg-Marquardt optimizer. Only the parameters that are not fixed are handed to the solver;
 * fixed ones are spliced back into the full vector before every residual evaluation.
 *
 * The Jacobian is estimated by forward differences, with a step proportional to the magnitude of
 * each parameter (a backward difference is used where the forward step would cross an upper
 * bound). Bounds and step limits are applied by a parameter validator: trial points are clamped
 * into the enabled bounds, and a parameter with a max step hint may not move further than that
 * from the best point evaluated so far.
 */
public class LevenbergMarquardtSolver implements Optimizer {

  private static final Logger logger = Logger.getLogger(LevenbergMarquardtSolver.class);

  private final Configuration configuration;

  public LevenbergMarquardtSolver() {
    this(Configuration.getInstance());
  }

  public LevenbergMarquardtSolver(Configuration configuration) {
    this.configuration = configuration;
  }

  public Configuration getConfiguration() {
    return configuration;
  }

  @Override
  public OptimizerResult optimize(final MultivariateVectorFunction residualFunction,
      final List<ParameterInfo> parameters) {

    final double[] fullStart = new double[parameters.size()];
    List<Integer> freeList = new ArrayList<>();
    for (int i = 0; i < parameters.size(); ++i) {
      ParameterInfo info = parameters.get(i);
      fullStart[i] = info.clamp(info.getValue());
      if (!info.isFixed()) {
        freeList.add(i);
      }
    }
    final int[] free = new int[freeList.size()];
    for (int j = 0; j < free.length; ++j) {
      free[j] = freeList.get(j);
    }

    double[] startResiduals = residualFunction.value(fullStart);
    if (free.length == 0) {
      logger.info("All parameters are fixed; nothing to optimize");
      return new OptimizerResult(OptimizerResult.Status.CONVERGED, fullStart,
          new double[fullStart.length], sumOfSquares(startResiduals), 0, 1,
          "All parameters fixed");
    }

    double[] freeStart = new double[free.length];
    for (int j = 0; j < free.length; ++j) {
      freeStart[j] = fullStart[free[j]];
    }

    final BestPoint best = new BestPoint(freeStart);
    final double relativeStep = configuration.getJacobianStep();

    MultivariateJacobianFunction jacobian = new MultivariateJacobianFunction() {
      @Override
      public Pair<RealVector, RealMatrix> value(final RealVector point) {
        return jacobian(point, residualFunction, parameters, fullStart, free, relativeStep,
            best);
      }
    };

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(freeStart).
        target(new double[startResiduals.length]).
        model(jacobian).
        parameterValidator(new StepValidator(parameters, free, best)).
        lazyEvaluation(false).
        maxEvaluations(configuration.getMaxEvaluations()).
        maxIterations(configuration.getMaxIterations()).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(configuration.getCostRelativeTolerance()).
        withParameterRelativeTolerance(configuration.getParameterRelativeTolerance()).
        withOrthoTolerance(configuration.getOrthoTolerance());

    LeastSquaresOptimizer.Optimum optimum;
    try {
      optimum = optimizer.optimize(lsp);
    } catch (MaxCountExceededException e) {
      logger.error("Solver stopped before converging: " + e.getMessage());
      // the iteration count is only known when it was the iteration limit that tripped
      int iterations =
          e instanceof TooManyIterationsException ? configuration.getMaxIterations() : 0;
      return new OptimizerResult(OptimizerResult.Status.MAX_ITERATIONS,
          merge(fullStart, free, best.point), null, best.cost, iterations, best.evaluations,
          e.getMessage());
    } catch (ConvergenceException e) {
      logger.error("Solver could not converge: " + e.getMessage());
      return new OptimizerResult(OptimizerResult.Status.FAILED,
          merge(fullStart, free, best.point), null, best.cost, 0, best.evaluations,
          e.getMessage());
    }

    double[] fitFree = optimum.getPoint().toArray();
    double[] fitFull = merge(fullStart, free, fitFree);

    double[] sigma = null;
    try {
      RealVector freeSigma = optimum.getSigma(configuration.getCovarianceThreshold());
      sigma = new double[fitFull.length];
      for (int j = 0; j < free.length; ++j) {
        sigma[free[j]] = freeSigma.getEntry(j);
      }
    } catch (SingularMatrixException e) {
      logger.warn("Covariance matrix is singular; parameter errors are not available");
    }

    double cost = optimum.getCost();
    String message = "Converged after " + optimum.getIterations() + " iterations ("
        + optimum.getEvaluations() + " evaluations)";
    logger.info(message + ", chi-square " + cost * cost);

    return new OptimizerResult(OptimizerResult.Status.CONVERGED, fitFull, sigma, cost * cost,
        optimum.getIterations(), optimum.getEvaluations(), message);
  }

  /**
   * Evaluate the residuals at the given point and estimate their Jacobian by finite differences
   *
   * @param variables Values of the free parameters
   * @param residualFunction Residuals as a function of the full parameter vector
   * @param parameters Parameter descriptions (used for upper bounds)
   * @param fullStart Full starting vector, supplying the fixed parameters
   * @param free Indices of the free parameters in the full vector
   * @param relativeStep Step size relative to a parameter's magnitude (at least 1)
   * @param best Tracker of the lowest-cost point, updated with this evaluation
   * @return Residual vector and Jacobian matrix (rows: residuals, columns: free parameters)
   */
  static Pair<RealVector, RealMatrix> jacobian(RealVector variables,
      MultivariateVectorFunction residualFunction, List<ParameterInfo> parameters,
      double[] fullStart, int[] free, double relativeStep, BestPoint best) {

    double[] freePoint = variables.toArray();
    double[] full = merge(fullStart, free, freePoint);
    double[] residuals = residualFunction.value(full);
    best.offer(freePoint, sumOfSquares(residuals));

    double[][] jacobian = new double[residuals.length][free.length];
    for (int j = 0; j < free.length; ++j) {
      int idx = free[j];
      ParameterInfo info = parameters.get(idx);
      double x = full[idx];
      double diffX = relativeStep * Math.max(Math.abs(x), 1.);
      if (info.isUpperLimited() && x + diffX > info.getUpperBound()) {
        diffX = -diffX;
      }
      double[] shifted = full.clone();
      shifted[idx] = x + diffX;
      double[] diffY = residualFunction.value(shifted);
      for (int i = 0; i < residuals.length; ++i) {
        jacobian[i][j] = (diffY[i] - residuals[i]) / diffX;
      }
    }

    return new Pair<>(MatrixUtils.createRealVector(residuals),
        MatrixUtils.createRealMatrix(jacobian));
  }

  static double[] merge(double[] fullStart, int[] free, double[] freeValues) {
    double[] full = fullStart.clone();
    for (int j = 0; j < free.length; ++j) {
      full[free[j]] = freeValues[j];
    }
    return full;
  }

  static double sumOfSquares(double[] residuals) {
    double sum = 0.;
    for (double residual : residuals) {
      sum += residual * residual;
    }
    return sum;
  }

  /**
   * Lowest-cost point seen so far, used as the anchor for step limits. The solver only accepts
   * steps that lower the cost, so this follows its accepted iterates.
   */
  static class BestPoint {

    double[] point;
    double cost = Double.POSITIVE_INFINITY;
    int evaluations = 0;

    BestPoint(double[] start) {
      point = start.clone();
    }

    void offer(double[] candidate, double candidateCost) {
      ++evaluations;
      if (candidateCost < cost) {
        point = candidate.clone();
        cost = candidateCost;
      }
    }
  }

  private static class StepValidator implements ParameterValidator {

    private final List<ParameterInfo> parameters;
    private final int[] free;
    private final BestPoint best;

    StepValidator(List<ParameterInfo> parameters, int[] free, BestPoint best) {
      this.parameters = parameters;
      this.free = free;
      this.best = best;
    }

    /**
     * Keep each free parameter within its enabled bounds and, where it has a max step, within
     * that distance of the best point so far.
     *
     * @param params Free parameters proposed by the solver
     * @return The same vector with offending entries pulled back
     */
    @Override
    public RealVector validate(RealVector params) {
      for (int j = 0; j < free.length; ++j) {
        ParameterInfo info = parameters.get(free[j]);
        double value = params.getEntry(j);
        double maxStep = info.getMaxStep();
        if (maxStep > 0) {
          double anchor = best.point[j];
          value = Math.max(anchor - maxStep, Math.min(anchor + maxStep, value));
        }
        params.setEntry(j, info.clamp(value));
      }
      return params;
    }
  }
}
