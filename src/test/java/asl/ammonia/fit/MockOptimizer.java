package asl.ammonia.fit;

import java.util.List;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;

/**
 * Optimizer stand-in that evaluates the residuals once at the starting point and reports a
 * preset outcome
 */
public class MockOptimizer implements Optimizer {

  OptimizerResult.Status status = OptimizerResult.Status.CONVERGED;
  String message = "mock optimizer finished";
  double[] point = null;
  double[] sigma = null;
  double[] lastResiduals = null;
  int calls = 0;

  @Override
  public OptimizerResult optimize(MultivariateVectorFunction residualFunction,
      List<ParameterInfo> parameters) {
    ++calls;
    double[] start = new double[parameters.size()];
    for (int i = 0; i < start.length; ++i) {
      start[i] = parameters.get(i).getValue();
    }
    double[] result = point == null ? start : point.clone();
    lastResiduals = residualFunction.value(result);
    double chiSquare = 0.;
    for (double residual : lastResiduals) {
      chiSquare += residual * residual;
    }
    return new OptimizerResult(status, result, sigma, chiSquare, 3, 7, message);
  }
}
