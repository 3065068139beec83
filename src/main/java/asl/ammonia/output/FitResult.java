package asl.ammonia.output;

import asl.ammonia.fit.ParameterInfo;
import asl.ammonia.model.Transition;
import asl.ammonia.utils.NumericUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything produced by a completed ammonia fit: the best-fit parameters and their errors, the
 * model spectrum at the best fit, the chi-square of the fit and the line-center optical depths of
 * each component. Parameter values are copied out when the result is built, so later changes to
 * the parameter records do not affect it.
 *
 * Like the calibration results elsewhere, the numbers are also available in a single map keyed
 * by descriptive strings for export to external programs.
 */
public class FitResult {

  private final List<ParameterInfo> parameters;
  private final double[] values;
  private final double[] errors;
  private final double[] model;
  private final double chiSquare;
  private final List<Map<Transition, Double>> opticalDepths;
  private final int componentCount;
  private final int dataLength;
  private final int iterations;
  private final int evaluations;
  private final String message;
  private final Map<String, double[]> numerMap;

  /**
   * @param parameters Fitted parameter records, values and errors already set
   * @param componentCount Number of velocity components in the fit
   * @param model Model spectrum at the best-fit values
   * @param chiSquare Sum of squared (weighted) residuals at the best fit
   * @param opticalDepths Line-center optical depth of each transition, one map per component
   * @param dataLength Number of data points fit
   * @param iterations Solver iterations used
   * @param evaluations Residual evaluations used
   * @param message Solver's description of how the fit ended
   */
  public FitResult(List<ParameterInfo> parameters, int componentCount, double[] model,
      double chiSquare, List<Map<Transition, Double>> opticalDepths, int dataLength,
      int iterations, int evaluations, String message) {
    this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    values = new double[parameters.size()];
    errors = new double[parameters.size()];
    for (int i = 0; i < values.length; ++i) {
      values[i] = parameters.get(i).getValue();
      errors[i] = parameters.get(i).getError();
    }
    this.model = model.clone();
    this.chiSquare = chiSquare;
    this.opticalDepths = Collections.unmodifiableList(new ArrayList<>(opticalDepths));
    this.componentCount = componentCount;
    this.dataLength = dataLength;
    this.iterations = iterations;
    this.evaluations = evaluations;
    this.message = message;
    numerMap = buildNumerMap();
  }

  private Map<String, double[]> buildNumerMap() {
    Map<String, double[]> map = new HashMap<>();
    map.put("Best_fit_values", values.clone());
    map.put("Parameter_errors", errors.clone());
    map.put("Model_spectrum", model.clone());
    map.put("Chi_square", new double[]{chiSquare});
    map.put("Reduced_chi_square", new double[]{getReducedChiSquare()});
    map.put("Degrees_of_freedom", new double[]{getDegreesOfFreedom()});
    for (int j = 0; j < opticalDepths.size(); ++j) {
      for (Map.Entry<Transition, Double> entry : opticalDepths.get(j).entrySet()) {
        String key = "Optical_depth_" + entry.getKey().getKey() + "_component_" + j;
        map.put(key, new double[]{entry.getValue()});
      }
    }
    return map;
  }

  public double[] getValues() {
    return values.clone();
  }

  public double[] getErrors() {
    return errors.clone();
  }

  public double[] getModel() {
    return model.clone();
  }

  public double getChiSquare() {
    return chiSquare;
  }

  /**
   * Chi-square divided by the number of data points (not by the degrees of freedom)
   *
   * @return Reduced chi-square
   */
  public double getReducedChiSquare() {
    return dataLength == 0 ? Double.NaN : chiSquare / dataLength;
  }

  /**
   * @return Number of data points less the number of parameters, fixed ones included
   */
  public int getDegreesOfFreedom() {
    return dataLength - values.length;
  }

  public List<ParameterInfo> getParameters() {
    return parameters;
  }

  public int getComponentCount() {
    return componentCount;
  }

  /**
   * @return Line-center optical depths, one map per component
   */
  public List<Map<Transition, Double>> getOpticalDepths() {
    return opticalDepths;
  }

  public Map<Transition, Double> getOpticalDepths(int component) {
    return opticalDepths.get(component);
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

  /**
   * TeX-formatted label for each parameter, e.g. "$T_K(0)$=  20.00 $\pm$ 0.1000", suitable for
   * annotating a plot of the fit
   *
   * @return One label per parameter, in parameter order
   */
  public String[] getAnnotations() {
    String[] labels = new String[parameters.size()];
    for (int i = 0; i < labels.length; ++i) {
      ParameterInfo info = parameters.get(i);
      labels[i] = String.format("$%s(%d)$=%6.4g $\\pm$ %6.4g", info.getName().getTexKey(),
          info.getComponent(), values[i], errors[i]);
    }
    return labels;
  }

  /**
   * Plain-text summary of the fit: the solver message, each parameter's value and error, and the
   * fit statistics
   *
   * @return Report text
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Fit message: ").append(message).append('\n');
    sb.append("Final fit values:\n");
    for (int i = 0; i < parameters.size(); ++i) {
      ParameterInfo info = parameters.get(i);
      sb.append(info.getDisplayName()).append(": ");
      sb.append(NumericUtils.formatValue(values[i]));
      sb.append(" +/- ");
      sb.append(NumericUtils.formatValue(errors[i]));
      if (info.isFixed()) {
        sb.append(" (fixed)");
      }
      sb.append('\n');
    }
    for (int j = 0; j < opticalDepths.size(); ++j) {
      sb.append("Optical depths (component ").append(j).append("):");
      for (Map.Entry<Transition, Double> entry : opticalDepths.get(j).entrySet()) {
        sb.append(' ').append(entry.getKey()).append('=');
        sb.append(NumericUtils.formatValue(entry.getValue()));
      }
      sb.append('\n');
    }
    sb.append("Chi2: ").append(NumericUtils.formatValue(chiSquare));
    sb.append(" Reduced Chi2: ").append(NumericUtils.formatValue(getReducedChiSquare()));
    sb.append(" DOF: ").append(getDegreesOfFreedom());
    return sb.toString();
  }

  /**
   * Return the map of numeric data
   *
   * @return map of double arrays keyed by descriptions of the numbers (best-fit values, chi-square,
   * per-component optical depths)
   */
  public Map<String, double[]> getNumerMap() {
    return numerMap;
  }
}
