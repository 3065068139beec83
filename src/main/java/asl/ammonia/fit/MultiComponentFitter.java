package asl.ammonia.fit;

import asl.ammonia.input.SpectralAxis;
import asl.ammonia.input.SpectralUnit;
import asl.ammonia.model.PhysicalParameters;
import asl.ammonia.model.SpectralSynthesizer;
import asl.ammonia.model.Transition;
import asl.ammonia.output.FitResult;
import asl.ammonia.utils.NumericUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Fits one or more ammonia velocity components to an observed spectrum.
 *
 * The parameters of all components are laid end to end in a {@link ParameterSet} and handed to
 * an {@link Optimizer} together with a residual function, (data - model) / errors, evaluated with
 * {@link MultiComponentModel}. Once the optimizer converges the parameter records are updated with
 * the best-fit values and errors, the excitation temperature of each component is capped at its
 * kinetic temperature, and the model spectrum and line optical depths at the best fit are
 * computed. A run that does not converge is reported as a {@link SolverFailureException}; nothing
 * is retried.
 *
 * Progress is published as status strings to registered change listeners, and the data, model and
 * residual of the last fit are available as plottable series from {@link #getData()}.
 */
public class MultiComponentFitter {

  private static final Logger logger = Logger.getLogger(MultiComponentFitter.class);

  /**
   * Number of residual evaluations between progress updates
   */
  static final int STATUS_INTERVAL = 10;

  private final Optimizer optimizer;
  private final EventListenerList eventHelper;
  private boolean thin;
  private String status;
  private List<XYSeriesCollection> xySeriesData;
  private FitResult lastResult;

  public MultiComponentFitter() {
    this(new LevenbergMarquardtSolver());
  }

  /**
   * @param optimizer Solver used to minimize the residuals
   */
  public MultiComponentFitter(Optimizer optimizer) {
    this.optimizer = optimizer;
    eventHelper = new EventListenerList();
    status = "";
    xySeriesData = new ArrayList<>();
    thin = false;
  }

  /**
   * Default starting values of one component: tkin, tex, ntot (log), width, xoff_v, fortho
   */
  private static double[] defaultValues() {
    return new double[]{20., 20., 14., 1.0, 0.0, 0.5};
  }

  private static boolean[] defaultLowerLimited() {
    return new boolean[]{true, true, true, true, false, true};
  }

  private static boolean[] defaultUpperLimited() {
    return new boolean[]{false, false, false, false, false, true};
  }

  private static double[] defaultLowerBounds() {
    return new double[]{2.73, 2.73, 0., 0., 0., 0.};
  }

  private static double[] defaultUpperBounds() {
    return new double[]{0., 0., 0., 0., 0., 1.};
  }

  /**
   * Initial guess for a single-component fit. This does not look at the data; it always returns
   * tkin 20, tex 10, ntot 1e15, width 1, xoff_v 0, fortho 1.
   *
   * @param axis Sample positions (unused)
   * @param data Observed spectrum (unused)
   * @return Starting parameters in the default order
   */
  public static double[] moments(SpectralAxis axis, double[] data) {
    return new double[]{20., 10., 1E15, 1.0, 0.0, 1.0};
  }

  /**
   * Add a listener to be notified as the fit status changes
   *
   * @param listener Listener to add
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  public void removeChangeListener(ChangeListener listener) {
    eventHelper.remove(ChangeListener.class, listener);
  }

  /**
   * Set the status string and notify listeners
   *
   * @param newStatus Description of the current step of the fit
   */
  void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  public String getStatus() {
    return status;
  }

  public boolean isThin() {
    return thin;
  }

  /**
   * @param thin True to fit with the optically thin parametrization
   */
  public void setThin(boolean thin) {
    this.thin = thin;
  }

  public Optimizer getOptimizer() {
    return optimizer;
  }

  /**
   * Return the plottable data of the last fit: observed and model spectra in the first collection,
   * residuals in the second, both against frequency in GHz
   *
   * @return List of series collections, empty if no fit has completed
   */
  public List<XYSeriesCollection> getData() {
    return xySeriesData;
  }

  /**
   * @return Result of the last completed fit, or null if there is none
   */
  public FitResult getLastResult() {
    return lastResult;
  }

  /**
   * Fit using the default settings for every parameter of every component
   *
   * @param axis Sample positions
   * @param data Observed spectrum (K), baselined to zero
   * @param componentCount Number of velocity components
   * @param errors Per-sample uncertainties, or null for an unweighted fit
   * @return Best-fit result
   * @throws SolverFailureException if the optimizer does not converge
   */
  public FitResult fitMultiComponent(SpectralAxis axis, double[] data, int componentCount,
      double[] errors) throws SolverFailureException {
    return fitMultiComponent(axis, data, componentCount, errors, null, null, null, null, null,
        null, null);
  }

  /**
   * Fit with caller-supplied settings. Each array may cover every parameter of every component,
   * cover a single component (it is then repeated for each), or be null to use the defaults:
   * values [20, 20, 14, 1, 0, 0.5], nothing fixed, lower bounds [2.73, 2.73, 0, 0, -, 0] and an
   * upper bound of 1 on fortho. When names describe some other set of parameters (adding
   * fillingfraction or tau11, say) the defaults are taken per parameter instead. Arrays of any
   * other length are replaced by per-parameter defaults.
   * If values holds more whole components than componentCount, the component count is raised to
   * match.
   *
   * @param axis Sample positions
   * @param data Observed spectrum (K), baselined to zero
   * @param componentCount Number of velocity components (0 or less to infer from values)
   * @param errors Per-sample uncertainties, or null for an unweighted fit
   * @param values Starting values
   * @param names Parameter names, for one component or all of them; defaults to tkin, tex, ntot,
   * width, xoff_v, fortho
   * @param fixed Which parameters are held at their starting values
   * @param lowerLimited Which parameters have a lower bound
   * @param upperLimited Which parameters have an upper bound
   * @param lowerBounds Lower bound values
   * @param upperBounds Upper bound values
   * @return Best-fit result
   * @throws SolverFailureException if the optimizer does not converge
   */
  public FitResult fitMultiComponent(SpectralAxis axis, double[] data, int componentCount,
      double[] errors, double[] values, ParameterName[] names, boolean[] fixed,
      boolean[] lowerLimited, boolean[] upperLimited, double[] lowerBounds, double[] upperBounds)
      throws SolverFailureException {

    ParameterName[] canonical = canonicalNames(names, componentCount);
    // the default arrays only line up with the default parameter layout
    boolean defaultLayout = Arrays.equals(canonical, ParameterName.defaultOrder());

    ParameterSet parameterSet = ParameterSet.builder(canonical).
        values(values == null && defaultLayout ? defaultValues() : values).
        names(names == null ? canonical : names).
        fixed(fixed).
        lowerLimited(lowerLimited == null && defaultLayout ? defaultLowerLimited() : lowerLimited).
        upperLimited(upperLimited == null && defaultLayout ? defaultUpperLimited() : upperLimited).
        lowerBounds(lowerBounds == null && defaultLayout ? defaultLowerBounds() : lowerBounds).
        upperBounds(upperBounds == null && defaultLayout ? defaultUpperBounds() : upperBounds).
        componentCount(componentCount).
        build();

    return fit(axis, data, errors, parameterSet);
  }

  /**
   * Parameters making up one component. A list holding every component repeats the same names
   * once per component; any other list is taken to describe a single component.
   *
   * @param names Parameter names as given by the caller, or null for the default order
   * @param componentCount Number of velocity components, or 0 or less if unknown
   * @return Names of a single component
   */
  static ParameterName[] canonicalNames(ParameterName[] names, int componentCount) {
    if (names == null || names.length == 0) {
      return ParameterName.defaultOrder();
    }
    if (componentCount > 0 && names.length % componentCount == 0
        && repeatsEvery(names, names.length / componentCount)) {
      return Arrays.copyOf(names, names.length / componentCount);
    }
    for (int period = 1; period < names.length; ++period) {
      if (names.length % period == 0 && repeatsEvery(names, period)) {
        return Arrays.copyOf(names, period);
      }
    }
    return names.clone();
  }

  private static boolean repeatsEvery(ParameterName[] names, int period) {
    for (int i = period; i < names.length; ++i) {
      if (names[i] != names[i % period]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Fit a prepared parameter set to the data. The parameter records in the set are updated in
   * place with the best-fit values and errors.
   *
   * @param axis Sample positions
   * @param data Observed spectrum (K), baselined to zero
   * @param errors Per-sample uncertainties, or null for an unweighted fit
   * @param parameterSet Starting values, bounds and fixed flags of every parameter
   * @return Best-fit result
   * @throws SolverFailureException if the optimizer does not converge
   */
  public FitResult fit(final SpectralAxis axis, final double[] data, final double[] errors,
      ParameterSet parameterSet) throws SolverFailureException {

    if (data.length != axis.length()) {
      throw new IllegalArgumentException("Data has " + data.length
          + " points but the spectral axis has " + axis.length());
    }
    if (errors != null) {
      if (errors.length != data.length) {
        throw new IllegalArgumentException("Errors have " + errors.length
            + " points but the data has " + data.length);
      }
      for (double error : errors) {
        if (!(error > 0.)) {
          throw new IllegalArgumentException("Errors must be positive, got " + error);
        }
      }
    }

    final MultiComponentModel model = new MultiComponentModel(thin);
    final ParameterName[] names = parameterSet.getNames();
    final int componentCount = parameterSet.getComponentCount();

    logger.info("Fitting " + componentCount + " ammonia component(s) to " + data.length
        + " points");
    if (logger.isDebugEnabled()) {
      for (ParameterInfo info : parameterSet) {
        logger.debug("Initial guess " + info);
      }
    }
    fireStateChange("Fitting " + componentCount + " component(s)...");

    MultivariateVectorFunction residuals = new MultivariateVectorFunction() {
      private int evaluations = 0;

      @Override
      public double[] value(double[] point) {
        ++evaluations;
        if (evaluations % STATUS_INTERVAL == 0) {
          fireStateChange("Fitting, model evaluation " + evaluations + "...");
        }
        double[] fit = model.evaluate(axis, point, names, componentCount);
        double[] residual = NumericUtils.subtract(data, fit);
        if (errors != null) {
          for (int i = 0; i < residual.length; ++i) {
            residual[i] /= errors[i];
          }
        }
        return residual;
      }
    };

    OptimizerResult result = optimizer.optimize(residuals, parameterSet.getParameters());

    if (!result.isConverged()) {
      fireStateChange("Fit failed: " + result.getMessage());
      throw new SolverFailureException(result.getStatus(), result.getMessage());
    }

    double[] point = result.getPoint();
    double[] sigma = result.getSigma();
    capExcitationTemperatures(point, names, parameterSet);
    for (int i = 0; i < parameterSet.size(); ++i) {
      ParameterInfo info = parameterSet.get(i);
      info.setValue(point[i]);
      info.setError(sigma == null ? 0. : sigma[i]);
    }

    fireStateChange("Fit converged after " + result.getIterations()
        + " iterations; building model...");

    double[] bestFit = model.evaluate(axis, point, names, componentCount);
    List<Map<Transition, Double>> opticalDepths = new ArrayList<>();
    for (PhysicalParameters component :
        MultiComponentModel.splitComponents(point, names, componentCount)) {
      opticalDepths.add(SpectralSynthesizer.opticalDepths(component, thin));
    }

    lastResult = new FitResult(parameterSet.getParameters(), componentCount, bestFit,
        result.getChiSquare(), opticalDepths, data.length, result.getIterations(),
        result.getEvaluations(), result.getMessage());
    xySeriesData = buildSeries(axis, data, bestFit);

    logger.info("Fit complete. Chi2: " + lastResult.getChiSquare() + " Reduced Chi2: "
        + lastResult.getReducedChiSquare() + " DOF: " + lastResult.getDegreesOfFreedom()
        + " residual RMS: "
        + NumericUtils.rootMeanSquare(NumericUtils.subtract(data, bestFit)));
    if (logger.isDebugEnabled()) {
      logger.debug(lastResult.getReportString());
    }
    fireStateChange("Fit complete");

    return lastResult;
  }

  /**
   * Cap each component's excitation temperature at its kinetic temperature, the value the model
   * actually uses in that case
   */
  private static void capExcitationTemperatures(double[] point, ParameterName[] names,
      ParameterSet parameterSet) {
    for (int j = 0; j < parameterSet.getComponentCount(); ++j) {
      int tkinIndex = -1;
      int texIndex = -1;
      for (ParameterInfo info : parameterSet.getComponent(j)) {
        if (names[info.getIndex()] == ParameterName.TKIN) {
          tkinIndex = info.getIndex();
        } else if (names[info.getIndex()] == ParameterName.TEX) {
          texIndex = info.getIndex();
        }
      }
      if (tkinIndex >= 0 && texIndex >= 0 && point[texIndex] > point[tkinIndex]) {
        point[texIndex] = point[tkinIndex];
      }
    }
  }

  private static List<XYSeriesCollection> buildSeries(SpectralAxis axis, double[] data,
      double[] bestFit) {
    double[] frequencies = axis.convertToUnit(SpectralUnit.GHZ).getValues();
    XYSeries dataSeries = new XYSeries("Data", false, true);
    XYSeries modelSeries = new XYSeries("Model", false, true);
    XYSeries residualSeries = new XYSeries("Residual", false, true);
    for (int i = 0; i < frequencies.length; ++i) {
      dataSeries.add(frequencies[i], data[i]);
      modelSeries.add(frequencies[i], bestFit[i]);
      residualSeries.add(frequencies[i], data[i] - bestFit[i]);
    }

    List<XYSeriesCollection> out = new ArrayList<>();
    XYSeriesCollection spectra = new XYSeriesCollection();
    spectra.addSeries(dataSeries);
    spectra.addSeries(modelSeries);
    out.add(spectra);
    XYSeriesCollection residualCollection = new XYSeriesCollection();
    residualCollection.addSeries(residualSeries);
    out.add(residualCollection);
    return out;
  }
}
