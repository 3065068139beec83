package asl.ammonia.fit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import asl.ammonia.input.Configuration;
import asl.ammonia.input.SpectralAxis;
import asl.ammonia.model.InvalidModelException;
import asl.ammonia.model.PhysicalParameters;
import asl.ammonia.model.SpectralSynthesizer;
import asl.ammonia.model.Transition;
import asl.ammonia.output.FitResult;
import java.util.Arrays;
import java.util.List;
import org.jfree.data.xy.XYSeriesCollection;
import org.junit.Test;

public class MultiComponentFitterTest {

  private static final SpectralAxis AXIS =
      SpectralAxis.aroundTransition(Transition.ONE_ONE, -20., 20., 400);

  private static double[] synthesize(SpectralAxis axis, double tkin, double tex, double ntot,
      double width, double xoff, double fortho) {
    PhysicalParameters parameters = PhysicalParameters.builder().
        kineticTemperature(tkin).
        excitationTemperature(tex).
        totalColumn(ntot).
        width(width).
        velocityOffset(xoff).
        orthoFraction(fortho).
        build();
    return SpectralSynthesizer.synthesize(axis, parameters);
  }

  @Test
  public void endToEnd_recoversTruthFromTruth() throws SolverFailureException {
    double[] data = synthesize(AXIS, 20., 15., 14., 1.0, 0.0, 0.5);
    double[] truth = {20., 15., 14., 1.0, 0.0, 0.5};
    MultiComponentFitter fitter = new MultiComponentFitter();
    FitResult result = fitter.fitMultiComponent(AXIS, data, 1, null, truth.clone(), null, null,
        null, null, null, null);

    assertTrue(result.getChiSquare() < 1E-6);
    double[] values = result.getValues();
    assertEquals(6, values.length);
    for (int i = 0; i < truth.length; ++i) {
      assertEquals(truth[i], values[i], Math.max(0.01 * Math.abs(truth[i]), 1E-3));
    }
    assertEquals(400, result.getModel().length);
    assertArrayEquals(data, result.getModel(), 1E-6);
  }

  @Test
  public void widthAndOffset_recoveredWithOthersFixed() throws SolverFailureException {
    double[] data = synthesize(AXIS, 20., 15., 14., 1.0, 0.0, 0.5);
    ParameterSet set = ParameterSet.builder().
        values(20., 15., 14., 1.2, 0.3, 0.5).
        fixed(true, true, true, false, false, true).
        build();
    MultiComponentFitter fitter = new MultiComponentFitter();
    FitResult result = fitter.fit(AXIS, data, null, set);

    double[] values = result.getValues();
    assertEquals(1.0, values[3], 1E-4);
    assertEquals(0.0, values[4], 1E-4);
    // fixed parameters come back exactly as given
    assertEquals(20., values[0], 0.);
    assertEquals(15., values[1], 0.);
    assertEquals(14., values[2], 0.);
    assertEquals(0.5, values[5], 0.);
    assertEquals(0., result.getErrors()[0], 0.);
    assertTrue(result.getErrors()[3] > 0.);
    assertTrue(result.getChiSquare() < 1E-8);
    // the parameter records are updated too
    assertEquals(values[3], set.get(3).getValue(), 0.);
  }

  @Test
  public void opticallyThickLine_separatesTexAndColumn() throws SolverFailureException {
    double[] data = synthesize(AXIS, 20., 15., 15., 1.0, 0.0, 0.5);
    ParameterSet set = ParameterSet.builder().
        values(20., 14., 14.9, 1.1, 0.1, 0.5).
        fixed(true, false, false, false, false, true).
        build();
    MultiComponentFitter fitter = new MultiComponentFitter();
    FitResult result = fitter.fit(AXIS, data, null, set);

    double[] values = result.getValues();
    assertEquals(15., values[1], 0.15);
    assertEquals(15., values[2], 0.15);
    assertEquals(1.0, values[3], 0.01);
    assertEquals(0.0, values[4], 0.01);
    assertTrue(result.getOpticalDepths(0).get(Transition.ONE_ONE) > 0.5);
  }

  @Test
  public void twoComponents_widthsAndOffsetsRecovered() throws SolverFailureException {
    SpectralAxis axis = SpectralAxis.aroundTransition(Transition.ONE_ONE, -30., 30., 400);
    double[] first = synthesize(axis, 20., 15., 14., 1.0, -3.0, 0.5);
    double[] second = synthesize(axis, 20., 12., 14.3, 0.8, 4.0, 0.5);
    double[] data = new double[first.length];
    for (int i = 0; i < data.length; ++i) {
      data[i] = first[i] + second[i];
    }
    ParameterSet set = ParameterSet.builder().
        values(20., 15., 14., 1.2, -2.5, 0.5, 20., 12., 14.3, 1.0, 3.5, 0.5).
        fixed(true, true, true, false, false, true).
        componentCount(2).
        build();
    assertEquals(ArrayResolution.REPLICATED, set.getResolution(ParameterSet.ParameterArray.FIXED));

    FitResult result = new MultiComponentFitter().fit(axis, data, null, set);
    double[] values = result.getValues();
    assertEquals(2, result.getComponentCount());
    assertEquals(1.0, values[3], 1E-4);
    assertEquals(-3.0, values[4], 1E-4);
    assertEquals(0.8, values[9], 1E-4);
    assertEquals(4.0, values[10], 1E-4);
    assertEquals(2, result.getOpticalDepths().size());
  }

  @Test
  public void solverFailure_throwsWithMessage() {
    MockOptimizer optimizer = new MockOptimizer();
    optimizer.status = OptimizerResult.Status.FAILED;
    optimizer.message = "unable to reduce chi-square";
    MultiComponentFitter fitter = new MultiComponentFitter(optimizer);
    double[] data = synthesize(AXIS, 20., 15., 14., 1.0, 0.0, 0.5);
    try {
      fitter.fitMultiComponent(AXIS, data, 1, null);
      fail("Expected the fit to fail");
    } catch (SolverFailureException e) {
      assertEquals("unable to reduce chi-square", e.getMessage());
      assertEquals(OptimizerResult.Status.FAILED, e.getStatus());
    }
    assertNull(fitter.getLastResult());
    assertTrue(fitter.getData().isEmpty());
  }

  @Test
  public void iterationLimit_throws() {
    MockOptimizer optimizer = new MockOptimizer();
    optimizer.status = OptimizerResult.Status.MAX_ITERATIONS;
    optimizer.message = "maximal count (1) exceeded";
    MultiComponentFitter fitter = new MultiComponentFitter(optimizer);
    double[] data = synthesize(AXIS, 20., 15., 14., 1.0, 0.0, 0.5);
    try {
      fitter.fitMultiComponent(AXIS, data, 1, null);
      fail("Expected the fit to fail");
    } catch (SolverFailureException e) {
      assertEquals(OptimizerResult.Status.MAX_ITERATIONS, e.getStatus());
      assertEquals("maximal count (1) exceeded", e.getMessage());
    }
  }

  @Test
  public void missingCovariance_givesZeroErrors() throws SolverFailureException {
    MockOptimizer optimizer = new MockOptimizer();
    MultiComponentFitter fitter = new MultiComponentFitter(optimizer);
    double[] data = synthesize(AXIS, 20., 15., 14., 1.0, 0.0, 0.5);
    FitResult result = fitter.fitMultiComponent(AXIS, data, 1, null);
    assertArrayEquals(new double[6], result.getErrors(), 0.);
    assertEquals("mock optimizer finished", result.getMessage());
  }

  @Test
  public void defaultStart_usesLogColumnAndHalfOrtho() throws SolverFailureException {
    MockOptimizer optimizer = new MockOptimizer();
    MultiComponentFitter fitter = new MultiComponentFitter(optimizer);
    double[] data = new double[AXIS.length()];
    FitResult result = fitter.fitMultiComponent(AXIS, data, 2, null);
    assertArrayEquals(new double[]{20., 20., 14., 1.0, 0.0, 0.5, 20., 20., 14., 1.0, 0.0, 0.5},
        result.getValues(), 0.);
    ParameterInfo xoff = result.getParameters().get(4);
    assertTrue(!xoff.isLowerLimited());
    ParameterInfo fortho = result.getParameters().get(11);
    assertTrue(fortho.isUpperLimited());
    assertEquals(1.0, fortho.getUpperBound(), 0.);
  }

  @Test
  public void excitationAboveKinetic_isCapped() throws SolverFailureException {
    MockOptimizer optimizer = new MockOptimizer();
    optimizer.point = new double[]{20., 25., 14., 1.0, 0.0, 0.5, 10., 8., 14., 1.0, 2.0, 0.5};
    optimizer.sigma = new double[12];
    MultiComponentFitter fitter = new MultiComponentFitter(optimizer);
    double[] data = new double[AXIS.length()];
    FitResult result = fitter.fitMultiComponent(AXIS, data, 2, null);
    double[] values = result.getValues();
    assertEquals(20., values[1], 0.);
    assertEquals(8., values[7], 0.);
  }

  @Test
  public void residuals_weightedByErrors() throws SolverFailureException {
    MockOptimizer optimizer = new MockOptimizer();
    MultiComponentFitter fitter = new MultiComponentFitter(optimizer);
    double[] data = synthesize(AXIS, 20., 15., 14., 1.0, 0.0, 0.5);
    double[] start = {20., 15., 14., 1.3, 0.2, 0.5};

    fitter.fitMultiComponent(AXIS, data, 1, null, start.clone(), null, null, null, null, null,
        null);
    double[] unweighted = optimizer.lastResiduals;

    double[] errors = new double[data.length];
    Arrays.fill(errors, 2.0);
    FitResult result = fitter.fitMultiComponent(AXIS, data, 1, errors, start.clone(), null, null,
        null, null, null, null);
    double[] weighted = optimizer.lastResiduals;

    double chiSquare = 0.;
    for (int i = 0; i < data.length; ++i) {
      assertEquals(unweighted[i] / 2.0, weighted[i], 1E-15);
      chiSquare += weighted[i] * weighted[i];
    }
    assertEquals(chiSquare, result.getChiSquare(), 1E-15);
  }

  @Test
  public void statusChanges_notifyListeners() throws SolverFailureException {
    MultiComponentFitter fitter = new MultiComponentFitter(new MockOptimizer());
    final int[] notifications = {0};
    fitter.addChangeListener(e -> ++notifications[0]);
    assertEquals("", fitter.getStatus());
    fitter.fitMultiComponent(AXIS, new double[AXIS.length()], 1, null);
    assertTrue(notifications[0] >= 2);
    assertEquals("Fit complete", fitter.getStatus());
  }

  @Test
  public void fireStateChange_updatesStatus() {
    MultiComponentFitter fitter = new MultiComponentFitter(new MockOptimizer());
    final int[] notifications = {0};
    fitter.addChangeListener(e -> ++notifications[0]);
    fitter.fireStateChange("Fired Status Change");
    assertEquals("Fired Status Change", fitter.getStatus());
    assertEquals(1, notifications[0]);
  }

  @Test
  public void getData_holdsSpectraAndResiduals() throws SolverFailureException {
    MultiComponentFitter fitter = new MultiComponentFitter(new MockOptimizer());
    double[] data = synthesize(AXIS, 20., 15., 14., 1.0, 0.0, 0.5);
    fitter.fitMultiComponent(AXIS, data, 1, null);
    List<XYSeriesCollection> plots = fitter.getData();
    assertEquals(2, plots.size());
    assertEquals(2, plots.get(0).getSeriesCount());
    assertEquals("Data", plots.get(0).getSeriesKey(0));
    assertEquals("Model", plots.get(0).getSeriesKey(1));
    assertEquals(400, plots.get(0).getSeries(0).getItemCount());
    assertEquals(AXIS.getValue(10), plots.get(0).getSeries(0).getX(10).doubleValue(), 1E-12);
    assertEquals(1, plots.get(1).getSeriesCount());
    assertEquals(400, plots.get(1).getSeries(0).getItemCount());
  }

  @Test
  public void thinMode_fitsOpticalDepthProfile() throws SolverFailureException {
    MockOptimizer optimizer = new MockOptimizer();
    MultiComponentFitter fitter = new MultiComponentFitter(optimizer);
    fitter.setThin(true);
    assertTrue(fitter.isThin());
    ParameterSet set = ParameterSet.builder(ParameterName.TKIN, ParameterName.TAU11,
        ParameterName.WIDTH, ParameterName.XOFF_V).values(20., 0.8, 1.0, 0.0).build();
    double[] data = new double[AXIS.length()];
    FitResult result = fitter.fit(AXIS, data, null, set);
    assertEquals(0.8, result.getOpticalDepths(0).get(Transition.ONE_ONE), 1E-15);
    double peak = 0.;
    for (double value : result.getModel()) {
      peak = Math.max(peak, value);
    }
    // optical depth profile, not brightness temperature
    assertTrue(peak < 0.8);
    assertTrue(peak > 0.);
  }

  @Test(expected = InvalidModelException.class)
  public void unphysicalStart_propagatesModelError() throws SolverFailureException {
    MultiComponentFitter fitter = new MultiComponentFitter();
    boolean[] allFixed = {true, true, true, true, true, true};
    boolean[] noUpper = new boolean[6];
    fitter.fitMultiComponent(AXIS, new double[AXIS.length()], 1, null,
        new double[]{20., 15., 14., 1.0, 0.0, 1.5}, null, allFixed, null, noUpper, null, null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void dataLengthMismatch_throwsException() throws SolverFailureException {
    new MultiComponentFitter(new MockOptimizer()).fitMultiComponent(AXIS, new double[10], 1,
        null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void nonPositiveErrors_throwsException() throws SolverFailureException {
    double[] errors = new double[AXIS.length()];
    new MultiComponentFitter(new MockOptimizer()).fitMultiComponent(AXIS,
        new double[AXIS.length()], 1, errors);
  }

  @Test
  public void moments_returnsFixedGuess() {
    assertArrayEquals(new double[]{20., 10., 1E15, 1.0, 0.0, 1.0},
        MultiComponentFitter.moments(AXIS, new double[AXIS.length()]), 0.);
  }

  @Test
  public void fillingFraction_fitWithSevenParameters() throws SolverFailureException {
    PhysicalParameters truth = PhysicalParameters.builder().
        kineticTemperature(20.).
        excitationTemperature(15.).
        totalColumn(14.).
        width(1.0).
        velocityOffset(0.0).
        orthoFraction(0.5).
        fillingFraction(0.5).
        build();
    double[] data = SpectralSynthesizer.synthesize(AXIS, truth);
    double[] start = {20., 15., 14., 1.0, 0.0, 0.5, 0.5};
    ParameterName[] names = {ParameterName.TKIN, ParameterName.TEX, ParameterName.NTOT,
        ParameterName.WIDTH, ParameterName.XOFF_V, ParameterName.FORTHO,
        ParameterName.FILLING_FRACTION};

    FitResult result = new MultiComponentFitter().fitMultiComponent(AXIS, data, 1, null,
        start.clone(), names, null, null, null, null, null);

    double[] values = result.getValues();
    assertEquals(7, values.length);
    assertEquals(ParameterName.FILLING_FRACTION, result.getParameters().get(6).getName());
    for (int i = 0; i < start.length; ++i) {
      assertEquals(start[i], values[i], Math.max(0.01 * Math.abs(start[i]), 1E-3));
    }
    assertTrue(result.getChiSquare() < 1E-6);
    assertArrayEquals(data, result.getModel(), 1E-6);
  }

  @Test
  public void singleComponentNames_replicatedAcrossComponents() throws SolverFailureException {
    MockOptimizer optimizer = new MockOptimizer();
    ParameterName[] names = {ParameterName.TKIN, ParameterName.TEX, ParameterName.NTOT,
        ParameterName.WIDTH, ParameterName.XOFF_V, ParameterName.FORTHO,
        ParameterName.FILLING_FRACTION};
    double[] values = {20., 15., 14., 1.0, -3.0, 0.5, 0.8, 20., 12., 14., 1.0, 3.0, 0.5, 0.6};
    FitResult result = new MultiComponentFitter(optimizer).fitMultiComponent(AXIS,
        new double[AXIS.length()], 2, null, values, names, null, null, null, null, null);

    assertEquals(14, result.getValues().length);
    assertEquals(2, result.getComponentCount());
    assertEquals(ParameterName.FILLING_FRACTION, result.getParameters().get(13).getName());
    assertEquals(1, result.getParameters().get(13).getComponent());
    assertEquals(0.6, result.getValues()[13], 0.);
  }

  @Test
  public void canonicalNames_splitsRepeatedLists() {
    ParameterName[] single = ParameterName.defaultOrder();
    assertArrayEquals(single, MultiComponentFitter.canonicalNames(null, 2));
    // six names for two components is still one component's worth
    assertArrayEquals(single, MultiComponentFitter.canonicalNames(single, 2));

    ParameterName[] doubled = new ParameterName[12];
    for (int i = 0; i < doubled.length; ++i) {
      doubled[i] = single[i % single.length];
    }
    assertArrayEquals(single, MultiComponentFitter.canonicalNames(doubled, 2));
    assertArrayEquals(single, MultiComponentFitter.canonicalNames(doubled, 0));
  }

  @Test
  public void defaultFitter_readsBundledConfiguration() {
    MultiComponentFitter fitter = new MultiComponentFitter();
    LevenbergMarquardtSolver solver = (LevenbergMarquardtSolver) fitter.getOptimizer();
    assertEquals(Configuration.DEFAULT_CONFIG_PATH,
        solver.getConfiguration().getLoadedConfigPath());
  }
}
