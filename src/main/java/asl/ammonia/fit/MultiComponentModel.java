package asl.ammonia.fit;

import asl.ammonia.input.SpectralAxis;
import asl.ammonia.model.PhysicalParameters;
import asl.ammonia.model.SpectralSynthesizer;
import java.util.ArrayList;
import java.util.List;

/**
 * Sum of several ammonia spectra, one per velocity component. The flat parameter vector is read
 * as consecutive equal-sized groups, one group per component; the background level is taken to
 * be zero, so data should be baselined before fitting.
 */
public class MultiComponentModel {

  private final boolean thin;

  public MultiComponentModel() {
    this(false);
  }

  /**
   * @param thin True to synthesize every component with the optically thin parametrization
   */
  public MultiComponentModel(boolean thin) {
    this.thin = thin;
  }

  public boolean isThin() {
    return thin;
  }

  /**
   * Evaluate the summed model over an axis
   *
   * @param axis Sample positions
   * @param values Flat parameter vector, componentCount groups laid end to end
   * @param names Canonical name of each entry in values
   * @param componentCount Number of velocity components
   * @return Summed spectrum, one value per axis sample
   * @throws LengthMismatchException if values and names differ in length
   */
  public double[] evaluate(SpectralAxis axis, double[] values, ParameterName[] names,
      int componentCount) {
    double[] spectrum = new double[axis.length()];
    for (PhysicalParameters component : splitComponents(values, names, componentCount)) {
      double[] componentSpectrum = SpectralSynthesizer.synthesize(axis, component, thin);
      for (int i = 0; i < spectrum.length; ++i) {
        spectrum[i] += componentSpectrum[i];
      }
    }
    return spectrum;
  }

  /**
   * Evaluate the summed model using display names ("tkin0", "tex0", ...). Trailing component
   * indices are stripped to find each entry's canonical parameter.
   *
   * @param axis Sample positions
   * @param values Flat parameter vector
   * @param displayNames Name of each entry in values
   * @param componentCount Number of velocity components
   * @return Summed spectrum, one value per axis sample
   * @throws LengthMismatchException if values and names differ in length
   */
  public double[] evaluate(SpectralAxis axis, double[] values, String[] displayNames,
      int componentCount) {
    if (values.length != displayNames.length) {
      throw new LengthMismatchException(values.length, displayNames.length);
    }
    ParameterName[] names = new ParameterName[displayNames.length];
    for (int i = 0; i < names.length; ++i) {
      names[i] = ParameterName.fromName(displayNames[i]);
    }
    return evaluate(axis, values, names, componentCount);
  }

  /**
   * Build the physical parameters of each component from a flat vector
   *
   * @param values Flat parameter vector
   * @param names Canonical name of each entry in values
   * @param componentCount Number of velocity components
   * @return One parameter record per component, in order
   */
  public static List<PhysicalParameters> splitComponents(double[] values, ParameterName[] names,
      int componentCount) {
    if (values.length != names.length) {
      throw new LengthMismatchException(values.length, names.length);
    }
    if (componentCount <= 0 || values.length % componentCount != 0) {
      throw new IllegalArgumentException("Cannot split " + values.length
          + " parameters evenly into " + componentCount + " components");
    }
    int perComponent = values.length / componentCount;
    List<PhysicalParameters> components = new ArrayList<>(componentCount);
    for (int j = 0; j < componentCount; ++j) {
      PhysicalParameters.Builder builder = PhysicalParameters.builder();
      for (int i = j * perComponent; i < (j + 1) * perComponent; ++i) {
        names[i].applyTo(builder, values[i]);
      }
      components.add(builder.build());
    }
    return components;
  }
}
