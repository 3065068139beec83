package asl.ammonia.input;

import asl.ammonia.model.PhysicalConstants;
import asl.ammonia.model.Transition;
import java.util.Arrays;

/**
 * Sample positions of a spectrum along with their units. Velocity axes need a reference (rest)
 * frequency to be converted to frequency and use the radio convention, nu = nu0 * (1 - v/c).
 *
 * Axes are immutable; conversion always produces a new axis and never modifies the caller's data.
 */
public class SpectralAxis {

  private final double[] values;
  private final SpectralUnit unit;
  private final Double referenceFrequency; // Hz

  /**
   * Create a frequency axis, or a velocity axis that will never be converted to frequency
   *
   * @param values Sample positions
   * @param unit Units of the sample positions
   */
  public SpectralAxis(double[] values, SpectralUnit unit) {
    this(values, unit, null);
  }

  /**
   * Create an axis with a reference frequency used in velocity/frequency conversions
   *
   * @param values Sample positions
   * @param unit Units of the sample positions
   * @param referenceFrequency Rest frequency (Hz) that zero velocity corresponds to, may be null
   */
  public SpectralAxis(double[] values, SpectralUnit unit, Double referenceFrequency) {
    this.values = values.clone();
    this.unit = unit;
    this.referenceFrequency = referenceFrequency;
  }

  /**
   * Build an evenly spaced frequency axis (GHz) covering a velocity window around a transition
   *
   * @param transition Line whose rest frequency defines zero velocity
   * @param minVelocity Lower velocity limit (km/s)
   * @param maxVelocity Upper velocity limit (km/s)
   * @param count Number of samples, at least 2
   * @return New axis in GHz with the transition's rest frequency as reference
   */
  public static SpectralAxis aroundTransition(Transition transition, double minVelocity,
      double maxVelocity, int count) {
    if (count < 2) {
      throw new IllegalArgumentException("Need at least 2 samples to span a window, got " + count);
    }
    double[] velocities = new double[count];
    double step = (maxVelocity - minVelocity) / (count - 1);
    for (int i = 0; i < count; ++i) {
      velocities[i] = minVelocity + i * step;
    }
    SpectralAxis velocityAxis =
        new SpectralAxis(velocities, SpectralUnit.KM_PER_S, transition.getRestFrequency());
    return velocityAxis.convertToUnit(SpectralUnit.GHZ);
  }

  /**
   * Produce a copy of this axis expressed in another unit
   *
   * @param target Unit to convert to
   * @return New axis in the target unit
   * @throws IllegalStateException if the conversion crosses between velocity and frequency and
   * no reference frequency is set
   */
  public SpectralAxis convertToUnit(SpectralUnit target) {
    double[] converted = new double[values.length];
    if (unit.isVelocity() == target.isVelocity()) {
      double factor = unit.getScale() / target.getScale();
      for (int i = 0; i < values.length; ++i) {
        converted[i] = values[i] * factor;
      }
      return new SpectralAxis(converted, target, referenceFrequency);
    }

    if (referenceFrequency == null) {
      throw new IllegalStateException(
          "Cannot convert " + unit + " to " + target + " without a reference frequency");
    }

    double c = PhysicalConstants.SPEED_OF_LIGHT_KMS;
    if (unit.isVelocity()) {
      for (int i = 0; i < values.length; ++i) {
        double kms = values[i] * unit.getScale();
        converted[i] = referenceFrequency * (1 - kms / c) / target.getScale();
      }
    } else {
      for (int i = 0; i < values.length; ++i) {
        double hz = values[i] * unit.getScale();
        converted[i] = c * (1 - hz / referenceFrequency) / target.getScale();
      }
    }
    return new SpectralAxis(converted, target, referenceFrequency);
  }

  /**
   * @return Copy of the sample positions in this axis' own units
   */
  public double[] getValues() {
    return values.clone();
  }

  public double getValue(int index) {
    return values[index];
  }

  public SpectralUnit getUnit() {
    return unit;
  }

  public Double getReferenceFrequency() {
    return referenceFrequency;
  }

  public int length() {
    return values.length;
  }

  @Override
  public String toString() {
    return "SpectralAxis[" + values.length + " samples, " + unit + "] "
        + Arrays.toString(Arrays.copyOf(values, Math.min(3, values.length)));
  }
}
