package asl.ammonia.model;

import asl.ammonia.input.SpectralAxis;
import asl.ammonia.input.SpectralUnit;
import java.util.EnumMap;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * Generates model ammonia spectra from a set of physical parameters. For each of the inversion
 * transitions in {@link Transition} the line-center optical depth is derived from the column
 * density and the partition function at the kinetic temperature, spread over the hyperfine
 * components as gaussian profiles, and turned into brightness temperature above the CMB by the
 * radiative transfer equation for a uniform slab.
 *
 * Two alternative parametrizations are supported:
 * <ul>
 * <li>a fixed 1-1 optical depth, to which the other three transitions are scaled keeping their
 * theoretical ratios;</li>
 * <li>the "thin" mode, which with a fixed 1-1 optical depth derives the other lines from a
 * rotational temperature and returns the summed optical depth profile instead of a brightness
 * temperature. Column density and excitation temperature play no role in this mode.</li>
 * </ul>
 */
public class SpectralSynthesizer {

  private static final Logger logger = Logger.getLogger(SpectralSynthesizer.class);

  /**
   * Energy difference between the (2,2) and (1,1) levels (K)
   */
  static final double DELTA_T_22 = 41.5;

  private SpectralSynthesizer() {
  }

  /**
   * Synthesize a brightness temperature spectrum without the thin approximation
   *
   * @param axis Sample positions, in any unit convertible to frequency
   * @param parameters Physical parameters of the emitting gas
   * @return Model spectrum (K), one value per axis sample
   * @see #synthesize(SpectralAxis, PhysicalParameters, boolean)
   */
  public static double[] synthesize(SpectralAxis axis, PhysicalParameters parameters) {
    return synthesize(axis, parameters, false);
  }

  /**
   * Synthesize the model spectrum of all four inversion transitions over the given axis
   *
   * @param axis Sample positions, in any unit convertible to frequency
   * @param parameters Physical parameters of the emitting gas
   * @param thin True to use the optically thin parametrization
   * @return Model spectrum, one value per axis sample: brightness temperature (K), or summed
   * optical depth if thin mode is used with a fixed 1-1 optical depth
   * @throws InvalidModelException if the spectrum goes negative
   */
  public static double[] synthesize(SpectralAxis axis, PhysicalParameters parameters,
      boolean thin) {
    double[] frequencies = axis.convertToUnit(SpectralUnit.GHZ).getValues();
    double tex = parameters.getEffectiveExcitationTemperature(thin);
    boolean opticalDepthOnly = thin && parameters.getTau11() != null;

    Map<Transition, Double> tauMap = opticalDepths(parameters, thin);

    double[] spectrum = new double[frequencies.length];
    for (Transition transition : Transition.values()) {
      double[] tauProfile = opticalDepthProfile(frequencies, transition, tauMap.get(transition),
          parameters.getWidth(), parameters.getVelocityOffset(),
          parameters.getEffectiveFillingFraction());

      double min = Double.MAX_VALUE;
      for (int i = 0; i < spectrum.length; ++i) {
        if (opticalDepthOnly) {
          spectrum[i] += tauProfile[i];
        } else {
          // "temperature" of the photon at this frequency
          double t0 = PhysicalConstants.PLANCK * frequencies[i] * 1E9
              / PhysicalConstants.BOLTZMANN;
          double sourceMinusBackground = t0 / (Math.exp(t0 / tex) - 1)
              - t0 / (Math.exp(t0 / PhysicalConstants.T_CMB) - 1);
          spectrum[i] += sourceMinusBackground * (1 - Math.exp(-tauProfile[i]));
        }
        min = Math.min(min, spectrum[i]);
      }
      if (min < 0) {
        throw new InvalidModelException("Model dropped below zero at the " + transition
            + " transition; that is not possible for physical parameters. (" + parameters + ")");
      }
    }

    if (logger.isDebugEnabled()) {
      logger.debug("tkin: " + parameters.getKineticTemperature() + "  tex: " + tex
          + "  ntot: " + parameters.getEffectiveColumn(thin) + "  width: "
          + parameters.getWidth() + "  xoff_v: " + parameters.getVelocityOffset()
          + "  fortho: " + parameters.getOrthoFraction() + "  fillingfraction: "
          + parameters.getEffectiveFillingFraction());
    }

    return spectrum;
  }

  /**
   * Get the line-center optical depth of each transition (before the hyperfine split). Filling
   * fraction is not applied to these values.
   *
   * @param parameters Physical parameters of the emitting gas
   * @param thin True to use the optically thin parametrization
   * @return Map from each transition to its total optical depth
   */
  public static Map<Transition, Double> opticalDepths(PhysicalParameters parameters,
      boolean thin) {
    double tkin = parameters.getKineticTemperature();
    Double tau11 = parameters.getTau11();
    Map<Transition, Double> tauMap = new EnumMap<>(Transition.class);

    if (tau11 != null && thin) {
      double trot = rotationalTemperature(tkin);
      tauMap.put(Transition.ONE_ONE, tau11);
      tauMap.put(Transition.TWO_TWO,
          tau11 * Math.pow(23.722 / 23.694, 2) * 4 / 3. * 5 / 3. * Math.exp(-41.5 / trot));
      tauMap.put(Transition.THREE_THREE,
          tau11 * Math.pow(23.8701279 / 23.694, 2) * 3 / 2. * 14. / 3.
              * Math.exp(-101.1 / trot));
      tauMap.put(Transition.FOUR_FOUR,
          tau11 * Math.pow(24.1394169 / 23.694, 2) * 8 / 5. * 9 / 3.
              * Math.exp(-177.34 / trot));
      return tauMap;
    }

    double tex = parameters.getEffectiveExcitationTemperature(thin);
    double column = parameters.getEffectiveColumn(thin);
    double width = parameters.getWidth();
    double fortho = parameters.getOrthoFraction();
    PartitionFunction partition = new PartitionFunction(tkin);

    double ckms = PhysicalConstants.SPEED_OF_LIGHT_KMS;
    double ccms = PhysicalConstants.SPEED_OF_LIGHT_CMS;
    double h = PhysicalConstants.PLANCK;
    double kb = PhysicalConstants.BOLTZMANN;

    for (Transition transition : Transition.values()) {
      double nu = transition.getRestFrequency();
      double orthoParaFraction = transition.isOrtho() ? fortho : 1.0 - fortho;
      double tau = column * orthoParaFraction * partition.getLevelFraction(transition)
          / (1 + Math.exp(-h * nu / (kb * tkin)))
          * ccms * ccms / (8 * Math.PI * nu * nu) * transition.getEinsteinA()
          * (1 - Math.exp(-h * nu / (kb * tex)))
          / (width / ckms * nu * Math.sqrt(2 * Math.PI));
      tauMap.put(transition, tau);
    }

    if (tau11 != null) {
      // keep the theoretical ratios but pin the 1-1 line to the requested depth
      double scale = tau11 / tauMap.get(Transition.ONE_ONE);
      for (Transition transition : Transition.values()) {
        tauMap.put(transition, tauMap.get(transition) * scale);
      }
    }

    return tauMap;
  }

  /**
   * Spread a transition's optical depth over its hyperfine components
   *
   * @param frequencies Sample positions (GHz)
   * @param transition Transition whose hyperfine structure is used
   * @param tau Total optical depth of the transition
   * @param width Gaussian velocity dispersion (km/s)
   * @param velocityOffset Bulk velocity offset (km/s)
   * @param fillingFraction Scaling applied to the profile
   * @return Optical depth at each sample position
   */
  public static double[] opticalDepthProfile(double[] frequencies, Transition transition,
      double tau, double width, double velocityOffset, double fillingFraction) {
    double ckms = PhysicalConstants.SPEED_OF_LIGHT_KMS;
    double[] offsets = transition.getVelocityOffsets();
    double[] weights = transition.getNormalizedWeights();
    double restGHz = transition.getRestFrequency() / 1E9;

    double[] profile = new double[frequencies.length];
    for (int k = 0; k < offsets.length; ++k) {
      double line = (1 - offsets[k] / ckms) * restGHz;
      double nuWidth = Math.abs(width / ckms * line);
      double nuOffset = velocityOffset / ckms * line;
      double amplitude = tau * weights[k] * fillingFraction;
      double denominator = 2.0 * nuWidth * nuWidth;
      for (int i = 0; i < frequencies.length; ++i) {
        double delta = frequencies[i] + nuOffset - line;
        profile[i] += amplitude * Math.exp(-delta * delta / denominator);
      }
    }
    return profile;
  }

  /**
   * Rotational temperature between the (1,1) and (2,2) levels for a given kinetic temperature,
   * as used by the thin parametrization
   *
   * @param kineticTemperature Gas kinetic temperature (K)
   * @return Rotational temperature (K)
   */
  public static double rotationalTemperature(double kineticTemperature) {
    return kineticTemperature / (1 + kineticTemperature / DELTA_T_22
        * Math.log(1 + 0.6 * Math.exp(-15.7 / kineticTemperature)));
  }
}
