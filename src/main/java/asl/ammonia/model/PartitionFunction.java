package asl.ammonia.model;

/**
 * Rigid-rotor rotational partition function of ammonia, split into its ortho (K a multiple of 3,
 * doubled statistical weight) and para branches. Weights are left unnormalized so that each
 * branch can be normalized on its own; use {@link #getOrthoFraction(int)} and
 * {@link #getParaFraction(int)} to get a level's share of its branch.
 *
 * A new instance is needed for every kinetic temperature.
 */
public class PartitionFunction {

  /**
   * Number of rotational levels included in the sums
   */
  public static final int LEVEL_COUNT = 51;

  /**
   * Rotational constants (Hz)
   */
  static final double B_ROT = 298117.06E6;
  static final double C_ROT = 186726.36E6;

  private final double kineticTemperature;
  private final double[] orthoWeights;
  private final double[] paraWeights;
  private final double orthoSum;
  private final double paraSum;

  /**
   * Compute level weights at the given kinetic temperature
   *
   * @param kineticTemperature Gas kinetic temperature (K)
   */
  public PartitionFunction(double kineticTemperature) {
    this.kineticTemperature = kineticTemperature;

    int orthoCount = (LEVEL_COUNT + 2) / 3;
    orthoWeights = new double[orthoCount];
    paraWeights = new double[LEVEL_COUNT - orthoCount];

    int orthoIdx = 0;
    int paraIdx = 0;
    double oSum = 0.;
    double pSum = 0.;
    for (int j = 0; j < LEVEL_COUNT; ++j) {
      double energy = PhysicalConstants.PLANCK
          * (B_ROT * j * (j + 1) + (C_ROT - B_ROT) * j * j);
      double boltzmann = (2 * j + 1) * Math.exp(-energy / (PhysicalConstants.BOLTZMANN
          * kineticTemperature));
      if (j % 3 == 0) {
        orthoWeights[orthoIdx] = 2 * boltzmann;
        oSum += orthoWeights[orthoIdx];
        ++orthoIdx;
      } else {
        paraWeights[paraIdx] = boltzmann;
        pSum += paraWeights[paraIdx];
        ++paraIdx;
      }
    }
    orthoSum = oSum;
    paraSum = pSum;
  }

  public double getKineticTemperature() {
    return kineticTemperature;
  }

  /**
   * @return Copy of the unnormalized ortho level weights (J = 0, 3, 6, ...)
   */
  public double[] getOrthoWeights() {
    return orthoWeights.clone();
  }

  /**
   * @return Copy of the unnormalized para level weights (J = 1, 2, 4, 5, ...)
   */
  public double[] getParaWeights() {
    return paraWeights.clone();
  }

  public double getOrthoSum() {
    return orthoSum;
  }

  public double getParaSum() {
    return paraSum;
  }

  public double getOrthoFraction(int level) {
    return orthoWeights[level] / orthoSum;
  }

  public double getParaFraction(int level) {
    return paraWeights[level] / paraSum;
  }

  /**
   * Population of the transition's level relative to the branch the transition belongs to
   *
   * @param transition Transition whose level population is wanted
   * @return Normalized population fraction
   */
  public double getLevelFraction(Transition transition) {
    if (transition.isOrtho()) {
      return getOrthoFraction(transition.getPartitionLevel());
    }
    return getParaFraction(transition.getPartitionLevel());
  }
}
