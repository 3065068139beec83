package asl.ammonia.model;

/**
 * Enumerated catalog of the ammonia inversion transitions handled by the model. Each transition
 * holds its rest frequency, Einstein A coefficient, nuclear-spin class and the velocity offsets
 * and relative intensities of its hyperfine components.
 *
 * The partition level index is the position of the transition's upper rotational level within
 * its own (ortho or para) branch of the {@link PartitionFunction}; the 0-0 ortho level is skipped,
 * which is why the 3-3 line sits at ortho index 1.
 *
 * Weight lists are stored exactly as tabulated and are not normalized; use
 * {@link #getNormalizedWeights()} when building optical depth profiles.
 */
public enum Transition {

  ONE_ONE("oneone", "1-1", 23.694506E9, 1.712E-7, false, 0,
      new double[]{19.8513, 19.3159, 7.88669, 7.46967, 7.35132, 0.460409, 0.322042,
          -0.0751680, -0.213003, 0.311034, 0.192266, -0.132382, -0.250923, -7.23349,
          -7.37280, -7.81526, -19.4117, -19.5500},
      new double[]{0.0740740, 0.148148, 0.0925930, 0.166667, 0.0185190, 0.0370370,
          0.0185190, 0.0185190, 0.0925930, 0.0333330, 0.300000, 0.466667,
          0.0333330, 0.0925930, 0.0185190, 0.166667, 0.0740740, 0.148148}),

  TWO_TWO("twotwo", "2-2", 23.722633335E9, 2.291E-7, false, 1,
      new double[]{26.5263, 26.0111, 25.9505, 16.3917, 16.3793, 15.8642, 0.562503,
          0.528408, 0.523745, 0.0132820, -0.00379100, -0.0132820, -0.501831,
          -0.531340, -0.589080, -15.8547, -16.3698, -16.3822, -25.9505, -26.0111,
          -26.5263},
      new double[]{0.00418600, 0.0376740, 0.0209300, 0.0372090, 0.0260470,
          0.00186000, 0.0209300, 0.0116280, 0.0106310, 0.267442, 0.499668,
          0.146512, 0.0116280, 0.0106310, 0.0209300, 0.00186000, 0.0260470,
          0.0372090, 0.0209300, 0.0376740, 0.00418600}),

  THREE_THREE("threethree", "3-3", 23.8701296E9, 2.625E-7, true, 1,
      new double[]{29.195098, 29.044147, 28.941877, 28.911408, 21.234827,
          21.214619, 21.136387, 21.087456, 1.005122, 0.806082, 0.778062,
          0.628569, 0.016754, -0.005589, -0.013401, -0.639734, -0.744554,
          -1.031924, -21.125222, -21.203441, -21.223649, -21.076291, -28.908067,
          -28.938523, -29.040794, -29.191744},
      new double[]{0.012263, 0.008409, 0.003434, 0.005494, 0.006652, 0.008852,
          0.004967, 0.011589, 0.019228, 0.010387, 0.010820, 0.009482, 0.293302,
          0.459109, 0.177372, 0.009482, 0.010820, 0.019228, 0.004967, 0.008852,
          0.006652, 0.011589, 0.005494, 0.003434, 0.008409, 0.012263}),

  FOUR_FOUR("fourfour", "4-4", 24.1394169E9, 3.167E-7, false, 2,
      new double[]{0., -30.49783692, 30.49783692, 0., 24.25907811, -24.25907811, 0.},
      new double[]{0.2431, 0.0162, 0.0162, 0.3008, 0.0163, 0.0163, 0.3911});

  private final String key;
  private final String designation;
  private final double restFrequency;
  private final double einsteinA;
  private final boolean ortho;
  private final int partitionLevel;
  private final double[] velocityOffsets;
  private final double[] weights;

  Transition(String key, String designation, double restFrequency, double einsteinA,
      boolean ortho, int partitionLevel, double[] velocityOffsets, double[] weights) {
    this.key = key;
    this.designation = designation;
    this.restFrequency = restFrequency;
    this.einsteinA = einsteinA;
    this.ortho = ortho;
    this.partitionLevel = partitionLevel;
    this.velocityOffsets = velocityOffsets;
    this.weights = weights;
  }

  /**
   * Find the transition matching either its short key ("oneone") or its designation ("1-1")
   *
   * @param name Key or designation of the transition
   * @return Matching transition
   * @throws IllegalArgumentException if nothing matches
   */
  public static Transition fromName(String name) {
    for (Transition transition : values()) {
      if (transition.key.equalsIgnoreCase(name) || transition.designation.equals(name)) {
        return transition;
      }
    }
    throw new IllegalArgumentException("Unknown ammonia transition: " + name);
  }

  public String getKey() {
    return key;
  }

  public String getDesignation() {
    return designation;
  }

  /**
   * @return Rest frequency of the transition in Hz
   */
  public double getRestFrequency() {
    return restFrequency;
  }

  /**
   * @return Einstein A coefficient (s^-1)
   */
  public double getEinsteinA() {
    return einsteinA;
  }

  public boolean isOrtho() {
    return ortho;
  }

  public int getPartitionLevel() {
    return partitionLevel;
  }

  public int getHyperfineCount() {
    return velocityOffsets.length;
  }

  /**
   * @return Copy of the hyperfine velocity offsets (km/s)
   */
  public double[] getVelocityOffsets() {
    return velocityOffsets.clone();
  }

  /**
   * @return Copy of the tabulated (unnormalized) relative intensities
   */
  public double[] getWeights() {
    return weights.clone();
  }

  /**
   * Get the hyperfine intensities scaled so that they sum to one.
   *
   * @return New array of weights with unit sum
   */
  public double[] getNormalizedWeights() {
    double sum = 0.;
    for (double weight : weights) {
      sum += weight;
    }
    double[] normalized = new double[weights.length];
    for (int i = 0; i < weights.length; ++i) {
      normalized[i] = weights[i] / sum;
    }
    return normalized;
  }

  @Override
  public String toString() {
    return designation;
  }
}
