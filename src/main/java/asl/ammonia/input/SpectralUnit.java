package asl.ammonia.input;

/**
 * Units understood by {@link SpectralAxis}. Frequency units scale to Hz, velocity units to km/s.
 */
public enum SpectralUnit {

  HZ("Hz", 1., false),
  KHZ("kHz", 1E3, false),
  MHZ("MHz", 1E6, false),
  GHZ("GHz", 1E9, false),
  M_PER_S("m/s", 1E-3, true),
  KM_PER_S("km/s", 1., true);

  private final String label;
  private final double scale;
  private final boolean velocity;

  SpectralUnit(String label, double scale, boolean velocity) {
    this.label = label;
    this.scale = scale;
    this.velocity = velocity;
  }

  /**
   * @return Multiplier taking a value in this unit to Hz (frequency) or km/s (velocity)
   */
  public double getScale() {
    return scale;
  }

  public boolean isVelocity() {
    return velocity;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
