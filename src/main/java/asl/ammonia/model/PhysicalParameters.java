package asl.ammonia.model;

/**
 * Physical parameters for a single ammonia velocity component. Instances are immutable; use
 * {@link #builder()} to construct one, starting from the model defaults (Tkin 20 K, LTE
 * excitation, N = 1E14 cm^-2, 1 km/s width, no offset, all ortho).
 *
 * Column density may be given either linearly or as log10; anything in the open interval (5, 25)
 * is taken as a logarithm. This is unambiguous because columns below 1E10 produce no measurable
 * emission and plausible columns do not exceed 1E25.
 */
public final class PhysicalParameters {

  static final double LOG_COLUMN_MIN = 5.;
  static final double LOG_COLUMN_MAX = 25.;
  static final double THIN_COLUMN = 1E15;

  private final double kineticTemperature;
  private final Double excitationTemperature;
  private final double totalColumn;
  private final double width;
  private final double velocityOffset;
  private final double orthoFraction;
  private final Double tau11;
  private final Double fillingFraction;

  private PhysicalParameters(Builder builder) {
    kineticTemperature = builder.kineticTemperature;
    excitationTemperature = builder.excitationTemperature;
    totalColumn = builder.totalColumn;
    width = builder.width;
    velocityOffset = builder.velocityOffset;
    orthoFraction = builder.orthoFraction;
    tau11 = builder.tau11;
    fillingFraction = builder.fillingFraction;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return Builder initialized with this instance's values
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.kineticTemperature = kineticTemperature;
    builder.excitationTemperature = excitationTemperature;
    builder.totalColumn = totalColumn;
    builder.width = width;
    builder.velocityOffset = velocityOffset;
    builder.orthoFraction = orthoFraction;
    builder.tau11 = tau11;
    builder.fillingFraction = fillingFraction;
    return builder;
  }

  public double getKineticTemperature() {
    return kineticTemperature;
  }

  /**
   * @return Excitation temperature as given, or null if LTE was assumed
   */
  public Double getExcitationTemperature() {
    return excitationTemperature;
  }

  public double getTotalColumn() {
    return totalColumn;
  }

  public double getWidth() {
    return width;
  }

  public double getVelocityOffset() {
    return velocityOffset;
  }

  public double getOrthoFraction() {
    return orthoFraction;
  }

  public Double getTau11() {
    return tau11;
  }

  public Double getFillingFraction() {
    return fillingFraction;
  }

  /**
   * Excitation temperature actually used by the model. Tex cannot exceed Tkin, and is ignored
   * (set to Tkin) when not given or when the thin approximation is used.
   *
   * @param thin True if the optically thin parametrization is in use
   * @return Effective excitation temperature (K)
   */
  public double getEffectiveExcitationTemperature(boolean thin) {
    if (excitationTemperature == null || thin
        || excitationTemperature > kineticTemperature) {
      return kineticTemperature;
    }
    return excitationTemperature;
  }

  /**
   * Column density actually used by the model, in linear units
   *
   * @param thin True if the optically thin parametrization is in use
   * @return Column density (cm^-2)
   */
  public double getEffectiveColumn(boolean thin) {
    if (thin) {
      return THIN_COLUMN;
    }
    if (totalColumn > LOG_COLUMN_MIN && totalColumn < LOG_COLUMN_MAX) {
      return Math.pow(10, totalColumn);
    }
    return totalColumn;
  }

  public double getEffectiveFillingFraction() {
    return fillingFraction == null ? 1.0 : fillingFraction;
  }

  @Override
  public String toString() {
    return "tkin: " + kineticTemperature + "  tex: " + excitationTemperature + "  ntot: "
        + totalColumn + "  width: " + width + "  xoff_v: " + velocityOffset + "  fortho: "
        + orthoFraction + "  tau11: " + tau11 + "  fillingfraction: " + fillingFraction;
  }

  /**
   * Mutable builder for {@link PhysicalParameters}
   */
  public static final class Builder {

    private double kineticTemperature = 20.;
    private Double excitationTemperature = null;
    private double totalColumn = 1E14;
    private double width = 1.;
    private double velocityOffset = 0.;
    private double orthoFraction = 1.;
    private Double tau11 = null;
    private Double fillingFraction = null;

    private Builder() {
    }

    public Builder kineticTemperature(double kineticTemperature) {
      this.kineticTemperature = kineticTemperature;
      return this;
    }

    public Builder excitationTemperature(Double excitationTemperature) {
      this.excitationTemperature = excitationTemperature;
      return this;
    }

    public Builder totalColumn(double totalColumn) {
      this.totalColumn = totalColumn;
      return this;
    }

    public Builder width(double width) {
      this.width = width;
      return this;
    }

    public Builder velocityOffset(double velocityOffset) {
      this.velocityOffset = velocityOffset;
      return this;
    }

    public Builder orthoFraction(double orthoFraction) {
      this.orthoFraction = orthoFraction;
      return this;
    }

    public Builder tau11(Double tau11) {
      this.tau11 = tau11;
      return this;
    }

    public Builder fillingFraction(Double fillingFraction) {
      this.fillingFraction = fillingFraction;
      return this;
    }

    public PhysicalParameters build() {
      return new PhysicalParameters(this);
    }
  }
}
