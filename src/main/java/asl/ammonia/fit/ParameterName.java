package asl.ammonia.fit;

import asl.ammonia.model.PhysicalConstants;
import asl.ammonia.model.PhysicalParameters;

/**
 * Canonical fit parameters of a single ammonia component. Each constant knows how it feeds into
 * {@link PhysicalParameters} and which default value, bounds and step hint a fit uses for it
 * when the caller does not supply them.
 */
public enum ParameterName {

  TKIN("tkin", "T_K", 20.),
  TEX("tex", "T_{ex}", 20.),
  NTOT("ntot", "N", 1E10),
  WIDTH("width", "\\sigma", 1.0),
  XOFF_V("xoff_v", "v", 0.0),
  FORTHO("fortho", "F_o", 0.5),
  TAU11("tau11", "\\tau_{1-1}", 1.0),
  FILLING_FRACTION("fillingfraction", "FF", 1.0);

  /**
   * Largest change allowed to a temperature in one solver iteration (K). Big jumps in temperature
   * make the partition function badly conditioned.
   */
  static final double TEMPERATURE_MAX_STEP = 1.0;

  private static final ParameterName[] DEFAULT_ORDER =
      {TKIN, TEX, NTOT, WIDTH, XOFF_V, FORTHO};

  private final String key;
  private final String texKey;
  private final double defaultValue;

  ParameterName(String key, String texKey, double defaultValue) {
    this.key = key;
    this.texKey = texKey;
    this.defaultValue = defaultValue;
  }

  /**
   * @return The six parameters of a standard fit, in order: tkin, tex, ntot, width, xoff_v, fortho
   */
  public static ParameterName[] defaultOrder() {
    return DEFAULT_ORDER.clone();
  }

  /**
   * Look up a parameter by its key, ignoring any trailing component index ("tkin0" -> TKIN)
   *
   * @param name Key or display name of the parameter
   * @return Matching parameter
   * @throws IllegalArgumentException if the stripped name is not a known parameter
   */
  public static ParameterName fromName(String name) {
    String stripped = stripComponentIndex(name).trim().toLowerCase();
    for (ParameterName parameter : values()) {
      if (parameter.key.equals(stripped)) {
        return parameter;
      }
    }
    throw new IllegalArgumentException("Unknown ammonia parameter name: " + name);
  }

  static String stripComponentIndex(String name) {
    int end = name.length();
    while (end > 0 && Character.isDigit(name.charAt(end - 1))) {
      --end;
    }
    return name.substring(0, end);
  }

  public String getKey() {
    return key;
  }

  public String getTexKey() {
    return texKey;
  }

  public double getDefaultValue() {
    return defaultValue;
  }

  public boolean isTemperature() {
    return this == TKIN || this == TEX;
  }

  public boolean isFraction() {
    return this == FORTHO || this == FILLING_FRACTION;
  }

  /**
   * @return True if a lower bound applies by default (everything but the velocity offset)
   */
  public boolean isLowerLimitedByDefault() {
    return this != XOFF_V;
  }

  public boolean isUpperLimitedByDefault() {
    return isFraction();
  }

  /**
   * @return Default lower bound: Tkin and Tex cannot go below the CMB, all else stays positive
   */
  public double getDefaultLowerBound() {
    return isTemperature() ? PhysicalConstants.T_CMB : 0.;
  }

  public double getDefaultUpperBound() {
    return isFraction() ? 1.0 : 0.;
  }

  /**
   * @return Largest change allowed per solver iteration, or 0 for no limit
   */
  public double getMaxStep() {
    return isTemperature() ? TEMPERATURE_MAX_STEP : 0.;
  }

  /**
   * Set this parameter's value on a physical parameter builder
   *
   * @param builder Builder for the component being assembled
   * @param value Value of the parameter
   */
  public void applyTo(PhysicalParameters.Builder builder, double value) {
    switch (this) {
      case TKIN:
        builder.kineticTemperature(value);
        break;
      case TEX:
        builder.excitationTemperature(value);
        break;
      case NTOT:
        builder.totalColumn(value);
        break;
      case WIDTH:
        builder.width(value);
        break;
      case XOFF_V:
        builder.velocityOffset(value);
        break;
      case FORTHO:
        builder.orthoFraction(value);
        break;
      case TAU11:
        builder.tau11(value);
        break;
      case FILLING_FRACTION:
        builder.fillingFraction(value);
        break;
      default:
        throw new IllegalStateException("Unhandled parameter " + this);
    }
  }

  @Override
  public String toString() {
    return key;
  }
}
