package asl.ammonia.fit;

/**
 * Description of one scalar fit parameter: which component and canonical parameter it belongs
 * to, its current value and error, bounds, whether it is held fixed and how far the solver may
 * move it per iteration. Value and error are updated in place once a fit completes.
 */
public class ParameterInfo {

  private final int index;
  private final int component;
  private final ParameterName name;
  private final boolean fixed;
  private final boolean lowerLimited;
  private final boolean upperLimited;
  private final double lowerBound;
  private final double upperBound;
  private final double maxStep;
  private double value;
  private double error;

  ParameterInfo(int index, int component, ParameterName name, double value, boolean fixed,
      boolean lowerLimited, boolean upperLimited, double lowerBound, double upperBound,
      double maxStep) {
    this.index = index;
    this.component = component;
    this.name = name;
    this.value = value;
    this.fixed = fixed;
    this.lowerLimited = lowerLimited;
    this.upperLimited = upperLimited;
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.maxStep = maxStep;
    this.error = 0.;
  }

  public int getIndex() {
    return index;
  }

  public int getComponent() {
    return component;
  }

  public ParameterName getName() {
    return name;
  }

  /**
   * Name of the parameter tagged with its component, e.g. "tkin0"
   *
   * @return Display name
   */
  public String getDisplayName() {
    return name.getKey() + component;
  }

  public double getValue() {
    return value;
  }

  public void setValue(double value) {
    this.value = value;
  }

  public double getError() {
    return error;
  }

  public void setError(double error) {
    this.error = error;
  }

  public boolean isFixed() {
    return fixed;
  }

  public boolean isLowerLimited() {
    return lowerLimited;
  }

  public boolean isUpperLimited() {
    return upperLimited;
  }

  public double getLowerBound() {
    return lowerBound;
  }

  public double getUpperBound() {
    return upperBound;
  }

  /**
   * @return Largest change allowed per solver iteration, 0 if unlimited
   */
  public double getMaxStep() {
    return maxStep;
  }

  /**
   * Pull a value back inside whichever bounds are enabled for this parameter
   *
   * @param candidate Value to check
   * @return The candidate, or the bound it crossed
   */
  public double clamp(double candidate) {
    if (lowerLimited && candidate < lowerBound) {
      return lowerBound;
    }
    if (upperLimited && candidate > upperBound) {
      return upperBound;
    }
    return candidate;
  }

  @Override
  public String toString() {
    return getDisplayName() + "=" + value + " +/- " + error + (fixed ? " (fixed)" : "");
  }
}
