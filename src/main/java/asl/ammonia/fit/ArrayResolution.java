package asl.ammonia.fit;

/**
 * How a per-parameter array given to {@link ParameterSet} was brought to full length.
 */
public enum ArrayResolution {
  /**
   * Already one entry per parameter of every component; used unchanged
   */
  PROVIDED,
  /**
   * One entry per parameter of a single component; tiled once per component
   */
  REPLICATED,
  /**
   * Missing or of an unusable length; rebuilt from the per-parameter defaults
   */
  DEFAULT_RESET
}
