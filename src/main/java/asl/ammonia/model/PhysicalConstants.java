package asl.ammonia.model;

/**
 * CGS constants used by the ammonia model.
 */
public final class PhysicalConstants {

  /**
   * Speed of light (km/s)
   */
  public static final double SPEED_OF_LIGHT_KMS = 2.99792458E5;

  /**
   * Speed of light (cm/s)
   */
  public static final double SPEED_OF_LIGHT_CMS = SPEED_OF_LIGHT_KMS * 1E5;

  /**
   * Planck constant (erg s)
   */
  public static final double PLANCK = 6.6260693E-27;

  /**
   * Boltzmann constant (erg/K)
   */
  public static final double BOLTZMANN = 1.3806505E-16;

  /**
   * Cosmic microwave background temperature (K)
   */
  public static final double T_CMB = 2.73;

  private PhysicalConstants() {
  }
}
