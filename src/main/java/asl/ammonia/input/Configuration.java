package asl.ammonia.input;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Solver settings for ammonia fits, read from an XML file. These are the limits and tolerances
 * handed to the Levenberg-Marquardt optimizer, the relative step used for its finite-difference
 * Jacobian and the singularity threshold used when inverting the covariance matrix.
 *
 * The file is looked up first as a path and then on the classpath; if it cannot be read the
 * defaults below are used and the failure is logged.
 */
public class Configuration {

  public static final String DEFAULT_CONFIG_PATH = "ammonia-fit-config.xml";

  private static final Logger logger = Logger.getLogger(Configuration.class);

  private static Configuration instance;

  private String loadedConfigPath = null;

  private int maxIterations = 1000;
  private int maxEvaluations = 10000;
  private double costRelativeTolerance = 1E-10;
  private double parameterRelativeTolerance = 1E-10;
  private double orthoTolerance = 1E-10;
  private double jacobianStep = 1.5E-8;
  private double covarianceThreshold = 1E-14;

  private Configuration() {
  }

  private Configuration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      maxIterations = config.getInt("Solver.MaxIterations", maxIterations);
      maxEvaluations = config.getInt("Solver.MaxEvaluations", maxEvaluations);
      costRelativeTolerance =
          config.getDouble("Solver.CostRelativeTolerance", costRelativeTolerance);
      parameterRelativeTolerance =
          config.getDouble("Solver.ParameterRelativeTolerance", parameterRelativeTolerance);
      orthoTolerance = config.getDouble("Solver.OrthoTolerance", orthoTolerance);
      jacobianStep = config.getDouble("Solver.JacobianStep", jacobianStep);
      covarianceThreshold = config.getDouble("Solver.CovarianceThreshold", covarianceThreshold);

      loadedConfigPath = configLocation;
      logger.info("Successfully loaded in configuration: " + configLocation);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  /**
   * Gets the current instance of the configuration, or creates one from the default file if none
   * exists
   *
   * @return the current configuration instance
   */
  public static synchronized Configuration getInstance() {
    return getInstance(DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists.
   *
   * @param configLocation Configuration file location to read from
   * @return the current configuration instance
   */
  public static synchronized Configuration getInstance(String configLocation) {
    if (instance == null) {
      instance = new Configuration(configLocation);
    }
    return instance;
  }

  /**
   * Read a configuration from a file without touching the shared instance
   *
   * @param configLocation Configuration file location to read from
   * @return New configuration, holding defaults for anything the file does not set
   */
  public static Configuration load(String configLocation) {
    return new Configuration(configLocation);
  }

  /**
   * @return New configuration holding only the built-in defaults
   */
  public static Configuration withDefaults() {
    return new Configuration();
  }

  /**
   * @return Location the configuration was read from, or null if the defaults are in use
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * The property is defined from Solver.MaxIterations
   *
   * @return Iteration limit for the optimizer
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  /**
   * The property is defined from Solver.MaxEvaluations
   *
   * @return Limit on residual function evaluations
   */
  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public void setMaxEvaluations(int maxEvaluations) {
    this.maxEvaluations = maxEvaluations;
  }

  public double getCostRelativeTolerance() {
    return costRelativeTolerance;
  }

  public void setCostRelativeTolerance(double costRelativeTolerance) {
    this.costRelativeTolerance = costRelativeTolerance;
  }

  public double getParameterRelativeTolerance() {
    return parameterRelativeTolerance;
  }

  public void setParameterRelativeTolerance(double parameterRelativeTolerance) {
    this.parameterRelativeTolerance = parameterRelativeTolerance;
  }

  public double getOrthoTolerance() {
    return orthoTolerance;
  }

  public void setOrthoTolerance(double orthoTolerance) {
    this.orthoTolerance = orthoTolerance;
  }

  /**
   * The property is defined from Solver.JacobianStep
   *
   * @return Relative step used for forward-difference derivatives
   */
  public double getJacobianStep() {
    return jacobianStep;
  }

  public void setJacobianStep(double jacobianStep) {
    this.jacobianStep = jacobianStep;
  }

  /**
   * The property is defined from Solver.CovarianceThreshold
   *
   * @return Singularity threshold used when inverting the normal matrix for parameter errors
   */
  public double getCovarianceThreshold() {
    return covarianceThreshold;
  }

  public void setCovarianceThreshold(double covarianceThreshold) {
    this.covarianceThreshold = covarianceThreshold;
  }
}
