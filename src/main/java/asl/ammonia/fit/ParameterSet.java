package asl.ammonia.fit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * Full set of fit parameters for a multi-component ammonia fit. The set is laid out as
 * consecutive groups, one per velocity component, each holding the same canonical parameters in
 * the same order.
 *
 * Every per-parameter array handed to the {@link Builder} is brought to full length
 * (parameters per component times component count) in one of three ways, recorded as an
 * {@link ArrayResolution}: used as-is when already full length, tiled when it covers exactly one
 * component, and otherwise rebuilt from the defaults of each parameter name. The last case is
 * lenient on purpose so that fits with many components can be set up from a single component's
 * worth of settings; it is logged at WARN level when it discards data the caller supplied.
 */
public class ParameterSet implements Iterable<ParameterInfo> {

  private static final Logger logger = Logger.getLogger(ParameterSet.class);

  /**
   * The per-parameter arrays a parameter set is assembled from
   */
  public enum ParameterArray {
    VALUES, NAMES, FIXED, LOWER_LIMITED, UPPER_LIMITED, LOWER_BOUNDS, UPPER_BOUNDS
  }

  private final List<ParameterInfo> parameters;
  private final int componentCount;
  private final int parametersPerComponent;
  private final Map<ParameterArray, ArrayResolution> resolutions;

  private ParameterSet(List<ParameterInfo> parameters, int componentCount,
      int parametersPerComponent, Map<ParameterArray, ArrayResolution> resolutions) {
    this.parameters = parameters;
    this.componentCount = componentCount;
    this.parametersPerComponent = parametersPerComponent;
    this.resolutions = resolutions;
  }

  /**
   * @return Builder whose canonical parameters are tkin, tex, ntot, width, xoff_v, fortho
   */
  public static Builder builder() {
    return new Builder(ParameterName.defaultOrder());
  }

  /**
   * @param canonicalNames Parameters making up a single component, in order
   * @return Builder for sets using those parameters
   */
  public static Builder builder(ParameterName... canonicalNames) {
    return new Builder(canonicalNames.clone());
  }

  public int size() {
    return parameters.size();
  }

  public ParameterInfo get(int index) {
    return parameters.get(index);
  }

  public int getComponentCount() {
    return componentCount;
  }

  public int getParametersPerComponent() {
    return parametersPerComponent;
  }

  /**
   * @param array Which input array to query
   * @return How that array was brought to full length
   */
  public ArrayResolution getResolution(ParameterArray array) {
    return resolutions.get(array);
  }

  /**
   * @param component Index of the velocity component
   * @return Read-only view of the parameters belonging to that component
   */
  public List<ParameterInfo> getComponent(int component) {
    int from = component * parametersPerComponent;
    return Collections.unmodifiableList(
        parameters.subList(from, from + parametersPerComponent));
  }

  /**
   * @return Read-only view of every parameter, in order
   */
  public List<ParameterInfo> getParameters() {
    return Collections.unmodifiableList(parameters);
  }

  /**
   * @return Current values of all parameters as a new array
   */
  public double[] getValues() {
    double[] values = new double[parameters.size()];
    for (int i = 0; i < values.length; ++i) {
      values[i] = parameters.get(i).getValue();
    }
    return values;
  }

  /**
   * @return Current errors of all parameters as a new array
   */
  public double[] getErrors() {
    double[] errors = new double[parameters.size()];
    for (int i = 0; i < errors.length; ++i) {
      errors[i] = parameters.get(i).getError();
    }
    return errors;
  }

  public ParameterName[] getNames() {
    ParameterName[] names = new ParameterName[parameters.size()];
    for (int i = 0; i < names.length; ++i) {
      names[i] = parameters.get(i).getName();
    }
    return names;
  }

  public String[] getDisplayNames() {
    String[] names = new String[parameters.size()];
    for (int i = 0; i < names.length; ++i) {
      names[i] = parameters.get(i).getDisplayName();
    }
    return names;
  }

  @Override
  public Iterator<ParameterInfo> iterator() {
    return getParameters().iterator();
  }

  /**
   * Collects the per-parameter arrays of a fit and expands them to one entry per parameter of
   * every component. Arrays not given are treated as unusable and rebuilt from defaults.
   */
  public static final class Builder {

    private final ParameterName[] canonicalNames;
    private double[] values;
    private ParameterName[] names;
    private boolean[] fixed;
    private boolean[] lowerLimited;
    private boolean[] upperLimited;
    private double[] lowerBounds;
    private double[] upperBounds;
    private int componentCount = 0;

    private Builder(ParameterName[] canonicalNames) {
      if (canonicalNames.length == 0) {
        throw new IllegalArgumentException("A component needs at least one parameter");
      }
      this.canonicalNames = canonicalNames;
    }

    public Builder values(double... values) {
      this.values = values;
      return this;
    }

    public Builder names(ParameterName... names) {
      this.names = names;
      return this;
    }

    public Builder fixed(boolean... fixed) {
      this.fixed = fixed;
      return this;
    }

    public Builder lowerLimited(boolean... lowerLimited) {
      this.lowerLimited = lowerLimited;
      return this;
    }

    public Builder upperLimited(boolean... upperLimited) {
      this.upperLimited = upperLimited;
      return this;
    }

    public Builder lowerBounds(double... lowerBounds) {
      this.lowerBounds = lowerBounds;
      return this;
    }

    public Builder upperBounds(double... upperBounds) {
      this.upperBounds = upperBounds;
      return this;
    }

    /**
     * @param componentCount Number of velocity components; zero or less to infer it from the
     * length of the values array
     * @return this builder
     */
    public Builder componentCount(int componentCount) {
      this.componentCount = componentCount;
      return this;
    }

    public ParameterSet build() {
      int perComponent = canonicalNames.length;
      int count = componentCount;
      // more values than the requested components can hold means more components are wanted
      if (values != null && values.length % perComponent == 0
          && (count <= 0 || values.length / perComponent > count)) {
        count = values.length / perComponent;
      }
      if (count <= 0) {
        count = 1;
      }
      final int total = perComponent * count;

      Map<ParameterArray, ArrayResolution> resolutions = new EnumMap<>(ParameterArray.class);

      ParameterName[] fullNames = new ParameterName[total];
      ArrayResolution nameResolution =
          resolve(ParameterArray.NAMES, names == null ? -1 : names.length, perComponent, total);
      for (int i = 0; i < total; ++i) {
        if (nameResolution == ArrayResolution.PROVIDED) {
          fullNames[i] = names[i];
        } else if (nameResolution == ArrayResolution.REPLICATED) {
          fullNames[i] = names[i % perComponent];
        } else {
          fullNames[i] = canonicalNames[i % perComponent];
        }
      }
      resolutions.put(ParameterArray.NAMES, nameResolution);

      double[] fullValues = new double[total];
      ArrayResolution valueResolution = expandDoubles(ParameterArray.VALUES, values, fullValues,
          fullNames, perComponent, DoubleDefault.VALUE);
      resolutions.put(ParameterArray.VALUES, valueResolution);

      double[] fullLower = new double[total];
      resolutions.put(ParameterArray.LOWER_BOUNDS, expandDoubles(ParameterArray.LOWER_BOUNDS,
          lowerBounds, fullLower, fullNames, perComponent, DoubleDefault.LOWER_BOUND));

      double[] fullUpper = new double[total];
      resolutions.put(ParameterArray.UPPER_BOUNDS, expandDoubles(ParameterArray.UPPER_BOUNDS,
          upperBounds, fullUpper, fullNames, perComponent, DoubleDefault.UPPER_BOUND));

      boolean[] fullFixed = new boolean[total];
      resolutions.put(ParameterArray.FIXED, expandBooleans(ParameterArray.FIXED, fixed,
          fullFixed, fullNames, perComponent, BooleanDefault.FIXED));

      boolean[] fullLowerLimited = new boolean[total];
      resolutions.put(ParameterArray.LOWER_LIMITED, expandBooleans(ParameterArray.LOWER_LIMITED,
          lowerLimited, fullLowerLimited, fullNames, perComponent, BooleanDefault.LOWER_LIMITED));

      boolean[] fullUpperLimited = new boolean[total];
      resolutions.put(ParameterArray.UPPER_LIMITED, expandBooleans(ParameterArray.UPPER_LIMITED,
          upperLimited, fullUpperLimited, fullNames, perComponent, BooleanDefault.UPPER_LIMITED));

      List<ParameterInfo> infos = new ArrayList<>(total);
      for (int i = 0; i < total; ++i) {
        ParameterName name = fullNames[i];
        infos.add(new ParameterInfo(i, i / perComponent, name, fullValues[i], fullFixed[i],
            fullLowerLimited[i], fullUpperLimited[i], fullLower[i], fullUpper[i],
            name.getMaxStep()));
      }

      return new ParameterSet(infos, count, perComponent, resolutions);
    }

    private static ArrayResolution resolve(ParameterArray array, int length, int perComponent,
        int total) {
      if (length == total) {
        return ArrayResolution.PROVIDED;
      }
      if (length == perComponent) {
        return ArrayResolution.REPLICATED;
      }
      if (length >= 0) {
        logger.warn(array + " has " + length + " entries but " + total + " (or "
            + perComponent + " to replicate) were expected; resetting to defaults");
      }
      return ArrayResolution.DEFAULT_RESET;
    }

    private static ArrayResolution expandDoubles(ParameterArray array, double[] given,
        double[] target, ParameterName[] fullNames, int perComponent, DoubleDefault policy) {
      ArrayResolution resolution =
          resolve(array, given == null ? -1 : given.length, perComponent, target.length);
      for (int i = 0; i < target.length; ++i) {
        switch (resolution) {
          case PROVIDED:
            target[i] = given[i];
            break;
          case REPLICATED:
            target[i] = given[i % perComponent];
            break;
          default:
            target[i] = policy.valueFor(fullNames[i]);
        }
      }
      return resolution;
    }

    private static ArrayResolution expandBooleans(ParameterArray array, boolean[] given,
        boolean[] target, ParameterName[] fullNames, int perComponent, BooleanDefault policy) {
      ArrayResolution resolution =
          resolve(array, given == null ? -1 : given.length, perComponent, target.length);
      for (int i = 0; i < target.length; ++i) {
        switch (resolution) {
          case PROVIDED:
            target[i] = given[i];
            break;
          case REPLICATED:
            target[i] = given[i % perComponent];
            break;
          default:
            target[i] = policy.valueFor(fullNames[i]);
        }
      }
      return resolution;
    }
  }

  private enum DoubleDefault {
    VALUE, LOWER_BOUND, UPPER_BOUND;

    double valueFor(ParameterName name) {
      switch (this) {
        case LOWER_BOUND:
          return name.getDefaultLowerBound();
        case UPPER_BOUND:
          return name.getDefaultUpperBound();
        default:
          return name.getDefaultValue();
      }
    }
  }

  private enum BooleanDefault {
    FIXED, LOWER_LIMITED, UPPER_LIMITED;

    boolean valueFor(ParameterName name) {
      switch (this) {
        case LOWER_LIMITED:
          return name.isLowerLimitedByDefault();
        case UPPER_LIMITED:
          return name.isUpperLimitedByDefault();
        default:
          return false;
      }
    }
  }
}
