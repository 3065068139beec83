package asl.ammonia.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Small numeric helpers shared by the fitter and its reports
 */
public class NumericUtils {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.####");
        setInfinityPrintable(format);
        return format;
      });

  public static final ThreadLocal<DecimalFormat> SCIENTIFIC_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("0.####E0");
        setInfinityPrintable(format);
        return format;
      });

  private NumericUtils() {
  }

  /**
   * Sets a DecimalFormat's infinity symbol to "Inf." for plain-text output
   *
   * @param df DecimalFormat to modify
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }

  /**
   * Format a value with the plain decimal format unless it is very large or very small, in which
   * case scientific notation is used (column densities, tiny errors)
   *
   * @param value Number to format
   * @return Formatted string
   */
  public static String formatValue(double value) {
    double magnitude = Math.abs(value);
    if (magnitude != 0. && !Double.isInfinite(magnitude)
        && (magnitude >= 1E5 || magnitude < 1E-3)) {
      return SCIENTIFIC_FORMAT.get().format(value);
    }
    return DECIMAL_FORMAT.get().format(value);
  }

  /**
   * Element-wise difference of two equal-length arrays
   *
   * @param minuend Values subtracted from
   * @param subtrahend Values to subtract
   * @return New array holding minuend[i] - subtrahend[i]
   */
  public static double[] subtract(double[] minuend, double[] subtrahend) {
    if (minuend.length != subtrahend.length) {
      throw new IllegalArgumentException("Cannot subtract arrays of length "
          + subtrahend.length + " from length " + minuend.length);
    }
    double[] difference = new double[minuend.length];
    for (int i = 0; i < difference.length; ++i) {
      difference[i] = minuend[i] - subtrahend[i];
    }
    return difference;
  }

  /**
   * @param values Data to evaluate
   * @return Root-mean-square of the data, 0 for an empty array
   */
  public static double rootMeanSquare(double[] values) {
    if (values.length == 0) {
      return 0.;
    }
    DescriptiveStatistics stats = new DescriptiveStatistics(values);
    return Math.sqrt(stats.getSumsq() / stats.getN());
  }
}
