package sapling.tree;

import java.text.DecimalFormat;

public class Utils {

  /** Scores closer than this are treated as equal when picking a split. */
  public static final double EPSILON = 1e-12;

  /** Logarithm of x in the given base. */
  public static double log(double x, double base) {
    return Math.log(x) / Math.log(base);
  }

  /** The entropy term -p*log_base(p), defined as 0 at p=0. */
  public static double plogp(double p, double base) {
    return (p <= 0) ? 0 : -p * log(p, base);
  }

  /** Entropy of a boolean variable that is true with probability q.
   * B(0) = B(1) = 0, B(0.5) = 1. */
  public static double binaryEntropy(double q) {
    if( q <= 0 || q >= 1 ) return 0;
    return plogp(q, 2) + plogp(1 - q, 2);
  }

  /** Entropy of the given class counts, in the given logarithm base. */
  public static double entropy(int[] counts, double base) {
    int total = sum(counts);
    if( total == 0 ) return 0;
    double result = 0;
    for( int c : counts ) result += plogp(c / (double) total, base);
    return result;
  }

  public static int sum(int[] from) {
    int result = 0;
    for (int d: from) result += d;
    return result;
  }

  /** Index of the largest value; the first one wins a tie. */
  public static int maxIndex(double[] from) {
    int result = 0;
    for (int i = 1; i<from.length; ++i)
      if (from[i] > from[result] + EPSILON) result = i;
    return result;
  }

  // ---------------------------------------------------------------------------
  // Chi-squared distribution

  private static final double[] LANCZOS = {
    76.18009172947146, -86.50532032941677, 24.01409824083091,
    -1.231739572450155, 0.1208650973866179e-2, -0.5395239384953e-5 };

  /** Natural log of the gamma function, Lanczos approximation (x > 0). */
  public static double lnGamma(double x) {
    double y = x, tmp = x + 5.5;
    tmp -= (x + 0.5) * Math.log(tmp);
    double ser = 1.000000000190015;
    for( double c : LANCZOS ) ser += c / ++y;
    return -tmp + Math.log(2.5066282746310005 * ser / x);
  }

  private static final int ITMAX = 500;
  private static final double EPS = 1e-15;
  private static final double FPMIN = 1e-300;

  /** Regularized upper incomplete gamma function Q(a, x). */
  public static double gammaQ(double a, double x) {
    if( x < 0 || a <= 0 ) throw new IllegalArgumentException("gammaQ(" + a + "," + x + ")");
    if( x == 0 ) return 1;
    return (x < a + 1) ? 1 - gammaSeries(a, x) : gammaContinuedFraction(a, x);
  }

  // P(a,x) by its series representation
  private static double gammaSeries(double a, double x) {
    double ap = a, sum = 1 / a, del = sum;
    for( int n = 0; n < ITMAX; n++ ) {
      del *= x / ++ap;
      sum += del;
      if( Math.abs(del) < Math.abs(sum) * EPS ) break;
    }
    return sum * Math.exp(-x + a * Math.log(x) - lnGamma(a));
  }

  // Q(a,x) by its continued fraction (modified Lentz)
  private static double gammaContinuedFraction(double a, double x) {
    double b = x + 1 - a, c = 1 / FPMIN, d = 1 / b, h = d;
    for( int i = 1; i <= ITMAX; i++ ) {
      double an = -i * (i - a);
      b += 2;
      d = an * d + b;
      if( Math.abs(d) < FPMIN ) d = FPMIN;
      c = b + an / c;
      if( Math.abs(c) < FPMIN ) c = FPMIN;
      d = 1 / d;
      double del = d * c;
      h *= del;
      if( Math.abs(del - 1) < EPS ) break;
    }
    return Math.exp(-x + a * Math.log(x) - lnGamma(a)) * h;
  }

  /** Probability that a chi-squared variable with df degrees of freedom is at
   * least x. Zero degrees of freedom carry no evidence, the result is 1. */
  public static double chiSquaredSurvival(double x, int df) {
    if( df <= 0 ) return 1;
    if( x <= 0 ) return 1;
    return gammaQ(df / 2.0, x / 2.0);
  }

  public static String p2d(double d) { return df.format(d); }
  static final DecimalFormat df = new  DecimalFormat ("0.##");
  public static String p5d(double d) { return df5.format(d); }
  static final DecimalFormat df5 = new  DecimalFormat ("0.#####");
}
