package arbor.stats;

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

/**
 * Estimates distance as (1 - r) / 2 where r is the Pearson correlation of the flattened
 * matrices: perfectly correlated matrices score 0 and perfectly anti-correlated ones 1.
 */
public class DistanceFromR implements MatrixDistance {

	public double distance(double[][] m1, double[][] m2) {
		return (1.0 - correlation(m1, m2)) / 2.0;
	}

	/**
	 * @return Pearson correlation coefficient of the cells of m1 and m2, read row by row
	 */
	public static double correlation(double[][] m1, double[][] m2) {
		double[] x = flatten(m1);
		double[] y = flatten(m2);
		Validate.isTrue(x.length == y.length, "matrices differ in size: %d vs %d", x.length, y.length);
		return new PearsonsCorrelation().correlation(x, y);
	}

	static double[] flatten(double[][] m) {
		int size = 0;
		for (int i = 0; i < m.length; i++) {
			size += m[i].length;
		}
		double[] flat = new double[size];
		int k = 0;
		for (int i = 0; i < m.length; i++) {
			System.arraycopy(m[i], 0, flat, k, m[i].length);
			k += m[i].length;
		}
		return flat;
	}
}
