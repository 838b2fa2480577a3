package gov.nih.ncats.jigsaw.internal.algo;

import java.util.Arrays;

/**
 * Dynamic time warping over sequences of integer vectors with an L1
 * local cost.
 */
public final class DynamicTimeWarping {

	private DynamicTimeWarping(){
		//can not instantiate
	}

	/**
	 * @return the minimal accumulated cost of aligning <code>a</code> with
	 * <code>b</code>, 0 for two empty sequences and infinity when only
	 * one of them is empty.
	 */
	public static double distance(int[][] a, int[][] b){
		int n = a.length, m = b.length;
		double[] prev = new double[m + 1];
		double[] cur = new double[m + 1];
		Arrays.fill(prev, Double.POSITIVE_INFINITY);
		prev[0] = 0;
		for(int i=1;i<=n;i++){
			Arrays.fill(cur, Double.POSITIVE_INFINITY);
			for(int j=1;j<=m;j++){
				double d = cost(a[i-1], b[j-1]);
				cur[j] = d + Math.min(prev[j], Math.min(cur[j-1], prev[j-1]));
			}
			double[] t = prev;
			prev = cur;
			cur = t;
		}
		return prev[m];
	}

	static double cost(int[] x, int[] y){
		int d = 0;
		for(int k=0;k<Math.min(x.length, y.length);k++){
			d += Math.abs(x[k] - y[k]);
		}
		return d;
	}
}
