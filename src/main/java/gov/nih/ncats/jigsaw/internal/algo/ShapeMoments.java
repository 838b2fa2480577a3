package gov.nih.ncats.jigsaw.internal.algo;

import java.awt.Point;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Hu's seven moment invariants of a set of pixels and the
 * log-scale distance between two such descriptors.
 */
public final class ShapeMoments {

	/**
	 * Every pixel is weighted as a full 8-bit stroke.
	 */
	private static final double INTENSITY = 255.0;

	/**
	 * Invariants with a magnitude below this are ignored when comparing.
	 */
	private static final double NEGLIGIBLE = 1e-5;

	private ShapeMoments(){
		//can not instantiate
	}

	public static double[] huMoments(Collection<Point> pixels){
		Set<Point> px = new LinkedHashSet<Point>(pixels);
		if(px.isEmpty()){
			throw new IllegalArgumentException("no pixels");
		}
		double m00 = INTENSITY * px.size();
		double m10 = 0, m01 = 0;
		for(Point p : px){
			m10 += p.x;
			m01 += p.y;
		}
		double xc = INTENSITY * m10 / m00;
		double yc = INTENSITY * m01 / m00;

		double mu20 = 0, mu02 = 0, mu11 = 0, mu30 = 0, mu03 = 0, mu21 = 0, mu12 = 0;
		for(Point p : px){
			double dx = p.x - xc, dy = p.y - yc;
			mu20 += dx*dx;
			mu02 += dy*dy;
			mu11 += dx*dy;
			mu30 += dx*dx*dx;
			mu03 += dy*dy*dy;
			mu21 += dx*dx*dy;
			mu12 += dx*dy*dy;
		}
		double s2 = Math.pow(m00, 2.0);
		double s3 = Math.pow(m00, 2.5);
		double n20 = INTENSITY*mu20/s2, n02 = INTENSITY*mu02/s2, n11 = INTENSITY*mu11/s2;
		double n30 = INTENSITY*mu30/s3, n03 = INTENSITY*mu03/s3;
		double n21 = INTENSITY*mu21/s3, n12 = INTENSITY*mu12/s3;

		double t0 = n30 + n12, t1 = n21 + n03;
		double q0 = n30 - 3*n12, q1 = 3*n21 - n03;

		double[] h = new double[7];
		h[0] = n20 + n02;
		h[1] = (n20 - n02)*(n20 - n02) + 4*n11*n11;
		h[2] = q0*q0 + q1*q1;
		h[3] = t0*t0 + t1*t1;
		h[4] = q0*t0*(t0*t0 - 3*t1*t1) + q1*t1*(3*t0*t0 - t1*t1);
		h[5] = (n20 - n02)*(t0*t0 - t1*t1) + 4*n11*t0*t1;
		h[6] = q1*t0*(t0*t0 - 3*t1*t1) - q0*t1*(3*t0*t0 - t1*t1);
		return h;
	}

	/**
	 * Sum over the invariants of |1/m_a - 1/m_b| with
	 * m = sign(h) * log10|h|. Invariants that are negligible on
	 * either side are skipped. 0 means identical shapes.
	 */
	public static double distance(double[] a, double[] b){
		double r = 0;
		for(int i=0;i<Math.min(a.length, b.length);i++){
			double ama = Math.abs(a[i]), amb = Math.abs(b[i]);
			if(ama > NEGLIGIBLE && amb > NEGLIGIBLE){
				double ma = Math.signum(a[i]) * Math.log10(ama);
				double mb = Math.signum(b[i]) * Math.log10(amb);
				r += Math.abs(-1.0/ma + 1.0/mb);
			}
		}
		return r;
	}
}
