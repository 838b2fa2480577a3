package gov.nih.ncats.jigsaw.internal.algo;

import java.awt.Color;
import java.awt.Point;
import java.util.List;

import gov.nih.ncats.jigsaw.internal.image.Piece;

/**
 * Colors sampled along a stretch of contour, as HSV triples on the
 * 8-bit scale (hue 0-179, saturation and value 0-255).
 */
public final class ColorProfile {

	/**
	 * distance between the two contour points whose chord sets the
	 * sampling direction
	 */
	static final int CHORD = 3;

	private final int[][] hsv;

	private ColorProfile(int[][] hsv){
		this.hsv = hsv;
	}

	/**
	 * For every point of the stretch, sample the two pixels one step off
	 * the contour on either side, perpendicular to the chord reaching
	 * {@value #CHORD} points ahead. The two samples are added channel by
	 * channel, clamped to 255, and converted to HSV. Background outside the
	 * piece reads as black, so the sum is the inside color.
	 */
	public static ColorProfile sample(Piece piece, List<Point> points){
		int n = Math.max(0, points.size() - CHORD);
		int[][] hsv = new int[n][];
		float[] buf = new float[3];
		for(int i=0;i<n;i++){
			Point p = points.get(i);
			Point q = points.get(i + CHORD);
			int dx = q.x - p.x, dy = q.y - p.y;
			int left = piece.getRGB(p.x + dy, p.y - dx);
			int right = piece.getRGB(p.x - dy, p.y + dx);
			int r = Math.min(255, ((left >> 16) & 0xff) + ((right >> 16) & 0xff));
			int g = Math.min(255, ((left >> 8) & 0xff) + ((right >> 8) & 0xff));
			int b = Math.min(255, (left & 0xff) + (right & 0xff));
			hsv[i] = toHsv(r, g, b, buf);
		}
		return new ColorProfile(hsv);
	}

	static int[] toHsv(int r, int g, int b, float[] buf){
		Color.RGBtoHSB(r, g, b, buf);
		return new int[]{
				Math.round(buf[0] * 180) % 180,
				Math.round(buf[1] * 255),
				Math.round(buf[2] * 255)};
	}

	public int size(){
		return hsv.length;
	}

	public int[] get(int i){
		return hsv[i].clone();
	}

	public ColorProfile reversed(){
		int[][] r = new int[hsv.length][];
		for(int i=0;i<hsv.length;i++){
			r[i] = hsv[hsv.length - 1 - i];
		}
		return new ColorProfile(r);
	}

	/**
	 * Warping distance between this profile and another. Two sides of a
	 * real joint run in opposite directions, so callers compare against the
	 * {@link #reversed()} profile of the other piece.
	 */
	public double distance(ColorProfile other){
		return DynamicTimeWarping.distance(hsv, other.hsv);
	}
}
