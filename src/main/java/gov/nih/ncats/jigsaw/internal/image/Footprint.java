package gov.nih.ncats.jigsaw.internal.image;

import java.awt.Point;
import java.awt.Rectangle;
import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

import gov.nih.ncats.jigsaw.Placement;

/**
 * Set of occupied pixels in absolute (assembly) coordinates. Immutable;
 * combining footprints returns new ones.
 */
public final class Footprint {

	/**
	 * Receives every absolute pixel covered by a placed piece together
	 * with the tile pixel it was sampled from.
	 */
	public interface PixelVisitor {
		void visit(int x, int y, int tileX, int tileY);
	}

	private static final Footprint EMPTY = new Footprint(new Rectangle(), new BitSet());

	private final Rectangle bounds;
	private final BitSet bits;
	private final int count;

	private Footprint(Rectangle bounds, BitSet bits){
		this.bounds = bounds;
		this.bits = bits;
		this.count = bits.cardinality();
	}

	public static Footprint empty(){
		return EMPTY;
	}

	/**
	 * Walk the absolute pixels covered by a piece at the given placement.
	 * Each candidate pixel is mapped back into the tile and rounded to the
	 * nearest tile pixel; it is covered when that tile pixel is opaque.
	 */
	public static void rasterize(Piece piece, Placement placement, PixelVisitor visitor){
		Rectangle area = placedBounds(piece, placement);
		double[] m = new double[6];
		placement.toInverseTransform(piece.getLocalCenter()).getMatrix(m);
		for (int y = area.y; y < area.y + area.height; ++y) {
			for (int x = area.x; x < area.x + area.width; ++x) {
				double lx = m[0] * x + m[2] * y + m[4];
				double ly = m[1] * x + m[3] * y + m[5];
				int sx = (int) Math.floor(lx + 0.5);
				int sy = (int) Math.floor(ly + 0.5);
				if (piece.isOn(sx, sy)) {
					visitor.visit(x, y, sx, sy);
				}
			}
		}
	}

	/**
	 * Integer box which contains the piece at the given placement, with
	 * one pixel of margin.
	 */
	static Rectangle placedBounds(Piece piece, Placement placement){
		Rectangle ob = piece.getOpaqueBounds();
		int x0 = ob.x, y0 = ob.y, x1 = ob.x + ob.width - 1, y1 = ob.y + ob.height - 1;
		AffineTransform at = placement.toTransform(piece.getLocalCenter());
		double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
		double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
		for (int[] c : new int[][]{{x0, y0}, {x1, y0}, {x0, y1}, {x1, y1}}) {
			Point2D p = at.transform(new Point2D.Double(c[0], c[1]), null);
			minX = Math.min(minX, p.getX());
			maxX = Math.max(maxX, p.getX());
			minY = Math.min(minY, p.getY());
			maxY = Math.max(maxY, p.getY());
		}
		int left = (int) Math.floor(minX) - 1;
		int top = (int) Math.floor(minY) - 1;
		int right = (int) Math.ceil(maxX) + 1;
		int bottom = (int) Math.ceil(maxY) + 1;
		return new Rectangle(left, top, right - left + 1, bottom - top + 1);
	}

	public static Footprint of(Piece piece, Placement placement){
		Rectangle area = placedBounds(piece, placement);
		BitSet bits = new BitSet(area.width * area.height);
		rasterize(piece, placement, (x, y, sx, sy) -> bits.set((y - area.y) * area.width + (x - area.x)));
		return new Footprint(area, bits);
	}

	public boolean contains(int x, int y){
		if (!bounds.contains(x, y)) {
			return false;
		}
		return bits.get((y - bounds.y) * bounds.width + (x - bounds.x));
	}

	public int count(){
		return count;
	}

	public boolean isEmpty(){
		return count == 0;
	}

	public Rectangle getBounds(){
		return new Rectangle(bounds);
	}

	/**
	 * Number of pixels set in both footprints.
	 */
	public int overlap(Footprint other){
		if (isEmpty() || other.isEmpty() || !bounds.intersects(other.bounds)) {
			return 0;
		}
		Footprint small = count <= other.count ? this : other;
		Footprint large = small == this ? other : this;
		int n = 0;
		for (int i = small.bits.nextSetBit(0); i >= 0; i = small.bits.nextSetBit(i + 1)) {
			if (large.contains(small.bounds.x + i % small.bounds.width, small.bounds.y + i / small.bounds.width)) {
				n++;
			}
		}
		return n;
	}

	public Footprint union(Footprint other){
		if (other.isEmpty()) {
			return this;
		}
		if (isEmpty()) {
			return other;
		}
		Rectangle area = bounds.union(other.bounds);
		BitSet merged = new BitSet(area.width * area.height);
		copyInto(area, merged);
		other.copyInto(area, merged);
		return new Footprint(area, merged);
	}

	private void copyInto(Rectangle area, BitSet target){
		for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
			int x = bounds.x + i % bounds.width;
			int y = bounds.y + i / bounds.width;
			target.set((y - area.y) * area.width + (x - area.x));
		}
	}

	/**
	 * Total Euclidean length of the outer boundaries of all 8-connected
	 * components. Holes do not contribute.
	 */
	public double outerBoundaryLength(){
		BitSet seen = new BitSet(bits.size());
		double total = 0;
		int w = bounds.width;
		Deque<Integer> stack = new ArrayDeque<Integer>();
		for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
			if (seen.get(i)) {
				continue;
			}
			//raster order makes i the first pixel of a new component
			Point start = new Point(bounds.x + i % w, bounds.y + i / w);
			seen.set(i);
			stack.push(i);
			while (!stack.isEmpty()) {
				int c = stack.pop();
				int cx = bounds.x + c % w, cy = bounds.y + c / w;
				for (ContourTracer.ChainCode d : ContourTracer.ChainCode.values()) {
					int nx = cx + d.dx(), ny = cy + d.dy();
					if (contains(nx, ny)) {
						int j = (ny - bounds.y) * w + (nx - bounds.x);
						if (!seen.get(j)) {
							seen.set(j);
							stack.push(j);
						}
					}
				}
			}
			total += ContourTracer.length(ContourTracer.trace(this::contains, start));
		}
		return total;
	}

	@Override
	public String toString() {
		return "Footprint{bounds=" + bounds + ", count=" + count + "}";
	}
}
