package gov.nih.ncats.jigsaw.internal.image;

import java.awt.Point;
import java.util.ArrayList;
import java.util.List;

/**
 * Moore-neighbour tracing of the outer boundary of an 8-connected
 * region.
 */
public final class ContourTracer {

	/**
	 * Tells which pixels belong to the region. Anything outside the
	 * image must answer false.
	 */
	public interface Mask {
		boolean isOn(int x, int y);
	}

	/**
	 * Neighbour directions in clockwise order as seen on screen
	 * (image y grows downwards).
	 */
	public enum ChainCode {
		E (1, 0),
		SE (1, 1),
		S (0, 1),
		SW (-1, 1),
		W (-1, 0),
		NW (-1, -1),
		N (0, -1),
		NE (1, -1);

		final int dx, dy;
		final double len;

		ChainCode (int dx, int dy) {
			this.dx = dx;
			this.dy = dy;
			len = Math.sqrt(dx*dx + dy*dy);
		}

		public int dx () {
			return dx;
		}

		public int dy () {
			return dy;
		}

		public double length () {
			return len;
		}

		public ChainCode rotate (int steps) {
			return values()[Math.floorMod(ordinal() + steps, 8)];
		}

		public boolean isDiagonal () {
			return dx != 0 && dy != 0;
		}

		/**
		 * Where to resume the neighbour search after stepping in this
		 * direction.
		 */
		ChainCode backtrack () {
			return isDiagonal() ? rotate(5) : rotate(6);
		}
	}

	private ContourTracer(){
		//can not instantiate
	}

	/**
	 * Trace the outer boundary of the region containing <code>start</code>.
	 * The start must be the first pixel of its region in raster order
	 * (lowest y, then lowest x), so its west neighbour is background.
	 *
	 * @return the boundary pixels in traversal order, without repeating
	 * the start at the end.
	 */
	public static List<Point> trace (Mask mask, Point start) {
		if (!mask.isOn(start.x, start.y)) {
			throw new IllegalArgumentException("start pixel " + start + " is not part of the region");
		}
		List<Point> contour = new ArrayList<Point>();
		contour.add(new Point(start));

		int x = start.x, y = start.y;
		ChainCode back = ChainCode.W;
		ChainCode first = null;
		ChainCode[] dirs = ChainCode.values();
		while (true) {
			ChainCode found = null;
			for (int k = 1; k <= 8; ++k) {
				ChainCode d = dirs[(back.ordinal() + k) % 8];
				if (mask.isOn(x + d.dx, y + d.dy)) {
					found = d;
					break;
				}
			}
			if (found == null) {
				//isolated pixel
				return contour;
			}
			if (x == start.x && y == start.y && first != null && found == first) {
				break;
			}
			if (first == null) {
				first = found;
			}
			x += found.dx;
			y += found.dy;
			contour.add(new Point(x, y));
			back = found.backtrack();
		}
		//the walk re-entered the start
		contour.remove(contour.size() - 1);
		return contour;
	}

	/**
	 * Euclidean length of a closed chain of 8-connected pixels, closing
	 * step included.
	 */
	public static double length (List<Point> contour) {
		int n = contour.size();
		if (n < 2) {
			return n;
		}
		double total = 0;
		for (int i = 0; i < n; ++i) {
			Point a = contour.get(i);
			Point b = contour.get((i + 1) % n);
			total += (a.x == b.x || a.y == b.y) ? 1.0 : Math.sqrt(2);
		}
		return total;
	}
}
