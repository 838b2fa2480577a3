package gov.nih.ncats.jigsaw.internal.image;

import java.awt.Point;
import java.awt.Rectangle;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One scanned puzzle piece: a square tile whose opaque pixels are the
 * piece, plus the outer contour traced from the alpha channel.
 */
public class Piece implements ContourTracer.Mask {

	private final int index;
	private final BufferedImage tile;
	private final boolean[] alpha;
	private final int width, height;
	private final List<Point> contour;
	private final double contourLength;
	private final Point localCenter;
	private final Rectangle opaqueBounds;
	private final Point2D scanCenter;
	private final double scale;

	public Piece(int index, BufferedImage tile){
		this(index, tile, null, 1.0);
	}

	/**
	 * @param index position of the piece in the input list.
	 * @param tile the piece image; pixels with zero alpha are background.
	 * @param scanCenter center of the piece in the original scan, may be null.
	 * @param scale factor the piece was shrunk by to fit the tile.
	 *
	 * @throws IllegalArgumentException if the tile has no opaque pixel.
	 */
	public Piece(int index, BufferedImage tile, Point2D scanCenter, double scale){
		Objects.requireNonNull(tile);
		this.index = index;
		this.tile = ImageUtil.toArgb(tile);
		this.width = tile.getWidth();
		this.height = tile.getHeight();
		this.scanCenter = scanCenter;
		this.scale = scale;
		this.localCenter = new Point(width / 2, height / 2);

		alpha = new boolean[width * height];
		Point start = null;
		int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE, maxX = -1, maxY = -1;
		for (int y = 0; y < height; ++y) {
			for (int x = 0; x < width; ++x) {
				if ((this.tile.getRGB(x, y) >>> 24) != 0) {
					alpha[y * width + x] = true;
					if (start == null) {
						start = new Point(x, y);
					}
					minX = Math.min(minX, x);
					maxX = Math.max(maxX, x);
					minY = Math.min(minY, y);
					maxY = Math.max(maxY, y);
				}
			}
		}
		if (start == null) {
			throw new IllegalArgumentException("piece " + index + " has no opaque pixel");
		}
		this.opaqueBounds = new Rectangle(minX, minY, maxX - minX + 1, maxY - minY + 1);
		this.contour = Collections.unmodifiableList(ContourTracer.trace(this, start));
		this.contourLength = ContourTracer.length(contour);
	}

	@Override
	public boolean isOn(int x, int y) {
		return x >= 0 && y >= 0 && x < width && y < height && alpha[y * width + x];
	}

	/**
	 * RGB at the given pixel; background and out of tile read as black.
	 */
	public int getRGB(int x, int y) {
		if (!isOn(x, y)) {
			return 0;
		}
		return tile.getRGB(x, y) & 0xffffff;
	}

	public int getARGB(int x, int y) {
		return tile.getRGB(x, y);
	}

	public int getIndex() {
		return index;
	}

	public BufferedImage getTile() {
		return tile;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public List<Point> getContour() {
		return contour;
	}

	public double getContourLength() {
		return contourLength;
	}

	public Point getLocalCenter() {
		return localCenter;
	}

	public Rectangle getOpaqueBounds() {
		return opaqueBounds;
	}

	public boolean hasScanCenter() {
		return scanCenter != null;
	}

	/**
	 * Map a tile point back to the coordinates of the original scan.
	 * Without a known scan center, the tile point is returned unchanged.
	 */
	public Point2D toScanCoordinates(Point2D local) {
		if (scanCenter == null) {
			return new Point2D.Double(local.getX(), local.getY());
		}
		return new Point2D.Double(scanCenter.getX() + (local.getX() - localCenter.x) / scale,
								  scanCenter.getY() + (local.getY() - localCenter.y) / scale);
	}

	@Override
	public String toString() {
		return "Piece{index=" + index + ", contour=" + contour.size() + "}";
	}
}
