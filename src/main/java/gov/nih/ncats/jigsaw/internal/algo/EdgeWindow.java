package gov.nih.ncats.jigsaw.internal.algo;

import java.awt.Point;
import java.awt.geom.Point2D;
import java.util.Collections;
import java.util.List;

import gov.nih.ncats.jigsaw.internal.util.GeomUtil.MinAreaRect;

/**
 * A run of consecutive contour points and the descriptors computed
 * from it.
 */
public final class EdgeWindow {

	private final int offset;
	private final List<Point> points;
	private final Point center;
	private final MinAreaRect rect;
	private final Point typePoint;
	private final EdgeType type;
	private final double[] huMoments;

	EdgeWindow(int offset, List<Point> points, MinAreaRect rect, Point typePoint,
			EdgeType type, double[] huMoments){
		this.offset = offset;
		this.points = Collections.unmodifiableList(points);
		this.center = points.get(points.size() / 2);
		this.rect = rect;
		this.typePoint = typePoint;
		this.type = type;
		this.huMoments = huMoments;
	}

	/**
	 * index of the first point in the piece contour
	 */
	public int getOffset() {
		return offset;
	}

	public List<Point> getPoints() {
		return points;
	}

	/**
	 * The middle point of the run; two windows are joined at their centers.
	 */
	public Point getCenter() {
		return center;
	}

	public MinAreaRect getRect() {
		return rect;
	}

	public Point2D getRectCenter() {
		return rect.getCenter();
	}

	/**
	 * The probe point used to classify the window: the rectangle center
	 * reflected through the midpoint of the two window ends.
	 */
	public Point getTypePoint() {
		return typePoint;
	}

	public EdgeType getType() {
		return type;
	}

	public double[] getHuMoments() {
		return huMoments.clone();
	}

	double shapeDistance(EdgeWindow other){
		return ShapeMoments.distance(huMoments, other.huMoments);
	}

	@Override
	public String toString() {
		return "EdgeWindow{offset=" + offset + ", type=" + type + ", rect=" + rect + "}";
	}
}
