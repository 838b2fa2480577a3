package gov.nih.ncats.jigsaw.internal.algo;

import java.awt.Point;

/**
 * Two windows, one on each piece, whose shapes agree. Joining
 * <code>pointA</code> to <code>pointB</code> and rotating piece B by
 * <code>angle</code> degrees relative to A brings the two edges together.
 */
public class FormMatch {

	private final int pieceA;
	private final int pieceB;
	private final int offsetA;
	private final int offsetB;
	private final Point pointA;
	private final Point pointB;
	private final double angle;
	private final double shapeDistance;

	public FormMatch(int pieceA, int pieceB, int offsetA, int offsetB,
			Point pointA, Point pointB, double angle, double shapeDistance) {
		this.pieceA = pieceA;
		this.pieceB = pieceB;
		this.offsetA = offsetA;
		this.offsetB = offsetB;
		this.pointA = new Point(pointA);
		this.pointB = new Point(pointB);
		this.angle = angle;
		this.shapeDistance = shapeDistance;
	}

	protected FormMatch(FormMatch other) {
		this(other.pieceA, other.pieceB, other.offsetA, other.offsetB,
				other.pointA, other.pointB, other.angle, other.shapeDistance);
	}

	public int getPieceA() {
		return pieceA;
	}

	public int getPieceB() {
		return pieceB;
	}

	public int getOffsetA() {
		return offsetA;
	}

	public int getOffsetB() {
		return offsetB;
	}

	public Point getPointA() {
		return new Point(pointA);
	}

	public Point getPointB() {
		return new Point(pointB);
	}

	public double getAngle() {
		return angle;
	}

	public double getShapeDistance() {
		return shapeDistance;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" + pieceA + ":" + offsetA + " -> " + pieceB + ":" + offsetB
				+ ", angle=" + angle + ", shape=" + shapeDistance + "}";
	}
}
