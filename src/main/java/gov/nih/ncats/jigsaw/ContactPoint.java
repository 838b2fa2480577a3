package gov.nih.ncats.jigsaw;

import java.awt.geom.Point2D;

/**
 * Where two pieces touch through a locked match, in the coordinates of
 * the original scan. Contact points are numbered from 1 in the order the
 * matches were locked.
 */
public final class ContactPoint {

	private final int number;
	private final int pieceA;
	private final Point2D pointA;
	private final int pieceB;
	private final Point2D pointB;

	public ContactPoint(int number, int pieceA, Point2D pointA, int pieceB, Point2D pointB){
		this.number = number;
		this.pieceA = pieceA;
		this.pointA = pointA;
		this.pieceB = pieceB;
		this.pointB = pointB;
	}

	public int getNumber() {
		return number;
	}

	public int getPieceA() {
		return pieceA;
	}

	public Point2D getPointA() {
		return (Point2D) pointA.clone();
	}

	public int getPieceB() {
		return pieceB;
	}

	public Point2D getPointB() {
		return (Point2D) pointB.clone();
	}

	@Override
	public String toString() {
		return "ContactPoint{" + number + ": " + pieceA + "@" + pointA + " - " + pieceB + "@" + pointB + "}";
	}
}
