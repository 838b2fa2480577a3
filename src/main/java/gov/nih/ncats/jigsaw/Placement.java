package gov.nih.ncats.jigsaw;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.util.Objects;

import gov.nih.ncats.jigsaw.internal.util.GeomUtil;
import gov.nih.ncats.jigsaw.internal.util.RigidTransforms;

/**
 * Where a piece sits in the assembled image: the absolute position its
 * tile center maps to, and the counter-clockwise rotation (as seen on
 * screen) applied to the tile, in degrees normalized into [0,360).
 */
public final class Placement {

	private final double centerY;
	private final double centerX;
	private final double angle;

	public Placement(double centerY, double centerX, double angle){
		this.centerY = centerY;
		this.centerX = centerX;
		this.angle = GeomUtil.normalizeDegrees(angle);
	}

	public double getCenterY() {
		return centerY;
	}

	public double getCenterX() {
		return centerX;
	}

	public double getAngle() {
		return angle;
	}

	public Point2D getCenter(){
		return new Point2D.Double(centerX, centerY);
	}

	/**
	 * Transform from tile coordinates to absolute coordinates.
	 * @param localCenter the tile center of the placed piece.
	 */
	public AffineTransform toTransform(Point2D localCenter){
		return RigidTransforms.placeOnAnchor(localCenter, angle, getCenter());
	}

	/**
	 * Transform from absolute coordinates back to tile coordinates.
	 * @param localCenter the tile center of the placed piece.
	 */
	public AffineTransform toInverseTransform(Point2D localCenter){
		return RigidTransforms.placeOnAnchor(getCenter(), -angle, localCenter);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Placement)) return false;
		Placement that = (Placement) o;
		return Double.compare(that.centerY, centerY) == 0
				&& Double.compare(that.centerX, centerX) == 0
				&& Double.compare(that.angle, angle) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(centerY, centerX, angle);
	}

	@Override
	public String toString() {
		return "Placement{" +
				"centerY=" + centerY +
				", centerX=" + centerX +
				", angle=" + angle +
				'}';
	}
}
