package gov.nih.ncats.jigsaw.internal.util;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;

import gov.nih.ncats.jigsaw.Placement;

/**
 * Rigid motions shared by match validation and assembly. Positive
 * angles are counter-clockwise as seen on screen, which in image
 * coordinates (y down) is a rotation by the negated angle.
 */
public final class RigidTransforms {

	private RigidTransforms(){
		//can not instantiate
	}

	/**
	 * Rotate a point about a center by the given degrees.
	 */
	public static Point2D rotateAboutCenter(Point2D point, double angle, Point2D center){
		if(angle==0){
			return new Point2D.Double(point.getX(), point.getY());
		}
		AffineTransform at = AffineTransform.getRotateInstance(-Math.toRadians(angle), center.getX(), center.getY());
		return at.transform(point, null);
	}

	/**
	 * The motion which carries <code>point</code> onto <code>anchor</code>
	 * and rotates everything around it by <code>angle</code> degrees.
	 */
	public static AffineTransform placeOnAnchor(Point2D point, double angle, Point2D anchor){
		AffineTransform at = new AffineTransform();
		at.translate(anchor.getX(), anchor.getY());
		if(angle!=0){
			at.rotate(-Math.toRadians(angle));
		}
		at.translate(-point.getX(), -point.getY());
		return at;
	}

	/**
	 * Map a tile-local point of a placed piece into absolute coordinates.
	 */
	public static Point2D rescale(Point2D point, Placement position, Point2D localCenter){
		Point2D p = rotateAboutCenter(point, position.getAngle(), localCenter);
		return new Point2D.Double(p.getX() + position.getCenterX() - localCenter.getX(),
								  p.getY() + position.getCenterY() - localCenter.getY());
	}

	/**
	 * Position of piece B when its contact point <code>pointB</code> is
	 * joined to the contact point <code>pointA</code> of an already placed
	 * piece A and B is rotated by <code>angle</code> relative to A.
	 *
	 * @param placementA where A sits.
	 * @param localCenterA tile center of A.
	 * @param pointA contact point in A's tile.
	 * @param localCenterB tile center of B.
	 * @param pointB contact point in B's tile.
	 * @param angle rotation of B relative to A.
	 */
	public static Placement attach(Placement placementA, Point2D localCenterA, Point2D pointA,
								   Point2D localCenterB, Point2D pointB, double angle){
		Point2D junction = rescale(pointA, placementA, localCenterA);
		double absolute = GeomUtil.normalizeDegrees(placementA.getAngle() + angle);
		Point2D center = placeOnAnchor(pointB, absolute, junction).transform(localCenterB, null);
		return new Placement(center.getY(), center.getX(), absolute);
	}
}
