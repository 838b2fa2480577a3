package gov.nih.ncats.jigsaw.internal.util;

import java.awt.Point;
import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.logging.Logger;


public class GeomUtil {
	private static final Logger logger =
        Logger.getLogger (GeomUtil.class.getName ());

    private static final boolean DEBUG = Boolean.getBoolean ("jigsaw.debug");
    public static final double EPS = 1e-9;

    public static double ccw (Point2D p1, Point2D p2, Point2D p3) {
        return (p2.getX () - p1.getX ()) * (p3.getY () - p1.getY ())
             - (p2.getY () - p1.getY ()) * (p3.getX () - p1.getX ());
    }

    /**
     * calculate angle between (x0,y0) and (x1,y1) in degrees, measured
     * from +x towards +y (image coordinates, so clockwise on screen)
     */
    public static double angle (double x0, double y0, double x1, double y1) {
        double dx = x1 - x0, dy = y1 - y0;
        return Math.toDegrees(Math.atan2(dy, dx));
    }

    /**
     * Monotone chain convex hull of integer points. Collinear points
     * are dropped; fewer than 3 distinct points are returned as-is,
     * sorted by x then y.
     */
    public static List<Point> convexHull (Collection<Point> pts) {
    	List<Point> sorted = new ArrayList<Point>(new LinkedHashSet<Point>(pts));
    	sorted.sort(Comparator.comparingInt((Point p)->p.x).thenComparingInt(p->p.y));
    	if(sorted.size()<=2){
    		return sorted;
    	}

    	List<Point> lower = new ArrayList<Point>();
    	for(Point p : sorted){
    		while(lower.size()>=2 && ccw(lower.get(lower.size()-2), lower.get(lower.size()-1), p) <= 0){
    			lower.remove(lower.size()-1);
    		}
    		lower.add(p);
    	}
    	List<Point> upper = new ArrayList<Point>();
    	for(int i=sorted.size()-1;i>=0;i--){
    		Point p = sorted.get(i);
    		while(upper.size()>=2 && ccw(upper.get(upper.size()-2), upper.get(upper.size()-1), p) <= 0){
    			upper.remove(upper.size()-1);
    		}
    		upper.add(p);
    	}
    	List<Point> hull = new ArrayList<Point>(lower.subList(0, lower.size()-1));
    	hull.addAll(upper.subList(0, upper.size()-1));

    	if (DEBUG) {
            logger.info ("Convex hull: " + hull.size () + " of " + sorted.size());
        }
    	return hull;
    }

    /**
     * Minimal area bounding rectangle of a point set, found by testing
     * the direction of every convex hull edge.
     *
     * The angle is the direction of the "width" side, measured in image
     * coordinates and reduced into [0,90). The "height" side is the
     * perpendicular one. Rotating a point set by any angle therefore
     * either keeps width/height or swaps them, and moves the angle by the
     * rotation modulo 90.
     */
    public static MinAreaRect minAreaRect (Collection<Point> pts) {
    	List<Point> hull = convexHull(pts);
    	if(hull.isEmpty()){
    		throw new IllegalArgumentException("can not bound an empty point set");
    	}
    	if(hull.size()==1){
    		Point p = hull.get(0);
    		return new MinAreaRect(new Point2D.Double(p.x, p.y), 0, 0, 0);
    	}
    	MinAreaRect best = null;
    	double bestArea = Double.MAX_VALUE;
    	int n = hull.size();
    	for(int i=0;i<n;i++){
    		Point p = hull.get(i);
    		Point q = hull.get((i+1)%n);
    		double a = reduceQuarter(angle(p.x, p.y, q.x, q.y));
    		double t = Math.toRadians(a);
    		double ux = Math.cos(t), uy = Math.sin(t);
    		double vx = -uy, vy = ux;

    		double minU = Double.MAX_VALUE, maxU = -Double.MAX_VALUE;
    		double minV = Double.MAX_VALUE, maxV = -Double.MAX_VALUE;
    		for(Point h : hull){
    			double u = h.x*ux + h.y*uy;
    			double v = h.x*vx + h.y*vy;
    			minU = Math.min(minU, u);
    			maxU = Math.max(maxU, u);
    			minV = Math.min(minV, v);
    			maxV = Math.max(maxV, v);
    		}
    		double w = maxU - minU;
    		double h = maxV - minV;
    		double area = w*h;
    		if(best==null || area < bestArea - EPS){
    			double cu = (maxU + minU)/2;
    			double cv = (maxV + minV)/2;
    			Point2D center = new Point2D.Double(cu*ux + cv*vx, cu*uy + cv*vy);
    			best = new MinAreaRect(center, w, h, a);
    			bestArea = area;
    		}
    	}
    	return best;
    }

    /**
     * Reduce an angle in degrees into [0,90).
     */
    public static double reduceQuarter (double deg) {
    	double a = ((deg % 90.0) + 90.0) % 90.0;
    	if(a>=90.0){
    		a-=90.0;
    	}
    	return a;
    }

    /**
     * Normalize an angle in degrees into [0,360).
     */
    public static double normalizeDegrees (double deg) {
    	double a = ((deg % 360.0) + 360.0) % 360.0;
    	if(a>=360.0){
    		a-=360.0;
    	}
    	return a;
    }

    public static double round (double value, int places) {
    	double scale = Math.pow(10, places);
    	return Math.round(value*scale)/scale;
    }

    public static int signum (double value) {
    	return value > 0 ? 1 : (value < 0 ? -1 : 0);
    }

    /**
     * Rotated rectangle: center, the two side lengths and the
     * direction of the width side.
     */
    public static class MinAreaRect {
    	private final Point2D center;
    	private final double width;
    	private final double height;
    	private final double angle;

    	public MinAreaRect(Point2D center, double width, double height, double angle){
    		this.center = center;
    		this.width = width;
    		this.height = height;
    		this.angle = angle;
    	}

    	public Point2D getCenter() {
    		return center;
    	}

    	public double getWidth() {
    		return width;
    	}

    	public double getHeight() {
    		return height;
    	}

    	/**
    	 * degrees in [0,90)
    	 */
    	public double getAngle() {
    		return angle;
    	}

    	/**
    	 * Sign of height minus width; windows with the same elongation sign
    	 * lie along the same axis.
    	 */
    	public int elongation() {
    		return signum(height - width);
    	}

    	@Override
    	public String toString() {
    		return "MinAreaRect{center=" + center + ", width=" + width + ", height=" + height + ", angle=" + angle + "}";
    	}
    }
}
