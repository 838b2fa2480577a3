package gov.nih.ncats.jigsaw.internal.algo;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.jigsaw.JigsawOptions;
import gov.nih.ncats.jigsaw.internal.image.Piece;
import gov.nih.ncats.jigsaw.internal.util.GeomUtil;
import gov.nih.ncats.jigsaw.internal.util.GeomUtil.MinAreaRect;
import gov.nih.ncats.jigsaw.internal.util.RigidTransforms;

/**
 * Finds candidate joints between two pieces by comparing every window
 * of one contour against every window of the other, first by shape and
 * then by the colors along the edge.
 */
public class PairwiseEdgeMatcher {
	private static final Logger logger = Logger.getLogger(PairwiseEdgeMatcher.class.getName());

	private static final Point2D ORIGIN = new Point2D.Double(0, 0);

	private final JigsawOptions options;
	private final EdgeDescriptorExtractor extractor;

	public PairwiseEdgeMatcher(JigsawOptions options){
		this.options = options;
		this.extractor = new EdgeDescriptorExtractor(options.getWindowLength());
	}

	public EdgeDescriptorExtractor getExtractor() {
		return extractor;
	}

	/**
	 * Window pairs of opposite type, compatible rectangles and a shape
	 * distance under the threshold. Piece A is scanned with the coarse
	 * stride, piece B with the fine one.
	 */
	public List<FormMatch> formMatches(Piece a, Piece b){
		List<EdgeWindow> wa = extractor.windows(a, options.getScanStep());
		List<EdgeWindow> wb = extractor.windows(b, options.getSearchStep());

		List<FormMatch> forms = new ArrayList<>();
		for(EdgeWindow x : wa){
			for(EdgeWindow y : wb){
				if(!compatible(x, y, options.getPrecision())){
					continue;
				}
				double d = x.shapeDistance(y);
				if(d < options.getMaxFormDistance()){
					forms.add(new FormMatch(a.getIndex(), b.getIndex(), x.getOffset(), y.getOffset(),
							x.getCenter(), y.getCenter(), relativeAngle(x, y), d));
				}
			}
		}
		if(logger.isLoggable(Level.FINE)){
			logger.fine("pair " + a.getIndex() + "/" + b.getIndex() + ": " + wa.size() + "x" + wb.size()
					+ " windows, " + forms.size() + " form matches");
		}
		return forms;
	}

	/**
	 * Keep the form matches whose color profiles align, B's profile taken
	 * in reverse.
	 */
	public List<ColorMatch> colorMatches(Piece a, Piece b, List<FormMatch> forms){
		List<ColorMatch> colors = new ArrayList<>();
		for(FormMatch f : forms){
			ColorProfile ca = extractor.colors(a, extractor.window(a, f.getOffsetA()));
			ColorProfile cb = extractor.colors(b, extractor.window(b, f.getOffsetB())).reversed();
			double d = ca.distance(cb);
			if(d < options.getMaxColorDistance()){
				colors.add(new ColorMatch(f, d));
			}
		}
		if(logger.isLoggable(Level.FINE)){
			logger.fine("pair " + a.getIndex() + "/" + b.getIndex() + ": " + colors.size() + " color matches");
		}
		return colors;
	}

	/**
	 * Window types must differ and the rectangles must agree within the
	 * precision, side to side or with the sides swapped.
	 */
	static boolean compatible(EdgeWindow a, EdgeWindow b, double precision){
		if(a.getType() == b.getType()){
			return false;
		}
		MinAreaRect ra = a.getRect();
		MinAreaRect rb = b.getRect();
		boolean same = Math.abs(ra.getHeight() - rb.getHeight()) < precision
				&& Math.abs(ra.getWidth() - rb.getWidth()) < precision;
		boolean swapped = Math.abs(ra.getHeight() - rb.getWidth()) < precision
				&& Math.abs(ra.getWidth() - rb.getHeight()) < precision;
		return same || swapped;
	}

	/**
	 * Counter-clockwise rotation of B, in degrees, which lays B's window
	 * against A's. The rectangle angles fix it modulo 90; the elongation of
	 * the two rectangles fixes it modulo 180; the direction from each
	 * rectangle center to its type point decides the remaining half turn.
	 */
	static double relativeAngle(EdgeWindow a, EdgeWindow b){
		MinAreaRect ra = a.getRect();
		MinAreaRect rb = b.getRect();
		boolean collinear = ra.elongation() == rb.elongation();
		double angleB = rb.getAngle() + (collinear ? 0 : 90);
		double phi = angleB - ra.getAngle();

		Point2D va = new Point2D.Double(a.getTypePoint().x - ra.getCenter().getX(), a.getTypePoint().y - ra.getCenter().getY());
		Point2D vb = new Point2D.Double(b.getTypePoint().x - rb.getCenter().getX(), b.getTypePoint().y - rb.getCenter().getY());
		//turn A's probe direction the same way the rectangle angles differ
		Point2D ta = RigidTransforms.rotateAboutCenter(va, -phi, ORIGIN);
		boolean codirect = ta.getX() * vb.getX() + ta.getY() * vb.getY() >= 0;
		if(!codirect){
			phi += 180;
		}
		return GeomUtil.round(phi, 4);
	}
}
