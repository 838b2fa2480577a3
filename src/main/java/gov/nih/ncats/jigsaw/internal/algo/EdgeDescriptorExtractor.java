package gov.nih.ncats.jigsaw.internal.algo;

import java.awt.Point;
import java.util.ArrayList;
import java.util.List;

import gov.nih.ncats.jigsaw.internal.image.Piece;
import gov.nih.ncats.jigsaw.internal.util.GeomUtil;
import gov.nih.ncats.jigsaw.internal.util.GeomUtil.MinAreaRect;

/**
 * Cuts piece contours into fixed length windows and describes each one.
 */
public class EdgeDescriptorExtractor {

	private final int windowLength;

	public EdgeDescriptorExtractor(int windowLength){
		if(windowLength < 1){
			throw new IllegalArgumentException("window length must be positive");
		}
		this.windowLength = windowLength;
	}

	public int getWindowLength() {
		return windowLength;
	}

	/**
	 * Windows starting at offsets 0, step, 2*step ... around the contour.
	 */
	public List<EdgeWindow> windows(Piece piece, int step){
		if(step < 1){
			throw new IllegalArgumentException("step must be positive");
		}
		int n = piece.getContour().size();
		List<EdgeWindow> list = new ArrayList<EdgeWindow>((n + step - 1) / step);
		for(int off=0; off<n; off+=step){
			list.add(window(piece, off));
		}
		return list;
	}

	/**
	 * The window starting at the given contour index. Runs longer than the
	 * contour are cut to the contour length; indices wrap around.
	 */
	public EdgeWindow window(Piece piece, int offset){
		List<Point> contour = piece.getContour();
		int n = contour.size();
		int len = Math.min(windowLength, n);
		List<Point> pts = new ArrayList<Point>(len);
		for(int k=0;k<len;k++){
			pts.add(contour.get((offset + k) % n));
		}
		MinAreaRect rect = GeomUtil.minAreaRect(pts);

		Point first = pts.get(0);
		Point last = pts.get(len - 1);
		Point typePoint = new Point(
				(int) Math.floor(first.x + last.x - rect.getCenter().getX()),
				(int) Math.floor(first.y + last.y - rect.getCenter().getY()));
		//a knob bulges away from the chord, so the reflected rectangle
		//center lands back inside the piece
		EdgeType type = piece.isOn(typePoint.x, typePoint.y) ? EdgeType.TAB : EdgeType.BLANK;

		return new EdgeWindow(offset, pts, rect, typePoint, type, ShapeMoments.huMoments(pts));
	}

	public ColorProfile colors(Piece piece, EdgeWindow window){
		return ColorProfile.sample(piece, window.getPoints());
	}
}
