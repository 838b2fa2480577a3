package gov.nih.ncats.jigsaw.internal.algo;

import static org.junit.Assert.*;

import java.awt.Point;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class ShapeMomentsTest {

	private static List<Point> arc(int dx, int dy, boolean quarterTurn){
		List<Point> pts = new ArrayList<>();
		for(int i=0;i<30;i++){
			int x = i;
			int y = (i - 15) * (i - 15) / 10;
			pts.add(quarterTurn ? new Point(-y + dx, x + dy) : new Point(x + dx, y + dy));
		}
		return pts;
	}

	@Test
	public void sameShapeHasZeroDistance(){
		double[] h = ShapeMoments.huMoments(arc(0, 0, false));
		assertEquals(0, ShapeMoments.distance(h, h), 0);
	}

	@Test
	public void translationDoesNotMatter(){
		double[] a = ShapeMoments.huMoments(arc(0, 0, false));
		double[] b = ShapeMoments.huMoments(arc(57, -13, false));
		assertArrayEquals(a, b, 1e-12);
	}

	@Test
	public void quarterTurnDoesNotMatter(){
		double[] a = ShapeMoments.huMoments(arc(0, 0, false));
		double[] b = ShapeMoments.huMoments(arc(5, 5, true));
		assertEquals(0, ShapeMoments.distance(a, b), 1e-6);
	}

	@Test
	public void duplicatePixelsCountOnce(){
		List<Point> pts = arc(0, 0, false);
		List<Point> doubled = new ArrayList<>(pts);
		doubled.addAll(pts);
		assertArrayEquals(ShapeMoments.huMoments(pts), ShapeMoments.huMoments(doubled), 0);
	}

	@Test
	public void differentShapesAreApart(){
		List<Point> line = new ArrayList<>();
		for(int i=0;i<30;i++){
			line.add(new Point(i, i / 3));
		}
		double[] a = ShapeMoments.huMoments(arc(0, 0, false));
		double[] b = ShapeMoments.huMoments(line);
		assertTrue(ShapeMoments.distance(a, b) > 0.015);
	}

	@Test
	public void firstInvariantOfAPixelPair(){
		List<Point> pts = new ArrayList<>();
		pts.add(new Point(0, 0));
		pts.add(new Point(2, 0));
		double[] h = ShapeMoments.huMoments(pts);
		//mu20 = 255 * 2, m00 = 510, nu20 = 510 / 510^2
		assertEquals(1.0 / 510, h[0], 1e-15);
		assertEquals(h[0] * h[0], h[1], 1e-15);
	}
}
