package gov.nih.ncats.jigsaw.internal.image;

import static org.junit.Assert.*;

import java.awt.Point;
import java.awt.Rectangle;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class ContourTracerTest {

	private static ContourTracer.Mask rect(int x, int y, int w, int h){
		Rectangle r = new Rectangle(x, y, w, h);
		return r::contains;
	}

	@Test
	public void squareIsTracedClockwiseFromTopLeft(){
		List<Point> c = ContourTracer.trace(rect(0, 0, 3, 3), new Point(0, 0));
		assertEquals(Arrays.asList(
				new Point(0, 0), new Point(1, 0), new Point(2, 0),
				new Point(2, 1), new Point(2, 2), new Point(1, 2),
				new Point(0, 2), new Point(0, 1)), c);
		assertEquals(8, ContourTracer.length(c), 1e-12);
	}

	@Test
	public void singlePixel(){
		List<Point> c = ContourTracer.trace(rect(4, 4, 1, 1), new Point(4, 4));
		assertEquals(Arrays.asList(new Point(4, 4)), c);
		assertEquals(1, ContourTracer.length(c), 0);
	}

	@Test
	public void lineIsWalkedThereAndBack(){
		List<Point> c = ContourTracer.trace(rect(0, 0, 3, 1), new Point(0, 0));
		assertEquals(Arrays.asList(new Point(0, 0), new Point(1, 0), new Point(2, 0), new Point(1, 0)), c);
		assertEquals(4, ContourTracer.length(c), 1e-12);
	}

	@Test
	public void diagonalStepsCountRootTwo(){
		ContourTracer.Mask diag = (x, y) -> (x == 0 && y == 0) || (x == 1 && y == 1);
		List<Point> c = ContourTracer.trace(diag, new Point(0, 0));
		assertEquals(Arrays.asList(new Point(0, 0), new Point(1, 1)), c);
		assertEquals(2 * Math.sqrt(2), ContourTracer.length(c), 1e-12);
	}

	@Test
	public void holesAreIgnored(){
		ContourTracer.Mask ring = (x, y) -> x >= 0 && y >= 0 && x < 5 && y < 5 && !(x == 2 && y == 2);
		List<Point> c = ContourTracer.trace(ring, new Point(0, 0));
		assertEquals(16, c.size());
		assertEquals(16, ContourTracer.length(c), 1e-12);
	}

	@Test(expected = IllegalArgumentException.class)
	public void startMustBeSet(){
		ContourTracer.trace(rect(0, 0, 3, 3), new Point(5, 5));
	}

	@Test
	public void chainCodes(){
		assertEquals(ContourTracer.ChainCode.S, ContourTracer.ChainCode.E.rotate(2));
		assertEquals(ContourTracer.ChainCode.NE, ContourTracer.ChainCode.E.rotate(-1));
		assertTrue(ContourTracer.ChainCode.SW.isDiagonal());
		assertEquals(Math.sqrt(2), ContourTracer.ChainCode.NW.length(), 1e-12);
	}
}
