package gov.nih.ncats.jigsaw.internal.image;

import static org.junit.Assert.*;

import java.awt.Point;
import java.awt.Rectangle;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;

import org.junit.Test;

import gov.nih.ncats.jigsaw.PuzzleFixtures;

public class PieceTest {

	@Test
	public void contourIsTracedFromAlpha(){
		Piece p = new Piece(3, PuzzleFixtures.loneSquare());
		assertEquals(3, p.getIndex());
		assertEquals(new Point(28, 28), p.getContour().get(0));
		assertEquals(new Point(29, 28), p.getContour().get(1));
		//the outline of a 40x40 block
		assertEquals(156, p.getContour().size());
		assertEquals(156, p.getContourLength(), 1e-9);
		assertEquals(new Rectangle(28, 28, 40, 40), p.getOpaqueBounds());
		assertEquals(new Point(48, 48), p.getLocalCenter());
	}

	@Test
	public void backgroundReadsBlack(){
		Piece p = new Piece(0, PuzzleFixtures.loneSquare());
		assertEquals(PuzzleFixtures.rgb(20, 40, 220), p.getRGB(30, 30));
		assertEquals(0, p.getRGB(2, 2));
		assertEquals(0, p.getRGB(-1, 500));
		assertFalse(p.isOn(-1, 0));
	}

	@Test(expected = IllegalArgumentException.class)
	public void emptyTileIsRejected(){
		new Piece(0, new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB));
	}

	@Test
	public void scanCoordinates(){
		Piece plain = new Piece(0, PuzzleFixtures.loneSquare());
		assertEquals(new Point2D.Double(30, 40), plain.toScanCoordinates(new Point(30, 40)));

		Piece scanned = new Piece(0, PuzzleFixtures.loneSquare(), new Point2D.Double(1000, 2000), 0.5);
		Point2D p = scanned.toScanCoordinates(new Point(58, 38));
		assertEquals(1020, p.getX(), 1e-9);
		assertEquals(1980, p.getY(), 1e-9);
	}
}
