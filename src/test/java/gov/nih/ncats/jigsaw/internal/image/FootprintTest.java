package gov.nih.ncats.jigsaw.internal.image;

import static org.junit.Assert.*;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;

import org.junit.Test;

import gov.nih.ncats.jigsaw.Placement;

public class FootprintTest {

	private static Piece block(int x, int y, int w, int h){
		BufferedImage tile = new BufferedImage(40, 40, BufferedImage.TYPE_INT_ARGB);
		for(int j=y;j<y+h;j++){
			for(int i=x;i<x+w;i++){
				tile.setRGB(i, j, 0xff336699);
			}
		}
		return new Piece(0, tile);
	}

	@Test
	public void identityPlacementCopiesTheMask(){
		Piece p = block(5, 7, 10, 4);
		Footprint f = Footprint.of(p, new Placement(20, 20, 0));
		assertEquals(40, f.count());
		assertTrue(f.contains(5, 7));
		assertTrue(f.contains(14, 10));
		assertFalse(f.contains(15, 10));
		assertFalse(f.contains(4, 7));
	}

	@Test
	public void translationMovesTheMask(){
		Piece p = block(5, 7, 10, 4);
		Footprint f = Footprint.of(p, new Placement(120, 220, 0));
		assertEquals(40, f.count());
		assertTrue(f.contains(205, 107));
		assertFalse(f.contains(5, 7));
	}

	@Test
	public void quarterTurnKeepsEveryPixel(){
		Piece p = block(5, 7, 10, 4);
		Footprint f = Footprint.of(p, new Placement(20, 20, 90));
		assertEquals(40, f.count());
		Rectangle b = f.getBounds();
		//the 10x4 block now stands upright; the bounds keep a margin of one
		assertTrue(b.width >= 4 && b.width <= 4 + 4);
		assertTrue(b.height >= 10 && b.height <= 10 + 4);
	}

	@Test
	public void unionAndOverlap(){
		Piece p = block(0, 0, 10, 10);
		Footprint a = Footprint.of(p, new Placement(20, 20, 0));
		Footprint b = Footprint.of(p, new Placement(20, 25, 0));
		assertEquals(50, a.overlap(b));
		assertEquals(50, b.overlap(a));
		Footprint u = a.union(b);
		assertEquals(150, u.count());
		assertEquals(a.count(), a.union(Footprint.empty()).count());
		assertSame(a, Footprint.empty().union(a));
		assertEquals(0, a.overlap(Footprint.empty()));
	}

	@Test
	public void outerBoundarySumsComponents(){
		Piece p = block(0, 0, 3, 3);
		Footprint a = Footprint.of(p, new Placement(20, 20, 0));
		Footprint b = Footprint.of(p, new Placement(20, 30, 0));
		assertEquals(8, a.outerBoundaryLength(), 1e-9);
		assertEquals(16, a.union(b).outerBoundaryLength(), 1e-9);
		//touching blocks fuse into one 6x3 outline
		Footprint c = Footprint.of(p, new Placement(20, 23, 0));
		assertEquals(14, a.union(c).outerBoundaryLength(), 1e-9);
	}

	@Test
	public void rasterizeReportsSourcePixels(){
		Piece p = block(5, 7, 2, 1);
		StringBuilder sb = new StringBuilder();
		Footprint.rasterize(p, new Placement(20, 20, 0), (x, y, sx, sy) -> sb.append(x).append(',').append(y)
				.append('<').append(sx).append(',').append(sy).append(' '));
		assertEquals("5,7<5,7 6,7<6,7 ", sb.toString());
	}
}
