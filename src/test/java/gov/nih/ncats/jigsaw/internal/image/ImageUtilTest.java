package gov.nih.ncats.jigsaw.internal.image;

import static org.junit.Assert.*;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.junit.Test;

import gov.nih.ncats.jigsaw.PuzzleFixtures;

public class ImageUtilTest {

	private static BufferedImage block(int w, int h, int tw, int th){
		BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
		for(int y=0;y<th;y++){
			for(int x=0;x<tw;x++){
				img.setRGB(x + 3, y + 5, 0xffcc8844);
			}
		}
		return img;
	}

	@Test
	public void pngBytesAreRead() throws IOException{
		BufferedImage tile = PuzzleFixtures.loneSquare();
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ImageIO.write(tile, "png", out);

		BufferedImage read = ImageUtil.read(out.toByteArray());
		assertEquals(BufferedImage.TYPE_INT_ARGB, read.getType());
		assertEquals(tile.getWidth(), read.getWidth());
		assertEquals(tile.getRGB(40, 40), read.getRGB(40, 40));
		assertEquals(0, read.getRGB(1, 1) >>> 24);
	}

	@Test(expected = IOException.class)
	public void unknownBytesAreRejected() throws IOException{
		ImageUtil.read(new byte[]{1, 2, 3, 4, 5, 6, 7, 8});
	}

	@Test
	public void opaqueBounds(){
		assertEquals(new Rectangle(3, 5, 7, 2), ImageUtil.opaqueBounds(block(20, 20, 7, 2)));
		assertNull(ImageUtil.opaqueBounds(new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB)));
	}

	@Test
	public void smallPieceIsCenteredWithoutScaling(){
		ImageUtil.NormalizedTile nt = ImageUtil.normalize(block(30, 40, 10, 20), 64);
		assertEquals(1.0, nt.getScale(), 0);
		assertEquals(64, nt.getTile().getWidth());
		assertEquals(64, nt.getTile().getHeight());
		assertEquals(new Rectangle(27, 22, 10, 20), ImageUtil.opaqueBounds(nt.getTile()));
	}

	@Test
	public void largePieceIsShrunk(){
		ImageUtil.NormalizedTile nt = ImageUtil.normalize(block(220, 120, 200, 100), 50);
		assertEquals(0.25, nt.getScale(), 1e-12);
		BufferedImage tile = nt.getTile();
		assertEquals(50, tile.getWidth());
		Rectangle b = ImageUtil.opaqueBounds(tile);
		assertNotNull(b);
		assertTrue(b.width <= 50 && b.width >= 48);
		assertTrue(b.height <= 26 && b.height >= 23);
		int alpha = tile.getRGB(25, 25) >>> 24;
		assertEquals(255, alpha);
	}

	@Test(expected = IllegalArgumentException.class)
	public void emptyPieceCanNotBeNormalized(){
		ImageUtil.normalize(new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB), 16);
	}
}
