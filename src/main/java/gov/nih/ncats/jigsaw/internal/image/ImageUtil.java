package gov.nih.ncats.jigsaw.internal.image;

import com.mortennobel.imagescaling.ResampleOp;
import com.twelvemonkeys.imageio.stream.ByteArrayImageInputStream;

import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.logging.Logger;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;


public class ImageUtil {
    private static final Logger logger = Logger.getLogger
	(ImageUtil.class.getName());

    /**
     * Alpha at or above this value survives resampling as opaque.
     */
    private static final int ALPHA_THRESHOLD = 128;

    private static boolean isTiff(byte[] f) {
        //0x4949 or 0x4d4d
        return f.length > 1 && ((f[0] == 0x49 && f[1] == 0x49) || (f[0] == 0x4d && f[1] == 0x4d));
    }
    private static boolean isPng(byte[] f) {
        //0x89PNG
        return f.length > 3 && (f[0] & 0xff) == 0x89 && f[1] == 0x50 && f[2] == 0x4E && f[3] == 0x47;
    }

    public static BufferedImage read (byte[] file) throws IOException {
        //read through an ImageReader directly so ImageIO
        //does not spool the bytes into its cache file
        try(ImageInputStream input = new ByteArrayImageInputStream(file)) {
            Iterator<ImageReader> readers;
            if(isPng(file)){
                readers = ImageIO.getImageReadersByFormatName("png");
            }else if(isTiff(file)){
                readers = ImageIO.getImageReadersByFormatName("tiff");
            }else{
                readers = ImageIO.getImageReaders(input);
            }

            if (!readers.hasNext()) {
                throw new IOException("No reader found for format provided in byte array");
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(input);
                return toArgb(reader.read(0));
            }
            finally {
                reader.dispose();
            }
        }
    }

    public static BufferedImage read (File file) throws IOException {
        BufferedImage bi = ImageIO.read(file);
        if(bi ==null){
            throw new IOException("No reader found for " + file);
        }
        return toArgb(bi);
    }

    /**
     * Copy into a TYPE_INT_ARGB image unless it already is one.
     */
    public static BufferedImage toArgb (BufferedImage bi) {
        if(bi.getType() == BufferedImage.TYPE_INT_ARGB){
            return bi;
        }
        BufferedImage out = new BufferedImage(bi.getWidth(), bi.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = out.createGraphics();
        g2d.drawImage(bi, 0, 0, null);
        g2d.dispose();
        return out;
    }

    /**
     * Bounding box of the pixels with non-zero alpha, or null if
     * there are none.
     */
    public static Rectangle opaqueBounds (BufferedImage bi) {
        int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
        int maxX = -1, maxY = -1;
        for (int y = 0; y < bi.getHeight(); ++y) {
            for (int x = 0; x < bi.getWidth(); ++x) {
                if ((bi.getRGB(x, y) >>> 24) != 0) {
                    if (x < minX) minX = x;
                    if (x > maxX) maxX = x;
                    if (y < minY) minY = y;
                    if (y > maxY) maxY = y;
                }
            }
        }
        if (maxX < 0) {
            return null;
        }
        return new Rectangle(minX, minY, maxX - minX + 1, maxY - minY + 1);
    }

    /**
     * Crop a segmented piece to its opaque pixels, shrink it if it does
     * not fit, and center it into a transparent square tile.
     *
     * @return the tile and the scale factor applied to the piece.
     */
    public static NormalizedTile normalize (BufferedImage piece, int tileSize) {
        BufferedImage argb = toArgb(piece);
        Rectangle bounds = opaqueBounds(argb);
        if (bounds == null) {
            throw new IllegalArgumentException("piece image has no opaque pixel");
        }
        BufferedImage cropped = argb.getSubimage(bounds.x, bounds.y, bounds.width, bounds.height);

        double scale = 1.0;
        int longest = Math.max(bounds.width, bounds.height);
        if (longest > tileSize) {
            scale = tileSize / (double) longest;
            //the resampler refuses targets under 3x3
            int nwidth = Math.max(3, (int) (bounds.width * scale));
            int nheight = Math.max(3, (int) (bounds.height * scale));
            logger.fine("downscaling piece " + bounds.width + "x" + bounds.height + " to " + nwidth + "x" + nheight);
            ResampleOp resizeOp = new ResampleOp(nwidth, nheight);
            cropped = binarizeAlpha(toArgb(resizeOp.filter(cropped, null)));
        }

        BufferedImage tile = new BufferedImage(tileSize, tileSize, BufferedImage.TYPE_INT_ARGB);
        int ox = tileSize / 2 - cropped.getWidth() / 2;
        int oy = tileSize / 2 - cropped.getHeight() / 2;
        for (int y = 0; y < cropped.getHeight(); ++y) {
            for (int x = 0; x < cropped.getWidth(); ++x) {
                tile.setRGB(ox + x, oy + y, cropped.getRGB(x, y));
            }
        }
        return new NormalizedTile(tile, scale);
    }

    private static BufferedImage binarizeAlpha (BufferedImage bi) {
        for (int y = 0; y < bi.getHeight(); ++y) {
            for (int x = 0; x < bi.getWidth(); ++x) {
                int argb = bi.getRGB(x, y);
                int alpha = argb >>> 24;
                bi.setRGB(x, y, alpha >= ALPHA_THRESHOLD ? (argb | 0xff000000) : 0);
            }
        }
        return bi;
    }

    public static class NormalizedTile {
        private final BufferedImage tile;
        private final double scale;

        public NormalizedTile(BufferedImage tile, double scale) {
            this.tile = tile;
            this.scale = scale;
        }

        public BufferedImage getTile() {
            return tile;
        }

        public double getScale() {
            return scale;
        }
    }
}
