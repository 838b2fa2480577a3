package gov.nih.ncats.jigsaw;

import java.awt.Point;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import gov.nih.ncats.jigsaw.internal.image.Piece;

/**
 * Synthetic puzzles: a rectangle of square cells, each shared border
 * carrying one elliptical knob that belongs to one of the two cells, cut
 * into transparent tiles centered on the cells.
 */
public final class PuzzleFixtures {

	public static final int CELL = 48;
	public static final int TILE = 96;

	public interface ColorField {
		int rgb(int x, int y);
	}

	/**
	 * One knob on the border between a cell and its right neighbour
	 * (horizontal) or its lower neighbour (vertical).
	 */
	public static final class Knob {
		final boolean horizontal;
		final int row, col;
		final boolean ownedByFirst;
		final int halfWidth, depth, shift;

		public Knob(boolean horizontal, int row, int col, boolean ownedByFirst, int halfWidth, int depth, int shift){
			this.horizontal = horizontal;
			this.row = row;
			this.col = col;
			this.ownedByFirst = ownedByFirst;
			this.halfWidth = halfWidth;
			this.depth = depth;
			this.shift = shift;
		}
	}

	private PuzzleFixtures(){
	}

	/**
	 * Options small enough for 96 pixel tiles.
	 */
	public static JigsawOptions testOptions(){
		return new JigsawOptions()
				.windowLength(40)
				.precision(4)
				.scanStep(8)
				.searchStep(3)
				.maxFormDistance(0.015)
				.maxColorDistance(3000)
				.maxPixelLoss(0.03)
				.maxFit(0.77)
				.maxOverlap(0.1)
				.maxPasses(10)
				.tileSize(TILE)
				.parallelism(1);
	}

	/**
	 * Label of every pixel of the puzzle, row major.
	 */
	public static int[] labels(int rows, int cols, List<Knob> knobs){
		int w = cols * CELL, h = rows * CELL;
		int[] lab = new int[w * h];
		for(int y=0;y<h;y++){
			for(int x=0;x<w;x++){
				lab[y*w + x] = (y / CELL) * cols + x / CELL;
			}
		}
		for(Knob k : knobs){
			int p = k.row * cols + k.col;
			if(k.horizontal){
				int bx = (k.col + 1) * CELL;
				int my = k.row * CELL + CELL / 2 + k.shift;
				int owner = k.ownedByFirst ? p : p + 1;
				int sgn = k.ownedByFirst ? 1 : -1;
				for(int y=my - k.halfWidth; y<=my + k.halfWidth; y++){
					for(int x=bx - k.depth - 1; x<=bx + k.depth; x++){
						double u = (x - bx + 0.5) * sgn;
						if(u < 0){
							continue;
						}
						double a = u / k.depth, b = (y - my) / (double) k.halfWidth;
						if(a*a + b*b <= 1.0){
							lab[y*w + x] = owner;
						}
					}
				}
			}else{
				int by = (k.row + 1) * CELL;
				int mx = k.col * CELL + CELL / 2 + k.shift;
				int owner = k.ownedByFirst ? p : p + cols;
				int sgn = k.ownedByFirst ? 1 : -1;
				for(int x=mx - k.halfWidth; x<=mx + k.halfWidth; x++){
					for(int y=by - k.depth - 1; y<=by + k.depth; y++){
						double u = (y - by + 0.5) * sgn;
						if(u < 0){
							continue;
						}
						double a = u / k.depth, b = (x - mx) / (double) k.halfWidth;
						if(a*a + b*b <= 1.0){
							lab[y*w + x] = owner;
						}
					}
				}
			}
		}
		return lab;
	}

	/**
	 * Cut every cell into its own tile. A cell is turned by
	 * <code>rotations[i]</code> quarter turns counter-clockwise.
	 */
	public static List<BufferedImage> cut(int[] lab, int rows, int cols, ColorField color, int[] rotations){
		int w = cols * CELL;
		List<BufferedImage> tiles = new ArrayList<>();
		for(int idx=0; idx<rows*cols; idx++){
			int r = idx / cols, c = idx % cols;
			int ox = c*CELL + CELL/2 - TILE/2;
			int oy = r*CELL + CELL/2 - TILE/2;
			int k = rotations == null ? 0 : rotations[idx];
			BufferedImage tile = new BufferedImage(TILE, TILE, BufferedImage.TYPE_INT_ARGB);
			for(int i=0;i<lab.length;i++){
				if(lab[i] != idx){
					continue;
				}
				int x = i % w, y = i / w;
				int tx = x - ox, ty = y - oy;
				for(int n=0;n<k;n++){
					int t = tx;
					tx = ty;
					ty = TILE - 1 - t;
				}
				tile.setRGB(tx, ty, 0xff000000 | color.rgb(x, y));
			}
			tiles.add(tile);
		}
		return tiles;
	}

	/**
	 * Two grey cells side by side; the left one carries a knob into the
	 * right one, and the right tile is turned upside down.
	 */
	public static List<BufferedImage> twoPieces(){
		List<Knob> knobs = new ArrayList<>();
		knobs.add(new Knob(true, 0, 0, true, 9, 9, 0));
		return cut(labels(1, 2, knobs), 1, 2, (x, y) -> rgb(128, 128, 128), new int[]{0, 2});
	}

	/**
	 * Knobs with varying size, position and owner for every inner border.
	 */
	public static List<Knob> gridKnobs(int rows, int cols){
		List<Knob> knobs = new ArrayList<>();
		int n = 0;
		for(int r=0;r<rows;r++){
			for(int c=0;c<cols;c++){
				if(c < cols - 1){
					knobs.add(new Knob(true, r, c, (r + c) % 2 == 0, 7 + n % 4, 7 + (n*3) % 4, (n*5) % 7 - 3));
					n++;
				}
				if(r < rows - 1){
					knobs.add(new Knob(false, r, c, (r + c) % 2 == 1, 7 + n % 4, 7 + (n*3) % 4, (n*5) % 7 - 3));
					n++;
				}
			}
		}
		return knobs;
	}

	/**
	 * A grid puzzle cut from a smooth color gradient.
	 */
	public static List<BufferedImage> gridPuzzle(int rows, int cols, int[] rotations){
		int w = cols * CELL, h = rows * CELL;
		ColorField gradient = (x, y) -> rgb(
				(int) (40 + 200.0 * x / w),
				(int) (40 + 200.0 * y / h),
				(int) (120 + 100 * Math.sin((x + y) / 37.0)));
		return cut(labels(rows, cols, gridKnobs(rows, cols)), rows, cols, gradient, rotations);
	}

	/**
	 * A plain blue square with no knobs.
	 */
	public static BufferedImage loneSquare(){
		BufferedImage tile = new BufferedImage(TILE, TILE, BufferedImage.TYPE_INT_ARGB);
		for(int y=28;y<68;y++){
			for(int x=28;x<68;x++){
				tile.setRGB(x, y, 0xff000000 | rgb(20, 40, 220));
			}
		}
		return tile;
	}

	/**
	 * The tile turned by the given number of quarter turns, the same way
	 * {@link #cut} turns cells.
	 */
	public static BufferedImage turn(BufferedImage tile, int quarterTurns){
		BufferedImage out = tile;
		for(int n=0;n<quarterTurns;n++){
			BufferedImage src = out;
			out = new BufferedImage(src.getHeight(), src.getWidth(), BufferedImage.TYPE_INT_ARGB);
			for(int y=0;y<src.getHeight();y++){
				for(int x=0;x<src.getWidth();x++){
					out.setRGB(y, src.getWidth() - 1 - x, src.getRGB(x, y));
				}
			}
		}
		return out;
	}

	/**
	 * Index of the contour point nearest to (x,y).
	 */
	public static int nearestContourIndex(Piece piece, int x, int y){
		List<Point> contour = piece.getContour();
		int best = 0;
		long bestDist = Long.MAX_VALUE;
		for(int i=0;i<contour.size();i++){
			long dx = contour.get(i).x - x, dy = contour.get(i).y - y;
			if(dx*dx + dy*dy < bestDist){
				bestDist = dx*dx + dy*dy;
				best = i;
			}
		}
		return best;
	}

	public static List<Piece> toPieces(List<BufferedImage> tiles){
		List<Piece> pieces = new ArrayList<>();
		for(int i=0;i<tiles.size();i++){
			pieces.add(new Piece(i, tiles.get(i)));
		}
		return pieces;
	}

	public static int rgb(int r, int g, int b){
		return (r << 16) | (g << 8) | b;
	}
}
