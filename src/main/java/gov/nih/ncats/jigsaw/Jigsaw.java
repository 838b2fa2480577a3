package gov.nih.ncats.jigsaw;

import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

import gov.nih.ncats.jigsaw.internal.algo.Assembler;
import gov.nih.ncats.jigsaw.internal.algo.Assembly;
import gov.nih.ncats.jigsaw.internal.algo.FitMatch;
import gov.nih.ncats.jigsaw.internal.algo.MatchSetBuilder;
import gov.nih.ncats.jigsaw.internal.image.ImageUtil;
import gov.nih.ncats.jigsaw.internal.image.Piece;

/**
 * Entry point: matches the edges of scanned puzzle pieces and assembles
 * them into one image.
 */
public final class Jigsaw {
	private static final Logger logger = Logger.getLogger(Jigsaw.class.getName());

	private Jigsaw(){
		//can not instantiate
	}

	/**
	 * Assemble the given piece images with the default options.
	 * @param tiles one image per piece, transparent outside the piece; can not be null.
	 * @return the {@link JigsawResult}.
	 * @throws NullPointerException if tiles is null.
	 * @throws IllegalArgumentException if there are no tiles or a tile has no opaque pixel.
	 */
	public static JigsawResult assemble(List<BufferedImage> tiles){
		return assemble(tiles, null);
	}

	/**
	 * Assemble the given piece images.
	 * @param tiles one image per piece, transparent outside the piece; can not be null.
	 * @param options the {@link JigsawOptions} to use; if options is null, then the default options are used.
	 * @return the {@link JigsawResult}.
	 * @throws NullPointerException if tiles is null.
	 * @throws IllegalArgumentException if there are no tiles or a tile has no opaque pixel.
	 */
	public static JigsawResult assemble(List<BufferedImage> tiles, JigsawOptions options){
		return assemble(tiles, null, options);
	}

	/**
	 * Assemble the given piece images, remembering where each piece was
	 * found in the original scan.
	 * @param tiles one image per piece, transparent outside the piece; can not be null.
	 * @param scanCenters the center of each piece in the scan, in the same order as tiles;
	 *                    may be null if unknown.
	 * @param options the {@link JigsawOptions} to use; if options is null, then the default options are used.
	 * @return the {@link JigsawResult}.
	 */
	public static JigsawResult assemble(List<BufferedImage> tiles, List<? extends Point2D> scanCenters, JigsawOptions options){
		checkNotNull(tiles);
		options = Optional.ofNullable(options).orElseGet(JigsawOptions::new);
		if(scanCenters !=null && scanCenters.size() != tiles.size()){
			throw new IllegalArgumentException("got " + scanCenters.size() + " scan centers for " + tiles.size() + " tiles");
		}
		List<Piece> pieces = new ArrayList<>(tiles.size());
		for(int i=0;i<tiles.size();i++){
			BufferedImage tile = Objects.requireNonNull(tiles.get(i), "tile can not be null");
			Point2D center = scanCenters==null? null : scanCenters.get(i);
			pieces.add(toPiece(i, tile, center, options.getTileSize()));
		}
		return assemblePieces(pieces, options);
	}

	/**
	 * Read and assemble piece images stored in files.
	 * @throws IOException if there are any problems reading the images.
	 */
	public static JigsawResult assembleFiles(List<File> files, JigsawOptions options) throws IOException{
		checkNotNull(files);
		List<BufferedImage> tiles = new ArrayList<>(files.size());
		for(File f : files){
			tiles.add(ImageUtil.read(Objects.requireNonNull(f)));
		}
		return assemble(tiles, options);
	}

	/**
	 * Read and assemble encoded piece images.
	 * @throws IOException if there are any problems parsing the images.
	 */
	public static JigsawResult assembleBytes(List<byte[]> images, JigsawOptions options) throws IOException{
		checkNotNull(images);
		List<BufferedImage> tiles = new ArrayList<>(images.size());
		for(byte[] b : images){
			tiles.add(ImageUtil.read(Objects.requireNonNull(b)));
		}
		return assemble(tiles, options);
	}

	public static CompletableFuture<JigsawResult> assembleAsync(List<BufferedImage> tiles, JigsawOptions options){
		return CompletableFuture.supplyAsync(() -> {
			try{
				return assemble(tiles, options);
			}catch(Exception e){
				return JigsawResult.createFromError(e);
			}
		});
	}

	public static CompletableFuture<JigsawResult> assembleAsync(List<BufferedImage> tiles, JigsawOptions options, Executor executor){
		return CompletableFuture.supplyAsync(() -> {
			try{
				return assemble(tiles, options);
			}catch(Exception e){
				return JigsawResult.createFromError(e);
			}
		}, executor);
	}

	public static CompletableFuture<JigsawResult> assembleFilesAsync(List<File> files, JigsawOptions options){
		return CompletableFuture.supplyAsync(() -> {
			try{
				return assembleFiles(files, options);
			}catch(Exception e){
				return JigsawResult.createFromError(e);
			}
		});
	}

	static JigsawResult assemblePieces(List<Piece> pieces, JigsawOptions options){
		if(pieces.isEmpty()){
			throw new IllegalArgumentException("no pieces to assemble");
		}
		if(options.getSeedPiece() >= pieces.size()){
			throw new IllegalArgumentException("seed piece " + options.getSeedPiece() + " out of range, only " + pieces.size() + " pieces");
		}
		long start = System.currentTimeMillis();
		List<FitMatch> matches = new MatchSetBuilder(options).build(pieces);
		Assembly assembly = new Assembler(options).assemble(pieces, matches);
		logger.info(String.format("assembled %d/%d pieces in %.3fs",
				assembly.getPlacedCount(), pieces.size(), 1e-3*(System.currentTimeMillis() - start)));
		return new AssemblyResult(assembly, matches);
	}

	/**
	 * Square tiles of the configured size are taken as they are; anything
	 * else is normalized into one first.
	 */
	static Piece toPiece(int index, BufferedImage image, Point2D scanCenter, int tileSize){
		if(image.getWidth() == tileSize && image.getHeight() == tileSize){
			return new Piece(index, image, scanCenter, 1.0);
		}
		ImageUtil.NormalizedTile nt = ImageUtil.normalize(image, tileSize);
		return new Piece(index, nt.getTile(), scanCenter, nt.getScale());
	}

	private static void checkNotNull(Object obj){
		Objects.requireNonNull(obj, "input can not be null");
	}
}
