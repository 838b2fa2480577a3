package gov.nih.ncats.jigsaw;

import java.awt.Point;
import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import gov.nih.ncats.jigsaw.internal.algo.FitMatch;

/**
 * Thresholds and knobs of the matching and assembly pipeline. The
 * defaults are tuned for pieces normalized into 300 pixel tiles.
 */
public class JigsawOptions {

	private static final boolean DEBUG = Boolean.getBoolean("jigsaw.debug");

	private int windowLength = 160;
	private double precision = 8;
	private int scanStep = 20;
	private int searchStep = 7;
	private double maxFormDistance = 0.015;
	private double maxColorDistance = 8000;
	private double maxPixelLoss = 0.03;
	private double maxFit = 0.77;
	private double maxOverlap = 0.1;
	private int maxPasses = 10;
	private int seedPiece = 0;
	private Point2D seedCenter = new Point2D.Double(700, 700);
	private int tileSize = 300;
	private int parallelism = Runtime.getRuntime().availableProcessors();
	private boolean debug = DEBUG;

	private final List<FitMatch> manualMatches = new ArrayList<>();


	public int getWindowLength() {
		return windowLength;
	}

	/**
	 * Number of contour points per window.
	 */
	public JigsawOptions windowLength(int windowLength){
		if(windowLength < 4){
			throw new IllegalArgumentException("window length must be >= 4");
		}
		this.windowLength = windowLength;
		return this;
	}

	public double getPrecision() {
		return precision;
	}

	/**
	 * Tolerance in pixels when comparing the sides of two window rectangles.
	 */
	public JigsawOptions precision(double precision){
		if(precision <= 0){
			throw new IllegalArgumentException("precision must be > 0");
		}
		this.precision = precision;
		return this;
	}

	public int getScanStep() {
		return scanStep;
	}

	/**
	 * Stride between window offsets on the first piece of a pair.
	 */
	public JigsawOptions scanStep(int scanStep){
		if(scanStep < 1){
			throw new IllegalArgumentException("scan step must be >= 1");
		}
		this.scanStep = scanStep;
		return this;
	}

	public int getSearchStep() {
		return searchStep;
	}

	/**
	 * Stride between window offsets on the second piece of a pair.
	 */
	public JigsawOptions searchStep(int searchStep){
		if(searchStep < 1){
			throw new IllegalArgumentException("search step must be >= 1");
		}
		this.searchStep = searchStep;
		return this;
	}

	public double getMaxFormDistance() {
		return maxFormDistance;
	}

	public JigsawOptions maxFormDistance(double maxFormDistance){
		this.maxFormDistance = requirePositive(maxFormDistance, "max form distance");
		return this;
	}

	public double getMaxColorDistance() {
		return maxColorDistance;
	}

	public JigsawOptions maxColorDistance(double maxColorDistance){
		this.maxColorDistance = requirePositive(maxColorDistance, "max color distance");
		return this;
	}

	public double getMaxPixelLoss() {
		return maxPixelLoss;
	}

	public JigsawOptions maxPixelLoss(double maxPixelLoss){
		this.maxPixelLoss = requireFraction(maxPixelLoss, "max pixel loss");
		return this;
	}

	public double getMaxFit() {
		return maxFit;
	}

	public JigsawOptions maxFit(double maxFit){
		this.maxFit = requirePositive(maxFit, "max fit");
		return this;
	}

	public double getMaxOverlap() {
		return maxOverlap;
	}

	/**
	 * Largest fraction of a new piece allowed to cover already placed pixels.
	 */
	public JigsawOptions maxOverlap(double maxOverlap){
		this.maxOverlap = requireFraction(maxOverlap, "max overlap");
		return this;
	}

	public int getMaxPasses() {
		return maxPasses;
	}

	public JigsawOptions maxPasses(int maxPasses){
		if(maxPasses < 1){
			throw new IllegalArgumentException("max passes must be >= 1");
		}
		this.maxPasses = maxPasses;
		return this;
	}

	public int getSeedPiece() {
		return seedPiece;
	}

	/**
	 * Index of the piece placed first, at {@link #getSeedCenter()} and angle 0.
	 */
	public JigsawOptions seedPiece(int seedPiece){
		if(seedPiece < 0){
			throw new IllegalArgumentException("seed piece must be >= 0");
		}
		this.seedPiece = seedPiece;
		return this;
	}

	public Point2D getSeedCenter() {
		return new Point2D.Double(seedCenter.getX(), seedCenter.getY());
	}

	public JigsawOptions seedCenter(double x, double y){
		this.seedCenter = new Point2D.Double(x, y);
		return this;
	}

	public int getTileSize() {
		return tileSize;
	}

	/**
	 * Edge of the square tile every piece image is normalized into.
	 */
	public JigsawOptions tileSize(int tileSize){
		if(tileSize < 8){
			throw new IllegalArgumentException("tile size must be >= 8");
		}
		this.tileSize = tileSize;
		return this;
	}

	public int getParallelism() {
		return parallelism;
	}

	/**
	 * Number of worker threads for pairwise matching; 1 runs sequentially.
	 */
	public JigsawOptions parallelism(int parallelism){
		if(parallelism < 1){
			throw new IllegalArgumentException("parallelism must be >= 1");
		}
		this.parallelism = parallelism;
		return this;
	}

	public boolean isDebug() {
		return debug;
	}

	/**
	 * Log every pair and every acceptance. Also switched on by the
	 * <code>jigsaw.debug</code> system property.
	 */
	public JigsawOptions debug(boolean debug){
		this.debug = debug;
		return this;
	}

	/**
	 * Add a joint the matcher is known to miss. It is tried, together with
	 * its mirror, after every found match.
	 *
	 * @param pieceA index of the first piece.
	 * @param pieceB index of the second piece.
	 * @param pointA contact point in A's tile.
	 * @param pointB contact point in B's tile.
	 * @param angle rotation of B relative to A in degrees, counter-clockwise.
	 */
	public JigsawOptions addManualMatch(int pieceA, int pieceB, Point pointA, Point pointB, double angle){
		Objects.requireNonNull(pointA);
		Objects.requireNonNull(pointB);
		if(pieceA < 0 || pieceB < 0 || pieceA == pieceB){
			throw new IllegalArgumentException("a manual match needs two distinct piece indices");
		}
		manualMatches.add(FitMatch.manual(pieceA, pieceB, pointA, pointB, angle));
		return this;
	}

	public List<FitMatch> getManualMatches() {
		return Collections.unmodifiableList(manualMatches);
	}

	private static double requirePositive(double v, String name){
		if(!(v > 0)){
			throw new IllegalArgumentException(name + " must be > 0");
		}
		return v;
	}

	private static double requireFraction(double v, String name){
		if(!(v > 0 && v <= 1)){
			throw new IllegalArgumentException(name + " must be in (0,1]");
		}
		return v;
	}
}
