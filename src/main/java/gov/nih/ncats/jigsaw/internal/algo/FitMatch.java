package gov.nih.ncats.jigsaw.internal.algo;

import java.awt.Point;

/**
 * A {@link ColorMatch} that survived the trial placement of the two
 * pieces. Lower scores are better.
 */
public class FitMatch extends ColorMatch {

	private final double pixelLoss;
	private final double fit;
	private final double score;
	private final boolean manual;

	public FitMatch(ColorMatch color, double pixelLoss, double fit, double score) {
		this(color, pixelLoss, fit, score, false);
	}

	private FitMatch(ColorMatch color, double pixelLoss, double fit, double score, boolean manual) {
		super(color);
		this.pixelLoss = pixelLoss;
		this.fit = fit;
		this.score = score;
		this.manual = manual;
	}

	/**
	 * A match supplied by the caller instead of found by matching. It has
	 * no window offsets and no measured distances.
	 */
	public static FitMatch manual(int pieceA, int pieceB, Point pointA, Point pointB, double angle){
		FormMatch form = new FormMatch(pieceA, pieceB, -1, -1, pointA, pointB, angle, Double.NaN);
		return new FitMatch(new ColorMatch(form, Double.NaN), Double.NaN, Double.NaN, Double.NaN, true);
	}

	/**
	 * The same joint seen from piece B.
	 */
	public FitMatch mirror(){
		FormMatch form = new FormMatch(getPieceB(), getPieceA(), getOffsetB(), getOffsetA(),
				getPointB(), getPointA(), -getAngle(), getShapeDistance());
		return new FitMatch(new ColorMatch(form, getColorDistance()), pixelLoss, fit, score, manual);
	}

	/**
	 * Fraction of pixels lost when the two footprints are merged.
	 */
	public double getPixelLoss() {
		return pixelLoss;
	}

	/**
	 * Outer boundary of the merged footprints relative to the two contours.
	 */
	public double getFit() {
		return fit;
	}

	public double getScore() {
		return score;
	}

	public boolean isManual() {
		return manual;
	}

	@Override
	public String toString() {
		return super.toString() + "[score=" + score + (manual ? ", manual" : "") + "]";
	}
}
