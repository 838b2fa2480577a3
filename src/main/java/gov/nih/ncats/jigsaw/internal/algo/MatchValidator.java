package gov.nih.ncats.jigsaw.internal.algo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.jigsaw.JigsawOptions;
import gov.nih.ncats.jigsaw.Placement;
import gov.nih.ncats.jigsaw.internal.image.Footprint;
import gov.nih.ncats.jigsaw.internal.image.Piece;
import gov.nih.ncats.jigsaw.internal.util.GeomUtil;
import gov.nih.ncats.jigsaw.internal.util.RigidTransforms;

/**
 * Trial placement of two pieces at a candidate joint. A good joint
 * leaves the footprints nearly disjoint while their union has a short
 * outer boundary.
 */
public class MatchValidator {
	private static final Logger logger = Logger.getLogger(MatchValidator.class.getName());

	private final JigsawOptions options;

	public MatchValidator(JigsawOptions options){
		this.options = options;
	}

	/**
	 * Place A at its own tile center with no rotation and attach B to it.
	 *
	 * @return the scored match, or empty if either threshold rejects it.
	 */
	public Optional<FitMatch> validate(Piece a, Piece b, ColorMatch m){
		Placement posA = new Placement(a.getLocalCenter().y, a.getLocalCenter().x, 0);
		Placement posB = RigidTransforms.attach(posA, a.getLocalCenter(), m.getPointA(),
				b.getLocalCenter(), m.getPointB(), m.getAngle());
		Footprint fa = Footprint.of(a, posA);
		Footprint fb = Footprint.of(b, posB);
		Footprint union = fa.union(fb);

		double loss = 1 - union.count() / (double) (fa.count() + fb.count());
		if(loss >= options.getMaxPixelLoss()){
			return Optional.empty();
		}
		double fit = union.outerBoundaryLength() / (a.getContourLength() + b.getContourLength());
		if(fit >= options.getMaxFit()){
			return Optional.empty();
		}
		return Optional.of(new FitMatch(m, loss, fit, GeomUtil.round(loss + fit, 4)));
	}

	/**
	 * Validate every candidate of one pair.
	 *
	 * @return the survivors sorted by score, ties in candidate order.
	 */
	public List<FitMatch> validate(Piece a, Piece b, List<ColorMatch> candidates){
		List<FitMatch> fits = new ArrayList<>();
		for(ColorMatch m : candidates){
			validate(a, b, m).ifPresent(fits::add);
		}
		fits.sort(Comparator.comparingDouble(FitMatch::getScore));
		if(logger.isLoggable(Level.FINE)){
			logger.fine("pair " + a.getIndex() + "/" + b.getIndex() + ": " + fits.size() + " fit matches"
					+ (fits.isEmpty() ? "" : ", best " + fits.get(0)));
		}
		return fits;
	}
}
