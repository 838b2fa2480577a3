package gov.nih.ncats.jigsaw.internal.algo;

import java.awt.geom.Point2D;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.jigsaw.JigsawOptions;
import gov.nih.ncats.jigsaw.Placement;
import gov.nih.ncats.jigsaw.internal.image.Footprint;
import gov.nih.ncats.jigsaw.internal.image.Piece;
import gov.nih.ncats.jigsaw.internal.util.RigidTransforms;

/**
 * Greedy assembly. Starting from the seed piece, the sorted match list
 * is scanned repeatedly; a match whose first piece is placed and whose
 * second is not places the second piece, unless that piece would cover
 * too much of what is already there. Nothing is ever taken back.
 */
public class Assembler {
	private static final Logger logger = Logger.getLogger(Assembler.class.getName());

	private final JigsawOptions options;

	public Assembler(JigsawOptions options){
		this.options = options;
	}

	public Assembly assemble(List<Piece> pieces, List<FitMatch> matches){
		Objects.requireNonNull(pieces);
		Objects.requireNonNull(matches);
		if(pieces.isEmpty()){
			throw new IllegalArgumentException("no pieces to assemble");
		}
		int seed = options.getSeedPiece();
		if(seed >= pieces.size()){
			throw new IllegalArgumentException("seed piece " + seed + " out of range, only " + pieces.size() + " pieces");
		}

		Assembly assembly = new Assembly(pieces);
		Point2D sc = options.getSeedCenter();
		assembly.seed(seed, new Placement(sc.getY(), sc.getX(), 0));

		while(!assembly.isComplete() && assembly.getPasses() < options.getMaxPasses()){
			int before = assembly.getPlacedCount();
			for(FitMatch m : matches){
				tryAttach(assembly, m);
			}
			assembly.endPass();
			logger.info("pass " + assembly.getPasses() + ": placed " + (assembly.getPlacedCount() - before)
					+ ", " + assembly.getPlacedCount() + "/" + pieces.size() + " in place");
		}

		if(assembly.isComplete()){
			logger.info("all " + pieces.size() + " pieces placed in " + assembly.getPasses() + " passes");
		}else{
			logger.info("unplaced pieces after " + assembly.getPasses() + " passes: " + assembly.getUnplaced());
		}
		return assembly;
	}

	/**
	 * @return true if the match placed its second piece.
	 */
	boolean tryAttach(Assembly assembly, FitMatch m){
		if(!assembly.isPlaced(m.getPieceA()) || assembly.isPlaced(m.getPieceB())){
			return false;
		}
		List<Piece> pieces = assembly.getPieces();
		Piece a = pieces.get(m.getPieceA());
		Piece b = pieces.get(m.getPieceB());
		Placement posB = RigidTransforms.attach(assembly.getPlacement(a.getIndex()), a.getLocalCenter(), m.getPointA(),
				b.getLocalCenter(), m.getPointB(), m.getAngle());
		Footprint fb = Footprint.of(b, posB);
		if(fb.isEmpty()){
			return false;
		}
		double overlap = fb.overlap(assembly.getFootprint()) / (double) fb.count();
		if(overlap >= options.getMaxOverlap()){
			if(options.isDebug()){
				logger.info("rejected " + m + ": overlap " + overlap);
			}
			return false;
		}
		assembly.attach(m, posB, fb);
		if(logger.isLoggable(Level.FINE) || options.isDebug()){
			logger.log(options.isDebug() ? Level.INFO : Level.FINE,
					"placed piece " + b.getIndex() + " at " + posB + " via " + m + ", overlap " + overlap);
		}
		return true;
	}
}
