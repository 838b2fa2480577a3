package gov.nih.ncats.jigsaw.internal.algo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import gov.nih.ncats.jigsaw.JigsawOptions;
import gov.nih.ncats.jigsaw.internal.image.Piece;

/**
 * Runs the pairwise matcher over every unordered pair of pieces and
 * merges the results, each with its mirror, into one sorted list.
 */
public class MatchSetBuilder {
	private static final Logger logger = Logger.getLogger(MatchSetBuilder.class.getName());

	/**
	 * Unordered pair first, then score. The remaining keys make the
	 * order total so it does not depend on how candidates were produced.
	 */
	public static final Comparator<FitMatch> GLOBAL_ORDER =
			Comparator.<FitMatch>comparingInt(m -> Math.min(m.getPieceA(), m.getPieceB()))
					.thenComparingInt(m -> Math.max(m.getPieceA(), m.getPieceB()))
					.thenComparingDouble(FitMatch::getScore)
					.thenComparingInt(FitMatch::getPieceA)
					.thenComparingInt(FitMatch::getPieceB)
					.thenComparingInt(FitMatch::getOffsetA)
					.thenComparingInt(FitMatch::getOffsetB);

	private final JigsawOptions options;
	private final PairwiseEdgeMatcher matcher;
	private final MatchValidator validator;

	public MatchSetBuilder(JigsawOptions options){
		this.options = options;
		this.matcher = new PairwiseEdgeMatcher(options);
		this.validator = new MatchValidator(options);
	}

	/**
	 * Form, color and fit stages for one pair.
	 */
	public List<FitMatch> matchPair(Piece a, Piece b){
		List<FormMatch> forms = matcher.formMatches(a, b);
		List<ColorMatch> colors = matcher.colorMatches(a, b, forms);
		List<FitMatch> fits = validator.validate(a, b, colors);
		if(options.isDebug()){
			logger.info("pair " + a.getIndex() + "/" + b.getIndex() + ": form " + forms.size()
					+ " color " + colors.size() + " fit " + fits.size());
		}
		return fits;
	}

	/**
	 * @return every found match and its mirror in {@link #GLOBAL_ORDER},
	 * followed by the manual matches of the options, each with its mirror.
	 */
	public List<FitMatch> build(List<Piece> pieces){
		for(Piece p : pieces){
			if(p.getContour().size() < options.getWindowLength()){
				logger.warning("piece " + p.getIndex() + " has a contour of " + p.getContour().size()
						+ " points, shorter than the window length " + options.getWindowLength());
			}
		}
		List<int[]> pairs = new ArrayList<>();
		for(int i=0;i<pieces.size()-1;i++){
			for(int j=i+1;j<pieces.size();j++){
				pairs.add(new int[]{i, j});
			}
		}

		List<List<FitMatch>> perPair = matchAll(pieces, pairs);

		List<FitMatch> found = new ArrayList<>();
		perPair.forEach(found::addAll);
		List<FitMatch> all = new ArrayList<>(found.size() * 2);
		all.addAll(found);
		for(FitMatch m : found){
			all.add(m.mirror());
		}
		all.sort(GLOBAL_ORDER);
		logger.info(pairs.size() + " pairs, " + found.size() + " matches (" + all.size() + " with mirrors)");

		for(FitMatch m : options.getManualMatches()){
			if(m.getPieceA() >= pieces.size() || m.getPieceB() >= pieces.size()){
				logger.warning("ignoring manual match for unknown piece: " + m);
				continue;
			}
			all.add(m);
			all.add(m.mirror());
		}
		return all;
	}

	private List<List<FitMatch>> matchAll(List<Piece> pieces, List<int[]> pairs){
		if(options.getParallelism() == 1 || pairs.size() < 2){
			return collect(pairs.stream(), pieces);
		}
		ForkJoinPool pool = new ForkJoinPool(options.getParallelism());
		try{
			//collect keeps pair order, so the merge matches the sequential run
			return pool.submit(() -> collect(pairs.parallelStream(), pieces)).get();
		}catch(InterruptedException e){
			Thread.currentThread().interrupt();
			throw new IllegalStateException("interrupted while matching", e);
		}catch(ExecutionException e){
			Throwable cause = e.getCause();
			if(cause instanceof RuntimeException){
				throw (RuntimeException) cause;
			}
			if(cause instanceof Error){
				throw (Error) cause;
			}
			throw new IllegalStateException(cause);
		}finally{
			pool.shutdown();
		}
	}

	private List<List<FitMatch>> collect(Stream<int[]> pairs, List<Piece> pieces){
		return pairs.map(p -> matchPair(pieces.get(p[0]), pieces.get(p[1])))
				.collect(Collectors.toList());
	}
}
