package gov.nih.ncats.jigsaw.internal.algo;

import java.awt.Point;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import gov.nih.ncats.jigsaw.Placement;
import gov.nih.ncats.jigsaw.internal.image.Footprint;
import gov.nih.ncats.jigsaw.internal.image.Piece;

/**
 * Growing layout of placed pieces. Every piece is kept as a rigid
 * placement in one fixed absolute frame; pixels only exist in the
 * combined footprint and in the image rendered on request.
 *
 * Pieces are only ever added and matches only ever locked.
 */
public class Assembly {

	private final List<Piece> pieces;
	private final Map<Integer, Placement> placements = new LinkedHashMap<>();
	private final Set<FitMatch> locked = Collections.newSetFromMap(new IdentityHashMap<>());
	private final List<FitMatch> lockOrder = new ArrayList<>();
	private Footprint footprint = Footprint.empty();
	private int passes;

	public Assembly(List<Piece> pieces){
		for(int i=0;i<pieces.size();i++){
			if(pieces.get(i).getIndex() != i){
				throw new IllegalArgumentException("piece at position " + i + " has index " + pieces.get(i).getIndex());
			}
		}
		this.pieces = Collections.unmodifiableList(new ArrayList<>(pieces));
	}

	/**
	 * Place the first piece.
	 */
	void seed(int piece, Placement placement){
		if(!placements.isEmpty()){
			throw new IllegalStateException("assembly already seeded");
		}
		add(piece, placement, Footprint.of(pieces.get(piece), placement));
	}

	/**
	 * Place a piece through a match and lock the match.
	 *
	 * @throws IllegalStateException if the match is already locked or the
	 * piece already placed.
	 */
	void attach(FitMatch via, Placement placement, Footprint pieceFootprint){
		if(locked.contains(via)){
			throw new IllegalStateException("match already locked: " + via);
		}
		add(via.getPieceB(), placement, pieceFootprint);
		locked.add(via);
		lockOrder.add(via);
	}

	private void add(int piece, Placement placement, Footprint pieceFootprint){
		if(placements.containsKey(piece)){
			throw new IllegalStateException("piece " + piece + " already placed");
		}
		placements.put(piece, placement);
		footprint = footprint.union(pieceFootprint);
	}

	void endPass(){
		passes++;
	}

	public List<Piece> getPieces() {
		return pieces;
	}

	public boolean isPlaced(int piece){
		return placements.containsKey(piece);
	}

	public Placement getPlacement(int piece){
		return placements.get(piece);
	}

	/**
	 * placements in the order the pieces were placed
	 */
	public Map<Integer, Placement> getPlacements() {
		return Collections.unmodifiableMap(placements);
	}

	public int getPlacedCount(){
		return placements.size();
	}

	public boolean isLocked(FitMatch match){
		return locked.contains(match);
	}

	public List<FitMatch> getLockedMatches() {
		return Collections.unmodifiableList(lockOrder);
	}

	public SortedSet<Integer> getUnplaced(){
		SortedSet<Integer> unplaced = new TreeSet<>();
		for(int i=0;i<pieces.size();i++){
			if(!placements.containsKey(i)){
				unplaced.add(i);
			}
		}
		return unplaced;
	}

	public boolean isComplete(){
		return placements.size() == pieces.size();
	}

	public Footprint getFootprint() {
		return footprint;
	}

	public int getPasses() {
		return passes;
	}

	/**
	 * absolute coordinates of pixel (0,0) of the {@link #render() rendered image}
	 */
	public Point getOrigin(){
		Rectangle r = footprint.getBounds();
		return new Point(r.x, r.y);
	}

	/**
	 * Draw every placed piece into one ARGB image covering the footprint.
	 * Where pieces overlap, the earlier placed piece wins.
	 */
	public BufferedImage render(){
		Rectangle r = footprint.getBounds();
		BufferedImage img = new BufferedImage(Math.max(1, r.width), Math.max(1, r.height), BufferedImage.TYPE_INT_ARGB);
		for(Map.Entry<Integer, Placement> e : placements.entrySet()){
			Piece piece = pieces.get(e.getKey());
			Footprint.rasterize(piece, e.getValue(), (x, y, sx, sy) -> {
				int ix = x - r.x, iy = y - r.y;
				if((img.getRGB(ix, iy) >>> 24) == 0){
					img.setRGB(ix, iy, piece.getARGB(sx, sy));
				}
			});
		}
		return img;
	}
}
