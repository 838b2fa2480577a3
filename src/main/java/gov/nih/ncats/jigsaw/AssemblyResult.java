package gov.nih.ncats.jigsaw;

import java.awt.Point;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

import gov.nih.ncats.jigsaw.internal.algo.Assembly;
import gov.nih.ncats.jigsaw.internal.algo.FitMatch;
import gov.nih.ncats.jigsaw.internal.image.Piece;
import gov.nih.ncats.jigsaw.internal.util.CachedSupplier;

class AssemblyResult implements JigsawResult {

	private final Assembly assembly;
	private final List<FitMatch> matches;
	private final CachedSupplier<BufferedImage> image;
	private final CachedSupplier<List<ContactPoint>> contacts;

	AssemblyResult(Assembly assembly, List<FitMatch> matches){
		this.assembly = assembly;
		this.matches = Collections.unmodifiableList(new ArrayList<>(matches));
		this.image = CachedSupplier.of(assembly::render);
		this.contacts = CachedSupplier.of(this::computeContactPoints);
	}

	private List<ContactPoint> computeContactPoints(){
		List<ContactPoint> list = new ArrayList<>();
		List<Piece> pieces = assembly.getPieces();
		int n = 1;
		for(FitMatch m : assembly.getLockedMatches()){
			Piece a = pieces.get(m.getPieceA());
			Piece b = pieces.get(m.getPieceB());
			list.add(new ContactPoint(n++, a.getIndex(), a.toScanCoordinates(m.getPointA()),
					b.getIndex(), b.toScanCoordinates(m.getPointB())));
		}
		return Collections.unmodifiableList(list);
	}

	@Override
	public Optional<BufferedImage> getComposedImage() {
		return Optional.of(image.get());
	}

	@Override
	public Optional<Point> getImageOrigin() {
		return Optional.of(assembly.getOrigin());
	}

	@Override
	public Map<Integer, Placement> getPlacements() {
		return assembly.getPlacements();
	}

	@Override
	public List<FitMatch> getLockedMatches() {
		return assembly.getLockedMatches();
	}

	@Override
	public List<FitMatch> getMatches() {
		return matches;
	}

	@Override
	public SortedSet<Integer> getUnplacedPieces() {
		return Collections.unmodifiableSortedSet(assembly.getUnplaced());
	}

	@Override
	public List<ContactPoint> getContactPoints() {
		return contacts.get();
	}

	@Override
	public boolean isComplete() {
		return assembly.isComplete();
	}

	@Override
	public boolean hasError() {
		return false;
	}

	@Override
	public Optional<Throwable> getError() {
		return Optional.empty();
	}
}
