package gov.nih.ncats.jigsaw;

import java.awt.Point;
import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

import gov.nih.ncats.jigsaw.internal.algo.FitMatch;

class ErrorResult implements JigsawResult{

    private final Throwable t;

    public ErrorResult(Throwable t) {
        this.t = Objects.requireNonNull(t);
    }

    @Override
    public Optional<BufferedImage> getComposedImage() {
        return Optional.empty();
    }

    @Override
    public Optional<Point> getImageOrigin() {
        return Optional.empty();
    }

    @Override
    public Map<Integer, Placement> getPlacements() {
        return Collections.emptyMap();
    }

    @Override
    public List<FitMatch> getLockedMatches() {
        return Collections.emptyList();
    }

    @Override
    public List<FitMatch> getMatches() {
        return Collections.emptyList();
    }

    @Override
    public SortedSet<Integer> getUnplacedPieces() {
        return Collections.unmodifiableSortedSet(new TreeSet<>());
    }

    @Override
    public List<ContactPoint> getContactPoints() {
        return Collections.emptyList();
    }

    @Override
    public boolean isComplete() {
        return false;
    }

    @Override
    public boolean hasError() {
        return true;
    }

    @Override
    public Optional<Throwable> getError() {
        return Optional.of(t);
    }
}
