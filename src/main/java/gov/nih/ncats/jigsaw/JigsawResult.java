package gov.nih.ncats.jigsaw;

import java.awt.Point;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

import gov.nih.ncats.jigsaw.internal.algo.FitMatch;

/**
 * Outcome of assembling one puzzle.
 */
public interface JigsawResult {

    /**
     * The placed pieces drawn into one ARGB image. Rendered on the first
     * call and cached.
     * @return an Optional containing the image or an empty Optional if there was an error.
     */
    Optional<BufferedImage> getComposedImage();

    /**
     * Absolute coordinates of the top left pixel of {@link #getComposedImage()}.
     * @return an Optional containing the origin or an empty Optional if there was an error.
     */
    Optional<Point> getImageOrigin();

    /**
     * Placement of every placed piece, keyed by piece index, in placement order.
     */
    Map<Integer, Placement> getPlacements();

    /**
     * The matches used to place pieces, in the order they were locked.
     */
    List<FitMatch> getLockedMatches();

    /**
     * The full match list the assembler walked, mirrors and manual matches included.
     */
    List<FitMatch> getMatches();

    SortedSet<Integer> getUnplacedPieces();

    /**
     * Contact points of the locked matches mapped into scan coordinates.
     * Pieces without a known scan center report tile coordinates.
     */
    List<ContactPoint> getContactPoints();

    /**
     * @return true if every piece was placed.
     */
    boolean isComplete();

    /**
     * If there was an error during assembly.
     * @return
     */
    boolean hasError();

    /**
     * Return the Throwable error if there is one; or empty optional if there is no error.
     * @return
     *
     * @see #hasError()
     */
    Optional<Throwable> getError();

    /**
     * Factory method to create a JigsawResult that has the given error.
     * @param t
     * @return
     */
    static JigsawResult createFromError(Throwable t){
        return new ErrorResult(t);
    }
}
