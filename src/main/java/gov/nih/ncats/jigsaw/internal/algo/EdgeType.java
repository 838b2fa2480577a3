package gov.nih.ncats.jigsaw.internal.algo;

/**
 * Whether a stretch of contour bulges out of the piece or is cut into it.
 */
public enum EdgeType {
	/**
	 * convex knob
	 */
	TAB,
	/**
	 * concave socket
	 */
	BLANK;
}
