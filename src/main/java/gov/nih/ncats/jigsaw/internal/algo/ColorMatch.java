package gov.nih.ncats.jigsaw.internal.algo;

/**
 * A {@link FormMatch} whose color profiles also agree.
 */
public class ColorMatch extends FormMatch {

	private final double colorDistance;

	public ColorMatch(FormMatch form, double colorDistance) {
		super(form);
		this.colorDistance = colorDistance;
	}

	protected ColorMatch(ColorMatch other) {
		super(other);
		this.colorDistance = other.colorDistance;
	}

	public double getColorDistance() {
		return colorDistance;
	}

	@Override
	public String toString() {
		return super.toString() + "[color=" + colorDistance + "]";
	}
}
