package flowbuf.infomodel;

/**
 * What to do when a template declares a length that is illegal for the
 * element's type.
 */
public enum LengthPolicy {
    /** Fail the whole template. */
    REJECT,
    /** Log a warning and keep the declared length. */
    WARN,
}
