package flowbuf.types;

/**
 * Structured data semantic, RFC 6313 section 4.4.
 */
public enum ListSemantic {
    NONE_OF(0),
    EXACTLY_ONE_OF(1),
    ONE_OR_MORE_OF(2),
    ALL_OF(3),
    ORDERED(4),
    UNDEFINED(0xFF);

    public final int code;

    ListSemantic(int code) {
        this.code = code;
    }

    /**
     * Unknown codes are mapped to {@link #UNDEFINED}.
     */
    public static ListSemantic fromCode(int code) {
        return switch (code) {
            case 0 -> NONE_OF;
            case 1 -> EXACTLY_ONE_OF;
            case 2 -> ONE_OR_MORE_OF;
            case 3 -> ALL_OF;
            case 4 -> ORDERED;
            default -> UNDEFINED;
        };
    }
}
