package flowbuf.infomodel;

import java.util.Locale;

public enum ElementUnits {
    NONE("none"),
    BITS("bits"),
    OCTETS("octets"),
    PACKETS("packets"),
    SECONDS("seconds"),
    MILLISECONDS("milliseconds"),
    MICROSECONDS("microseconds"),
    NANOSECONDS("nanoseconds"),
    FOUR_OCTET_WORDS("4-octet words"),
    MESSAGES("messages"),
    HOPS("hops"),
    ENTRIES("entries"),
    FRAMES("frames"),
    PORTS("ports"),
    INFERRED("inferred"),
    FLOWS("flows");

    public final String ianaName;

    ElementUnits(String ianaName) {
        this.ianaName = ianaName;
    }

    public int code() {
        return ordinal();
    }

    public static ElementUnits fromName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (ElementUnits u: values()) {
            if (u.ianaName.equals(lower)) {
                return u;
            }
        }
        return NONE;
    }
}
