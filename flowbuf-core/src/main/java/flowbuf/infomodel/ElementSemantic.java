package flowbuf.infomodel;

import java.util.Locale;

public enum ElementSemantic {
    DEFAULT("default"),
    QUANTITY("quantity"),
    TOTAL_COUNTER("totalCounter"),
    DELTA_COUNTER("deltaCounter"),
    IDENTIFIER("identifier"),
    FLAGS("flags"),
    LIST("list"),
    SNMP_COUNTER("snmpCounter"),
    SNMP_GAUGE("snmpGauge");

    public final String ianaName;

    ElementSemantic(String ianaName) {
        this.ianaName = ianaName;
    }

    public int code() {
        return ordinal();
    }

    /**
     * Blank or unknown names are mapped to {@link #DEFAULT}.
     */
    public static ElementSemantic fromName(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT;
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (ElementSemantic s: values()) {
            if (s.ianaName.toLowerCase(Locale.ROOT).equals(lower)) {
                return s;
            }
        }
        return DEFAULT;
    }
}
