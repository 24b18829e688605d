package flowbuf.infomodel;

import java.util.HashMap;
import java.util.Map;

/**
 * Abstract data types of RFC 7012 and RFC 6313, with their IANA names and
 * canonical encoded lengths.
 */
public enum DataType {
    OCTET_ARRAY("octetArray", InfoElement.VARLEN),
    UNSIGNED8("unsigned8", 1),
    UNSIGNED16("unsigned16", 2),
    UNSIGNED32("unsigned32", 4),
    UNSIGNED64("unsigned64", 8),
    SIGNED8("signed8", 1),
    SIGNED16("signed16", 2),
    SIGNED32("signed32", 4),
    SIGNED64("signed64", 8),
    FLOAT32("float32", 4),
    FLOAT64("float64", 8),
    BOOLEAN("boolean", 1),
    MAC_ADDRESS("macAddress", 6),
    STRING("string", InfoElement.VARLEN),
    DATETIME_SECONDS("dateTimeSeconds", 4),
    DATETIME_MILLISECONDS("dateTimeMilliseconds", 8),
    DATETIME_MICROSECONDS("dateTimeMicroseconds", 8),
    DATETIME_NANOSECONDS("dateTimeNanoseconds", 8),
    IPV4_ADDRESS("ipv4Address", 4),
    IPV6_ADDRESS("ipv6Address", 16),
    BASIC_LIST("basicList", InfoElement.VARLEN),
    SUB_TEMPLATE_LIST("subTemplateList", InfoElement.VARLEN),
    SUB_TEMPLATE_MULTI_LIST("subTemplateMultiList", InfoElement.VARLEN);

    private static final Map<String, DataType> BY_NAME = new HashMap<>();
    static {
        for (DataType t: values()) {
            BY_NAME.put(t.ianaName, t);
        }
    }

    public final String ianaName;
    public final int canonicalLength;

    DataType(String ianaName, int canonicalLength) {
        this.ianaName = ianaName;
        this.canonicalLength = canonicalLength;
    }

    /**
     * @return the type, or null if the name is unknown
     */
    public static DataType fromName(String name) {
        return BY_NAME.get(name);
    }

    public boolean isList() {
        return this == BASIC_LIST || this == SUB_TEMPLATE_LIST || this == SUB_TEMPLATE_MULTI_LIST;
    }

    public boolean isSigned() {
        return this == SIGNED8 || this == SIGNED16 || this == SIGNED32 || this == SIGNED64;
    }

    public boolean isUnsigned() {
        return this == UNSIGNED8 || this == UNSIGNED16 || this == UNSIGNED32 || this == UNSIGNED64;
    }

    public boolean isInteger() {
        return isSigned() || isUnsigned();
    }

    public boolean isTimestamp() {
        return this == DATETIME_SECONDS || this == DATETIME_MILLISECONDS || this == DATETIME_MICROSECONDS || this == DATETIME_NANOSECONDS;
    }

    /**
     * Types whose values are raw bytes of any length.
     */
    public boolean isOctets() {
        return this == OCTET_ARRAY || this == STRING;
    }

    @Override
    public String toString() {
        return ianaName;
    }
}
