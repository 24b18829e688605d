package flowbuf.buffer;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import flowbuf.infomodel.DataType;
import flowbuf.infomodel.InfoElement;
import flowbuf.types.MacAddress;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

/**
 * Conversions between encoded IPFIX values, always big endian, and Java values.
 */
public class Values {

    /** Seconds between 1900-01-01, the NTP epoch, and 1970-01-01. */
    public static final long NTP_EPOCH_OFFSET = 2208988800L;
    private static final long FRACTION_SCALE = 1L << 32;
    // RFC 7011 section 6.1.9, unused bits for microsecond precision
    private static final long MICROSECONDS_MASK = ~0x7FFL;

    private Values() {
    }

    /**
     * Read an unsigned integer of any length up to 8 bytes. Longer values keep
     * only their low-order 8 bytes.
     */
    public static long readUnsigned(ByteBuf buf, int index, int length) {
        if (length > 8) {
            index += length - 8;
            length = 8;
        }
        long value = 0;
        for (int i = 0; i < length; i++) {
            value = (value << 8) | buf.getUnsignedByte(index + i);
        }
        return value;
    }

    /**
     * Read a signed integer of any length up to 8 bytes, extending the sign.
     */
    public static long readSigned(ByteBuf buf, int index, int length) {
        if (length == 0) {
            return 0;
        }
        long value = readUnsigned(buf, index, length);
        int shift = 64 - 8 * Math.min(length, 8);
        return (value << shift) >> shift;
    }

    /**
     * Write the low-order <code>length</code> bytes of a value.
     */
    public static void writeInteger(ByteBuf buf, int index, int length, long value) {
        for (int i = length - 1; i >= 0; i--) {
            buf.setByte(index + i, (int) (value & 0xFF));
            value >>>= 8;
        }
    }

    public static double readFloat(ByteBuf buf, int index, int length) {
        if (length >= 8) {
            return buf.getDouble(index + length - 8);
        } else if (length >= 4) {
            return buf.getFloat(index + length - 4);
        } else {
            return 0.0;
        }
    }

    /**
     * Write a float64 value, reduced to a float32 if the length is 4.
     */
    public static void writeFloat(ByteBuf buf, int index, int length, double value) {
        if (length == 4) {
            buf.setFloat(index, (float) value);
        } else if (length == 8) {
            buf.setDouble(index, value);
        } else {
            buf.setZero(index, length);
        }
    }

    public static Instant readTime(DataType type, ByteBuf buf, int index, int length) {
        long raw = readUnsigned(buf, index, length);
        switch (type) {
        case DATETIME_SECONDS:
            return Instant.ofEpochSecond(raw);
        case DATETIME_MILLISECONDS:
            return Instant.ofEpochMilli(raw);
        case DATETIME_MICROSECONDS: {
            long micros = ((raw & 0xFFFFFFFFL) * 1_000_000L + (FRACTION_SCALE >> 1)) >>> 32;
            return Instant.ofEpochSecond((raw >>> 32) - NTP_EPOCH_OFFSET, micros * 1000);
        }
        case DATETIME_NANOSECONDS: {
            long nanos = ((raw & 0xFFFFFFFFL) * 1_000_000_000L + (FRACTION_SCALE >> 1)) >>> 32;
            return Instant.ofEpochSecond((raw >>> 32) - NTP_EPOCH_OFFSET, nanos);
        }
        default:
            throw new IllegalArgumentException("Not a time type: " + type);
        }
    }

    public static long encodeTime(DataType type, Instant time) {
        switch (type) {
        case DATETIME_SECONDS:
            return time.getEpochSecond();
        case DATETIME_MILLISECONDS:
            return time.toEpochMilli();
        case DATETIME_MICROSECONDS: {
            long fraction = ((long) (time.getNano() / 1000) << 32) / 1_000_000L;
            return ((time.getEpochSecond() + NTP_EPOCH_OFFSET) << 32) | (fraction & MICROSECONDS_MASK & 0xFFFFFFFFL);
        }
        case DATETIME_NANOSECONDS: {
            long fraction = ((long) time.getNano() << 32) / 1_000_000_000L;
            return ((time.getEpochSecond() + NTP_EPOCH_OFFSET) << 32) | fraction;
        }
        default:
            throw new IllegalArgumentException("Not a time type: " + type);
        }
    }

    public static InetAddress readAddress(ByteBuf buf, int index, int length) {
        byte[] raw = new byte[length];
        buf.getBytes(index, raw);
        try {
            return InetAddress.getByAddress(raw);
        } catch (UnknownHostException ex) {
            throw new IllegalArgumentException("Not an IP address of length " + length, ex);
        }
    }

    /**
     * Decode a value as the Java type matching the IPFIX type. Integers are
     * returned as {@link Long}, unsigned64 keeping its raw bits. Octet arrays
     * are copied into a byte array.
     */
    public static Object decode(DataType type, ByteBuf value) {
        int index = value.readerIndex();
        int length = value.readableBytes();
        return switch (type) {
            case UNSIGNED8, UNSIGNED16, UNSIGNED32, UNSIGNED64 -> readUnsigned(value, index, length);
            case SIGNED8, SIGNED16, SIGNED32, SIGNED64 -> readSigned(value, index, length);
            case FLOAT32, FLOAT64 -> readFloat(value, index, length);
            case BOOLEAN -> length > 0 && value.getUnsignedByte(index) == 1;
            case MAC_ADDRESS -> new MacAddress(ByteBufUtil.getBytes(value, index, length));
            case STRING -> readString(value);
            case DATETIME_SECONDS, DATETIME_MILLISECONDS, DATETIME_MICROSECONDS, DATETIME_NANOSECONDS -> readTime(type, value, index, length);
            case IPV4_ADDRESS, IPV6_ADDRESS -> readAddress(value, index, length);
            case OCTET_ARRAY -> ByteBufUtil.getBytes(value, index, length);
            case BASIC_LIST, SUB_TEMPLATE_LIST, SUB_TEMPLATE_MULTI_LIST -> throw new IllegalArgumentException("Lists are not plain values");
        };
    }

    /**
     * Strings in a fixed length field are padded with NUL bytes, they are trimmed.
     */
    public static String readString(ByteBuf value) {
        int end = value.writerIndex();
        while (end > value.readerIndex() && value.getByte(end - 1) == 0) {
            end--;
        }
        return value.toString(value.readerIndex(), end - value.readerIndex(), StandardCharsets.UTF_8);
    }

    /**
     * Encode a Java value for an IPFIX type.
     *
     * @param length the encoded length, or {@link InfoElement#VARLEN} for the natural length
     * @throws IllegalArgumentException if the value can't be used for this type
     */
    public static ByteBuf encode(DataType type, int length, Object value) {
        int size = length == InfoElement.VARLEN ? naturalLength(type, value) : length;
        ByteBuf buf = Unpooled.buffer(size, size);
        buf.writerIndex(size);
        encode(type, buf, 0, size, value);
        return buf;
    }

    /**
     * Encode a Java value at a fixed position.
     */
    public static void encode(DataType type, ByteBuf buf, int index, int length, Object value) {
        switch (type) {
        case UNSIGNED8, UNSIGNED16, UNSIGNED32, UNSIGNED64, SIGNED8, SIGNED16, SIGNED32, SIGNED64 ->
            writeInteger(buf, index, length, asNumber(type, value).longValue());
        case FLOAT32, FLOAT64 -> writeFloat(buf, index, length, asNumber(type, value).doubleValue());
        case BOOLEAN -> {
            if (! (value instanceof Boolean b)) {
                throw wrongType(type, value);
            }
            buf.setZero(index, length);
            buf.setByte(index + length - 1, b ? 1 : 2);
        }
        case MAC_ADDRESS -> {
            MacAddress mac;
            if (value instanceof MacAddress m) {
                mac = m;
            } else if (value instanceof String s) {
                mac = new MacAddress(s);
            } else if (value instanceof byte[] b) {
                mac = new MacAddress(b);
            } else {
                throw wrongType(type, value);
            }
            setPadded(buf, index, length, mac.address());
        }
        case DATETIME_SECONDS, DATETIME_MILLISECONDS, DATETIME_MICROSECONDS, DATETIME_NANOSECONDS -> {
            if (! (value instanceof Instant i)) {
                throw wrongType(type, value);
            }
            writeInteger(buf, index, length, encodeTime(type, i));
        }
        case IPV4_ADDRESS, IPV6_ADDRESS -> {
            if (type == DataType.IPV4_ADDRESS && value instanceof Inet4Address a) {
                setPadded(buf, index, length, a.getAddress());
            } else if (type == DataType.IPV6_ADDRESS && value instanceof Inet6Address a) {
                setPadded(buf, index, length, a.getAddress());
            } else {
                throw wrongType(type, value);
            }
        }
        case STRING, OCTET_ARRAY -> setPadded(buf, index, length, asBytes(type, value));
        case BASIC_LIST, SUB_TEMPLATE_LIST, SUB_TEMPLATE_MULTI_LIST -> throw new IllegalArgumentException("Lists are not plain values");
        }
    }

    private static int naturalLength(DataType type, Object value) {
        if (type.isOctets()) {
            return asBytes(type, value).length;
        } else {
            return type.canonicalLength;
        }
    }

    static byte[] asBytes(DataType type, Object value) {
        if (value instanceof String s) {
            return s.getBytes(StandardCharsets.UTF_8);
        } else if (value instanceof byte[] b) {
            return b;
        } else if (value instanceof ByteBuf b) {
            return ByteBufUtil.getBytes(b);
        } else {
            throw wrongType(type, value);
        }
    }

    private static Number asNumber(DataType type, Object value) {
        if (value instanceof Number n) {
            return n;
        } else {
            throw wrongType(type, value);
        }
    }

    private static void setPadded(ByteBuf buf, int index, int length, byte[] content) {
        int copied = Math.min(length, content.length);
        buf.setBytes(index, content, 0, copied);
        if (copied < length) {
            buf.setZero(index + copied, length - copied);
        }
    }

    private static IllegalArgumentException wrongType(DataType type, Object value) {
        return new IllegalArgumentException(String.format("Can't use %s as %s", value == null ? "null" : value.getClass().getName(), type));
    }

}
