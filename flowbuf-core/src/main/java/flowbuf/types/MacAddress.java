package flowbuf.types;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record MacAddress(byte[] address) {

    public static final int LENGTH = 6;

    private static final Pattern macPattern = Pattern.compile("([0-9A-Fa-f]{2})[-:.]([0-9A-Fa-f]{2})[-:.]([0-9A-Fa-f]{2})[-:.]([0-9A-Fa-f]{2})[-:.]([0-9A-Fa-f]{2})[-:.]([0-9A-Fa-f]{2})");
    private static final ThreadLocal<Matcher> localMatcher = ThreadLocal.withInitial(() -> macPattern.matcher(""));

    public MacAddress(byte[] address) {
        if (address.length != LENGTH) {
            throw new IllegalArgumentException("Invalid mac address length " + address.length);
        } else {
            this.address = Arrays.copyOf(address, address.length);
        }
    }

    public MacAddress(String addressStr) {
        this(parseAddress(addressStr));
    }

    private static byte[] parseAddress(String addressStr) {
        Matcher m = localMatcher.get().reset(addressStr.trim());
        if (! m.matches()) {
            throw new IllegalArgumentException(addressStr + " is not a valid mac address");
        }
        byte[] addrBuffer = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            addrBuffer[i] = (byte) Integer.parseInt(m.group(i + 1), 16);
        }
        return addrBuffer;
    }

    public byte[] getBytes() {
        return Arrays.copyOf(address, address.length);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MacAddress other && Arrays.equals(address, other.address);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(address);
    }

    @Override
    public String toString() {
        return String.format("%02X-%02X-%02X-%02X-%02X-%02X", address[0], address[1], address[2], address[3], address[4], address[5]);
    }

}
