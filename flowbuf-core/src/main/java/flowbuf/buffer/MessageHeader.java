package flowbuf.buffer;

import java.time.Instant;

/**
 * The 16 bytes header of an IPFIX message.
 */
public record MessageHeader(int version, int length, long exportTime, long sequenceNumber, long observationDomain) {

    public static final int LENGTH = 16;
    public static final int VERSION = 10;

    public Instant exportInstant() {
        return Instant.ofEpochSecond(exportTime);
    }

}
