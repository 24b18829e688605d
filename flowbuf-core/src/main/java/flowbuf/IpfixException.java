package flowbuf;

import lombok.Getter;

/**
 * The checked exception thrown by every IPFIX operation. The {@link Kind} tells
 * the caller how to react: some are expected control flow, such as the end of a
 * message, while others leave the current message unusable.
 */
public class IpfixException extends Exception {

    public enum Kind {
        /** Template missing, badly paired or illegal. */
        TEMPLATE,
        /** The current message is exhausted, or full when exporting. */
        END_OF_MESSAGE,
        /** The current set is exhausted. */
        END_OF_SET,
        /** Clean end of the underlying stream. */
        END_OF_STREAM,
        /** Inconsistent or illegal data on the wire. */
        MALFORMED,
        /** The buffer must grow to {@link IpfixException#getRequiredSize()}, then the call retried. */
        BUFFER_TOO_SMALL,
        /** Valid IPFIX that this library can't handle. */
        UNSUPPORTED,
        IO,
        NO_ELEMENT,
        /** Failure specific to a transport implementation. */
        TRANSPORT,
        /** Misconfiguration detected before any data was processed. */
        SETUP,
        /** Illegal length for an information element. */
        LENGTH,
    }

    @Getter
    private final Kind kind;
    @Getter
    private final int requiredSize;

    public IpfixException(Kind kind, String message) {
        super(message);
        this.kind = kind;
        this.requiredSize = -1;
    }

    public IpfixException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.requiredSize = -1;
    }

    private IpfixException(String message, int requiredSize) {
        super(message);
        this.kind = Kind.BUFFER_TOO_SMALL;
        this.requiredSize = requiredSize;
    }

    public static IpfixException bufferTooSmall(int requiredSize, int available) {
        return new IpfixException(String.format("Buffer too small: %d bytes required, %d available", requiredSize, available), requiredSize);
    }

    public boolean is(Kind other) {
        return kind == other;
    }

}
