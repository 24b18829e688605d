package flowbuf.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import flowbuf.IpfixException;
import flowbuf.buffer.MessageHeader;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * Reads whole IPFIX messages from a transport.
 */
public class Collector {

    private static final Logger logger = LogManager.getLogger();

    private final Transport transport;
    private ByteBuf pendingHeader = null;

    public Collector(Transport transport) {
        this.transport = transport;
    }

    /**
     * Read one message, header included.
     *
     * @param capacity the largest message accepted
     * @throws IpfixException of kind BUFFER_TOO_SMALL if the message is larger
     *         than capacity. The header is kept, the call can be retried with
     *         a larger capacity.
     */
    public ByteBuf readMessage(int capacity) throws IpfixException {
        if (! transport.isOpen()) {
            transport.open();
        }
        ByteBuf header = pendingHeader != null ? pendingHeader : transport.readExact(MessageHeader.LENGTH);
        pendingHeader = null;
        int version = header.getUnsignedShort(header.readerIndex());
        int length = header.getUnsignedShort(header.readerIndex() + 2);
        if (version != MessageHeader.VERSION) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Illegal IPFIX message version 0x%04x", version));
        } else if (length < MessageHeader.LENGTH) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Illegal IPFIX message length %d", length));
        } else if (length > capacity) {
            pendingHeader = header;
            throw IpfixException.bufferTooSmall(length, capacity);
        }
        logger.trace("Reading message of {} bytes", length);
        if (length == MessageHeader.LENGTH) {
            return Unpooled.copiedBuffer(header);
        } else {
            try {
                ByteBuf body = transport.readExact(length - MessageHeader.LENGTH);
                return Unpooled.copiedBuffer(header, body);
            } catch (IpfixException ex) {
                if (ex.is(IpfixException.Kind.END_OF_STREAM)) {
                    throw new IpfixException(IpfixException.Kind.IO, String.format("Stream ended inside a message of %d bytes", length), ex);
                } else {
                    throw ex;
                }
            }
        }
    }

    public Transport getTransport() {
        return transport;
    }

    public void close() {
        pendingHeader = null;
        transport.close();
    }

}
