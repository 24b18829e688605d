package flowbuf.io;

import flowbuf.IpfixException;
import io.netty.buffer.ByteBuf;

/**
 * A byte stream carrying IPFIX messages.
 */
public interface Transport {

    void open() throws IpfixException;

    /**
     * Read exactly <code>length</code> bytes.
     *
     * @throws IpfixException of kind END_OF_STREAM on a clean end of stream
     *         before any byte was read, of kind IO if the stream ends in the
     *         middle of the read or fails
     */
    ByteBuf readExact(int length) throws IpfixException;

    void write(ByteBuf message) throws IpfixException;

    void close();

    boolean isOpen();

}
