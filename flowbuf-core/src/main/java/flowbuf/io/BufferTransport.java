package flowbuf.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import flowbuf.IpfixException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * An in memory transport: reads from a given buffer and keeps a copy of each
 * message written.
 */
public class BufferTransport implements Transport {

    private final ByteBuf input;
    private final List<ByteBuf> written = new ArrayList<>();
    private boolean open = false;

    public BufferTransport() {
        this(Unpooled.EMPTY_BUFFER);
    }

    public BufferTransport(ByteBuf input) {
        this.input = input;
    }

    @Override
    public void open() {
        open = true;
    }

    @Override
    public ByteBuf readExact(int length) throws IpfixException {
        if (! open) {
            throw new IpfixException(IpfixException.Kind.IO, "Transport closed");
        } else if (length > 0 && ! input.isReadable()) {
            throw new IpfixException(IpfixException.Kind.END_OF_STREAM, "End of buffer");
        } else if (input.readableBytes() < length) {
            int available = input.readableBytes();
            input.skipBytes(available);
            throw new IpfixException(IpfixException.Kind.IO, String.format("End of buffer after %d bytes, %d expected", available, length));
        } else {
            return input.readSlice(length);
        }
    }

    @Override
    public void write(ByteBuf message) throws IpfixException {
        if (! open) {
            throw new IpfixException(IpfixException.Kind.IO, "Transport closed");
        }
        written.add(Unpooled.copiedBuffer(message));
    }

    @Override
    public void close() {
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public List<ByteBuf> getWritten() {
        return Collections.unmodifiableList(written);
    }

    /**
     * Every written message, concatenated.
     */
    public ByteBuf getOutput() {
        return Unpooled.wrappedBuffer(written.toArray(ByteBuf[]::new)).copy();
    }

}
