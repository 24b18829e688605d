package flowbuf.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import flowbuf.IpfixException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * A transport over a blocking input or output stream. Streams are obtained
 * from openers on each {@link #open()}, so a closed transport can be reopened.
 */
public class StreamTransport implements Transport {

    private static final Logger logger = LogManager.getLogger();

    @FunctionalInterface
    public interface StreamOpener<S> {
        S open() throws IOException;
    }

    @Accessors(chain = true)
    @Setter
    public static class Builder {
        private StreamOpener<InputStream> input;
        private StreamOpener<OutputStream> output;
        private Builder() {
        }
        public StreamTransport build() throws IpfixException {
            if (input == null && output == null) {
                throw new IpfixException(IpfixException.Kind.SETUP, "Neither input nor output stream given");
            }
            return new StreamTransport(this);
        }
    }
    public static Builder getBuilder() {
        return new Builder();
    }

    public static StreamTransport ofInput(InputStream in) throws IpfixException {
        return getBuilder().setInput(() -> in).build();
    }

    public static StreamTransport ofOutput(OutputStream out) throws IpfixException {
        return getBuilder().setOutput(() -> out).build();
    }

    private final StreamOpener<InputStream> inputOpener;
    private final StreamOpener<OutputStream> outputOpener;
    private InputStream in;
    private OutputStream out;
    private boolean open = false;

    private StreamTransport(Builder builder) {
        this.inputOpener = builder.input;
        this.outputOpener = builder.output;
    }

    @Override
    public void open() throws IpfixException {
        if (open) {
            return;
        }
        try {
            in = inputOpener != null ? inputOpener.open() : null;
            out = outputOpener != null ? outputOpener.open() : null;
            open = true;
        } catch (IOException ex) {
            close();
            throw new IpfixException(IpfixException.Kind.IO, "Unable to open stream: " + ex.getMessage(), ex);
        }
    }

    @Override
    public ByteBuf readExact(int length) throws IpfixException {
        if (in == null) {
            throw new IpfixException(IpfixException.Kind.SETUP, "Not an input transport, or not opened");
        }
        byte[] content = new byte[length];
        int read = 0;
        try {
            while (read < length) {
                int count = in.read(content, read, length - read);
                if (count < 0) {
                    break;
                }
                read += count;
            }
        } catch (IOException ex) {
            throw new IpfixException(IpfixException.Kind.IO, "Read failed: " + ex.getMessage(), ex);
        }
        if (read == 0 && length > 0) {
            throw new IpfixException(IpfixException.Kind.END_OF_STREAM, "End of stream");
        } else if (read < length) {
            throw new IpfixException(IpfixException.Kind.IO, String.format("End of stream after %d bytes, %d expected", read, length));
        }
        return Unpooled.wrappedBuffer(content);
    }

    @Override
    public void write(ByteBuf message) throws IpfixException {
        if (out == null) {
            throw new IpfixException(IpfixException.Kind.SETUP, "Not an output transport, or not opened");
        }
        try {
            message.getBytes(message.readerIndex(), out, message.readableBytes());
            out.flush();
        } catch (IOException ex) {
            throw new IpfixException(IpfixException.Kind.IO, "Write failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        open = false;
        closeQuietly(in);
        closeQuietly(out);
        in = null;
        out = null;
    }

    private void closeQuietly(AutoCloseable stream) {
        if (stream != null) {
            try {
                stream.close();
            } catch (Exception ex) {
                logger.warn("Failed to close stream: {}", ex.getMessage());
                logger.catching(Level.DEBUG, ex);
            }
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

}
