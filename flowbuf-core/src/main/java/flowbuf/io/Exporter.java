package flowbuf.io;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import flowbuf.IpfixException;
import io.netty.buffer.ByteBuf;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Writes IPFIX messages to a transport, opening it on demand.
 */
public class Exporter {

    private static final Logger logger = LogManager.getLogger();

    public static final int DEFAULT_MTU = 65535;

    @Accessors(chain = true)
    @Setter
    public static class Builder {
        private Transport transport;
        private int mtu = DEFAULT_MTU;
        private Builder() {
        }
        public Exporter build() throws IpfixException {
            if (transport == null) {
                throw new IpfixException(IpfixException.Kind.SETUP, "No transport for exporter");
            } else if (mtu < 32 || mtu > DEFAULT_MTU) {
                throw new IpfixException(IpfixException.Kind.SETUP, "Illegal exporter MTU " + mtu);
            }
            return new Exporter(this);
        }
    }
    public static Builder getBuilder() {
        return new Builder();
    }

    @Getter
    private final Transport transport;
    @Getter
    private final int mtu;
    @Getter
    private boolean active = false;

    private Exporter(Builder builder) {
        this.transport = builder.transport;
        this.mtu = builder.mtu;
    }

    /**
     * Write a message. On failure the transport is closed and will be opened
     * again by the next write.
     */
    public void write(ByteBuf message) throws IpfixException {
        if (! active) {
            transport.open();
            active = true;
        }
        try {
            transport.write(message);
        } catch (IpfixException ex) {
            failed(ex);
            throw ex;
        } catch (RuntimeException ex) {
            failed(ex);
            throw new IpfixException(IpfixException.Kind.TRANSPORT, "Transport failure: " + ex.getMessage(), ex);
        }
    }

    private void failed(Exception ex) {
        logger.warn("Export failed, closing transport: {}", ex.getMessage());
        logger.catching(Level.DEBUG, ex);
        close();
    }

    public void close() {
        active = false;
        transport.close();
    }

}
