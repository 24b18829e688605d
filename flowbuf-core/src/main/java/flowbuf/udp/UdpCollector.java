package flowbuf.udp;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.LongSupplier;

import flowbuf.IpfixException;
import flowbuf.buffer.MessageBuffer;
import flowbuf.buffer.MessageHeader;
import flowbuf.buffer.Record;
import flowbuf.session.Session;
import io.netty.buffer.ByteBuf;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Decodes IPFIX datagrams from many exporters, each (address, observation
 * domain) pair getting its own session.
 */
public class UdpCollector {

    public static final long DEFAULT_IDLE_TIMEOUT = TimeUnit.MINUTES.toMillis(30);

    @Accessors(chain = true)
    @Setter
    public static class Builder {
        private Session prototype;
        private long idleTimeout = DEFAULT_IDLE_TIMEOUT;
        private int capacity = MessageBuffer.DEFAULT_CAPACITY;
        private LongSupplier clock = System::currentTimeMillis;
        private Builder() {
        }
        public UdpCollector build() throws IpfixException {
            if (prototype == null) {
                throw new IpfixException(IpfixException.Kind.SETUP, "No prototype session");
            }
            return new UdpCollector(this);
        }
    }
    public static Builder getBuilder() {
        return new Builder();
    }

    @Getter
    private final PeerTable peers;
    private final MessageBuffer buffer;
    private final LongSupplier clock;

    private UdpCollector(Builder builder) throws IpfixException {
        this.peers = new PeerTable(builder.prototype, builder.idleTimeout);
        this.clock = builder.clock;
        this.buffer = MessageBuffer.getBuilder()
                                   .setSession(builder.prototype)
                                   .setCapacity(builder.capacity)
                                   .build();
    }

    /**
     * Decode every record of a datagram. Records are only valid during the
     * consumer call.
     *
     * @return the number of records decoded
     */
    public int decode(ByteBuf datagram, InetSocketAddress sender, BiConsumer<PeerKey, Record> consumer) throws IpfixException {
        if (datagram.readableBytes() < MessageHeader.LENGTH) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Datagram from %s too short: %d bytes", sender, datagram.readableBytes()));
        }
        long domain = datagram.getUnsignedInt(datagram.readerIndex() + 12);
        PeerKey key = new PeerKey(sender, domain);
        Session session = peers.lookup(key, clock.getAsLong());
        buffer.setSession(session);
        buffer.decode(datagram);
        int count = 0;
        while (true) {
            Record r;
            try {
                r = buffer.next();
            } catch (IpfixException ex) {
                if (ex.is(IpfixException.Kind.END_OF_MESSAGE)) {
                    return count;
                }
                throw ex;
            }
            consumer.accept(key, r);
            count++;
        }
    }

    /**
     * Evict idle peers without waiting for the next datagram.
     */
    public int reap() {
        return peers.reap(clock.getAsLong());
    }

    public void close() {
        peers.clear();
    }

}
