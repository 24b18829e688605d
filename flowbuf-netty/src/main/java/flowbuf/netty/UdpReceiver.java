package flowbuf.netty;

import java.net.InetSocketAddress;
import java.util.function.BiConsumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import flowbuf.IpfixException;
import flowbuf.buffer.MessageBuffer;
import flowbuf.buffer.Record;
import flowbuf.session.Session;
import flowbuf.udp.PeerKey;
import flowbuf.udp.UdpCollector;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Listen for IPFIX datagrams and decode them on a single event loop thread.
 */
public class UdpReceiver {

    private static final Logger logger = LogManager.getLogger();

    public static final int IPFIX_PORT = 4739;

    @Accessors(chain = true)
    @Setter
    public static class Builder {
        private String host = null;
        private int port = IPFIX_PORT;
        private int bufferSize = MessageBuffer.DEFAULT_CAPACITY;
        private Session prototype;
        private long idleTimeout = UdpCollector.DEFAULT_IDLE_TIMEOUT;
        private BiConsumer<PeerKey, Record> consumer;
        private Builder() {
        }
        public UdpReceiver build() throws IpfixException {
            if (consumer == null) {
                throw new IpfixException(IpfixException.Kind.SETUP, "No record consumer");
            }
            return new UdpReceiver(this);
        }
    }
    public static Builder getBuilder() {
        return new Builder();
    }

    private final InetSocketAddress address;
    private final int bufferSize;
    private final IpfixDatagramHandler handler;
    private EventLoopGroup group = null;
    private Channel channel = null;

    private UdpReceiver(Builder builder) throws IpfixException {
        this.address = builder.host == null ? new InetSocketAddress(builder.port) : new InetSocketAddress(builder.host, builder.port);
        this.bufferSize = builder.bufferSize;
        UdpCollector collector = UdpCollector.getBuilder()
                                             .setPrototype(builder.prototype)
                                             .setIdleTimeout(builder.idleTimeout)
                                             .setCapacity(builder.bufferSize)
                                             .build();
        this.handler = new IpfixDatagramHandler(collector, builder.consumer);
    }

    public synchronized void bind() throws InterruptedException {
        group = new NioEventLoopGroup(1, new DefaultThreadFactory("ipfix/" + address, true));
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                 .channel(NioDatagramChannel.class)
                 .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(bufferSize))
                 .handler(handler);
        try {
            channel = bootstrap.bind(address).sync().channel();
        } catch (InterruptedException | RuntimeException ex) {
            group.shutdownGracefully();
            group = null;
            throw ex;
        }
        logger.debug("Bound to {}", channel.localAddress());
    }

    public InetSocketAddress getLocalAddress() {
        return channel == null ? null : (InetSocketAddress) channel.localAddress();
    }

    public synchronized void close() {
        if (channel != null) {
            channel.close().syncUninterruptibly();
            channel = null;
        }
        if (group != null) {
            group.shutdownGracefully().syncUninterruptibly();
            group = null;
        }
    }

}
