package flowbuf.netty;

import java.util.function.BiConsumer;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import flowbuf.IpfixException;
import flowbuf.buffer.Record;
import flowbuf.udp.PeerKey;
import flowbuf.udp.UdpCollector;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import lombok.Getter;

/**
 * Decodes each datagram with a {@link UdpCollector} and hands its records to
 * a consumer. Records are only valid during the consumer call, as the datagram
 * is released afterward. Must stay in a single channel pipeline.
 */
public class IpfixDatagramHandler extends SimpleChannelInboundHandler<DatagramPacket> {

    private static final Logger logger = LogManager.getLogger();

    @Getter
    private final UdpCollector collector;
    private final BiConsumer<PeerKey, Record> consumer;
    @Getter
    private long failures = 0;

    public IpfixDatagramHandler(UdpCollector collector, BiConsumer<PeerKey, Record> consumer) {
        this.collector = collector;
        this.consumer = consumer;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
        try {
            int count = collector.decode(packet.content(), packet.sender(), consumer);
            logger.trace("{} records received from {}", count, packet.sender());
        } catch (IpfixException ex) {
            failures++;
            logger.warn("Invalid IPFIX datagram from {}: {}", packet.sender(), ex.getMessage());
            logger.catching(Level.DEBUG, ex);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        // A datagram channel is not closed on failure
        logger.warn("Failure on {}: {}", ctx.channel().localAddress(), cause.getMessage());
        logger.catching(Level.DEBUG, cause);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        collector.close();
        super.channelInactive(ctx);
    }

}
