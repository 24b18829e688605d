package flowbuf.netty;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import flowbuf.IpfixException;
import flowbuf.LogUtils;
import flowbuf.Tools;
import flowbuf.infomodel.InfoModel;
import flowbuf.session.Session;
import flowbuf.udp.PeerKey;
import flowbuf.udp.UdpCollector;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.channel.socket.DatagramPacket;

public class TestIpfixDatagramHandler {

    private static Logger logger;
    private static InfoModel model;

    @BeforeClass
    public static void configure() {
        Tools.configure();
        logger = LogManager.getLogger();
        LogUtils.setLevel(logger, Level.TRACE, "flowbuf.netty", "flowbuf.udp");
        model = InfoModel.getBuilder().build();
    }

    /**
     * A message with a template for sourceIPv4Address and one record per address.
     */
    private static ByteBuf message(long domain, long sequence, byte[]... addresses) {
        ByteBuf records = Unpooled.buffer(4 * addresses.length);
        for (byte[] a : addresses) {
            records.writeBytes(a);
        }
        return Tools.message(domain, sequence, Tools.set(2, Tools.shorts(256, 1, 8, 4)), Tools.set(256, records));
    }

    @Test
    public void testHandler() throws IpfixException {
        UdpCollector collector = UdpCollector.getBuilder().setPrototype(new Session(model)).build();
        List<PeerKey> keys = new ArrayList<>();
        List<String> addresses = new ArrayList<>();
        IpfixDatagramHandler handler = new IpfixDatagramHandler(collector, (k, r) -> {
            keys.add(k);
            addresses.add(r.getAddress(0).getHostAddress());
        });
        EmbeddedChannel channel = new EmbeddedChannel(handler);
        InetSocketAddress recipient = new InetSocketAddress("127.0.0.1", UdpReceiver.IPFIX_PORT);
        InetSocketAddress sender = new InetSocketAddress("192.0.2.1", 50000);
        ByteBuf content = message(3, 0, new byte[] {10, 0, 0, 1}, new byte[] {10, 0, 0, 2});
        channel.writeInbound(new DatagramPacket(content, recipient, sender));
        Assert.assertEquals(List.of("10.0.0.1", "10.0.0.2"), addresses);
        Assert.assertEquals(new PeerKey(sender, 3), keys.get(0));
        // The datagram was released
        Assert.assertEquals(0, content.refCnt());

        ByteBuf garbage = Unpooled.wrappedBuffer(new byte[] {0, 9, 0, 16, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0});
        channel.writeInbound(new DatagramPacket(garbage, recipient, sender));
        Assert.assertEquals(1, handler.getFailures());
        Assert.assertEquals(0, garbage.refCnt());
        Assert.assertEquals(2, addresses.size());
        Assert.assertNull(channel.readInbound());

        channel.close();
        Assert.assertEquals(0, collector.getPeers().size());
    }

    @Test(timeout = 10000)
    public void testReceiver() throws IpfixException, InterruptedException, IOException {
        CountDownLatch received = new CountDownLatch(2);
        List<String> addresses = new ArrayList<>();
        UdpReceiver receiver = UdpReceiver.getBuilder()
                                          .setHost("127.0.0.1")
                                          .setPort(0)
                                          .setPrototype(new Session(model))
                                          .setConsumer((k, r) -> {
                                              synchronized (addresses) {
                                                  addresses.add(r.getAddress(0).getHostAddress());
                                              }
                                              received.countDown();
                                          })
                                          .build();
        try {
            receiver.bind();
            InetSocketAddress local = receiver.getLocalAddress();
            Assert.assertNotEquals(0, local.getPort());
            byte[] content = ByteBufUtil.getBytes(message(0, 0, new byte[] {(byte) 192, 0, 2, 10}, new byte[] {(byte) 192, 0, 2, 11}));
            try (DatagramSocket socket = new DatagramSocket(0, InetAddress.getByName("127.0.0.1"))) {
                socket.send(new java.net.DatagramPacket(content, content.length, local));
            }
            Assert.assertTrue(received.await(5, TimeUnit.SECONDS));
            synchronized (addresses) {
                Assert.assertEquals(List.of("192.0.2.10", "192.0.2.11"), addresses);
            }
        } finally {
            receiver.close();
        }
        Assert.assertNull(receiver.getLocalAddress());
    }

    @Test
    public void testSetup() {
        IpfixException ex = Assert.assertThrows(IpfixException.class, () -> UdpReceiver.getBuilder().setPrototype(new Session(model)).build());
        Assert.assertEquals(IpfixException.Kind.SETUP, ex.getKind());
        ex = Assert.assertThrows(IpfixException.class, () -> UdpReceiver.getBuilder().setConsumer((k, r) -> { }).build());
        Assert.assertEquals(IpfixException.Kind.SETUP, ex.getKind());
    }

}
