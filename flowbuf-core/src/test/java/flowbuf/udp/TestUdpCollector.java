package flowbuf.udp;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import flowbuf.IpfixException;
import flowbuf.LogUtils;
import flowbuf.Tools;
import flowbuf.buffer.Record;
import flowbuf.infomodel.InfoModel;
import flowbuf.session.Session;
import flowbuf.template.TemplateBuilder;
import io.netty.buffer.Unpooled;

public class TestUdpCollector {

    private static Logger logger;
    private static InfoModel model;

    @BeforeClass
    public static void configure() {
        Tools.configure();
        logger = LogManager.getLogger();
        LogUtils.setLevel(logger, Level.TRACE, "flowbuf.udp", "flowbuf.buffer");
        model = InfoModel.getBuilder().build();
    }

    @Test
    public void testPeers() throws IpfixException {
        AtomicLong clock = new AtomicLong(0);
        UdpCollector collector = UdpCollector.getBuilder()
                                             .setPrototype(new Session(model))
                                             .setIdleTimeout(1000)
                                             .setClock(clock::get)
                                             .build();
        InetSocketAddress first = new InetSocketAddress("192.0.2.1", 50000);
        InetSocketAddress second = new InetSocketAddress("192.0.2.2", 50000);
        List<PeerKey> keys = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        // Same template id, a different layout for each peer
        int count = collector.decode(Tools.message(1, 0,
                                                   Tools.set(2, Tools.shorts(256, 1, 8, 4)),
                                                   Tools.set(256, Unpooled.wrappedBuffer(new byte[] {10, 0, 0, 1}))),
                                     first, (k, r) -> {
                                         keys.add(k);
                                         values.add(r.getValue(0));
                                     });
        Assert.assertEquals(1, count);
        count = collector.decode(Tools.message(1, 0,
                                               Tools.set(2, Tools.shorts(256, 1, 4, 1)),
                                               Tools.set(256, Unpooled.wrappedBuffer(new byte[] {6, 17}))),
                                 second, (k, r) -> {
                                     keys.add(k);
                                     values.add(r.getValue(0));
                                 });
        Assert.assertEquals(2, count);
        // Template already known for the first peer
        collector.decode(Tools.message(1, 1, Tools.set(256, Unpooled.wrappedBuffer(new byte[] {10, 0, 0, 2}))),
                         first, (k, r) -> {
                             keys.add(k);
                             values.add(r.getValue("sourceIPv4Address").toString());
                         });
        Assert.assertEquals(new PeerKey(first, 1), keys.get(0));
        Assert.assertEquals(new PeerKey(second, 1), keys.get(1));
        Assert.assertEquals(6L, values.get(1));
        Assert.assertEquals(17L, values.get(2));
        Assert.assertEquals("/10.0.0.2", values.get(3));
        Assert.assertEquals(2, collector.getPeers().size());

        clock.set(1500);
        Assert.assertEquals(2, collector.reap());
        // The template is forgotten with the peer
        Assert.assertEquals(0, collector.decode(Tools.message(1, 2, Tools.set(256, Unpooled.wrappedBuffer(new byte[] {10, 0, 0, 3}))),
                                                first, (k, r) -> Assert.fail()));
        collector.close();
        Assert.assertEquals(0, collector.getPeers().size());
    }

    @Test
    public void testPairing() throws IpfixException {
        Session prototype = new Session(model);
        prototype.addTemplate(true, 1000, new TemplateBuilder(model).append("protocolIdentifier").build());
        prototype.addTemplatePair(256, 1000);
        UdpCollector collector = UdpCollector.getBuilder().setPrototype(prototype).build();
        List<Record> records = new ArrayList<>();
        collector.decode(Tools.message(0, 0,
                                       Tools.set(2, Tools.shorts(256, 2, 8, 4, 4, 1, 257, 1, 4, 1)),
                                       Tools.set(256, Unpooled.wrappedBuffer(new byte[] {10, 0, 0, 1, 17})),
                                       Tools.set(257, Unpooled.wrappedBuffer(new byte[] {6}))),
                         new InetSocketAddress("192.0.2.1", 50000), (k, r) -> records.add(r.copy()));
        Assert.assertEquals(1, records.size());
        Assert.assertEquals(1000, records.get(0).getTemplateId());
        Assert.assertEquals(17L, records.get(0).getLong(0));
    }

    @Test
    public void testMalformed() throws IpfixException {
        UdpCollector collector = UdpCollector.getBuilder().setPrototype(new Session(model)).build();
        InetSocketAddress sender = new InetSocketAddress("192.0.2.1", 50000);
        IpfixException ex = Assert.assertThrows(IpfixException.class,
                () -> collector.decode(Unpooled.wrappedBuffer(new byte[] {0, 10, 0, 4}), sender, (k, r) -> Assert.fail()));
        Assert.assertEquals(IpfixException.Kind.MALFORMED, ex.getKind());
        Assert.assertEquals(0, collector.getPeers().size());
        ex = Assert.assertThrows(IpfixException.class, () -> UdpCollector.getBuilder().build());
        Assert.assertEquals(IpfixException.Kind.SETUP, ex.getKind());
    }

}
