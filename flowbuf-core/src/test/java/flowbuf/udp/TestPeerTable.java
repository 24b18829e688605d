package flowbuf.udp;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;

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
import flowbuf.session.TemplateContext;
import flowbuf.template.Template;
import flowbuf.template.TemplateBuilder;

public class TestPeerTable {

    private static Logger logger;
    private static InfoModel model;

    @BeforeClass
    public static void configure() {
        Tools.configure();
        logger = LogManager.getLogger();
        LogUtils.setLevel(logger, Level.TRACE, "flowbuf.udp");
        model = InfoModel.getBuilder().build();
    }

    @Test
    public void testLookup() throws IpfixException {
        Session prototype = new Session(model);
        Template internal = new TemplateBuilder(model).append("octetDeltaCount").build();
        prototype.addTemplate(true, 1000, internal);
        prototype.addTemplatePair(256, 1000);
        PeerTable peers = new PeerTable(prototype, 1000);
        PeerKey key = new PeerKey(new InetSocketAddress("192.0.2.1", 4739), 5);
        Session s1 = peers.lookup(key, 0);
        Assert.assertNotSame(prototype, s1);
        Assert.assertEquals(5, s1.getDomain());
        Assert.assertSame(internal, s1.getTemplate(true, 1000));
        Assert.assertEquals(Integer.valueOf(1000), s1.getTemplatePairs().get(256));
        Assert.assertSame(s1, peers.lookup(new PeerKey(new InetSocketAddress("192.0.2.1", 4739), 5), 10));
        Assert.assertNotSame(s1, peers.lookup(new PeerKey(new InetSocketAddress("192.0.2.1", 4739), 6), 10));
        Assert.assertNotSame(s1, peers.lookup(new PeerKey(new InetSocketAddress("192.0.2.1", 4740), 5), 10));
        Assert.assertEquals(3, peers.size());
    }

    @Test
    public void testEviction() throws IpfixException {
        List<Integer> released = new ArrayList<>();
        Session prototype = new Session(model);
        prototype.setNewTemplateCallback((s, tid, template, ctx) -> new TemplateContext() {
            @Override
            public void release(Object appContext) {
                released.add(tid);
            }
        }, null);
        Template t = new TemplateBuilder(model).append("octetDeltaCount").build();
        PeerTable peers = new PeerTable(prototype, 100);
        PeerKey a = new PeerKey(new InetSocketAddress("192.0.2.1", 4739), 0);
        PeerKey b = new PeerKey(new InetSocketAddress("192.0.2.2", 4739), 0);
        peers.lookup(a, 0).addTemplate(false, 256, t);
        peers.lookup(b, 50).addTemplate(false, 257, t);
        // a is seen again, b becomes the oldest
        peers.lookup(a, 90);
        Assert.assertEquals(2, peers.size());
        Assert.assertEquals(1, peers.reap(151));
        Assert.assertFalse(peers.contains(b));
        Assert.assertTrue(peers.contains(a));
        Assert.assertEquals(List.of(257), released);
        // A new session for an evicted peer
        Assert.assertFalse(peers.lookup(b, 152).hasTemplate(false, 257));
        Assert.assertTrue(peers.remove(a));
        Assert.assertFalse(peers.remove(a));
        Assert.assertEquals(List.of(257, 256), released);
        peers.clear();
        Assert.assertEquals(0, peers.size());
    }

}
