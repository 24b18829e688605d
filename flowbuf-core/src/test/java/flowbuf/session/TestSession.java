package flowbuf.session;

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
import flowbuf.template.Template;
import flowbuf.template.TemplateBuilder;

public class TestSession {

    private static Logger logger;
    private static InfoModel model;

    @BeforeClass
    public static void configure() {
        Tools.configure();
        logger = LogManager.getLogger();
        LogUtils.setLevel(logger, Level.TRACE, "flowbuf.session");
        model = InfoModel.getBuilder().build();
    }

    private Template template(String... names) throws IpfixException {
        TemplateBuilder builder = new TemplateBuilder(model);
        for (String name : names) {
            builder.append(name);
        }
        return builder.build();
    }

    @Test
    public void testAddAndRemove() throws IpfixException {
        Session session = new Session(model);
        Template t = template("sourceIPv4Address");
        Assert.assertEquals(300, session.addTemplate(false, 300, t));
        Assert.assertSame(t, session.getTemplate(false, 300));
        Assert.assertNull(session.getTemplate(true, 300));
        Assert.assertTrue(session.hasTemplate(false, 300));
        Assert.assertTrue(session.removeTemplate(false, 300));
        Assert.assertFalse(session.removeTemplate(false, 300));
        IpfixException ex = Assert.assertThrows(IpfixException.class, () -> session.requireTemplate(false, 300));
        Assert.assertEquals(IpfixException.Kind.TEMPLATE, ex.getKind());
        ex = Assert.assertThrows(IpfixException.class, () -> session.addTemplate(false, 255, t));
        Assert.assertEquals(IpfixException.Kind.TEMPLATE, ex.getKind());
    }

    @Test
    public void testAutoIds() throws IpfixException {
        Session session = new Session(model);
        Template t = template("sourceIPv4Address");
        session.addTemplate(false, 256, t);
        Assert.assertEquals(257, session.addTemplate(false, Session.AUTO_TEMPLATE_ID, t));
        Assert.assertEquals(258, session.addTemplate(false, Session.AUTO_TEMPLATE_ID, t));
        Assert.assertEquals(65535, session.addTemplate(true, Session.AUTO_TEMPLATE_ID, t));
        Assert.assertEquals(65534, session.addTemplate(true, Session.AUTO_TEMPLATE_ID, t));
    }

    @Test
    public void testDomains() throws IpfixException {
        Session session = new Session(model);
        Template t1 = template("sourceIPv4Address");
        Template t2 = template("destinationIPv4Address");
        Template internal = template("octetDeltaCount");
        session.addTemplate(true, 400, internal);
        session.setDomain(1);
        session.addTemplate(false, 256, t1);
        session.setSequence(10);
        session.setDomain(2);
        Assert.assertNull(session.getTemplate(false, 256));
        Assert.assertEquals(0, session.getSequence());
        session.addTemplate(false, 256, t2);
        // Internal templates are shared by every domain
        Assert.assertSame(internal, session.getTemplate(true, 400));
        session.setDomain(1);
        Assert.assertSame(t1, session.getTemplate(false, 256));
        Assert.assertEquals(10, session.getSequence());
        session.incrementSequence(0xFFFFFFFFL);
        Assert.assertEquals(9, session.getSequence());
    }

    @Test
    public void testPairing() throws IpfixException {
        Session session = new Session(model);
        Template external = template("sourceIPv4Address", "octetDeltaCount");
        Template other = template("destinationIPv4Address");
        Template internal = template("octetDeltaCount");
        session.addTemplate(false, 256, external);
        session.addTemplate(false, 257, other);
        session.addTemplate(false, 258, other);
        session.addTemplate(false, 259, other);
        session.addTemplate(true, 1000, internal);

        // Unknown external template
        IpfixException ex = Assert.assertThrows(IpfixException.class, () -> session.getTemplatePair(300));
        Assert.assertEquals(IpfixException.Kind.TEMPLATE, ex.getKind());

        // Empty pairing table, records are decoded as sent
        TemplatePair pair = session.getTemplatePair(256);
        Assert.assertSame(external, pair.internal());
        Assert.assertEquals(256, pair.internalId());

        session.addTemplatePair(256, 1000);
        session.addTemplatePair(258, 258);
        session.addTemplatePair(259, Session.NO_TRANSCODE);
        pair = session.getTemplatePair(256);
        Assert.assertSame(internal, pair.internal());
        Assert.assertEquals(1000, pair.internalId());
        // Not in the table
        Assert.assertTrue(session.getTemplatePair(257).isSkip());
        // Paired with itself, without an internal template
        Assert.assertSame(other, session.getTemplatePair(258).internal());
        Assert.assertTrue(session.getTemplatePair(259).isSkip());

        // Disabled pairing
        session.setTemplatePairsDisabled(true);
        Assert.assertSame(other, session.getTemplatePair(257).internal());
        session.setTemplatePairsDisabled(false);

        // Pairing with an unknown internal template is ignored
        session.addTemplatePair(257, 2000);
        Assert.assertFalse(session.getTemplatePairs().containsKey(257));
    }

    @Test
    public void testDanglingPair() throws IpfixException {
        Session session = new Session(model);
        session.addTemplate(true, 1000, template("octetDeltaCount"));
        session.addTemplatePair(256, 1000);
        session.addTemplate(false, 256, template("sourceIPv4Address"));
        session.removeTemplate(true, 1000);
        IpfixException ex = Assert.assertThrows(IpfixException.class, () -> session.getTemplatePair(256));
        Assert.assertEquals(IpfixException.Kind.TEMPLATE, ex.getKind());
    }

    private static class Context implements TemplateContext {
        private final List<Object> released;
        private Context(List<Object> released) {
            this.released = released;
        }
        @Override
        public void release(Object appContext) {
            released.add(appContext);
        }
    }

    @Test
    public void testCallback() throws IpfixException {
        List<Integer> seen = new ArrayList<>();
        List<Object> released = new ArrayList<>();
        Session session = new Session(model);
        session.setNewTemplateCallback((s, tid, t, app) -> {
            seen.add(tid);
            Assert.assertEquals("app", app);
            Assert.assertSame(t, s.getTemplate(false, tid));
            s.addTemplatePair(tid, tid);
            return new Context(released);
        }, "app");
        session.addTemplate(false, 256, template("sourceIPv4Address"));
        Assert.assertNotNull(session.getTemplateContext(256));
        // Same layout again, nothing new
        session.addTemplate(false, 256, template("sourceIPv4Address"));
        Assert.assertEquals(List.of(256), seen);
        Assert.assertEquals(List.of(), released);
        // Redefinition
        session.addTemplate(false, 256, template("destinationIPv4Address"));
        Assert.assertEquals(List.of(256, 256), seen);
        Assert.assertEquals(List.of("app"), released);
        Assert.assertEquals(Integer.valueOf(256), session.getTemplatePairs().get(256));
        session.removeTemplate(false, 256);
        Assert.assertEquals(2, released.size());
        session.addTemplate(false, 257, template("sourceIPv4Address"));
        session.setDomain(5);
        session.addTemplate(false, 257, template("sourceIPv4Address"));
        session.close();
        Assert.assertEquals(4, released.size());
        Assert.assertNull(session.getTemplate(false, 257));
    }

    @Test
    public void testReleaseFailure() throws IpfixException {
        Session session = new Session(model);
        session.setNewTemplateCallback((s, tid, t, app) -> new TemplateContext() {
            @Override
            public void release(Object appContext) {
                throw new IllegalStateException("failed");
            }
        }, null);
        session.addTemplate(false, 256, template("sourceIPv4Address"));
        session.close();
        Assert.assertFalse(session.hasTemplate(false, 256));
    }

    @Test
    public void testCloneForPeer() throws IpfixException {
        Session session = new Session(model);
        Template internal = template("octetDeltaCount");
        session.addTemplate(true, 1000, internal);
        session.addTemplatePair(256, 1000);
        session.addTemplate(false, 256, template("sourceIPv4Address", "octetDeltaCount"));
        List<Integer> seen = new ArrayList<>();
        session.setNewTemplateCallback((s, tid, t, app) -> {
            seen.add(tid);
            return null;
        }, null);
        Session clone = session.cloneForPeer();
        Assert.assertSame(internal, clone.getTemplate(true, 1000));
        Assert.assertFalse(clone.hasTemplate(false, 256));
        Assert.assertEquals(session.getTemplatePairs(), clone.getTemplatePairs());
        clone.addTemplate(false, 256, template("sourceIPv4Address", "octetDeltaCount"));
        Assert.assertEquals(List.of(256), seen);
        Assert.assertSame(internal, clone.getTemplatePair(256).internal());
    }

    @Test
    public void testAnnounced() throws IpfixException {
        Session session = new Session(model);
        session.addTemplate(false, 256, template("sourceIPv4Address"));
        Assert.assertFalse(session.isAnnounced(256));
        session.markAnnounced(256);
        Assert.assertTrue(session.isAnnounced(256));
        session.clearAnnounced();
        Assert.assertFalse(session.isAnnounced(256));
        session.markAnnounced(256);
        session.addTemplate(false, 256, template("destinationIPv4Address"));
        Assert.assertFalse(session.isAnnounced(256));
    }

}
