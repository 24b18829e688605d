package flowbuf.template;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import flowbuf.IpfixException;
import flowbuf.LogUtils;
import flowbuf.Tools;
import flowbuf.infomodel.InfoElement;
import flowbuf.infomodel.InfoModel;

import static flowbuf.template.TemplateBuilder.FieldSpec.of;

public class TestTemplate {

    private static Logger logger;
    private static InfoModel model;

    @BeforeClass
    public static void configure() {
        Tools.configure();
        logger = LogManager.getLogger();
        LogUtils.setLevel(logger, Level.TRACE, "flowbuf.template");
        model = InfoModel.getBuilder().build();
    }

    @Test
    public void testLayout() throws IpfixException {
        Template t = new TemplateBuilder(model).appendAll(
                of("sourceIPv4Address"),
                of("octetDeltaCount", 4),
                of("interfaceName"),
                of("protocolIdentifier"),
                of("subTemplateList")).build();
        Assert.assertEquals(5, t.size());
        Assert.assertFalse(t.isOptions());
        Assert.assertTrue(t.hasVariableLength());
        Assert.assertTrue(t.hasList());
        // 4 + 4 + 1 + 1 + 1
        Assert.assertEquals(11, t.getMinWireLength());
        Assert.assertEquals(9, t.getFixedLength());
        Assert.assertEquals(2, t.getSlotCount());
        Assert.assertEquals(0, t.getField(0).offset());
        Assert.assertEquals(4, t.getField(1).offset());
        Assert.assertEquals(4, t.getField(1).length());
        Assert.assertEquals(0, t.getField(2).slot());
        Assert.assertFalse(t.getField(2).isFixed());
        Assert.assertEquals(8, t.getField(3).offset());
        Assert.assertEquals(1, t.getField(4).slot());
        Assert.assertTrue(t.getField(4).isList());
        Assert.assertArrayEquals(new int[] {4}, t.getSubTemplateListPositions());
        Assert.assertEquals(0, t.getBasicListPositions().length);
        Assert.assertEquals(2, t.indexOf("interfaceName"));
        Assert.assertEquals(-1, t.indexOf("packetDeltaCount"));
    }

    @Test
    public void testRepeated() throws IpfixException {
        Template t = new TemplateBuilder(model).append("interfaceName").append("octetDeltaCount").append("interfaceName", 16).build();
        Assert.assertEquals(0, t.findField("interfaceName", 0).index());
        Assert.assertEquals(2, t.findField("interfaceName", 1).index());
        Assert.assertEquals(16, t.findField(model.getByName("interfaceName"), 1).length());
        Assert.assertNull(t.findField("interfaceName", 2));
    }

    @Test
    public void testOptions() throws IpfixException {
        TemplateBuilder builder = new TemplateBuilder(model).append("sourceIPv4Address").append("packetDeltaCount");
        Assert.assertThrows(IpfixException.class, () -> builder.setScopeCount(3));
        Template t = builder.setScopeCount(1).build();
        Assert.assertTrue(t.isOptions());
        Assert.assertEquals(1, t.getScopeCount());
    }

    @Test
    public void testErrors() {
        TemplateBuilder builder = new TemplateBuilder(model);
        IpfixException ex = Assert.assertThrows(IpfixException.class, () -> builder.append("noSuchElement"));
        Assert.assertEquals(IpfixException.Kind.NO_ELEMENT, ex.getKind());
        ex = Assert.assertThrows(IpfixException.class, () -> builder.append(0, 8, 2));
        Assert.assertEquals(IpfixException.Kind.LENGTH, ex.getKind());
        ex = Assert.assertThrows(IpfixException.class, () -> builder.append("protocolIdentifier", InfoElement.VARLEN));
        Assert.assertEquals(IpfixException.Kind.LENGTH, ex.getKind());
        Assert.assertEquals(0, builder.size());
    }

    @Test
    public void testCompare() throws IpfixException {
        Template a = new TemplateBuilder(model).append("sourceIPv4Address").append("octetDeltaCount").build();
        Template b = new TemplateBuilder(model).append("octetDeltaCount").append("sourceIPv4Address").build();
        Template c = new TemplateBuilder(model).append("octetDeltaCount").append("sourceIPv4Address").append("protocolIdentifier").build();
        Template d = new TemplateBuilder(model).append("octetDeltaCount", 4).append("packetDeltaCount").build();
        Template e = new TemplateBuilder(model).append("interfaceName").build();

        Assert.assertEquals(TemplateComparison.Result.EQUAL, a.setCompare(b, false).result());
        Assert.assertFalse(a.sameLayout(b));
        Assert.assertEquals(TemplateComparison.Result.SUBSET, a.setCompare(c, false).result());
        Assert.assertEquals(TemplateComparison.Result.SUPERSET, c.setCompare(a, false).result());
        TemplateComparison.Outcome common = a.setCompare(d, true);
        Assert.assertEquals(TemplateComparison.Result.COMMON, common.result());
        Assert.assertEquals(1, common.matchingFields());
        Assert.assertEquals(TemplateComparison.Result.DISJOINT, a.setCompare(d, false).result());
        Assert.assertEquals(TemplateComparison.Result.DISJOINT, a.setCompare(e, true).result());
    }

    @Test
    public void testSameLayout() throws IpfixException {
        Template a = new TemplateBuilder(model).append("sourceIPv4Address").append("octetDeltaCount").build();
        Template b = new TemplateBuilder(model).append("sourceIPv4Address").append("octetDeltaCount").build();
        Template c = new TemplateBuilder(model).append("sourceIPv4Address").append("octetDeltaCount", 4).build();
        Assert.assertTrue(a.sameLayout(b));
        Assert.assertNotEquals(a, b);
        Assert.assertFalse(a.sameLayout(c));
    }

}
