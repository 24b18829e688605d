package flowbuf.buffer;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import flowbuf.Tools;
import flowbuf.infomodel.DataType;
import flowbuf.infomodel.InfoElement;
import flowbuf.types.MacAddress;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

public class TestValues {

    @BeforeClass
    public static void configure() {
        Tools.configure();
    }

    @Test
    public void testIntegers() {
        ByteBuf buf = Unpooled.wrappedBuffer(new byte[] {(byte) 0xFF, (byte) 0xFE, 0x01});
        Assert.assertEquals(0xFFFE01L, Values.readUnsigned(buf, 0, 3));
        Assert.assertEquals(-511L, Values.readSigned(buf, 0, 3));
        Assert.assertEquals(1L, Values.readSigned(buf, 2, 1));
        Assert.assertEquals(0L, Values.readSigned(buf, 0, 0));
        ByteBuf out = Unpooled.buffer(2, 2);
        out.writerIndex(2);
        Values.writeInteger(out, 0, 2, 0x12345678L);
        Assert.assertEquals("5678", ByteBufUtil.hexDump(out));
        Values.writeInteger(out, 0, 2, -2);
        Assert.assertEquals("fffe", ByteBufUtil.hexDump(out));
    }

    @Test
    public void testFloats() {
        ByteBuf buf = Values.encode(DataType.FLOAT64, 4, 1.5);
        Assert.assertEquals(4, buf.readableBytes());
        Assert.assertEquals(1.5, Values.readFloat(buf, 0, 4), 0.0);
        buf = Values.encode(DataType.FLOAT64, InfoElement.VARLEN, Math.PI);
        Assert.assertEquals(8, buf.readableBytes());
        Assert.assertEquals(Math.PI, (Double) Values.decode(DataType.FLOAT64, buf), 0.0);
    }

    @Test
    public void testTimes() {
        Instant t = Instant.ofEpochSecond(1_700_000_000L, 123_456_789);
        Assert.assertEquals(Instant.ofEpochSecond(1_700_000_000L), Values.decode(DataType.DATETIME_SECONDS, Values.encode(DataType.DATETIME_SECONDS, 4, t)));
        Assert.assertEquals(Instant.ofEpochMilli(1_700_000_000_123L), Values.decode(DataType.DATETIME_MILLISECONDS, Values.encode(DataType.DATETIME_MILLISECONDS, 8, t)));
        Assert.assertEquals(Instant.ofEpochSecond(1_700_000_000L, 123_456_000), Values.decode(DataType.DATETIME_MICROSECONDS, Values.encode(DataType.DATETIME_MICROSECONDS, 8, t)));
        Assert.assertEquals(t, Values.decode(DataType.DATETIME_NANOSECONDS, Values.encode(DataType.DATETIME_NANOSECONDS, 8, t)));
        // NTP era starts in 1900
        long raw = Values.encodeTime(DataType.DATETIME_NANOSECONDS, Instant.EPOCH);
        Assert.assertEquals(Values.NTP_EPOCH_OFFSET, raw >>> 32);
        Assert.assertEquals(0, raw & 0xFFFFFFFFL);
        // Microseconds clear the low 11 bits of the fraction
        long micro = Values.encodeTime(DataType.DATETIME_MICROSECONDS, t);
        Assert.assertEquals(0, micro & 0x7FF);
    }

    @Test
    public void testOthers() throws UnknownHostException {
        Assert.assertEquals(Boolean.TRUE, Values.decode(DataType.BOOLEAN, Values.encode(DataType.BOOLEAN, 1, true)));
        Assert.assertEquals(2, Values.encode(DataType.BOOLEAN, 1, false).getByte(0));
        Assert.assertEquals(Boolean.FALSE, Values.decode(DataType.BOOLEAN, Unpooled.wrappedBuffer(new byte[] {2})));
        MacAddress mac = new MacAddress("00:1b:21:3c:9d:f8");
        Assert.assertEquals(mac, Values.decode(DataType.MAC_ADDRESS, Values.encode(DataType.MAC_ADDRESS, 6, "00-1B-21-3C-9D-F8")));
        InetAddress v6 = InetAddress.getByName("2001:db8::1");
        Assert.assertEquals(v6, Values.decode(DataType.IPV6_ADDRESS, Values.encode(DataType.IPV6_ADDRESS, 16, v6)));
        Assert.assertThrows(IllegalArgumentException.class, () -> Values.encode(DataType.IPV4_ADDRESS, 4, v6));
        // Fixed length strings are NUL padded
        ByteBuf s = Values.encode(DataType.STRING, 8, "eth0");
        Assert.assertEquals(8, s.readableBytes());
        Assert.assertEquals("eth0", Values.decode(DataType.STRING, s));
        Assert.assertEquals("été", Values.decode(DataType.STRING, Values.encode(DataType.STRING, InfoElement.VARLEN, "été")));
        Assert.assertArrayEquals(new byte[] {1, 2, 0}, (byte[]) Values.decode(DataType.OCTET_ARRAY, Values.encode(DataType.OCTET_ARRAY, 3, new byte[] {1, 2})));
        Assert.assertThrows(IllegalArgumentException.class, () -> Values.encode(DataType.UNSIGNED8, 1, "text"));
    }

}
