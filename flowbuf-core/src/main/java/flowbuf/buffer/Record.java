package flowbuf.buffer;

import java.net.InetAddress;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import flowbuf.infomodel.DataType;
import flowbuf.template.Template;
import flowbuf.template.TemplateField;
import flowbuf.types.MacAddress;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import lombok.Getter;

/**
 * A record laid out by an internal template. Fixed length fields are stored
 * big endian at their template offset, with the template's length. Variable
 * length fields and lists are held in value slots.
 * <p>
 * A decoded record's variable length values are slices of the message buffer:
 * they are only valid until the next decode call. Use {@link #copy()} to keep
 * a record longer.
 */
public class Record {

    @Getter
    private final Template template;
    @Getter
    private final int templateId;
    final ByteBuf data;
    final Object[] slots;

    public Record(Template template) {
        this(template, 0);
    }

    public Record(Template template, int templateId) {
        this.template = template;
        this.templateId = templateId;
        this.data = Unpooled.wrappedBuffer(new byte[template.getFixedLength()]);
        this.slots = new Object[template.getSlotCount()];
    }

    private Record(Record other) {
        this.template = other.template;
        this.templateId = other.templateId;
        this.data = Unpooled.copiedBuffer(other.data);
        this.slots = new Object[other.slots.length];
        for (int i = 0; i < slots.length; i++) {
            Object o = other.slots[i];
            if (o instanceof ByteBuf b) {
                slots[i] = Unpooled.copiedBuffer(b);
            } else if (o instanceof BasicList bl) {
                slots[i] = bl.copy();
            } else if (o instanceof SubTemplateList stl) {
                slots[i] = stl.copy();
            } else if (o instanceof SubTemplateMultiList stml) {
                slots[i] = stml.copy();
            }
        }
    }

    /**
     * A deep copy, not sharing any buffer with this record.
     */
    public Record copy() {
        return new Record(this);
    }

    public int size() {
        return template.size();
    }

    public int indexOf(String name) {
        int index = template.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("No field " + name + " in record");
        }
        return index;
    }

    /**
     * The raw encoded value of a field, a view on the record's storage.
     */
    public ByteBuf getOctets(int index) {
        TemplateField f = template.getField(index);
        if (f.isFixed()) {
            return data.slice(f.offset(), f.length());
        } else if (f.isList()) {
            throw new IllegalArgumentException(f.name() + " is a list");
        } else {
            ByteBuf value = (ByteBuf) slots[f.slot()];
            return value == null ? Unpooled.EMPTY_BUFFER : value.duplicate();
        }
    }

    public ByteBuf getOctets(String name) {
        return getOctets(indexOf(name));
    }

    public long getUnsigned(int index) {
        ByteBuf v = getOctets(index);
        return Values.readUnsigned(v, v.readerIndex(), v.readableBytes());
    }

    public long getSigned(int index) {
        ByteBuf v = getOctets(index);
        return Values.readSigned(v, v.readerIndex(), v.readableBytes());
    }

    /**
     * An integer, sign extended for signed types.
     */
    public long getLong(int index) {
        return template.getField(index).type().isSigned() ? getSigned(index) : getUnsigned(index);
    }

    public long getLong(String name) {
        return getLong(indexOf(name));
    }

    public double getDouble(int index) {
        ByteBuf v = getOctets(index);
        return Values.readFloat(v, v.readerIndex(), v.readableBytes());
    }

    public double getDouble(String name) {
        return getDouble(indexOf(name));
    }

    public boolean getBoolean(int index) {
        return (Boolean) Values.decode(DataType.BOOLEAN, getOctets(index));
    }

    public boolean getBoolean(String name) {
        return getBoolean(indexOf(name));
    }

    public Instant getInstant(int index) {
        return (Instant) Values.decode(template.getField(index).type(), getOctets(index));
    }

    public Instant getInstant(String name) {
        return getInstant(indexOf(name));
    }

    public InetAddress getAddress(int index) {
        ByteBuf v = getOctets(index);
        return Values.readAddress(v, v.readerIndex(), v.readableBytes());
    }

    public InetAddress getAddress(String name) {
        return getAddress(indexOf(name));
    }

    public MacAddress getMacAddress(int index) {
        return (MacAddress) Values.decode(DataType.MAC_ADDRESS, getOctets(index));
    }

    public MacAddress getMacAddress(String name) {
        return getMacAddress(indexOf(name));
    }

    public String getString(int index) {
        return Values.readString(getOctets(index));
    }

    public String getString(String name) {
        return getString(indexOf(name));
    }

    public byte[] getBytes(int index) {
        return ByteBufUtil.getBytes(getOctets(index));
    }

    public byte[] getBytes(String name) {
        return getBytes(indexOf(name));
    }

    public BasicList getBasicList(int index) {
        return (BasicList) getList(index, DataType.BASIC_LIST);
    }

    public BasicList getBasicList(String name) {
        return getBasicList(indexOf(name));
    }

    public SubTemplateList getSubTemplateList(int index) {
        return (SubTemplateList) getList(index, DataType.SUB_TEMPLATE_LIST);
    }

    public SubTemplateList getSubTemplateList(String name) {
        return getSubTemplateList(indexOf(name));
    }

    public SubTemplateMultiList getSubTemplateMultiList(int index) {
        return (SubTemplateMultiList) getList(index, DataType.SUB_TEMPLATE_MULTI_LIST);
    }

    public SubTemplateMultiList getSubTemplateMultiList(String name) {
        return getSubTemplateMultiList(indexOf(name));
    }

    private Object getList(int index, DataType type) {
        TemplateField f = template.getField(index);
        if (f.type() != type) {
            throw new IllegalArgumentException(f.name() + " is not a " + type);
        }
        return slots[f.slot()];
    }

    /**
     * The value of a field as the Java type matching its IPFIX type, lists as
     * themselves. An unset list is null.
     */
    public Object getValue(int index) {
        TemplateField f = template.getField(index);
        if (f.isList()) {
            return slots[f.slot()];
        } else {
            return Values.decode(f.type(), getOctets(index));
        }
    }

    public Object getValue(String name) {
        return getValue(indexOf(name));
    }

    /**
     * Set a field from a Java value: a {@link Number} for numeric types, an
     * {@link Instant} for time, an {@link InetAddress}, a {@link MacAddress}, a
     * {@link Boolean}, a String, a byte array or a {@link ByteBuf} for octets,
     * or the matching list object.
     *
     * @throws IllegalArgumentException if the value can't be used for the field
     */
    public Record set(int index, Object value) {
        TemplateField f = template.getField(index);
        if (f.isList()) {
            boolean matches = switch (f.type()) {
                case BASIC_LIST -> value instanceof BasicList;
                case SUB_TEMPLATE_LIST -> value instanceof SubTemplateList;
                case SUB_TEMPLATE_MULTI_LIST -> value instanceof SubTemplateMultiList;
                default -> false;
            };
            if (value != null && ! matches) {
                throw new IllegalArgumentException("Can't use " + value.getClass().getName() + " for " + f.name());
            }
            slots[f.slot()] = value;
        } else if (f.isFixed()) {
            Values.encode(f.type(), data, f.offset(), f.length(), value);
        } else {
            slots[f.slot()] = value == null ? null : Values.encode(f.type(), f.length(), value);
        }
        return this;
    }

    public Record set(String name, Object value) {
        return set(indexOf(name), value);
    }

    /**
     * All the values, keyed by element name. Repeated elements get a suffix
     * with their occurrence.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> values = new LinkedHashMap<>(template.size());
        for (TemplateField f: template.getFields()) {
            String key = f.name();
            for (int n = 1; values.containsKey(key); n++) {
                key = f.name() + "#" + n;
            }
            values.put(key, getValue(f.index()));
        }
        return values;
    }

    @Override
    public String toString() {
        return "Record" + toMap();
    }

}
