package flowbuf.buffer;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import flowbuf.infomodel.DataType;
import flowbuf.infomodel.InfoElement;
import flowbuf.types.ListSemantic;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.Getter;

/**
 * Repeated values of a single information element, RFC 6313 section 4.5.1.
 * Items are held encoded, with the list's item length, or as list objects
 * when the element is itself a list.
 */
public class BasicList {

    @Getter
    private final ListSemantic semantic;
    @Getter
    private final InfoElement element;
    @Getter
    private final int itemLength;
    final List<Object> items = new ArrayList<>();

    public BasicList(ListSemantic semantic, InfoElement element) {
        this(semantic, element, element.getLength());
    }

    public BasicList(ListSemantic semantic, InfoElement element, int itemLength) {
        this.semantic = semantic;
        this.element = element;
        this.itemLength = itemLength;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Add a value, encoded with the list's item length.
     */
    public BasicList add(Object value) {
        DataType type = element.getType();
        if (type.isList()) {
            if (! (value instanceof BasicList || value instanceof SubTemplateList || value instanceof SubTemplateMultiList)) {
                throw new IllegalArgumentException("Items of " + element.getName() + " must be lists");
            }
            items.add(value);
        } else {
            items.add(Values.encode(type, itemLength, value));
        }
        return this;
    }

    public BasicList addAll(Object... values) {
        for (Object v: values) {
            add(v);
        }
        return this;
    }

    /**
     * The item as a Java value, see {@link Values#decode(DataType, ByteBuf)}.
     */
    public Object get(int index) {
        Object item = items.get(index);
        return item instanceof ByteBuf b ? Values.decode(element.getType(), b.duplicate()) : item;
    }

    public ByteBuf getOctets(int index) {
        return ((ByteBuf) items.get(index)).duplicate();
    }

    public long getLong(int index) {
        ByteBuf b = getOctets(index);
        return element.getType().isSigned() ? Values.readSigned(b, b.readerIndex(), b.readableBytes()) : Values.readUnsigned(b, b.readerIndex(), b.readableBytes());
    }

    public String getString(int index) {
        return Values.readString(getOctets(index));
    }

    public InetAddress getAddress(int index) {
        ByteBuf b = getOctets(index);
        return Values.readAddress(b, b.readerIndex(), b.readableBytes());
    }

    public List<Object> values() {
        List<Object> values = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            values.add(get(i));
        }
        return Collections.unmodifiableList(values);
    }

    public BasicList copy() {
        BasicList copy = new BasicList(semantic, element, itemLength);
        for (Object item: items) {
            if (item instanceof ByteBuf b) {
                copy.items.add(Unpooled.copiedBuffer(b));
            } else if (item instanceof BasicList bl) {
                copy.items.add(bl.copy());
            } else if (item instanceof SubTemplateList stl) {
                copy.items.add(stl.copy());
            } else if (item instanceof SubTemplateMultiList stml) {
                copy.items.add(stml.copy());
            }
        }
        return copy;
    }

    @Override
    public String toString() {
        return "BasicList[" + semantic + " " + element.getName() + " " + values() + "]";
    }

}
