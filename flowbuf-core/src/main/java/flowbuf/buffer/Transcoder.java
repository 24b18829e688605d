package flowbuf.buffer;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import flowbuf.IpfixException;
import flowbuf.infomodel.DataType;
import flowbuf.infomodel.InfoElement;
import flowbuf.infomodel.InfoModel;
import flowbuf.session.Session;
import flowbuf.session.TemplatePair;
import flowbuf.template.Template;
import flowbuf.template.TemplateField;
import flowbuf.types.ListSemantic;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * Copies records between their wire encoding, laid out by an external
 * template, and {@link Record}, laid out by an internal template.
 */
class Transcoder {

    private static final Logger logger = LogManager.getLogger();

    static final int MAX_DEPTH = 32;
    private static final int PLAN_CACHE_SIZE = 64;
    private static final int VARLEN_EXTENDED = 255;

    /**
     * For each external field, the index of the internal field or -1.
     */
    record Plan(int[] internalIndex) {}

    // Template doesn't override equals, so the key uses identities
    private record PlanKey(Template external, Template internal) {}

    private final Map<PlanKey, Plan> plans = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<PlanKey, Plan> eldest) {
            return size() > PLAN_CACHE_SIZE;
        }
    };

    private Session session;

    Transcoder(Session session) {
        this.session = session;
    }

    void setSession(Session session) {
        this.session = session;
    }

    Plan plan(Template external, Template internal) throws IpfixException {
        PlanKey key = new PlanKey(external, internal);
        Plan plan = plans.get(key);
        if (plan == null) {
            plan = buildPlan(external, internal);
            plans.put(key, plan);
        }
        return plan;
    }

    private Plan buildPlan(Template external, Template internal) throws IpfixException {
        int[] index = new int[external.size()];
        Arrays.fill(index, -1);
        Map<Long, Integer> occurrences = new HashMap<>();
        for (TemplateField ef: external.getFields()) {
            int occurrence = occurrences.merge(ef.element().getKey(), 1, Integer::sum) - 1;
            TemplateField inf = internal.findField(ef.element(), occurrence);
            if (inf == null) {
                continue;
            }
            if (ef.type().isOctets() && ef.isVariableLength() != inf.isVariableLength()) {
                throw new IpfixException(IpfixException.Kind.UNSUPPORTED, String.format("Transcoding %s between fixed and variable length is not supported", ef.name()));
            }
            index[ef.index()] = inf.index();
        }
        return new Plan(index);
    }

    static int readVarlen(ByteBuf src) throws IpfixException {
        if (! src.isReadable()) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, "Missing variable length prefix");
        }
        int length = src.readUnsignedByte();
        if (length == VARLEN_EXTENDED) {
            if (src.readableBytes() < 2) {
                throw new IpfixException(IpfixException.Kind.MALFORMED, "Truncated variable length prefix");
            }
            length = src.readUnsignedShort();
        }
        return length;
    }

    static void writeVarlen(ByteBuf out, int length) throws IpfixException {
        if (length < VARLEN_EXTENDED) {
            out.writeByte(length);
        } else if (length <= 0xFFFF) {
            out.writeByte(VARLEN_EXTENDED);
            out.writeShort(length);
        } else {
            throw new IpfixException(IpfixException.Kind.UNSUPPORTED, "Variable length value too long: " + length);
        }
    }

    private static ByteBuf readValue(ByteBuf src, TemplateField field) throws IpfixException {
        int length = field.isVariableLength() ? readVarlen(src) : field.length();
        if (src.readableBytes() < length) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Field %s overruns its set: %d bytes needed, %d left", field.name(), length, src.readableBytes()));
        }
        return src.readSlice(length);
    }

    /**
     * Skip one record, without decoding it.
     */
    static void skipRecord(ByteBuf src, Template external) throws IpfixException {
        for (TemplateField f: external.getFields()) {
            readValue(src, f);
        }
    }

    Record decodeRecord(ByteBuf src, TemplatePair pair, Plan plan, int depth) throws IpfixException {
        Template external = pair.external();
        Record r = new Record(pair.internal(), pair.internalId());
        for (TemplateField ef: external.getFields()) {
            ByteBuf value = readValue(src, ef);
            int i = plan.internalIndex()[ef.index()];
            if (i >= 0) {
                decodeField(value, pair.internal().getField(i), r, depth);
            }
        }
        return r;
    }

    private void decodeField(ByteBuf value, TemplateField inf, Record r, int depth) throws IpfixException {
        DataType type = inf.type();
        if (inf.isList()) {
            r.slots[inf.slot()] = decodeList(type, value, depth + 1);
        } else if (! inf.isFixed()) {
            r.slots[inf.slot()] = value;
        } else if (type.isInteger()) {
            int length = value.readableBytes();
            long v = type.isSigned() ? Values.readSigned(value, value.readerIndex(), length) : Values.readUnsigned(value, value.readerIndex(), length);
            Values.writeInteger(r.data, inf.offset(), inf.length(), v);
        } else if (type == DataType.FLOAT64) {
            Values.writeFloat(r.data, inf.offset(), inf.length(), Values.readFloat(value, value.readerIndex(), value.readableBytes()));
        } else {
            copyPadded(value, r.data, inf.offset(), inf.length());
        }
    }

    private static void copyPadded(ByteBuf value, ByteBuf dst, int offset, int length) {
        int copied = Math.min(length, value.readableBytes());
        dst.setBytes(offset, value, value.readerIndex(), copied);
        if (copied < length) {
            dst.setZero(offset + copied, length - copied);
        }
    }

    private Object decodeList(DataType type, ByteBuf value, int depth) throws IpfixException {
        if (depth > MAX_DEPTH) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, "Structured data nested too deeply");
        }
        return switch (type) {
            case BASIC_LIST -> decodeBasicList(value, depth);
            case SUB_TEMPLATE_LIST -> decodeSubTemplateList(value, depth);
            case SUB_TEMPLATE_MULTI_LIST -> decodeSubTemplateMultiList(value, depth);
            default -> throw new IllegalStateException("Not a list type " + type);
        };
    }

    private BasicList decodeBasicList(ByteBuf value, int depth) throws IpfixException {
        if (value.readableBytes() < 5) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, "Basic list too short: " + value.readableBytes());
        }
        ListSemantic semantic = ListSemantic.fromCode(value.readUnsignedByte());
        int rawId = value.readUnsignedShort();
        int itemLength = value.readUnsignedShort();
        long enterprise = 0;
        if ((rawId & 0x8000) != 0) {
            if (value.readableBytes() < 4) {
                throw new IpfixException(IpfixException.Kind.MALFORMED, "Basic list enterprise number truncated");
            }
            enterprise = value.readUnsignedInt();
        }
        int id = rawId & InfoElement.MAX_ID;
        if (itemLength == 0) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Illegal item length 0 in basic list of element %d/%d", enterprise, id));
        }
        InfoModel model = session.getInfoModel();
        InfoElement element = model.get(enterprise, id);
        if (element == null) {
            element = model.addAlien(enterprise, id, itemLength);
        }
        BasicList bl = new BasicList(semantic, element, itemLength);
        DataType itemType = element.getType();
        while (value.isReadable()) {
            int length = itemLength == InfoElement.VARLEN ? readVarlen(value) : itemLength;
            if (value.readableBytes() < length) {
                throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Basic list item of %s overruns its list", element.getName()));
            }
            ByteBuf item = value.readSlice(length);
            bl.items.add(itemType.isList() ? decodeList(itemType, item, depth + 1) : item);
        }
        return bl;
    }

    private SubTemplateList decodeSubTemplateList(ByteBuf value, int depth) throws IpfixException {
        if (! value.isReadable()) {
            return new SubTemplateList(ListSemantic.UNDEFINED, 0, null);
        } else if (value.readableBytes() < 3) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, "Sub template list too short: " + value.readableBytes());
        }
        ListSemantic semantic = ListSemantic.fromCode(value.readUnsignedByte());
        int tid = value.readUnsignedShort();
        TemplatePair pair = resolve(tid, "sub template list");
        if (pair == null) {
            return new SubTemplateList(semantic, tid, null);
        }
        SubTemplateList stl = new SubTemplateList(semantic, tid, pair.internal());
        Plan plan = plan(pair.external(), pair.internal());
        int minLength = Math.max(1, pair.external().getMinWireLength());
        while (value.readableBytes() >= minLength) {
            stl.add(decodeRecord(value, pair, plan, depth));
        }
        return stl;
    }

    private SubTemplateMultiList decodeSubTemplateMultiList(ByteBuf value, int depth) throws IpfixException {
        if (! value.isReadable()) {
            return new SubTemplateMultiList(ListSemantic.UNDEFINED);
        }
        SubTemplateMultiList stml = new SubTemplateMultiList(ListSemantic.fromCode(value.readUnsignedByte()));
        while (value.readableBytes() >= 4) {
            int tid = value.readUnsignedShort();
            int length = value.readUnsignedShort();
            if (length < 4) {
                logger.warn("Invalid sub template multi list entry length {} for template 0x{}", () -> length, () -> Integer.toHexString(tid));
                break;
            }
            if (length - 4 > value.readableBytes()) {
                throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Sub template multi list entry for template 0x%04x overruns its list", tid));
            }
            ByteBuf content = value.readSlice(length - 4);
            TemplatePair pair = resolve(tid, "sub template multi list entry");
            if (pair == null) {
                continue;
            }
            SubTemplateMultiList.Entry entry = stml.addEntry(tid, pair.internal());
            Plan plan = plan(pair.external(), pair.internal());
            int minLength = Math.max(1, pair.external().getMinWireLength());
            while (content.readableBytes() >= minLength) {
                entry.add(decodeRecord(content, pair, plan, depth));
            }
        }
        return stml;
    }

    /**
     * @return the pair, or null if the records are not to be decoded
     */
    private TemplatePair resolve(int tid, String what) throws IpfixException {
        if (! session.hasTemplate(false, tid)) {
            logger.warn("Skipping {}: template 0x{} not present in domain {}", () -> what, () -> Integer.toHexString(tid), session::getDomain);
            return null;
        }
        TemplatePair pair = session.getTemplatePair(tid);
        return pair.isSkip() ? null : pair;
    }

    void encodeRecord(Record r, Template external, ByteBuf out, int depth) throws IpfixException {
        Template internal = r.getTemplate();
        Plan plan = plan(external, internal);
        for (TemplateField ef: external.getFields()) {
            int i = plan.internalIndex()[ef.index()];
            if (i < 0) {
                if (ef.isVariableLength()) {
                    out.writeByte(0);
                } else {
                    out.writeZero(ef.length());
                }
            } else {
                encodeField(r, internal.getField(i), ef, out, depth);
            }
        }
    }

    private void encodeField(Record r, TemplateField inf, TemplateField ef, ByteBuf out, int depth) throws IpfixException {
        DataType type = ef.type();
        if (inf.isList()) {
            Object list = r.slots[inf.slot()];
            ByteBuf content = Unpooled.buffer();
            try {
                if (list != null) {
                    encodeList(list, content, depth + 1);
                }
                writeSized(ef, content, out);
            } finally {
                content.release();
            }
        } else if (! inf.isFixed()) {
            ByteBuf value = (ByteBuf) r.slots[inf.slot()];
            writeSized(ef, value == null ? Unpooled.EMPTY_BUFFER : value.duplicate(), out);
        } else if (ef.isVariableLength()) {
            writeSized(ef, r.data.slice(inf.offset(), inf.length()), out);
        } else if (type.isInteger()) {
            long v = type.isSigned() ? Values.readSigned(r.data, inf.offset(), inf.length()) : Values.readUnsigned(r.data, inf.offset(), inf.length());
            int index = out.writerIndex();
            out.writeZero(ef.length());
            Values.writeInteger(out, index, ef.length(), v);
        } else if (type == DataType.FLOAT64) {
            int index = out.writerIndex();
            out.writeZero(ef.length());
            Values.writeFloat(out, index, ef.length(), Values.readFloat(r.data, inf.offset(), inf.length()));
        } else {
            int copied = Math.min(ef.length(), inf.length());
            out.writeBytes(r.data, inf.offset(), copied);
            out.writeZero(ef.length() - copied);
        }
    }

    /**
     * Write a value with a length prefix for a variable length field, or
     * padded to the length of a fixed one.
     */
    private static void writeSized(TemplateField ef, ByteBuf content, ByteBuf out) throws IpfixException {
        int length = content.readableBytes();
        if (ef.isVariableLength()) {
            writeVarlen(out, length);
            out.writeBytes(content, content.readerIndex(), length);
        } else if (length > ef.length()) {
            throw new IpfixException(IpfixException.Kind.UNSUPPORTED, String.format("Value of %d bytes doesn't fit field %s", length, ef));
        } else {
            out.writeBytes(content, content.readerIndex(), length);
            out.writeZero(ef.length() - length);
        }
    }

    private void encodeList(Object list, ByteBuf out, int depth) throws IpfixException {
        if (depth > MAX_DEPTH) {
            throw new IpfixException(IpfixException.Kind.UNSUPPORTED, "Structured data nested too deeply");
        }
        if (list instanceof BasicList bl) {
            encodeBasicList(bl, out, depth);
        } else if (list instanceof SubTemplateList stl) {
            out.writeByte(stl.getSemantic().code);
            out.writeShort(stl.getTemplateId());
            if (! stl.isEmpty()) {
                Template external = session.requireTemplate(false, stl.getTemplateId());
                for (Record r: stl.getRecords()) {
                    encodeRecord(r, external, out, depth);
                }
            }
        } else if (list instanceof SubTemplateMultiList stml) {
            out.writeByte(stml.getSemantic().code);
            for (SubTemplateMultiList.Entry e: stml.getEntries()) {
                Template external = session.requireTemplate(false, e.getTemplateId());
                int start = out.writerIndex();
                out.writeShort(e.getTemplateId());
                out.writeShort(0);
                for (Record r: e.getRecords()) {
                    encodeRecord(r, external, out, depth);
                }
                int length = out.writerIndex() - start;
                if (length > 0xFFFF) {
                    throw new IpfixException(IpfixException.Kind.UNSUPPORTED, String.format("Sub template multi list entry for 0x%04x too long", e.getTemplateId()));
                }
                out.setShort(start + 2, length);
            }
        } else {
            throw new IllegalArgumentException("Not a list: " + list.getClass().getName());
        }
    }

    private void encodeBasicList(BasicList bl, ByteBuf out, int depth) throws IpfixException {
        InfoElement element = bl.getElement();
        out.writeByte(bl.getSemantic().code);
        out.writeShort(element.getEnterprise() == 0 ? element.getId() : element.getId() | 0x8000);
        out.writeShort(bl.getItemLength());
        if (element.getEnterprise() != 0) {
            out.writeInt((int) element.getEnterprise());
        }
        boolean varlen = bl.getItemLength() == InfoElement.VARLEN;
        for (Object item: bl.items) {
            ByteBuf content;
            if (item instanceof ByteBuf b) {
                content = b.duplicate();
            } else {
                content = Unpooled.buffer();
                encodeList(item, content, depth + 1);
            }
            int length = content.readableBytes();
            if (varlen) {
                writeVarlen(out, length);
                out.writeBytes(content);
            } else {
                int copied = Math.min(length, bl.getItemLength());
                out.writeBytes(content, content.readerIndex(), copied);
                out.writeZero(bl.getItemLength() - copied);
            }
        }
    }

    /**
     * Collect the template ids used by the lists of a record, recursively.
     */
    static void collectTemplateIds(Record r, Set<Integer> ids) {
        for (Object slot: r.slots) {
            collectListTemplateIds(slot, ids);
        }
    }

    private static void collectListTemplateIds(Object list, Set<Integer> ids) {
        if (list instanceof SubTemplateList stl) {
            if (! stl.isEmpty()) {
                ids.add(stl.getTemplateId());
            }
            stl.getRecords().forEach(r -> collectTemplateIds(r, ids));
        } else if (list instanceof SubTemplateMultiList stml) {
            for (SubTemplateMultiList.Entry e: stml.getEntries()) {
                ids.add(e.getTemplateId());
                e.getRecords().forEach(r -> collectTemplateIds(r, ids));
            }
        } else if (list instanceof BasicList bl && bl.getElement().getType().isList()) {
            bl.items.forEach(i -> collectListTemplateIds(i, ids));
        }
    }

}
