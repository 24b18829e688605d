package flowbuf.buffer;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import flowbuf.IpfixException;
import flowbuf.infomodel.InfoElement;
import flowbuf.infomodel.InfoModel;
import flowbuf.io.Collector;
import flowbuf.io.Exporter;
import flowbuf.session.Session;
import flowbuf.session.TemplatePair;
import flowbuf.template.Template;
import flowbuf.template.TemplateBuilder;
import flowbuf.template.TemplateField;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Reads records from IPFIX messages or writes records to IPFIX messages,
 * transcoding them between the external templates of a {@link Session} and
 * the internal templates of the application.
 * <p>
 * A buffer is either a collecting buffer, fed by a {@link Collector} or by
 * {@link #decode(ByteBuf)}, or an exporting buffer writing to an
 * {@link Exporter}. Not thread safe.
 */
public class MessageBuffer {

    private static final Logger logger = LogManager.getLogger();

    public static final int DEFAULT_CAPACITY = 65535;
    private static final int SET_HEADER_LENGTH = 4;

    @Accessors(chain = true)
    @Setter
    public static class Builder {
        private Session session;
        private Collector collector;
        private Exporter exporter;
        private int capacity = DEFAULT_CAPACITY;
        private int mtu = -1;
        private TemplateRefresh templateRefresh = TemplateRefresh.oncePerSession();
        private boolean autoNextMessage = true;
        private Supplier<Instant> exportTime = Instant::now;
        private Builder() {
        }
        public MessageBuffer build() throws IpfixException {
            if (session == null) {
                throw new IpfixException(IpfixException.Kind.SETUP, "No session for message buffer");
            } else if (collector != null && exporter != null) {
                throw new IpfixException(IpfixException.Kind.SETUP, "A message buffer can't both collect and export");
            } else if (capacity < MessageHeader.LENGTH || capacity > DEFAULT_CAPACITY) {
                throw new IpfixException(IpfixException.Kind.SETUP, "Illegal capacity " + capacity);
            } else if (mtu >= 0 && (mtu <= MessageHeader.LENGTH + SET_HEADER_LENGTH || mtu > DEFAULT_CAPACITY)) {
                throw new IpfixException(IpfixException.Kind.SETUP, "Illegal MTU " + mtu);
            }
            return new MessageBuffer(this);
        }
    }
    public static Builder getBuilder() {
        return new Builder();
    }

    @Getter
    private Session session;
    private final Collector collector;
    private final Exporter exporter;
    @Getter
    private int capacity;
    @Getter
    private final int mtu;
    private final TemplateRefresh templateRefresh;
    private final boolean autoNextMessage;
    private final Supplier<Instant> exportTime;
    private final Transcoder transcoder;

    // Collection state
    private ByteBuf message = null;
    @Getter
    private MessageHeader header = null;
    private ByteBuf currentSet = null;
    private TemplatePair currentPair = null;
    private Transcoder.Plan currentPlan = null;
    private int currentMinLength = 1;
    private int recordsInMessage = 0;
    /**
     * Records lost between the last two collected messages, as told by their
     * sequence numbers. Negative for a backward jump.
     */
    @Getter
    private int lastSequenceGap = 0;

    // Export state
    private ByteBuf out = null;
    private int exportTemplateId = -1;
    private int openSetId = -1;
    private int openSetStart = -1;
    private int recordsInOut = 0;
    @Getter
    private long messageCount = 0;

    private MessageBuffer(Builder builder) {
        this.session = builder.session;
        this.collector = builder.collector;
        this.exporter = builder.exporter;
        this.capacity = builder.capacity;
        if (builder.mtu > 0) {
            this.mtu = builder.mtu;
        } else if (exporter != null) {
            this.mtu = exporter.getMtu();
        } else {
            this.mtu = DEFAULT_CAPACITY;
        }
        this.templateRefresh = builder.templateRefresh;
        this.autoNextMessage = builder.autoNextMessage;
        this.exportTime = builder.exportTime;
        this.transcoder = new Transcoder(session);
    }

    /**
     * Use another session, dropping any message being read or written.
     */
    public void setSession(Session session) {
        this.session = session;
        transcoder.setSession(session);
        abandonMessage();
        resetOutput();
    }

    /**
     * Allow larger messages to be read, after a failure of kind BUFFER_TOO_SMALL.
     */
    public void setCapacity(int capacity) {
        if (capacity < MessageHeader.LENGTH || capacity > DEFAULT_CAPACITY) {
            throw new IllegalArgumentException("Illegal capacity " + capacity);
        }
        this.capacity = capacity;
    }

    /*
     * Collection
     */

    /**
     * Attach a whole message, usually a datagram, whose records are then read
     * with {@link #next()}. Records alias the message buffer.
     *
     * @throws IpfixException of kind BUFFER_TOO_SMALL if the message is larger
     *         than the capacity, nothing is consumed. Of kind MALFORMED if the
     *         header is not valid.
     */
    public void decode(ByteBuf newMessage) throws IpfixException {
        if (exporter != null) {
            throw new IpfixException(IpfixException.Kind.SETUP, "Exporting message buffer can't decode");
        }
        attach(newMessage);
    }

    private void attach(ByteBuf newMessage) throws IpfixException {
        int available = newMessage.readableBytes();
        if (available < MessageHeader.LENGTH) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Message too short for an IPFIX header: %d bytes", available));
        }
        int start = newMessage.readerIndex();
        int version = newMessage.getUnsignedShort(start);
        int length = newMessage.getUnsignedShort(start + 2);
        if (version != MessageHeader.VERSION) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Illegal IPFIX message version 0x%04x", version));
        } else if (length > capacity) {
            throw IpfixException.bufferTooSmall(length, capacity);
        } else if (length < MessageHeader.LENGTH || length != available) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Message length %d doesn't match the %d bytes received", length, available));
        }
        abandonMessage();
        header = new MessageHeader(version, length,
                                   newMessage.getUnsignedInt(start + 4),
                                   newMessage.getUnsignedInt(start + 8),
                                   newMessage.getUnsignedInt(start + 12));
        message = newMessage.slice(start, length);
        message.skipBytes(MessageHeader.LENGTH);
        newMessage.skipBytes(length);
        session.setDomain(header.observationDomain());
        checkSequence(header.sequenceNumber());
        logger.trace("New message {}", header);
    }

    private void checkSequence(long received) {
        long expected = session.getSequence();
        if (expected != received && expected != 0) {
            lastSequenceGap = (int) (received - expected);
            logger.warn("Out of sequence in domain {}: expected {}, got {}, gap {}", session.getDomain(), expected, received, lastSequenceGap);
        } else {
            lastSequenceGap = 0;
        }
        session.setSequence(received);
    }

    /**
     * The next record, across sets and messages.
     *
     * @throws IpfixException of kind END_OF_MESSAGE when the message is
     *         exhausted and no other message is read automatically.
     */
    public Record next() throws IpfixException {
        return read(false);
    }

    /**
     * The next record of the current data set.
     *
     * @throws IpfixException of kind END_OF_SET when the set is exhausted.
     */
    public Record nextInSet() throws IpfixException {
        return read(true);
    }

    private Record read(boolean stopAtSet) throws IpfixException {
        while (true) {
            if (message == null) {
                if (collector == null) {
                    throw new IpfixException(IpfixException.Kind.END_OF_MESSAGE, "No message");
                }
                attach(collector.readMessage(capacity));
            }
            try {
                if (currentSet != null && currentSet.readableBytes() >= currentMinLength) {
                    Record r = transcoder.decodeRecord(currentSet, currentPair, currentPlan, 0);
                    recordsInMessage++;
                    return r;
                } else if (currentSet != null) {
                    closeCollectionSet();
                    if (stopAtSet) {
                        throw new IpfixException(IpfixException.Kind.END_OF_SET, "End of set");
                    }
                } else if (message.isReadable()) {
                    readSet();
                } else {
                    finishMessage();
                    if (collector == null || ! autoNextMessage) {
                        throw new IpfixException(IpfixException.Kind.END_OF_MESSAGE, "End of message");
                    }
                }
            } catch (IpfixException ex) {
                if (ex.is(IpfixException.Kind.MALFORMED)) {
                    abandonMessage();
                }
                throw ex;
            } catch (IndexOutOfBoundsException ex) {
                abandonMessage();
                throw new IpfixException(IpfixException.Kind.MALFORMED, "Truncated message: " + ex.getMessage(), ex);
            }
        }
    }

    /**
     * The external template of the current data set, or null.
     */
    public Template getCollectionTemplate() {
        return currentPair != null ? currentPair.external() : null;
    }

    /**
     * Move to the next data set holding records, if the current one is
     * exhausted, and return its external template.
     *
     * @return the template, or null at the end of the message
     */
    public Template nextCollectionTemplate() throws IpfixException {
        if (message == null) {
            return null;
        }
        try {
            while (currentSet == null || currentSet.readableBytes() < currentMinLength) {
                closeCollectionSet();
                if (! message.isReadable()) {
                    return null;
                }
                readSet();
            }
            return currentPair.external();
        } catch (IpfixException ex) {
            if (ex.is(IpfixException.Kind.MALFORMED)) {
                abandonMessage();
            }
            throw ex;
        } catch (IndexOutOfBoundsException ex) {
            abandonMessage();
            throw new IpfixException(IpfixException.Kind.MALFORMED, "Truncated message: " + ex.getMessage(), ex);
        }
    }

    private void readSet() throws IpfixException {
        if (message.readableBytes() < SET_HEADER_LENGTH) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Truncated set header, %d bytes left", message.readableBytes()));
        }
        int setId = message.readUnsignedShort();
        int setLength = message.readUnsignedShort();
        if (setLength < SET_HEADER_LENGTH || setLength - SET_HEADER_LENGTH > message.readableBytes()) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Illegal length %d for set 0x%04x", setLength, setId));
        }
        ByteBuf content = message.readSlice(setLength - SET_HEADER_LENGTH);
        if (setId == Session.TEMPLATE_SET_ID || setId == Session.OPTIONS_TEMPLATE_SET_ID) {
            readTemplateSet(content, setId == Session.OPTIONS_TEMPLATE_SET_ID);
        } else if (setId < Session.MIN_TEMPLATE_ID) {
            throw new IpfixException(IpfixException.Kind.MALFORMED, String.format("Illegal set id %d", setId));
        } else if (! session.hasTemplate(false, setId)) {
            logger.warn("Skipping set: template 0x{} not present in domain {}", () -> String.format("%04x", setId), session::getDomain);
        } else {
            TemplatePair pair = session.getTemplatePair(setId);
            if (pair.isSkip()) {
                logger.debug("Skipping set 0x{}: not paired", () -> String.format("%04x", setId));
                countRecords(content, pair.external());
            } else {
                currentSet = content;
                currentPair = pair;
                currentPlan = transcoder.plan(pair.external(), pair.internal());
                currentMinLength = Math.max(1, pair.external().getMinWireLength());
            }
        }
    }

    private void countRecords(ByteBuf content, Template external) {
        int minLength = Math.max(1, external.getMinWireLength());
        try {
            while (content.readableBytes() >= minLength) {
                Transcoder.skipRecord(content, external);
                recordsInMessage++;
            }
        } catch (IpfixException ex) {
            logger.debug("Incomplete record in skipped set: {}", ex.getMessage());
        }
    }

    private void readTemplateSet(ByteBuf content, boolean options) throws IpfixException {
        InfoModel model = session.getInfoModel();
        while (content.readableBytes() >= 4) {
            int tid = content.readUnsignedShort();
            int count = content.readUnsignedShort();
            if (count == 0) {
                withdraw(tid);
                continue;
            }
            int scope = 0;
            if (options) {
                if (content.readableBytes() < 2) {
                    logger.warn("Truncated options template record 0x{}", () -> String.format("%04x", tid));
                    return;
                }
                scope = content.readUnsignedShort();
            }
            TemplateBuilder builder = new TemplateBuilder(model);
            String rejection = null;
            for (int i = 0; i < count; i++) {
                if (content.readableBytes() < 4) {
                    logger.warn("Truncated template record 0x{}", () -> String.format("%04x", tid));
                    return;
                }
                int rawId = content.readUnsignedShort();
                int length = content.readUnsignedShort();
                long enterprise = 0;
                if ((rawId & 0x8000) != 0) {
                    if (content.readableBytes() < 4) {
                        logger.warn("Truncated template record 0x{}", () -> String.format("%04x", tid));
                        return;
                    }
                    enterprise = content.readUnsignedInt();
                }
                if (rejection != null) {
                    continue;
                }
                int id = rawId & InfoElement.MAX_ID;
                InfoElement element = model.get(enterprise, id);
                if (element == null) {
                    element = model.addAlien(enterprise, id, length);
                }
                try {
                    builder.append(element, length);
                } catch (IpfixException ex) {
                    if (! ex.is(IpfixException.Kind.LENGTH)) {
                        throw ex;
                    }
                    rejection = ex.getMessage();
                }
            }
            if (tid < Session.MIN_TEMPLATE_ID) {
                logger.warn("Ignoring template with illegal id {}", tid);
            } else if (options && (scope == 0 || scope > count)) {
                logger.warn("Ignoring options template 0x{}: illegal scope count {} for {} fields", String.format("%04x", tid), scope, count);
            } else if (rejection != null) {
                logger.warn("Ignoring template 0x{}: {}", String.format("%04x", tid), rejection);
            } else {
                Template template = builder.setScopeCount(scope).build();
                session.addTemplate(false, tid, template);
                logger.debug("New template 0x{} in domain {}: {}", () -> String.format("%04x", tid), session::getDomain, () -> template);
            }
        }
    }

    private void withdraw(int tid) {
        if (tid == Session.TEMPLATE_SET_ID) {
            int count = session.removeExternalTemplates(t -> ! t.isOptions());
            logger.debug("Withdrawn {} templates in domain {}", count, session.getDomain());
        } else if (tid == Session.OPTIONS_TEMPLATE_SET_ID) {
            int count = session.removeExternalTemplates(Template::isOptions);
            logger.debug("Withdrawn {} options templates in domain {}", count, session.getDomain());
        } else if (session.removeTemplate(false, tid)) {
            logger.debug("Withdrawn template 0x{} in domain {}", () -> String.format("%04x", tid), session::getDomain);
        } else {
            logger.debug("Withdrawal of unknown template 0x{}", () -> String.format("%04x", tid));
        }
    }

    private void closeCollectionSet() {
        currentSet = null;
        currentPair = null;
        currentPlan = null;
        currentMinLength = 1;
    }

    private void finishMessage() {
        session.incrementSequence(recordsInMessage);
        message = null;
        recordsInMessage = 0;
        closeCollectionSet();
    }

    private void abandonMessage() {
        message = null;
        recordsInMessage = 0;
        closeCollectionSet();
    }

    /*
     * Export
     */

    /**
     * Records appended with {@link #append(Record)} use this external template.
     */
    public void setExportTemplate(int tid) throws IpfixException {
        requireExporter();
        session.requireTemplate(false, tid);
        exportTemplateId = tid;
    }

    public void append(Record r) throws IpfixException {
        if (exportTemplateId < 0) {
            throw new IpfixException(IpfixException.Kind.TEMPLATE, "No export template set");
        }
        append(exportTemplateId, r);
    }

    /**
     * Append a record laid out by the external template <code>tid</code>.
     * Templates used are written first, if needed.
     *
     * @throws IpfixException of kind END_OF_MESSAGE if the record doesn't fit
     *         the current message and messages are not emitted automatically.
     *         Of kind BUFFER_TOO_SMALL if it can't fit an empty message.
     */
    public void append(int tid, Record r) throws IpfixException {
        requireExporter();
        Template external = session.requireTemplate(false, tid);
        ByteBuf encoded = Unpooled.buffer(external.getMinWireLength());
        transcoder.encodeRecord(r, external, encoded, 0);
        Set<Integer> needed = new LinkedHashSet<>();
        Transcoder.collectTemplateIds(r, needed);
        needed.add(tid);
        boolean emitted = false;
        while (true) {
            announce(needed);
            int required = encoded.readableBytes() + (openSetId == tid ? 0 : SET_HEADER_LENGTH);
            if (out.writerIndex() + required <= mtu) {
                break;
            } else if (emitted || out.writerIndex() == MessageHeader.LENGTH) {
                throw IpfixException.bufferTooSmall(MessageHeader.LENGTH + SET_HEADER_LENGTH + encoded.readableBytes(), mtu);
            } else if (! autoNextMessage) {
                throw new IpfixException(IpfixException.Kind.END_OF_MESSAGE, "Message full");
            }
            emit();
            emitted = true;
        }
        openSet(tid);
        out.writeBytes(encoded);
        recordsInOut++;
    }

    /**
     * Write the templates not yet announced. A message already holding data
     * records is emitted first. When the templates overflow a message, the
     * pass starts again, as the refresh may have forgotten the ones written
     * before the split.
     */
    private void announce(Set<Integer> tids) throws IpfixException {
        Set<Integer> written = new HashSet<>();
        boolean lostBefore = false;
        boolean restart = true;
        while (restart) {
            restart = false;
            for (int tid: tids) {
                if (session.isAnnounced(tid)) {
                    continue;
                }
                if (recordsInOut > 0) {
                    emit();
                    restart = true;
                    break;
                }
                long before = messageCount;
                writeTemplate(tid, session.requireTemplate(false, tid));
                written.add(tid);
                if (messageCount != before) {
                    boolean lost = written.stream().anyMatch(t -> ! session.isAnnounced(t));
                    if (lost && lostBefore) {
                        // The message was started by these templates and still can't hold them all
                        throw IpfixException.bufferTooSmall(announcementLength(tids), mtu);
                    }
                    lostBefore = lost;
                    if (lost) {
                        restart = true;
                        break;
                    }
                }
            }
        }
    }

    private int announcementLength(Set<Integer> tids) throws IpfixException {
        int length = MessageHeader.LENGTH;
        for (int tid: tids) {
            Template template = session.requireTemplate(false, tid);
            length += SET_HEADER_LENGTH + (template.isOptions() ? 6 : 4);
            for (TemplateField f: template.getFields()) {
                length += f.element().getEnterprise() == 0 ? 4 : 8;
            }
        }
        return length;
    }

    /**
     * Write every external template of the current domain.
     */
    public void exportTemplates() throws IpfixException {
        requireExporter();
        if (recordsInOut > 0) {
            emit();
        }
        for (Map.Entry<Integer, Template> e: new TreeMap<>(session.getTemplates(false)).entrySet()) {
            writeTemplate(e.getKey(), e.getValue());
        }
    }

    /**
     * Tell the collector that a template is withdrawn, and remove it from the
     * session.
     */
    public void withdrawTemplate(int tid) throws IpfixException {
        requireExporter();
        Template template = session.requireTemplate(false, tid);
        ByteBuf record = Unpooled.buffer(4);
        record.writeShort(tid);
        record.writeShort(0);
        writeTemplateRecord(template.isOptions() ? Session.OPTIONS_TEMPLATE_SET_ID : Session.TEMPLATE_SET_ID, record);
        session.removeTemplate(false, tid);
        if (exportTemplateId == tid) {
            exportTemplateId = -1;
        }
    }

    private void writeTemplate(int tid, Template template) throws IpfixException {
        ByteBuf record = Unpooled.buffer();
        record.writeShort(tid);
        record.writeShort(template.size());
        if (template.isOptions()) {
            record.writeShort(template.getScopeCount());
        }
        for (TemplateField f: template.getFields()) {
            InfoElement e = f.element();
            if (e.getEnterprise() == 0) {
                record.writeShort(e.getId());
                record.writeShort(f.length());
            } else {
                record.writeShort(e.getId() | 0x8000);
                record.writeShort(f.length());
                record.writeInt((int) e.getEnterprise());
            }
        }
        writeTemplateRecord(template.isOptions() ? Session.OPTIONS_TEMPLATE_SET_ID : Session.TEMPLATE_SET_ID, record);
        session.markAnnounced(tid);
        logger.trace("Template 0x{} written", () -> String.format("%04x", tid));
    }

    private void writeTemplateRecord(int setId, ByteBuf record) throws IpfixException {
        int required = record.readableBytes() + (openSetId == setId ? 0 : SET_HEADER_LENGTH);
        if (out.writerIndex() + required > mtu) {
            if (out.writerIndex() == MessageHeader.LENGTH) {
                throw IpfixException.bufferTooSmall(MessageHeader.LENGTH + SET_HEADER_LENGTH + record.readableBytes(), mtu);
            } else if (! autoNextMessage) {
                throw new IpfixException(IpfixException.Kind.END_OF_MESSAGE, "Message full");
            }
            emit();
            if (MessageHeader.LENGTH + SET_HEADER_LENGTH + record.readableBytes() > mtu) {
                throw IpfixException.bufferTooSmall(MessageHeader.LENGTH + SET_HEADER_LENGTH + record.readableBytes(), mtu);
            }
        }
        openSet(setId);
        out.writeBytes(record);
    }

    private void openSet(int setId) {
        if (openSetId == setId) {
            return;
        }
        closeSet();
        openSetId = setId;
        openSetStart = out.writerIndex();
        out.writeShort(setId);
        out.writeShort(0);
    }

    private void closeSet() {
        if (openSetId >= 0) {
            out.setShort(openSetStart + 2, out.writerIndex() - openSetStart);
            openSetId = -1;
            openSetStart = -1;
        }
    }

    /**
     * Send the current message, if it holds anything. On failure, the message
     * is kept and the call can be retried.
     */
    public void emit() throws IpfixException {
        requireExporter();
        if (out.writerIndex() == MessageHeader.LENGTH) {
            return;
        }
        closeSet();
        out.setShort(0, MessageHeader.VERSION);
        out.setShort(2, out.writerIndex());
        out.setInt(4, (int) exportTime.get().getEpochSecond());
        out.setInt(8, (int) session.getSequence());
        out.setInt(12, (int) session.getDomain());
        exporter.write(out.slice(0, out.writerIndex()));
        logger.trace("Message of {} bytes and {} records sent", out.writerIndex(), recordsInOut);
        session.incrementSequence(recordsInOut);
        messageCount++;
        if (templateRefresh.isDue(messageCount)) {
            session.clearAnnounced();
        }
        resetOutput();
    }

    /**
     * Messages are built for a single observation domain: a pending message
     * is emitted before switching.
     */
    public void setExportDomain(long domain) throws IpfixException {
        requireExporter();
        if (domain != session.getDomain()) {
            emit();
            session.setDomain(domain);
        }
    }

    private void requireExporter() throws IpfixException {
        if (exporter == null) {
            throw new IpfixException(IpfixException.Kind.SETUP, "Not an exporting message buffer");
        }
        if (out == null) {
            resetOutput();
        }
    }

    private void resetOutput() {
        if (exporter == null) {
            return;
        }
        out = Unpooled.buffer(Math.min(mtu, 1500), mtu);
        out.writeZero(MessageHeader.LENGTH);
        openSetId = -1;
        openSetStart = -1;
        recordsInOut = 0;
    }

    /**
     * Emit any pending message, then close the collector or exporter.
     */
    public void close() throws IpfixException {
        abandonMessage();
        if (collector != null) {
            collector.close();
        }
        if (exporter != null) {
            try {
                emit();
            } finally {
                exporter.close();
            }
        }
    }

    @Override
    public String toString() {
        return String.format("MessageBuffer[%s, %s]", exporter != null ? "export" : "collect", session);
    }

}
