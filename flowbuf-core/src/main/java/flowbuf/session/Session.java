package flowbuf.session;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import flowbuf.IpfixException;
import flowbuf.infomodel.InfoModel;
import flowbuf.template.Template;
import lombok.Getter;

/**
 * Template bookkeeping for one endpoint. Internal templates describe the
 * application's record layouts and are shared by every observation domain.
 * External templates are the ones seen on, or declared to, the wire. They
 * are scoped to an observation domain, like sequence numbers.
 */
public class Session {

    private static final Logger logger = LogManager.getLogger();

    /** Template set id. */
    public static final int TEMPLATE_SET_ID = 2;
    /** Options template set id. */
    public static final int OPTIONS_TEMPLATE_SET_ID = 3;
    public static final int MIN_TEMPLATE_ID = 256;
    public static final int MAX_TEMPLATE_ID = 65535;
    /** Asks {@link #addTemplate(boolean, int, Template)} to choose an id. */
    public static final int AUTO_TEMPLATE_ID = 0;
    /** Pairing target that skips records. */
    public static final int NO_TRANSCODE = 0;

    private record External(Template template, TemplateContext context) {}

    private static class DomainState {
        private final Map<Integer, External> templates = new HashMap<>();
        private final Set<Integer> announced = new HashSet<>();
        private long sequence = 0;
        private int nextTemplateId = MIN_TEMPLATE_ID;
    }

    @Getter
    private final InfoModel infoModel;
    private final Map<Integer, Template> internalTemplates = new HashMap<>();
    private final Map<Integer, Integer> templatePairs = new HashMap<>();
    private final Map<Long, DomainState> domains = new HashMap<>();
    private DomainState current;
    @Getter
    private long domain = 0;
    @Getter
    private boolean templatePairsDisabled = false;
    private int nextInternalId = MAX_TEMPLATE_ID;
    private NewTemplateCallback callback;
    @Getter
    private Object appContext;

    public Session(InfoModel infoModel) {
        this.infoModel = infoModel;
        this.current = domains.computeIfAbsent(domain, d -> new DomainState());
    }

    /**
     * A session for a new peer: same model, internal templates, pairing and
     * callback, without any external template.
     */
    public Session cloneForPeer() {
        Session clone = new Session(infoModel);
        clone.internalTemplates.putAll(internalTemplates);
        clone.templatePairs.putAll(templatePairs);
        clone.templatePairsDisabled = templatePairsDisabled;
        clone.nextInternalId = nextInternalId;
        clone.callback = callback;
        clone.appContext = appContext;
        return clone;
    }

    public void setNewTemplateCallback(NewTemplateCallback callback, Object appContext) {
        this.callback = callback;
        this.appContext = appContext;
    }

    /**
     * Switch the observation domain, for external templates and sequence numbers.
     */
    public void setDomain(long domain) {
        if (domain != this.domain) {
            this.domain = domain;
            current = domains.computeIfAbsent(domain, d -> new DomainState());
        }
    }

    /**
     * Register a template.
     *
     * @param tid the template id, or {@link #AUTO_TEMPLATE_ID}
     * @return the template id used
     * @throws IpfixException if the id is reserved or no id is left
     */
    public int addTemplate(boolean internal, int tid, Template template) throws IpfixException {
        int id;
        if (tid == AUTO_TEMPLATE_ID) {
            id = internal ? allocateInternalId() : allocateExternalId();
        } else if (tid < MIN_TEMPLATE_ID || tid > MAX_TEMPLATE_ID) {
            throw new IpfixException(IpfixException.Kind.TEMPLATE, String.format("Illegal template id %d", tid));
        } else {
            id = tid;
        }
        if (internal) {
            internalTemplates.put(id, template);
        } else {
            External previous = current.templates.get(id);
            if (previous != null && previous.template.sameLayout(template)) {
                logger.trace("Template 0x{} already known in domain {}", () -> Integer.toHexString(id), () -> domain);
                return id;
            }
            if (previous != null) {
                logger.debug("Template 0x{} redefined in domain {}", () -> Integer.toHexString(id), () -> domain);
                release(previous);
                current.announced.remove(id);
            }
            // The callback may look the template up, so it's registered first
            current.templates.put(id, new External(template, null));
            if (callback != null) {
                TemplateContext ctx = callback.newTemplate(this, id, template, appContext);
                if (ctx != null) {
                    // It might have been removed by the callback
                    current.templates.computeIfPresent(id, (k, v) -> v.template == template ? new External(template, ctx) : v);
                }
            }
        }
        return id;
    }

    private int allocateExternalId() throws IpfixException {
        for (int i = 0; i <= MAX_TEMPLATE_ID - MIN_TEMPLATE_ID; i++) {
            int candidate = current.nextTemplateId;
            current.nextTemplateId = candidate == MAX_TEMPLATE_ID ? MIN_TEMPLATE_ID : candidate + 1;
            if (! current.templates.containsKey(candidate)) {
                return candidate;
            }
        }
        throw new IpfixException(IpfixException.Kind.TEMPLATE, "No external template id left");
    }

    private int allocateInternalId() throws IpfixException {
        for (int i = 0; i <= MAX_TEMPLATE_ID - MIN_TEMPLATE_ID; i++) {
            int candidate = nextInternalId;
            nextInternalId = candidate == MIN_TEMPLATE_ID ? MAX_TEMPLATE_ID : candidate - 1;
            if (! internalTemplates.containsKey(candidate)) {
                return candidate;
            }
        }
        throw new IpfixException(IpfixException.Kind.TEMPLATE, "No internal template id left");
    }

    /**
     * Remove a template and the pairing keyed by its id.
     *
     * @return true if a template was removed
     */
    public boolean removeTemplate(boolean internal, int tid) {
        boolean removed;
        if (internal) {
            removed = internalTemplates.remove(tid) != null;
        } else {
            External previous = current.templates.remove(tid);
            current.announced.remove(tid);
            removed = previous != null;
            if (removed) {
                release(previous);
            }
        }
        templatePairs.remove(tid);
        return removed;
    }

    /**
     * Remove the external templates of the current domain matching a condition.
     *
     * @return the number of templates removed
     */
    public int removeExternalTemplates(Predicate<Template> condition) {
        int count = 0;
        Iterator<Map.Entry<Integer, External>> i = current.templates.entrySet().iterator();
        while (i.hasNext()) {
            Map.Entry<Integer, External> e = i.next();
            if (condition.test(e.getValue().template)) {
                i.remove();
                current.announced.remove(e.getKey());
                templatePairs.remove(e.getKey());
                release(e.getValue());
                count++;
            }
        }
        return count;
    }

    /**
     * @return the template, or null
     */
    public Template getTemplate(boolean internal, int tid) {
        if (internal) {
            return internalTemplates.get(tid);
        } else {
            External e = current.templates.get(tid);
            return e == null ? null : e.template;
        }
    }

    /**
     * @throws IpfixException of kind TEMPLATE if there is no such template
     */
    public Template requireTemplate(boolean internal, int tid) throws IpfixException {
        Template t = getTemplate(internal, tid);
        if (t == null) {
            throw new IpfixException(IpfixException.Kind.TEMPLATE, String.format("Missing %s template 0x%04x in domain %d", internal ? "internal" : "external", tid, domain));
        }
        return t;
    }

    public boolean hasTemplate(boolean internal, int tid) {
        return internal ? internalTemplates.containsKey(tid) : current.templates.containsKey(tid);
    }

    public Map<Integer, Template> getTemplates(boolean internal) {
        if (internal) {
            return Collections.unmodifiableMap(internalTemplates);
        } else {
            Map<Integer, Template> copy = new HashMap<>(current.templates.size());
            current.templates.forEach((k, v) -> copy.put(k, v.template));
            return Collections.unmodifiableMap(copy);
        }
    }

    /**
     * @return the context attached by the new template callback, or null
     */
    public TemplateContext getTemplateContext(int tid) {
        External e = current.templates.get(tid);
        return e == null ? null : e.context;
    }

    /**
     * Records of external template <code>externalId</code> are decoded with
     * internal template <code>internalId</code>, or skipped with
     * {@link #NO_TRANSCODE}. The internal template must be registered, or
     * have the same id as the external template.
     */
    public void addTemplatePair(int externalId, int internalId) {
        if (externalId < MIN_TEMPLATE_ID) {
            logger.debug("Ignoring pairing of illegal template id {}", externalId);
        } else if (internalId == NO_TRANSCODE || internalId == externalId || internalTemplates.containsKey(internalId)) {
            templatePairs.put(externalId, internalId);
        } else {
            logger.debug("Ignoring pairing of 0x{} with unknown internal template 0x{}", () -> Integer.toHexString(externalId), () -> Integer.toHexString(internalId));
        }
    }

    public void removeTemplatePair(int externalId) {
        templatePairs.remove(externalId);
    }

    public Map<Integer, Integer> getTemplatePairs() {
        return Collections.unmodifiableMap(templatePairs);
    }

    public void setTemplatePairsDisabled(boolean disabled) {
        this.templatePairsDisabled = disabled;
    }

    /**
     * Resolve the internal template used to decode records of an external template.
     *
     * @throws IpfixException of kind TEMPLATE if the external template is unknown,
     *         or if its pairing names a missing internal template
     */
    public TemplatePair getTemplatePair(int externalId) throws IpfixException {
        External e = current.templates.get(externalId);
        if (e == null) {
            throw new IpfixException(IpfixException.Kind.TEMPLATE, String.format("Template 0x%04x not present in domain %d", externalId, domain));
        }
        Template external = e.template;
        if (templatePairsDisabled || templatePairs.isEmpty()) {
            return new TemplatePair(externalId, external, externalId, external);
        }
        Integer paired = templatePairs.get(externalId);
        if (paired == null || paired == NO_TRANSCODE) {
            return new TemplatePair(externalId, external, NO_TRANSCODE, null);
        }
        Template internal = internalTemplates.get(paired);
        if (internal != null) {
            return new TemplatePair(externalId, external, paired, internal);
        } else if (paired == externalId) {
            return new TemplatePair(externalId, external, externalId, external);
        } else {
            throw new IpfixException(IpfixException.Kind.TEMPLATE, String.format("Cannot find internal template 0x%04x paired with external template 0x%04x", paired, externalId));
        }
    }

    public long getSequence() {
        return current.sequence;
    }

    public void setSequence(long sequence) {
        current.sequence = sequence & 0xFFFFFFFFL;
    }

    public void incrementSequence(long count) {
        current.sequence = (current.sequence + count) & 0xFFFFFFFFL;
    }

    /**
     * True if the external template was written by the current export.
     */
    public boolean isAnnounced(int tid) {
        return current.announced.contains(tid);
    }

    public void markAnnounced(int tid) {
        current.announced.add(tid);
    }

    /**
     * Forget every announcement, so templates are written again before use.
     */
    public void clearAnnounced() {
        current.announced.clear();
    }

    /**
     * Drop every external template and sequence number, in every domain.
     */
    public void resetExternal() {
        domains.values().forEach(d -> d.templates.values().forEach(this::release));
        domains.clear();
        current = domains.computeIfAbsent(domain, d -> new DomainState());
    }

    /**
     * Release every template context.
     */
    public void close() {
        resetExternal();
    }

    private void release(External e) {
        if (e.context != null) {
            try {
                e.context.release(appContext);
            } catch (RuntimeException ex) {
                logger.error("Failed to release template context: {}", ex::getMessage);
                logger.catching(Level.DEBUG, ex);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("Session[domain=%d, %d internal, %d external]", domain, internalTemplates.size(), current.templates.size());
    }

}
