package flowbuf.infomodel;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import flowbuf.IpfixException;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Registry of information elements, indexed by (enterprise, id) and by name.
 * <p>
 * Not thread safe: lookups from other threads while elements are added require
 * external synchronization.
 */
public class InfoModel {

    private static final Logger logger = LogManager.getLogger();

    public static final String REVERSE_PREFIX = "reverse";
    /** RFC 5103 reverse information element private enterprise number. */
    public static final long REVERSE_ENTERPRISE = 29305;
    public static final int REVERSE_FLAG = 0x4000;
    public static final String ALIEN_NAME = "_alienInformationElement";
    static final int MAX_NAME_LENGTH = 500;

    @Accessors(chain = true)
    @Setter
    public static class Builder {
        private LengthPolicy lengthPolicy = LengthPolicy.REJECT;
        private boolean loadDefaults = true;
        private Builder() {
        }
        public InfoModel build() {
            InfoModel model = new InfoModel(this);
            if (loadDefaults) {
                model.addAll(CsvElementLoader.ianaElements());
            }
            return model;
        }
    }
    public static Builder getBuilder() {
        return new Builder();
    }

    private final Map<Long, InfoElement> elements = new HashMap<>();
    private final Map<String, InfoElement> names = new HashMap<>();
    @Getter
    private final LengthPolicy lengthPolicy;

    private InfoModel(Builder builder) {
        this.lengthPolicy = builder.lengthPolicy;
    }

    /**
     * Register an element, replacing any element with the same identity. A
     * reversible element also registers its reverse.
     */
    public void add(InfoElement element) {
        put(element);
        if (element.isReversible() && ! element.isReverse()) {
            reverseOf(element).ifPresent(this::put);
        }
    }

    public void addAll(InfoElement... newElements) {
        for (InfoElement e: newElements) {
            add(e);
        }
    }

    public void addAll(Collection<InfoElement> newElements) {
        newElements.forEach(this::add);
    }

    private void put(InfoElement element) {
        InfoElement previous = elements.put(element.getKey(), element);
        if (previous != null && names.get(previous.getName()) == previous) {
            names.remove(previous.getName());
        }
        if (! element.isAlien()) {
            names.put(element.getName(), element);
        }
    }

    private Optional<InfoElement> reverseOf(InfoElement element) {
        String name = element.getName();
        if (REVERSE_PREFIX.length() + name.length() > MAX_NAME_LENGTH) {
            return Optional.empty();
        }
        String reverseName = REVERSE_PREFIX + (name.isEmpty() ? "" : Character.toUpperCase(name.charAt(0)) + name.substring(1));
        InfoElement.Builder builder = element.toBuilder().setName(reverseName).setReversible(false).setReverse(true);
        if (element.getEnterprise() == 0) {
            builder.setEnterprise(REVERSE_ENTERPRISE);
        } else {
            builder.setId(element.getId() | REVERSE_FLAG);
        }
        return Optional.of(builder.build());
    }

    public InfoElement get(long enterprise, int id) {
        return elements.get(InfoElement.key(enterprise, id));
    }

    public InfoElement getByName(String name) {
        return names.get(name);
    }

    public boolean contains(long enterprise, int id) {
        return elements.containsKey(InfoElement.key(enterprise, id));
    }

    public int size() {
        return elements.size();
    }

    public Collection<InfoElement> elements() {
        return Collections.unmodifiableCollection(elements.values());
    }

    /**
     * Register a placeholder for an element that a peer uses but this model
     * does not know.
     */
    public InfoElement addAlien(long enterprise, int id, int length) {
        InfoElement alien = InfoElement.getBuilder()
                                       .setEnterprise(enterprise)
                                       .setId(id)
                                       .setName(ALIEN_NAME)
                                       .setType(DataType.OCTET_ARRAY)
                                       .setLength(length)
                                       .setAlien(true)
                                       .build();
        logger.debug("Registering alien element {}/{} with length {}", enterprise, id, length);
        put(alien);
        return alien;
    }

    /**
     * Check that a template field length is legal for an element's type.
     *
     * @throws IpfixException of kind LENGTH if it's not
     */
    public static void checkLength(InfoElement element, int length) throws IpfixException {
        DataType type = element.getType();
        switch (type) {
        case BOOLEAN, DATETIME_SECONDS, DATETIME_MILLISECONDS, DATETIME_MICROSECONDS, DATETIME_NANOSECONDS,
             FLOAT32, SIGNED8, UNSIGNED8, IPV4_ADDRESS, IPV6_ADDRESS, MAC_ADDRESS -> {
            if (length == InfoElement.VARLEN) {
                throw new IpfixException(IpfixException.Kind.LENGTH, String.format("Information element %s may not be variable length", element.getName()));
            } else if (length != type.canonicalLength) {
                throw illegalLength(element, length);
            }
        }
        case FLOAT64 -> {
            if (length != 4 && length != 8) {
                throw illegalLength(element, length);
            }
        }
        case SIGNED16, SIGNED32, SIGNED64, UNSIGNED16, UNSIGNED32, UNSIGNED64 -> {
            if (length == 0 || length > type.canonicalLength) {
                throw illegalLength(element, length);
            }
        }
        case BASIC_LIST, SUB_TEMPLATE_LIST, SUB_TEMPLATE_MULTI_LIST -> {
            if (length == 0) {
                throw illegalLength(element, length);
            }
        }
        case OCTET_ARRAY, STRING -> {
            // Any length is legal
        }
        }
    }

    private static IpfixException illegalLength(InfoElement element, int length) {
        return new IpfixException(IpfixException.Kind.LENGTH, String.format("Illegal length %d for information element %s", length, element.getName()));
    }

    /**
     * Check a length according to this model's {@link LengthPolicy}.
     *
     * @throws IpfixException only with {@link LengthPolicy#REJECT}
     */
    public void validateLength(InfoElement element, int length) throws IpfixException {
        try {
            checkLength(element, length);
        } catch (IpfixException ex) {
            if (lengthPolicy == LengthPolicy.REJECT) {
                throw ex;
            } else {
                logger.warn(ex.getMessage());
            }
        }
    }

}
