package flowbuf.infomodel;

import java.util.Objects;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * An immutable information element definition, identified by its enterprise
 * number and element id.
 */
@Getter
public class InfoElement {

    public static final int VARLEN = 65535;
    public static final int MAX_ID = 0x7FFF;

    @Accessors(chain = true)
    @Setter
    public static class Builder {
        private long enterprise = 0;
        private int id;
        private String name;
        private DataType type = DataType.OCTET_ARRAY;
        private int length = -1;
        private ElementSemantic semantic = ElementSemantic.DEFAULT;
        private ElementUnits units = ElementUnits.NONE;
        private long min = 0;
        private long max = 0;
        private boolean reversible = false;
        private boolean reverse = false;
        private boolean alien = false;
        private String description = "";
        private Builder() {
        }
        public InfoElement build() {
            if (id < 0 || id > MAX_ID) {
                throw new IllegalArgumentException("Invalid element id " + id);
            }
            if (enterprise < 0 || enterprise > 0xFFFFFFFFL) {
                throw new IllegalArgumentException("Invalid enterprise number " + enterprise);
            }
            Objects.requireNonNull(name, "Information element without a name");
            Objects.requireNonNull(type);
            return new InfoElement(this);
        }
    }
    public static Builder getBuilder() {
        return new Builder();
    }

    private final long enterprise;
    private final int id;
    private final String name;
    private final DataType type;
    /**
     * Canonical length, {@link #VARLEN} for variable length types.
     */
    private final int length;
    private final ElementSemantic semantic;
    private final ElementUnits units;
    private final long min;
    private final long max;
    private final boolean reversible;
    private final boolean reverse;
    private final boolean alien;
    private final String description;

    private InfoElement(Builder builder) {
        this.enterprise = builder.enterprise;
        this.id = builder.id;
        this.name = builder.name;
        this.type = builder.type;
        this.length = builder.length < 0 ? builder.type.canonicalLength : builder.length;
        this.semantic = builder.semantic;
        this.units = builder.units;
        this.min = builder.min;
        this.max = builder.max;
        this.reversible = builder.reversible;
        this.reverse = builder.reverse;
        this.alien = builder.alien;
        this.description = builder.description;
    }

    /**
     * A builder preloaded with this element's attributes.
     */
    public Builder toBuilder() {
        return getBuilder().setEnterprise(enterprise).setId(id).setName(name).setType(type).setLength(length)
                           .setSemantic(semantic).setUnits(units).setMin(min).setMax(max)
                           .setReversible(reversible).setReverse(reverse).setAlien(alien)
                           .setDescription(description);
    }

    public boolean isVariableLength() {
        return length == VARLEN;
    }

    public long getKey() {
        return key(enterprise, id);
    }

    /**
     * Same identity, ignoring every other attribute.
     */
    public boolean sameIdentity(InfoElement other) {
        return other != null && enterprise == other.enterprise && id == other.id;
    }

    public static long key(long enterprise, int id) {
        return (enterprise << 16) | (id & 0xFFFF);
    }

    @Override
    public String toString() {
        return enterprise == 0 ? String.format("%s(%d)", name, id) : String.format("%s(%d/%d)", name, enterprise, id);
    }

}
