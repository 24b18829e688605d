package flowbuf.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import flowbuf.infomodel.DataType;
import flowbuf.infomodel.InfoElement;
import flowbuf.infomodel.InfoModel;
import lombok.Getter;

/**
 * An immutable ordered list of fields, built with a {@link TemplateBuilder}.
 * Templates are freely shared between sessions.
 */
public final class Template {

    private final InfoModel model;
    private final List<TemplateField> fields;
    @Getter
    private final int scopeCount;
    /**
     * Fixed lengths plus one byte for each variable length field.
     */
    @Getter
    private final int minWireLength;
    /**
     * Size of a record's fixed storage.
     */
    @Getter
    private final int fixedLength;
    /**
     * Number of value slots for variable length and list fields.
     */
    @Getter
    private final int slotCount;
    private final boolean variableLength;
    private final boolean list;
    private final int[] basicListPositions;
    private final int[] subTemplateListPositions;
    private final int[] subTemplateMultiListPositions;

    Template(InfoModel model, List<TemplateBuilder.Spec> specs, int scopeCount) {
        this.model = model;
        this.scopeCount = scopeCount;
        List<TemplateField> built = new ArrayList<>(specs.size());
        int offset = 0;
        int slot = 0;
        int wire = 0;
        boolean hasVarlen = false;
        for (TemplateBuilder.Spec s: specs) {
            boolean varlen = s.length() == InfoElement.VARLEN;
            hasVarlen |= varlen;
            wire += varlen ? 1 : s.length();
            if (varlen || s.element().getType().isList()) {
                built.add(new TemplateField(s.element(), s.length(), built.size(), -1, slot++));
            } else {
                built.add(new TemplateField(s.element(), s.length(), built.size(), offset, -1));
                offset += s.length();
            }
        }
        this.fields = Collections.unmodifiableList(built);
        this.minWireLength = wire;
        this.fixedLength = offset;
        this.slotCount = slot;
        this.variableLength = hasVarlen;
        this.basicListPositions = positions(DataType.BASIC_LIST);
        this.subTemplateListPositions = positions(DataType.SUB_TEMPLATE_LIST);
        this.subTemplateMultiListPositions = positions(DataType.SUB_TEMPLATE_MULTI_LIST);
        this.list = basicListPositions.length + subTemplateListPositions.length + subTemplateMultiListPositions.length > 0;
    }

    private int[] positions(DataType type) {
        return fields.stream().filter(f -> f.type() == type).mapToInt(TemplateField::index).toArray();
    }

    public InfoModel getInfoModel() {
        return model;
    }

    public int size() {
        return fields.size();
    }

    public TemplateField getField(int index) {
        return fields.get(index);
    }

    public List<TemplateField> getFields() {
        return fields;
    }

    public boolean isOptions() {
        return scopeCount > 0;
    }

    public boolean hasVariableLength() {
        return variableLength;
    }

    public boolean hasList() {
        return list;
    }

    public int[] getBasicListPositions() {
        return basicListPositions.clone();
    }

    public int[] getSubTemplateListPositions() {
        return subTemplateListPositions.clone();
    }

    public int[] getSubTemplateMultiListPositions() {
        return subTemplateMultiListPositions.clone();
    }

    /**
     * Find the n-th field (counting from 0) using the named element.
     *
     * @return the field, or null
     */
    public TemplateField findField(String name, int occurrence) {
        int seen = 0;
        for (TemplateField f: fields) {
            if (f.name().equals(name) && seen++ == occurrence) {
                return f;
            }
        }
        return null;
    }

    /**
     * Find the n-th field (counting from 0) with the same element identity.
     *
     * @return the field, or null
     */
    public TemplateField findField(InfoElement element, int occurrence) {
        int seen = 0;
        for (TemplateField f: fields) {
            if (f.element().sameIdentity(element) && seen++ == occurrence) {
                return f;
            }
        }
        return null;
    }

    /**
     * @return the index of the first field with this name, or -1
     */
    public int indexOf(String name) {
        TemplateField f = findField(name, 0);
        return f == null ? -1 : f.index();
    }

    public boolean contains(InfoElement element) {
        return findField(element, 0) != null;
    }

    /**
     * Same elements in the same order, with the same lengths and scope.
     */
    public boolean sameLayout(Template other) {
        if (other == this) {
            return true;
        }
        if (other == null || other.fields.size() != fields.size() || other.scopeCount != scopeCount) {
            return false;
        }
        for (int i = 0; i < fields.size(); i++) {
            TemplateField a = fields.get(i);
            TemplateField b = other.fields.get(i);
            if (! a.element().sameIdentity(b.element()) || a.length() != b.length()) {
                return false;
            }
        }
        return true;
    }

    public TemplateComparison.Outcome setCompare(Template other, boolean ignoreLengths) {
        return TemplateComparison.compare(this, other, ignoreLengths);
    }

    @Override
    public String toString() {
        return fields.stream().map(TemplateField::toString)
                     .collect(Collectors.joining(", ", scopeCount > 0 ? "Template[scope=" + scopeCount + "; " : "Template[", "]"));
    }

}
