package flowbuf.template;

import flowbuf.infomodel.DataType;
import flowbuf.infomodel.InfoElement;

/**
 * One field of a template.
 *
 * @param element the canonical element
 * @param length the effective length, possibly reduced, or {@link InfoElement#VARLEN}
 * @param index position in the template
 * @param offset position in the record's fixed storage, -1 for variable length fields
 * @param slot position in the record's value slots, -1 for fixed length fields
 */
public record TemplateField(InfoElement element, int length, int index, int offset, int slot) {

    public boolean isVariableLength() {
        return length == InfoElement.VARLEN;
    }

    /**
     * Lists are always held in a value slot, even when the wire length is fixed.
     */
    public boolean isList() {
        return element.getType().isList();
    }

    public boolean isFixed() {
        return offset >= 0;
    }

    public DataType type() {
        return element.getType();
    }

    public String name() {
        return element.getName();
    }

    @Override
    public String toString() {
        return isVariableLength() ? element + "[varlen]" : element + "[" + length + "]";
    }
}
