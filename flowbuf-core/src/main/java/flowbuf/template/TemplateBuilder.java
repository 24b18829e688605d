package flowbuf.template;

import java.util.ArrayList;
import java.util.List;

import flowbuf.IpfixException;
import flowbuf.infomodel.InfoElement;
import flowbuf.infomodel.InfoModel;

/**
 * Builds a {@link Template} field by field. Every length given explicitly is
 * checked against the model's length policy.
 */
public class TemplateBuilder {

    record Spec(InfoElement element, int length) {}

    /**
     * A field given by element name, used for bulk appends.
     *
     * @param name the element name
     * @param length the length, 0 for the canonical length
     */
    public record FieldSpec(String name, int length) {
        public static FieldSpec of(String name) {
            return new FieldSpec(name, 0);
        }
        public static FieldSpec of(String name, int length) {
            return new FieldSpec(name, length);
        }
    }

    private final InfoModel model;
    private final List<Spec> specs = new ArrayList<>();
    private int scopeCount = 0;

    public TemplateBuilder(InfoModel model) {
        this.model = model;
    }

    public TemplateBuilder append(InfoElement element) throws IpfixException {
        return append(element, element.getLength());
    }

    public TemplateBuilder append(InfoElement element, int length) throws IpfixException {
        model.validateLength(element, length);
        specs.add(new Spec(element, length));
        return this;
    }

    public TemplateBuilder append(String name) throws IpfixException {
        return append(resolve(name));
    }

    public TemplateBuilder append(String name, int length) throws IpfixException {
        return append(resolve(name), length);
    }

    public TemplateBuilder append(long enterprise, int id) throws IpfixException {
        return append(resolve(enterprise, id));
    }

    public TemplateBuilder append(long enterprise, int id, int length) throws IpfixException {
        return append(resolve(enterprise, id), length);
    }

    public TemplateBuilder appendAll(FieldSpec... fields) throws IpfixException {
        for (FieldSpec fs: fields) {
            InfoElement ie = resolve(fs.name());
            append(ie, fs.length() == 0 ? ie.getLength() : fs.length());
        }
        return this;
    }

    /**
     * Mark the first <code>count</code> fields as scope fields, making it an options template.
     */
    public TemplateBuilder setScopeCount(int count) throws IpfixException {
        if (count < 0 || count > specs.size()) {
            throw new IpfixException(IpfixException.Kind.TEMPLATE, String.format("Scope count %d out of range for %d fields", count, specs.size()));
        }
        scopeCount = count;
        return this;
    }

    public int size() {
        return specs.size();
    }

    public Template build() {
        return new Template(model, List.copyOf(specs), scopeCount);
    }

    private InfoElement resolve(String name) throws IpfixException {
        InfoElement ie = model.getByName(name);
        if (ie == null) {
            throw new IpfixException(IpfixException.Kind.NO_ELEMENT, "No information element named " + name);
        }
        return ie;
    }

    private InfoElement resolve(long enterprise, int id) throws IpfixException {
        InfoElement ie = model.get(enterprise, id);
        if (ie == null) {
            throw new IpfixException(IpfixException.Kind.NO_ELEMENT, String.format("No information element %d/%d", enterprise, id));
        }
        return ie;
    }

}
