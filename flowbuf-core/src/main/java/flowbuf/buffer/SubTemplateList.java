package flowbuf.buffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import flowbuf.template.Template;
import flowbuf.types.ListSemantic;
import lombok.Getter;

/**
 * Records of a single template, RFC 6313 section 4.5.2. The template id is the
 * one used on the wire, the template is the internal one laying out the
 * records. A list whose records were not decoded has a null template.
 */
@Getter
public class SubTemplateList {

    private final ListSemantic semantic;
    private final int templateId;
    private final Template template;
    private final List<Record> records = new ArrayList<>();

    public SubTemplateList(ListSemantic semantic, int templateId, Template template) {
        this.semantic = semantic;
        this.templateId = templateId;
        this.template = template;
    }

    /**
     * Create an empty record, added to the list.
     */
    public Record newRecord() {
        if (template == null) {
            throw new IllegalStateException("Sub template list without template");
        }
        Record r = new Record(template, templateId);
        records.add(r);
        return r;
    }

    public SubTemplateList add(Record r) {
        if (r.getTemplate() != template) {
            throw new IllegalArgumentException("Record doesn't use the list's template");
        }
        records.add(r);
        return this;
    }

    public List<Record> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public Record get(int index) {
        return records.get(index);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public SubTemplateList copy() {
        SubTemplateList copy = new SubTemplateList(semantic, templateId, template);
        records.forEach(r -> copy.records.add(r.copy()));
        return copy;
    }

    @Override
    public String toString() {
        return String.format("SubTemplateList[%s 0x%04x %s]", semantic, templateId, records);
    }

}
