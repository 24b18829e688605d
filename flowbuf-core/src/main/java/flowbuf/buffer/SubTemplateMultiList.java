package flowbuf.buffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import flowbuf.template.Template;
import flowbuf.types.ListSemantic;
import lombok.Getter;

/**
 * Records of several templates, RFC 6313 section 4.5.3. Each entry holds the
 * records of one template.
 */
public class SubTemplateMultiList {

    @Getter
    public static class Entry {
        private final int templateId;
        private final Template template;
        private final List<Record> records = new ArrayList<>();

        private Entry(int templateId, Template template) {
            this.templateId = templateId;
            this.template = template;
        }

        public Record newRecord() {
            Record r = new Record(template, templateId);
            records.add(r);
            return r;
        }

        public Entry add(Record r) {
            if (r.getTemplate() != template) {
                throw new IllegalArgumentException("Record doesn't use the entry's template");
            }
            records.add(r);
            return this;
        }

        public List<Record> getRecords() {
            return Collections.unmodifiableList(records);
        }

        public int size() {
            return records.size();
        }

        @Override
        public String toString() {
            return String.format("0x%04x%s", templateId, records);
        }
    }

    @Getter
    private final ListSemantic semantic;
    private final List<Entry> entries = new ArrayList<>();

    public SubTemplateMultiList(ListSemantic semantic) {
        this.semantic = semantic;
    }

    public Entry addEntry(int templateId, Template template) {
        Entry e = new Entry(templateId, template);
        entries.add(e);
        return e;
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public Entry get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public SubTemplateMultiList copy() {
        SubTemplateMultiList copy = new SubTemplateMultiList(semantic);
        for (Entry e: entries) {
            Entry ec = copy.addEntry(e.templateId, e.template);
            e.records.forEach(r -> ec.records.add(r.copy()));
        }
        return copy;
    }

    @Override
    public String toString() {
        return "SubTemplateMultiList[" + semantic + " " + entries + "]";
    }

}
