package flowbuf.infomodel;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import lombok.Data;

/**
 * Loads elements from a CSV file in the format of the IANA registry,
 * <a href="https://www.iana.org/assignments/ipfix/ipfix-information-elements.csv">ipfix-information-elements.csv</a>.
 * The same layout is used for vendor registries, with an enterprise number
 * given to the loader.
 */
public class CsvElementLoader implements ElementLoader {

    private static final Logger logger = LogManager.getLogger();

    public static final String IANA_RESOURCE = "ipfix-information-elements.csv";

    // RFC 5103 section 6.1, elements that must not be reversed
    private static final Set<Integer> NON_REVERSIBLE = Set.of(
            10, 14, 40, 41, 42, 73, 130, 131, 137, 138, 141, 143, 144, 145, 148, 149,
            160, 161, 163, 164, 165, 166, 167, 168, 173, 210, 211, 212, 213, 214, 215, 216, 217,
            239, 291, 292, 293, 303, 320, 322, 323, 324, 325, 339, 340, 341, 342, 343, 344, 345, 346
    );
    private static final Pattern RANGE = Pattern.compile("(-?\\d+)\\s*-\\s*(-?\\d+)");

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"elementId", "name", "type", "semantics", "status", "description",
                        "units", "range", "additional", "references", "revision", "date"})
    public static class Entry {
        private String elementId = "";
        private String name = "";
        private String type = "";
        private String semantics = "";
        private String status = "";
        private String description = "";
        private String units = "";
        private String range = "";
        private String additional = "";
        private String references = "";
        private String revision = "";
        private String date = "";
    }

    // Parsed once per process, on first use
    private static class IanaHolder {
        private static final List<InfoElement> ELEMENTS = loadResource();
        private static List<InfoElement> loadResource() {
            URL resource = CsvElementLoader.class.getClassLoader().getResource(IANA_RESOURCE);
            if (resource == null) {
                throw new IllegalStateException("Missing resource " + IANA_RESOURCE);
            }
            try {
                return Collections.unmodifiableList(new CsvElementLoader(resource, 0).read());
            } catch (IOException ex) {
                throw new IllegalStateException("Can't use " + IANA_RESOURCE, ex);
            }
        }
    }

    /**
     * The bundled IANA elements.
     */
    public static List<InfoElement> ianaElements() {
        return IanaHolder.ELEMENTS;
    }

    private final URL source;
    private final long enterprise;

    public CsvElementLoader(URL source, long enterprise) {
        this.source = source;
        this.enterprise = enterprise;
    }

    @Override
    public void load(InfoModel model) throws IOException {
        model.addAll(read());
    }

    public List<InfoElement> read() throws IOException {
        try (InputStream is = source.openStream(); Reader in = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return read(in);
        }
    }

    List<InfoElement> read(Reader in) throws IOException {
        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = mapper.schemaFor(Entry.class).withHeader();
        ObjectReader csvReader = mapper.readerFor(Entry.class).with(schema);
        List<InfoElement> elements = new ArrayList<>();
        MappingIterator<Entry> i = csvReader.readValues(in);
        while (i.hasNextValue()) {
            try {
                Entry e = i.nextValue();
                InfoElement ie = resolve(e);
                if (ie != null) {
                    elements.add(ie);
                }
            } catch (JsonMappingException ex) {
                logger.debug("Ignored broken line in {}: {}", source, ex.getMessage());
            }
        }
        return elements;
    }

    private InfoElement resolve(Entry e) {
        int id;
        try {
            id = Integer.parseInt(e.elementId.trim());
        } catch (NumberFormatException ex) {
            // Reserved ranges like "433-32767"
            logger.trace("Not an element id: {}", e.elementId);
            return null;
        }
        DataType type = DataType.fromName(e.type.trim());
        if (type == null || e.name.isBlank() || id > InfoElement.MAX_ID) {
            logger.debug("Skipping element {} \"{}\" with type \"{}\"", id, e.name, e.type);
            return null;
        }
        InfoElement.Builder builder = InfoElement.getBuilder()
                                                 .setEnterprise(enterprise)
                                                 .setId(id)
                                                 .setName(e.name.trim())
                                                 .setType(type)
                                                 .setSemantic(ElementSemantic.fromName(e.semantics))
                                                 .setUnits(ElementUnits.fromName(e.units))
                                                 .setDescription(e.description.trim())
                                                 .setReversible(enterprise != 0 || ! NON_REVERSIBLE.contains(id));
        Matcher m = RANGE.matcher(e.range.trim());
        if (m.matches()) {
            try {
                builder.setMin(Long.parseLong(m.group(1))).setMax(Long.parseUnsignedLong(m.group(2)));
            } catch (NumberFormatException ex) {
                logger.debug("Unusable range \"{}\" for {}", e.range, e.name);
            }
        }
        return builder.build();
    }

}
