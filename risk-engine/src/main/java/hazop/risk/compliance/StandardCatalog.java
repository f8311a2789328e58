package hazop.risk.compliance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import hazop.risk.error.ComputationException;
import hazop.risk.error.FieldViolation;
import hazop.risk.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup table of supported regulatory standards, keyed by identifier and read
 * once from {@code regulatory-standards.json}. Adding a standard means adding an
 * identifier and a table entry.
 */
@Component
public class StandardCatalog {
    private static final Logger log = LoggerFactory.getLogger(StandardCatalog.class);
    static final String RESOURCE = "/regulatory-standards.json";

    private final Map<RegulatoryStandardId, RegulatoryStandard> standards;

    @Autowired
    public StandardCatalog(ObjectMapper objectMapper) {
        this(load(objectMapper));
    }

    StandardCatalog(List<RegulatoryStandard> table) {
        Map<RegulatoryStandardId, RegulatoryStandard> byId = new EnumMap<>(RegulatoryStandardId.class);
        for (RegulatoryStandard standard : table) {
            if (byId.put(standard.id(), standard) != null) {
                throw new IllegalStateException("Duplicate standard in catalog: " + standard.id());
            }
        }
        for (RegulatoryStandardId id : RegulatoryStandardId.values()) {
            if (!byId.containsKey(id)) {
                throw new IllegalStateException("Standard catalog has no entry for " + id);
            }
        }
        this.standards = Collections.unmodifiableMap(byId);
        log.info("Loaded {} regulatory standards", byId.size());
    }

    public List<RegulatoryStandard> all() {
        return List.copyOf(standards.values());
    }

    public RegulatoryStandard get(RegulatoryStandardId id) {
        return standards.get(id);
    }

    /**
     * Clause table of a standard. An empty table would let every percentage
     * silently collapse, so it is treated as corrupted configuration.
     */
    public List<RegulatoryClause> clausesFor(RegulatoryStandardId id) {
        List<RegulatoryClause> clauses = standards.get(id).clauses();
        if (clauses.isEmpty()) {
            throw new ComputationException("Standard " + id + " has an empty clause table");
        }
        return clauses;
    }

    /**
     * Parses a comma-separated standards filter. Null or blank selects every
     * supported standard; unknown tokens are all reported in one error.
     */
    public List<RegulatoryStandardId> parseFilter(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of(RegulatoryStandardId.values());
        }
        Set<RegulatoryStandardId> selected = new LinkedHashSet<>();
        List<String> invalid = new ArrayList<>();
        for (String token : raw.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            RegulatoryStandardId id = lookup(trimmed);
            if (id == null) {
                invalid.add(trimmed);
            } else {
                selected.add(id);
            }
        }
        if (!invalid.isEmpty()) {
            String message = "Invalid regulatory standard(s): " + String.join(", ", invalid)
                    + ". Valid values: " + Arrays.toString(RegulatoryStandardId.values());
            throw new ValidationException(message, List.of(new FieldViolation("standards", message)));
        }
        if (selected.isEmpty()) {
            return List.of(RegulatoryStandardId.values());
        }
        return List.copyOf(selected);
    }

    private static RegulatoryStandardId lookup(String token) {
        for (RegulatoryStandardId id : RegulatoryStandardId.values()) {
            if (id.name().equals(token)) {
                return id;
            }
        }
        return null;
    }

    private static List<RegulatoryStandard> load(ObjectMapper objectMapper) {
        try (InputStream in = StandardCatalog.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return objectMapper.readValue(in, new TypeReference<List<RegulatoryStandard>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
    }
}
