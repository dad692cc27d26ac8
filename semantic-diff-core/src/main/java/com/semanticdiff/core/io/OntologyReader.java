package com.semanticdiff.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.semanticdiff.core.model.BusinessRule;
import com.semanticdiff.core.model.Constraint;
import com.semanticdiff.core.model.Ontology;
import com.semanticdiff.core.model.OntologyEntity;
import com.semanticdiff.core.model.OntologyProperty;
import com.semanticdiff.core.model.OntologyRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads ontologies from the JSON interchange format.
 *
 * <p>Field names are snake_case ({@code entity_type}, {@code data_type},
 * {@code from_entity}, {@code business_rules}, ...). Optional fields take
 * these defaults when absent:
 * <ul>
 *   <li>model: name {@code "Unnamed"}, version {@code "1.0"}</li>
 *   <li>entity: entity_type {@code "standard"}</li>
 *   <li>property: data_type {@code "String"}, required/unique {@code false}</li>
 *   <li>relationship: relationship_type {@code "related_to"}, cardinality {@code "one-to-many"}</li>
 *   <li>business rule: priority {@code 1}</li>
 * </ul>
 *
 * <p>Elements without a name (or relationships without both ends) are
 * rejected with a {@link ModelValidationException} listing every problem.
 * Duplicate names are handled per {@link DuplicateNamePolicy}.
 */
public class OntologyReader {

    private static final Logger log = LoggerFactory.getLogger(OntologyReader.class);

    private static final String DEFAULT_NAME = "Unnamed";
    private static final String DEFAULT_VERSION = "1.0";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DuplicateNamePolicy duplicateNamePolicy;

    /**
     * Creates a reader that accepts duplicate names (last wins).
     */
    public OntologyReader() {
        this(DuplicateNamePolicy.LAST_WINS);
    }

    /**
     * Creates a reader.
     *
     * @param duplicateNamePolicy how duplicate names are handled
     */
    public OntologyReader(DuplicateNamePolicy duplicateNamePolicy) {
        this.duplicateNamePolicy = Objects.requireNonNull(duplicateNamePolicy, "duplicateNamePolicy must not be null");
    }

    /**
     * Reads an ontology from a JSON file.
     *
     * @param file JSON file
     * @return parsed ontology
     * @throws IOException if the file cannot be read or is not valid JSON
     * @throws ModelValidationException if the model is malformed
     */
    public Ontology read(Path file) throws IOException {
        log.debug("Reading ontology from: {}", file);
        return toOntology(objectMapper.readTree(file.toFile()), file.toString());
    }

    /**
     * Reads an ontology from a JSON string.
     *
     * @param json JSON content
     * @return parsed ontology
     * @throws IOException if the content is not valid JSON
     * @throws ModelValidationException if the model is malformed
     */
    public Ontology readString(String json) throws IOException {
        return toOntology(objectMapper.readTree(json), "<string>");
    }

    /**
     * Reads every file matching a glob in a directory. Files that fail to load
     * are logged and skipped.
     *
     * @param directory directory to scan
     * @param glob file name pattern (e.g. {@code "*.json"})
     * @return ontologies keyed by file name, sorted by file name
     * @throws IOException if the directory cannot be listed
     */
    public Map<String, Ontology> readDirectory(Path directory, String glob) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        files.sort(Path::compareTo);

        Map<String, Ontology> ontologies = new LinkedHashMap<>();
        for (Path file : files) {
            try {
                Ontology ontology = read(file);
                ontologies.put(file.getFileName().toString(), ontology);
                log.info("Loaded ontology '{}' from {} ({} entities)",
                    ontology.name(), file.getFileName(), ontology.entities().size());
            } catch (IOException | ModelValidationException e) {
                log.warn("Failed to load {}: {}", file, e.getMessage());
            }
        }
        return ontologies;
    }

    private Ontology toOntology(JsonNode root, String origin) {
        if (root == null || !root.isObject()) {
            throw new ModelValidationException(List.of(origin + ": expected a JSON object"));
        }

        List<String> errors = new ArrayList<>();

        List<OntologyEntity> entities = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root.path("entities")) {
            String name = text(node, "name", null);
            if (name == null || name.isBlank()) {
                errors.add(origin + ": entities[" + index + "] has no name");
            } else {
                entities.add(toEntity(node, name, origin, errors));
            }
            index++;
        }

        List<OntologyRelationship> relationships = new ArrayList<>();
        index = 0;
        for (JsonNode node : root.path("relationships")) {
            String from = text(node, "from_entity", null);
            String to = text(node, "to_entity", null);
            if (from == null || to == null) {
                errors.add(origin + ": relationships[" + index + "] needs from_entity and to_entity");
            } else {
                relationships.add(new OntologyRelationship(
                    from,
                    to,
                    text(node, "from_property", ""),
                    text(node, "to_property", ""),
                    text(node, "relationship_type", "related_to"),
                    text(node, "cardinality", "one-to-many"),
                    text(node, "description", "")));
            }
            index++;
        }

        List<BusinessRule> rules = new ArrayList<>();
        index = 0;
        for (JsonNode node : root.path("business_rules")) {
            String name = text(node, "name", null);
            if (name == null || name.isBlank()) {
                errors.add(origin + ": business_rules[" + index + "] has no name");
            } else {
                rules.add(new BusinessRule(
                    name,
                    text(node, "entity", ""),
                    text(node, "condition", ""),
                    text(node, "action", ""),
                    text(node, "classification", ""),
                    text(node, "description", ""),
                    node.path("priority").asInt(1)));
            }
            index++;
        }

        if (!errors.isEmpty()) {
            throw new ModelValidationException(errors);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        root.path("metadata").fields().forEachRemaining(entry ->
            metadata.put(entry.getKey(), entry.getValue().isValueNode()
                ? entry.getValue().asText()
                : entry.getValue().toString()));

        Ontology ontology = new Ontology(
            text(root, "name", DEFAULT_NAME),
            text(root, "version", DEFAULT_VERSION),
            text(root, "source", ""),
            entities,
            relationships,
            rules,
            metadata);

        OntologyValidator.validate(ontology, duplicateNamePolicy);
        return ontology;
    }

    private OntologyEntity toEntity(JsonNode node, String name, String origin, List<String> errors) {
        List<OntologyProperty> properties = new ArrayList<>();
        int index = 0;
        for (JsonNode propertyNode : node.path("properties")) {
            String propertyName = text(propertyNode, "name", null);
            if (propertyName == null || propertyName.isBlank()) {
                errors.add(origin + ": entity '" + name + "' properties[" + index + "] has no name");
            } else {
                properties.add(new OntologyProperty(
                    propertyName,
                    text(propertyNode, "data_type", "String"),
                    propertyNode.path("required").asBoolean(false),
                    propertyNode.path("unique").asBoolean(false),
                    text(propertyNode, "description", ""),
                    toConstraints(propertyNode.path("constraints"))));
            }
            index++;
        }

        return new OntologyEntity(
            name,
            text(node, "description", ""),
            text(node, "entity_type", "standard"),
            properties,
            toConstraints(node.path("constraints")));
    }

    private List<Constraint> toConstraints(JsonNode array) {
        List<Constraint> constraints = new ArrayList<>();
        for (JsonNode node : array) {
            String type = text(node, "type", null);
            if (type != null) {
                constraints.add(new Constraint(type, text(node, "value", ""), text(node, "message", "")));
            }
        }
        return constraints;
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
