package com.semanticdiff.core.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.semanticdiff.core.model.BusinessRule;
import com.semanticdiff.core.model.Constraint;
import com.semanticdiff.core.model.Ontology;
import com.semanticdiff.core.model.OntologyEntity;
import com.semanticdiff.core.model.OntologyProperty;
import com.semanticdiff.core.model.OntologyRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes ontologies in the JSON interchange format read by {@link OntologyReader}.
 */
public class OntologyWriter {

    private static final Logger log = LoggerFactory.getLogger(OntologyWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Converts an ontology to a JSON tree.
     *
     * @param ontology ontology to convert
     * @return JSON object node
     */
    public ObjectNode toJson(Ontology ontology) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("name", ontology.name());
        root.put("version", ontology.version());
        root.put("source", ontology.source());

        ArrayNode entities = root.putArray("entities");
        for (OntologyEntity entity : ontology.entities()) {
            ObjectNode node = entities.addObject();
            node.put("name", entity.name());
            node.put("description", entity.description());
            node.put("entity_type", entity.entityType());
            ArrayNode properties = node.putArray("properties");
            for (OntologyProperty property : entity.properties()) {
                ObjectNode propertyNode = properties.addObject();
                propertyNode.put("name", property.name());
                propertyNode.put("data_type", property.dataType());
                propertyNode.put("required", property.required());
                propertyNode.put("unique", property.unique());
                propertyNode.put("description", property.description());
                writeConstraints(propertyNode.putArray("constraints"), property.constraints());
            }
            writeConstraints(node.putArray("constraints"), entity.constraints());
        }

        ArrayNode relationships = root.putArray("relationships");
        for (OntologyRelationship relationship : ontology.relationships()) {
            ObjectNode node = relationships.addObject();
            node.put("from_entity", relationship.fromEntity());
            node.put("to_entity", relationship.toEntity());
            node.put("from_property", relationship.fromProperty());
            node.put("to_property", relationship.toProperty());
            node.put("relationship_type", relationship.relationshipType());
            node.put("cardinality", relationship.cardinality());
            node.put("description", relationship.description());
        }

        ArrayNode rules = root.putArray("business_rules");
        for (BusinessRule rule : ontology.businessRules()) {
            ObjectNode node = rules.addObject();
            node.put("name", rule.name());
            node.put("entity", rule.entity());
            node.put("condition", rule.condition());
            node.put("action", rule.action());
            node.put("classification", rule.classification());
            node.put("description", rule.description());
            node.put("priority", rule.priority());
        }

        ObjectNode metadata = root.putObject("metadata");
        ontology.metadata().forEach(metadata::put);
        return root;
    }

    /**
     * Serializes an ontology to pretty-printed JSON.
     *
     * @param ontology ontology to serialize
     * @return JSON text
     * @throws IOException if serialization fails
     */
    public String writeString(Ontology ontology) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(ontology));
    }

    /**
     * Writes an ontology to a file, creating parent directories as needed.
     *
     * @param ontology ontology to write
     * @param file target file
     * @throws IOException if the file cannot be written
     */
    public void write(Ontology ontology, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, writeString(ontology));
        log.info("Wrote ontology '{}' v{} to {}", ontology.name(), ontology.version(), file);
    }

    private static void writeConstraints(ArrayNode array, List<Constraint> constraints) {
        for (Constraint constraint : constraints) {
            ObjectNode node = array.addObject();
            node.put("type", constraint.type());
            node.put("value", constraint.value());
            node.put("message", constraint.message());
        }
    }
}
