package com.semanticdiff.core.io;

import com.semanticdiff.core.model.BusinessRule;
import com.semanticdiff.core.model.Ontology;
import com.semanticdiff.core.model.OntologyEntity;
import com.semanticdiff.core.model.OntologyProperty;
import com.semanticdiff.core.model.OntologyRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Checks that names are unique within their scope: entities and rules per
 * model, properties per entity and {@code From→To} pairs per model.
 */
public final class OntologyValidator {

    private static final Logger log = LoggerFactory.getLogger(OntologyValidator.class);

    private OntologyValidator() {
        // Utility class
    }

    /**
     * Lists duplicate-name problems of a model.
     *
     * @param ontology model to check
     * @return one message per duplicated name, empty if the model is clean
     */
    public static List<String> findDuplicates(Ontology ontology) {
        Objects.requireNonNull(ontology, "ontology must not be null");

        List<String> problems = new ArrayList<>();
        collect(problems, ontology.entities(), OntologyEntity::name, "entity", ontology.name());
        for (OntologyEntity entity : ontology.entities()) {
            collect(problems, entity.properties(), OntologyProperty::name, "property", ontology.name() + "." + entity.name());
        }
        collect(problems, ontology.relationships(), OntologyRelationship::key, "relationship", ontology.name());
        collect(problems, ontology.businessRules(), BusinessRule::name, "business rule", ontology.name());
        return problems;
    }

    /**
     * Validates a model under the given policy.
     *
     * @param ontology model to check
     * @param policy duplicate-name policy
     * @throws ModelValidationException under {@link DuplicateNamePolicy#REJECT} when duplicates exist
     */
    public static void validate(Ontology ontology, DuplicateNamePolicy policy) {
        List<String> problems = findDuplicates(ontology);
        if (problems.isEmpty()) {
            return;
        }
        if (policy == DuplicateNamePolicy.REJECT) {
            throw new ModelValidationException(problems);
        }
        problems.forEach(problem -> log.warn("{} (last definition wins)", problem));
    }

    private static <T> void collect(List<String> problems, Collection<T> items,
                                    Function<T, String> keyExtractor, String kind, String scope) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (T item : items) {
            counts.merge(keyExtractor.apply(item), 1, Integer::sum);
        }
        counts.forEach((key, count) -> {
            if (count > 1) {
                problems.add("Duplicate " + kind + " '" + key + "' in " + scope + " (" + count + " definitions)");
            }
        });
    }
}
