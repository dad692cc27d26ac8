package com.semanticdiff.core.merge;

import com.semanticdiff.core.TestModels;
import com.semanticdiff.core.diff.ChangeType;
import com.semanticdiff.core.diff.ElementType;
import com.semanticdiff.core.model.BusinessRule;
import com.semanticdiff.core.model.Ontology;
import com.semanticdiff.core.model.OntologyEntity;
import com.semanticdiff.core.model.OntologyProperty;
import com.semanticdiff.core.model.OntologyRelationship;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.semanticdiff.core.TestModels.entity;
import static com.semanticdiff.core.TestModels.ontology;
import static com.semanticdiff.core.TestModels.property;
import static com.semanticdiff.core.TestModels.relationship;
import static com.semanticdiff.core.TestModels.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MergeEngine}.
 */
class MergeEngineTest {

    private final MergeEngine engine = new MergeEngine();

    @Test
    void merge_sameModelThreeTimes_onlyBumpsVersion() {
        Ontology base = TestModels.sales();

        MergeResult result = engine.merge(base, base, base);

        Ontology merged = result.merged();
        assertThat(result.hasConflicts()).isFalse();
        assertThat(merged.version()).isEqualTo("1.1");
        assertThat(merged.name()).isEqualTo(base.name());
        assertThat(merged.entities()).isEqualTo(base.entities());
        assertThat(merged.relationships()).isEqualTo(base.relationships());
        assertThat(merged.businessRules()).isEqualTo(base.businessRules());

        Map<String, String> metadata = new LinkedHashMap<>(merged.metadata());
        assertThat(metadata.remove(MergeEngine.MERGED_FROM_KEY)).isEqualTo("[Sales, Sales]");
        assertThat(metadata).isEqualTo(base.metadata());
    }

    @Test
    void merge_independentEntityAdditions_keepsBoth() {
        // Given
        Ontology base = ontology("Shop", entity("Customer"));
        Ontology ours = ontology("Shop", entity("Customer"), entity("Product"));
        Ontology theirs = ontology("Shop", entity("Customer"), entity("Order"));

        // When
        MergeResult result = engine.merge(base, ours, theirs, MergeStrategy.UNION);

        // Then
        assertThat(result.conflicts()).isEmpty();
        assertThat(result.strategy()).isEqualTo(MergeStrategy.UNION);
        assertThat(result.merged().entities())
            .extracting(OntologyEntity::name)
            .containsExactly("Customer", "Product", "Order");
    }

    @Test
    void merge_bothChangeDescription_reportsSingleConflict() {
        Ontology base = ontology("Shop", describedCustomer("A customer"));
        Ontology ours = ontology("Shop", describedCustomer("A buyer"));
        Ontology theirs = ontology("Shop", describedCustomer("A client"));

        MergeResult result = engine.merge(base, ours, theirs);

        assertThat(result.conflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.path()).isEqualTo("Customer.description");
            assertThat(conflict.elementType()).isEqualTo(ElementType.ENTITY);
            assertThat(conflict.resolution()).isEqualTo(MergeStrategy.OURS);
            assertThat(conflict.ourChange().newValue()).isEqualTo("A buyer");
            assertThat(conflict.theirChange().newValue()).isEqualTo("A client");
        });
        assertThat(result.merged().entities().get(0).description()).isEqualTo("A buyer");
    }

    @Test
    void merge_theirsStrategy_takesTheirValueOnConflict() {
        Ontology base = ontology("Shop", describedCustomer("A customer"));
        Ontology ours = ontology("Shop", describedCustomer("A buyer"));
        Ontology theirs = ontology("Shop", describedCustomer("A client"));

        MergeResult result = engine.merge(base, ours, theirs, MergeStrategy.THEIRS);

        assertThat(result.conflicts()).hasSize(1);
        assertThat(result.conflicts().get(0).resolution()).isEqualTo(MergeStrategy.THEIRS);
        assertThat(result.merged().entities().get(0).description()).isEqualTo("A client");
    }

    @Test
    void merge_labelOnlyMode_keepsOursWhateverTheStrategy() {
        Ontology base = ontology("Shop", describedCustomer("A customer"));
        Ontology ours = ontology("Shop", describedCustomer("A buyer"));
        Ontology theirs = ontology("Shop", describedCustomer("A client"));

        MergeResult result = new MergeEngine(false).merge(base, ours, theirs, MergeStrategy.THEIRS);

        assertThat(result.conflicts()).singleElement()
            .extracting(MergeConflict::resolution)
            .isEqualTo(MergeStrategy.THEIRS);
        assertThat(result.merged().entities().get(0).description()).isEqualTo("A buyer");
    }

    @Test
    void merge_theirsAddsProperty_propertyIncorporated() {
        Ontology base = ontology("Shop", entity("Customer", property("Id", "Integer")));
        Ontology theirs = ontology("Shop", entity("Customer", property("Id", "Integer"), property("Email", "String")));

        MergeResult result = engine.merge(base, base, theirs);

        assertThat(result.conflicts()).isEmpty();
        assertThat(result.merged().entities().get(0).properties())
            .extracting(OntologyProperty::name)
            .containsExactly("Id", "Email");
    }

    @Test
    void merge_theirsOnlyModification_isNotPropagated() {
        Ontology base = ontology("Shop", describedCustomer("A customer"));
        Ontology theirs = ontology("Shop", describedCustomer("A client"));

        MergeResult result = engine.merge(base, base, theirs);

        assertThat(result.conflicts()).isEmpty();
        assertThat(result.merged().entities().get(0).description()).isEqualTo("A customer");
    }

    @Test
    void merge_bothAddSameEntity_unionCombinesProperties() {
        Ontology base = ontology("Shop", entity("Customer"));
        Ontology ours = ontology("Shop", entity("Customer"),
            entity("Order", property("Id", "Integer"), property("Total", "Decimal")));
        Ontology theirs = ontology("Shop", entity("Customer"),
            entity("Order", property("Id", "Integer"), property("Status", "String")));

        MergeResult union = engine.merge(base, ours, theirs, MergeStrategy.UNION);
        MergeResult their = engine.merge(base, ours, theirs, MergeStrategy.THEIRS);

        assertThat(union.conflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.path()).isEqualTo("Order");
            assertThat(conflict.theirChange().changeType()).isEqualTo(ChangeType.ADDED);
        });
        assertThat(union.merged().findEntity("Order").orElseThrow().properties())
            .extracting(OntologyProperty::name)
            .containsExactly("Id", "Total", "Status");
        assertThat(their.merged().findEntity("Order").orElseThrow().properties())
            .extracting(OntologyProperty::name)
            .containsExactly("Id", "Status");
    }

    @Test
    void merge_ruleConditionConflict_theirsReplacesOnlyThatField() {
        Ontology base = ontology("Shop", List.of(), List.of(), List.of(rule("HighValueOrder", "Amount > 10000")), Map.of());
        Ontology ours = ontology("Shop", List.of(), List.of(), List.of(rule("HighValueOrder", "Amount > 20000")), Map.of());
        Ontology theirs = ontology("Shop", List.of(), List.of(), List.of(rule("HighValueOrder", "Amount > 50000")), Map.of());

        MergeResult result = engine.merge(base, ours, theirs, MergeStrategy.THEIRS);

        assertThat(result.conflicts()).extracting(MergeConflict::path)
            .containsExactly("rule:HighValueOrder.condition");
        assertThat(result.merged().businessRules().get(0).condition()).isEqualTo("Amount > 50000");
        assertThat(result.merged().businessRules().get(0).action()).isEqualTo("flag");
    }

    @Test
    void merge_metadataConflict_resolvedPerStrategy() {
        Ontology base = ontology("Shop", List.of(), List.of(), List.of(), Map.of("owner", "core"));
        Ontology ours = ontology("Shop", List.of(), List.of(), List.of(), Map.of("owner", "sales"));
        Ontology theirs = ontology("Other", List.of(), List.of(), List.of(), Map.of("owner", "finance", "region", "EU"));

        MergeResult keepOurs = engine.merge(base, ours, theirs, MergeStrategy.OURS);
        MergeResult takeTheirs = engine.merge(base, ours, theirs, MergeStrategy.THEIRS);

        assertThat(keepOurs.merged().metadata())
            .containsEntry("owner", "sales")
            .containsEntry("region", "EU")
            .containsEntry(MergeEngine.MERGED_FROM_KEY, "[Shop, Other]");
        assertThat(takeTheirs.merged().metadata()).containsEntry("owner", "finance");
    }

    @Test
    void merge_propertyFieldConflict_theirsReplacesOnlyThatField() {
        // Given
        Ontology base = ontology("Shop", entity("Customer", new OntologyProperty("Id", "Integer", false, false, "", List.of())));
        Ontology ours = ontology("Shop", entity("Customer", new OntologyProperty("Id", "Long", true, false, "", List.of())));
        Ontology theirs = ontology("Shop", entity("Customer", new OntologyProperty("Id", "String", false, false, "", List.of())));

        // When
        MergeResult result = engine.merge(base, ours, theirs, MergeStrategy.THEIRS);

        // Then
        assertThat(result.conflicts()).extracting(MergeConflict::path)
            .containsExactly("Customer.Id.data_type");
        OntologyProperty id = result.merged().findEntity("Customer").orElseThrow().properties().get(0);
        assertThat(id.dataType()).isEqualTo("String");
        assertThat(id.required()).isTrue();
    }

    @Test
    void merge_theirsAddsRelationshipAndRule_bothIncorporated() {
        // Given
        Ontology base = ontology("Shop", entity("Customer"), entity("Order"));
        Ontology ours = ontology("Shop", List.of(entity("Customer"), entity("Order"), entity("Product")),
            List.of(), List.of(), Map.of());
        Ontology theirs = ontology("Shop", List.of(entity("Customer"), entity("Order")),
            List.of(relationship("Order", "Customer", "many-to-one")),
            List.of(rule("HighValueOrder", "Amount > 10000")), Map.of());

        // When
        MergeResult result = engine.merge(base, ours, theirs);

        // Then
        assertThat(result.hasConflicts()).isFalse();
        assertThat(result.merged().entities()).extracting(OntologyEntity::name)
            .containsExactly("Customer", "Order", "Product");
        assertThat(result.merged().relationships()).extracting(OntologyRelationship::key)
            .containsExactly("Order→Customer");
        assertThat(result.merged().businessRules()).extracting(BusinessRule::name)
            .containsExactly("HighValueOrder");
    }

    @Test
    void merge_relationshipCardinalityConflict_resolvedPerStrategy() {
        // Given
        Ontology base = withRelationship(new OntologyRelationship("Order", "Customer", "", "", "related_to", "many-to-one", ""));
        Ontology ours = withRelationship(new OntologyRelationship("Order", "Customer", "", "", "belongs_to", "one-to-one", ""));
        Ontology theirs = withRelationship(new OntologyRelationship("Order", "Customer", "", "", "related_to", "one-to-many", ""));

        // When
        MergeResult their = engine.merge(base, ours, theirs, MergeStrategy.THEIRS);
        MergeResult union = engine.merge(base, ours, theirs, MergeStrategy.UNION);

        // Then
        assertThat(their.conflicts()).extracting(MergeConflict::path)
            .containsExactly("Order→Customer.cardinality");
        OntologyRelationship taken = their.merged().relationships().get(0);
        assertThat(taken.cardinality()).isEqualTo("one-to-many");
        assertThat(taken.relationshipType()).isEqualTo("belongs_to");

        OntologyRelationship kept = union.merged().relationships().get(0);
        assertThat(kept.cardinality()).isEqualTo("one-to-one");
        assertThat(kept.relationshipType()).isEqualTo("belongs_to");
    }

    @Test
    void merge_relationshipTypeConflict_theirsTakesType() {
        Ontology base = withRelationship(new OntologyRelationship("Order", "Customer", "", "", "related_to", "many-to-one", ""));
        Ontology ours = withRelationship(new OntologyRelationship("Order", "Customer", "", "", "belongs_to", "many-to-one", ""));
        Ontology theirs = withRelationship(new OntologyRelationship("Order", "Customer", "", "", "placed_by", "many-to-one", ""));

        MergeResult result = engine.merge(base, ours, theirs, MergeStrategy.THEIRS);

        assertThat(result.conflicts()).extracting(MergeConflict::path)
            .containsExactly("Order→Customer.type");
        assertThat(result.merged().relationships().get(0).relationshipType()).isEqualTo("placed_by");
    }

    @ParameterizedTest
    @CsvSource({
        "1.0, 1.1",
        "2.3.9, 2.3.10",
        "1, 1.1",
        "1.x, 1.x.1"
    })
    void incrementVersion_bumpsLastNumericComponent(String version, String expected) {
        assertThat(MergeEngine.incrementVersion(version)).isEqualTo(expected);
    }

    @Test
    void mergeStrategy_fromString_isCaseInsensitive() {
        assertThat(MergeStrategy.fromString("Union")).isEqualTo(MergeStrategy.UNION);
        assertThat(MergeStrategy.fromString(" theirs ")).isEqualTo(MergeStrategy.THEIRS);
    }

    @Test
    void mergeStrategy_fromString_unknownName_throwsException() {
        assertThatThrownBy(() -> MergeStrategy.fromString("rebase"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown merge strategy: rebase");
    }

    private static Ontology withRelationship(OntologyRelationship relationship) {
        return ontology("Shop", List.of(entity("Customer"), entity("Order")), List.of(relationship), List.of(), Map.of());
    }

    private static OntologyEntity describedCustomer(String description) {
        return new OntologyEntity("Customer", description, "standard", List.of(), List.of());
    }
}
