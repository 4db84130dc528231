package com.datamodel.matching.ontology;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Ontology Tests")
class OntologyLoaderTest {

    private static Ontology ontology;

    @BeforeAll
    static void loadOntology() {
        ontology = new OntologyLoader().loadDefault();
    }

    @Nested
    @DisplayName("Bundled healthcare payor ontology")
    class BundledOntology {

        @Test
        @DisplayName("Should load all canonical entities in declaration order")
        void loadsEntities() {
            List<String> names = ontology.entities().stream().map(OntologyEntity::canonicalName).toList();
            assertEquals(List.of("beneficiary", "provider", "scheme", "claim", "claim_line",
                    "authorization", "remittance"), names);
        }

        @Test
        @DisplayName("Should keep preferred attributes in declaration order")
        void preferredAttributeOrder() {
            OntologyEntity scheme = ontology.entity("scheme").orElseThrow();
            assertEquals(List.of("scheme_id", "scheme_name"), scheme.preferredAttributeNames());
            assertTrue(scheme.synonyms().contains("plan"));
        }

        @Test
        @DisplayName("Should load semantic alias groups")
        void semanticAliases() {
            assertTrue(ontology.semanticAliases().get("id").contains("npi"));
            assertEquals(List.of("ndc"), ontology.semanticAliases().get("drug"));
        }
    }

    @Nested
    @DisplayName("Canonical names")
    class CanonicalNames {

        @Test
        @DisplayName("Should resolve synonyms case-insensitively")
        void resolvesSynonyms() {
            assertEquals("beneficiary", ontology.canonicalEntityName("Member"));
            assertEquals("scheme", ontology.canonicalEntityName("  PLAN "));
            assertEquals("claim", ontology.canonicalEntityName("Claim"));
        }

        @Test
        @DisplayName("Should return unknown names trimmed and lowercased")
        void unknownNames() {
            assertEquals("widget", ontology.canonicalEntityName(" Widget "));
            assertFalse(ontology.isKnownEntity("Widget"));
            assertTrue(ontology.isKnownEntity("subscriber"));
        }

        @Test
        @DisplayName("Should suggest preferred attribute names for synonyms")
        void suggestsPreferredAttribute() {
            assertEquals("date_of_birth", ontology.suggestPreferredAttribute("beneficiary", "DOB").orElseThrow());
            assertEquals("beneficiary_id", ontology.suggestPreferredAttribute("beneficiary", "member_id").orElseThrow());
            assertEquals("gender", ontology.suggestPreferredAttribute("beneficiary", "gender").orElseThrow());
        }

        @Test
        @DisplayName("Should return empty for unknown attributes or entities")
        void noSuggestion() {
            assertTrue(ontology.suggestPreferredAttribute("beneficiary", "favourite_colour").isEmpty());
            assertTrue(ontology.suggestPreferredAttribute("widget", "dob").isEmpty());
            assertTrue(ontology.suggestPreferredAttribute("beneficiary", " ").isEmpty());
        }
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Should parse an ontology from JSON text")
        void loadString() {
            Ontology custom = new OntologyLoader().loadString("""
                    {"entities": {"Vehicle": {"synonyms": ["car"],
                      "preferred_attributes": {"vin": ["chassis_number"]}}}}
                    """);

            assertEquals("vehicle", custom.canonicalEntityName("car"));
            assertEquals("vin", custom.suggestPreferredAttribute("vehicle", "chassis_number").orElseThrow());
            assertTrue(custom.semanticAliases().isEmpty());
        }

        @Test
        @DisplayName("Should load an ontology file")
        void loadFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("ontology.json");
            Files.writeString(file, "{\"entities\": {\"store\": {\"preferred_attributes\": {\"store_id\": []}}}}");

            Ontology custom = new OntologyLoader().loadFile(file);

            assertEquals(1, custom.entities().size());
            assertEquals(List.of("store_id"), custom.entity("store").orElseThrow().preferredAttributeNames());
        }

        @Test
        @DisplayName("Should reject invalid or non-object documents")
        void rejectsInvalidDocuments() {
            OntologyLoader loader = new OntologyLoader();
            assertThrows(OntologyLoadException.class, () -> loader.loadString("{not json"));
            assertThrows(OntologyLoadException.class, () -> loader.loadString("[]"));
        }

        @Test
        @DisplayName("Should fail for missing resources and files")
        void missingSources(@TempDir Path dir) {
            OntologyLoader loader = new OntologyLoader();
            assertThrows(OntologyLoadException.class, () -> loader.loadResource("ontology/missing.json"));
            assertThrows(OntologyLoadException.class, () -> loader.loadFile(dir.resolve("missing.json")));
        }
    }
}
