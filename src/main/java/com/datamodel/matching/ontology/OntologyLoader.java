package com.datamodel.matching.ontology;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads an {@link Ontology} from a JSON artifact.
 *
 * <p>Expected format:</p>
 * <pre>
 * {
 *   "entities": {
 *     "beneficiary": {
 *       "synonyms": ["member", "subscriber"],
 *       "preferred_attributes": {"date_of_birth": ["dob"]}
 *     }
 *   },
 *   "semantic_aliases": {"money": ["amount", "paid"]}
 * }
 * </pre>
 *
 * <p>Usage:</p>
 * <pre>
 * Ontology ontology = new OntologyLoader().loadDefault();
 * MeceAnalyzer analyzer = new MeceAnalyzer(ontology);
 * </pre>
 */
public class OntologyLoader {
    private static final Logger log = LoggerFactory.getLogger(OntologyLoader.class);

    public static final String DEFAULT_RESOURCE = "ontology/healthcare-payor.json";

    private final ObjectMapper objectMapper;

    public OntologyLoader() {
        this(new ObjectMapper());
    }

    public OntologyLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the bundled healthcare payor ontology.
     */
    public Ontology loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads an ontology from a classpath resource.
     */
    public Ontology loadResource(String resource) {
        ClassLoader classLoader = OntologyLoader.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new OntologyLoadException("Ontology resource not found: " + resource);
            }
            Ontology ontology = parse(objectMapper.readTree(in), resource);
            log.info("ontology.loaded source={} entities={}", resource, ontology.entities().size());
            return ontology;
        } catch (IOException e) {
            throw new OntologyLoadException("Failed to read ontology resource " + resource, e);
        }
    }

    /**
     * Loads an ontology from a file.
     */
    public Ontology loadFile(Path path) {
        if (!Files.exists(path)) {
            throw new OntologyLoadException("Ontology file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            Ontology ontology = parse(objectMapper.readTree(in), path.toString());
            log.info("ontology.loaded source={} entities={}", path, ontology.entities().size());
            return ontology;
        } catch (IOException e) {
            throw new OntologyLoadException("Failed to read ontology file " + path, e);
        }
    }

    /**
     * Parses an ontology from JSON text.
     */
    public Ontology loadString(String json) {
        try {
            return parse(objectMapper.readTree(json), "<string>");
        } catch (JsonProcessingException e) {
            throw new OntologyLoadException("Ontology JSON is not valid", e);
        }
    }

    private Ontology parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new OntologyLoadException("Ontology document must be a JSON object: " + source);
        }

        List<OntologyEntity> entities = new ArrayList<>();
        JsonNode entitiesNode = root.path("entities");
        Iterator<Map.Entry<String, JsonNode>> fields = entitiesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String canonical = Ontology.normalize(field.getKey());
            if (canonical.isEmpty()) {
                continue;
            }
            JsonNode body = field.getValue();
            Set<String> synonyms = new LinkedHashSet<>(textList(body.path("synonyms")));

            Map<String, List<String>> preferred = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> attrs = body.path("preferred_attributes").fields();
            while (attrs.hasNext()) {
                Map.Entry<String, JsonNode> attr = attrs.next();
                String attrName = attr.getKey().trim();
                if (!attrName.isEmpty()) {
                    preferred.put(attrName, textList(attr.getValue()));
                }
            }
            entities.add(new OntologyEntity(canonical, synonyms, preferred));
        }

        Map<String, List<String>> semanticAliases = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> aliasFields = root.path("semantic_aliases").fields();
        while (aliasFields.hasNext()) {
            Map.Entry<String, JsonNode> alias = aliasFields.next();
            semanticAliases.put(alias.getKey(), textList(alias.getValue()));
        }

        log.debug("Parsed ontology from {}: {} entities, {} alias groups",
                source, entities.size(), semanticAliases.size());
        return new Ontology(entities, semanticAliases);
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            }
        }
        return values;
    }
}
