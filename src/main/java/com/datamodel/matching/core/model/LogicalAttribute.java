package com.datamodel.matching.core.model;

/**
 * Attribute of a logical entity, as supplied by the model-authoring layer.
 *
 * @param id           attribute identity
 * @param name         attribute name
 * @param datatype     declared logical datatype, may be null
 * @param semanticType free-text semantic classification, may be null
 * @param required     whether the attribute is mandatory
 */
public record LogicalAttribute(
        String id,
        String name,
        String datatype,
        String semanticType,
        boolean required
) {
    public LogicalAttribute {
        name = name != null ? name : "";
    }

    /**
     * Creates an attribute with only a name, as found in model drafts.
     */
    public static LogicalAttribute named(String name) {
        return new LogicalAttribute(null, name, null, null, false);
    }
}
