package dev.aparikh.searchindexer.indexing;

/**
 * What the index schema reports about one field name.
 *
 * @param name        the field name as declared by the indexer
 * @param dynamic     true when the name is covered by a dynamic field rule such as {@code *_s}
 * @param displayName the part of the name matched by the rule's wildcard ({@code meta_type} for
 *                    {@code meta_type_s}), or the name itself for a declared field
 */
public record FieldMetadata(String name, boolean dynamic, String displayName) {

    public static FieldMetadata declared(String name) {
        return new FieldMetadata(name, false, name);
    }

    public static FieldMetadata dynamic(String name, String displayName) {
        return new FieldMetadata(name, true, displayName);
    }
}
