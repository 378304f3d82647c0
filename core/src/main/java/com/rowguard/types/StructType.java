package com.rowguard.types;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Row schema of a relation: ordered, named columns.
 *
 * <p>Scan nodes carry one of these and expose each column as an output attribute. The
 * type name is the DDL rendering, so {@code SchemaParser.parse(t.typeName())} gives back
 * an equal schema.
 *
 * @param fields the columns, in order
 */
public record StructType(List<StructField> fields) implements DataType {

    public static final StructType EMPTY = new StructType(List.of());

    public StructType {
        fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
    }

    public StructType(StructField... fields) {
        this(List.of(fields));
    }

    public int size() {
        return fields.size();
    }

    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    /**
     * Looks a column up by its exact name.
     *
     * @param name the column name
     * @return the first column with that name, if any
     */
    public Optional<StructField> field(String name) {
        for (StructField f : fields) {
            if (f.name().equals(name)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    public List<String> fieldNames() {
        return fields.stream().map(StructField::name).collect(Collectors.toList());
    }

    @Override
    public String typeName() {
        return fields.stream()
            .map(StructField::toString)
            .collect(Collectors.joining(",", "struct<", ">"));
    }

    @Override
    public boolean containsMap() {
        for (StructField f : fields) {
            if (f.dataType().containsMap()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
