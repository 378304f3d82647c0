package com.rowguard.types;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads scan schemas.
 *
 * <p>Two notations are accepted:
 * <ul>
 *   <li>DDL, {@code struct<id:bigint,tags:array<string>>} or the bare field list
 *       {@code id:bigint, tags:array<string>}. Every DDL column is nullable.</li>
 *   <li>JSON, {@code {"type":"struct","fields":[{"name":"id","type":"long","nullable":false}]}}</li>
 * </ul>
 *
 * <p>Type keywords are case-insensitive; column names keep their case.
 */
public final class SchemaParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SchemaParser() {}

    /**
     * Parses a schema in either notation.
     *
     * @param schemaStr the schema text
     * @return the schema
     * @throws IllegalArgumentException if the text is blank or malformed
     */
    public static StructType parse(String schemaStr) {
        if (schemaStr == null || schemaStr.isBlank()) {
            throw new IllegalArgumentException("Schema string cannot be null or empty");
        }
        String text = schemaStr.trim();
        if (text.charAt(0) == '{') {
            return fromJson(text);
        }
        DdlReader reader = new DdlReader(text);
        StructType schema = text.toLowerCase(Locale.ROOT).startsWith("struct<")
            ? (StructType) reader.type()
            : reader.fields();
        reader.expectEnd();
        return schema;
    }

    /**
     * Parses one DDL type, e.g. {@code map<string,decimal(10,2)>}.
     *
     * @param typeStr the type text
     * @return the type
     * @throws IllegalArgumentException if the type is unknown or malformed
     */
    public static DataType parseType(String typeStr) {
        DdlReader reader = new DdlReader(typeStr.trim());
        DataType type = reader.type();
        reader.expectEnd();
        return type;
    }

    private static StructType fromJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse JSON schema: " + e.getOriginalMessage(), e);
        }
        return jsonStruct(root);
    }

    private static StructType jsonStruct(JsonNode node) {
        JsonNode fieldsNode = node.path("fields");
        if (!fieldsNode.isArray()) {
            return StructType.EMPTY;
        }
        List<StructField> fields = new ArrayList<>(fieldsNode.size());
        for (JsonNode field : fieldsNode) {
            if (!field.hasNonNull("name")) {
                throw new IllegalArgumentException("JSON schema field without name: " + field);
            }
            fields.add(new StructField(
                field.get("name").asText(),
                jsonType(field.get("type")),
                field.path("nullable").asBoolean(true)));
        }
        return new StructType(fields);
    }

    private static DataType jsonType(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Type node cannot be null");
        }
        if (node.isTextual()) {
            return parseType(node.asText());
        }
        if (!node.isObject() || !node.has("type")) {
            throw new IllegalArgumentException("Unsupported type node: " + node);
        }
        String name = node.get("type").asText().toLowerCase(Locale.ROOT);
        switch (name) {
            case "array":
                return new ArrayType(jsonType(node.get("elementType")), node.path("containsNull").asBoolean(true));
            case "map":
                return new MapType(jsonType(node.get("keyType")), jsonType(node.get("valueType")));
            case "struct":
                return jsonStruct(node);
            default:
                return parseType(name);
        }
    }

    static DataType primitive(String keyword) {
        switch (keyword) {
            case "boolean":
            case "bool":
                return PrimitiveType.BOOLEAN;
            case "byte":
            case "tinyint":
                return PrimitiveType.BYTE;
            case "short":
            case "smallint":
                return PrimitiveType.SHORT;
            case "int":
            case "integer":
                return PrimitiveType.INTEGER;
            case "long":
            case "bigint":
                return PrimitiveType.LONG;
            case "float":
            case "real":
                return PrimitiveType.FLOAT;
            case "double":
                return PrimitiveType.DOUBLE;
            case "string":
            case "varchar":
                return PrimitiveType.STRING;
            case "binary":
                return PrimitiveType.BINARY;
            case "date":
                return PrimitiveType.DATE;
            case "timestamp":
                return PrimitiveType.TIMESTAMP;
            case "null":
            case "void":
                return PrimitiveType.NULL;
            default:
                throw new IllegalArgumentException("Unsupported type: " + keyword);
        }
    }

    /**
     * Cursor over DDL text. Each method consumes what it reads and leaves the cursor on
     * the next non-blank character.
     */
    private static final class DdlReader {

        private final String text;
        private int pos;

        DdlReader(String text) {
            this.text = text;
        }

        DataType type() {
            skipBlanks();
            String keyword = word();
            switch (keyword) {
                case "array": {
                    expect('<');
                    DataType element = type();
                    expect('>');
                    return new ArrayType(element);
                }
                case "map": {
                    expect('<');
                    DataType key = type();
                    if (peek() != ',') {
                        throw new IllegalArgumentException("Invalid map type: " + text);
                    }
                    pos++;
                    DataType value = type();
                    expect('>');
                    return new MapType(key, value);
                }
                case "struct": {
                    expect('<');
                    StructType struct = fields();
                    expect('>');
                    return struct;
                }
                case "decimal":
                    return decimal();
                default:
                    return primitive(keyword);
            }
        }

        /** Reads {@code name:type} pairs up to the end of input or an unmatched {@code >}. */
        StructType fields() {
            List<StructField> fields = new ArrayList<>();
            skipBlanks();
            while (pos < text.length() && peek() != '>') {
                int start = pos;
                while (pos < text.length() && ":,<>".indexOf(text.charAt(pos)) < 0) {
                    pos++;
                }
                String name = text.substring(start, pos).trim();
                if (peek() != ':' || name.isEmpty()) {
                    throw new IllegalArgumentException("Invalid field definition: " + text.substring(start, pos));
                }
                pos++;
                fields.add(new StructField(name, type()));
                if (peek() == ',') {
                    pos++;
                    skipBlanks();
                }
            }
            return fields.isEmpty() ? StructType.EMPTY : new StructType(fields);
        }

        void expectEnd() {
            skipBlanks();
            if (pos != text.length()) {
                throw new IllegalArgumentException("Unexpected input at position " + pos + " in: " + text);
            }
        }

        private DataType decimal() {
            if (peek() != '(') {
                return new DecimalType(10, 0);
            }
            int close = text.indexOf(')', pos);
            if (close < 0) {
                throw new IllegalArgumentException("Invalid decimal type: " + text);
            }
            String[] args = text.substring(pos + 1, close).split(",");
            pos = close + 1;
            skipBlanks();
            try {
                int precision = Integer.parseInt(args[0].trim());
                int scale = args.length > 1 ? Integer.parseInt(args[1].trim()) : 0;
                return new DecimalType(precision, scale);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid decimal type: " + text, e);
            }
        }

        private String word() {
            int start = pos;
            while (pos < text.length()
                && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            if (start == pos) {
                throw new IllegalArgumentException("Expected a type at position " + start + " in: " + text);
            }
            String keyword = text.substring(start, pos).toLowerCase(Locale.ROOT);
            skipBlanks();
            return keyword;
        }

        private void expect(char c) {
            if (peek() != c) {
                throw new IllegalArgumentException(
                    "Expected '" + c + "' at position " + pos + " in: " + text);
            }
            pos++;
            skipBlanks();
        }

        private char peek() {
            return pos < text.length() ? text.charAt(pos) : '\0';
        }

        private void skipBlanks() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }
    }
}
