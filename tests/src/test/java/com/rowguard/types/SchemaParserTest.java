package com.rowguard.types;

import com.rowguard.test.TestBase;
import com.rowguard.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaParser.
 *
 * <p>Covers both the DDL form {@code struct<name:type,...>} and the JSON schema form.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("SchemaParser Tests")
public class SchemaParserTest extends TestBase {

    @Nested
    @DisplayName("DDL Struct Parsing")
    class DdlStructParsing {

        @Test
        @DisplayName("Parse simple struct with two fields")
        void testParseSimpleStruct() {
            StructType schema = SchemaParser.parse("struct<id:int,name:string>");

            assertThat(schema.size()).isEqualTo(2);
            assertThat(schema.fieldAt(0).name()).isEqualTo("id");
            assertThat(schema.fieldAt(0).dataType()).isEqualTo(PrimitiveType.INTEGER);
            assertThat(schema.fieldAt(1).name()).isEqualTo("name");
            assertThat(schema.fieldAt(1).dataType()).isEqualTo(PrimitiveType.STRING);
        }

        @Test
        @DisplayName("Parse empty struct")
        void testParseEmptyStruct() {
            assertThat(SchemaParser.parse("struct<>")).isEqualTo(StructType.EMPTY);
        }

        @Test
        @DisplayName("Parse field list without struct wrapper")
        void testParseBareFieldList() {
            StructType schema = SchemaParser.parse("a:bigint, b:double");

            assertThat(schema.size()).isEqualTo(2);
            assertThat(schema.field("a").orElseThrow().dataType()).isEqualTo(PrimitiveType.LONG);
            assertThat(schema.field("b").orElseThrow().dataType()).isEqualTo(PrimitiveType.DOUBLE);
        }

        @Test
        @DisplayName("DDL fields are nullable")
        void testDdlFieldsNullable() {
            StructType schema = SchemaParser.parse("struct<id:int>");

            assertThat(schema.fieldAt(0).nullable()).isTrue();
        }

        @Test
        @DisplayName("Nested array, map and struct types")
        void testParseNestedTypes() {
            StructType schema = SchemaParser.parse(
                "struct<tags:array<string>,attrs:map<string,array<int>>,point:struct<x:double,y:double>>");

            assertThat(schema.fieldAt(0).dataType()).isEqualTo(new ArrayType(PrimitiveType.STRING));
            assertThat(schema.fieldAt(1).dataType())
                .isEqualTo(new MapType(PrimitiveType.STRING, new ArrayType(PrimitiveType.INTEGER)));
            assertThat(schema.fieldAt(2).dataType()).isInstanceOf(StructType.class);
            StructType point = (StructType) schema.fieldAt(2).dataType();
            assertThat(point.field("y").orElseThrow().dataType()).isEqualTo(PrimitiveType.DOUBLE);
        }

        @Test
        @DisplayName("Type name renders the DDL form and parses back")
        void testTypeNameRoundTrip() {
            StructType schema = SchemaParser.parse("struct<id:bigint,attrs:map<string,decimal(10,2)>>");

            assertThat(schema.typeName()).isEqualTo("struct<id:long,attrs:map<string,decimal(10,2)>>");
            assertThat(SchemaParser.parse(schema.typeName())).isEqualTo(schema);
            assertThat(schema.fieldNames()).containsExactly("id", "attrs");
            assertThat(schema.field("missing")).isEmpty();
        }

        @Test
        @DisplayName("Trailing input after the struct is rejected")
        void testTrailingInput() {
            assertThatThrownBy(() -> SchemaParser.parse("struct<id:int> extra"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unexpected input");
        }

        @Test
        @DisplayName("containsMap looks through nested types")
        void testContainsMap() {
            assertThat(SchemaParser.parse("struct<a:array<map<string,int>>>").containsMap()).isTrue();
            assertThat(SchemaParser.parse("struct<a:array<int>>").containsMap()).isFalse();
        }
    }

    @Nested
    @DisplayName("Type Names")
    class TypeNames {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "boolean, BOOLEAN",
            "tinyint, BYTE",
            "smallint, SHORT",
            "int, INTEGER",
            "integer, INTEGER",
            "bigint, LONG",
            "long, LONG",
            "float, FLOAT",
            "double, DOUBLE",
            "string, STRING",
            "varchar, STRING",
            "binary, BINARY",
            "date, DATE",
            "timestamp, TIMESTAMP",
            "void, NULL"
        })
        @DisplayName("Primitive type aliases")
        void testPrimitiveAliases(String typeName, PrimitiveType expected) {
            assertThat(SchemaParser.parseType(typeName)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Type names are case-insensitive")
        void testCaseInsensitive() {
            assertThat(SchemaParser.parseType("BIGINT")).isEqualTo(PrimitiveType.LONG);
            assertThat(SchemaParser.parseType("Array<Int>")).isEqualTo(new ArrayType(PrimitiveType.INTEGER));
        }

        @Test
        @DisplayName("Decimal with precision and scale")
        void testDecimal() {
            assertThat(SchemaParser.parseType("decimal(18,4)")).isEqualTo(new DecimalType(18, 4));
            assertThat(SchemaParser.parseType("decimal")).isEqualTo(new DecimalType(10, 0));
        }

        @Test
        @DisplayName("Decimal inside a map splits at the top-level comma only")
        void testDecimalInsideMap() {
            assertThat(SchemaParser.parseType("map<string,decimal(10,2)>"))
                .isEqualTo(new MapType(PrimitiveType.STRING, new DecimalType(10, 2)));
        }
    }

    @Nested
    @DisplayName("JSON Schema Parsing")
    class JsonSchemaParsing {

        @Test
        @DisplayName("Parse JSON schema with nullability")
        void testParseJson() {
            StructType schema = SchemaParser.parse(
                "{\"type\":\"struct\",\"fields\":["
                    + "{\"name\":\"id\",\"type\":\"long\",\"nullable\":false},"
                    + "{\"name\":\"tags\",\"type\":{\"type\":\"array\",\"elementType\":\"string\",\"containsNull\":false}},"
                    + "{\"name\":\"m\",\"type\":{\"type\":\"map\",\"keyType\":\"string\",\"valueType\":\"integer\"}}"
                    + "]}");

            assertThat(schema.size()).isEqualTo(3);
            assertThat(schema.fieldAt(0)).isEqualTo(new StructField("id", PrimitiveType.LONG, false));
            assertThat(schema.fieldAt(1).dataType()).isEqualTo(new ArrayType(PrimitiveType.STRING, false));
            assertThat(schema.fieldAt(1).nullable()).isTrue();
            assertThat(schema.fieldAt(2).dataType())
                .isEqualTo(new MapType(PrimitiveType.STRING, PrimitiveType.INTEGER));
        }

        @Test
        @DisplayName("JSON schema without fields is empty")
        void testJsonWithoutFields() {
            assertThat(SchemaParser.parse("{\"type\":\"struct\"}")).isEqualTo(StructType.EMPTY);
        }

        @Test
        @DisplayName("Malformed JSON is rejected")
        void testMalformedJson() {
            assertThatThrownBy(() -> SchemaParser.parse("{\"type\":"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to parse JSON schema");
        }
    }

    @Nested
    @DisplayName("Error Handling")
    class ErrorHandling {

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Blank schema is rejected")
        void testBlankSchema(String schema) {
            assertThatThrownBy(() -> SchemaParser.parse(schema))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Unknown type is rejected")
        void testUnknownType() {
            assertThatThrownBy(() -> SchemaParser.parse("struct<a:uuid>"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("uuid");
        }

        @Test
        @DisplayName("Field without type is rejected")
        void testFieldWithoutType() {
            assertThatThrownBy(() -> SchemaParser.parse("struct<a>"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid field definition");
        }

        @Test
        @DisplayName("Decimal scale beyond precision is rejected")
        void testInvalidDecimal() {
            assertThatThrownBy(() -> SchemaParser.parseType("decimal(4,6)"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
