package com.measure.compiler.generator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Maps each data family to a warehouse table so SQL generation never hard-codes table or column names.
 */
public final class SchemaBinding {
    private static final Logger logger = LoggerFactory.getLogger(SchemaBinding.class);

    public static final String DEFAULT_RESOURCE = "/schema/hdi-schema-binding.json";

    private final Map<DataFamily, TableBinding> tables;
    private final ValueSetTable valueSetTable;

    public SchemaBinding(Map<DataFamily, TableBinding> tables, ValueSetTable valueSetTable) {
        this.tables = new EnumMap<>(tables);
        this.valueSetTable = valueSetTable;
    }

    /**
     * Load the bundled HDI binding from the classpath.
     */
    public static SchemaBinding loadDefault() {
        try (InputStream in = SchemaBinding.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new SchemaBindingException("Schema binding resource not found: " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new SchemaBindingException("Failed to read schema binding " + DEFAULT_RESOURCE, e);
        }
    }

    public static SchemaBinding load(InputStream in) {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(in);
        } catch (IOException e) {
            throw new SchemaBindingException("Schema binding is not valid JSON", e);
        }
        if (root == null || !root.hasNonNull("tables") || !root.hasNonNull("valueSetTable")) {
            throw new SchemaBindingException("Schema binding requires 'tables' and 'valueSetTable'");
        }

        JsonNode vs = root.get("valueSetTable");
        ValueSetTable valueSetTable = new ValueSetTable(
                required(vs, "table"), required(vs, "oidColumn"), required(vs, "codeColumn"));

        Map<DataFamily, TableBinding> tables = new EnumMap<>(DataFamily.class);
        Iterator<Map.Entry<String, JsonNode>> fields = root.get("tables").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            DataFamily family;
            try {
                family = DataFamily.valueOf(entry.getKey().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new SchemaBindingException("Unknown data family in schema binding: " + entry.getKey(), e);
            }
            tables.put(family, readTable(entry.getValue()));
        }
        logger.debug("Loaded schema binding with {} tables", tables.size());
        return new SchemaBinding(tables, valueSetTable);
    }

    private static TableBinding readTable(JsonNode node) {
        Map<ColumnRole, String> columns = new EnumMap<>(ColumnRole.class);
        JsonNode columnsNode = node.path("columns");
        Iterator<Map.Entry<String, JsonNode>> fields = columnsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> column = fields.next();
            try {
                columns.put(ColumnRole.valueOf(column.getKey().toUpperCase(Locale.ROOT)), column.getValue().asText());
            } catch (IllegalArgumentException e) {
                throw new SchemaBindingException("Unknown column role: " + column.getKey(), e);
            }
        }
        return new TableBinding(required(node, "table"), required(node, "alias"),
                node.path("dataModel").asText(null), columns);
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.asText().isBlank()) {
            throw new SchemaBindingException("Schema binding is missing '" + field + "'");
        }
        return value.asText();
    }

    /**
     * @throws SchemaBindingException if the family has no bound table
     */
    public TableBinding table(DataFamily family) {
        TableBinding table = tables.get(family);
        if (table == null) {
            throw new SchemaBindingException("No table bound for data family " + family);
        }
        return table;
    }

    public ValueSetTable getValueSetTable() {
        return valueSetTable;
    }
}
