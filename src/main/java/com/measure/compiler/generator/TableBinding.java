package com.measure.compiler.generator;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One warehouse table with its alias and role-to-column map.
 */
public final class TableBinding {
    private final String table;
    private final String alias;
    private final String dataModel;
    private final Map<ColumnRole, String> columns;

    public TableBinding(String table, String alias, String dataModel, Map<ColumnRole, String> columns) {
        this.table = Objects.requireNonNull(table, "table");
        this.alias = Objects.requireNonNull(alias, "alias");
        this.dataModel = dataModel;
        this.columns = columns.isEmpty() ? Map.of() : new EnumMap<>(columns);
    }

    public String getTable() {
        return table;
    }

    public String getAlias() {
        return alias;
    }

    public String getDataModel() {
        return dataModel;
    }

    public boolean hasColumn(ColumnRole role) {
        return columns.containsKey(role);
    }

    /**
     * @throws SchemaBindingException if the role is not bound for this table
     */
    public String column(ColumnRole role) {
        String column = columns.get(role);
        if (column == null) {
            throw new SchemaBindingException("Table " + table + " has no column bound to role " + role);
        }
        return column;
    }

    /**
     * Column reference qualified with this table's alias, e.g. {@code C.effective_date}.
     */
    public String qualified(ColumnRole role) {
        return alias + "." + column(role);
    }
}
