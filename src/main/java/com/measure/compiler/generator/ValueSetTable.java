package com.measure.compiler.generator;

/**
 * Table that expands value set OIDs to member codes.
 */
public final class ValueSetTable {
    private final String table;
    private final String oidColumn;
    private final String codeColumn;

    public ValueSetTable(String table, String oidColumn, String codeColumn) {
        this.table = table;
        this.oidColumn = oidColumn;
        this.codeColumn = codeColumn;
    }

    public String getTable() {
        return table;
    }

    public String getOidColumn() {
        return oidColumn;
    }

    public String getCodeColumn() {
        return codeColumn;
    }
}
