package com.latex.jdbc.schema;

import java.sql.Types;
import java.util.Objects;

public final class ColumnDescriptor {
    private final String name;
    private final int jdbcType;
    private final String typeName;
    private final int size;
    private final boolean nullable;
    private final String className;

    public ColumnDescriptor(
            String name, int jdbcType, String typeName, int size, boolean nullable, String className) {
        this.name = Objects.requireNonNull(name, "name");
        this.jdbcType = jdbcType;
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.size = size;
        this.nullable = nullable;
        this.className = Objects.requireNonNull(className, "className");
    }

    static ColumnDescriptor integer(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.INTEGER, "INTEGER", 10, nullable, Integer.class.getName());
    }

    static ColumnDescriptor varchar(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.VARCHAR, "VARCHAR", 0, nullable, String.class.getName());
    }

    static ColumnDescriptor bool(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.BOOLEAN, "BOOLEAN", 0, nullable, Boolean.class.getName());
    }

    static ColumnDescriptor real(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.DOUBLE, "DOUBLE", 0, nullable, Double.class.getName());
    }

    public String getName() {
        return name;
    }

    public int getJdbcType() {
        return jdbcType;
    }

    public String getTypeName() {
        return typeName;
    }

    public int getSize() {
        return size;
    }

    public boolean isNullable() {
        return nullable;
    }

    public String getClassName() {
        return className;
    }
}
