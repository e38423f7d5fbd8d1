package com.latex.jdbc.calcite;

import com.latex.jdbc.schema.ColumnDescriptor;
import com.latex.jdbc.schema.TableDefinition;
import java.sql.Types;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;

/** Translates table definitions into Calcite row types. */
final class CalciteTypeMapper {

    private CalciteTypeMapper() {}

    static RelDataType rowType(RelDataTypeFactory factory, TableDefinition definition) {
        RelDataTypeFactory.Builder builder = factory.builder();
        for (ColumnDescriptor column : definition.getColumns()) {
            builder.add(column.getName(), columnType(factory, column));
        }
        return builder.build();
    }

    static RelDataType columnType(RelDataTypeFactory factory, ColumnDescriptor column) {
        SqlTypeName sqlType = sqlTypeOf(column.getJdbcType());
        RelDataType type =
                column.getSize() > 0 && sqlType.allowsPrec()
                        ? factory.createSqlType(sqlType, column.getSize())
                        : factory.createSqlType(sqlType);
        return factory.createTypeWithNullability(type, column.isNullable());
    }

    static SqlTypeName sqlTypeOf(int jdbcType) {
        return switch (jdbcType) {
            case Types.INTEGER -> SqlTypeName.INTEGER;
            case Types.BOOLEAN -> SqlTypeName.BOOLEAN;
            case Types.DOUBLE -> SqlTypeName.DOUBLE;
            case Types.VARCHAR -> SqlTypeName.VARCHAR;
            default -> SqlTypeName.ANY;
        };
    }
}
