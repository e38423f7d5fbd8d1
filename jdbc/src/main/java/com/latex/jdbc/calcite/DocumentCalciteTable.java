package com.latex.jdbc.calcite;

import com.latex.jdbc.schema.TableDefinition;
import java.util.List;
import java.util.Objects;
import org.apache.calcite.DataContext;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;

/** Read-only Calcite table over rows materialized from an analysed document. */
final class DocumentCalciteTable extends AbstractTable implements ScannableTable {

    private final TableDefinition definition;
    private final List<Object[]> rows;

    DocumentCalciteTable(TableDefinition definition, List<Object[]> rows) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.rows = List.copyOf(rows);
    }

    @Override
    public RelDataType getRowType(RelDataTypeFactory typeFactory) {
        return CalciteTypeMapper.rowType(typeFactory, definition);
    }

    @Override
    public Enumerable<Object[]> scan(DataContext root) {
        return Linq4j.asEnumerable(rows);
    }
}
