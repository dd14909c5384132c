package com.di.etlcontrol.typemap;

import com.di.etlcontrol.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the columns of one source table to warehouse column definitions and table designs.
 *
 * <p>Every warehouse table is expected to have an {@code id} column usable as primary key. When the
 * source has none, a synthetic one numbered by {@code row_number() OVER()} is put first.
 */
@Slf4j
@RequiredArgsConstructor
public class TableDesignMapper {

    public static final String ID_COLUMN = "id";
    public static final String ID_EXPRESSION = "row_number() OVER()";
    public static final String MISSING_SOURCE_TYPE = "<missing>";
    public static final String DISTSTYLE_EVEN = "even";

    private final TypeResolver typeResolver;

    public List<ColumnDefinition> mapColumns(String tableName, List<SourceColumn> columns) {
        return mapColumns(TableName.parse(tableName), columns);
    }

    /**
     * Resolves every column in source order. Column names are taken as written; they only reach
     * SQL quoted.
     *
     * @throws IllegalArgumentException if there are no columns, an entry is null or a name is invalid
     */
    public List<ColumnDefinition> mapColumns(TableName tableName, List<SourceColumn> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Table " + tableName + " has no columns");
        }
        List<ColumnDefinition> definitions = new ArrayList<>(columns.size() + 1);
        boolean foundId = false;
        int defaulted = 0;
        for (SourceColumn column : columns) {
            if (column == null) {
                throw new IllegalArgumentException("Table " + tableName + " has a null column entry");
            }
            String name = InputValidator.validateColumnName(column.getName());
            if (ID_COLUMN.equals(name)) {
                foundId = true;
            }
            ResolvedMapping mapping = typeResolver.resolve(column.getSourceType(), name);
            if (mapping.isDefaultMapping()) {
                defaulted++;
                log.debug("[TYPE-MAP] {}.{}: no rule for type '{}', using default {}",
                        tableName, name, column.getSourceType(), mapping.getTargetType());
            }
            definitions.add(ColumnDefinition.builder()
                    .name(name)
                    .sourceSqlType(column.getSourceType())
                    .sqlType(mapping.getTargetType())
                    .expression(mapping.isCastNeeded() ? mapping.getCastExpression() : null)
                    .serializationFormat(mapping.getSerializationFormat())
                    .notNull(column.isNotNull())
                    .build());
        }
        if (!foundId) {
            definitions.add(0, ColumnDefinition.builder()
                    .name(ID_COLUMN)
                    .sourceSqlType(MISSING_SOURCE_TYPE)
                    .sqlType("bigint")
                    .expression(ID_EXPRESSION)
                    .serializationFormat(SerializationFormat.LONG)
                    .notNull(true)
                    .build());
        }
        log.info("[TYPE-MAP] Mapped {} column(s) of {} ({} by default rule{})",
                columns.size(), tableName, defaulted, foundId ? "" : ", synthetic id added");
        return definitions;
    }

    /**
     * Table design for a source table. The warehouse table lives in a schema named after the source
     * and is keyed, sorted and evenly distributed by {@code id}.
     *
     * @param sourceName name of the upstream source, e.g. {@code www}
     */
    public TableDesign design(String sourceName, TableName tableName, List<SourceColumn> columns) {
        String source = InputValidator.validateIdentifier(sourceName == null ? null : sourceName.trim(), "Source name");
        List<ColumnDefinition> fields = mapColumns(tableName, columns);
        TableName target = new TableName(source, tableName.getTable());
        return TableDesign.builder()
                .name(target.getIdentifier())
                .sourceName(source + "." + tableName.getIdentifier())
                .fields(fields)
                .tableConstraints(new TableDesign.TableConstraints(List.of(ID_COLUMN)))
                .tableAttributes(new TableDesign.TableAttributes(DISTSTYLE_EVEN, List.of(ID_COLUMN)))
                .build();
    }
}
