package com.di.etlcontrol.typemap;

import com.di.etlcontrol.typemap.dto.TableDesignResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exposes type resolution and table selection to the schema preparation step.
 *
 * <ul>
 *   <li>{@code GET /api/type-maps/resolve?type=integer[]&column=tags}: mapping of one column</li>
 *   <li>{@code POST /api/type-maps/tables/{table}?source=www&limit=n}: table design and COPY
 *       statement for a list of source columns</li>
 *   <li>{@code POST /api/type-maps/selection?subset=order*}: which of the posted
 *       {@code schema.table} names are to be extracted</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/type-maps")
@RequiredArgsConstructor
public class TypeMapController {

    private final TypeResolver typeResolver;
    private final TableDesignMapper tableDesignMapper;
    private final TableSelector tableSelector;

    @GetMapping("/resolve")
    public ResolvedMapping resolve(@RequestParam("type") String sourceType,
                                   @RequestParam(value = "column", defaultValue = "column") String column) {
        return typeResolver.resolve(sourceType, column);
    }

    @PostMapping("/tables/{table}")
    public TableDesignResponse designTable(@PathVariable String table,
                                           @RequestParam("source") String source,
                                           @RequestParam(value = "limit", required = false) Integer limit,
                                           @RequestBody List<SourceColumn> columns) {
        TableName tableName = TableName.parse(table);
        TableDesign design = tableDesignMapper.design(source, tableName, columns);
        return TableDesignResponse.builder()
                .tableName(tableName.getIdentifier())
                .tableDesign(design)
                .copyStatement(CopyStatementBuilder.build(tableName, design.getFields(), limit))
                .build();
    }

    @PostMapping("/selection")
    public List<String> selectTables(@RequestParam(value = "subset", required = false) String subset,
                                     @RequestBody List<String> relations) {
        List<TableName> candidates = relations.stream().map(TableName::parse).collect(Collectors.toList());
        return tableSelector.select(candidates, subset).stream()
                .map(TableName::getIdentifier)
                .collect(Collectors.toList());
    }
}
