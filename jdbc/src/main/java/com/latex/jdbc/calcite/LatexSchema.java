package com.latex.jdbc.calcite;

import com.latex.jdbc.document.LatexDocument;
import com.latex.jdbc.loader.LoaderException;
import com.latex.jdbc.loader.LoaderOptions;
import com.latex.jdbc.loader.LoaderResult;
import com.latex.jdbc.schema.BibAuthorsTable;
import com.latex.jdbc.schema.BibEntriesTable;
import com.latex.jdbc.schema.CitationsTable;
import com.latex.jdbc.schema.CommandsTable;
import com.latex.jdbc.schema.DiagnosticsTable;
import com.latex.jdbc.schema.EnvironmentsTable;
import com.latex.jdbc.schema.FloatsTable;
import com.latex.jdbc.schema.LabelsTable;
import com.latex.jdbc.schema.MathTable;
import com.latex.jdbc.schema.ReferencesTable;
import com.latex.jdbc.schema.SectionsTable;
import com.latex.jdbc.schema.TableDefinition;
import com.latex.jdbc.schema.TokensTable;
import com.latex.jdbc.source.DocumentProvider;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

/**
 * Calcite schema exposing one analysed LaTeX document as read-only tables. The document is loaded
 * on first table access unless a pre-loaded result is supplied.
 */
public final class LatexSchema extends AbstractSchema {

    private final Path documentPath;
    private final LoaderOptions options;
    private volatile LoaderResult loaderResult;
    private volatile Map<String, Table> tables;

    LatexSchema(Path documentPath, LoaderOptions options) {
        this.documentPath = Objects.requireNonNull(documentPath, "documentPath");
        this.options = Objects.requireNonNull(options, "options");
    }

    LatexSchema(Path documentPath, LoaderResult loaderResult) {
        this(documentPath, LoaderOptions.defaults());
        this.loaderResult = Objects.requireNonNull(loaderResult, "loaderResult");
    }

    @Override
    protected Map<String, Table> getTableMap() {
        Map<String, Table> local = tables;
        if (local == null) {
            synchronized (this) {
                local = tables;
                if (local == null) {
                    local = buildTables(loadDocument());
                    tables = local;
                }
            }
        }
        return local;
    }

    private LoaderResult loadDocument() {
        LoaderResult current = loaderResult;
        if (current == null) {
            try {
                current = DocumentProvider.load(documentPath, options);
            } catch (LoaderException ex) {
                throw new IllegalStateException("Failed to load document: " + documentPath, ex);
            }
            loaderResult = current;
        }
        return current;
    }

    private static Map<String, Table> buildTables(LoaderResult result) {
        LatexDocument document = result.getDocument();
        Set<String> citedKeys = new HashSet<>();
        document.getCitations().forEach(citation -> citedKeys.addAll(citation.getKeys()));

        Map<String, Table> map = new LinkedHashMap<>();
        put(map, TokensTable.getDefinition(), TokensTable.materializeRows(document.getTokens()));
        put(map, CommandsTable.getDefinition(), CommandsTable.materializeRows(document.getCommands()));
        put(map, EnvironmentsTable.getDefinition(), EnvironmentsTable.materializeRows(document.getEnvironments()));
        put(map, SectionsTable.getDefinition(), SectionsTable.materializeRows(document.getSections()));
        put(map, MathTable.getDefinition(), MathTable.materializeRows(document.getEquations()));
        put(
                map,
                CitationsTable.getDefinition(),
                CitationsTable.materializeRows(document.getCitations(), document.getBibliography()));
        put(
                map,
                BibEntriesTable.getDefinition(),
                BibEntriesTable.materializeRows(document.getBibliography().values(), citedKeys));
        put(map, BibAuthorsTable.getDefinition(), BibAuthorsTable.materializeRows(document.getBibliography().values()));
        put(map, LabelsTable.getDefinition(), LabelsTable.materializeRows(document.getCrossReferences()));
        put(map, ReferencesTable.getDefinition(), ReferencesTable.materializeRows(document.getCrossReferences()));
        put(map, FloatsTable.getDefinition(), FloatsTable.materializeRows(document.getFloats()));
        put(map, DiagnosticsTable.getDefinition(), DiagnosticsTable.materializeRows(result.getMessages()));
        return Map.copyOf(map);
    }

    private static void put(Map<String, Table> map, TableDefinition definition, List<Object[]> rows) {
        map.put(definition.getName(), new DocumentCalciteTable(definition, rows));
    }
}
