package com.latex.jdbc.calcite;

import com.latex.jdbc.loader.LoaderOptions;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Calcite {@link SchemaFactory} entry point that mounts a LaTeX document from a JSON model. The
 * operand must name the {@code document}; the loader option keys ({@code maxEnvironmentDepth},
 * {@code duplicateKeys}, {@code validate}) are accepted alongside it.
 */
public final class LatexSchemaFactory implements SchemaFactory {

    public static final String DOCUMENT_OPERAND = "document";

    @Override
    public Schema create(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        Objects.requireNonNull(parentSchema, "parentSchema");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operand, "operand");
        return new LatexSchema(resolveDocumentPath(operand), LoaderOptions.fromProperties(toProperties(operand)));
    }

    private static Path resolveDocumentPath(Map<String, Object> operand) {
        Object document = operand.get(DOCUMENT_OPERAND);
        if (document == null) {
            throw new IllegalArgumentException("LaTeX schema operand must include '" + DOCUMENT_OPERAND + "'");
        }
        return Paths.get(document.toString()).toAbsolutePath().normalize();
    }

    private static Properties toProperties(Map<String, Object> operand) {
        Properties properties = new Properties();
        for (Map.Entry<String, Object> entry : operand.entrySet()) {
            if (entry.getValue() != null) {
                properties.setProperty(entry.getKey(), entry.getValue().toString());
            }
        }
        return properties;
    }
}
