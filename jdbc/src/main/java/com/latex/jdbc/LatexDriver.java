package com.latex.jdbc;

import com.latex.jdbc.calcite.CalciteConnectionFactory;
import com.latex.jdbc.loader.LoaderException;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderOptions;
import com.latex.jdbc.loader.LoaderResult;
import com.latex.jdbc.source.DocumentProvider;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.util.Arrays;
import java.util.Properties;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.calcite.schema.Schema;

/**
 * JDBC driver that opens Calcite-backed connections over an analysed LaTeX document.
 *
 * <p>URL form: {@code jdbc:latex:<path or file URI>[?key=value&...]}. Query parameters and
 * connection properties configure the loader ({@code maxEnvironmentDepth}, {@code duplicateKeys},
 * {@code validate}) and are otherwise handed to Calcite.</p>
 */
public final class LatexDriver implements Driver {

    static final String URL_PREFIX = "jdbc:latex:";
    static final String PRODUCT_NAME = "LaTeX";
    static final String DOCUMENT_PROPERTY = "document";
    static final String CALCITE_DEBUG_PROPERTY = "latex.jdbc.debugCalcite";
    private static final String METADATA_SCHEMA_NAME = "metadata";
    private static final String SYSTEM_TABLE_JDBC_NAME = Schema.TableType.SYSTEM_TABLE.jdbcName;
    private static final Logger LOGGER = Logger.getLogger(LatexDriver.class.getName());

    static {
        if (Boolean.getBoolean(CALCITE_DEBUG_PROPERTY)) {
            enableCalciteDebugLogging();
        }
        try {
            DriverManager.registerDriver(new LatexDriver());
        } catch (SQLException ex) {
            throw new ExceptionInInitializerError(ex);
        }
    }

    @Override
    public Connection connect(String url, Properties info) throws SQLException {
        if (!acceptsURL(url)) {
            return null;
        }
        ParsedUrl parsed = parseUrl(url);
        Properties properties = new Properties();
        if (info != null) {
            for (String name : info.stringPropertyNames()) {
                properties.setProperty(name, info.getProperty(name));
            }
        }
        properties.putAll(parsed.properties);
        properties.setProperty(DOCUMENT_PROPERTY, parsed.documentPath.toString());

        LoaderOptions options;
        try {
            options = LoaderOptions.fromProperties(properties);
        } catch (IllegalArgumentException ex) {
            throw new SQLException("Invalid connection option: " + ex.getMessage(), ex);
        }
        LoaderResult loaderResult;
        try {
            loaderResult = DocumentProvider.load(parsed.documentPath, options);
        } catch (LoaderException ex) {
            throw new SQLException("Failed to load document: " + parsed.documentPath, ex);
        }
        Connection connection = CalciteConnectionFactory.connect(parsed.documentPath, loaderResult, properties);
        SQLWarning warnings = buildWarningChain(loaderResult, parsed.documentPath);
        logWarnings(loaderResult, parsed.documentPath);
        return wrapCalciteConnection(connection, warnings);
    }

    @Override
    public boolean acceptsURL(String url) {
        return url != null && url.startsWith(URL_PREFIX);
    }

    @Override
    public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) {
        DriverPropertyInfo document = new DriverPropertyInfo(DOCUMENT_PROPERTY, null);
        document.required = true;
        document.description = "Absolute or relative path to the flattened .tex file.";
        DriverPropertyInfo depth =
                new DriverPropertyInfo(
                        LoaderOptions.MAX_ENVIRONMENT_DEPTH,
                        String.valueOf(LoaderOptions.DEFAULT_MAX_ENVIRONMENT_DEPTH));
        depth.description = "Deepest environment nesting accepted before \\begin is ignored.";
        DriverPropertyInfo duplicates = new DriverPropertyInfo(LoaderOptions.DUPLICATE_KEYS, "KEEP_LAST");
        duplicates.description = "How repeated BibTeX keys are handled.";
        duplicates.choices = new String[] {"KEEP_LAST", "KEEP_FIRST", "REJECT"};
        DriverPropertyInfo validate = new DriverPropertyInfo(LoaderOptions.VALIDATE, "true");
        validate.description = "Run the reference and citation validation rules.";
        validate.choices = new String[] {"true", "false"};
        return new DriverPropertyInfo[] {document, depth, duplicates, validate};
    }

    @Override
    public int getMajorVersion() {
        return Version.MAJOR;
    }

    @Override
    public int getMinorVersion() {
        return Version.MINOR;
    }

    @Override
    public boolean jdbcCompliant() {
        return false;
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException("Logging hierarchy not implemented.");
    }

    static ParsedUrl parseUrl(String url) throws SQLException {
        String remainder = url.substring(URL_PREFIX.length());
        if (remainder.isEmpty()) {
            throw new SQLException("Document path missing from JDBC URL.");
        }

        String documentSegment = remainder;
        Properties props = new Properties();
        int paramIndex = remainder.indexOf('?');
        if (paramIndex >= 0) {
            documentSegment = remainder.substring(0, paramIndex);
            String query = remainder.substring(paramIndex + 1);
            for (String pair : query.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = eq >= 0 ? pair.substring(0, eq) : pair;
                String value = eq >= 0 ? pair.substring(eq + 1) : "";
                props.setProperty(
                        URLDecoder.decode(key, StandardCharsets.UTF_8),
                        URLDecoder.decode(value, StandardCharsets.UTF_8));
            }
        }
        if (documentSegment.isEmpty()) {
            throw new SQLException("Document path missing from JDBC URL.");
        }

        Path documentPath;
        if (documentSegment.startsWith("file:")) {
            try {
                documentPath = Paths.get(URI.create(documentSegment));
            } catch (IllegalArgumentException ex) {
                throw new SQLException("Invalid file URI in JDBC URL: " + documentSegment, ex);
            }
        } else {
            documentPath = Paths.get(documentSegment);
        }

        documentPath = documentPath.toAbsolutePath().normalize();

        if (!Files.exists(documentPath)) {
            throw new SQLException("Document file not found: " + documentPath);
        }
        if (!Files.isReadable(documentPath)) {
            throw new SQLException("Document file is not readable: " + documentPath);
        }

        return new ParsedUrl(documentPath, props);
    }

    private Connection wrapCalciteConnection(Connection delegate, SQLWarning warnings) {
        return (Connection)
                Proxy.newProxyInstance(
                        Connection.class.getClassLoader(),
                        new Class<?>[] {Connection.class},
                        new DelegatingHandler(delegate) {
                            private SQLWarning localWarnings = warnings;

                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                return switch (method.getName()) {
                                    case "getMetaData" -> wrapCalciteMetaData(
                                            (DatabaseMetaData) super.handle(proxy, method, args), (Connection) proxy);
                                    case "getWarnings" -> localWarnings;
                                    case "clearWarnings" -> {
                                        localWarnings = null;
                                        yield null;
                                    }
                                    default -> super.handle(proxy, method, args);
                                };
                            }
                        });
    }

    static SQLWarning buildWarningChain(LoaderResult loaderResult, Path documentPath) {
        SQLWarning head = null;
        SQLWarning tail = null;
        for (LoaderMessage message : loaderResult.getMessages()) {
            if (message.getLevel() != LoaderMessage.Level.WARNING) {
                continue;
            }
            SQLWarning warning = new SQLWarning(formatMessage(message, documentPath));
            if (head == null) {
                head = warning;
            } else {
                tail.setNextWarning(warning);
            }
            tail = warning;
        }
        return head;
    }

    private static void logWarnings(LoaderResult loaderResult, Path documentPath) {
        for (LoaderMessage message : loaderResult.getMessages()) {
            if (message.getLevel() != LoaderMessage.Level.WARNING) {
                continue;
            }
            LOGGER.log(Level.WARNING, "{0}", formatMessage(message, documentPath));
        }
    }

    private static String formatMessage(LoaderMessage message, Path documentPath) {
        String file = message.getSourceFilename().isEmpty()
                ? String.valueOf(documentPath.getFileName())
                : message.getSourceFilename();
        return "[LaTeX JDBC] "
                + message.getCategory()
                + ": "
                + message.getMessage()
                + " ("
                + file
                + ":"
                + message.getSourceLineno()
                + ")";
    }

    private DatabaseMetaData wrapCalciteMetaData(DatabaseMetaData delegate, Connection owner) {
        return (DatabaseMetaData)
                Proxy.newProxyInstance(
                        DatabaseMetaData.class.getClassLoader(),
                        new Class<?>[] {DatabaseMetaData.class},
                        new DelegatingHandler(delegate) {
                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                return switch (method.getName()) {
                                    case "getDatabaseProductName" -> PRODUCT_NAME;
                                    case "getDatabaseProductVersion", "getDriverVersion" -> Version.RUNTIME;
                                    case "getDriverName" -> "LaTeX JDBC Driver (Calcite)";
                                    case "getDriverMajorVersion" -> Version.MAJOR;
                                    case "getDriverMinorVersion" -> Version.MINOR;
                                    case "getConnection" -> owner;
                                    case "getTables" -> invokeDelegate(delegate, method, adjustMetadataTableArgs(args));
                                    default -> super.handle(proxy, method, args);
                                };
                            }
                        });
    }

    private static Object invokeDelegate(Object delegate, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(delegate, args);
        } catch (InvocationTargetException ex) {
            throw ex.getCause();
        }
    }

    record ParsedUrl(Path documentPath, Properties properties) {}

    private abstract static class DelegatingHandler implements InvocationHandler {
        private final Object delegate;

        DelegatingHandler(Object delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (method.getDeclaringClass() == Object.class) {
                return invokeDelegate(delegate, method, args);
            }
            return handle(proxy, method, args);
        }

        Object handle(Object proxy, Method method, Object[] args) throws Throwable {
            return invokeDelegate(delegate, method, args);
        }
    }

    private static Object[] adjustMetadataTableArgs(Object[] args) {
        if (args == null || args.length < 4) {
            return args;
        }
        if (!metadataSchemaRequested(args[1])) {
            return args;
        }
        String[] requestedTypes = (String[]) args[3];
        if (requestedTypes == null) {
            return args;
        }
        for (String type : requestedTypes) {
            if (type != null && SYSTEM_TABLE_JDBC_NAME.equalsIgnoreCase(type.trim())) {
                return args;
            }
        }
        String[] augmented = Arrays.copyOf(requestedTypes, requestedTypes.length + 1);
        augmented[requestedTypes.length] = SYSTEM_TABLE_JDBC_NAME;
        Object[] adjusted = args.clone();
        adjusted[3] = augmented;
        return adjusted;
    }

    private static boolean metadataSchemaRequested(Object schemaPattern) {
        if (schemaPattern == null) {
            return true;
        }
        if (!(schemaPattern instanceof String pattern)) {
            return false;
        }
        String normalized = pattern.trim();
        if (normalized.isEmpty() || "%".equals(normalized)) {
            return true;
        }
        if (normalized.startsWith("\"") && normalized.endsWith("\"") && normalized.length() > 1) {
            normalized = normalized.substring(1, normalized.length() - 1);
        }
        return METADATA_SCHEMA_NAME.equalsIgnoreCase(normalized);
    }

    private static void enableCalciteDebugLogging() {
        Logger calciteLogger = Logger.getLogger("org.apache.calcite");
        calciteLogger.setLevel(Level.FINE);
        for (Handler handler : calciteLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler console) {
                console.setLevel(Level.FINE);
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        calciteLogger.addHandler(handler);
    }
}
