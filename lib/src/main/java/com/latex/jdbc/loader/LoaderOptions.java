package com.latex.jdbc.loader;

import java.util.Objects;
import java.util.Properties;

/**
 * Immutable knobs for one analysis run. Instances are cheap to copy; every {@code with*} method
 * returns a new instance.
 */
public final class LoaderOptions {

    public static final String MAX_ENVIRONMENT_DEPTH = "maxEnvironmentDepth";
    public static final String DUPLICATE_KEYS = "duplicateKeys";
    public static final String VALIDATE = "validate";

    public static final int DEFAULT_MAX_ENVIRONMENT_DEPTH = 64;

    private static final LoaderOptions DEFAULTS =
            new LoaderOptions(DEFAULT_MAX_ENVIRONMENT_DEPTH, DuplicateKeyPolicy.KEEP_LAST, true);

    private final int maxEnvironmentDepth;
    private final DuplicateKeyPolicy duplicateKeyPolicy;
    private final boolean validate;

    private LoaderOptions(int maxEnvironmentDepth, DuplicateKeyPolicy duplicateKeyPolicy, boolean validate) {
        if (maxEnvironmentDepth < 1) {
            throw new IllegalArgumentException("maxEnvironmentDepth must be >= 1: " + maxEnvironmentDepth);
        }
        this.maxEnvironmentDepth = maxEnvironmentDepth;
        this.duplicateKeyPolicy = Objects.requireNonNull(duplicateKeyPolicy, "duplicateKeyPolicy");
        this.validate = validate;
    }

    public static LoaderOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads options from connection-style properties. Unknown keys are ignored so the same
     * {@link Properties} can carry JDBC and Calcite settings.
     */
    public static LoaderOptions fromProperties(Properties properties) {
        LoaderOptions options = DEFAULTS;
        if (properties == null) {
            return options;
        }
        String depth = properties.getProperty(MAX_ENVIRONMENT_DEPTH);
        if (depth != null && !depth.isBlank()) {
            try {
                options = options.withMaxEnvironmentDepth(Integer.parseInt(depth.trim()));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid " + MAX_ENVIRONMENT_DEPTH + ": " + depth, ex);
            }
        }
        String policy = properties.getProperty(DUPLICATE_KEYS);
        if (policy != null && !policy.isBlank()) {
            options = options.withDuplicateKeyPolicy(DuplicateKeyPolicy.fromName(policy));
        }
        String validate = properties.getProperty(VALIDATE);
        if (validate != null && !validate.isBlank()) {
            options = options.withValidate(Boolean.parseBoolean(validate.trim()));
        }
        return options;
    }

    public int getMaxEnvironmentDepth() {
        return maxEnvironmentDepth;
    }

    public DuplicateKeyPolicy getDuplicateKeyPolicy() {
        return duplicateKeyPolicy;
    }

    public boolean isValidate() {
        return validate;
    }

    public LoaderOptions withMaxEnvironmentDepth(int depth) {
        return new LoaderOptions(depth, duplicateKeyPolicy, validate);
    }

    public LoaderOptions withDuplicateKeyPolicy(DuplicateKeyPolicy policy) {
        return new LoaderOptions(maxEnvironmentDepth, policy, validate);
    }

    public LoaderOptions withValidate(boolean enabled) {
        return new LoaderOptions(maxEnvironmentDepth, duplicateKeyPolicy, enabled);
    }
}
