package org.oldskooler.computedhash.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Options for computed hash processing.
 */
public class ComputedHashOptions {

    /** Classpath resource read by {@link #load()}. */
    public static final String RESOURCE = "computed-hash.properties";

    public static final String WARN_INSECURE = "computedhash.warn-insecure";
    public static final String SUPPRESS_NOOP_ALTERS = "computedhash.suppress-noop-alters";

    private final boolean warnOnInsecureAlgorithms;
    private final boolean suppressNoOpAlters;

    /**
     * Creates options with default settings.
     * Default: warn on legacy algorithms, suppress alters that change nothing.
     */
    public ComputedHashOptions() {
        this(true, true);
    }

    /**
     * @param warnOnInsecureAlgorithms log a warning when a legacy algorithm is declared
     * @param suppressNoOpAlters drop alter operations whose hash definition and column shape are unchanged
     */
    public ComputedHashOptions(boolean warnOnInsecureAlgorithms, boolean suppressNoOpAlters) {
        this.warnOnInsecureAlgorithms = warnOnInsecureAlgorithms;
        this.suppressNoOpAlters = suppressNoOpAlters;
    }

    public boolean isWarnOnInsecureAlgorithms() {
        return warnOnInsecureAlgorithms;
    }

    public boolean isSuppressNoOpAlters() {
        return suppressNoOpAlters;
    }

    /**
     * Reads {@value #RESOURCE} from the context class loader. Missing file or keys fall back to defaults.
     */
    public static ComputedHashOptions load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = ComputedHashOptions.class.getClassLoader();

        Properties props = new Properties();
        try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
        return fromProperties(props);
    }

    public static ComputedHashOptions fromProperties(Properties props) {
        Builder b = builder();
        String warn = props.getProperty(WARN_INSECURE);
        if (warn != null) b.warnOnInsecureAlgorithms(Boolean.parseBoolean(warn.trim()));
        String suppress = props.getProperty(SUPPRESS_NOOP_ALTERS);
        if (suppress != null) b.suppressNoOpAlters(Boolean.parseBoolean(suppress.trim()));
        return b.build();
    }

    /**
     * Creates a builder for constructing ComputedHashOptions.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ComputedHashOptions.
     */
    public static class Builder {
        private boolean warnOnInsecureAlgorithms = true;
        private boolean suppressNoOpAlters = true;

        public Builder warnOnInsecureAlgorithms(boolean warn) {
            this.warnOnInsecureAlgorithms = warn;
            return this;
        }

        public Builder suppressNoOpAlters(boolean suppress) {
            this.suppressNoOpAlters = suppress;
            return this;
        }

        public ComputedHashOptions build() {
            return new ComputedHashOptions(warnOnInsecureAlgorithms, suppressNoOpAlters);
        }
    }
}
