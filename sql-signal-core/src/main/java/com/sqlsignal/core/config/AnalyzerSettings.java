package com.sqlsignal.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the process-wide, read-only {@link AnalyzerConfig}.
 *
 * <p>Initialized at most once; the first call to {@link #initialize(AnalyzerConfig)} or
 * {@link #current()} wins and later initializations are ignored. Components receive the config
 * through their constructors, this holder only guards the startup path.
 */
public final class AnalyzerSettings {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerSettings.class);
    private static final AtomicReference<AnalyzerConfig> CURRENT = new AtomicReference<>();

    private AnalyzerSettings() {
        // Utility class
    }

    /**
     * Installs the process-wide configuration if none is installed yet.
     *
     * @param config configuration to install
     * @return the configuration in effect after the call
     */
    public static AnalyzerConfig initialize(AnalyzerConfig config) {
        AnalyzerConfig candidate = config == null ? AnalyzerConfig.defaults() : config;
        if (!CURRENT.compareAndSet(null, candidate)) {
            log.debug("Analyzer settings already initialized; ignoring later configuration");
        }
        return CURRENT.get();
    }

    /**
     * Returns the configuration in effect, installing defaults on first use.
     *
     * @return process-wide configuration
     */
    public static AnalyzerConfig current() {
        AnalyzerConfig config = CURRENT.get();
        return config != null ? config : initialize(AnalyzerConfig.defaults());
    }

    public static boolean isInitialized() {
        return CURRENT.get() != null;
    }
}
