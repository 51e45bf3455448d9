package org.polyast.core.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Tuning knobs shared by the tree visitors, read from the {@code polyast.visitor} section.
 *
 * <p>Defaults live in {@code reference.conf}; applications override them in their own
 * {@code application.conf} or through {@code -Dpolyast.visitor.<key>=...}.</p>
 *
 * @param visitTokens Whether leaf tokens are dispatched to the token hook.
 * @param traceTodo   Whether each visited escape-hatch ({@code *Todo}) node is logged at DEBUG.
 */
public record VisitorSettings(boolean visitTokens, boolean traceTodo) {

    public static final String CONFIG_PATH = "polyast.visitor";

    public static final VisitorSettings DEFAULTS = new VisitorSettings(true, false);

    /**
     * Loads the settings from the application's default configuration stack.
     *
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public static VisitorSettings load() {
        Config root = ConfigFactory.load();
        return root.hasPath(CONFIG_PATH) ? fromConfig(root.getConfig(CONFIG_PATH)) : DEFAULTS;
    }

    /**
     * Reads the settings from a {@code polyast.visitor} section. Missing keys fall back to
     * {@link #DEFAULTS}.
     *
     * @param options The section, i.e. the config found at {@link #CONFIG_PATH}.
     */
    public static VisitorSettings fromConfig(Config options) {
        boolean visitTokens = options.hasPath("visit-tokens")
            ? options.getBoolean("visit-tokens")
            : DEFAULTS.visitTokens();
        boolean traceTodo = options.hasPath("trace-todo")
            ? options.getBoolean("trace-todo")
            : DEFAULTS.traceTodo();
        return new VisitorSettings(visitTokens, traceTodo);
    }
}
