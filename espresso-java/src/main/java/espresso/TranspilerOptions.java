package espresso;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Knobs of one transpiler run.
 *
 * @param foreignBlockMarker   directive that opens an embedded C++ block, {@code @cpp} by default
 * @param indentationSensitive parse the layout-based dialect (INDENT/DEDENT instead of braces)
 * @param recoverFromErrors    keep parsing after a broken statement and collect the errors
 * @param tabWidth             columns a tab counts for when measuring indentation
 * @param defaultIncludes      include directives every program starts with
 */
public record TranspilerOptions(
        String foreignBlockMarker,
        boolean indentationSensitive,
        boolean recoverFromErrors,
        int tabWidth,
        List<String> defaultIncludes
) {
    public static final String RESOURCE = "espresso.properties";

    public static final String DEFAULT_FOREIGN_MARKER = "@cpp";
    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final String DEFAULT_INCLUDE = "<runtime.hpp>";

    public TranspilerOptions {
        if (foreignBlockMarker == null || foreignBlockMarker.isBlank()) {
            throw new IllegalArgumentException("foreign block marker must not be blank");
        }
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("tab width must be positive: " + tabWidth);
        }
        defaultIncludes = defaultIncludes == null ? List.of() : List.copyOf(defaultIncludes);
    }

    public TranspilerOptions() {
        this(
            DEFAULT_FOREIGN_MARKER,
            false,
            false,
            DEFAULT_TAB_WIDTH,
            List.of(DEFAULT_INCLUDE)
        );
    }

    public TranspilerOptions withForeignBlockMarker(String marker) {
        return new TranspilerOptions(marker, indentationSensitive, recoverFromErrors, tabWidth, defaultIncludes);
    }

    public TranspilerOptions withIndentationSensitive(boolean enabled) {
        return new TranspilerOptions(foreignBlockMarker, enabled, recoverFromErrors, tabWidth, defaultIncludes);
    }

    public TranspilerOptions withRecoverFromErrors(boolean enabled) {
        return new TranspilerOptions(foreignBlockMarker, indentationSensitive, enabled, tabWidth, defaultIncludes);
    }

    public TranspilerOptions withTabWidth(int width) {
        return new TranspilerOptions(foreignBlockMarker, indentationSensitive, recoverFromErrors, width, defaultIncludes);
    }

    public TranspilerOptions withDefaultIncludes(List<String> includes) {
        return new TranspilerOptions(foreignBlockMarker, indentationSensitive, recoverFromErrors, tabWidth, includes);
    }

    /**
     * Reads {@code espresso.*} keys; missing keys keep their defaults.
     * {@code espresso.default-includes} is a comma-separated list, e.g. {@code <runtime.hpp>,<vector>}.
     */
    public static TranspilerOptions fromProperties(Properties props) {
        TranspilerOptions defaults = new TranspilerOptions();

        String marker = props.getProperty("espresso.foreign-marker", defaults.foreignBlockMarker()).trim();
        boolean indentation = Boolean.parseBoolean(
                props.getProperty("espresso.indentation", String.valueOf(defaults.indentationSensitive())).trim());
        boolean recover = Boolean.parseBoolean(
                props.getProperty("espresso.recover", String.valueOf(defaults.recoverFromErrors())).trim());

        String tabText = props.getProperty("espresso.tab-width", String.valueOf(defaults.tabWidth())).trim();
        int tab;
        try {
            tab = Integer.parseInt(tabText);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("espresso.tab-width is not a number: " + tabText, e);
        }

        List<String> includes = defaults.defaultIncludes();
        String includeText = props.getProperty("espresso.default-includes");
        if (includeText != null) {
            includes = new ArrayList<>();
            for (String part : includeText.split(",")) {
                String inc = part.trim();
                if (!inc.isEmpty()) includes.add(inc);
            }
        }

        return new TranspilerOptions(marker, indentation, recover, tab, includes);
    }

    /** Options from {@value #RESOURCE} on the classpath, or the defaults when it is absent. */
    public static TranspilerOptions load() {
        try (InputStream in = TranspilerOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) return new TranspilerOptions();
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }
}
