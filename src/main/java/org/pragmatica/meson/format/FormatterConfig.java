package org.pragmatica.meson.format;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Style options of the {@link ConfigurableFormatter}.
 *
 * @param indentBy   text repeated once per nesting level
 * @param spaceArray whether non-empty array and index brackets get a space inside
 * @param wideColon  whether keyword argument colons are padded on both sides
 */
public record FormatterConfig(String indentBy, boolean spaceArray, boolean wideColon) {
    public static final String INDENT_BY = "indent_by";
    public static final String SPACE_ARRAY = "space_array";
    public static final String WIDE_COLON = "wide_colon";

    public static final FormatterConfig DEFAULT = new FormatterConfig("    ", false, false);

    public FormatterConfig {
        if (indentBy == null || !indentBy.isBlank()) {
            throw new IllegalArgumentException("indent_by must consist of blanks only, got '" + indentBy + "'");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read options from properties. Missing keys keep their default; {@code indent_by} may be
     * quoted so that its blanks survive properties parsing.
     *
     * @throws IllegalArgumentException when a value is malformed
     */
    public static FormatterConfig fromProperties(Properties properties) {
        var builder = builder();
        var indentBy = properties.getProperty(INDENT_BY);
        if (indentBy != null) {
            builder.indentBy(unquote(indentBy));
        }
        var spaceArray = properties.getProperty(SPACE_ARRAY);
        if (spaceArray != null) {
            builder.spaceArray(parseBoolean(SPACE_ARRAY, spaceArray));
        }
        var wideColon = properties.getProperty(WIDE_COLON);
        if (wideColon != null) {
            builder.wideColon(parseBoolean(WIDE_COLON, wideColon));
        }
        return builder.build();
    }

    /**
     * Read options from a properties file.
     */
    public static FormatterConfig load(Path path) throws IOException {
        var properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    private static String unquote(String value) {
        var trimmed = value.strip();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    private static boolean parseBoolean(String key, String value) {
        switch (value.strip()
                     .toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
        }
    }

    public static final class Builder {
        private String indentBy = DEFAULT.indentBy();
        private boolean spaceArray = DEFAULT.spaceArray();
        private boolean wideColon = DEFAULT.wideColon();

        private Builder() {}

        public Builder indentBy(String indentBy) {
            this.indentBy = indentBy;
            return this;
        }

        public Builder spaceArray(boolean spaceArray) {
            this.spaceArray = spaceArray;
            return this;
        }

        public Builder wideColon(boolean wideColon) {
            this.wideColon = wideColon;
            return this;
        }

        public FormatterConfig build() {
            return new FormatterConfig(indentBy, spaceArray, wideColon);
        }
    }
}
