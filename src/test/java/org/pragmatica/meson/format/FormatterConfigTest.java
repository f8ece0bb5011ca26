package org.pragmatica.meson.format;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatterConfigTest {

    @Test
    void default_usesFourSpacesAndTightSpacing() {
        assertThat(FormatterConfig.DEFAULT.indentBy()).isEqualTo("    ");
        assertThat(FormatterConfig.DEFAULT.spaceArray()).isFalse();
        assertThat(FormatterConfig.DEFAULT.wideColon()).isFalse();
        assertThat(FormatterConfig.builder()
                                  .build()).isEqualTo(FormatterConfig.DEFAULT);
    }

    @Test
    void fromProperties_emptyProperties_givesDefault() {
        assertThat(FormatterConfig.fromProperties(new Properties())).isEqualTo(FormatterConfig.DEFAULT);
    }

    @Test
    void fromProperties_readsAllKeys() {
        var properties = new Properties();
        properties.setProperty("indent_by", "\"\t\"");
        properties.setProperty("space_array", "TRUE");
        properties.setProperty("wide_colon", " true ");

        var config = FormatterConfig.fromProperties(properties);

        assertThat(config).isEqualTo(new FormatterConfig("\t", true, true));
    }

    @Test
    void fromProperties_malformedBoolean_isRejected() {
        var properties = new Properties();
        properties.setProperty("space_array", "yes");

        assertThatThrownBy(() -> FormatterConfig.fromProperties(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("space_array");
    }

    @Test
    void constructor_nonBlankIndent_isRejected() {
        assertThatThrownBy(() -> new FormatterConfig("--", false, false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void load_readsPropertiesFile() throws IOException, URISyntaxException {
        var path = Path.of(getClass().getResource("/formatter/meson-format.properties")
                                     .toURI());

        var config = FormatterConfig.load(path);

        assertThat(config).isEqualTo(new FormatterConfig("  ", true, false));
    }

    @Test
    void load_missingFile_propagatesIoException(@TempDir Path dir) {
        assertThatThrownBy(() -> FormatterConfig.load(dir.resolve("absent.properties")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void load_unquotedIndent_losesLeadingBlanks(@TempDir Path dir) throws IOException {
        var file = dir.resolve("meson-format.properties");
        Files.writeString(file, "indent_by=\t\nwide_colon=true\n");

        var config = FormatterConfig.load(file);

        assertThat(config.indentBy()).isEmpty();
        assertThat(config.wideColon()).isTrue();
    }
}
