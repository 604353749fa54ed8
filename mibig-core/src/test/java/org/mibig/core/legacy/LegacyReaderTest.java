package org.mibig.core.legacy;

import org.mibig.core.error.LegacyFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LegacyReader}.
 */
class LegacyReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void read_fixtureFile_decodesClusterAndChangelog() throws URISyntaxException {
        Path file = Path.of(getClass().getResource("/legacy/BGC0000055.json").toURI());

        LegacyEntry entry = LegacyReader.read(file);

        LegacyCluster cluster = entry.cluster();
        assertThat(cluster.accession()).isEqualTo("BGC0000055");
        assertThat(cluster.biosyntheticClasses()).containsExactly("Polyketide");
        assertThat(cluster.status()).isEqualTo("active");
        assertThat(cluster.loci().completeness()).isEqualTo("complete");
        assertThat(cluster.polyketide().synthases()).singleElement()
            .satisfies(synthase -> assertThat(synthase.modules()).hasSize(1));
        assertThat(entry.changelog()).hasSize(2);
        assertThat(entry.changelog().get(1).hasTimestamps()).isTrue();
    }

    @Test
    void read_singleStringWhereListExpected_acceptsIt() {
        LegacyEntry entry = LegacyReader.read("""
            {
              "cluster": {
                "biosyn_class": "Other",
                "mibig_accession": "BGC0000002",
                "loci": {"accession": "X1.1", "completeness": "complete"}
              },
              "changelog": [
                {"version": "2.0", "comments": "Submitted", "contributors": "AAAAAAAAAAAAAAAAAAAAAAAA"}
              ]
            }
            """);

        assertThat(entry.cluster().biosyntheticClasses()).containsExactly("Other");
        assertThat(entry.changelog().get(0).comments()).containsExactly("Submitted");
        assertThat(entry.changelog().get(0).hasTimestamps()).isFalse();
    }

    @Test
    void read_unknownClass_throws() {
        assertThatThrownBy(() -> LegacyReader.read("""
            {"cluster": {"biosyn_class": ["Lipid"], "mibig_accession": "BGC0000002"}, "changelog": []}
            """))
            .isInstanceOf(LegacyFormatException.class)
            .hasMessageContaining("Unknown biosynthetic class 'Lipid'");
    }

    @Test
    void read_invalidAccession_throws() {
        assertThatThrownBy(() -> LegacyReader.read("""
            {"cluster": {"biosyn_class": ["NRP"], "mibig_accession": "BGC12"}, "changelog": []}
            """))
            .isInstanceOf(LegacyFormatException.class)
            .hasMessageContaining("Invalid accession 'BGC12'");
    }

    @Test
    void read_missingChangelog_throws() {
        assertThatThrownBy(() -> LegacyReader.read("""
            {"cluster": {"biosyn_class": ["NRP"], "mibig_accession": "BGC0000002"}}
            """))
            .isInstanceOf(LegacyFormatException.class)
            .hasMessageContaining("changelog");
    }

    @Test
    void read_malformedJson_throws() {
        assertThatThrownBy(() -> LegacyReader.read("{\"cluster\": "))
            .isInstanceOf(LegacyFormatException.class)
            .hasMessageContaining("Malformed legacy entry");
    }

    @Test
    void read_missingFile_throws() {
        Path missing = tempDir.resolve("BGC9999999.json");

        assertThatThrownBy(() -> LegacyReader.read(missing))
            .isInstanceOf(LegacyFormatException.class)
            .hasMessageContaining("Cannot read legacy entry");
    }
}
