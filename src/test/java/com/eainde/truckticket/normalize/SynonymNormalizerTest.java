package com.eainde.truckticket.normalize;

import com.eainde.truckticket.PipelineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SynonymNormalizerTest {

    private static final SynonymNormalizer SHIPPED = SynonymNormalizer.load(PipelineFixture.resource("/synonyms.yml"));

    @Nested
    @DisplayName("shipped table")
    class Shipped {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "Non Contaminated,       NON_CONTAMINATED",
                "'  class   ii ',        CLASS_2_CONTAMINATED",
                "non_contaminated,       NON_CONTAMINATED",
                "Select Fill Dirt,       IMPORT",
                "Contaminated Soil,      CLASS_2_CONTAMINATED"
        })
        void materials(String raw, String expected) {
            assertThat(SHIPPED.normalize(raw, SynonymCategory.MATERIAL)).isEqualTo(expected);
            assertThat(SHIPPED.isMapped(raw, SynonymCategory.MATERIAL)).isTrue();
        }

        @Test
        @DisplayName("categories are looked up independently")
        void perCategory() {
            assertThat(SHIPPED.normalize("South Parking Garage", SynonymCategory.SOURCE)).isEqualTo("SPG");
            assertThat(SHIPPED.normalize("South Parking Garage", SynonymCategory.DESTINATION)).isEqualTo("South Parking Garage");
            assertThat(SHIPPED.isMapped("SPG", SynonymCategory.DESTINATION)).isFalse();
        }

        @Test
        @DisplayName("normalizing twice equals normalizing once")
        void idempotent() {
            List<String> samples = List.of("WM Lewisville", "ldi", "Post Oak Pit #2", "JD & SON", "Class 2",
                    "clean fill", "Unobtainium", "BLDG A", "north parking garage", "");
            for (SynonymCategory category : SynonymCategory.values()) {
                for (String sample : samples) {
                    String once = SHIPPED.normalize(sample, category);
                    assertThat(SHIPPED.normalize(once, category)).as("%s in %s", sample, category).isEqualTo(once);
                }
            }
        }
    }

    @Test
    @DisplayName("the longest contained term wins")
    void longestTerm() {
        SynonymNormalizer normalizer = new SynonymNormalizer(Map.of(SynonymCategory.MATERIAL,
                Map.of("FILL", "GENERIC_FILL", "CLEAN FILL", "NON_CONTAMINATED")));

        assertThat(normalizer.normalize("Clean Fill Dirt", SynonymCategory.MATERIAL)).isEqualTo("NON_CONTAMINATED");
        assertThat(normalizer.normalize("Road fill", SynonymCategory.MATERIAL)).isEqualTo("GENERIC_FILL");
    }

    @Test
    @DisplayName("unknown, blank and null values pass through")
    void passThrough() {
        assertThat(SHIPPED.normalize("Unobtainium", SynonymCategory.MATERIAL)).isEqualTo("Unobtainium");
        assertThat(SHIPPED.isMapped("Unobtainium", SynonymCategory.MATERIAL)).isFalse();
        assertThat(SHIPPED.normalize("   ", SynonymCategory.VENDOR)).isEqualTo("   ");
        assertThat(SHIPPED.normalize(null, SynonymCategory.VENDOR)).isNull();
        assertThat(SHIPPED.isMapped(null, SynonymCategory.VENDOR)).isFalse();
        assertThat(SynonymNormalizer.empty().normalize("LDI", SynonymCategory.VENDOR)).isEqualTo("LDI");
    }

    @Test
    @DisplayName("section names accept singular and plural forms")
    void sections() {
        assertThat(SynonymCategory.fromSection("vendors")).isEqualTo(SynonymCategory.VENDOR);
        assertThat(SynonymCategory.fromSection(" MATERIAL ")).isEqualTo(SynonymCategory.MATERIAL);
        assertThatThrownBy(() -> SynonymCategory.fromSection("trucks")).isInstanceOf(IllegalArgumentException.class);
    }
}
