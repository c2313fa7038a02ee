package eu.virtualparadox.incidentkb.rag.retriever.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrieverSettingsTest {

    @Test
    void testDefaults() {
        assertThat(RetrieverSettings.DEFAULTS.searchType()).isEqualTo(ESearchType.MMR);
        assertThat(RetrieverSettings.DEFAULTS.k()).isEqualTo(8);
        assertThat(RetrieverSettings.DEFAULTS.fetchK()).isEqualTo(16);
        assertThat(RetrieverSettings.DEFAULTS.lambda()).isEqualTo(0.7);
    }

    @Test
    void testInvalidSettingsAreRejected() {
        assertThatThrownBy(() -> new RetrieverSettings(ESearchType.MMR, 0, 16, 0.7, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetrieverSettings(ESearchType.MMR, 8, 4, 0.7, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetrieverSettings(ESearchType.MMR, 8, 16, 1.5, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetrieverSettings(null, 8, 16, 0.7, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
