package com.example.delivery.unit.application;

import com.example.delivery.application.service.MarketResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MarketResolver Tests")
class MarketResolverTest {

    private final MarketResolver resolver = new MarketResolver(new String[]{"900:0", "902:0", "9021:4", "921:1"});

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "90001, 0",
            "90210, 4",
            "90299, 0",
            "92101, 1"
    })
    @DisplayName("should_pick_longest_matching_prefix")
    void should_pick_longest_matching_prefix(String zip, int marketId) {
        assertThat(resolver.marketIdFor(zip)).isEqualTo(marketId);
    }

    @Test
    @DisplayName("should_return_null_outside_known_markets")
    void should_return_null_outside_known_markets() {
        assertThat(resolver.marketIdFor("10001")).isNull();
        assertThat(resolver.marketIdFor(null)).isNull();
        assertThat(resolver.marketIdFor(" ")).isNull();
    }

    @Test
    @DisplayName("should_reject_malformed_entry")
    void should_reject_malformed_entry() {
        assertThatThrownBy(() -> new MarketResolver(new String[]{"900"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("900");
    }

    @Test
    @DisplayName("should_resolve_nothing_when_unconfigured")
    void should_resolve_nothing_when_unconfigured() {
        assertThat(new MarketResolver(new String[0]).marketIdFor("90210")).isNull();
    }
}
