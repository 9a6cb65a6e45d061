package com.ledgersync.unit.instrument;

import static org.assertj.core.api.Assertions.assertThat;

import com.ledgersync.domain.enums.InstrumentType;
import com.ledgersync.instrument.SymbolClassifier;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SymbolClassifierTest {

    @Nested
    @DisplayName("Options")
    class Options {

        @ParameterizedTest
        @ValueSource(strings = {"AAPL240119C00150000", "SPY   240119P00400000", ".SPY240119P00400000", "brk.b250620c00400000"})
        @DisplayName("OCC symbols are recognised as options")
        void occSymbolsAreOptions(String symbol) {
            assertThat(SymbolClassifier.isOption(symbol)).isTrue();
            assertThat(SymbolClassifier.classify(symbol)).isEqualTo(InstrumentType.OPTION);
        }

        @Test
        @DisplayName("Underlying of an option is its root symbol")
        void extractsRoot() {
            assertThat(SymbolClassifier.extractUnderlying("AAPL240119C00150000")).isEqualTo("AAPL");
            assertThat(SymbolClassifier.extractUnderlying("SPY   240119P00400000")).isEqualTo("SPY");
        }

        @Test
        @DisplayName("Options are valued with the 100 multiplier")
        void optionMultiplier() {
            assertThat(SymbolClassifier.valueMultiplier("AAPL240119C00150000")).isEqualByComparingTo("100");
        }
    }

    @Nested
    @DisplayName("Futures")
    class Futures {

        @Test
        @DisplayName("Slash-prefixed symbols are futures with their root's contract size")
        void knownRoots() {
            assertThat(SymbolClassifier.isFuturesSymbol("/ESZ4")).isTrue();
            assertThat(SymbolClassifier.contractSize("/ESZ4")).isEqualTo(50);
            assertThat(SymbolClassifier.contractSize("/MESH25")).isEqualTo(5);
            assertThat(SymbolClassifier.contractSize("/CLF5")).isEqualTo(1000);
        }

        @Test
        @DisplayName("Unknown roots fall back to a contract size of 1")
        void unknownRoot() {
            assertThat(SymbolClassifier.isFuturesSymbol("/QQQZ4")).isTrue();
            assertThat(SymbolClassifier.contractSize("/QQQZ4")).isEqualTo(1);
        }

        @Test
        @DisplayName("A future is its own underlying")
        void ownUnderlying() {
            assertThat(SymbolClassifier.extractUnderlying("/ESZ4")).isEqualTo("/ESZ4");
            assertThat(SymbolClassifier.valueMultiplier("/ESZ4")).isEqualByComparingTo(BigDecimal.valueOf(50));
        }
    }

    @Test
    @DisplayName("Plain tickers are equities with multiplier 1")
    void equities() {
        assertThat(SymbolClassifier.classify("MSFT")).isEqualTo(InstrumentType.EQUITY);
        assertThat(SymbolClassifier.isOption("MSFT")).isFalse();
        assertThat(SymbolClassifier.isFuturesSymbol("MSFT")).isFalse();
        assertThat(SymbolClassifier.contractSize("MSFT")).isEqualTo(1);
        assertThat(SymbolClassifier.extractUnderlying("MSFT")).isEqualTo("MSFT");
        assertThat(SymbolClassifier.valueMultiplier("MSFT")).isEqualByComparingTo(BigDecimal.ONE);
    }
}
