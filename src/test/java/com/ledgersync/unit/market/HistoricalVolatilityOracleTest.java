package com.ledgersync.unit.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

import com.ledgersync.exception.MarketDataException;
import com.ledgersync.market.HistoricalVolatilityOracle;
import com.ledgersync.market.PriceHistorySource;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HistoricalVolatilityOracleTest {

    @Mock
    private PriceHistorySource priceHistorySource;

    private HistoricalVolatilityOracle oracle;

    @BeforeEach
    void setUp() {
        oracle = new HistoricalVolatilityOracle(priceHistorySource, 252, 3);
    }

    private static List<BigDecimal> closes(String... values) {
        return Arrays.stream(values).map(BigDecimal::new).toList();
    }

    @Nested
    @DisplayName("Returns")
    class Returns {

        @Test
        @DisplayName("Daily returns are percentage changes between consecutive closes")
        void percentageChanges() {
            List<Double> returns = HistoricalVolatilityOracle.dailyReturns(closes("100", "110", "99"));

            assertThat(returns).hasSize(2);
            assertThat(returns.get(0)).isCloseTo(0.10, within(1e-12));
            assertThat(returns.get(1)).isCloseTo(-0.10, within(1e-12));
        }

        @Test
        @DisplayName("A zero close is skipped as a base")
        void zeroCloseSkipped() {
            List<Double> returns = HistoricalVolatilityOracle.dailyReturns(closes("0", "100", "101"));

            assertThat(returns).hasSize(1);
            assertThat(returns.get(0)).isCloseTo(0.01, within(1e-12));
        }

        @Test
        @DisplayName("Sample standard deviation divides by n - 1")
        void sampleStandardDeviation() {
            double stdev = HistoricalVolatilityOracle.sampleStandardDeviation(List.of(1.0, 2.0, 3.0, 4.0));

            assertThat(stdev).isCloseTo(Math.sqrt(5.0 / 3.0), within(1e-12));
        }

        @Test
        @DisplayName("A flat series has zero deviation and an empty one has none")
        void degenerateSeries() {
            assertThat(HistoricalVolatilityOracle.sampleStandardDeviation(List.of(0.01, 0.01, 0.01))).isZero();
            assertThat(HistoricalVolatilityOracle.sampleStandardDeviation(List.of())).isNaN();
        }
    }

    @Test
    @DisplayName("Annualizes the sample deviation by the square root of trading days")
    void annualizes() {
        when(priceHistorySource.dailyCloses("SPY")).thenReturn(closes("100", "101", "100", "101", "100"));

        Optional<Double> volatility = oracle.annualizedVolatility("SPY");

        List<Double> returns = HistoricalVolatilityOracle.dailyReturns(closes("100", "101", "100", "101", "100"));
        double expected = HistoricalVolatilityOracle.sampleStandardDeviation(returns) * Math.sqrt(252);
        assertThat(volatility).hasValueSatisfying(value -> assertThat(value).isCloseTo(expected, within(1e-12)));
        assertThat(expected).isBetween(0.18, 0.19);
    }

    @Test
    @DisplayName("Too few observations yield no volatility")
    void tooFewObservations() {
        when(priceHistorySource.dailyCloses("NEW")).thenReturn(closes("10", "11", "12"));

        assertThat(oracle.annualizedVolatility("NEW")).isEmpty();
    }

    @Test
    @DisplayName("An empty history yields no volatility even with no minimum")
    void emptyHistoryWithoutMinimum() {
        HistoricalVolatilityOracle lenient = new HistoricalVolatilityOracle(priceHistorySource, 252, 0);
        when(priceHistorySource.dailyCloses("IPO")).thenReturn(closes("25"));

        assertThat(lenient.annualizedVolatility("IPO")).isEmpty();
    }

    @Test
    @DisplayName("A failing history source yields no volatility")
    void sourceFailure() {
        when(priceHistorySource.dailyCloses("XYZ")).thenThrow(new MarketDataException("XYZ", "404"));

        assertThat(oracle.annualizedVolatility("XYZ")).isEmpty();
    }
}
