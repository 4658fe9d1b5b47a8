/* (C)2026 */
package com.ammann.regimeshift.service;

import static com.ammann.regimeshift.support.TestDataFactory.dailySeries;
import static com.ammann.regimeshift.support.TestDataFactory.noisySeries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.regimeshift.model.DailyCount;
import com.ammann.regimeshift.model.MetricSeries;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for {@link SignalEngine}.
 *
 * <p>Checks each rolling statistic against hand-computed values, the bounds of autocorrelation and
 * risk, fixed-baseline z-scoring, and the orchestration in {@code computeMetrics}.
 */
class SignalEngineTest {
    private static final double TOLERANCE = 1e-9;

    private final SignalEngine engine = new SignalEngine();

    @Nested
    class RollingStatistics {
        @Test
        void rollingMeanGrowsWindowUntilFull() {
            double[] mean = engine.rollingMean(new double[] {1, 2, 3, 4, 5}, 3);

            assertThat(mean).containsExactly(new double[] {1.0, 1.5, 2.0, 3.0, 4.0}, within(TOLERANCE));
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 3, 14, 100})
        void rollingMeanOfConstantSeriesIsTheConstant(int window) {
            double[] values = new double[40];
            Arrays.fill(values, 7.0);

            double[] mean = engine.rollingMean(values, window);

            assertThat(Arrays.stream(mean).boxed().toList())
                    .allSatisfy(v -> assertThat(v).isCloseTo(7.0, within(TOLERANCE)));
        }

        @Test
        void residualsRemoveTrailingMean() {
            double[] residuals = engine.residuals(new double[] {2, 4, 6}, 2);

            assertThat(residuals).containsExactly(new double[] {0.0, 1.0, 1.0}, within(TOLERANCE));
        }

        @Test
        void rollingVarianceIsPopulationVarianceOverTrailingWindow() {
            double[] variance = engine.rollingVariance(new double[] {1, 2, 3, 4}, 2);

            assertThat(variance).containsExactly(new double[] {0.0, 0.25, 0.25, 0.25}, within(TOLERANCE));
        }

        @Test
        void rollingTrendRecoversSlopeOfLine() {
            double[] line = new double[20];
            for (int i = 0; i < line.length; i++) {
                line[i] = 2.0 * i + 1.0;
            }

            double[] slope = engine.rollingTrend(line, 5);

            assertThat(slope[0]).isZero();
            for (int i = 1; i < slope.length; i++) {
                assertThat(slope[i]).isCloseTo(2.0, within(TOLERANCE));
            }
        }

        @Test
        void rollingTrendOfFlatSeriesIsZero() {
            assertThat(engine.rollingTrend(new double[] {3, 3, 3, 3}, 14))
                    .containsExactly(0.0, 0.0, 0.0, 0.0);
        }

        @Test
        void rejectsNonPositiveWindows() {
            assertThatThrownBy(() -> engine.rollingVariance(new double[] {1, 2}, 0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.lag1Autocorrelation(new double[] {1, 2}, -1))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.zscoreVsBaseline(new double[] {1, 2}, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Autocorrelation {
        @Test
        void isZeroForFirstPointAndForFlatWindows() {
            double[] ac = engine.lag1Autocorrelation(new double[] {4, 4, 4, 4}, 3);

            assertThat(ac).containsExactly(0.0, 0.0, 0.0, 0.0);
        }

        @Test
        void alternatingSeriesIsStronglyNegative() {
            double[] ac = engine.lag1Autocorrelation(new double[] {1, -1, 1, -1, 1, -1}, 6);

            assertThat(ac[0]).isZero();
            assertThat(ac[5]).isCloseTo(-5.0 / 6.0, within(TOLERANCE));
        }

        @Test
        void persistentSeriesIsPositive() {
            double[] ac = engine.lag1Autocorrelation(new double[] {1, 2, 3, 4, 5, 6, 7, 8}, 8);

            assertThat(ac[7]).isGreaterThan(0.5);
        }

        @ParameterizedTest
        @ValueSource(longs = {1L, 7L, 42L, 1234L})
        void staysWithinUnitInterval(long seed) {
            Random random = new Random(seed);
            double[] values = random.doubles(200, -50, 50).toArray();

            for (int window : new int[] {1, 2, 3, 14, 50}) {
                double[] ac = engine.lag1Autocorrelation(values, window);
                assertThat(Arrays.stream(ac).boxed().toList())
                        .allSatisfy(v -> assertThat(v).isBetween(-1.0, 1.0));
            }
        }
    }

    @Nested
    class BaselineZScore {
        @Test
        void usesOnlyTheLeadingBaselinePoints() {
            double[] z = engine.zscoreVsBaseline(new double[] {1, 3, 10}, 2);

            assertThat(z).containsExactly(new double[] {-1.0, 1.0, 8.0}, within(TOLERANCE));
        }

        @Test
        void constantSeriesScoresZeroEverywhere() {
            double[] values = new double[50];
            Arrays.fill(values, 5.0);

            assertThat(engine.zscoreVsBaseline(values, 30)).containsOnly(0.0);
        }

        @Test
        void zeroDeviationBaselineDividesByOne() {
            double[] z = engine.zscoreVsBaseline(new double[] {2, 2, 5}, 2);

            assertThat(z).containsExactly(new double[] {0.0, 0.0, 3.0}, within(TOLERANCE));
        }

        @Test
        void baselineLongerThanSeriesUsesWholeSeries() {
            double[] z = engine.zscoreVsBaseline(new double[] {1, 3}, 30);

            assertThat(z).containsExactly(new double[] {-1.0, 1.0}, within(TOLERANCE));
        }

        @Test
        void emptySeriesYieldsEmptyResult() {
            assertThat(engine.zscoreVsBaseline(new double[0], 30)).isEmpty();
        }
    }

    @Nested
    class Risk {
        @Test
        void neutralScoresGiveMidpoint() {
            assertThat(engine.combineRisk(0, 0, 0, null)).isCloseTo(0.5, within(TOLERANCE));
        }

        @Test
        void extremeScoresAreClampedBeforeWeighting() {
            assertThat(engine.combineRisk(10, 10, 10, null)).isCloseTo(1.0, within(TOLERANCE));
            assertThat(engine.combineRisk(-10, -10, -10, null)).isCloseTo(0.0, within(TOLERANCE));
        }

        @Test
        void weightsFavourAutocorrelation() {
            assertThat(engine.combineRisk(3, -3, -3, null)).isCloseTo(0.5, within(TOLERANCE));
            assertThat(engine.combineRisk(-3, 3, -3, null)).isCloseTo(0.3, within(TOLERANCE));
            assertThat(engine.combineRisk(-3, -3, 3, null)).isCloseTo(0.2, within(TOLERANCE));
        }

        @Test
        void smoothsAgainstPreviousValue() {
            assertThat(engine.combineRisk(3, 3, 3, 0.0)).isCloseTo(0.25, within(TOLERANCE));
            assertThat(engine.combineRisk(3, 3, 3, 0.0, 0.5)).isCloseTo(0.5, within(TOLERANCE));
        }

        @ParameterizedTest
        @MethodSource("com.ammann.regimeshift.service.SignalEngineTest#riskInputs")
        void staysWithinUnitInterval(double ac, double var, double trend, Double previous) {
            assertThat(engine.combineRisk(ac, var, trend, previous)).isBetween(0.0, 1.0);
        }
    }

    static Stream<Arguments> riskInputs() {
        return Stream.of(
                Arguments.of(0.0, 0.0, 0.0, null),
                Arguments.of(100.0, -100.0, 5.0, 0.9),
                Arguments.of(Double.MAX_VALUE, Double.MAX_VALUE, Double.MAX_VALUE, 1.0),
                Arguments.of(-Double.MAX_VALUE, 0.0, 0.0, 0.0),
                Arguments.of(1.5, 2.5, -0.5, 0.3));
    }

    @Nested
    class ComputeMetrics {
        @Test
        void emptySeriesYieldsEmptyMetrics() {
            MetricSeries metrics = engine.computeMetrics("A", List.of());

            assertThat(metrics.species()).isEqualTo("A");
            assertThat(metrics.dates()).isEmpty();
            assertThat(metrics.detections()).isEmpty();
            assertThat(metrics.autocorrelation()).isEmpty();
            assertThat(metrics.variance()).isEmpty();
            assertThat(metrics.trend()).isEmpty();
            assertThat(metrics.risk()).isEmpty();
            assertThat(metrics.latest()).isEmpty();
        }

        @Test
        void outputsAreAlignedWithInputDays() {
            List<DailyCount> series = noisySeries(60, 11L);

            MetricSeries metrics = engine.computeMetrics("A", series);

            assertThat(metrics.size()).isEqualTo(60);
            assertThat(metrics.detections()).hasSize(60);
            assertThat(metrics.autocorrelation()).hasSize(60);
            assertThat(metrics.variance()).hasSize(60);
            assertThat(metrics.trend()).hasSize(60);
            assertThat(metrics.risk()).hasSize(60);
            assertThat(metrics.dates().get(0)).isEqualTo(series.get(0).day());
            assertThat(metrics.detections().get(59)).isEqualTo((double) series.get(59).count());
        }

        @Test
        void metricsRespectTheirBounds() {
            MetricSeries metrics = engine.computeMetrics("A", noisySeries(120, 5L), 7, 10, 20);

            assertThat(metrics.autocorrelation()).allSatisfy(v -> assertThat(v).isBetween(-1.0, 1.0));
            assertThat(metrics.variance()).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0));
            assertThat(metrics.risk()).allSatisfy(v -> assertThat(v).isBetween(0.0, 100.0));
        }

        @Test
        void repeatedRunsAreIdentical() {
            List<DailyCount> series = noisySeries(90, 99L);

            MetricSeries first = engine.computeMetrics("A", series);
            MetricSeries second = engine.computeMetrics("A", series);

            assertThat(second).isEqualTo(first);
        }

        @Test
        void riskAtEachDayDependsOnlyOnEarlierDays() {
            List<DailyCount> full = noisySeries(45, 3L);
            List<DailyCount> prefix = full.subList(0, 35);

            MetricSeries fullMetrics = engine.computeMetrics("A", full);
            MetricSeries prefixMetrics = engine.computeMetrics("A", prefix);

            assertThat(fullMetrics.risk().subList(0, 35)).isEqualTo(prefixMetrics.risk());
            assertThat(fullMetrics.autocorrelation().subList(0, 35)).isEqualTo(prefixMetrics.autocorrelation());
        }

        @Test
        void firstDayRiskIsUnsmoothedCombination() {
            MetricSeries metrics = engine.computeMetrics("A", dailySeries(4));

            // one point: every statistic and z-score is zero
            assertThat(metrics.risk()).hasSize(1);
            assertThat(metrics.risk().get(0)).isCloseTo(50.0, within(TOLERANCE));
            assertThat(metrics.trend()).containsExactly(0.0);
        }

        @Test
        void constantSeriesHasNeutralSignals() {
            long[] counts = new long[40];
            Arrays.fill(counts, 12L);

            MetricSeries metrics = engine.computeMetrics("A", dailySeries(counts));

            assertThat(metrics.autocorrelation()).containsOnly(0.0);
            assertThat(metrics.variance()).containsOnly(0.0);
            assertThat(metrics.trend()).containsOnly(0.0);
            assertThat(metrics.risk()).allSatisfy(v -> assertThat(v).isCloseTo(50.0, within(TOLERANCE)));
        }

        @Test
        void rejectsNonPositiveWindows() {
            List<DailyCount> series = dailySeries(1, 2, 3);

            assertThatThrownBy(() -> engine.computeMetrics("A", series, 0, 14, 30))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("trendWindow");
            assertThatThrownBy(() -> engine.computeMetrics("A", series, 14, 14, -1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("baselineN");
        }
    }
}
