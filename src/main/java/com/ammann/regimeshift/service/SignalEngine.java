/* (C)2026 */
package com.ammann.regimeshift.service;

import com.ammann.regimeshift.model.DailyCount;
import com.ammann.regimeshift.model.MetricSeries;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Computes early-warning signals of critical slowing down from a species' daily detection counts.
 *
 * <p>Rising lag-1 autocorrelation and rising variance of the detrended series are the classical
 * leading indicators of an approaching regime shift. Both are computed over a trailing window,
 * z-scored against a fixed baseline made of the first days of the series, blended with the
 * z-scored trend slope of the raw counts and smoothed with an exponential moving average into a
 * single risk score.
 *
 * <p>Every rolling statistic uses a trailing window that grows from one point up to its full size
 * and never looks ahead, so the value at day {@code i} depends only on days {@code 0..i}. The
 * service keeps no state; all outputs are aligned index-for-index with their inputs.
 */
@ApplicationScoped
public class SignalEngine
{
    private static final Logger LOG = Logger.getLogger(SignalEngine.class);

    public static final int DEFAULT_TREND_WINDOW = 14;
    public static final int DEFAULT_METRIC_WINDOW = 14;
    public static final int DEFAULT_BASELINE = 30;
    public static final double DEFAULT_ALPHA = 0.25;

    private static final double Z_CLAMP = 3.0;
    private static final double WEIGHT_AUTOCORRELATION = 0.5;
    private static final double WEIGHT_VARIANCE = 0.3;
    private static final double WEIGHT_TREND = 0.2;

    /**
     * Trailing moving average.
     *
     * @param values input series
     * @param window maximum number of trailing points averaged
     * @return averages aligned with {@code values}; a copy of the input for {@code window <= 1}
     */
    public double[] rollingMean(double[] values, int window)
    {
        if (window <= 1) {
            return values.clone();
        }
        double[] out = new double[values.length];
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            out[i] = sum / Math.min(i + 1, window);
        }
        return out;
    }

    /**
     * Subtracts the trailing mean of {@code trendWindow} points from each value.
     */
    public double[] residuals(double[] values, int trendWindow)
    {
        double[] trend = rollingMean(values, trendWindow);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] - trend[i];
        }
        return out;
    }

    /**
     * Population variance over the trailing window.
     */
    public double[] rollingVariance(double[] residuals, int window)
    {
        requirePositive(window, "window");
        double[] out = new double[residuals.length];
        for (int i = 0; i < residuals.length; i++) {
            int start = windowStart(i, window);
            double mean = mean(residuals, start, i);
            double sumSquares = 0.0;
            for (int k = start; k <= i; k++) {
                double d = residuals[k] - mean;
                sumSquares += d * d;
            }
            out[i] = sumSquares / (i - start + 1);
        }
        return out;
    }

    /**
     * Lag-1 autocorrelation over the trailing window, clamped to [-1, 1].
     *
     * <p>Zero while fewer than two points are available and whenever the window has no spread.
     */
    public double[] lag1Autocorrelation(double[] residuals, int window)
    {
        requirePositive(window, "window");
        double[] out = new double[residuals.length];
        for (int i = 0; i < residuals.length; i++) {
            if (i < 1) {
                out[i] = 0.0;
                continue;
            }
            int start = windowStart(i, window);
            double mean = mean(residuals, start, i);

            double numerator = 0.0;
            for (int k = start + 1; k <= i; k++) {
                numerator += (residuals[k] - mean) * (residuals[k - 1] - mean);
            }
            double denominator = 0.0;
            for (int k = start; k <= i; k++) {
                double d = residuals[k] - mean;
                denominator += d * d;
            }

            double ac = denominator != 0.0 ? numerator / denominator : 0.0;
            out[i] = clamp(ac, -1.0, 1.0);
        }
        return out;
    }

    /**
     * Ordinary least squares slope of the values against their 0-based position in the trailing window.
     * Zero while fewer than two points are available.
     */
    public double[] rollingTrend(double[] values, int window)
    {
        requirePositive(window, "window");
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int start = windowStart(i, window);
            int n = i - start + 1;
            if (n < 2) {
                out[i] = 0.0;
                continue;
            }
            double xMean = (n - 1) / 2.0;
            double yMean = mean(values, start, i);
            double numerator = 0.0;
            double denominator = 0.0;
            for (int k = 0; k < n; k++) {
                double dx = k - xMean;
                numerator += dx * (values[start + k] - yMean);
                denominator += dx * dx;
            }
            out[i] = denominator != 0.0 ? numerator / denominator : 0.0;
        }
        return out;
    }

    /**
     * Z-scores every element against the mean and population standard deviation of the first
     * {@code min(baselineN, length)} elements. The baseline is fixed; it does not slide.
     * A zero standard deviation is replaced by 1.0.
     */
    public double[] zscoreVsBaseline(double[] series, int baselineN)
    {
        requirePositive(baselineN, "baselineN");
        if (series.length == 0) {
            return new double[0];
        }
        int n = Math.max(1, Math.min(series.length, baselineN));
        double mean = mean(series, 0, n - 1);
        double sumSquares = 0.0;
        for (int k = 0; k < n; k++) {
            double d = series[k] - mean;
            sumSquares += d * d;
        }
        double variance = sumSquares / n;
        double sd = variance > 0.0 ? Math.sqrt(variance) : 1.0;

        double[] out = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            out[i] = (series[i] - mean) / sd;
        }
        return out;
    }

    /**
     * Blends three z-scores into a risk score in [0, 1].
     *
     * <p>Each z-score is clamped to [-3, 3] and rescaled to [0, 1]; the weighted sum
     * {@code 0.5 * autocorrelation + 0.3 * variance + 0.2 * trend} is then smoothed against the
     * previous day's score.
     *
     * @param previousEma score of the previous day, {@code null} on the first day
     * @param alpha       weight of the new value in the moving average
     */
    public double combineRisk(double autocorrZ, double varianceZ, double trendZ, Double previousEma, double alpha)
    {
        double raw = WEIGHT_AUTOCORRELATION * toUnit(autocorrZ)
                + WEIGHT_VARIANCE * toUnit(varianceZ)
                + WEIGHT_TREND * toUnit(trendZ);
        double score = previousEma == null ? raw : alpha * raw + (1 - alpha) * previousEma;
        return clamp(score, 0.0, 1.0);
    }

    public double combineRisk(double autocorrZ, double varianceZ, double trendZ, Double previousEma)
    {
        return combineRisk(autocorrZ, varianceZ, trendZ, previousEma, DEFAULT_ALPHA);
    }

    /**
     * Computes all metrics for one species with the default windows.
     */
    public MetricSeries computeMetrics(String species, List<DailyCount> series)
    {
        return computeMetrics(species, series, DEFAULT_TREND_WINDOW, DEFAULT_METRIC_WINDOW, DEFAULT_BASELINE);
    }

    /**
     * Computes all metrics for one species.
     *
     * <p>Autocorrelation and variance are taken from the residuals after removing a trailing mean of
     * {@code trendWindow} days; the trend is the slope of the raw counts. Each of the three is
     * z-scored against the first {@code baselineN} days and folded into the EMA-smoothed risk,
     * reported on a 0-100 scale.
     *
     * @param species      species label carried into the result
     * @param series       contiguous daily counts ordered by day
     * @param trendWindow  detrending window in days
     * @param metricWindow window for autocorrelation, variance and trend in days
     * @param baselineN    number of leading days forming the z-score baseline
     * @return aligned metric lists; all empty for an empty series
     * @throws IllegalArgumentException if a window or the baseline is not positive
     */
    public MetricSeries computeMetrics(
            String species, List<DailyCount> series, int trendWindow, int metricWindow, int baselineN)
    {
        requirePositive(trendWindow, "trendWindow");
        requirePositive(metricWindow, "metricWindow");
        requirePositive(baselineN, "baselineN");

        if (series == null || series.isEmpty()) {
            return MetricSeries.empty(species);
        }

        int n = series.size();
        List<LocalDate> dates = new ArrayList<>(n);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            DailyCount day = series.get(i);
            dates.add(day.day());
            values[i] = day.count();
        }

        double[] residuals = residuals(values, trendWindow);
        double[] autocorrelation = lag1Autocorrelation(residuals, metricWindow);
        double[] variance = rollingVariance(residuals, metricWindow);
        double[] slope = rollingTrend(values, metricWindow);

        double[] autocorrelationZ = zscoreVsBaseline(autocorrelation, baselineN);
        double[] varianceZ = zscoreVsBaseline(variance, baselineN);
        double[] slopeZ = zscoreVsBaseline(slope, baselineN);

        double[] risk = new double[n];
        Double ema = null;
        for (int i = 0; i < n; i++) {
            double score = combineRisk(autocorrelationZ[i], varianceZ[i], slopeZ[i], ema);
            ema = score;
            risk[i] = clamp(score * 100.0, 0.0, 100.0);
        }

        LOG.debugf("Computed %d days of signals for %s (trendWindow=%d, metricWindow=%d, baseline=%d)",
                n, species, trendWindow, metricWindow, baselineN);

        return new MetricSeries(
                species,
                List.copyOf(dates),
                boxed(values),
                boxed(autocorrelation),
                boxed(variance),
                boxed(slope),
                boxed(risk));
    }

    /** Maps a z-score clamped to [-3, 3] onto [0, 1]. */
    private static double toUnit(double z)
    {
        return (clamp(z, -Z_CLAMP, Z_CLAMP) + Z_CLAMP) / (2 * Z_CLAMP);
    }

    private static int windowStart(int index, int window)
    {
        return Math.max(0, index - window + 1);
    }

    /** Mean of {@code values[from..to]}, both ends inclusive. */
    private static double mean(double[] values, int from, int to)
    {
        double sum = 0.0;
        for (int k = from; k <= to; k++) {
            sum += values[k];
        }
        return sum / (to - from + 1);
    }

    private static double clamp(double value, double min, double max)
    {
        return Math.max(min, Math.min(max, value));
    }

    private static List<Double> boxed(double[] values)
    {
        return Arrays.stream(values).boxed().toList();
    }

    private static void requirePositive(int value, String name)
    {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format("%s must be positive, got %d", name, value));
        }
    }
}
