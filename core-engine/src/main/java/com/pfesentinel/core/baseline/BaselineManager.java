package com.pfesentinel.core.baseline;

import com.pfesentinel.core.config.BaselineSettings;
import com.pfesentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Computes reference distributions from historical rate samples.
 *
 * <ul>
 * <li>{@link #simpleBaseline(Collection)}: plain window statistics</li>
 * <li>{@link #contextualBaseline(Collection, Instant)}: same hour band and
 * weekday/weekend class as the reference time</li>
 * <li>{@link #multiWindowBaseline(Collection, Instant)}: short, medium and
 * long windows blended with adaptive weights</li>
 * <li>{@link #ewmaBaseline(Collection, double)}: reactive EWMA band</li>
 * <li>{@link #detectRegimeChange(Collection, Baseline)}: sustained shift to
 * a new steady state</li>
 * </ul>
 *
 * <p>
 * Missing values are always filtered first. With no valid samples every
 * method returns its empty form ({@code sampleCount == 0}); nothing here
 * throws on empty input.
 * </p>
 *
 * <p>
 * Instances hold only configuration and are safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineManager {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineManager.class);

    private static final double RECENCY_SHORT = 0.5;
    private static final double RECENCY_MEDIUM = 0.3;
    private static final double RECENCY_LONG = 0.2;

    private static final double RECENCY_SHARE = 0.4;
    private static final double AVAILABILITY_SHARE = 0.3;
    private static final double RELIABILITY_SHARE = 0.3;

    /** Floor for the largest window std when scoring reliability. */
    private static final double MIN_STD = 0.01;

    private final Duration shortWindow;
    private final Duration mediumWindow;
    private final Duration longWindow;
    private final double ewmaAlpha;
    private final double regimeThreshold;
    private final int regimeMinSamples;
    private final double regimeSustainedFraction;
    private final int contextHourRadius;
    private final int contextMinSamples;
    private final ZoneId zone;

    /**
     * Manager with the default windows (2h / 24h / 168h), alpha 0.3 and a
     * regime threshold of 2σ, evaluating time-of-day in UTC.
     */
    public BaselineManager() {
        this(new BaselineSettings());
    }

    public BaselineManager(BaselineSettings settings) {
        this(settings, ZoneOffset.UTC);
    }

    /**
     * @param settings window and smoothing settings; must not be {@code null}
     * @param zone     zone used for hour-of-day and weekday context
     */
    public BaselineManager(BaselineSettings settings, ZoneId zone) {
        Objects.requireNonNull(settings, "BaselineSettings must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.shortWindow = Duration.ofHours(settings.getShortWindowHours());
        this.mediumWindow = Duration.ofHours(settings.getMediumWindowHours());
        this.longWindow = Duration.ofHours(settings.getLongWindowHours());
        this.ewmaAlpha = settings.getEwmaAlpha();
        this.regimeThreshold = settings.getRegimeThreshold();
        this.regimeMinSamples = settings.getRegimeMinSamples();
        this.regimeSustainedFraction = settings.getRegimeSustainedFraction();
        this.contextHourRadius = settings.getContextHourRadius();
        this.contextMinSamples = settings.getContextMinSamples();
        LOG.info("BaselineManager initialised: short={}h, medium={}h, long={}h, alpha={}",
                shortWindow.toHours(), mediumWindow.toHours(), longWindow.toHours(), ewmaAlpha);
    }

    // ---------------------------------------------------------------
    // Simple
    // ---------------------------------------------------------------

    /**
     * Mean, median, sample std, min, max, nearest-rank p95 and count of the
     * valid samples. Order of the input does not matter.
     */
    public Baseline simpleBaseline(Collection<Sample> samples) {
        return fromValues(validValues(samples));
    }

    /**
     * Statistics over raw values, all assumed valid.
     */
    public static Baseline fromValues(double[] values) {
        if (values.length == 0) {
            return Baseline.EMPTY;
        }
        return new Baseline(
                SampleStatistics.mean(values),
                SampleStatistics.median(values),
                SampleStatistics.sampleStd(values),
                SampleStatistics.min(values),
                SampleStatistics.max(values),
                SampleStatistics.nearestRankPercentile(values, 0.95),
                values.length);
    }

    // ---------------------------------------------------------------
    // Contextual
    // ---------------------------------------------------------------

    /**
     * Baseline over samples whose hour of day lies within the configured
     * radius of {@code referenceTime}'s hour (wrapping at midnight) and that
     * share its weekday/weekend class. Falls back to every valid sample when
     * fewer than the minimum match.
     */
    public ContextualBaseline contextualBaseline(Collection<Sample> series, Instant referenceTime) {
        Objects.requireNonNull(referenceTime, "referenceTime must not be null");
        ZonedDateTime reference = referenceTime.atZone(zone);
        int referenceHour = reference.getHour();
        boolean referenceWeekend = isWeekend(reference.getDayOfWeek());
        String context = "hour=" + referenceHour + "±" + contextHourRadius + "h, dayClass="
                + (referenceWeekend ? "weekend" : "weekday");

        List<Sample> valid = valid(series);
        if (valid.isEmpty()) {
            return new ContextualBaseline(Baseline.EMPTY, context, false);
        }

        List<Double> matching = new ArrayList<>();
        for (Sample sample : valid) {
            ZonedDateTime t = sample.getTime().atZone(zone);
            int delta = Math.abs(t.getHour() - referenceHour);
            int hourDistance = Math.min(delta, 24 - delta);
            if (hourDistance <= contextHourRadius && isWeekend(t.getDayOfWeek()) == referenceWeekend) {
                matching.add(sample.getValue());
            }
        }

        if (matching.size() < contextMinSamples) {
            LOG.debug("Only {} contextual samples for {}, using all {} samples",
                    matching.size(), context, valid.size());
            return new ContextualBaseline(simpleBaseline(valid), context, false);
        }
        double[] values = matching.stream().mapToDouble(Double::doubleValue).toArray();
        return new ContextualBaseline(fromValues(values), context, true);
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    // ---------------------------------------------------------------
    // Multi-window
    // ---------------------------------------------------------------

    /**
     * Short, medium and long trailing windows ending at {@code referenceTime},
     * blended into a composite. Mean, median, std and p95 are weighted sums;
     * min and max are taken across the non-empty windows unweighted.
     */
    public MultiWindowBaseline multiWindowBaseline(Collection<Sample> series, Instant referenceTime) {
        Objects.requireNonNull(referenceTime, "referenceTime must not be null");
        List<Sample> valid = valid(series);
        if (valid.isEmpty()) {
            return MultiWindowBaseline.EMPTY;
        }

        Baseline shortBaseline = simpleBaseline(window(valid, referenceTime, shortWindow));
        Baseline mediumBaseline = simpleBaseline(window(valid, referenceTime, mediumWindow));
        Baseline longBaseline = simpleBaseline(window(valid, referenceTime, longWindow));

        WindowWeights weights = adaptiveWeights(shortBaseline, mediumBaseline, longBaseline);
        Baseline composite = composite(List.of(shortBaseline, mediumBaseline, longBaseline), weights);
        return new MultiWindowBaseline(shortBaseline, mediumBaseline, longBaseline, composite, weights);
    }

    /**
     * Blend a fixed recency prior (0.5/0.3/0.2), each window's share of the
     * samples, and an inverse-variance reliability score in a 40/30/30 split,
     * then normalise to sum to 1. A window without samples gets weight 0.
     *
     * @return {@link WindowWeights#NONE} when all three windows are empty
     */
    public static WindowWeights adaptiveWeights(Baseline shortBaseline, Baseline mediumBaseline,
            Baseline longBaseline) {
        double total = (double) shortBaseline.getSampleCount()
                + mediumBaseline.getSampleCount()
                + longBaseline.getSampleCount();
        if (total == 0) {
            return WindowWeights.NONE;
        }

        double maxStd = Math.max(MIN_STD,
                Math.max(shortBaseline.getStd(), Math.max(mediumBaseline.getStd(), longBaseline.getStd())));

        double s = combine(RECENCY_SHORT, shortBaseline, total, maxStd);
        double m = combine(RECENCY_MEDIUM, mediumBaseline, total, maxStd);
        double l = combine(RECENCY_LONG, longBaseline, total, maxStd);
        double sum = s + m + l;
        return new WindowWeights(s / sum, m / sum, l / sum);
    }

    private static double combine(double recency, Baseline baseline, double totalSamples, double maxStd) {
        if (baseline.isEmpty()) {
            return 0.0;
        }
        double availability = baseline.getSampleCount() / totalSamples;
        double reliability = 1.0 - baseline.getStd() / maxStd;
        return recency * RECENCY_SHARE + availability * AVAILABILITY_SHARE + reliability * RELIABILITY_SHARE;
    }

    private static Baseline composite(List<Baseline> windows, WindowWeights weights) {
        if (weights.sum() == 0) {
            return Baseline.EMPTY;
        }
        double[] w = {weights.getShort(), weights.getMedium(), weights.getLong()};
        double mean = 0;
        double median = 0;
        double std = 0;
        double p95 = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int count = 0;
        for (int i = 0; i < windows.size(); i++) {
            Baseline b = windows.get(i);
            mean += b.getMean() * w[i];
            median += b.getMedian() * w[i];
            std += b.getStd() * w[i];
            p95 += b.getP95() * w[i];
            if (!b.isEmpty()) {
                min = Math.min(min, b.getMin());
                max = Math.max(max, b.getMax());
            }
            // windows are nested, so the widest one holds every distinct sample
            count = Math.max(count, b.getSampleCount());
        }
        return new Baseline(mean, median, std, min, max, p95, count);
    }

    private static List<Sample> window(List<Sample> valid, Instant end, Duration length) {
        Instant start = end.minus(length);
        return valid.stream()
                .filter(s -> !s.getTime().isBefore(start) && !s.getTime().isAfter(end))
                .toList();
    }

    // ---------------------------------------------------------------
    // EWMA
    // ---------------------------------------------------------------

    public EwmaBaseline ewmaBaseline(Collection<Sample> series) {
        return ewmaBaseline(series, ewmaAlpha);
    }

    /**
     * EWMA seeded with the oldest value; the variance is smoothed alongside
     * using each step's updated average. Bounds are {@code ewma ± 3σ} with the
     * lower bound floored at zero.
     *
     * @throws IllegalArgumentException if {@code alpha} is outside (0, 1]
     */
    public EwmaBaseline ewmaBaseline(Collection<Sample> series, double alpha) {
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1], got: " + alpha);
        }
        List<Sample> sorted = new ArrayList<>(valid(series));
        if (sorted.isEmpty()) {
            return EwmaBaseline.empty(alpha);
        }
        sorted.sort(Comparator.comparing(Sample::getTime));

        double ewma = sorted.get(0).getValue();
        double variance = 0.0;
        for (int i = 1; i < sorted.size(); i++) {
            double v = sorted.get(i).getValue();
            ewma = alpha * v + (1 - alpha) * ewma;
            double d = v - ewma;
            variance = alpha * d * d + (1 - alpha) * variance;
        }
        return new EwmaBaseline(ewma, Math.sqrt(variance), sorted.size(), alpha);
    }

    // ---------------------------------------------------------------
    // Regime change
    // ---------------------------------------------------------------

    /**
     * A regime change needs enough recent samples, a recent mean beyond
     * {@code mean + k·std} or below half the historical mean, and the same
     * deviation in at least the sustained fraction of individual samples.
     */
    public RegimeChange detectRegimeChange(Collection<Sample> recentSamples, Baseline historical) {
        Objects.requireNonNull(historical, "historical baseline must not be null");
        double[] recent = validValues(recentSamples);
        if (recent.length < regimeMinSamples || historical.isEmpty()) {
            return RegimeChange.none();
        }

        Baseline recentBaseline = fromValues(recent);
        double upper = historical.getMean() + regimeThreshold * historical.getStd();
        double lower = historical.getMean() * 0.5;
        double recentMean = recentBaseline.getMean();
        if (!(recentMean > upper || recentMean < lower)) {
            return RegimeChange.none();
        }

        int deviating = 0;
        for (double v : recent) {
            if (v > upper || v < lower) {
                deviating++;
            }
        }
        double fraction = (double) deviating / recent.length;
        if (fraction >= regimeSustainedFraction) {
            LOG.info("Regime change detected: {} -> {} ({}% of samples sustained)",
                    String.format("%.2f", historical.getMean()), String.format("%.2f", recentMean),
                    Math.round(fraction * 100));
            return RegimeChange.detected(recentBaseline);
        }
        return RegimeChange.none();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<Sample> valid(Collection<Sample> samples) {
        if (samples == null) {
            return List.of();
        }
        return samples.stream().filter(Objects::nonNull).filter(Sample::isValid).toList();
    }

    private static double[] validValues(Collection<Sample> samples) {
        return valid(samples).stream().mapToDouble(Sample::getValue).toArray();
    }

    public Duration getShortWindow() {
        return shortWindow;
    }

    public Duration getMediumWindow() {
        return mediumWindow;
    }

    public Duration getLongWindow() {
        return longWindow;
    }

    public double getEwmaAlpha() {
        return ewmaAlpha;
    }
}
