package com.pfesentinel.core.engine;

import com.pfesentinel.core.baseline.BaselineManager;
import com.pfesentinel.core.config.DetectionConfig;
import com.pfesentinel.core.config.DetectionThresholds;
import com.pfesentinel.core.config.SeverityMap;
import com.pfesentinel.core.detection.DetectionRule;
import com.pfesentinel.core.detection.DynamicBaselineResolver;
import com.pfesentinel.core.detection.RuleContext;
import com.pfesentinel.core.detection.RuleFactory;
import com.pfesentinel.core.fusion.DetectionRanker;
import com.pfesentinel.core.ml.IsolationForestScorer;
import com.pfesentinel.core.ml.OutlierDetector;
import com.pfesentinel.core.ml.OutlierScorer;
import com.pfesentinel.core.model.AnalysisReport;
import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.Sample;
import com.pfesentinel.core.model.SeriesKey;
import com.pfesentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point of the detection core.
 *
 * <p>
 * One {@link #analyze(AnalysisRequest)} call fetches the series it needs from
 * the {@link RateSeriesSource}, computes baselines, runs every rule and
 * (optionally) the outlier model, then ranks and links the result.
 * </p>
 *
 * <p>
 * The engine owns a bounded worker pool for outlier-model fits; close it
 * when done. Everything else runs on the calling thread.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisEngine.class);

    static final Duration RECENT_RESOLUTION = Duration.ofMinutes(1);
    static final Duration BASELINE_RESOLUTION = Duration.ofMinutes(5);
    static final Duration HOURLY_RESOLUTION = Duration.ofHours(1);
    static final Duration STATIC_BASELINE_SPAN = Duration.ofHours(48);
    static final Duration WEEK = Duration.ofDays(7);

    private final RateSeriesSource source;
    private final DetectionThresholds thresholds;
    private final SeverityMap severities;
    private final Clock clock;
    private final BaselineManager baselineManager;
    private final DynamicBaselineResolver resolver;
    private final OutlierDetector outlierDetector;
    private final DetectionRanker ranker = new DetectionRanker();
    private final DashboardLinkBuilder linkBuilder;
    private final ExecutorService mlPool;

    public AnalysisEngine(RateSeriesSource source, DetectionConfig config, Clock clock, int mlWorkers) {
        this(source, config, clock, mlWorkers, new IsolationForestScorer(
                config.getThresholds().getMlTrees(), config.getThresholds().getMlSubsample()));
    }

    public AnalysisEngine(RateSeriesSource source, DetectionConfig config, Clock clock, int mlWorkers,
                          OutlierScorer scorer) {
        this.source = Objects.requireNonNull(source, "RateSeriesSource must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        if (mlWorkers < 1) {
            throw new IllegalArgumentException("mlWorkers must be >= 1, got: " + mlWorkers);
        }
        this.thresholds = config.getThresholds();
        this.severities = config.severityMap();
        this.baselineManager = new BaselineManager(config.getBaseline());
        this.resolver = new DynamicBaselineResolver(baselineManager, thresholds.getMinBaselineSamples());
        this.outlierDetector = new OutlierDetector(scorer, thresholds);
        this.linkBuilder = new DashboardLinkBuilder(config.getDashboard(), clock);
        this.mlPool = Executors.newFixedThreadPool(mlWorkers, workerThreads());
        LOG.info("Analysis engine ready: {} severity mapping(s), {} ML worker(s)",
                severities.asMap().size(), mlWorkers);
    }

    /**
     * Run one analysis.
     *
     * @param request run parameters; must not be {@code null}
     * @return ranked detections and their summary
     */
    public AnalysisReport analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "AnalysisRequest must not be null");
        Instant now = clock.instant();
        Duration lookback = request.getLookback();
        Instant recentStart = now.minus(lookback);

        Map<SeriesKey, TimeSeries> recent = source.fetch(recentStart, now, RECENT_RESOLUTION);
        Map<SeriesKey, TimeSeries> baselineSeries =
                source.fetch(recentStart.minus(STATIC_BASELINE_SPAN), recentStart, BASELINE_RESOLUTION);
        Map<SeriesKey, TimeSeries> weeklySeries =
                source.fetch(recentStart.minus(WEEK), now.minus(WEEK), BASELINE_RESOLUTION);
        Map<SeriesKey, TimeSeries> hourly =
                lookback.compareTo(Duration.ofHours(thresholds.getTrendMinLookbackHours())) >= 0
                        ? source.fetch(recentStart, now, HOURLY_RESOLUTION)
                        : Map.of();

        RuleContext.Builder context = RuleContext.builder()
                .now(now)
                .lookback(lookback)
                .minConsecutiveSamples(request.getMinConsecutiveSamples())
                .thresholds(thresholds)
                .severities(severities)
                .recent(recent)
                .hourly(hourly);
        for (SeriesKey key : recent.keySet()) {
            context.staticBaseline(key, baselineManager.simpleBaseline(samplesOf(baselineSeries, key)));
            context.weeklyBaseline(key, baselineManager.simpleBaseline(samplesOf(weeklySeries, key)));
        }
        if (request.isUseDynamicBaseline()) {
            Map<SeriesKey, TimeSeries> history =
                    source.fetch(now.minus(baselineManager.getLongWindow()), recentStart, BASELINE_RESOLUTION);
            for (Map.Entry<SeriesKey, TimeSeries> entry : recent.entrySet()) {
                SeriesKey key = entry.getKey();
                context.dynamicBaseline(key, resolver.resolve(
                        samplesOf(history, key), entry.getValue().getSamples(), recentStart, now));
            }
        }

        List<Detection> candidates = new ArrayList<>(evaluateRules(context.build(), request.isUseDynamicBaseline()));
        if (request.isUseMl()) {
            candidates.addAll(runOutlierModel(recent, request.getMlConfidenceThreshold()));
        }

        List<Detection> linked = new ArrayList<>();
        for (Detection detection : ranker.rank(candidates)) {
            linked.add(detection.withDashboardLink(linkBuilder.link(detection.getKey())));
        }
        AnalysisReport report = new AnalysisReport(now, linked);
        LOG.info("Analyzed {} series over {}h: {}", recent.size(), request.getLookbackHours(), report.getSummary());
        return report;
    }

    private List<Detection> evaluateRules(RuleContext context, boolean dynamic) {
        List<Detection> detections = new ArrayList<>();
        for (DetectionRule rule : RuleFactory.createAll(dynamic)) {
            try {
                detections.addAll(rule.evaluate(context));
            } catch (RuntimeException e) {
                LOG.error("Rule [{}] threw an exception, continuing with next rule", rule.getRuleName(), e);
            }
        }
        return detections;
    }

    private List<Detection> runOutlierModel(Map<SeriesKey, TimeSeries> recent, double minConfidence) {
        Map<SeriesKey, Future<Optional<Detection>>> futures = new LinkedHashMap<>();
        for (TimeSeries series : new TreeMap<>(recent).values()) {
            futures.put(series.getKey(), mlPool.submit(() ->
                    outlierDetector.detect(series, severities.severityOf(series.getKey().getExceptionType()),
                            minConfidence)));
        }

        List<Detection> detections = new ArrayList<>();
        for (Map.Entry<SeriesKey, Future<Optional<Detection>>> entry : futures.entrySet()) {
            try {
                entry.getValue().get().ifPresent(detections::add);
            } catch (ExecutionException e) {
                LOG.error("Outlier model failed for {}", entry.getKey(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while scoring, returning {} ML detection(s) so far", detections.size());
                futures.values().forEach(f -> f.cancel(true));
                break;
            }
        }
        return detections;
    }

    private static Collection<Sample> samplesOf(Map<SeriesKey, TimeSeries> series, SeriesKey key) {
        TimeSeries found = series.get(key);
        return found != null ? found.getSamples() : List.of();
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "pfe-ml-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        mlPool.shutdownNow();
        LOG.info("Analysis engine closed");
    }
}
