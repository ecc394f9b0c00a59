package com.pfesentinel.core.engine;

import com.pfesentinel.core.model.SeriesKey;
import com.pfesentinel.core.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Supplies exception rate series from the time-series store.
 * <p>
 * Values are non-negative rates in exceptions per second, already averaged
 * into fixed windows. Failures are not retried by the engine.
 * </p>
 */
public interface RateSeriesSource {

    /**
     * @param start          inclusive start of the range
     * @param stop           exclusive end of the range
     * @param aggregateEvery window width samples are averaged into
     * @return one series per key with data in the range
     */
    Map<SeriesKey, TimeSeries> fetch(Instant start, Instant stop, Duration aggregateEvery);
}
