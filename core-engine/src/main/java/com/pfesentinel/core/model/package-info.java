/**
 * Domain model shared by the detection engine and the monitor service.
 *
 * <ul>
 * <li>{@link com.pfesentinel.core.model.SeriesKey} identifies a device/slot/exception series</li>
 * <li>{@link com.pfesentinel.core.model.TimeSeries} and {@link com.pfesentinel.core.model.Sample} carry rate data</li>
 * <li>{@link com.pfesentinel.core.model.Detection} is what rules and the outlier model emit</li>
 * <li>{@link com.pfesentinel.core.model.AnalysisReport} is the final ranked result</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.pfesentinel.core.model;
