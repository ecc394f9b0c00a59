/**
 * Statistical baselines for rate series.
 *
 * <p>
 * {@link com.pfesentinel.core.baseline.BaselineManager} is the entry point.
 * Everything it returns is immutable and has a well-defined empty form.
 * </p>
 *
 * @since 1.0.0
 */
package com.pfesentinel.core.baseline;
