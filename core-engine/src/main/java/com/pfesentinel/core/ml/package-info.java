/**
 * Isolation-forest outlier model over a single rate series.
 */
package com.pfesentinel.core.ml;
