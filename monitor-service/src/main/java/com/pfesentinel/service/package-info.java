/**
 * HTTP monitor service: exposes the analysis engine over {@code POST /analyze}
 * together with health and readiness probes.
 *
 * <p>
 * The service is stateless; each request carries the series to analyse and
 * gets its own engine instance.
 * </p>
 */
package com.pfesentinel.service;
