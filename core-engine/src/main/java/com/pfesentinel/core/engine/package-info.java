/**
 * Analysis entry point, the rate-series ingress seam and dashboard links.
 */
package com.pfesentinel.core.engine;
