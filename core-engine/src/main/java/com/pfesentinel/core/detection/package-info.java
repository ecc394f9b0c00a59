/**
 * Rule engine: stateless detection rules evaluated over one
 * {@link com.pfesentinel.core.detection.RuleContext}.
 */
package com.pfesentinel.core.detection;
