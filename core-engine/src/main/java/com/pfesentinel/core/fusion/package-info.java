/**
 * Deduplication, ordering and summary of detections.
 */
package com.pfesentinel.core.fusion;
