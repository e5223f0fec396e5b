/**
 * Consumers of anomaly events emitted by detectors.
 */
package com.logsentinel.core.event;
