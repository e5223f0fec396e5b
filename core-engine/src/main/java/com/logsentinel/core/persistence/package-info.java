/**
 * Storage of detector state between runs.
 *
 * <p>
 * Detectors write their state through the
 * {@link com.logsentinel.core.persistence.PersistenceStore} abstraction;
 * {@link com.logsentinel.core.persistence.JsonFilePersistenceStore} is the
 * file-based implementation used in production.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.persistence;
