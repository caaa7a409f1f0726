/**
 * In-memory Store adapter implementation package.
 *
 * <p>This package provides the reference implementation of the
 * {@link com.ryuqq.cutover.core.spi.StoreAdapter} SPI used by tests and by local runs
 * that need no persistent backend.</p>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> per-key check-and-set through
 *       {@link java.util.concurrent.ConcurrentHashMap#compute}</li>
 *   <li><strong>Ordering:</strong> query results sorted by record key</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.cutover.core.spi.StoreAdapter
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.adapter.inmemory.store;
