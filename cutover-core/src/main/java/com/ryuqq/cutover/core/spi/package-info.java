/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the store contract that infrastructure adapters implement,
 * together with the failure taxonomy shared by every layer above it.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cutover.core.spi.StoreAdapter} - get/put/query over one physical backend</li>
 * </ul>
 *
 * <h2>Failure Taxonomy</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cutover.core.spi.VersionConflictException} - expected version did not hold</li>
 *   <li>{@link com.ryuqq.cutover.core.spi.TransientStoreException} - retriable, adapter-internal</li>
 *   <li>{@link com.ryuqq.cutover.core.spi.StoreUnavailableException} - retries exhausted</li>
 *   <li>{@link com.ryuqq.cutover.core.spi.RecordValidationException} - malformed document or broken reference</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (cutover-adapter-inmemory, cutover-adapter-filesystem) provide
 * concrete implementations. Backend client libraries never leak past them.</p>
 *
 * @since 1.0.0
 * @author Cutover Team
 */
package com.ryuqq.cutover.core.spi;
