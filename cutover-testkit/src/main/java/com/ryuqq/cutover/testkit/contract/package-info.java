/**
 * Contract tests shared by every {@link com.ryuqq.cutover.core.spi.StoreAdapter} implementation.
 *
 * <p>Adapter modules extend {@link com.ryuqq.cutover.testkit.contract.AbstractStoreAdapterContractTest}
 * from their test sources to prove they honour the version-token protocol.</p>
 *
 * @since 1.0.0
 * @author Cutover Team
 */
package com.ryuqq.cutover.testkit.contract;
