/**
 * File-backed Store adapter.
 *
 * <p>One JSON envelope file per record, written with temp-then-rename. Stands in for the
 * blob-style legacy store and for the local emulator of the primary table store.</p>
 *
 * @see com.ryuqq.cutover.core.spi.StoreAdapter
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.adapter.filesystem;
