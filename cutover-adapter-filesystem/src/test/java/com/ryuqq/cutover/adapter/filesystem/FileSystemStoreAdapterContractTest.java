package com.ryuqq.cutover.adapter.filesystem;

import com.ryuqq.cutover.core.spi.StoreAdapter;
import com.ryuqq.cutover.testkit.contract.AbstractStoreAdapterContractTest;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

/**
 * Contract Tests for FileSystemStoreAdapter implementation.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class FileSystemStoreAdapterContractTest extends AbstractStoreAdapterContractTest {

    @TempDir
    Path root;

    @Override
    protected StoreAdapter createAdapter() {
        return new FileSystemStoreAdapter("legacy-fs", root);
    }
}
