package com.supplier.catalog.persistence;

import com.supplier.catalog.core.model.Product;
import com.supplier.catalog.core.model.ProductAsset;
import com.supplier.catalog.core.model.SupplierItem;
import com.supplier.catalog.similarity.BlockingKeyStrategy;
import com.supplier.catalog.similarity.TokenBlockingKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory implementation of all persistence contracts, suitable for tests and
 * single-JVM deployments.
 *
 * <p>Transactions cover products, supplier items and product assets. They hold one
 * reentrant lock for their whole duration; the outermost transaction takes a
 * snapshot of those three record sets and restores it if the work throws.
 * Upload records and asset jobs are written immediately and never rolled back.</p>
 */
public class InMemoryCatalogStore implements TransactionManager {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final InMemoryProductRepository products;
    private final InMemorySupplierItemRepository supplierItems;
    private final InMemoryProductAssetRepository productAssets;
    private final InMemoryCatalogUploadRepository uploads = new InMemoryCatalogUploadRepository();
    private final InMemoryAssetJobRepository assetJobs = new InMemoryAssetJobRepository();

    public InMemoryCatalogStore() {
        this(new TokenBlockingKeyStrategy());
    }

    public InMemoryCatalogStore(BlockingKeyStrategy blockingKeyStrategy) {
        this.products = new InMemoryProductRepository(lock, blockingKeyStrategy);
        this.supplierItems = new InMemorySupplierItemRepository(lock);
        this.productAssets = new InMemoryProductAssetRepository(lock);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                return work.get();
            }
            Snapshot snapshot = new Snapshot(products.snapshot(), supplierItems.snapshot(), productAssets.snapshot());
            try {
                return work.get();
            } catch (RuntimeException | Error e) {
                products.restore(snapshot.products());
                supplierItems.restore(snapshot.supplierItems());
                productAssets.restore(snapshot.productAssets());
                log.debug("transaction.rolledBack error={}", e.toString());
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    public ProductRepository products() {
        return products;
    }

    public SupplierItemRepository supplierItems() {
        return supplierItems;
    }

    public ProductAssetRepository productAssets() {
        return productAssets;
    }

    public CatalogUploadRepository uploads() {
        return uploads;
    }

    public AssetJobRepository assetJobs() {
        return assetJobs;
    }

    private record Snapshot(
            Map<String, Product> products,
            Map<String, SupplierItem> supplierItems,
            Map<String, ProductAsset> productAssets
    ) {}
}
