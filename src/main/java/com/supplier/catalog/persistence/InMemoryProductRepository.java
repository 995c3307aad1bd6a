package com.supplier.catalog.persistence;

import com.supplier.catalog.core.exception.DuplicateGtinException;
import com.supplier.catalog.core.model.Product;
import com.supplier.catalog.similarity.BlockingKeyStrategy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory products with a GTIN index and a blocking-key index over normalized names.
 */
public class InMemoryProductRepository extends InMemoryRecords<Product> implements ProductRepository {

    private final BlockingKeyStrategy blockingKeyStrategy;
    private final Map<String, String> gtinIndex = new HashMap<>();
    private final Map<String, Set<String>> blockingIndex = new HashMap<>();

    InMemoryProductRepository(ReentrantLock lock, BlockingKeyStrategy blockingKeyStrategy) {
        super(lock);
        this.blockingKeyStrategy = blockingKeyStrategy;
    }

    @Override
    public Product save(Product product) {
        return locked(() -> {
            if (product.hasGtin()) {
                String owner = gtinIndex.get(product.getGtin());
                if (owner != null && !owner.equals(product.getId())) {
                    throw new DuplicateGtinException(product.getGtin(), owner);
                }
            }
            Product previous = records.get(product.getId());
            if (previous != null) {
                unindex(previous);
            }
            Product stored = product.copy();
            records.put(stored.getId(), stored);
            index(stored);
            return stored.copy();
        });
    }

    @Override
    public Optional<Product> findById(String id) {
        return locked(() -> Optional.ofNullable(records.get(id)).map(Product::copy));
    }

    @Override
    public Optional<Product> findByGtin(String gtin) {
        if (gtin == null) {
            return Optional.empty();
        }
        return locked(() -> Optional.ofNullable(gtinIndex.get(gtin))
                .map(records::get)
                .map(Product::copy));
    }

    @Override
    public List<Product> findByGtins(Collection<String> gtins) {
        return locked(() -> {
            Set<String> ids = new LinkedHashSet<>();
            for (String gtin : gtins) {
                String id = gtinIndex.get(gtin);
                if (id != null) {
                    ids.add(id);
                }
            }
            return ids.stream().map(records::get).map(Product::copy).toList();
        });
    }

    @Override
    public List<Product> findCandidates(Set<String> blockingKeys, int limit) {
        return locked(() -> {
            Map<String, Integer> sharedKeys = new HashMap<>();
            for (String key : blockingKeys) {
                for (String id : blockingIndex.getOrDefault(key, Set.of())) {
                    sharedKeys.merge(id, 1, Integer::sum);
                }
            }
            return sharedKeys.entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                            .thenComparing(Map.Entry.comparingByKey()))
                    .limit(limit)
                    .map(e -> records.get(e.getKey()).copy())
                    .toList();
        });
    }

    @Override
    public long count() {
        return locked(() -> (long) records.size());
    }

    @Override
    protected void reindex() {
        gtinIndex.clear();
        blockingIndex.clear();
        new ArrayList<>(records.values()).forEach(this::index);
    }

    private void index(Product product) {
        if (product.hasGtin()) {
            gtinIndex.put(product.getGtin(), product.getId());
        }
        for (String key : blockingKeyStrategy.generateKeys(product.getNormalizedName())) {
            blockingIndex.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(product.getId());
        }
    }

    private void unindex(Product product) {
        if (product.hasGtin()) {
            gtinIndex.remove(product.getGtin());
        }
        for (String key : blockingKeyStrategy.generateKeys(product.getNormalizedName())) {
            Set<String> ids = blockingIndex.get(key);
            if (ids != null) {
                ids.remove(product.getId());
                if (ids.isEmpty()) {
                    blockingIndex.remove(key);
                }
            }
        }
    }
}
