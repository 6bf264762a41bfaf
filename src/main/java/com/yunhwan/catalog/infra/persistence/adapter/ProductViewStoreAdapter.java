package com.yunhwan.catalog.infra.persistence.adapter;

import com.yunhwan.catalog.domain.product.ProductView;
import com.yunhwan.catalog.infra.persistence.entity.ProductViewEntity;
import com.yunhwan.catalog.infra.persistence.jpa.ProductViewJpaRepository;
import com.yunhwan.catalog.infra.serialization.JacksonEventPayloadSerializer;
import com.yunhwan.catalog.usecase.projection.port.ProductViewStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Transactional
public class ProductViewStoreAdapter implements ProductViewStore {

    private final ProductViewJpaRepository repo;
    private final JacksonEventPayloadSerializer serializer;

    @Override
    @Transactional(readOnly = true)
    public Optional<ProductView> findById(String productId) {
        return repo.findById(productId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProductView> findAllBySkus(Collection<String> skus) {
        if (skus.isEmpty()) return List.of();
        return repo.findBySkuIn(skus).stream().map(this::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProductView> findByCollection(String collection, int limit, int offset) {
        return repo.findPageByCollection(collection, limit, offset).stream().map(this::toDomain).toList();
    }

    @Override
    public ProductView save(ProductView view) {
        return toDomain(repo.save(toEntity(view)));
    }

    @Override
    public void deleteById(String productId) {
        repo.findById(productId).ifPresent(repo::delete);
    }

    private ProductViewEntity toEntity(ProductView v) {
        return ProductViewEntity.of(
                v.productId(),
                v.sku(),
                v.name(),
                v.price(),
                v.comparePrice(),
                v.description(),
                v.collection(),
                serializer.serializeStrings(v.images()),
                v.inventory(),
                v.deleted(),
                v.version(),
                v.updatedAt()
        );
    }

    private ProductView toDomain(ProductViewEntity e) {
        return new ProductView(
                e.getProductId(),
                e.getSku(),
                e.getName(),
                e.getPrice(),
                e.getComparePrice(),
                e.getDescription(),
                e.getCollection(),
                serializer.deserializeStrings(e.getImages()),
                e.getInventory(),
                e.isDeleted(),
                e.getVersion(),
                e.getUpdatedAt()
        );
    }
}
