package com.yunhwan.catalog.usecase.projection.port;

import com.yunhwan.catalog.domain.product.ProductView;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProductViewStore {

    Optional<ProductView> findById(String productId);

    /** deleted 포함. 걸러내는 것은 호출자 몫 */
    List<ProductView> findAllBySkus(Collection<String> skus);

    /** deleted 제외, sku 오름차순 */
    List<ProductView> findByCollection(String collection, int limit, int offset);

    /** productId 기준 upsert */
    ProductView save(ProductView view);

    void deleteById(String productId);
}
