package com.yunhwan.catalog.infra.persistence.jpa;

import com.yunhwan.catalog.infra.persistence.entity.ProductViewEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ProductViewJpaRepository extends JpaRepository<ProductViewEntity, String> {

    List<ProductViewEntity> findBySkuIn(Collection<String> skus);

    @Query(value = """
            SELECT *
              FROM product_view
             WHERE collection = :collection
               AND deleted = false
             ORDER BY sku ASC, product_id ASC
             LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<ProductViewEntity> findPageByCollection(
            @Param("collection") String collection,
            @Param("limit") int limit,
            @Param("offset") int offset
    );
}
