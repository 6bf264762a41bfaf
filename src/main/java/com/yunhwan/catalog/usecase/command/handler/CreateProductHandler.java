package com.yunhwan.catalog.usecase.command.handler;

import com.yunhwan.catalog.domain.command.Command;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.domain.event.EventPayload;
import com.yunhwan.catalog.domain.event.EventType;
import com.yunhwan.catalog.domain.product.Prices;
import com.yunhwan.catalog.usecase.command.CommandHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.yunhwan.catalog.domain.product.ProductFields.*;

@Component
@RequiredArgsConstructor
public class CreateProductHandler implements CommandHandler {

    private final Clock clock;

    @Override
    public List<DomainEvent> handle(Command command) {
        ProductCommandRules.of(command)
                .sku()
                .name()
                .price(PRICE)
                .optionalNonNegativeNumber(COMPARE_PRICE)
                .optionalMaxLength(DESCRIPTION, ProductCommandRules.DESCRIPTION_MAX)
                .optionalImages()
                .optionalMaxLength(COLLECTION, ProductCommandRules.COLLECTION_MAX)
                .nonNegativeInteger(INVENTORY, false)
                .validate();

        Map<String, Object> in = command.payload();
        String productId = UUID.randomUUID().toString();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PRODUCT_ID, productId);
        payload.put(SKU, in.get(SKU));
        payload.put(NAME, ((String) in.get(NAME)).trim());
        payload.put(PRICE, Prices.normalize((Number) in.get(PRICE)));
        payload.put(COMPARE_PRICE, Prices.normalize((Number) in.get(COMPARE_PRICE)));
        payload.put(DESCRIPTION, in.get(DESCRIPTION));
        payload.put(COLLECTION, in.get(COLLECTION));
        payload.put(IMAGES, in.get(IMAGES) == null
                ? List.of()
                : ((Collection<?>) in.get(IMAGES)).stream().map(String::valueOf).toList());
        payload.put(INVENTORY, in.get(INVENTORY) == null ? 0 : ProductCommandRules.toInt(in.get(INVENTORY)));

        return List.of(DomainEvent.create(
                EventType.PRODUCT_CREATED,
                productId,
                AGGREGATE_TYPE,
                EventPayload.of(payload),
                1,
                command.userId(),
                command.correlationId(),
                clock
        ));
    }
}
