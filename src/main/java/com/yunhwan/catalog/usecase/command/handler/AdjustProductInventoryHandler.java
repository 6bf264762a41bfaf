package com.yunhwan.catalog.usecase.command.handler;

import com.yunhwan.catalog.domain.command.Command;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.domain.event.EventPayload;
import com.yunhwan.catalog.domain.event.EventType;
import com.yunhwan.catalog.usecase.command.CommandHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static com.yunhwan.catalog.domain.product.ProductFields.*;

@Component
@RequiredArgsConstructor
public class AdjustProductInventoryHandler implements CommandHandler {

    private final ProductAggregateReader aggregateReader;
    private final Clock clock;

    @Override
    public List<DomainEvent> handle(Command command) {
        ProductCommandRules.of(command)
                .productId()
                .nonNegativeInteger(NEW_QUANTITY, true)
                .validate();

        String productId = (String) command.payload().get(PRODUCT_ID);
        int version = aggregateReader.nextVersionOfLive(productId);
        int quantity = ProductCommandRules.toInt(command.payload().get(NEW_QUANTITY));

        return List.of(DomainEvent.create(
                EventType.PRODUCT_INVENTORY_CHANGED,
                productId,
                AGGREGATE_TYPE,
                EventPayload.of(Map.of(NEW_QUANTITY, quantity)),
                version,
                command.userId(),
                command.correlationId(),
                clock
        ));
    }
}
