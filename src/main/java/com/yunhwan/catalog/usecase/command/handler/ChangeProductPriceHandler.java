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
import java.util.List;
import java.util.Map;

import static com.yunhwan.catalog.domain.product.ProductFields.*;

@Component
@RequiredArgsConstructor
public class ChangeProductPriceHandler implements CommandHandler {

    private final ProductAggregateReader aggregateReader;
    private final Clock clock;

    @Override
    public List<DomainEvent> handle(Command command) {
        ProductCommandRules.of(command)
                .productId()
                .price(NEW_PRICE)
                .validate();

        String productId = (String) command.payload().get(PRODUCT_ID);
        int version = aggregateReader.nextVersionOfLive(productId);

        return List.of(DomainEvent.create(
                EventType.PRODUCT_PRICE_CHANGED,
                productId,
                AGGREGATE_TYPE,
                EventPayload.of(Map.of(NEW_PRICE, Prices.normalize((Number) command.payload().get(NEW_PRICE)))),
                version,
                command.userId(),
                command.correlationId(),
                clock
        ));
    }
}
