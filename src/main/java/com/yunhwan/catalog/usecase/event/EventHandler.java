package com.yunhwan.catalog.usecase.event;

import com.yunhwan.catalog.domain.event.DomainEvent;

public interface EventHandler {

    void handle(DomainEvent event);

    /** dead letter에 남길 handler 식별자 */
    default String name() {
        return getClass().getSimpleName();
    }
}
