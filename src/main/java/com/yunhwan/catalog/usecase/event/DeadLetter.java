package com.yunhwan.catalog.usecase.event;

import com.yunhwan.catalog.domain.event.DomainEvent;

import java.time.OffsetDateTime;

/**
 * 이미 저장된 이벤트를 handler가 처리하지 못한 기록. 운영자가 확인 후 재전달한다.
 */
public record DeadLetter(
        DomainEvent event,
        String handlerName,
        String errorType,
        String errorMessage,
        OffsetDateTime failedAt
) {
}
