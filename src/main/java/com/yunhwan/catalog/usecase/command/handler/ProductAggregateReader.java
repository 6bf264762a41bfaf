package com.yunhwan.catalog.usecase.command.handler;

import com.yunhwan.catalog.common.exception.CommandValidationException;
import com.yunhwan.catalog.usecase.event.EventStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.yunhwan.catalog.domain.product.ProductFields.DELETED;

/**
 * 쓰기 경로에서 aggregate 상태를 이벤트 재생으로 확인한다. (projection은 읽지 않는다)
 */
@Component
@RequiredArgsConstructor
public class ProductAggregateReader {

    private final EventStore eventStore;

    /**
     * 살아 있는 aggregate의 다음 version. 없거나 삭제된 경우 검증 실패.
     */
    public int nextVersionOfLive(String productId) {
        Map<String, Object> state = eventStore.replay(productId);
        if (state.isEmpty()) {
            throw new CommandValidationException("productId: not found " + productId);
        }
        if (Boolean.TRUE.equals(state.get(DELETED))) {
            throw new CommandValidationException("productId: already deleted " + productId);
        }
        return eventStore.currentVersion(productId) + 1;
    }
}
