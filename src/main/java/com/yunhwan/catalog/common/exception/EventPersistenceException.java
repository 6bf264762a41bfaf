package com.yunhwan.catalog.common.exception;

/**
 * 이벤트 저장소가 쓰기를 거부했거나 닿지 않는 경우.
 * 이 예외가 나면 해당 이벤트는 일어나지 않은 것으로 본다.
 */
public class EventPersistenceException extends RuntimeException {

    public EventPersistenceException(String message) {
        super(message);
    }

    public EventPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
