package com.yunhwan.catalog.common.exception;

/**
 * 등록된 handler가 없는 command/query 타입. 프로그래밍 오류이므로 재시도 의미 없음.
 */
public class UnhandledTypeException extends RuntimeException {

    public UnhandledTypeException(String kind, Enum<?> type) {
        super("no handler registered. " + kind + "=" + type);
    }
}
