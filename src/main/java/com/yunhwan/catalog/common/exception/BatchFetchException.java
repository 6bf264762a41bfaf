package com.yunhwan.catalog.common.exception;

/**
 * 배치 fetch 자체가 실패한 경우. 같은 배치에 묶인 모든 호출자에게 전달된다.
 */
public class BatchFetchException extends RuntimeException {

    public BatchFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
