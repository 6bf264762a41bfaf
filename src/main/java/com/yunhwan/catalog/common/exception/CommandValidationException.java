package com.yunhwan.catalog.common.exception;

import java.util.List;

/**
 * command payload가 비즈니스 규칙을 통과하지 못한 경우.
 * 이벤트를 하나도 만들기 전에 던지므로 저장된 것은 없다.
 */
public class CommandValidationException extends RuntimeException {

    private final List<String> violations;

    public CommandValidationException(String message, List<String> violations) {
        super(message + " " + violations);
        this.violations = List.copyOf(violations);
    }

    public CommandValidationException(String violation) {
        this("command rejected.", List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
