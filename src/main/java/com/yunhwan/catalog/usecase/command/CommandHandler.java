package com.yunhwan.catalog.usecase.command;

import com.yunhwan.catalog.domain.command.Command;
import com.yunhwan.catalog.domain.event.DomainEvent;

import java.util.List;

/**
 * command 하나를 검증해 이벤트로 바꾼다. 저장은 하지 않는다 (bus가 한다).
 *
 * @throws com.yunhwan.catalog.common.exception.CommandValidationException 규칙 위반 시. 위반 항목 전부를 담는다.
 */
@FunctionalInterface
public interface CommandHandler {

    List<DomainEvent> handle(Command command);
}
