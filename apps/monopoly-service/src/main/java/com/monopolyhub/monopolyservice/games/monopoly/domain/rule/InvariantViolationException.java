package com.monopolyhub.monopolyservice.games.monopoly.domain.rule;

/**
 * 内部不变量被破坏（例如建筑数为负、房屋池对不上账）。
 * 这表示引擎缺陷而不是正常的业务错误；触发它的动作会整体回滚。
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super("INVARIANT_VIOLATION: " + message);
    }
}
