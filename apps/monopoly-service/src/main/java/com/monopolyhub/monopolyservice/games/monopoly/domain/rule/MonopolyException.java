package com.monopolyhub.monopolyservice.games.monopoly.domain.rule;

import com.monopolyhub.monopolyservice.games.monopoly.domain.constants.GameMessages;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ErrorKind;
import lombok.Getter;

/**
 * 业务规则异常：可恢复，调用方根据 {@link ErrorKind} 区分处理。
 * 继承 IllegalStateException，上层可以与其它“业务状态冲突”统一映射。
 */
@Getter
public class MonopolyException extends IllegalStateException {

    private final ErrorKind kind;

    public MonopolyException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /** 按 {@link GameMessages} 模板格式化消息 */
    public static MonopolyException of(ErrorKind kind, String template, Object... args) {
        return new MonopolyException(kind, GameMessages.format(template, args));
    }
}
