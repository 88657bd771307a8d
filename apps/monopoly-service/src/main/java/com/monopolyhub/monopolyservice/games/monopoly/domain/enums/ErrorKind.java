package com.monopolyhub.monopolyservice.games.monopoly.domain.enums;

/**
 * 业务错误种类。均为可恢复错误：操作失败时会话状态不变。
 */
public enum ErrorKind {

    SESSION_NOT_FOUND,
    SESSION_BUSY,
    GAME_OVER,
    PLAYER_NOT_FOUND,
    NOT_CURRENT_PLAYER,
    INVALID_PHASE,
    INSUFFICIENT_FUNDS,
    PROPERTY_NOT_OWNABLE,
    PROPERTY_ALREADY_OWNED,
    NOT_PROPERTY_OWNER,
    BUILDING_RULE_VIOLATION,
    MORTGAGE_RULE_VIOLATION,
    INVALID_PLAYER_COUNT,
    TRADE_NOT_FOUND,
    INVALID_TRADE
}
