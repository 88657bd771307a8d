package com.monopolyhub.monopolyservice.games.monopoly.domain.enums;

/** 棋盘格子类型（闭合枚举，落地/租金逻辑按它穷举分派） */
public enum SpaceKind {

    GO,
    PROPERTY,
    RAILROAD,
    UTILITY,
    TAX,
    CHANCE,
    COMMUNITY_CHEST,
    JAIL,
    GO_TO_JAIL,
    FREE_PARKING;

    /** 是否可被玩家持有（地产/铁路/公用事业） */
    public boolean ownable() {
        return this == PROPERTY || this == RAILROAD || this == UTILITY;
    }
}
