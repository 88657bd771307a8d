package com.monopolyhub.monopolyservice.games.monopoly.domain.enums;

/** 落地时的租金计算方式：普通落地，或由“最近铁路/最近公用事业”卡牌带来的特殊倍率 */
public enum RentMode {

    STANDARD,
    CARD_RAILROAD_DOUBLE,
    CARD_UTILITY_TEN_TIMES
}
