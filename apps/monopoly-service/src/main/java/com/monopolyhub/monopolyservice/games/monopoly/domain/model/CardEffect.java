package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.CardEffectType;

/**
 * 卡牌效果：type 决定语义，其余字段是按类型使用的载荷。
 * - amount：金额（COLLECT/PAY/...）或步数（MOVE_RELATIVE，负数表示后退）；
 * - target：ADVANCE_TO 的目标位置；
 * - perHouse/perHotel：REPAIRS 的单价；
 * - collectGo：前进类卡牌经过起点时是否领薪水。
 */
public record CardEffect(CardEffectType type,
                         int amount,
                         int target,
                         int perHouse,
                         int perHotel,
                         boolean collectGo) {

    public static CardEffect advanceTo(int target) {
        return new CardEffect(CardEffectType.ADVANCE_TO, 0, target, 0, 0, true);
    }

    public static CardEffect moveRelative(int steps) {
        return new CardEffect(CardEffectType.MOVE_RELATIVE, steps, 0, 0, 0, false);
    }

    public static CardEffect nearestRailroad() {
        return new CardEffect(CardEffectType.NEAREST_RAILROAD, 0, 0, 0, 0, true);
    }

    public static CardEffect nearestUtility() {
        return new CardEffect(CardEffectType.NEAREST_UTILITY, 0, 0, 0, 0, true);
    }

    public static CardEffect collect(int amount) {
        return new CardEffect(CardEffectType.COLLECT, amount, 0, 0, 0, false);
    }

    public static CardEffect pay(int amount) {
        return new CardEffect(CardEffectType.PAY, amount, 0, 0, 0, false);
    }

    public static CardEffect payEachPlayer(int amount) {
        return new CardEffect(CardEffectType.PAY_EACH_PLAYER, amount, 0, 0, 0, false);
    }

    public static CardEffect collectFromEachPlayer(int amount) {
        return new CardEffect(CardEffectType.COLLECT_FROM_EACH_PLAYER, amount, 0, 0, 0, false);
    }

    public static CardEffect getOutOfJailFree() {
        return new CardEffect(CardEffectType.GET_OUT_OF_JAIL_FREE, 0, 0, 0, 0, false);
    }

    public static CardEffect goToJail() {
        return new CardEffect(CardEffectType.GO_TO_JAIL, 0, 0, 0, 0, false);
    }

    public static CardEffect repairs(int perHouse, int perHotel) {
        return new CardEffect(CardEffectType.REPAIRS, 0, 0, perHouse, perHotel, false);
    }
}
