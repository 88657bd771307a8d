package com.monopolyhub.monopolyservice.games.monopoly.domain.enums;

/** 卡牌效果种类（CardResolver 对其穷举分派） */
public enum CardEffectType {

    ADVANCE_TO,              // 前进到指定格子
    MOVE_RELATIVE,           // 相对移动（如后退 3 格）
    NEAREST_RAILROAD,        // 前进到最近的铁路，有主则付双倍租金
    NEAREST_UTILITY,         // 前进到最近的公用事业，有主则付 10 倍骰子点数
    COLLECT,                 // 从银行收款
    PAY,                     // 向银行付款
    PAY_EACH_PLAYER,         // 付给每位玩家
    COLLECT_FROM_EACH_PLAYER,// 向每位玩家收款
    GET_OUT_OF_JAIL_FREE,    // 出狱卡（由玩家持有）
    GO_TO_JAIL,              // 直接入狱
    REPAIRS                  // 按房屋/旅馆数量付维修费
}
