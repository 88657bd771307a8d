package com.monopolyhub.monopolyservice.games.monopoly.domain.enums;

/**
 * 回合阶段（显式状态机）：
 * AWAITING_ACTION -> (roll) -> MOVED -> AWAITING_ACTION | AWAITING_PURCHASE_DECISION | TURN_END
 */
public enum TurnPhase {

    AWAITING_ACTION,            // 等待掷骰（或狱中的缴费/用卡）
    MOVED,                      // 已移动，正在结算落点（仅在单次调用内部出现）
    AWAITING_PURCHASE_DECISION, // 落在无主地产上，等待 buy / decline
    TURN_END                    // 本回合结束，等待 endTurn 交给下一位
}
