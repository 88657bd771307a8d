package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

/**
 * 资产管理动作（抵押/赎回/建房/拆房）的结果。
 * amount 为正表示玩家收到的钱，为负表示支付的钱。
 */
public record ManagementResult(String player,
                               String property,
                               String action,
                               int amount,
                               int cash,
                               int buildings,
                               boolean mortgaged,
                               int housesRemaining,
                               int hotelsRemaining) {
}
