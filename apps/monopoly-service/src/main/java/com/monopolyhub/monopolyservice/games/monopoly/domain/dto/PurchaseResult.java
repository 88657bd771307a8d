package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

/** 购买结果 */
public record PurchaseResult(boolean success,
                             String player,
                             String property,
                             int price,
                             int remainingCash,
                             String phase) {
}
