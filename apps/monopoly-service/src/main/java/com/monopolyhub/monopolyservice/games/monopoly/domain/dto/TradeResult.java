package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

import com.monopolyhub.monopolyservice.games.monopoly.domain.model.TradeOffer;

/**
 * 交易处理结果。status: PROPOSED / ACCEPTED / REJECTED。
 */
public record TradeResult(String status, TradeOffer offer, int proposerCash, int counterpartyCash) {
}
