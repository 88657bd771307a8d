package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 交易报价：proposer 给出 give*，换取 counterparty 的 request*。
 * 被接受前只是一份待处理的提议，不占用任何资产。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TradeOffer {

    private String tradeId;
    private String proposer;
    private String counterparty;

    @Builder.Default
    private List<String> giveProperties = new ArrayList<>();
    private int giveCash;
    private int giveJailCards;

    @Builder.Default
    private List<String> requestProperties = new ArrayList<>();
    private int requestCash;
    private int requestJailCards;

    public boolean isEmpty() {
        return giveProperties.isEmpty() && requestProperties.isEmpty()
                && giveCash == 0 && requestCash == 0
                && giveJailCards == 0 && requestJailCards == 0;
    }

    public boolean involves(String playerName) {
        return playerName.equals(proposer) || playerName.equals(counterparty);
    }

    public TradeOffer copy() {
        return toBuilder()
                .giveProperties(new ArrayList<>(giveProperties))
                .requestProperties(new ArrayList<>(requestProperties))
                .build();
    }
}
