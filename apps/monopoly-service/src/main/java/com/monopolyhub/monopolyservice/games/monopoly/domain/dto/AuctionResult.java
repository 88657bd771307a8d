package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * 一次性密封拍卖的结果。
 * winner 为 null 表示无人有效出价，地产仍归银行。
 * rejectedBids：出价人 -> 被拒原因。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuctionResult(String property,
                            String decliner,
                            String winner,
                            int price,
                            Map<String, Integer> acceptedBids,
                            Map<String, String> rejectedBids,
                            String phase) {

    public boolean sold() {
        return winner != null;
    }
}
