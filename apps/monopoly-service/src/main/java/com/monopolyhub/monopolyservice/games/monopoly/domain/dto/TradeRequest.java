package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** 发起交易的请求体：给出什么、想要什么 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRequest {

    @Builder.Default
    private List<String> giveProperties = new ArrayList<>();
    private int giveCash;
    private int giveJailCards;

    @Builder.Default
    private List<String> requestProperties = new ArrayList<>();
    private int requestCash;
    private int requestJailCards;
}
