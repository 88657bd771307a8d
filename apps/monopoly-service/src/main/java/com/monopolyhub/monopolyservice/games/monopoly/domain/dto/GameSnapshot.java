package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.BoardCatalog;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.TradeOffer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 对局的只读全量快照（不暴露可变内部状态）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GameSnapshot(String gameId,
                           long createdAt,
                           List<PlayerView> players,
                           String currentPlayer,
                           String phase,
                           int doublesStreak,
                           List<Integer> lastDice,
                           String pendingPurchase,
                           TradeOffer pendingTrade,
                           int housesRemaining,
                           int hotelsRemaining,
                           boolean gameOver,
                           String winner) {

    public static GameSnapshot of(String gameId, long createdAt, MonopolyState s) {
        return new GameSnapshot(
                gameId,
                createdAt,
                s.getPlayers().stream().map(p -> PlayerView.of(s.getLedger(), p)).collect(Collectors.toList()),
                s.current().getName(),
                s.getPhase().name(),
                s.getDoublesStreak(),
                s.getLastRoll() == null ? null : List.of(s.getLastRoll().first(), s.getLastRoll().second()),
                s.getPendingPurchase() == null ? null : BoardCatalog.space(s.getPendingPurchase()).name(),
                s.getPendingTrade() == null ? null : s.getPendingTrade().copy(),
                s.getLedger().housesRemaining(),
                s.getLedger().hotelsRemaining(),
                s.isOver(),
                s.getWinner());
    }
}
