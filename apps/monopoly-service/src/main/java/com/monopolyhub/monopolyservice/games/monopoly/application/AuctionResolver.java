package com.monopolyhub.monopolyservice.games.monopoly.application;

import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.AuctionResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.GameSettings;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次性密封拍卖：每位在局玩家至多一个出价，最高有效出价者向银行付款得地。
 * 平局时按从放弃者开始的行动顺序，先出价者胜。出价 0 视为放弃。
 */
public class AuctionResolver {

    static final String REJECT_UNKNOWN = "UNKNOWN_PLAYER";
    static final String REJECT_BANKRUPT = "BANKRUPT";
    static final String REJECT_BELOW_MIN = "BELOW_MIN_BID";
    static final String REJECT_ABOVE_CASH = "ABOVE_CASH";

    private final GameSettings settings;

    public AuctionResolver(GameSettings settings) {
        this.settings = settings;
    }

    /**
     * @param bids 出价人 -> 金额；可以为 null 或空（无人出价）
     */
    public AuctionResult resolve(MonopolyState state, Player decliner, Deed deed, Map<String, Integer> bids) {
        Map<String, Integer> accepted = new LinkedHashMap<>();
        Map<String, String> rejected = new LinkedHashMap<>();
        Map<String, Integer> offered = bids == null ? Map.of() : bids;

        for (String name : offered.keySet()) {
            if (state.getPlayers().stream().noneMatch(p -> p.getName().equals(name))) {
                rejected.put(name, REJECT_UNKNOWN);
            }
        }

        Player winner = null;
        int best = 0;
        for (Player bidder : biddingOrder(state, decliner)) {
            Integer amount = offered.get(bidder.getName());
            if (amount == null || amount == 0) {
                continue;
            }
            if (bidder.isBankrupt()) {
                rejected.put(bidder.getName(), REJECT_BANKRUPT);
            } else if (amount < settings.getAuctionMinBid()) {
                rejected.put(bidder.getName(), REJECT_BELOW_MIN);
            } else if (amount > bidder.getCash()) {
                rejected.put(bidder.getName(), REJECT_ABOVE_CASH);
            } else {
                accepted.put(bidder.getName(), amount);
                // 严格大于：平局保留先出价者
                if (amount > best) {
                    best = amount;
                    winner = bidder;
                }
            }
        }

        if (winner != null) {
            state.getLedger().debit(winner, best);
            state.getLedger().assign(deed, winner.getName());
        }
        return new AuctionResult(deed.space().name(), decliner.getName(),
                winner == null ? null : winner.getName(), winner == null ? 0 : best,
                accepted, rejected, null);
    }

    /** 从放弃者开始按行动顺序排列全部玩家 */
    private static List<Player> biddingOrder(MonopolyState state, Player decliner) {
        List<Player> players = state.getPlayers();
        int start = players.indexOf(decliner);
        int n = players.size();
        Player[] ordered = new Player[n];
        for (int i = 0; i < n; i++) {
            ordered[i] = players.get((start + i) % n);
        }
        return List.of(ordered);
    }
}
