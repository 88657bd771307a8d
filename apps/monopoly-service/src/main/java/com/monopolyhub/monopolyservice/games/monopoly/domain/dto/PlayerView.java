package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

import com.monopolyhub.monopolyservice.games.monopoly.domain.model.BoardCatalog;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Ledger;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;

import java.util.List;
import java.util.stream.Collectors;

/** 玩家只读视图 */
public record PlayerView(String name,
                         int cash,
                         int position,
                         String space,
                         boolean inJail,
                         int jailTurns,
                         int jailCards,
                         boolean bankrupt,
                         List<String> properties,
                         int netWorth) {

    public static PlayerView of(Ledger ledger, Player p) {
        List<Deed> deeds = ledger.deedsOf(p.getName());
        // 总资产 = 现金 + 地产售价 + 建筑造价（与抵押无关）
        int netWorth = p.getCash() + deeds.stream()
                .mapToInt(d -> d.space().price() + d.getBuildings() * d.space().houseCost())
                .sum();
        return new PlayerView(
                p.getName(),
                p.getCash(),
                p.getPosition(),
                BoardCatalog.space(p.getPosition()).name(),
                p.isInJail(),
                p.getJailTurns(),
                p.jailCardCount(),
                p.isBankrupt(),
                deeds.stream().map(d -> d.space().name()).collect(Collectors.toList()),
                netWorth);
    }
}
