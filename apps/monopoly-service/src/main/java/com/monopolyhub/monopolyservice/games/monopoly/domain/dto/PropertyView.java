package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.SpaceKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Ledger;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Space;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.RentCalculator;

/**
 * 单块地产的详情：颜色、售价、建筑、抵押状态、当前租金、是否垄断。
 * monopoly 只对普通地产有意义，铁路/公用事业为 null。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertyView(String name,
                           int position,
                           String kind,
                           String color,
                           int price,
                           int buildings,
                           boolean hotel,
                           boolean mortgaged,
                           int mortgageValue,
                           int rent,
                           Boolean monopoly) {

    public static PropertyView of(Ledger ledger, Deed deed, int diceTotal) {
        Space s = deed.space();
        Boolean monopoly = null;
        if (s.kind() == SpaceKind.PROPERTY && deed.getOwner() != null) {
            monopoly = ledger.ownsGroup(deed.getOwner(), s.color());
        }
        return new PropertyView(
                s.name(),
                s.index(),
                s.kind().name(),
                s.color() == null ? s.kind().name() : s.color().name(),
                s.price(),
                deed.getBuildings(),
                deed.hasHotel(),
                deed.isMortgaged(),
                s.mortgageValue(),
                RentCalculator.rent(ledger, deed, diceTotal),
                monopoly);
    }
}
