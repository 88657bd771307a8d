package com.monopolyhub.monopolyservice.games.monopoly.domain.rule;

import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.SpaceKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Ledger;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Space;

/**
 * 租金规则（纯函数：只依赖账本状态与骰子点数）。
 * - 地产：空地基础租金，持有整组且整组无建筑时翻倍；有建筑按表定租金；
 * - 铁路：25 × 2^(持有数 - 1)；
 * - 公用事业：持有 1 个 = 点数 × 4，持有 2 个 = 点数 × 10；
 * - 无主或已抵押：0。
 */
public final class RentCalculator {

    /** 铁路基础租金 */
    public static final int RAILROAD_BASE_RENT = 25;

    private RentCalculator() {
    }

    public static int rent(Ledger ledger, Deed deed, int diceTotal) {
        String owner = deed.getOwner();
        if (owner == null || deed.isMortgaged()) {
            return 0;
        }
        Space space = deed.space();
        return switch (space.kind()) {
            case PROPERTY -> propertyRent(ledger, deed, space);
            case RAILROAD -> railroadRent(ledger.countOwned(owner, SpaceKind.RAILROAD));
            case UTILITY -> diceTotal * (ledger.countOwned(owner, SpaceKind.UTILITY) >= 2 ? 10 : 4);
            case GO, TAX, CHANCE, COMMUNITY_CHEST, JAIL, GO_TO_JAIL, FREE_PARKING -> 0;
        };
    }

    /** “最近铁路”卡：两倍表定租金 */
    public static int railroadCardRent(Ledger ledger, Deed deed) {
        return 2 * rent(ledger, deed, 0);
    }

    /** “最近公用事业”卡：重新掷骰点数 × 10（与持有数量无关） */
    public static int utilityCardRent(Deed deed, int diceTotal) {
        if (deed.getOwner() == null || deed.isMortgaged()) {
            return 0;
        }
        return diceTotal * 10;
    }

    public static int railroadRent(int owned) {
        if (owned <= 0) return 0;
        return RAILROAD_BASE_RENT * (1 << (owned - 1));
    }

    private static int propertyRent(Ledger ledger, Deed deed, Space space) {
        int buildings = deed.getBuildings();
        if (buildings > 0) {
            return space.rentAt(buildings);
        }
        boolean monopoly = ledger.ownsGroup(deed.getOwner(), space.color());
        return monopoly ? space.rentAt(0) * 2 : space.rentAt(0);
    }
}
