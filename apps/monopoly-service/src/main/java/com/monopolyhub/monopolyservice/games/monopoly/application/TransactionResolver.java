package com.monopolyhub.monopolyservice.games.monopoly.application;

import com.monopolyhub.monopolyservice.games.monopoly.domain.constants.GameMessages;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.AuctionResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.ManagementResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.PurchaseResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ErrorKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.SpaceKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.TurnPhase;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.BoardCatalog;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Ledger;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Space;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.MonopolyException;

import java.util.Map;

/**
 * 交易类操作：购买/放弃（拍卖）、抵押/赎回、建房/拆房。
 * 每个方法先完成全部校验，再修改状态。
 */
public class TransactionResolver {

    /** 赎回手续费：抵押价的 10% */
    static final int UNMORTGAGE_PERCENT = 110;
    /** 旅馆造价 = 4 × 房屋造价 */
    static final int HOTEL_COST_MULTIPLIER = 4;

    private final TurnEngine turns;
    private final AuctionResolver auctions;

    public TransactionResolver(TurnEngine turns, AuctionResolver auctions) {
        this.turns = turns;
        this.auctions = auctions;
    }

    // ---------------- 购买 / 放弃 ----------------

    public PurchaseResult buy(MonopolyState state, String playerName, String propertyName) {
        Player player = requirePurchaseDecision(state, playerName, "buy");
        Deed deed = requirePendingDeed(state, player, propertyName);
        int price = deed.space().price();
        if (player.getCash() < price) {
            throw MonopolyException.of(ErrorKind.INSUFFICIENT_FUNDS, GameMessages.INSUFFICIENT_FUNDS,
                    player.getName(), price, player.getCash());
        }
        state.getLedger().debit(player, price);
        state.getLedger().assign(deed, player.getName());
        closePurchase(state);
        return new PurchaseResult(true, player.getName(), deed.space().name(), price, player.getCash(), state.getPhase().name());
    }

    /** 放弃购买并立即以给定出价拍卖 */
    public AuctionResult decline(MonopolyState state, String playerName, String propertyName, Map<String, Integer> bids) {
        Player player = requirePurchaseDecision(state, playerName, "decline");
        Deed deed = requirePendingDeed(state, player, propertyName);
        AuctionResult auction = auctions.resolve(state, player, deed, bids);
        closePurchase(state);
        return new AuctionResult(auction.property(), auction.decliner(), auction.winner(), auction.price(),
                auction.acceptedBids(), auction.rejectedBids(), state.getPhase().name());
    }

    private Player requirePurchaseDecision(MonopolyState state, String playerName, String action) {
        state.requireNotOver();
        Player player = state.requireCurrent(playerName);
        state.requirePhase(TurnPhase.AWAITING_PURCHASE_DECISION, action);
        return player;
    }

    private Deed requirePendingDeed(MonopolyState state, Player player, String propertyName) {
        Space space = requireOwnable(propertyName);
        Integer pending = state.getPendingPurchase();
        if (pending == null || pending != space.index() || player.getPosition() != space.index()) {
            throw MonopolyException.of(ErrorKind.INVALID_PHASE, GameMessages.NOT_ON_PROPERTY, player.getName(), space.name());
        }
        Deed deed = state.getLedger().deed(space.index());
        if (deed.getOwner() != null) {
            throw MonopolyException.of(ErrorKind.PROPERTY_ALREADY_OWNED, GameMessages.PROPERTY_ALREADY_OWNED,
                    space.name(), deed.getOwner());
        }
        return deed;
    }

    private void closePurchase(MonopolyState state) {
        state.setPendingPurchase(null);
        state.setPhase(turns.afterResolution(state));
    }

    // ---------------- 抵押 / 赎回 ----------------

    public ManagementResult mortgage(MonopolyState state, String playerName, String propertyName) {
        Player player = requireManager(state, playerName, "mortgage");
        Deed deed = requireOwnedDeed(state, player, propertyName);
        Space space = deed.space();
        if (deed.isMortgaged()) {
            throw MonopolyException.of(ErrorKind.MORTGAGE_RULE_VIOLATION, GameMessages.ALREADY_MORTGAGED, space.name());
        }
        if (space.kind() == SpaceKind.PROPERTY && state.getLedger().groupHasBuildings(space.color())) {
            throw MonopolyException.of(ErrorKind.MORTGAGE_RULE_VIOLATION, GameMessages.GROUP_HAS_BUILDINGS, space.color());
        }
        int value = space.mortgageValue();
        state.getLedger().credit(player, value);
        deed.setMortgaged(true);
        return result(state, player, deed, "mortgage", value);
    }

    public ManagementResult unmortgage(MonopolyState state, String playerName, String propertyName) {
        Player player = requireManager(state, playerName, "unmortgage");
        Deed deed = requireOwnedDeed(state, player, propertyName);
        if (!deed.isMortgaged()) {
            throw MonopolyException.of(ErrorKind.MORTGAGE_RULE_VIOLATION, GameMessages.NOT_MORTGAGED, deed.space().name());
        }
        int cost = unmortgageCost(deed.space());
        if (player.getCash() < cost) {
            throw MonopolyException.of(ErrorKind.INSUFFICIENT_FUNDS, GameMessages.INSUFFICIENT_FUNDS,
                    player.getName(), cost, player.getCash());
        }
        state.getLedger().debit(player, cost);
        deed.setMortgaged(false);
        return result(state, player, deed, "unmortgage", -cost);
    }

    public static int unmortgageCost(Space space) {
        return space.mortgageValue() * UNMORTGAGE_PERCENT / 100;
    }

    // ---------------- 建房 / 拆房 ----------------

    public ManagementResult build(MonopolyState state, String playerName, String propertyName) {
        Player player = requireManager(state, playerName, "build");
        Deed deed = requireOwnedDeed(state, player, propertyName);
        Space space = deed.space();
        Ledger ledger = state.getLedger();
        if (space.kind() != SpaceKind.PROPERTY) {
            throw buildingError(GameMessages.NOT_BUILDABLE, space.name());
        }
        if (!ledger.ownsGroup(player.getName(), space.color())) {
            throw buildingError(GameMessages.MONOPOLY_REQUIRED, space.color());
        }
        if (ledger.groupHasMortgage(space.color())) {
            throw buildingError(GameMessages.GROUP_MORTGAGED, space.color());
        }
        int level = deed.getBuildings();
        if (level >= 5) {
            throw buildingError(GameMessages.MAX_BUILDINGS, space.name());
        }
        int min = ledger.groupDeeds(space.color()).stream().mapToInt(Deed::getBuildings).min().orElse(0);
        if (level > min) {
            throw buildingError(GameMessages.UNEVEN_BUILD, space.name());
        }
        if (level < 4 && ledger.housesRemaining() == 0) {
            throw buildingError(GameMessages.HOUSE_POOL_EMPTY, ledger.housesRemaining());
        }
        if (level == 4 && ledger.hotelsRemaining() == 0) {
            throw buildingError(GameMessages.HOTEL_POOL_EMPTY);
        }
        int cost = buildingPrice(space, level);
        if (player.getCash() < cost) {
            throw MonopolyException.of(ErrorKind.INSUFFICIENT_FUNDS, GameMessages.INSUFFICIENT_FUNDS,
                    player.getName(), cost, player.getCash());
        }
        ledger.debit(player, cost);
        ledger.addBuilding(deed);
        return result(state, player, deed, "build", -cost);
    }

    public ManagementResult sellBuilding(MonopolyState state, String playerName, String propertyName) {
        Player player = requireManager(state, playerName, "sellBuilding");
        Deed deed = requireOwnedDeed(state, player, propertyName);
        Space space = deed.space();
        Ledger ledger = state.getLedger();
        int level = deed.getBuildings();
        if (level == 0) {
            throw buildingError(GameMessages.NO_BUILDINGS, space.name());
        }
        int max = ledger.groupDeeds(space.color()).stream().mapToInt(Deed::getBuildings).max().orElse(0);
        if (level < max) {
            throw buildingError(GameMessages.UNEVEN_SELL, space.name());
        }
        if (level == 5 && ledger.housesRemaining() < 4) {
            throw buildingError(GameMessages.HOUSE_POOL_EMPTY, ledger.housesRemaining());
        }
        int refund = buildingPrice(space, level - 1);
        ledger.removeBuilding(deed);
        ledger.credit(player, refund);
        return result(state, player, deed, "sellBuilding", refund);
    }

    /** 从 level 升一级的价格：房屋为房屋造价，4 -> 旅馆为 4 倍房屋造价 */
    static int buildingPrice(Space space, int level) {
        return level == 4 ? space.houseCost() * HOTEL_COST_MULTIPLIER : space.houseCost();
    }

    // ---------------- 公共校验 ----------------

    private Player requireManager(MonopolyState state, String playerName, String action) {
        state.requireNotOver();
        Player player = state.requireCurrent(playerName);
        state.requireFreeToManage(player, action);
        return player;
    }

    private Deed requireOwnedDeed(MonopolyState state, Player player, String propertyName) {
        Space space = requireOwnable(propertyName);
        Deed deed = state.getLedger().deed(space.index());
        if (!deed.ownedBy(player.getName())) {
            throw MonopolyException.of(ErrorKind.NOT_PROPERTY_OWNER, GameMessages.NOT_PROPERTY_OWNER, player.getName(), space.name());
        }
        return deed;
    }

    static Space requireOwnable(String propertyName) {
        return BoardCatalog.findOwnable(propertyName)
                .orElseThrow(() -> MonopolyException.of(ErrorKind.PROPERTY_NOT_OWNABLE, GameMessages.PROPERTY_NOT_OWNABLE, propertyName));
    }

    private static MonopolyException buildingError(String template, Object... args) {
        return MonopolyException.of(ErrorKind.BUILDING_RULE_VIOLATION, template, args);
    }

    private static ManagementResult result(MonopolyState state, Player player, Deed deed, String action, int amount) {
        Ledger ledger = state.getLedger();
        return new ManagementResult(player.getName(), deed.space().name(), action, amount, player.getCash(),
                deed.getBuildings(), deed.isMortgaged(), ledger.housesRemaining(), ledger.hotelsRemaining());
    }
}
