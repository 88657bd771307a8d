package com.monopolyhub.monopolyservice.games.monopoly.application;

import com.monopolyhub.monopolyservice.games.monopoly.domain.constants.GameMessages;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TurnOutcome;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.DeckType;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.RentMode;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.SpaceKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.BoardCatalog;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Card;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.CardDeck;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.CardEffect;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.InvariantViolationException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 卡牌效果解释器：机会与命运两副卡组共用。
 * 出狱卡留在玩家手里，其余卡牌结算完成后回到牌底。
 */
public class CardResolver {

    private final LandingResolver landing;
    private final BankruptcyResolver bankruptcy;

    CardResolver(LandingResolver landing, BankruptcyResolver bankruptcy) {
        this.landing = landing;
        this.bankruptcy = bankruptcy;
    }

    public void draw(MonopolyState state, Player player, CardDeck deck, TurnOutcome outcome) {
        Card card = deck.draw();
        if (card == null) {
            throw new InvariantViolationException(deck.type() + " 卡组为空");
        }
        outcome.getCardsDrawn().add(card.text());
        outcome.event(GameMessages.format(GameMessages.EVENT_CARD, player.getName(), deckLabel(deck.type()), card.text()));

        if (card.isGetOutOfJailFree()) {
            player.getJailCards().add(card);
            outcome.event(GameMessages.format(GameMessages.EVENT_JAIL_CARD_KEPT, player.getName()));
            return;
        }
        apply(state, player, card.effect(), outcome);
        deck.returnToBottom(card);
    }

    void apply(MonopolyState state, Player player, CardEffect effect, TurnOutcome outcome) {
        switch (effect.type()) {
            case ADVANCE_TO -> {
                landing.moveTo(state, player, effect.target(), effect.collectGo(), outcome);
                landing.resolve(state, player, RentMode.STANDARD, outcome);
            }
            case MOVE_RELATIVE -> {
                if (effect.amount() < 0) {
                    landing.moveBack(player, -effect.amount(), outcome);
                } else {
                    landing.advance(state, player, effect.amount(), outcome);
                }
                landing.resolve(state, player, RentMode.STANDARD, outcome);
            }
            case NEAREST_RAILROAD -> {
                int target = BoardCatalog.nextOfKind(player.getPosition(), SpaceKind.RAILROAD);
                landing.moveTo(state, player, target, effect.collectGo(), outcome);
                landing.resolve(state, player, RentMode.CARD_RAILROAD_DOUBLE, outcome);
            }
            case NEAREST_UTILITY -> {
                int target = BoardCatalog.nextOfKind(player.getPosition(), SpaceKind.UTILITY);
                landing.moveTo(state, player, target, effect.collectGo(), outcome);
                landing.resolve(state, player, RentMode.CARD_UTILITY_TEN_TIMES, outcome);
            }
            case COLLECT -> {
                state.getLedger().credit(player, effect.amount());
                outcome.event(GameMessages.format(GameMessages.EVENT_COLLECTED, player.getName(), effect.amount()));
            }
            case PAY -> bankruptcy.collect(state, player, null, effect.amount(), outcome);
            case PAY_EACH_PLAYER -> payEachPlayer(state, player, effect.amount(), outcome);
            case COLLECT_FROM_EACH_PLAYER -> {
                for (Player other : others(state, player)) {
                    bankruptcy.collect(state, other, player, effect.amount(), outcome);
                    if (state.isOver()) {
                        return;
                    }
                }
            }
            case GET_OUT_OF_JAIL_FREE -> throw new InvariantViolationException("出狱卡由 draw 直接交给玩家，不参与效果结算");
            case GO_TO_JAIL -> landing.sendToJail(state, player, outcome);
            case REPAIRS -> {
                int total = 0;
                for (Deed deed : state.getLedger().deedsOf(player.getName())) {
                    total += deed.hasHotel() ? effect.perHotel() : deed.getBuildings() * effect.perHouse();
                }
                bankruptcy.collect(state, player, null, total, outcome);
            }
        }
    }

    /** 付不起全部款项时先不付任何人，直接对银行破产 */
    private void payEachPlayer(MonopolyState state, Player player, int amount, TurnOutcome outcome) {
        List<Player> others = others(state, player);
        int total = amount * others.size();
        if (player.getCash() < total) {
            bankruptcy.declareBankrupt(state, player, null, outcome);
            return;
        }
        for (Player other : others) {
            bankruptcy.collect(state, player, other, amount, outcome);
        }
    }

    private static List<Player> others(MonopolyState state, Player player) {
        return state.activePlayers().stream().filter(p -> p != player).collect(Collectors.toList());
    }

    private static String deckLabel(DeckType type) {
        return switch (type) {
            case CHANCE -> "机会卡";
            case COMMUNITY_CHEST -> "命运卡";
        };
    }
}
