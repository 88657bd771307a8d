package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.DeckType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 标准机会/命运卡组（各 16 张）。
 */
public final class StandardDecks {

    private StandardDecks() {
    }

    /** 机会卡（未洗牌，固定顺序） */
    public static List<Card> chanceCards() {
        DeckType d = DeckType.CHANCE;
        return List.of(
                new Card(d, "Advance to Boardwalk", CardEffect.advanceTo(39)),
                new Card(d, "Advance to Go (Collect $200)", CardEffect.advanceTo(BoardCatalog.GO)),
                new Card(d, "Advance to Illinois Avenue. If you pass Go, collect $200", CardEffect.advanceTo(24)),
                new Card(d, "Advance to St. Charles Place. If you pass Go, collect $200", CardEffect.advanceTo(11)),
                new Card(d, "Advance to the nearest Railroad. If owned, pay owner twice the rental", CardEffect.nearestRailroad()),
                new Card(d, "Advance to the nearest Railroad. If owned, pay owner twice the rental", CardEffect.nearestRailroad()),
                new Card(d, "Advance token to nearest Utility. If owned, throw dice and pay owner ten times the amount thrown", CardEffect.nearestUtility()),
                new Card(d, "Bank pays you dividend of $50", CardEffect.collect(50)),
                new Card(d, "Get Out of Jail Free", CardEffect.getOutOfJailFree()),
                new Card(d, "Go Back 3 Spaces", CardEffect.moveRelative(-3)),
                new Card(d, "Go to Jail. Go directly to Jail, do not pass Go, do not collect $200", CardEffect.goToJail()),
                new Card(d, "Make general repairs on all your property. For each house pay $25. For each hotel pay $100", CardEffect.repairs(25, 100)),
                new Card(d, "Speeding fine $15", CardEffect.pay(15)),
                new Card(d, "Take a trip to Reading Railroad. If you pass Go, collect $200", CardEffect.advanceTo(5)),
                new Card(d, "You have been elected Chairman of the Board. Pay each player $50", CardEffect.payEachPlayer(50)),
                new Card(d, "Your building loan matures. Collect $150", CardEffect.collect(150)));
    }

    /** 命运卡（未洗牌，固定顺序） */
    public static List<Card> communityChestCards() {
        DeckType d = DeckType.COMMUNITY_CHEST;
        return List.of(
                new Card(d, "Advance to Go (Collect $200)", CardEffect.advanceTo(BoardCatalog.GO)),
                new Card(d, "Bank error in your favor. Collect $200", CardEffect.collect(200)),
                new Card(d, "Doctor's fee. Pay $50", CardEffect.pay(50)),
                new Card(d, "From sale of stock you get $50", CardEffect.collect(50)),
                new Card(d, "Get Out of Jail Free", CardEffect.getOutOfJailFree()),
                new Card(d, "Go to Jail. Go directly to jail, do not pass Go, do not collect $200", CardEffect.goToJail()),
                new Card(d, "Holiday fund matures. Receive $100", CardEffect.collect(100)),
                new Card(d, "Income tax refund. Collect $20", CardEffect.collect(20)),
                new Card(d, "It is your birthday. Collect $10 from every player", CardEffect.collectFromEachPlayer(10)),
                new Card(d, "Life insurance matures. Collect $100", CardEffect.collect(100)),
                new Card(d, "Pay hospital fees of $100", CardEffect.pay(100)),
                new Card(d, "Pay school fees of $50", CardEffect.pay(50)),
                new Card(d, "Receive $25 consultancy fee", CardEffect.collect(25)),
                new Card(d, "You are assessed for street repair. $40 per house. $115 per hotel", CardEffect.repairs(40, 115)),
                new Card(d, "You have won second prize in a beauty contest. Collect $10", CardEffect.collect(10)),
                new Card(d, "You inherit $100", CardEffect.collect(100)));
    }

    public static CardDeck shuffledChance(Random random) {
        return shuffled(DeckType.CHANCE, chanceCards(), random);
    }

    public static CardDeck shuffledCommunityChest(Random random) {
        return shuffled(DeckType.COMMUNITY_CHEST, communityChestCards(), random);
    }

    private static CardDeck shuffled(DeckType type, List<Card> cards, Random random) {
        List<Card> copy = new ArrayList<>(cards);
        Collections.shuffle(copy, random);
        return new CardDeck(type, copy);
    }
}
