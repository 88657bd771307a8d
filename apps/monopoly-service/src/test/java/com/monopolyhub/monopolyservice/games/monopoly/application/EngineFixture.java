package com.monopolyhub.monopolyservice.games.monopoly.application;

import com.monopolyhub.monopolyservice.engine.core.FixedDiceRoller;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.DeckType;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.BoardCatalog;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Card;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.CardDeck;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.GameSettings;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.StandardDecks;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * 测试夹具：固定骰子 + 可直接摆布的对局状态。
 */
public class EngineFixture {

    public final FixedDiceRoller dice = new FixedDiceRoller();
    public final MonopolyEngine engine;
    public final MonopolyState state;

    public EngineFixture(String... names) {
        this(GameSettings.defaults(), names);
    }

    public EngineFixture(GameSettings settings, String... names) {
        this.engine = new MonopolyEngine(settings, dice, new Random(1));
        this.state = engine.newGame(List.of(names));
    }

    public Player player(String name) {
        return state.player(name);
    }

    public Deed deed(String property) {
        return state.getLedger().deed(BoardCatalog.findOwnable(property).orElseThrow().index());
    }

    public void own(String owner, String... properties) {
        for (String p : properties) {
            state.getLedger().assign(deed(p), owner);
        }
    }

    /** 通过账本加建筑（不扣钱），保持建筑池对账 */
    public void addBuildings(String property, int count) {
        for (int i = 0; i < count; i++) {
            state.getLedger().addBuilding(deed(property));
        }
    }

    public void stackChance(Card... cards) {
        state.setChance(new CardDeck(DeckType.CHANCE, Arrays.asList(cards)));
    }

    public void stackCommunityChest(Card... cards) {
        state.setCommunityChest(new CardDeck(DeckType.COMMUNITY_CHEST, Arrays.asList(cards)));
    }

    public static Card chanceCard(String prefix) {
        return StandardDecks.chanceCards().stream()
                .filter(c -> c.text().startsWith(prefix))
                .findFirst()
                .orElseThrow();
    }

    public static Card communityChestCard(String prefix) {
        return StandardDecks.communityChestCards().stream()
                .filter(c -> c.text().startsWith(prefix))
                .findFirst()
                .orElseThrow();
    }

    public void assertInvariants() {
        state.getLedger().assertInvariants(state.getPlayers());
    }
}
