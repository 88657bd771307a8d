package com.monopolyhub.monopolyservice.games.monopoly.application;

import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TurnOutcome;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.TurnPhase;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.BoardCatalog;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Card;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CardResolverTest {

    @Test
    void nearestRailroadChargesDoubleRent() {
        EngineFixture f = new EngineFixture("alice", "bob");
        f.own("bob", "Reading Railroad", "Pennsylvania Railroad");
        f.stackChance(EngineFixture.chanceCard("Advance to the nearest Railroad"));
        f.dice.then(3, 4);

        TurnOutcome out = f.engine.roll(f.state, "alice");

        assertThat(out.getPosition()).isEqualTo(15);
        assertThat(out.isPassedGo()).isFalse();
        assertThat(f.player("alice").getCash()).isEqualTo(1400);
        assertThat(f.player("bob").getCash()).isEqualTo(1600);
    }

    @Test
    void nearestRailroadWrapsPastGoAndOffersPurchase() {
        EngineFixture f = new EngineFixture("alice", "bob");
        f.player("alice").setPosition(33);
        f.stackChance(EngineFixture.chanceCard("Advance to the nearest Railroad"));
        f.dice.then(1, 2);

        TurnOutcome out = f.engine.roll(f.state, "alice");

        assertThat(out.getPosition()).isEqualTo(5);
        assertThat(out.isPassedGo()).isTrue();
        assertThat(out.getPurchaseOffer()).isEqualTo("Reading Railroad");
        assertThat(f.player("alice").getCash()).isEqualTo(1700);
        assertThat(f.state.getPhase()).isEqualTo(TurnPhase.AWAITING_PURCHASE_DECISION);
    }

    @Test
    void nearestUtilityRollsAgainAndPaysTenTimes() {
        EngineFixture f = new EngineFixture("alice", "bob");
        f.own("bob", "Electric Company");
        f.stackChance(EngineFixture.chanceCard("Advance token to nearest Utility"));
        f.dice.then(3, 4).then(5, 6);

        TurnOutcome out = f.engine.roll(f.state, "alice");

        assertThat(f.player("alice").getPosition()).isEqualTo(12);
        assertThat(f.player("alice").getCash()).isEqualTo(1500 - 110);
        assertThat(out.getDice()).containsExactly(3, 4);
        assertThat(out.getUtilityDice()).containsExactly(5, 6);
        assertThat(f.dice.remaining()).isZero();
    }

    @Test
    void goBackThreeSpacesResolvesNewSpace() {
        EngineFixture f = new EngineFixture("alice", "bob");
        f.stackChance(EngineFixture.chanceCard("Go Back 3 Spaces"));
        f.dice.then(3, 4);

        TurnOutcome out = f.engine.roll(f.state, "alice");

        assertThat(out.getPosition()).isEqualTo(4);
        assertThat(out.getLandedOn()).isEqualTo("Income Tax");
        assertThat(f.player("alice").getCash()).isEqualTo(1300);
    }

    @Test
    void goToJailCardPaysNoSalary() {
        EngineFixture f = new EngineFixture("alice", "bob");
        f.stackChance(EngineFixture.chanceCard("Go to Jail"));
        f.dice.then(3, 4);

        TurnOutcome out = f.engine.roll(f.state, "alice");

        assertThat(out.isSentToJail()).isTrue();
        assertThat(f.player("alice").getPosition()).isEqualTo(BoardCatalog.JAIL);
        assertThat(f.player("alice").getCash()).isEqualTo(1500);
        assertThat(f.state.getPhase()).isEqualTo(TurnPhase.TURN_END);
    }

    @Test
    void repairsChargePerHouseAndHotel() {
        EngineFixture f = new EngineFixture("alice", "bob");
        f.own("alice", "Park Place", "Boardwalk", "Mediterranean Avenue", "Baltic Avenue");
        f.addBuildings("Park Place", 4);
        f.addBuildings("Boardwalk", 5);
        f.addBuildings("Mediterranean Avenue", 1);
        f.stackChance(EngineFixture.chanceCard("Make general repairs"));
        f.player("alice").setPosition(4);
        f.dice.then(1, 2);

        f.engine.roll(f.state, "alice");

        // 5 栋房 × 25 + 1 座旅馆 × 100
        assertThat(f.player("alice").getCash()).isEqualTo(1500 - 225);
    }

    @Test
    void chairmanPaysEachActivePlayer() {
        EngineFixture f = new EngineFixture("alice", "bob", "carol", "dave");
        f.player("dave").setBankrupt(true);
        f.stackChance(EngineFixture.chanceCard("You have been elected Chairman"));
        f.dice.then(3, 4);

        f.engine.roll(f.state, "alice");

        assertThat(f.player("alice").getCash()).isEqualTo(1400);
        assertThat(f.player("bob").getCash()).isEqualTo(1550);
        assertThat(f.player("carol").getCash()).isEqualTo(1550);
        assertThat(f.player("dave").getCash()).isEqualTo(1500);
    }

    @Test
    void chairmanShortfallBankruptsDrawerToBank() {
        EngineFixture f = new EngineFixture("alice", "bob", "carol");
        f.player("alice").setCash(60);
        f.own("alice", "Boardwalk");
        f.stackChance(EngineFixture.chanceCard("You have been elected Chairman"));
        f.dice.then(3, 4);

        TurnOutcome out = f.engine.roll(f.state, "alice");

        assertThat(out.getBankruptPlayers()).containsExactly("alice");
        assertThat(f.player("bob").getCash()).isEqualTo(1500);
        assertThat(f.deed("Boardwalk").getOwner()).isNull();
    }

    @Test
    void birthdayCollectsFromEveryoneAndCanBankruptThem() {
        EngineFixture f = new EngineFixture("alice", "bob");
        f.player("bob").setCash(5);
        f.stackCommunityChest(EngineFixture.communityChestCard("It is your birthday"));
        f.dice.then(1, 1);

        TurnOutcome out = f.engine.roll(f.state, "alice");

        assertThat(f.player("alice").getCash()).isEqualTo(1505);
        assertThat(out.getBankruptPlayers()).containsExactly("bob");
        assertThat(out.isGameOver()).isTrue();
        assertThat(out.getWinner()).isEqualTo("alice");
    }

    @Test
    void resolvedCardsRecycleAndJailCardsAreKept() {
        EngineFixture f = new EngineFixture("alice", "bob");
        Card bankError = EngineFixture.communityChestCard("Bank error");
        Card jailCard = EngineFixture.communityChestCard("Get Out of Jail Free");
        Card fee = EngineFixture.communityChestCard("Doctor's fee");
        f.stackCommunityChest(bankError, jailCard, fee);
        f.own("alice", "Oriental Avenue");
        f.dice.then(1, 1);

        f.engine.roll(f.state, "alice");
        assertThat(f.player("alice").getCash()).isEqualTo(1700);
        assertThat(f.state.getCommunityChest().peekAll()).containsExactly(jailCard, fee, bankError);

        // 对子加掷：从 31 走到 33 的命运格
        f.player("alice").setPosition(31);
        f.dice.then(1, 1);
        f.engine.roll(f.state, "alice");

        assertThat(f.player("alice").jailCardCount()).isEqualTo(1);
        assertThat(f.state.getCommunityChest().peekAll()).containsExactly(fee, bankError);
    }
}
