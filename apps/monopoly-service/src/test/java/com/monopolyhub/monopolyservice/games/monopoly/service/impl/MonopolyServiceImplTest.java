package com.monopolyhub.monopolyservice.games.monopoly.service.impl;

import com.monopolyhub.monopolyservice.engine.core.FixedDiceRoller;
import com.monopolyhub.monopolyservice.games.monopoly.application.MonopolyEngine;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.GameSnapshot;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.AuctionResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.PlayerPropertiesView;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.PlayerView;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.PropertyView;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.SessionSummary;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.SpaceView;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TradeRequest;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TurnOutcome;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ErrorKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.TurnPhase;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.BoardCatalog;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Game;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.GameSettings;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.InvariantViolationException;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.MonopolyException;
import com.monopolyhub.monopolyservice.games.monopoly.infrastructure.memory.InMemoryMonopolySessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonopolyServiceImplTest {

    private FixedDiceRoller dice;
    private InMemoryMonopolySessionRepository sessions;
    private MonopolyEngine engine;
    private MonopolyServiceImpl service;

    @BeforeEach
    void setUp() {
        dice = new FixedDiceRoller();
        sessions = new InMemoryMonopolySessionRepository();
        engine = new MonopolyEngine(GameSettings.defaults(), dice, new Random(5));
        service = new MonopolyServiceImpl(sessions, engine);
    }

    @Test
    void createGameValidatesPlayerList() {
        assertThatThrownBy(() -> service.createGame(List.of("solo")))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_PLAYER_COUNT);
        assertThatThrownBy(() -> service.createGame(Collections.nCopies(9, "p")))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_PLAYER_COUNT);
        assertThatThrownBy(() -> service.createGame(List.of("a", "a")))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_PLAYER_COUNT);
        assertThatThrownBy(() -> service.createGame(List.of("a", " ")))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_PLAYER_COUNT);
        assertThatThrownBy(() -> service.createGame(null))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_PLAYER_COUNT);
        assertThat(service.listGames()).isEmpty();
    }

    @Test
    void newGameSnapshotShowsStartingPosition() {
        String id = service.createGame(List.of("alice", "bob", "carol"));

        GameSnapshot s = service.getState(id);

        assertThat(s.gameId()).isEqualTo(id);
        assertThat(s.players()).extracting(PlayerView::name).containsExactly("alice", "bob", "carol");
        assertThat(s.players()).allSatisfy(p -> {
            assertThat(p.cash()).isEqualTo(1500);
            assertThat(p.position()).isZero();
            assertThat(p.netWorth()).isEqualTo(1500);
        });
        assertThat(s.currentPlayer()).isEqualTo("alice");
        assertThat(s.phase()).isEqualTo("AWAITING_ACTION");
        assertThat(s.housesRemaining()).isEqualTo(32);
        assertThat(s.hotelsRemaining()).isEqualTo(12);
        assertThat(s.gameOver()).isFalse();
        assertThat(service.listGames()).extracting(SessionSummary::getGameId).containsExactly(id);
    }

    @Test
    void unknownSessionIsReported() {
        assertThatThrownBy(() -> service.getState("nope"))
                .isInstanceOf(MonopolyException.class)
                .extracting("kind").isEqualTo(ErrorKind.SESSION_NOT_FOUND);
        assertThatThrownBy(() -> service.roll("nope", "alice"))
                .extracting("kind").isEqualTo(ErrorKind.SESSION_NOT_FOUND);
    }

    @Test
    void fullTurnCycleBuyThenPayRent() {
        String id = service.createGame(List.of("alice", "bob"));
        dice.then(2, 4).then(1, 5);

        TurnOutcome landed = service.roll(id, "alice");
        assertThat(landed.getPurchaseOffer()).isEqualTo("Oriental Avenue");
        service.buy(id, "alice", "Oriental Avenue");
        TurnOutcome ended = service.endTurn(id, "alice");
        assertThat(ended.getCurrentPlayer()).isEqualTo("bob");

        TurnOutcome rent = service.roll(id, "bob");

        assertThat(rent.getCashDelta()).isEqualTo(-6);
        GameSnapshot s = service.getState(id);
        assertThat(s.players().get(0).cash()).isEqualTo(1406);
        assertThat(s.players().get(0).properties()).containsExactly("Oriental Avenue");
        assertThat(s.players().get(0).netWorth()).isEqualTo(1506);
    }

    @Test
    void failedActionLeavesCommittedStateUntouched() {
        String id = service.createGame(List.of("alice", "bob"));
        dice.then(2, 4);
        service.roll(id, "alice");
        MonopolyState before = sessions.get(id).orElseThrow().getState();

        assertThatThrownBy(() -> service.buy(id, "alice", "Boardwalk")).isInstanceOf(MonopolyException.class);
        assertThatThrownBy(() -> service.roll(id, "bob")).isInstanceOf(MonopolyException.class);

        assertThat(sessions.get(id).orElseThrow().getState()).isSameAs(before);
        assertThat(service.getState(id).phase()).isEqualTo("AWAITING_PURCHASE_DECISION");
    }

    @Test
    void invariantViolationRollsBackWholeAction() {
        MonopolyState state = engine.newGame(List.of("alice", "bob"));
        state.setPhase(TurnPhase.TURN_END);
        state.getLedger().deed(39).setBuildings(1);
        sessions.create(new Game("broken", 1L, state));

        assertThatThrownBy(() -> service.endTurn("broken", "alice"))
                .isInstanceOf(InvariantViolationException.class);

        GameSnapshot s = service.getState("broken");
        assertThat(s.currentPlayer()).isEqualTo("alice");
        assertThat(s.phase()).isEqualTo("TURN_END");
    }

    @Test
    void concurrentActionOnSameSessionIsBusy() throws Exception {
        String id = service.createGame(List.of("alice", "bob"));
        Game game = sessions.get(id).orElseThrow();
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            game.getLock().lock();
            try {
                locked.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                game.getLock().unlock();
            }
        });
        holder.start();
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> service.roll(id, "alice"))
                    .extracting("kind").isEqualTo(ErrorKind.SESSION_BUSY);
        } finally {
            release.countDown();
            holder.join(5_000);
        }

        dice.then(1, 2);
        assertThat(service.roll(id, "alice").getPosition()).isEqualTo(3);
    }

    @Test
    void playerPropertiesReportRentAndMonopoly() {
        String id = service.createGame(List.of("alice", "bob"));
        MonopolyState state = sessions.get(id).orElseThrow().getState();
        state.getLedger().assign(state.getLedger().deed(37), "bob");
        state.getLedger().assign(state.getLedger().deed(39), "bob");
        state.getLedger().assign(state.getLedger().deed(5), "bob");

        PlayerPropertiesView view = service.getPlayerProperties(id, "bob");

        assertThat(view.totalProperties()).isEqualTo(3);
        assertThat(view.properties()).extracting(PropertyView::name)
                .containsExactly("Reading Railroad", "Park Place", "Boardwalk");
        PropertyView boardwalk = view.properties().get(2);
        assertThat(boardwalk.rent()).isEqualTo(100);
        assertThat(boardwalk.monopoly()).isTrue();
        assertThat(boardwalk.color()).isEqualTo("DARK_BLUE");
        assertThat(view.properties().get(0).monopoly()).isNull();
        assertThatThrownBy(() -> service.getPlayerProperties(id, "zed"))
                .extracting("kind").isEqualTo(ErrorKind.PLAYER_NOT_FOUND);
    }

    @Test
    void boardCatalogListsAllSpaces() {
        List<SpaceView> board = service.boardCatalog();

        assertThat(board).hasSize(BoardCatalog.SIZE);
        assertThat(board.get(0).name()).isEqualTo("GO");
        assertThat(board.get(0).price()).isNull();
        assertThat(board.get(39).rents()).containsExactly(50, 200, 600, 1400, 1700, 2000);
        assertThat(board.get(38).taxAmount()).isEqualTo(100);
    }

    @Test
    void managementAndTradesGoThroughService() {
        String id = service.createGame(List.of("alice", "bob"));
        MonopolyState state = sessions.get(id).orElseThrow().getState();
        state.getLedger().assign(state.getLedger().deed(37), "alice");
        state.getLedger().assign(state.getLedger().deed(39), "alice");

        assertThat(service.build(id, "alice", "Boardwalk").buildings()).isEqualTo(1);
        assertThat(service.sellBuilding(id, "alice", "Boardwalk").buildings()).isZero();
        assertThat(service.mortgage(id, "alice", "Park Place").mortgaged()).isTrue();
        assertThat(service.unmortgage(id, "alice", "Park Place").mortgaged()).isFalse();

        String tradeId = service.proposeTrade(id, "alice", "bob",
                TradeRequest.builder().giveProperties(List.of("Park Place")).requestCash(300).build())
                .offer().getTradeId();
        assertThat(service.getState(id).pendingTrade().getTradeId()).isEqualTo(tradeId);
        service.acceptTrade(id, "bob", tradeId);

        GameSnapshot s = service.getState(id);
        assertThat(s.pendingTrade()).isNull();
        assertThat(s.players().get(1).properties()).containsExactly("Park Place");
    }

    @Test
    void declineRunsAuctionThroughService() {
        String id = service.createGame(List.of("alice", "bob"));
        dice.then(2, 4);
        service.roll(id, "alice");

        AuctionResult result = service.decline(id, "alice", "Oriental Avenue", Map.of("bob", 90));

        assertThat(result.winner()).isEqualTo("bob");
        assertThat(service.getPlayerProperties(id, "bob").properties()).hasSize(1);
    }
}
