package com.monopolyhub.monopolyservice.platform.config;

import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.GameSnapshot;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.GameSettings;
import com.monopolyhub.monopolyservice.games.monopoly.service.MonopolyService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "monopoly.starting-cash=2000",
        "monopoly.auction.min-bid=25",
        "monopoly.dice.seed=42"
})
class MonopolyConfigTest {

    @Autowired
    private GameSettings settings;

    @Autowired
    private MonopolyService service;

    @Test
    void settingsAreBoundFromProperties() {
        assertThat(settings.getStartingCash()).isEqualTo(2000);
        assertThat(settings.getAuctionMinBid()).isEqualTo(25);
        assertThat(settings.getGoSalary()).isEqualTo(200);
        assertThat(settings.getHouses()).isEqualTo(32);
    }

    @Test
    void serviceIsWiredWithConfiguredRules() {
        String id = service.createGame(List.of("alice", "bob"));

        GameSnapshot snapshot = service.getState(id);

        assertThat(snapshot.players()).allSatisfy(p -> assertThat(p.cash()).isEqualTo(2000));
        assertThat(service.roll(id, "alice").getDice()).hasSize(2);
    }
}
