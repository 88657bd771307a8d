package com.monopolyhub.monopolyservice.games.monopoly.domain.rule;

import com.monopolyhub.monopolyservice.games.monopoly.domain.model.BoardCatalog;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Ledger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RentCalculatorTest {

    private Ledger ledger;

    @BeforeEach
    void setUp() {
        ledger = new Ledger(32, 12);
    }

    private Deed deed(String name) {
        return ledger.deed(BoardCatalog.findOwnable(name).orElseThrow().index());
    }

    private void own(String owner, String... names) {
        for (String n : names) {
            ledger.assign(deed(n), owner);
        }
    }

    @Test
    void unimprovedRentDoublesWithFullGroup() {
        own("bob", "Park Place");
        assertThat(RentCalculator.rent(ledger, deed("Park Place"), 7)).isEqualTo(35);

        own("bob", "Boardwalk");
        assertThat(RentCalculator.rent(ledger, deed("Park Place"), 7)).isEqualTo(70);
        assertThat(RentCalculator.rent(ledger, deed("Boardwalk"), 7)).isEqualTo(100);
    }

    @Test
    void improvedRentUsesTable() {
        own("bob", "Park Place", "Boardwalk");
        ledger.addBuilding(deed("Boardwalk"));
        ledger.addBuilding(deed("Park Place"));
        ledger.addBuilding(deed("Boardwalk"));

        assertThat(RentCalculator.rent(ledger, deed("Boardwalk"), 0)).isEqualTo(600);
        assertThat(RentCalculator.rent(ledger, deed("Park Place"), 0)).isEqualTo(175);
    }

    @Test
    void railroadRentDoublesPerRailroadOwned() {
        own("bob", "Reading Railroad");
        assertThat(RentCalculator.rent(ledger, deed("Reading Railroad"), 0)).isEqualTo(25);
        own("bob", "Pennsylvania Railroad", "Short Line");
        assertThat(RentCalculator.rent(ledger, deed("Short Line"), 0)).isEqualTo(100);
        own("bob", "B. & O. Railroad");
        assertThat(RentCalculator.rent(ledger, deed("Reading Railroad"), 0)).isEqualTo(200);
        assertThat(RentCalculator.railroadCardRent(ledger, deed("Reading Railroad"))).isEqualTo(400);
    }

    @Test
    void splitRailroadsCountPerOwner() {
        own("bob", "Reading Railroad", "Pennsylvania Railroad");
        own("carol", "B. & O. Railroad", "Short Line");
        assertThat(RentCalculator.rent(ledger, deed("Reading Railroad"), 0)).isEqualTo(50);
        assertThat(RentCalculator.rent(ledger, deed("Short Line"), 0)).isEqualTo(50);
    }

    @Test
    void utilityRentDependsOnDiceAndCount() {
        own("bob", "Electric Company");
        assertThat(RentCalculator.rent(ledger, deed("Electric Company"), 9)).isEqualTo(36);
        own("bob", "Water Works");
        assertThat(RentCalculator.rent(ledger, deed("Electric Company"), 9)).isEqualTo(90);
        assertThat(RentCalculator.utilityCardRent(deed("Water Works"), 4)).isEqualTo(40);
    }

    @Test
    void mortgagedOrUnownedCollectsNothing() {
        assertThat(RentCalculator.rent(ledger, deed("Boardwalk"), 12)).isZero();
        own("bob", "Boardwalk");
        deed("Boardwalk").setMortgaged(true);
        assertThat(RentCalculator.rent(ledger, deed("Boardwalk"), 12)).isZero();
        assertThat(RentCalculator.utilityCardRent(deed("Water Works"), 12)).isZero();
    }

    @Test
    void rentIsPureFunctionOfState() {
        own("bob", "Illinois Avenue", "Kentucky Avenue", "Indiana Avenue");
        int first = RentCalculator.rent(ledger, deed("Illinois Avenue"), 6);
        int second = RentCalculator.rent(ledger, deed("Illinois Avenue"), 6);
        assertThat(first).isEqualTo(second).isEqualTo(40);
    }
}
