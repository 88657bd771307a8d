package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ColorGroup;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.SpaceKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BoardCatalogTest {

    @Test
    void boardHasFortyIndexedSpaces() {
        assertThat(BoardCatalog.spaces()).hasSize(40);
        for (int i = 0; i < BoardCatalog.SIZE; i++) {
            assertThat(BoardCatalog.space(i).index()).isEqualTo(i);
        }
        assertThat(BoardCatalog.space(BoardCatalog.JAIL).kind()).isEqualTo(SpaceKind.JAIL);
        assertThat(BoardCatalog.space(BoardCatalog.GO_TO_JAIL).kind()).isEqualTo(SpaceKind.GO_TO_JAIL);
        assertThat(BoardCatalog.ownableSpaces()).hasSize(28);
    }

    @Test
    void colorGroupsMatchDeclaredSizes() {
        for (ColorGroup g : ColorGroup.values()) {
            assertThat(BoardCatalog.group(g)).hasSize(g.size());
        }
        assertThat(BoardCatalog.group(ColorGroup.DARK_BLUE))
                .extracting(Space::name)
                .containsExactly("Park Place", "Boardwalk");
    }

    @Test
    void propertyDataFollowsCatalog() {
        Space boardwalk = BoardCatalog.findOwnable("  BOARDWALK ").orElseThrow();
        assertThat(boardwalk.price()).isEqualTo(400);
        assertThat(boardwalk.mortgageValue()).isEqualTo(200);
        assertThat(boardwalk.houseCost()).isEqualTo(200);
        assertThat(boardwalk.rentAt(5)).isEqualTo(2000);
        assertThat(BoardCatalog.space(4).taxAmount()).isEqualTo(200);
        assertThat(BoardCatalog.space(38).taxAmount()).isEqualTo(100);
        assertThat(BoardCatalog.findOwnable("Chance")).isEmpty();
        assertThat(BoardCatalog.findOwnable(null)).isEmpty();
    }

    @Test
    void nextOfKindScansForwardWithWraparound() {
        assertThat(BoardCatalog.nextOfKind(7, SpaceKind.RAILROAD)).isEqualTo(15);
        assertThat(BoardCatalog.nextOfKind(22, SpaceKind.RAILROAD)).isEqualTo(25);
        assertThat(BoardCatalog.nextOfKind(36, SpaceKind.RAILROAD)).isEqualTo(5);
        assertThat(BoardCatalog.nextOfKind(7, SpaceKind.UTILITY)).isEqualTo(12);
        assertThat(BoardCatalog.nextOfKind(36, SpaceKind.UTILITY)).isEqualTo(12);
        assertThat(BoardCatalog.nextOfKind(22, SpaceKind.UTILITY)).isEqualTo(28);
    }
}
