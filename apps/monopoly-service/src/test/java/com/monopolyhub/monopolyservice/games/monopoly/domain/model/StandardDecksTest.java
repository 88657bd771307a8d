package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.DeckType;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StandardDecksTest {

    @Test
    void eachDeckHasSixteenCardsWithOneJailCard() {
        assertThat(StandardDecks.chanceCards()).hasSize(16)
                .allMatch(c -> c.deck() == DeckType.CHANCE)
                .filteredOn(Card::isGetOutOfJailFree).hasSize(1);
        assertThat(StandardDecks.communityChestCards()).hasSize(16)
                .allMatch(c -> c.deck() == DeckType.COMMUNITY_CHEST)
                .filteredOn(Card::isGetOutOfJailFree).hasSize(1);
    }

    @Test
    void shuffleIsReproducibleForSameSeed() {
        CardDeck a = StandardDecks.shuffledChance(new Random(42));
        CardDeck b = StandardDecks.shuffledChance(new Random(42));
        assertThat(a.peekAll()).isEqualTo(b.peekAll());
        assertThat(a.peekAll()).containsExactlyInAnyOrderElementsOf(StandardDecks.chanceCards());
    }

    @Test
    void drawnCardGoesBackToTheBottomOfItsOwnDeck() {
        CardDeck deck = StandardDecks.shuffledCommunityChest(new Random(1));
        Card top = deck.draw();
        assertThat(deck.size()).isEqualTo(15);

        deck.returnToBottom(top);
        assertThat(deck.peekAll()).last().isEqualTo(top);

        Card foreign = StandardDecks.chanceCards().get(0);
        assertThatThrownBy(() -> deck.returnToBottom(foreign)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copyIsIndependent() {
        CardDeck deck = StandardDecks.shuffledChance(new Random(3));
        CardDeck copy = deck.copy();
        copy.draw();
        assertThat(deck.size()).isEqualTo(16);
        assertThat(copy.size()).isEqualTo(15);
    }
}
