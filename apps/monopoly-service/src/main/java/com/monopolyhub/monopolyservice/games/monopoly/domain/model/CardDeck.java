package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.DeckType;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * 一副卡组：队首为下一张要抽的牌。
 * - 抽出的普通卡结算后回到队尾；
 * - 出狱卡被玩家持有，使用或交易后弃牌时才回到队尾。
 */
public class CardDeck {

    private final DeckType type;
    private final Deque<Card> cards;

    public CardDeck(DeckType type, Collection<Card> ordered) {
        this.type = type;
        this.cards = new ArrayDeque<>(ordered);
    }

    public DeckType type() {
        return type;
    }

    /** 抽牌；卡组为空（理论上不会发生）时返回 null */
    public Card draw() {
        return cards.pollFirst();
    }

    /** 卡牌回到牌底 */
    public void returnToBottom(Card card) {
        if (card.deck() != type) {
            throw new IllegalArgumentException("卡牌不属于卡组 " + type + ": " + card.text());
        }
        cards.addLast(card);
    }

    public int size() {
        return cards.size();
    }

    /** 只读视图（按抽牌顺序） */
    public List<Card> peekAll() {
        return List.copyOf(cards);
    }

    /** Card 是不可变 record，复制队列即可 */
    public CardDeck copy() {
        return new CardDeck(type, cards);
    }
}
