package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.CardEffectType;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.DeckType;

/** 一张卡牌：所属卡组 + 牌面文字 + 效果（不可变） */
public record Card(DeckType deck, String text, CardEffect effect) {

    public boolean isGetOutOfJailFree() {
        return effect.type() == CardEffectType.GET_OUT_OF_JAIL_FREE;
    }
}
