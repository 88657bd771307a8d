package com.monopolyhub.monopolyservice.games.monopoly.domain.enums;

/** 两副卡组：机会 / 命运 */
public enum DeckType {

    CHANCE,
    COMMUNITY_CHEST
}
