package com.dicehub.baseball.games.baseball.domain.model;

/**
 * 打线中的一个棒次
 *
 * @param battingOrder 棒次 1..9
 */
public record LineupSlot(int battingOrder, PlayerRef player, BattingProfile batting) {
}
