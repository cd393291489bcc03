package com.dicehub.baseball.games.baseball.domain.model;

import com.dicehub.baseball.engine.random.RandomSource;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * 两颗六面骰的点数。序列化为 [d1, d2]。
 */
public record DiceRoll(int first, int second) {

    public DiceRoll {
        if (first < 1 || first > 6 || second < 1 || second > 6) {
            throw new IllegalArgumentException("dice must be between 1 and 6: " + first + "," + second);
        }
    }

    public static DiceRoll roll(RandomSource random) {
        return new DiceRoll(random.nextInt(6) + 1, random.nextInt(6) + 1);
    }

    @JsonCreator
    public static DiceRoll of(List<Integer> dice) {
        if (dice == null || dice.size() != 2 || dice.get(0) == null || dice.get(1) == null) {
            throw new IllegalArgumentException("dice roll must contain exactly two values");
        }
        return new DiceRoll(dice.get(0), dice.get(1));
    }

    public int total() {
        return first + second;
    }

    @JsonValue
    public List<Integer> asList() {
        return List.of(first, second);
    }
}
