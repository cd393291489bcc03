package com.dicehub.baseball.games.baseball.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

import static com.dicehub.baseball.games.baseball.domain.rule.Modifiers.clamp;

/**
 * 打席结果注册表。
 * 声明顺序即加权抽样的固定迭代顺序；新增结果只需在这里加一项。
 */
public enum Outcome {

    HOME_RUN("homeRun", new OutcomeDefinition(0.028, true,
            b -> clamp(b.power(), 0.3, 2.5),
            p -> clamp(p.homeRun(), 0.5, 2.5),
            BaseRunningRule.homeRun(), 0,
            List.of("{batter} crushes one! Home run!",
                    "{batter} goes yard! It's outta here!",
                    "Swing and a drive! {batter} with a homer!",
                    "{batter} deposits one in the seats!"))),

    TRIPLE("triple", new OutcomeDefinition(0.005, true,
            b -> clamp(b.power(), 0.3, 2.0),
            p -> clamp(p.control(), 0.67, 2.0),
            BaseRunningRule.triple(), 0,
            List.of("{batter} triples into the gap!",
                    "{batter} legs out a triple!",
                    "Off the wall! {batter} with a triple!"))),

    DOUBLE("double", new OutcomeDefinition(0.046, true,
            b -> clamp(b.hit() * b.power(), 0.4, 1.8),
            p -> clamp(p.control(), 0.67, 1.8),
            BaseRunningRule.doubleHit(), 0,
            List.of("{batter} doubles down the line!",
                    "{batter} rips one for extra bases!",
                    "Into the gap! {batter} with a double!"))),

    SINGLE("single", new OutcomeDefinition(0.150, true,
            b -> clamp(b.hit(), 0.5, 1.5),
            p -> clamp(p.control(), 0.67, 2.0),
            BaseRunningRule.single(), 0,
            List.of("{batter} singles through the infield.",
                    "{batter} pokes one into the outfield.",
                    "Base hit for {batter}!",
                    "{batter} with a seeing-eye single."))),

    WALK("walk", new OutcomeDefinition(0.083, true,
            b -> clamp(b.discipline(), 0.5, 2.0),
            p -> clamp(p.walk(), 0.55, 2.0),
            BaseRunningRule.walk(), 0,
            List.of("{batter} works a walk.",
                    "Ball four. {batter} takes first.",
                    "{pitcher} can't find the zone. Walk."))),

    STRIKEOUT("strikeout", new OutcomeDefinition(0.217, false,
            b -> clamp(b.discipline(), 0.5, 2.0),
            p -> clamp(p.strikeout(), 0.6, 1.8),
            BaseRunningRule.HOLD, 1,
            List.of("{batter} goes down swinging!",
                    "Struck out looking! {pitcher} gets {batter}.",
                    "{pitcher} blows it by {batter}. K!",
                    "Swing and a miss! That's strike three!"))),

    GROUND_OUT("groundOut", new OutcomeDefinition(0.278, false,
            OutcomeDefinition.neutral(),
            OutcomeDefinition.neutral(),
            BaseRunningRule.HOLD, 1,
            List.of("{batter} grounds out to short.",
                    "Easy grounder, and {batter} is out.",
                    "{batter} rolls one to the infield. Out."))),

    FLY_OUT("flyOut", new OutcomeDefinition(0.193, false,
            b -> clamp(b.power(), 0.7, 1.3),
            OutcomeDefinition.neutral(),
            BaseRunningRule.HOLD, 1,
            List.of("{batter} flies out to center.",
                    "Can of corn. {batter} is out.",
                    "{batter} skies one to left. Caught.")));

    private final String wireName;
    private final OutcomeDefinition definition;

    Outcome(String wireName, OutcomeDefinition definition) {
        this.wireName = wireName;
        this.definition = definition;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public OutcomeDefinition definition() {
        return definition;
    }

    public boolean helpsBatter() {
        return definition.helpsBatter();
    }

    public int outsRecorded() {
        return definition.outsRecorded();
    }
}
