package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.engine.random.RandomSource;

import java.util.List;

/**
 * 文字播报：从结果模板中随机挑选一条，并按得分追加后缀
 */
public final class PlayDescriber {

    private PlayDescriber() {
    }

    public static String describe(Outcome outcome, String batterName, String pitcherName,
                                  int runsScored, RandomSource random) {
        List<String> templates = outcome.definition().templates();
        String template = templates.get(random.nextInt(templates.size()));
        StringBuilder desc = new StringBuilder(template
                .replace("{batter}", batterName)
                .replace("{pitcher}", pitcherName));
        if (runsScored == 1) {
            desc.append(" Runner scores!");
        } else if (runsScored > 1) {
            desc.append(' ').append(runsScored).append(" runs score!");
        }
        return desc.toString();
    }
}
