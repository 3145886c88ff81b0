package com.whenthen.domain.matcher;

import com.whenthen.domain.playlet.ConditionField;
import com.whenthen.domain.playlet.ConditionOperator;
import com.whenthen.domain.playlet.FileFilter;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.TriggerCondition;
import com.whenthen.domain.playlet.TriggerConfig;
import com.whenthen.domain.playlet.TriggerType;

import java.util.List;
import java.util.Optional;

/**
 * SpecificityScorer - Playlet 特异性评分
 * <p>
 * 多个 torrent_added Playlet 同时匹配时，分数最高者获得种子。
 * 分数相同时保留先出现的候选。
 * </p>
 */
public class SpecificityScorer {

    public int score(Playlet playlet) {
        int score = 0;
        for (TriggerCondition condition : playlet.getConditions()) {
            score += 2;
            if (condition.getOperator() == ConditionOperator.EQUALS) {
                score += 1;
            }
            if (condition.getField() == ConditionField.NAME && condition.getOperator() == ConditionOperator.REGEX) {
                score += 1;
            }
        }

        FileFilter filter = playlet.getFileFilter();
        if (filter != null && filter.getCategory() != null) {
            switch (filter.getCategory()) {
                case CUSTOM:
                    score += 3;
                    break;
                case VIDEO:
                case AUDIO:
                case SUBTITLE:
                    score += 2;
                    break;
                default:
                    score += 1;
            }
            if (filter.isSelectLargest()) {
                score += 1;
            }
            if (filter.hasMinSize()) {
                score += 1;
            }
        }

        TriggerConfig trigger = playlet.getTrigger();
        if (trigger != null) {
            if (trigger.getType() == TriggerType.FOLDER_WATCH && trigger.hasWatchFolder()) {
                score += 2;
            } else if (trigger.getType() == TriggerType.SEEDING_RATIO) {
                score += 1;
            }
        }
        return score;
    }

    /**
     * 选出得分最高的候选，仅严格更高的分数才能替换当前最佳
     */
    public Optional<Playlet> pickBest(List<Playlet> candidates) {
        Playlet best = null;
        int bestScore = Integer.MIN_VALUE;
        for (Playlet candidate : candidates) {
            int s = score(candidate);
            if (best == null || s > bestScore) {
                best = candidate;
                bestScore = s;
            }
        }
        return Optional.ofNullable(best);
    }
}
