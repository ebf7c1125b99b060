package com.dcruver.cultivation.domain;

import com.dcruver.cultivation.domain.character.CharacterStatus;
import org.springframework.stereotype.Component;

/**
 * Suggests what to do next from the character's readings.
 * Checks run from most to least urgent; the first match wins.
 */
@Component
public class ActionAdvisor {

    static final double CRITICAL_RATIO = 0.3;
    static final double COMFORTABLE_MANA_RATIO = 0.8;
    static final int COMFORTABLE_PILL_COUNT = 2;

    public String recommend(CharacterStatus status, SessionPhase phase) {
        if (phase == SessionPhase.ASCENDED) {
            return "你已飞升，可以重新开始新的修仙之旅";
        }
        if (phase == SessionPhase.GAME_OVER || !status.isAlive()) {
            return "修炼失败，请重新开始";
        }

        boolean hasPills = status.getPillCount() > 0;

        if (status.getHealthPercentage() < CRITICAL_RATIO) {
            return hasPills ? "生命垂危，建议立即服用丹药" : "生命垂危且无丹药，建议打坐恢复";
        }
        if (status.getManaPercentage() < CRITICAL_RATIO) {
            return hasPills ? "仙力不足，建议服用丹药恢复" : "仙力不足，建议打坐恢复";
        }
        if (status.getManaPercentage() > COMFORTABLE_MANA_RATIO && status.getPillCount() > COMFORTABLE_PILL_COUNT) {
            return "状态良好，建议全力修炼";
        }
        if (!hasPills) {
            return "缺少丹药，建议多打坐积累修为";
        }
        return "状态适中，可以根据需要选择修炼或恢复";
    }
}
