package com.dcruver.cultivation.domain;

import com.dcruver.cultivation.domain.character.CharacterStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionAdvisorTest {

    private final ActionAdvisor advisor = new ActionAdvisor();

    private CharacterStatus status(int health, int mana, int pills) {
        return CharacterStatus.builder()
            .alive(health > 0)
            .health(health).maxHealth(100)
            .mana(mana).maxMana(100)
            .stage(StageLevel.QI_REFINING)
            .talent(5)
            .pillCount(pills)
            .build();
    }

    @Test
    void testTerminalPhasesTakePrecedence() {
        assertEquals("修炼失败，请重新开始", advisor.recommend(status(0, 50, 1), SessionPhase.GAME_OVER));
        assertTrue(advisor.recommend(status(80, 80, 1), SessionPhase.ASCENDED).contains("飞升"));
    }

    @Test
    void testLowHealthIsMostUrgent() {
        assertEquals("生命垂危，建议立即服用丹药", advisor.recommend(status(20, 10, 1), SessionPhase.ACTIVE));
        assertEquals("生命垂危且无丹药，建议打坐恢复", advisor.recommend(status(20, 10, 0), SessionPhase.ACTIVE));
    }

    @Test
    void testLowMana() {
        assertEquals("仙力不足，建议服用丹药恢复", advisor.recommend(status(100, 10, 2), SessionPhase.ACTIVE));
        assertEquals("仙力不足，建议打坐恢复", advisor.recommend(status(100, 10, 0), SessionPhase.ACTIVE));
    }

    @Test
    void testHealthyStates() {
        assertEquals("状态良好，建议全力修炼", advisor.recommend(status(100, 90, 3), SessionPhase.ACTIVE));
        assertEquals("缺少丹药，建议多打坐积累修为", advisor.recommend(status(100, 50, 0), SessionPhase.ACTIVE));
        assertEquals("状态适中，可以根据需要选择修炼或恢复", advisor.recommend(status(100, 50, 1), SessionPhase.ACTIVE));
    }
}
