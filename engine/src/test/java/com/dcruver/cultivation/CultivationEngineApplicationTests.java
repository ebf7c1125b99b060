package com.dcruver.cultivation;

import com.dcruver.cultivation.config.DifficultyCatalog;
import com.dcruver.cultivation.domain.CultivationRules;
import com.dcruver.cultivation.domain.SessionPhase;
import com.dcruver.cultivation.domain.actions.ActionType;
import com.dcruver.cultivation.session.ActionResult;
import com.dcruver.cultivation.session.SessionManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "cultivation.random-seed=1234")
class CultivationEngineApplicationTests {

    @Autowired
    private SessionManager sessionManager;

    @Autowired
    private DifficultyCatalog difficultyCatalog;

    @Autowired
    private CultivationRules rules;

    @Test
    void contextLoads() {
        assertEquals(3, difficultyCatalog.all().size());
        assertEquals("normal", difficultyCatalog.getDefault().getId());
        assertEquals(20, rules.getCultivationManaCost());
    }

    @Test
    void testPlayThroughWiredEngine() {
        sessionManager.createSession(difficultyCatalog.require("简单"), 7);

        ActionResult result = sessionManager.applyAction(ActionType.MEDITATE);

        assertTrue(result.isAccepted());
        assertEquals(SessionPhase.ACTIVE, result.getStatus().getPhase());
        assertEquals(3, result.getStatus().getCharacter().getPillCount());
        sessionManager.endSession();
    }
}
