package com.dcruver.cultivation.session;

import com.dcruver.cultivation.domain.Achievement;
import com.dcruver.cultivation.domain.AchievementEvaluator;
import com.dcruver.cultivation.domain.ActionAdvisor;
import com.dcruver.cultivation.domain.ActionCost;
import com.dcruver.cultivation.domain.CultivationRules;
import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.SessionPhase;
import com.dcruver.cultivation.domain.StageLevel;
import com.dcruver.cultivation.domain.actions.ActionExecutor;
import com.dcruver.cultivation.domain.actions.ActionOutcome;
import com.dcruver.cultivation.domain.actions.ActionType;
import com.dcruver.cultivation.domain.character.CharacterAggregate;
import com.dcruver.cultivation.domain.character.CharacterStatus;
import com.dcruver.cultivation.domain.error.CultivationException;
import com.dcruver.cultivation.domain.error.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.random.RandomGenerator;
import java.util.stream.Collectors;

/**
 * Owns the current game session and is the only thing that mutates it.
 *
 * Every call runs a full validate, apply, log, transition cycle before returning.
 * Not thread-safe: the render/input loop is expected to call in one action at a time.
 */
@Component
@Slf4j
public class SessionManager {

    private final CultivationRules rules;
    private final ActionExecutor actionExecutor;
    private final ActionAdvisor advisor;
    private final AchievementEvaluator achievementEvaluator;
    private final Clock clock;
    private final RandomGenerator random;
    private final int recentLogSize;

    private SessionState current;

    public SessionManager(
            CultivationRules rules,
            ActionExecutor actionExecutor,
            ActionAdvisor advisor,
            AchievementEvaluator achievementEvaluator,
            Clock clock,
            RandomGenerator random,
            @Value("${cultivation.session.recent-log-size:8}") int recentLogSize) {
        this.rules = rules;
        this.actionExecutor = actionExecutor;
        this.advisor = advisor;
        this.achievementEvaluator = achievementEvaluator;
        this.clock = clock;
        this.random = random;
        this.recentLogSize = recentLogSize;
    }

    /**
     * Start a session with a talent drawn from the difficulty's range.
     */
    public SessionState createSession(DifficultySettings difficulty) {
        validateDifficulty(difficulty);
        int talent = random.nextInt(difficulty.getTalentMin(), difficulty.getTalentMax() + 1);
        return startSession(CharacterAggregate.DEFAULT_NAME, difficulty, talent);
    }

    /**
     * Start a session with an explicitly assigned talent, which must lie in the difficulty's range.
     */
    public SessionState createSession(DifficultySettings difficulty, int talent) {
        return createSession(CharacterAggregate.DEFAULT_NAME, difficulty, talent);
    }

    public SessionState createSession(String characterName, DifficultySettings difficulty, int talent) {
        validateDifficulty(difficulty);
        validateTalent(difficulty, talent);
        return startSession(characterName, difficulty, talent);
    }

    /**
     * Discard the current session, whatever its phase, and start a fresh one.
     */
    public SessionState restart(DifficultySettings difficulty) {
        validateDifficulty(difficulty);
        logRestart(difficulty);
        return createSession(difficulty);
    }

    public SessionState restart(DifficultySettings difficulty, int talent) {
        validateDifficulty(difficulty);
        validateTalent(difficulty, talent);
        logRestart(difficulty);
        return createSession(difficulty, talent);
    }

    /**
     * Quit: drop the current session without starting another.
     */
    public void endSession() {
        if (current != null) {
            log.info("Ending session {} in phase {} after {} actions",
                current.getSessionId(), current.getPhase(), current.character().getTotalActions());
        }
        current = null;
    }

    public boolean hasSession() {
        return current != null;
    }

    public SessionState currentSession() {
        return requireSession();
    }

    /**
     * Apply one player action to the current session.
     *
     * A rejected action changes no character state and appends exactly one explanatory entry.
     * A null type is a caller bug, like calling without a session: it throws
     * {@link InvalidArgumentException} and leaves the log untouched.
     */
    public ActionResult applyAction(ActionType type) {
        if (type == null) {
            throw new InvalidArgumentException("行动类型不能为空");
        }
        SessionState session = requireSession();
        EventLog eventLog = session.eventLog();
        long mark = eventLog.getLastSequence();

        ActionOutcome outcome;
        try {
            outcome = actionExecutor.execute(type, session.getPhase(), session.character(), session.getDifficulty());
        } catch (CultivationException e) {
            log.warn("Rejected action {} in session {}: {}", type, session.getSessionId(), e.getMessage());
            LogEntry rejection = eventLog.append(EventKind.ACTION_REJECTED,
                String.format("无法%s：%s", type.getDisplayName(), e.getMessage()),
                Map.of("action", type.name(), "error", e.getErrorCode().name()));
            return ActionResult.builder()
                .accepted(false)
                .action(type)
                .summary(rejection.getMessage())
                .errorCode(e.getErrorCode())
                .entries(List.of(rejection))
                .status(buildStatus(session))
                .build();
        }

        recordOutcome(session, outcome);
        recordAchievements(session, outcome);
        evaluatePhase(session);

        List<LogEntry> appended = eventLog.since(mark);
        return ActionResult.builder()
            .accepted(true)
            .action(type)
            .summary(appended.stream().map(LogEntry::getMessage).collect(Collectors.joining(" ")))
            .outcome(outcome)
            .entries(appended)
            .status(buildStatus(session))
            .build();
    }

    public StatusView snapshot() {
        return buildStatus(requireSession());
    }

    public List<ActionType> availableActions() {
        SessionState session = requireSession();
        return actionExecutor.availableActions(session.getPhase(), session.character());
    }

    /**
     * What one action of the given type costs under the current rules. Needs no session.
     */
    public ActionCost actionCost(ActionType type) {
        if (type == null) {
            throw new InvalidArgumentException("行动类型不能为空");
        }
        return rules.costOf(type);
    }

    public List<LogEntry> logEntries() {
        return requireSession().logEntries();
    }

    private SessionState startSession(String characterName, DifficultySettings difficulty, int talent) {
        CharacterAggregate character = new CharacterAggregate(
            characterName, rules, talent, difficulty.getInitialPillCount());
        EventLog eventLog = new EventLog(clock);
        SessionState session = new SessionState(
            UUID.randomUUID().toString(), difficulty, clock.instant(), character, eventLog);

        eventLog.append(EventKind.SESSION_STARTED,
            String.format("欢迎来到极简修仙世界，%s！", character.getName()),
            Map.of("difficulty", difficulty.getId(), "talent", talent));
        eventLog.append(EventKind.SESSION_STARTED,
            String.format("你的资质为 %d，难度%s，身怀丹药%d颗，开始你的修仙之旅。",
                talent, difficulty.getDisplayName(), difficulty.getInitialPillCount()));

        current = session;
        log.info("Started session {} (difficulty: {}, talent: {}, pills: {})",
            session.getSessionId(), difficulty.getId(), talent, difficulty.getInitialPillCount());
        return session;
    }

    private void recordOutcome(SessionState session, ActionOutcome outcome) {
        CharacterAggregate character = session.character();
        EventLog eventLog = session.eventLog();

        eventLog.append(EventKind.ACTION_APPLIED, outcome.getMessage(), Map.of(
            "action", outcome.getAction().name(),
            "healthDelta", outcome.getHealthDelta(),
            "manaDelta", outcome.getManaDelta(),
            "experienceGained", outcome.getExperienceGained(),
            "pillsConsumed", outcome.getPillsConsumed(),
            "totalExperience", character.getExperience().getTotalExperience()));

        for (StageLevel stage : outcome.getStagesCrossed()) {
            log.info("Session {} broke through to {}", session.getSessionId(), stage);
            eventLog.append(EventKind.BREAKTHROUGH,
                String.format("突破至 %s！", stage.getDisplayName()),
                Map.of("stage", stage.name(), "rank", stage.getRank(), "threshold", stage.getThreshold()));
        }
    }

    private void recordAchievements(SessionState session, ActionOutcome outcome) {
        List<Achievement> earned = achievementEvaluator.evaluate(outcome.getAction(),
            session.characterStatus(), outcome.getStagesCrossed(), session.getAchievements());
        for (Achievement achievement : earned) {
            if (session.unlock(achievement)) {
                log.info("Session {} unlocked achievement {}", session.getSessionId(), achievement);
                session.eventLog().append(EventKind.ACHIEVEMENT,
                    String.format("成就解锁：%s", achievement.getDisplayName()),
                    Map.of("achievement", achievement.name()));
            }
        }
    }

    /**
     * Death is checked before ascension, so an action that does both ends in GAME_OVER.
     */
    private void evaluatePhase(SessionState session) {
        CharacterAggregate character = session.character();
        if (!character.isAlive()) {
            session.transitionTo(SessionPhase.GAME_OVER);
            session.eventLog().append(EventKind.GAME_OVER, "修炼失败，游戏结束。",
                Map.of("stage", character.getCurrentStage().name(), "totalActions", character.getTotalActions()));
            log.info("Session {} is over: character died at {}", session.getSessionId(), character.getCurrentStage());
        } else if (character.getCurrentStage().isTerminal()) {
            session.transitionTo(SessionPhase.ASCENDED);
            session.eventLog().append(EventKind.ASCENDED, "恭喜！你已成功飞升，达成完美结局！",
                Map.of("totalActions", character.getTotalActions()));
            log.info("Session {} ascended after {} actions", session.getSessionId(), character.getTotalActions());
        }
    }

    private StatusView buildStatus(SessionState session) {
        CharacterStatus status = session.characterStatus();
        StageLevel stage = status.getStage();
        return StatusView.builder()
            .sessionId(session.getSessionId())
            .difficultyName(session.getDifficulty().getDisplayName())
            .phase(session.getPhase())
            .character(status)
            .stageProgressPercent(rules.stageProgressPercent(status.getTotalExperience()))
            .nextStageThreshold(stage.isTerminal() ? null : rules.nextStageThreshold(stage))
            .powerLevel(rules.powerLevel(status))
            .recommendation(advisor.recommend(status, session.getPhase()))
            .availableActions(List.copyOf(actionExecutor.availableActions(session.getPhase(), session.character())))
            .actionCosts(actionCosts())
            .achievements(session.getAchievements())
            .recentLog(session.eventLog().recent(recentLogSize))
            .build();
    }

    private Map<ActionType, ActionCost> actionCosts() {
        Map<ActionType, ActionCost> costs = new EnumMap<>(ActionType.class);
        for (ActionType type : ActionType.values()) {
            costs.put(type, rules.costOf(type));
        }
        return Collections.unmodifiableMap(costs);
    }

    private void validateTalent(DifficultySettings difficulty, int talent) {
        if (!difficulty.acceptsTalent(talent)) {
            throw new InvalidArgumentException(String.format("资质 %d 不在难度 %s 的范围 [%d, %d] 内",
                talent, difficulty.getDisplayName(), difficulty.getTalentMin(), difficulty.getTalentMax()));
        }
    }

    private void validateDifficulty(DifficultySettings difficulty) {
        if (difficulty == null) {
            throw new InvalidArgumentException("难度设置不能为空");
        }
        difficulty.validate();
    }

    private void logRestart(DifficultySettings difficulty) {
        if (current != null) {
            log.info("Restarting: discarding session {} (phase {})", current.getSessionId(), current.getPhase());
        }
        log.debug("Restart requested with difficulty {}", difficulty.getId());
    }

    private SessionState requireSession() {
        if (current == null) {
            throw new IllegalStateException("No session in progress; call createSession first");
        }
        return current;
    }
}
