package com.dcruver.cultivation.domain.character;

import com.dcruver.cultivation.domain.CultivationRules;
import com.dcruver.cultivation.domain.StageLevel;
import com.dcruver.cultivation.domain.actions.ActionType;
import lombok.Getter;

import java.util.List;

/**
 * One playable character, composed of its components plus behaviour counters.
 *
 * Created at session start and replaced as a whole on restart, never patched.
 * {@code alive} and the current stage are always derived from the components.
 */
@Getter
public class CharacterAggregate {
    public static final String DEFAULT_NAME = "无名修士";

    private final String name;
    private final HealthComponent health;
    private final ManaComponent mana;
    private final ExperienceComponent experience;
    private final TalentComponent talent;
    private final InventoryComponent inventory;

    private int meditationStreak;
    private int totalActions;
    private int pillsConsumed;
    private int breakthroughs;

    public CharacterAggregate(String name, CultivationRules rules, int talent, int initialPillCount) {
        this.name = name == null || name.isBlank() ? DEFAULT_NAME : name;
        this.health = new HealthComponent(rules.getMaxHealth());
        this.mana = new ManaComponent(rules.getMaxMana(), rules.initialMana());
        this.experience = new ExperienceComponent(rules::resolveStage);
        this.talent = new TalentComponent(talent);
        this.inventory = new InventoryComponent(initialPillCount);
    }

    public boolean isAlive() {
        return !health.isDepleted();
    }

    public StageLevel getCurrentStage() {
        return experience.getCurrentStage();
    }

    public int getTalentValue() {
        return talent.getTalent();
    }

    /**
     * Gain experience, counting each stage entered.
     *
     * @return stages crossed, in ascending order
     */
    public List<StageLevel> gainExperience(long amount) {
        List<StageLevel> crossed = experience.add(amount);
        breakthroughs += crossed.size();
        return crossed;
    }

    /**
     * @return remaining pills
     */
    public int consumePills(int n) {
        int remaining = inventory.consume(n);
        pillsConsumed += n;
        return remaining;
    }

    /**
     * Bookkeeping after an action was applied: meditation extends the streak, anything
     * else breaks it.
     */
    public void recordAction(ActionType type) {
        meditationStreak = type == ActionType.MEDITATE ? meditationStreak + 1 : 0;
        totalActions++;
    }

    public CharacterStatus snapshot() {
        return CharacterStatus.builder()
            .name(name)
            .alive(isAlive())
            .health(health.getCurrent())
            .maxHealth(health.getMax())
            .mana(mana.getCurrent())
            .maxMana(mana.getMax())
            .totalExperience(experience.getTotalExperience())
            .stage(experience.getCurrentStage())
            .talent(talent.getTalent())
            .pillCount(inventory.getPillCount())
            .meditationStreak(meditationStreak)
            .totalActions(totalActions)
            .pillsConsumed(pillsConsumed)
            .breakthroughs(breakthroughs)
            .build();
    }
}
