package com.dcruver.cultivation.domain.character;

import com.dcruver.cultivation.domain.StageLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only copy of a character's fields at one moment.
 */
@Value
@Builder(toBuilder = true)
public class CharacterStatus {
    String name;
    boolean alive;

    int health;
    int maxHealth;
    int mana;
    int maxMana;

    long totalExperience;
    StageLevel stage;
    int talent;
    int pillCount;

    // Counters
    int meditationStreak;
    int totalActions;
    int pillsConsumed;
    int breakthroughs;

    public double getHealthPercentage() {
        return maxHealth == 0 ? 0.0 : (double) health / maxHealth;
    }

    public double getManaPercentage() {
        return maxMana == 0 ? 0.0 : (double) mana / maxMana;
    }
}
