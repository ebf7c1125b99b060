package com.dcruver.cultivation.config;

import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.error.InvalidArgumentException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named difficulty presets, bound from {@code cultivation.difficulties.*}.
 * Falls back to the built-in easy/normal/hard presets when nothing is configured.
 */
@ConfigurationProperties(prefix = "cultivation")
@Data
@Slf4j
public class DifficultyCatalog {

    private String defaultDifficulty = "normal";
    private Map<String, Preset> difficulties = new LinkedHashMap<>(defaults());

    /**
     * Look up a preset by id ("normal") or display name ("普通").
     */
    public Optional<DifficultySettings> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Preset byId = difficulties.get(key);
        if (byId != null) {
            return Optional.of(byId.toSettings(key));
        }
        return difficulties.entrySet().stream()
            .filter(e -> key.equals(e.getValue().getDisplayName()))
            .findFirst()
            .map(e -> e.getValue().toSettings(e.getKey()));
    }

    public DifficultySettings require(String key) {
        return find(key).orElseThrow(() -> new InvalidArgumentException("未知难度: " + key));
    }

    public DifficultySettings getDefault() {
        return require(defaultDifficulty);
    }

    public List<DifficultySettings> all() {
        return difficulties.entrySet().stream()
            .map(e -> e.getValue().toSettings(e.getKey()))
            .toList();
    }

    private static Map<String, Preset> defaults() {
        Map<String, Preset> presets = new LinkedHashMap<>();
        for (DifficultySettings settings : List.of(DifficultySettings.EASY, DifficultySettings.NORMAL, DifficultySettings.HARD)) {
            presets.put(settings.getId(), Preset.from(settings));
        }
        return presets;
    }

    /**
     * Mutable binding target for one preset.
     */
    @Data
    public static class Preset {
        private String displayName;
        private int talentMin = DifficultySettings.MIN_TALENT;
        private int talentMax = DifficultySettings.MAX_TALENT;
        private int initialPillCount;
        private double experienceMultiplier = 1.0;
        private double recoveryMultiplier = 1.0;

        static Preset from(DifficultySettings settings) {
            Preset preset = new Preset();
            preset.setDisplayName(settings.getDisplayName());
            preset.setTalentMin(settings.getTalentMin());
            preset.setTalentMax(settings.getTalentMax());
            preset.setInitialPillCount(settings.getInitialPillCount());
            preset.setExperienceMultiplier(settings.getExperienceMultiplier());
            preset.setRecoveryMultiplier(settings.getRecoveryMultiplier());
            return preset;
        }

        DifficultySettings toSettings(String id) {
            return DifficultySettings.builder()
                .id(id)
                .displayName(displayName != null ? displayName : id)
                .talentMin(talentMin)
                .talentMax(talentMax)
                .initialPillCount(initialPillCount)
                .experienceMultiplier(experienceMultiplier)
                .recoveryMultiplier(recoveryMultiplier)
                .build();
        }
    }
}
