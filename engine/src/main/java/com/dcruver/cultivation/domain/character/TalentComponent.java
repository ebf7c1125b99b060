package com.dcruver.cultivation.domain.character;

import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.error.InvalidArgumentException;
import lombok.Getter;

/**
 * Fixed aptitude (资质), set once at creation.
 */
@Getter
public class TalentComponent {
    private final int talent;

    public TalentComponent(int talent) {
        if (talent < DifficultySettings.MIN_TALENT || talent > DifficultySettings.MAX_TALENT) {
            throw new InvalidArgumentException(String.format("资质 %d 不在 [%d, %d] 内",
                talent, DifficultySettings.MIN_TALENT, DifficultySettings.MAX_TALENT));
        }
        this.talent = talent;
    }
}
