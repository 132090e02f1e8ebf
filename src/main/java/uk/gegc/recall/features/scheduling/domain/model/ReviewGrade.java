package uk.gegc.recall.features.scheduling.domain.model;

import lombok.Getter;

@Getter
public enum ReviewGrade {
    AGAIN(false),
    GOOD(true);

    private final boolean correct;

    ReviewGrade(boolean correct) {
        this.correct = correct;
    }

    public static ReviewGrade fromCorrectness(boolean isCorrect) {
        return isCorrect ? GOOD : AGAIN;
    }
}
