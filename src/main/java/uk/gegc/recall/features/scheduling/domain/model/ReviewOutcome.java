package uk.gegc.recall.features.scheduling.domain.model;

import java.time.Instant;
import java.util.Objects;

public record ReviewOutcome(ReviewGrade grade, Instant answeredAt) {

    public ReviewOutcome {
        Objects.requireNonNull(grade, "grade");
        Objects.requireNonNull(answeredAt, "answeredAt");
    }

    public static ReviewOutcome correct(Instant answeredAt) {
        return new ReviewOutcome(ReviewGrade.GOOD, answeredAt);
    }

    public static ReviewOutcome incorrect(Instant answeredAt) {
        return new ReviewOutcome(ReviewGrade.AGAIN, answeredAt);
    }

    public static ReviewOutcome of(boolean isCorrect, Instant answeredAt) {
        return new ReviewOutcome(ReviewGrade.fromCorrectness(isCorrect), answeredAt);
    }

    public boolean isCorrect() {
        return grade.isCorrect();
    }
}
