package app.revisio.core.review.domain;

import app.revisio.core.review.exception.InvalidRatingException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RatingTest {

    @Test
    void fromGrade_mapsButtonsInOrder() {
        assertThat(Rating.fromGrade(1)).isEqualTo(Rating.AGAIN);
        assertThat(Rating.fromGrade(2)).isEqualTo(Rating.HARD);
        assertThat(Rating.fromGrade(3)).isEqualTo(Rating.GOOD);
        assertThat(Rating.fromGrade(4)).isEqualTo(Rating.EASY);
    }

    @Test
    void fromGrade_rejectsOutOfRange() {
        assertThatThrownBy(() -> Rating.fromGrade(0))
                .isInstanceOf(InvalidRatingException.class)
                .hasMessageContaining("between 1 and 4");
        assertThatThrownBy(() -> Rating.fromGrade(5))
                .isInstanceOfSatisfying(InvalidRatingException.class, ex -> assertThat(ex.getRating()).isEqualTo(5));
    }
}
