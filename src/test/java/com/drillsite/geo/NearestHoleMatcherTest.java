package com.drillsite.geo;

import com.drillsite.model.Hole;
import com.drillsite.model.PositionFix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NearestHoleMatcherTest {

  private final NearestHoleMatcher matcher = new NearestHoleMatcher();
  private final PositionFix origin = new PositionFix(0.0, 0.0, null, Instant.EPOCH);

  @Test
  @DisplayName("Выбирается ближайшая скважина")
  void shouldFindNearestHole() {
    List<Hole> holes = List.of(
        new Hole("far", 0.0, 10.0, null, null),
        new Hole("near", 0.0, 0.001, null, null),
        new Hole("mid", 0.0, 0.5, null, null));

    HoleMatch match = matcher.findNearest(holes, origin);

    assertThat(match.getHole()).hasValueSatisfying(h -> assertThat(h.getExternalId()).isEqualTo("near"));
    assertThat(match.getDistanceMeters()).isBetween(110.0, 112.0);
  }

  @Test
  @DisplayName("Скважина в точке положения: расстояние 0, побеждает первая")
  void shouldPreferFirstOnExactTie() {
    List<Hole> holes = List.of(
        new Hole("a", 0.0, 0.0, null, null),
        new Hole("b", 0.0, 0.001, null, null),
        new Hole("c", 0.0, 0.0, null, null));

    HoleMatch match = matcher.findNearest(holes, origin);

    assertThat(match.getHole().map(Hole::getExternalId)).contains("a");
    assertThat(match.getDistanceMeters()).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Скважины без координат пропускаются")
  void shouldSkipHolesWithoutCoordinates() {
    List<Hole> holes = List.of(
        new Hole("no-coords", null, null, null, null),
        new Hole("half", 0.0, null, null, null),
        new Hole("valid", 0.0, 1.0, null, null));

    HoleMatch match = matcher.findNearest(holes, origin);

    assertThat(match.getHole().map(Hole::getExternalId)).contains("valid");
  }

  @Test
  @DisplayName("Без пригодных скважин результат пустой, расстояние бесконечно")
  void shouldReturnNoneWhenNothingMatches() {
    HoleMatch empty = matcher.findNearest(List.of(), origin);
    HoleMatch noCoords = matcher.findNearest(List.of(new Hole("x", null, null, null, null)), origin);

    assertThat(empty.getHole()).isEmpty();
    assertThat(empty.getDistanceMeters()).isEqualTo(Double.POSITIVE_INFINITY);
    assertThat(empty.isWithin(Double.MAX_VALUE)).isFalse();
    assertThat(noCoords.getHole()).isEmpty();
  }

  @Test
  @DisplayName("Порог расстояния включительный")
  void shouldApplyInclusiveThreshold() {
    HoleMatch match = matcher.findNearest(List.of(new Hole("a", 0.0, 0.0, null, null)), origin);

    assertThat(match.isWithin(0.0)).isTrue();
    assertThat(match.isWithin(-1.0)).isFalse();
  }

  @Test
  @DisplayName("Ранжирование: сортировка, порог и ограничение количества")
  void shouldRankHolesByDistance() {
    List<Hole> holes = List.of(
        new Hole("c", 0.0, 0.003, null, null),
        new Hole("a", 0.0, 0.001, null, null),
        new Hole("skip", null, null, null, null),
        new Hole("b", 0.0, 0.002, null, null),
        new Hole("far", 0.0, 1.0, null, null));

    List<HoleMatch> all = matcher.rankByDistance(holes, origin, null, null, false);
    List<HoleMatch> limited = matcher.rankByDistance(holes, origin, 1000.0, 2, false);

    assertThat(all).extracting(m -> m.getHole().get().getExternalId())
        .containsExactly("a", "b", "c", "far");
    assertThat(limited).extracting(m -> m.getHole().get().getExternalId())
        .containsExactly("a", "b");
  }

  @Test
  @DisplayName("3D-ранжирование учитывает высоту")
  void shouldUseElevationWhenRequested() {
    PositionFix withElevation = new PositionFix(0.0, 0.0, 0.0, Instant.EPOCH);
    List<Hole> holes = List.of(
        new Hole("deep", 0.0, 0.0, 500.0, null),
        new Hole("flat", 0.0, 0.001, 0.0, null));

    List<HoleMatch> flat = matcher.rankByDistance(holes, withElevation, null, null, false);
    List<HoleMatch> spatial = matcher.rankByDistance(holes, withElevation, null, null, true);

    assertThat(flat.get(0).getHole().get().getExternalId()).isEqualTo("deep");
    assertThat(spatial.get(0).getHole().get().getExternalId()).isEqualTo("flat");
  }
}
