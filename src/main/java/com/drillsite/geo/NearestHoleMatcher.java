package com.drillsite.geo;

import com.drillsite.model.Hole;
import com.drillsite.model.PositionFix;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Поиск скважины, ближайшей к текущему GNSS-положению.
 * <p>
 * Класс не хранит состояния. Порог расстояния применяет вызывающая сторона
 * через {@link HoleMatch#isWithin(double)}.
 */
public class NearestHoleMatcher {

  /**
   * Находит ближайшую скважину по расстоянию большого круга.
   * <p>
   * Скважины без координат пропускаются. При точном равенстве расстояний
   * побеждает первая в порядке перебора.
   *
   * @param holes    Набор скважин проекта.
   * @param position Текущее положение.
   * @return Ближайшая скважина или {@link HoleMatch#none()}, если ни у одной нет координат.
   */
  public HoleMatch findNearest(List<Hole> holes, PositionFix position) {
    Hole nearest = null;
    double minDistance = Double.POSITIVE_INFINITY;

    for (Hole hole : holes) {
      if (!hole.hasCoordinates()) {
        continue;
      }
      double distance = GeoMath.greatCircleDistance(
          position.getLatitude(), position.getLongitude(),
          hole.getLatitude(), hole.getLongitude());
      if (distance < minDistance) {
        minDistance = distance;
        nearest = hole;
      }
    }

    return nearest == null ? HoleMatch.none() : new HoleMatch(nearest, minDistance);
  }

  /**
   * Возвращает скважины, отсортированные по удалению от положения (ближайшие первыми).
   *
   * @param maxDistance Отбросить скважины дальше этого расстояния; {@code null} без ограничения.
   * @param limit       Максимальное число результатов; {@code null} означает все.
   * @param use3d       Учитывать перепад высот, если высоты известны с обеих сторон.
   */
  public List<HoleMatch> rankByDistance(List<Hole> holes, PositionFix position,
                                        Double maxDistance, Integer limit, boolean use3d) {
    List<HoleMatch> ranked = new ArrayList<>();
    for (Hole hole : holes) {
      if (!hole.hasCoordinates()) {
        continue;
      }
      double distance = use3d
          ? GeoMath.distance3D(position.getLatitude(), position.getLongitude(), position.getElevation(),
              hole.getLatitude(), hole.getLongitude(), hole.getElevation())
          : GeoMath.greatCircleDistance(position.getLatitude(), position.getLongitude(),
              hole.getLatitude(), hole.getLongitude());
      if (maxDistance != null && distance > maxDistance) {
        continue;
      }
      ranked.add(new HoleMatch(hole, distance));
    }

    // List.sort стабилен: равные расстояния сохраняют исходный порядок
    ranked.sort(Comparator.comparingDouble(HoleMatch::getDistanceMeters));
    if (limit != null && ranked.size() > limit) {
      return new ArrayList<>(ranked.subList(0, Math.max(0, limit)));
    }
    return ranked;
  }
}
