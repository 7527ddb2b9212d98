package com.drillsite.geo;

import java.util.Locale;

/**
 * Геодезические расчёты расстояний между GNSS-координатами.
 */
public final class GeoMath {

  /** Средний радиус Земли в метрах. */
  public static final double EARTH_RADIUS_METERS = 6_371_000.0;

  /**
   * Расстояние по дуге большого круга (формула гаверсинусов).
   *
   * @return Расстояние в метрах, всегда неотрицательное.
   */
  public static double greatCircleDistance(double lat1, double lon1, double lat2, double lon2) {
    double phi1 = Math.toRadians(lat1);
    double phi2 = Math.toRadians(lat2);
    double dPhi = Math.toRadians(lat2 - lat1);
    double dLambda = Math.toRadians(lon2 - lon1);

    double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
        + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    return EARTH_RADIUS_METERS * c;
  }

  /**
   * Приближённое 3D-расстояние: горизонтальная дуга и перепад высот как катеты.
   * <p>
   * Это не точная геодезия: вертикаль считается ортогональной искривлённой дуге.
   * Погрешность пренебрежимо мала на расстояниях до нескольких километров.
   * Если хотя бы одна высота неизвестна, возвращается {@link #greatCircleDistance}.
   */
  public static double distance3D(double lat1, double lon1, Double elev1,
                                  double lat2, double lon2, Double elev2) {
    double horizontal = greatCircleDistance(lat1, lon1, lat2, lon2);
    if (elev1 == null || elev2 == null) {
      return horizontal;
    }
    double vertical = Math.abs(elev1 - elev2);
    return Math.sqrt(horizontal * horizontal + vertical * vertical);
  }

  /**
   * Форматирует расстояние для логов: "15.3m" или "1.23km".
   */
  public static String formatDistance(double meters) {
    if (Double.isInfinite(meters)) {
      return "∞";
    }
    if (meters < 1000) {
      return String.format(Locale.ROOT, "%.1fm", meters);
    }
    return String.format(Locale.ROOT, "%.2fkm", meters / 1000);
  }

  private GeoMath() {
    throw new UnsupportedOperationException("Utility class");
  }
}
