package com.drillsite.api;

import com.drillsite.model.Hole;

import java.util.List;

/**
 * Клиент удалённого Holes API.
 * <p>
 * Реализации не возвращают "частичных" результатов: либо полный ответ, либо {@link HolesApiException}.
 */
public interface HolesApi {

  /**
   * Загружает все скважины проекта: GET /projects/{projectId}/holes.
   *
   * @param projectId ID проекта.
   * @return Полный список скважин в порядке ответа API.
   * @throws HolesApiException если API недоступен или ответ некорректен.
   */
  List<Hole> fetchHoles(long projectId) throws HolesApiException;

  /**
   * Отправляет скорость и глубину бурения: POST /projects/{projectId}/holes/{holeId}/drilling-speed.
   *
   * @param projectId ID проекта.
   * @param holeId    Внешний идентификатор скважины (например, "HK_01").
   * @param report    Тело запроса.
   * @throws HolesApiException если API недоступен или не подтвердил приём ({@code "success": false}).
   */
  void postDrillingSpeed(long projectId, String holeId, DrillingSpeedReport report) throws HolesApiException;
}
