package com.drillsite.service;

import com.drillsite.api.DrillingSpeedReport;
import com.drillsite.api.HolesApi;
import com.drillsite.api.HolesApiException;
import com.drillsite.model.Hole;
import com.drillsite.model.PositionFix;
import com.drillsite.mqtt.MessageListener;
import com.drillsite.mqtt.PositionTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PositionCorrelationServiceTest {

  private static final long PROJECT = 5L;
  private static final String TOPIC = "device/+/upload";

  // ~1.5 м от скважины H-NEAR
  private static final String NEAR_PAYLOAD = "{\"lat\":21.02851,\"lon\":105.85421,\"elevation\":12.0}";
  // ~50 м от скважины H-NEAR
  private static final String FAR_PAYLOAD = "{\"gps\":{\"lat\":21.02895,\"lon\":105.8542}}";

  @Mock
  private PositionTransport transport;

  @Mock
  private HolesApi holesApi;

  private MutableClock clock;
  private PositionCorrelationService service;

  @BeforeEach
  void setUp() throws Exception {
    MockitoAnnotations.openMocks(this);
    clock = new MutableClock(Instant.parse("2024-05-01T10:15:30Z"));
    when(transport.connect()).thenReturn(true);
    when(transport.subscribe(TOPIC)).thenReturn(true);
    when(holesApi.fetchHoles(PROJECT)).thenReturn(List.of(
        new Hole("H-NEAR", 21.0285, 105.8542, 12.0, "Скважина 1"),
        new Hole("H-FAR", 21.04, 105.87, null, "Скважина 2"),
        new Hole("H-EMPTY", null, null, null, "Без координат")));
  }

  @AfterEach
  void tearDown() {
    if (service != null) {
      service.stop();
    }
  }

  private PositionCorrelationService linkedService(double maxDistance) {
    return PositionCorrelationService.builder(transport)
        .topic(TOPIC)
        .remote(holesApi, PROJECT)
        .maxDistanceMeters(maxDistance)
        .clock(clock)
        .build();
  }

  @Test
  @DisplayName("Положение рядом со скважиной → отправка drilling-speed")
  void shouldSubmitDrillingSpeedForNearbyHole() throws Exception {
    service = linkedService(5.0);
    assertThat(service.start()).isTrue();
    service.setDrillingData(0.5, 12.3);

    service.onMessage("device/rig-1/upload", NEAR_PAYLOAD);

    ArgumentCaptor<DrillingSpeedReport> captor = ArgumentCaptor.forClass(DrillingSpeedReport.class);
    verify(holesApi).postDrillingSpeed(eq(PROJECT), eq("H-NEAR"), captor.capture());
    assertThat(captor.getValue().getSpeed()).isEqualTo(0.5);
    assertThat(captor.getValue().getDepth()).isEqualTo(12.3);
    assertThat(captor.getValue().getSensorId()).isEqualTo("GNSS_RIG");
    assertThat(captor.getValue().getTimestamp()).isEqualTo("2024-05-01T10:15:30Z");

    CorrelationStats stats = service.getStats();
    assertThat(stats.getMessagesReceived()).isEqualTo(1);
    assertThat(stats.getFixesProcessed()).isEqualTo(1);
    assertThat(stats.getHolesUpdated()).isEqualTo(1);
    assertThat(stats.getLastUpdateTimestamp()).isEqualTo(clock.instant());
    assertThat(stats.getLastFix().getLatitude()).isEqualTo(21.02851);
  }

  @Test
  @DisplayName("Скважина дальше порога → отправки нет")
  void shouldNotSubmitBeyondThreshold() throws Exception {
    service = linkedService(5.0);
    service.start();
    service.setDrillingData(0.5, 12.3);

    service.onMessage("device/rig-1/upload", FAR_PAYLOAD);

    verify(holesApi, never()).postDrillingSpeed(anyLong(), anyString(), any());
    assertThat(service.getStats().getFixesProcessed()).isEqualTo(1);
    assertThat(service.getStats().getHolesUpdated()).isZero();
  }

  @Test
  @DisplayName("Порог 100 м пропускает положение в 50 м")
  void shouldSubmitWithinLargerThreshold() throws Exception {
    service = linkedService(100.0);
    service.start();
    service.setDrillingData(0.5, 12.3);

    service.onMessage("device/rig-1/upload", FAR_PAYLOAD);

    verify(holesApi).postDrillingSpeed(eq(PROJECT), eq("H-NEAR"), any());
  }

  @Test
  @DisplayName("Без данных бурения отправки нет")
  void shouldNotSubmitWithoutDrillingData() throws Exception {
    service = linkedService(5.0);
    service.start();

    service.onMessage("device/rig-1/upload", NEAR_PAYLOAD);

    verify(holesApi, never()).postDrillingSpeed(anyLong(), anyString(), any());
    assertThat(service.getStats().getFixesProcessed()).isEqualTo(1);
  }

  @Test
  @DisplayName("Ошибка API при отправке учитывается, сервис продолжает работу")
  void shouldCountFailedSubmissions() throws Exception {
    doThrow(new HolesApiException("HTTP 500", 500, null))
        .doNothing()
        .when(holesApi).postDrillingSpeed(anyLong(), anyString(), any());
    service = linkedService(5.0);
    service.start();
    service.setDrillingData(0.5, 12.3);

    service.onMessage("device/rig-1/upload", NEAR_PAYLOAD);
    service.onMessage("device/rig-1/upload", NEAR_PAYLOAD);

    CorrelationStats stats = service.getStats();
    assertThat(stats.getSubmissionsFailed()).isEqualTo(1);
    assertThat(stats.getHolesUpdated()).isEqualTo(1);
  }

  @Test
  @DisplayName("RuntimeException клиента при отправке тоже считается ошибкой")
  void shouldCountUnexpectedSubmissionErrors() throws Exception {
    doThrow(new IllegalStateException("boom")).when(holesApi).postDrillingSpeed(anyLong(), anyString(), any());
    service = linkedService(5.0);
    service.start();
    service.setDrillingData(0.5, 12.3);

    service.onMessage("device/rig-1/upload", NEAR_PAYLOAD);

    assertThat(service.getStats().getSubmissionsFailed()).isEqualTo(1);
    assertThat(service.getStats().getHolesUpdated()).isZero();
  }

  @Test
  @DisplayName("Пустой список скважин → отправки нет, положение учтено")
  void shouldStopPipelineWhenNoHoles() throws Exception {
    when(holesApi.fetchHoles(PROJECT)).thenReturn(List.of());
    service = linkedService(5.0);
    service.start();
    service.setDrillingData(0.5, 12.3);

    service.onMessage("device/rig-1/upload", NEAR_PAYLOAD);

    verify(holesApi, never()).postDrillingSpeed(anyLong(), anyString(), any());
    assertThat(service.getStats().getFixesProcessed()).isEqualTo(1);
    assertThat(service.getStats().getSubmissionsFailed()).isZero();
  }

  @Test
  @DisplayName("API скважин недоступен → отправки нет, исключение не выходит наружу")
  void shouldStopPipelineWhenHoleFetchFails() throws Exception {
    when(holesApi.fetchHoles(PROJECT)).thenThrow(new HolesApiException("Connection refused"));
    service = linkedService(5.0);
    service.start();
    service.setDrillingData(0.5, 12.3);

    service.onMessage("device/rig-1/upload", NEAR_PAYLOAD);

    verify(holesApi, never()).postDrillingSpeed(anyLong(), anyString(), any());
    assertThat(service.getStats().getMessagesReceived()).isEqualTo(1);
    assertThat(service.getStats().getFixesProcessed()).isEqualTo(1);
  }

  @Test
  @DisplayName("Скважины загружаются один раз в пределах TTL, clearHoleCache() сбрасывает кэш")
  void shouldCacheHoles() throws Exception {
    service = linkedService(5.0);
    service.start();

    service.onMessage("t", NEAR_PAYLOAD);
    service.onMessage("t", NEAR_PAYLOAD);
    verify(holesApi, times(1)).fetchHoles(PROJECT);

    service.clearHoleCache();
    service.onMessage("t", NEAR_PAYLOAD);
    verify(holesApi, times(2)).fetchHoles(PROJECT);

    clock.advance(Duration.ofMinutes(5));
    service.onMessage("t", NEAR_PAYLOAD);
    verify(holesApi, times(3)).fetchHoles(PROJECT);
  }

  @Test
  @DisplayName("Режим наблюдения: положения учитываются, API не вызывается")
  void shouldOnlyCountFixesInMonitoringMode() throws Exception {
    service = PositionCorrelationService.builder(transport).topic(TOPIC).clock(clock).build();
    service.start();
    service.setDrillingData(0.5, 12.3);

    service.onMessage("t", NEAR_PAYLOAD);

    assertThat(service.getStats().getFixesProcessed()).isEqualTo(1);
    assertThat(service.getStats().getLastFix()).isEqualTo(new PositionFix(21.02851, 105.85421, 12.0, clock.instant()));
    verifyNoInteractions(holesApi);
  }

  @Test
  @DisplayName("Неразбираемое сообщение считается полученным, но не обработанным")
  void shouldSurviveUnparseableMessages() {
    service = linkedService(5.0);
    service.start();

    service.onMessage("t", "{\"foo\":\"bar\"}");
    service.onMessage("t", "garbage");
    service.onMessage("t", null);

    CorrelationStats stats = service.getStats();
    assertThat(stats.getMessagesReceived()).isEqualTo(3);
    assertThat(stats.getFixesProcessed()).isZero();
  }

  @Test
  @DisplayName("Сообщения до запуска игнорируются")
  void shouldIgnoreMessagesWhenStopped() {
    service = linkedService(5.0);

    service.onMessage("t", NEAR_PAYLOAD);

    assertThat(service.getStats().getMessagesReceived()).isZero();
  }

  @Test
  @DisplayName("Нет подключения к брокеру → start() возвращает false")
  void shouldFailToStartWithoutConnection() {
    when(transport.connect()).thenReturn(false);
    service = linkedService(5.0);

    assertThat(service.start()).isFalse();
    assertThat(service.isRunning()).isFalse();
    verify(transport, never()).subscribe(anyString());
  }

  @Test
  @DisplayName("Ошибка подписки → start() возвращает false и отключается")
  void shouldFailToStartWhenSubscribeFails() {
    when(transport.subscribe(TOPIC)).thenReturn(false);
    service = linkedService(5.0);

    assertThat(service.start()).isFalse();
    assertThat(service.isRunning()).isFalse();
    verify(transport).disconnect();
  }

  @Test
  @DisplayName("Сообщения от транспорта обрабатываются отдельным потоком по порядку")
  void shouldDispatchTransportMessages() throws Exception {
    service = linkedService(5.0);
    service.start();
    service.setDrillingData(0.5, 12.3);

    ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
    verify(transport).setMessageListener(listener.capture());
    listener.getValue().onMessage("device/rig-1/upload", NEAR_PAYLOAD);

    verify(holesApi, timeout(5000)).postDrillingSpeed(eq(PROJECT), eq("H-NEAR"), any());
  }

  @Test
  @DisplayName("stop() дообрабатывает сообщения, уже принятые от транспорта")
  void shouldDrainAcceptedMessagesOnStop() throws Exception {
    when(holesApi.fetchHoles(PROJECT)).thenAnswer(invocation -> {
      Thread.sleep(300);
      return List.of(new Hole("H-NEAR", 21.0285, 105.8542, 12.0, "Скважина 1"));
    });
    service = linkedService(5.0);
    service.start();
    service.setDrillingData(0.5, 12.3);

    ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
    verify(transport).setMessageListener(listener.capture());
    for (int i = 0; i < 3; i++) {
      listener.getValue().onMessage("device/rig-1/upload", NEAR_PAYLOAD);
    }

    service.stop();

    CorrelationStats stats = service.getStats();
    assertThat(stats.getMessagesReceived()).isEqualTo(3);
    assertThat(stats.getFixesProcessed()).isEqualTo(3);
    assertThat(stats.getHolesUpdated()).isEqualTo(3);
    assertThat(service.isRunning()).isFalse();
  }

  @Test
  @DisplayName("stop() отписывается и отключается от брокера")
  void shouldUnsubscribeOnStop() {
    service = linkedService(5.0);
    service.start();

    service.stop();

    assertThat(service.isRunning()).isFalse();
    verify(transport).unsubscribe(TOPIC);
    verify(transport).disconnect();
  }

  @Test
  @DisplayName("Некорректные параметры сборки отклоняются")
  void shouldValidateBuilder() {
    assertThatThrownBy(() -> PositionCorrelationService.builder(null).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PositionCorrelationService.builder(transport).topic(" ").build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PositionCorrelationService.builder(transport).maxDistanceMeters(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
