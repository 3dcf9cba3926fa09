/*
 * Where: Notification delivery service unit tests
 * What: Channel ordering, fan-out aggregation, device invalidation and guarded terminal writes
 * Why: These decide whether a user is notified once, twice or never
 */
package com.salesos.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesos.notification.apns.ApnsConfigurationException;
import com.salesos.notification.apns.ApnsCredentialManager;
import com.salesos.notification.apns.ApnsEnvironment;
import com.salesos.notification.apns.ApnsPushClient;
import com.salesos.notification.config.ApnsProperties;
import com.salesos.notification.config.NotificationClaimProperties;
import com.salesos.notification.model.DeviceRegistration;
import com.salesos.notification.model.DeviceType;
import com.salesos.notification.model.JobStatus;
import com.salesos.notification.model.NotificationJob;
import com.salesos.notification.model.NotificationPriority;
import com.salesos.notification.model.PushTokenType;
import com.salesos.notification.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@ExtendWith(MockitoExtension.class)
class NotificationDeliveryServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-02T09:00:00Z");
  private static final String WORKER = "worker-1";
  private static final NotificationClaimProperties PROPERTIES =
      new NotificationClaimProperties(true, Duration.ofMinutes(1), 25, Duration.ofMinutes(5), 200);

  @Mock private NotificationJobRepository jobRepository;
  @Mock private RealtimeChannel realtimeChannel;
  @Mock private NativePushChannel nativePushChannel;
  @Mock private DeviceRegistry deviceRegistry;
  @Mock private NotificationMetrics metrics;

  private NotificationDeliveryService service;
  private NotificationJob job;

  @BeforeEach
  void setUp() {
    final Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    service =
        new NotificationDeliveryService(
            jobRepository,
            realtimeChannel,
            nativePushChannel,
            deviceRegistry,
            new NotificationMessageMapper(new ObjectMapper()),
            metrics,
            PROPERTIES,
            clock);
    job = inFlightJob();
  }

  @Test
  void realtimeDeliveryMarksDeliveredWithoutTouchingNativePush() {
    when(realtimeChannel.pushToUser(eq("u_1"), any(RealtimeEnvelope.class))).thenReturn(true);
    when(jobRepository.markDelivered(job.jobId(), FIXED_NOW, WORKER)).thenReturn(1);

    final DeliveryOutcome outcome = service.deliver(job, WORKER);

    assertThat(outcome.status()).isEqualTo(JobStatus.DELIVERED);
    verifyNoInteractions(deviceRegistry, nativePushChannel);
    verify(metrics).recordDeliveryResult(JobStatus.DELIVERED);
    verify(metrics).recordDeliveryE2eDelay(job.createdAt(), FIXED_NOW);
  }

  @Test
  void realtimeEnvelopeCarriesTheJob() {
    when(realtimeChannel.pushToUser(eq("u_1"), any(RealtimeEnvelope.class))).thenReturn(true);
    when(jobRepository.markDelivered(job.jobId(), FIXED_NOW, WORKER)).thenReturn(1);

    service.deliver(job, WORKER);

    final ArgumentCaptor<RealtimeEnvelope> captor = ArgumentCaptor.forClass(RealtimeEnvelope.class);
    verify(realtimeChannel).pushToUser(eq("u_1"), captor.capture());
    assertThat(captor.getValue().notificationId()).isEqualTo(job.jobId().toString());
    assertThat(captor.getValue().title()).isEqualTo("Deal won");
    assertThat(captor.getValue().actionData()).isEqualTo("{\"dealId\":\"d-9\"}");
  }

  @Test
  void acceptingDeviceMarksSent() {
    final DeviceRegistration device = device("token-a");
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(device));
    when(nativePushChannel.send(eq("token-a"), any(PushMessage.class)))
        .thenReturn(PushResult.accepted("apns-1"));
    when(jobRepository.markSent(job.jobId(), FIXED_NOW, null, WORKER)).thenReturn(1);

    final DeliveryOutcome outcome = service.deliver(job, WORKER);

    assertThat(outcome.status()).isEqualTo(JobStatus.SENT);
    assertThat(outcome.devicesAccepted()).isEqualTo(1);
    verify(deviceRegistry, never()).invalidateAddress(any());
    verify(metrics).recordChannelAttempt(NotificationMetrics.CHANNEL_REALTIME, false);
    verify(metrics).recordChannelAttempt(NotificationMetrics.CHANNEL_APNS, true);
  }

  @Test
  void pushMessageUsesJobIdAsCollapseKey() {
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(device("token-a")));
    when(nativePushChannel.send(eq("token-a"), any(PushMessage.class)))
        .thenReturn(PushResult.accepted("apns-1"));
    when(jobRepository.markSent(job.jobId(), FIXED_NOW, null, WORKER)).thenReturn(1);

    service.deliver(job, WORKER);

    final ArgumentCaptor<PushMessage> captor = ArgumentCaptor.forClass(PushMessage.class);
    verify(nativePushChannel).send(eq("token-a"), captor.capture());
    final PushMessage message = captor.getValue();
    assertThat(message.collapseId()).isEqualTo(job.jobId().toString());
    assertThat(message.threadId()).isEqualTo("DEAL_UPDATE");
    assertThat(message.category()).isEqualTo("open_deal");
    assertThat(message.priority()).isEqualTo(NotificationPriority.HIGH);
    assertThat(message.data()).containsEntry("notificationId", job.jobId().toString());
  }

  @Test
  void permanentRejectionFailsJobAndInvalidatesDevice() {
    final DeviceRegistration device = device("token-dead");
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(device));
    when(nativePushChannel.send(eq("token-dead"), any()))
        .thenReturn(PushResult.rejected(410, "Unregistered", true));
    when(deviceRegistry.invalidateAddress(device.deviceId())).thenReturn(true);
    when(jobRepository.markFailed(eq(job.jobId()), anyString(), eq(WORKER))).thenReturn(1);

    final DeliveryOutcome outcome = service.deliver(job, WORKER);

    assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
    assertThat(outcome.devicesInvalidated()).isEqualTo(1);
    assertThat(outcome.lastError()).contains("Unregistered").contains("410");
    verify(deviceRegistry).invalidateAddress(device.deviceId());
    verify(metrics).recordDeviceInvalidated();
    verify(jobRepository).markFailed(job.jobId(), outcome.lastError(), WORKER);
  }

  @Test
  void transientRejectionFailsJobButKeepsDevice() {
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(device("token-a")));
    when(nativePushChannel.send(eq("token-a"), any())).thenReturn(PushResult.unreachable("Timeout"));
    when(jobRepository.markFailed(eq(job.jobId()), anyString(), eq(WORKER))).thenReturn(1);

    final DeliveryOutcome outcome = service.deliver(job, WORKER);

    assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
    assertThat(outcome.lastError()).endsWith("Timeout");
    verify(deviceRegistry, never()).invalidateAddress(any());
  }

  @Test
  void partialFanOutIsSentAndKeepsTheFailingDeviceReason() {
    final DeviceRegistration good = device("token-good");
    final DeviceRegistration bad = device("token-bad");
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(good, bad));
    when(nativePushChannel.send(eq("token-good"), any())).thenReturn(PushResult.accepted("apns-1"));
    when(nativePushChannel.send(eq("token-bad"), any()))
        .thenReturn(PushResult.rejected(400, "BadDeviceToken", true));
    when(deviceRegistry.invalidateAddress(bad.deviceId())).thenReturn(true);
    when(jobRepository.markSent(eq(job.jobId()), eq(FIXED_NOW), anyString(), eq(WORKER))).thenReturn(1);

    final DeliveryOutcome outcome = service.deliver(job, WORKER);

    assertThat(outcome.status()).isEqualTo(JobStatus.SENT);
    assertThat(outcome.devicesAttempted()).isEqualTo(2);
    assertThat(outcome.devicesAccepted()).isEqualTo(1);
    verify(jobRepository).markSent(eq(job.jobId()), eq(FIXED_NOW), startsWith("deviceId=" + bad.deviceId()), eq(WORKER));
  }

  @Test
  void throwingDeviceDoesNotStopTheFanOut() {
    final DeviceRegistration broken = device("token-broken");
    final DeviceRegistration good = device("token-good");
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(broken, good));
    when(nativePushChannel.send(eq("token-broken"), any()))
        .thenThrow(new RestClientException("stream reset"));
    when(nativePushChannel.send(eq("token-good"), any())).thenReturn(PushResult.accepted("apns-2"));
    when(jobRepository.markSent(eq(job.jobId()), eq(FIXED_NOW), anyString(), eq(WORKER))).thenReturn(1);

    final DeliveryOutcome outcome = service.deliver(job, WORKER);

    assertThat(outcome.status()).isEqualTo(JobStatus.SENT);
    assertThat(outcome.devicesAttempted()).isEqualTo(2);
    assertThat(outcome.devicesAccepted()).isEqualTo(1);
    assertThat(outcome.lastError()).isEqualTo("deviceId=" + broken.deviceId() + " stream reset");
    verify(deviceRegistry, never()).invalidateAddress(any());
    verify(metrics).recordChannelAttempt(NotificationMetrics.CHANNEL_APNS, false);
    verify(metrics).recordChannelAttempt(NotificationMetrics.CHANNEL_APNS, true);
  }

  @Test
  void blankTokenIsInvalidatedWhileTheOtherDeviceStillReceivesThePush() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final ApnsCredentialManager credentialManager = mock(ApnsCredentialManager.class);
    when(credentialManager.getToken()).thenReturn("jwt-1");
    final Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    final ApnsPushClient apnsClient =
        new ApnsPushClient(
            builder.baseUrl("https://apns.test").build(),
            credentialManager,
            new ApnsProperties(
                ApnsEnvironment.SANDBOX,
                "https://apns.test",
                "TEAM123456",
                "KEY1234567",
                null,
                null,
                "com.salesos.mobile",
                null,
                null,
                null,
                null,
                null),
            new ObjectMapper(),
            clock);
    final NotificationDeliveryService realClientService =
        new NotificationDeliveryService(
            jobRepository,
            realtimeChannel,
            apnsClient,
            deviceRegistry,
            new NotificationMessageMapper(new ObjectMapper()),
            metrics,
            PROPERTIES,
            clock);
    final DeviceRegistration blank = device(" ");
    final DeviceRegistration good = device("goodtoken123456");
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(blank, good));
    when(deviceRegistry.invalidateAddress(blank.deviceId())).thenReturn(true);
    when(jobRepository.markSent(eq(job.jobId()), eq(FIXED_NOW), anyString(), eq(WORKER))).thenReturn(1);
    server
        .expect(requestTo("https://apns.test/3/device/goodtoken123456"))
        .andRespond(withSuccess().header("apns-id", "apns-good"));

    final DeliveryOutcome outcome = realClientService.deliver(job, WORKER);

    server.verify();
    assertThat(outcome.status()).isEqualTo(JobStatus.SENT);
    assertThat(outcome.devicesAccepted()).isEqualTo(1);
    assertThat(outcome.devicesInvalidated()).isEqualTo(1);
    verify(deviceRegistry).invalidateAddress(blank.deviceId());
    verify(deviceRegistry, never()).invalidateAddress(good.deviceId());
  }

  @Test
  void leaseIsExtendedBeforeSendingWhenLessThanHalfRemains() {
    final NotificationJob shortLease = inFlightJob(FIXED_NOW.minusSeconds(240), FIXED_NOW.plusSeconds(60));
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(device("token-a")));
    when(jobRepository.extendLease(shortLease.jobId(), FIXED_NOW.plusSeconds(300), WORKER)).thenReturn(1);
    when(nativePushChannel.send(eq("token-a"), any())).thenReturn(PushResult.accepted("apns-1"));
    when(jobRepository.markSent(shortLease.jobId(), FIXED_NOW, null, WORKER)).thenReturn(1);

    assertThat(service.deliver(shortLease, WORKER).status()).isEqualTo(JobStatus.SENT);
    verify(jobRepository).extendLease(shortLease.jobId(), FIXED_NOW.plusSeconds(300), WORKER);
  }

  @Test
  void leaseWithPlentyLeftIsNotExtended() {
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(device("token-a")));
    when(nativePushChannel.send(eq("token-a"), any())).thenReturn(PushResult.accepted("apns-1"));
    when(jobRepository.markSent(job.jobId(), FIXED_NOW, null, WORKER)).thenReturn(1);

    service.deliver(job, WORKER);

    verify(jobRepository, never()).extendLease(any(), any(), anyString());
  }

  @Test
  void lostLeaseStopsTheFanOutBeforeSending() {
    final NotificationJob shortLease = inFlightJob(FIXED_NOW.minusSeconds(290), FIXED_NOW.plusSeconds(10));
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1"))
        .thenReturn(List.of(device("token-a"), device("token-b")));
    when(jobRepository.extendLease(shortLease.jobId(), FIXED_NOW.plusSeconds(300), WORKER)).thenReturn(0);
    when(jobRepository.markFailed(shortLease.jobId(), "claim lost during fan-out", WORKER)).thenReturn(0);

    final DeliveryOutcome outcome = service.deliver(shortLease, WORKER);

    assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
    assertThat(outcome.devicesAttempted()).isZero();
    verifyNoInteractions(nativePushChannel);
    verify(metrics, never()).recordDeliveryResult(any());
  }

  @Test
  void realtimeErrorFallsBackToNativePush() {
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenThrow(new IllegalStateException("gateway down"));
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(device("token-a")));
    when(nativePushChannel.send(eq("token-a"), any())).thenReturn(PushResult.accepted("apns-1"));
    when(jobRepository.markSent(job.jobId(), FIXED_NOW, null, WORKER)).thenReturn(1);

    assertThat(service.deliver(job, WORKER).status()).isEqualTo(JobStatus.SENT);
  }

  @Test
  void noDevicesFailsWithNoReachableChannel() {
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of());
    when(jobRepository.markFailed(job.jobId(), "no reachable channel", WORKER)).thenReturn(1);

    final DeliveryOutcome outcome = service.deliver(job, WORKER);

    assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
    verifyNoInteractions(nativePushChannel);
    verify(metrics).recordDeliveryResult(JobStatus.FAILED);
  }

  @Test
  void nativeConfigurationErrorFailsJob() {
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(device("token-a")));
    when(nativePushChannel.send(eq("token-a"), any()))
        .thenThrow(new ApnsConfigurationException("notification.apns.key-id is required for native push"));
    when(jobRepository.markFailed(eq(job.jobId()), anyString(), eq(WORKER))).thenReturn(1);

    final DeliveryOutcome outcome = service.deliver(job, WORKER);

    assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
    assertThat(outcome.lastError()).startsWith("native push misconfigured");
  }

  @Test
  void deviceRegistryFailureFailsJobInsteadOfPropagating() {
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1"))
        .thenThrow(new DataAccessResourceFailureException("registry down"));
    when(jobRepository.markFailed(job.jobId(), "registry down", WORKER)).thenReturn(1);

    assertThat(service.deliver(job, WORKER).status()).isEqualTo(JobStatus.FAILED);
  }

  @Test
  void lostClaimSkipsMetricsAndDoesNotThrow() {
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(true);
    when(jobRepository.markDelivered(job.jobId(), FIXED_NOW, WORKER)).thenReturn(0);

    service.deliver(job, WORKER);

    verify(metrics, never()).recordDeliveryResult(any());
    verify(metrics, never()).recordDeliveryE2eDelay(any(), any());
  }

  @Test
  void mdcIsClearedAfterDelivery() {
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(true);
    when(jobRepository.markDelivered(job.jobId(), FIXED_NOW, WORKER)).thenReturn(1);

    service.deliver(job, WORKER);

    assertThat(MDC.get("job_id")).isNull();
    assertThat(MDC.get("worker_id")).isNull();
  }

  @Test
  void truncateErrorCapsAtConfiguredLength() {
    assertThat(service.truncateError("x".repeat(300))).hasSize(200);
    assertThat(service.truncateError("short")).isEqualTo("short");
    assertThat(service.truncateError(null)).isNull();
  }

  @Test
  void sentWithoutErrorPassesNullLastError() {
    when(realtimeChannel.pushToUser(eq("u_1"), any())).thenReturn(false);
    when(deviceRegistry.listActiveNativeDevices("u_1")).thenReturn(List.of(device("token-a")));
    when(nativePushChannel.send(eq("token-a"), any())).thenReturn(PushResult.accepted("apns-1"));
    when(jobRepository.markSent(eq(job.jobId()), eq(FIXED_NOW), isNull(), eq(WORKER))).thenReturn(1);

    service.deliver(job, WORKER);

    verify(jobRepository).markSent(eq(job.jobId()), eq(FIXED_NOW), isNull(), eq(WORKER));
  }

  private static DeviceRegistration device(String token) {
    return new DeviceRegistration(
        UUID.randomUUID(),
        "u_1",
        DeviceType.MOBILE_IOS,
        token,
        PushTokenType.APNS,
        true,
        true,
        FIXED_NOW.minusSeconds(3600));
  }

  private static NotificationJob inFlightJob() {
    return inFlightJob(FIXED_NOW.minusSeconds(5), FIXED_NOW.plusSeconds(295));
  }

  private static NotificationJob inFlightJob(Instant lockedAt, Instant leaseUntil) {
    return new NotificationJob(
        UUID.randomUUID(),
        "u_1",
        "Deal won",
        "Acme closed at 40k",
        "DEAL_UPDATE",
        NotificationPriority.HIGH,
        "open_deal",
        "{\"dealId\":\"d-9\"}",
        JobStatus.IN_FLIGHT,
        FIXED_NOW.minusSeconds(120),
        WORKER,
        lockedAt,
        leaseUntil,
        null,
        FIXED_NOW.minusSeconds(300),
        null,
        null);
  }
}
