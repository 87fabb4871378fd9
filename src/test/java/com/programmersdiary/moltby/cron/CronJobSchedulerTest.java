package com.programmersdiary.moltby.cron;

import com.programmersdiary.moltby.bot.TransportGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CronJobSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock private TaskScheduler taskScheduler;
    @Mock private ScheduledFuture<Object> future;
    @Mock private TransportGateway gateway;

    private CronJobRegistry registry;
    private CronDispatcher dispatcher;
    private CronTimerManager timerManager;
    private CronJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        when(gateway.isAttached()).thenReturn(true);
        registry = spy(new CronJobRegistry(clock));
        dispatcher = new CronDispatcher(registry, gateway, clock, 1);
        timerManager = new CronTimerManager(taskScheduler, dispatcher, clock);
        scheduler = new CronJobScheduler(registry, timerManager, dispatcher);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    void createReturnsEnabledJobWithArmedTimer() {
        var job = scheduler.createJob(ping());

        assertThat(job.enabled()).isTrue();
        assertThat(job.runHistory()).isEmpty();
        assertThat(job.lastRun()).isNull();
        assertThat(timerManager.state(job.id())).isEqualTo(TimerState.ARMED);
        assertThat(scheduler.listJobs()).containsExactly(job);
    }

    @Test
    void createDisabledJobLeavesTimerAbsent() {
        var job = scheduler.createJob(new JobDefinition("ping", null, null, "*/5 * * * *", "123", "hi",
                false, null, null));

        assertThat(job.enabled()).isFalse();
        assertThat(timerManager.state(job.id())).isEqualTo(TimerState.ABSENT);
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void invalidScheduleLeavesRegistryAndTimersUntouched() {
        scheduler.createJob(ping());

        assertThatThrownBy(() -> scheduler.createJob(new JobDefinition("bad", null, null, "not-a-cron",
                "123", "hi", null, null, null)))
                .isInstanceOf(JobValidationException.class)
                .hasMessage("Invalid cron expression");

        assertThat(scheduler.listJobs()).hasSize(1);
        assertThat(timerManager.armedCount()).isEqualTo(1);
    }

    @Test
    void missingFieldsAreRejected() {
        assertThatThrownBy(() -> scheduler.createJob(new JobDefinition(null, null, null, "* * * * *",
                "123", "hi", null, null, null)))
                .isInstanceOf(JobValidationException.class)
                .hasMessage("Missing required fields");
        assertThat(scheduler.listJobs()).isEmpty();
    }

    @Test
    void failedRegistrationDestroysArmedTimer() {
        doThrow(new IllegalStateException("store unavailable")).when(registry).register(any());

        assertThatThrownBy(() -> scheduler.createJob(ping())).isInstanceOf(IllegalStateException.class);

        verify(future).cancel(false);
        assertThat(timerManager.armedCount()).isZero();
    }

    @Test
    void toggleOffThenOnThenFireRecordsOneRun() throws Exception {
        var job = scheduler.createJob(ping());

        var off = scheduler.toggleJob(job.id());
        assertThat(off.enabled()).isFalse();
        assertThat(timerManager.state(job.id())).isEqualTo(TimerState.DISARMED);

        var on = scheduler.toggleJob(job.id());
        assertThat(on.enabled()).isTrue();
        assertThat(timerManager.state(job.id())).isEqualTo(TimerState.ARMED);

        dispatcher.dispatch(job.id());

        var updated = scheduler.getJob(job.id());
        assertThat(updated.runHistory()).hasSize(1);
        assertThat(updated.lastRun()).isEqualTo(NOW);
        assertThat(updated.enabled()).isTrue();
        assertThat(updated.schedule()).isEqualTo(job.schedule());
    }

    @Test
    void toggleEnablesDisabledJobByCreatingMissingTimer() {
        var job = scheduler.createJob(new JobDefinition("ping", null, null, "*/5 * * * *", "123", "hi",
                false, null, null));

        var toggled = scheduler.toggleJob(job.id());

        assertThat(toggled.enabled()).isTrue();
        assertThat(timerManager.state(job.id())).isEqualTo(TimerState.ARMED);
    }

    @Test
    void togglePairKeepsHistoryAndSchedule() {
        var job = scheduler.createJob(ping());
        dispatcher.dispatch(job.id());

        scheduler.toggleJob(job.id());
        var restored = scheduler.toggleJob(job.id());

        assertThat(restored.enabled()).isTrue();
        assertThat(restored.runHistory()).hasSize(1);
        assertThat(restored.schedule()).isEqualTo("*/5 * * * *");
    }

    @Test
    void failedRegistryToggleRevertsTimer() {
        var job = scheduler.createJob(ping());
        doThrow(new IllegalStateException("store unavailable")).when(registry).setEnabled(anyString(), anyBoolean());

        assertThatThrownBy(() -> scheduler.toggleJob(job.id())).isInstanceOf(IllegalStateException.class);

        assertThat(scheduler.getJob(job.id()).enabled()).isTrue();
        assertThat(timerManager.state(job.id())).isEqualTo(TimerState.ARMED);
    }

    @Test
    void twelveFiresKeepTenMostRecent() {
        var job = scheduler.createJob(ping());

        for (int i = 0; i < 12; i++) {
            dispatcher.dispatch(job.id());
        }

        assertThat(scheduler.getJob(job.id()).runHistory()).hasSize(CronJob.HISTORY_LIMIT);
    }

    @Test
    void fireWhileDetachedLeavesHistoryUntouched() throws Exception {
        var job = scheduler.createJob(ping());
        when(gateway.isAttached()).thenReturn(false);

        assertThatCode(() -> dispatcher.dispatch(job.id())).doesNotThrowAnyException();

        var updated = scheduler.getJob(job.id());
        assertThat(updated.runHistory()).isEmpty();
        assertThat(updated.lastRun()).isNull();
        verify(gateway, never()).sendMessage(anyString(), anyString());
    }

    @Test
    void deletedJobIsGoneForEveryOperation() throws Exception {
        var job = scheduler.createJob(ping());

        scheduler.deleteJob(job.id());

        verify(future).cancel(false);
        assertThat(timerManager.state(job.id())).isEqualTo(TimerState.ABSENT);
        assertThatThrownBy(() -> scheduler.getJob(job.id())).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> scheduler.toggleJob(job.id())).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> scheduler.deleteJob(job.id())).isInstanceOf(JobNotFoundException.class);
        assertThat(scheduler.listJobs()).isEmpty();
    }

    @Test
    void pendingFireAfterDeletionCompletesQuietly() throws Exception {
        var job = scheduler.createJob(ping());
        scheduler.deleteJob(job.id());

        var result = dispatcher.fire(job.id()).get();

        assertThat(result).isEqualTo(DispatchResult.SKIPPED);
        assertThat(registry.get(job.id())).isEmpty();
        verify(gateway, never()).sendMessage(anyString(), anyString());
        assertThat(dispatcher).extracting("jobLocks", InstanceOfAssertFactories.MAP).isEmpty();
        assertThat(scheduler).extracting("jobLocks", InstanceOfAssertFactories.MAP).isEmpty();
    }

    @Test
    void toggleLosingRaceWithDeleteLeavesNoLockBehind() {
        var job = scheduler.createJob(ping());
        doReturn(Optional.of(job)).doReturn(Optional.empty()).when(registry).get(job.id());

        assertThatThrownBy(() -> scheduler.toggleJob(job.id())).isInstanceOf(JobNotFoundException.class);

        assertThat(scheduler).extracting("jobLocks", InstanceOfAssertFactories.MAP).isEmpty();
        verify(registry, never()).setEnabled(anyString(), anyBoolean());
    }

    @Test
    void enabledMatchesArmedTimerForEveryJob() {
        var first = scheduler.createJob(ping());
        var second = scheduler.createJob(ping());
        var third = scheduler.createJob(new JobDefinition("quiet", null, null, "0 9 * * 1-5", "456", "standup",
                false, null, null));
        scheduler.toggleJob(second.id());
        scheduler.toggleJob(third.id());
        scheduler.deleteJob(first.id());

        for (var job : scheduler.listJobs()) {
            assertThat(timerManager.state(job.id()) == TimerState.ARMED)
                    .as("timer armed for job %s", job.id())
                    .isEqualTo(job.enabled());
        }
        assertThat(timerManager.armedCount()).isEqualTo(1);
    }

    @Test
    void unknownIdsAreReported() {
        assertThatThrownBy(() -> scheduler.toggleJob("nope"))
                .isInstanceOf(JobNotFoundException.class)
                .hasMessage("Job not found");
        assertThatThrownBy(() -> scheduler.deleteJob("nope"))
                .isInstanceOf(JobNotFoundException.class);
    }

    private static JobDefinition ping() {
        return new JobDefinition("ping", null, null, "*/5 * * * *", "123", "hi", null, null, null);
    }
}
