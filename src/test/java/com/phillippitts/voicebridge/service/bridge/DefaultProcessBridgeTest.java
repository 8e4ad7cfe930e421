package com.phillippitts.voicebridge.service.bridge;

import com.phillippitts.voicebridge.config.properties.BridgeProperties;
import com.phillippitts.voicebridge.domain.Speaker;
import com.phillippitts.voicebridge.domain.Turn;
import com.phillippitts.voicebridge.domain.TurnReply;
import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.ProcessFailureException;
import com.phillippitts.voicebridge.exception.SessionNotFoundException;
import com.phillippitts.voicebridge.exception.TurnInProgressException;
import com.phillippitts.voicebridge.exception.TurnTimeoutException;
import com.phillippitts.voicebridge.service.bridge.BridgeTestDoubles.ScriptedProcess;
import com.phillippitts.voicebridge.service.bridge.BridgeTestDoubles.ScriptedProcessFactory;
import com.phillippitts.voicebridge.service.events.ProcessRespawnedEvent;
import com.phillippitts.voicebridge.service.events.StaleOutputDiscardedEvent;
import com.phillippitts.voicebridge.service.metrics.VoiceBridgeMetrics;
import com.phillippitts.voicebridge.service.session.Session;
import com.phillippitts.voicebridge.service.session.SessionHistoryRepository;
import com.phillippitts.voicebridge.service.session.SessionStore;
import com.phillippitts.voicebridge.testutil.EventCapturingPublisher;
import com.phillippitts.voicebridge.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Hermetic tests for the process bridge using scripted fake processes.
 */
class DefaultProcessBridgeTest {

    @TempDir
    Path historyDir;

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MutableClock clock = new MutableClock();
    private BridgeProperties props;
    private ScriptedProcessFactory factory;
    private DefaultProcessBridge bridge;

    @BeforeEach
    void setUp() {
        props = new BridgeProperties();
        props.setMaxSessions(4);
        props.setTurnTimeout(Duration.ofSeconds(3));
        props.setCapacityAcquireTimeout(Duration.ofMillis(100));
        props.setShutdownGrace(Duration.ofMillis(200));
        props.setIdleTimeout(Duration.ofMinutes(30));
    }

    @AfterEach
    void tearDown() {
        if (bridge != null) {
            bridge.shutdown();
        }
    }

    private DefaultProcessBridge newBridge(Supplier<ScriptedProcess> supplier) {
        factory = new ScriptedProcessFactory(supplier);
        bridge = new DefaultProcessBridge(props, new SessionStore(), new SessionHistoryRepository(historyDir),
                factory, publisher, new VoiceBridgeMetrics(registry), clock);
        return bridge;
    }

    private DefaultProcessBridge echoBridge() {
        return newBridge(() -> new ScriptedProcess(BridgeTestDoubles.echo("echo:")));
    }

    @Test
    void mintsSessionIdAndStartsOneProcess() {
        echoBridge();

        Session session = bridge.getOrCreate(null);

        assertThat(session.id()).matches("[0-9a-f]{8}");
        assertThat(session.hasLiveProcess()).isTrue();
        assertThat(bridge.getOrCreate(session.id())).isSameAs(session);
        assertThat(factory.started).hasSize(1);
        assertThat(bridge.liveSessions()).isEqualTo(1);
        assertThat(registry.get("voicebridge.sessions.live").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void adoptsValidUnknownIdAndRejectsUnsafeOne() {
        echoBridge();

        assertThat(bridge.getOrCreate("kitchen-tablet_1").id()).isEqualTo("kitchen-tablet_1");
        assertThatThrownBy(() -> bridge.getOrCreate("../../etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void turnReturnsReplyAndRecordsHistory() {
        echoBridge();
        String id = bridge.getOrCreate(null).id();

        TurnReply reply = bridge.sendTurn(id, "bonjour", null);

        assertThat(reply.sessionId()).isEqualTo(id);
        assertThat(reply.text()).isEqualTo("echo:bonjour");
        assertThat(reply.respawned()).isFalse();
        assertThat(reply.staleOutputDiscarded()).isFalse();
        List<Turn> history = bridge.history(id);
        assertThat(history).extracting(Turn::speaker).containsExactly(Speaker.USER, Speaker.ASSISTANT);
        assertThat(history).extracting(Turn::text).containsExactly("bonjour", "echo:bonjour");
    }

    @Test
    void shutdownTerminatesEverySessionProcess() {
        echoBridge();
        bridge.getOrCreate(null);
        bridge.getOrCreate(null);

        bridge.shutdown();

        assertThat(bridge.liveSessions()).isZero();
        assertThat(factory.started).hasSize(2);
        await().atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> assertThat(factory.started).noneMatch(ScriptedProcess::isAlive));
    }

    @Test
    void unknownSessionIsNotFound() {
        echoBridge();

        assertThatThrownBy(() -> bridge.sendTurn("nope", "hi", null))
                .isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> bridge.history("nope"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void concurrentTurnsOnOneSessionNeverOverlapAndEachGetsItsOwnReply() throws Exception {
        newBridge(() -> new ScriptedProcess(BridgeTestDoubles.echo("re:"), index -> 80L));
        String id = bridge.getOrCreate(null).id();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<TurnReply>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String message = "m" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return bridge.sendTurn(id, message, Duration.ofSeconds(5));
                }));
            }
            start.countDown();

            for (int i = 0; i < 4; i++) {
                assertThat(futures.get(i).get(10, TimeUnit.SECONDS).text()).isEqualTo("re:m" + i);
            }
        } finally {
            pool.shutdownNow();
        }

        ScriptedProcess process = factory.last();
        assertThat(process.overlapped()).isFalse();
        assertThat(process.received).containsExactlyInAnyOrder("m0", "m1", "m2", "m3");
        List<Turn> history = bridge.history(id);
        assertThat(history).hasSize(8);
        for (int i = 0; i < history.size(); i += 2) {
            assertThat(history.get(i).speaker()).isEqualTo(Speaker.USER);
            assertThat(history.get(i + 1).text()).isEqualTo("re:" + history.get(i).text());
        }
    }

    @Test
    void sessionsAreIsolated() throws Exception {
        newBridge(() -> new ScriptedProcess(BridgeTestDoubles.echo("pong:"), index -> 50L));
        String a = bridge.getOrCreate("session-a").id();
        String b = bridge.getOrCreate("session-b").id();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<List<String>>> results = new ArrayList<>();
            for (String id : List.of(a, b)) {
                results.add(pool.submit(() -> {
                    List<String> replies = new ArrayList<>();
                    for (int i = 0; i < 3; i++) {
                        replies.add(bridge.sendTurn(id, "ping-" + id + "-" + i, null).text());
                    }
                    return replies;
                }));
            }
            assertThat(results.get(0).get(10, TimeUnit.SECONDS))
                    .containsExactly("pong:ping-session-a-0", "pong:ping-session-a-1", "pong:ping-session-a-2");
            assertThat(results.get(1).get(10, TimeUnit.SECONDS))
                    .containsExactly("pong:ping-session-b-0", "pong:ping-session-b-1", "pong:ping-session-b-2");
        } finally {
            pool.shutdownNow();
        }
        assertThat(factory.started).hasSize(2);
    }

    @Test
    void secondTurnGivesUpWhileFirstIsRunning() throws Exception {
        newBridge(() -> new ScriptedProcess(BridgeTestDoubles.echo("slow:"), index -> 600L));
        String id = bridge.getOrCreate(null).id();

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<TurnReply> first = pool.submit(() -> bridge.sendTurn(id, "first", null));
            await().atMost(Duration.ofSeconds(2)).until(() -> !factory.last().received.isEmpty());

            assertThatThrownBy(() -> bridge.sendTurn(id, "second", Duration.ofMillis(100)))
                    .isInstanceOf(TurnInProgressException.class);
            assertThat(first.get(5, TimeUnit.SECONDS).text()).isEqualTo("slow:first");
        } finally {
            pool.shutdownNow();
        }
        assertThat(factory.last().received).containsExactly("first");
        assertThat(registry.get("voicebridge.turn.failure").tag("reason", "conflict").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void respawnsProcessKilledBetweenTurns() {
        echoBridge();
        String id = bridge.getOrCreate(null).id();
        bridge.sendTurn(id, "one", null);

        factory.last().kill();
        TurnReply reply = bridge.sendTurn(id, "two", null);

        assertThat(reply.text()).isEqualTo("echo:two");
        assertThat(reply.respawned()).isTrue();
        assertThat(factory.started).hasSize(2);
        assertThat(bridge.history(id)).extracting(Turn::speaker)
                .containsExactly(Speaker.USER, Speaker.ASSISTANT, Speaker.SYSTEM, Speaker.USER, Speaker.ASSISTANT);
        List<ProcessRespawnedEvent> events = publisher.eventsOf(ProcessRespawnedEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).exitCode()).isEqualTo(137);
        assertThat(events.get(0).duringTurn()).isFalse();
        assertThat(registry.get("voicebridge.process.respawn").counter().count()).isEqualTo(1.0);
    }

    @Test
    void retriesOnceWhenProcessDiesDuringTurn() {
        AtomicInteger spawned = new AtomicInteger();
        newBridge(() -> {
            ScriptedProcess process = new ScriptedProcess(BridgeTestDoubles.echo("echo:"));
            return spawned.getAndIncrement() == 0 ? process.dieOnNextLine() : process;
        });
        String id = bridge.getOrCreate(null).id();

        TurnReply reply = bridge.sendTurn(id, "still there?", null);

        assertThat(reply.text()).isEqualTo("echo:still there?");
        assertThat(reply.respawned()).isTrue();
        assertThat(factory.started).hasSize(2);
        assertThat(factory.started.get(1).received).containsExactly("still there?");
        assertThat(publisher.eventsOf(ProcessRespawnedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.duringTurn()).isTrue());
        assertThat(bridge.liveSessions()).isEqualTo(1);
    }

    @Test
    void failsWhenRespawnedProcessDiesToo() {
        newBridge(() -> new ScriptedProcess(BridgeTestDoubles.echo("")).dieOnNextLine());
        String id = bridge.getOrCreate(null).id();

        assertThatThrownBy(() -> bridge.sendTurn(id, "hello", null))
                .isInstanceOf(ProcessFailureException.class)
                .hasMessageContaining("failed again after respawn")
                .hasMessageContaining("sessionId=" + id);
        assertThat(factory.started).hasSize(2);
    }

    @Test
    void timedOutTurnLeavesProcessRunningAndLateOutputIsDiscarded() throws InterruptedException {
        newBridge(() -> new ScriptedProcess(BridgeTestDoubles.echo("re:"), index -> index == 0 ? 500L : 0L));
        String id = bridge.getOrCreate(null).id();

        assertThatThrownBy(() -> bridge.sendTurn(id, "slow question", Duration.ofMillis(150)))
                .isInstanceOf(TurnTimeoutException.class);
        ScriptedProcess process = factory.last();
        assertThat(process.isAlive()).isTrue();

        await().atMost(Duration.ofSeconds(2)).until(() -> process.linesAnswered() == 1);
        // let the output pump pick up the late reply
        Thread.sleep(150);

        TurnReply reply = bridge.sendTurn(id, "next question", null);

        assertThat(reply.text()).isEqualTo("re:next question");
        assertThat(reply.staleOutputDiscarded()).isTrue();
        assertThat(reply.respawned()).isFalse();
        assertThat(factory.started).hasSize(1);
        assertThat(publisher.eventsOf(StaleOutputDiscardedEvent.class)).hasSize(1);
        assertThat(bridge.history(id))
                .filteredOn(t -> t.speaker() == Speaker.SYSTEM)
                .extracting(Turn::text)
                .anySatisfy(text -> assertThat(text).startsWith("Turn timed out"))
                .anySatisfy(text -> assertThat(text).contains("re:slow question"));
    }

    @Test
    void turnSentRightAfterATimeoutWaitsForTheLateReplyBeforeWriting() {
        newBridge(() -> new ScriptedProcess(BridgeTestDoubles.echo("re:"), index -> index == 0 ? 500L : 0L));
        String id = bridge.getOrCreate(null).id();
        assertThatThrownBy(() -> bridge.sendTurn(id, "slow question", Duration.ofMillis(150)))
                .isInstanceOf(TurnTimeoutException.class);

        TurnReply second = bridge.sendTurn(id, "next question", null);
        TurnReply third = bridge.sendTurn(id, "third question", null);

        assertThat(second.text()).isEqualTo("re:next question");
        assertThat(second.staleOutputDiscarded()).isTrue();
        assertThat(third.text()).isEqualTo("re:third question");
        assertThat(third.staleOutputDiscarded()).isFalse();
        assertThat(factory.last().received).containsExactly("slow question", "next question", "third question");
        assertThat(factory.last().overlapped()).isFalse();
        assertThat(publisher.eventsOf(StaleOutputDiscardedEvent.class)).hasSize(1);
        assertThat(bridge.history(id))
                .filteredOn(t -> t.speaker() == Speaker.ASSISTANT)
                .extracting(Turn::text)
                .containsExactly("re:next question", "re:third question");
    }

    @Test
    void turnIsRejectedUnsentWhileTimedOutReplyIsStillRunning() {
        newBridge(() -> new ScriptedProcess(BridgeTestDoubles.echo("re:"), index -> index == 0 ? 800L : 0L));
        String id = bridge.getOrCreate(null).id();
        assertThatThrownBy(() -> bridge.sendTurn(id, "slow question", Duration.ofMillis(100)))
                .isInstanceOf(TurnTimeoutException.class);

        assertThatThrownBy(() -> bridge.sendTurn(id, "impatient", Duration.ofMillis(100)))
                .isInstanceOf(TurnInProgressException.class);
        assertThat(factory.last().received).containsExactly("slow question");
        assertThat(bridge.history(id)).extracting(Turn::text).doesNotContain("impatient");

        TurnReply reply = bridge.sendTurn(id, "patient", null);

        assertThat(reply.text()).isEqualTo("re:patient");
        assertThat(reply.staleOutputDiscarded()).isTrue();
        assertThat(factory.last().received).containsExactly("slow question", "patient");
    }

    @Test
    void quiescenceModeWaitsForTheLateReplyToGoQuiet() {
        props.getCompletion().setMode(BridgeProperties.CompletionMode.QUIESCENCE);
        props.getCompletion().setQuietPeriod(Duration.ofMillis(100));
        newBridge(() -> new ScriptedProcess(line -> "re:" + line + "\n", index -> index == 0 ? 400L : 0L));
        String id = bridge.getOrCreate(null).id();
        assertThatThrownBy(() -> bridge.sendTurn(id, "slow question", Duration.ofMillis(150)))
                .isInstanceOf(TurnTimeoutException.class);

        TurnReply reply = bridge.sendTurn(id, "next question", null);

        assertThat(reply.text()).isEqualTo("re:next question");
        assertThat(reply.staleOutputDiscarded()).isTrue();
        assertThat(bridge.history(id))
                .filteredOn(t -> t.speaker() == Speaker.SYSTEM)
                .extracting(Turn::text)
                .anySatisfy(text -> assertThat(text).contains("re:slow question"));
    }

    @Test
    void clearIsIdempotent() {
        echoBridge();
        String id = bridge.getOrCreate(null).id();
        bridge.sendTurn(id, "remember me", null);
        ScriptedProcess process = factory.last();
        assertThat(historyDir.resolve(id + ".json")).exists();

        assertThat(bridge.clear(id)).isTrue();
        assertThat(bridge.clear(id)).isFalse();
        assertThat(bridge.clear("never-existed")).isFalse();

        assertThat(process.isAlive()).isFalse();
        assertThat(historyDir.resolve(id + ".json")).doesNotExist();
        assertThat(bridge.liveSessions()).isZero();
        assertThatThrownBy(() -> bridge.sendTurn(id, "hello?", null))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void clearDuringAnInFlightHistorySaveLeavesNoHistoryBehind() throws Exception {
        CountDownLatch saving = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SessionHistoryRepository slowRepository = new SessionHistoryRepository(historyDir) {
            @Override
            public void save(String sessionId, List<Turn> history) {
                saving.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.save(sessionId, history);
            }
        };
        factory = new ScriptedProcessFactory(() -> new ScriptedProcess(BridgeTestDoubles.echo("echo:")));
        bridge = new DefaultProcessBridge(props, new SessionStore(), slowRepository, factory, publisher,
                new VoiceBridgeMetrics(registry), clock);
        String id = bridge.getOrCreate(null).id();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<TurnReply> turn = pool.submit(() -> bridge.sendTurn(id, "keep this", null));
            assertThat(saving.await(5, TimeUnit.SECONDS)).isTrue();
            Future<Boolean> cleared = pool.submit(() -> bridge.clear(id));
            Thread.sleep(100);
            release.countDown();

            assertThat(turn.get(5, TimeUnit.SECONDS).text()).isEqualTo("echo:keep this");
            assertThat(cleared.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
        assertThat(historyDir.resolve(id + ".json")).doesNotExist();
        assertThat(bridge.getOrCreate(id).historySnapshot()).isEmpty();
    }

    @Test
    void clearedIdStartsFreshSession() {
        echoBridge();
        bridge.getOrCreate("reuse");
        bridge.sendTurn("reuse", "old", null);
        bridge.clear("reuse");

        bridge.getOrCreate("reuse");

        assertThat(bridge.history("reuse")).isEmpty();
        assertThat(factory.started).hasSize(2);
    }

    @Test
    void capacityIsBoundedAndReleasedOnClear() {
        props.setMaxSessions(1);
        echoBridge();
        bridge.getOrCreate("first");

        assertThatThrownBy(() -> bridge.getOrCreate("second"))
                .isInstanceOf(CapacityExceededException.class);

        assertThatThrownBy(() -> bridge.sendTurn("second", "hi", null))
                .isInstanceOf(SessionNotFoundException.class);

        bridge.clear("first");
        assertThat(bridge.getOrCreate("second").hasLiveProcess()).isTrue();
        assertThat(bridge.liveSessions()).isEqualTo(1);
    }

    @Test
    void spawnFailureReleasesSlot() {
        props.setMaxSessions(1);
        echoBridge();
        factory.failNextStart = true;

        assertThatThrownBy(() -> bridge.getOrCreate("broken"))
                .isInstanceOf(ProcessFailureException.class)
                .hasMessageContaining("Failed to start assistant process");

        assertThat(bridge.getOrCreate("working").hasLiveProcess()).isTrue();
    }

    @Test
    void evictsIdleSessionsButKeepsTheirHistoryFile() {
        echoBridge();
        String idle = bridge.getOrCreate("idle").id();
        bridge.sendTurn(idle, "hello", null);
        ScriptedProcess idleProcess = factory.last();

        clock.advance(Duration.ofMinutes(20));
        String active = bridge.getOrCreate("active").id();
        bridge.sendTurn(active, "hello", null);
        clock.advance(Duration.ofMinutes(15));

        assertThat(bridge.evictIdle()).isEqualTo(1);

        assertThat(idleProcess.isAlive()).isFalse();
        assertThat(bridge.liveSessions()).isEqualTo(1);
        assertThat(historyDir.resolve("idle.json")).exists();
        assertThatThrownBy(() -> bridge.history(idle)).isInstanceOf(SessionNotFoundException.class);
        assertThat(bridge.history(active)).hasSize(2);
    }

    @Test
    void restoresHistoryForReturningSession() {
        echoBridge();
        bridge.getOrCreate("returning");
        bridge.sendTurn("returning", "first visit", null);
        bridge.shutdown();

        echoBridge();
        bridge.getOrCreate("returning");

        assertThat(bridge.history("returning")).extracting(Turn::text)
                .containsExactly("first visit", "echo:first visit");
    }
}
