package com.tableadvisor.advisor.service;

import com.tableadvisor.advisor.dto.EngineDiagnostics;
import com.tableadvisor.advisor.dto.ReconcileOutcome;
import com.tableadvisor.advisor.dto.SessionStarted;
import com.tableadvisor.advisor.logger.DecisionFlowLogger;
import com.tableadvisor.advisor.session.SessionRegistry;
import com.tableadvisor.common.engine.EngineThresholds;
import com.tableadvisor.common.engine.ReconcileVerdict;
import com.tableadvisor.common.engine.ReconciliationEngine;
import com.tableadvisor.common.model.ActingKind;
import com.tableadvisor.common.model.ActionKind;
import com.tableadvisor.common.model.FieldKey;
import com.tableadvisor.common.model.Frame;
import com.tableadvisor.common.model.PixelConfidence;
import com.tableadvisor.common.model.PixelSignal;
import com.tableadvisor.common.model.UiPhase;
import com.tableadvisor.common.model.UiState;
import com.tableadvisor.common.pixel.DetectorSettings;
import com.tableadvisor.common.pixel.PixelSignalDetector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives {@link AdvisorService} end to end against the real parser, detector and engine.
 */
class AdvisorServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private static final PixelSignal HIGH = PixelSignal.of(true, true, 0.05);

    private static final int W = 200;
    private static final int H = 100;

    private SessionRegistry registry;
    private AdvisorService service;
    private String sessionId;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(CLOCK, 1_800_000L);
        service = new AdvisorService(
            registry,
            new ReconciliationEngine(EngineThresholds.defaults()),
            new PixelSignalDetector(DetectorSettings.defaults()),
            new DecisionFlowLogger(),
            CLOCK);
        sessionId = service.startSession().block(TIMEOUT).sessionId();
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    private static Frame tableFrame(boolean foldButton) {
        int[] px = new int[W * H];
        Arrays.fill(px, 0xFF0A5A2A);
        if (foldButton) {
            for (int y = 88; y < H; y++) {
                for (int x = 10; x < 70; x++) {
                    px[y * W + x] = 0xFFDC1E1E;
                }
            }
        }
        return Frame.of(W, H, px);
    }

    private ReconcileOutcome respond(String text) {
        return service.submitResponse(sessionId, text).block(TIMEOUT);
    }

    // ── lifecycle ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("session lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("a new session starts WAITING with an empty display")
        void startsWaiting() {
            SessionStarted started = service.startSession().block(TIMEOUT);

            assertNotNull(started.sessionId());
            assertNotEquals(sessionId, started.sessionId());
            assertEquals(UiPhase.WAITING, started.state().phase());
            assertEquals("", started.state().display());
        }

        @Test
        @DisplayName("stop removes the session; later calls complete empty")
        void stopRemoves() {
            assertTrue(service.stopSession(sessionId).block(TIMEOUT));

            assertNull(service.currentState(sessionId).block(TIMEOUT));
            assertNull(service.submitResponse(sessionId, "ACTION: CALL").block(TIMEOUT));
            assertNull(service.stopSession(sessionId).block(TIMEOUT));
        }

        @Test
        @DisplayName("unknown session ids complete empty")
        void unknownSession() {
            assertNull(service.currentState("missing").block(TIMEOUT));
            assertNull(service.diagnostics("missing").block(TIMEOUT));
            assertNull(service.stream("missing").block(TIMEOUT));
        }

        @Test
        @DisplayName("reset returns the session to its initial state")
        void reset() {
            service.submitPixelSignal(sessionId, HIGH).block(TIMEOUT);
            respond("ACTION: RAISE 120\nPOT: 80");

            UiState state = service.resetSession(sessionId).block(TIMEOUT);

            assertEquals(UiPhase.WAITING, state.phase());
            assertEquals("", state.display());
            EngineDiagnostics diag = service.diagnostics(sessionId).block(TIMEOUT);
            assertEquals(0, diag.actingStreak());
            assertEquals(1, diag.metrics().getResets());
        }
    }

    // ── responses ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("response path")
    class ResponseTests {

        @Test
        @DisplayName("round trip: RAISE 120 with high pixel confidence commits ACTING(RAISE)")
        void roundTrip() {
            service.submitPixelSignal(sessionId, HIGH).block(TIMEOUT);

            ReconcileOutcome outcome = respond("ACTION: RAISE 120\nPOT: 80");

            assertEquals(ActionKind.RAISE, outcome.classified().actionKind());
            assertEquals("Raise 120", outcome.classified().displayText());
            assertTrue(outcome.emitted());
            assertEquals(ReconcileVerdict.COMMITTED, outcome.verdict());
            assertEquals(UiPhase.ACTING, outcome.state().phase());
            assertEquals(ActingKind.RAISE, outcome.state().actingKind());
            assertEquals("Raise 120", outcome.state().display());
            assertEquals("80", outcome.state().pinnedFields().get(FieldKey.POT));
        }

        @Test
        @DisplayName("the same response twice emits once")
        void duplicate() {
            service.submitPixelSignal(sessionId, HIGH).block(TIMEOUT);
            respond("ACTION: CALL");

            ReconcileOutcome second = respond("ACTION: CALL");

            assertFalse(second.emitted());
            assertEquals(ReconcileVerdict.DUPLICATE, second.verdict());
            EngineDiagnostics diag = service.diagnostics(sessionId).block(TIMEOUT);
            assertEquals(1, diag.metrics().getDuplicates());
        }

        @Test
        @DisplayName("a skip response leaves the state untouched")
        void skipIsolation() {
            service.submitPixelSignal(sessionId, HIGH).block(TIMEOUT);
            respond("ACTION: CALL");

            ReconcileOutcome skipped = respond("ACTION: SKIP");

            assertEquals(ReconcileVerdict.SKIPPED, skipped.verdict());
            assertFalse(skipped.emitted());
            assertEquals(ActingKind.CALL, service.currentState(sessionId).block(TIMEOUT).actingKind());
        }

        @Test
        @DisplayName("without pixel confirmation a single acting response is held back")
        void weakEntryNeedsTwo() {
            ReconcileOutcome first = respond("ACTION: CALL");
            assertEquals(ReconcileVerdict.SUPPRESSED_ENTRY, first.verdict());

            ReconcileOutcome second = respond("ACTION: CALL");
            assertEquals(ReconcileVerdict.COMMITTED, second.verdict());
            assertEquals(ActingKind.CALL, second.state().actingKind());
        }
    }

    // ── streaming ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("partial responses")
    class PartialTests {

        @Test
        @DisplayName("acting prefix is withheld until the rationale label arrives, then committed once")
        void earlyCommit() {
            service.submitPixelSignal(sessionId, HIGH).block(TIMEOUT);

            ReconcileOutcome withheld = service.submitPartial(sessionId, "ACTION: CALL").block(TIMEOUT);
            assertEquals(ReconcileVerdict.WITHHELD, withheld.verdict());

            ReconcileOutcome early = service.submitPartial(sessionId,
                "ACTION: CALL\nANALYSIS: pot odds are fine").block(TIMEOUT);
            assertTrue(early.emitted());
            assertTrue(early.reason().startsWith("early: "));
            assertEquals(ActionKind.CALL, early.classified().actionKind());

            ReconcileOutcome last = respond("ACTION: CALL\nANALYSIS: pot odds are fine");
            assertEquals(ReconcileVerdict.DUPLICATE, last.verdict());
            assertEquals(1, service.diagnostics(sessionId).block(TIMEOUT).metrics().getEmissions());
        }

        @Test
        @DisplayName("a prefix without an action keyword is ignored and carries no classification")
        void prefixWithoutAction() {
            ReconcileOutcome outcome = service.submitPartial(sessionId, "HAND: Ah Kd\nBOARD: 2c").block(TIMEOUT);

            assertEquals(ReconcileVerdict.IGNORED, outcome.verdict());
            assertNull(outcome.classified());
            assertFalse(outcome.emitted());
        }
    }

    // ── pixel path ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("frames and control events")
    class FrameTests {

        @Test
        @DisplayName("a frame with the fold button marks controls present")
        void frameWithControls() {
            service.submitFrame(sessionId, tableFrame(true)).block(TIMEOUT);

            EngineDiagnostics diag = service.diagnostics(sessionId).block(TIMEOUT);
            assertTrue(diag.controlPresent());
            assertEquals(PixelConfidence.MEDIUM, diag.lastPixelConfidence());
            assertEquals(1, diag.actingStreak());
            assertEquals(1, diag.metrics().getFramesProcessed());
            assertEquals(1, diag.metrics().getControlEvents());
        }

        @Test
        @DisplayName("controls vanishing forces WAITING with the waiting label")
        void controlsVanish() {
            service.submitFrame(sessionId, tableFrame(true)).block(TIMEOUT);
            respond("ACTION: FOLD");

            UiState after = service.submitFrame(sessionId, tableFrame(false)).block(TIMEOUT);

            assertEquals(UiPhase.WAITING, after.phase());
            assertEquals("Not your turn", after.display());
            assertFalse(service.diagnostics(sessionId).block(TIMEOUT).controlPresent());
        }

        @Test
        @DisplayName("controls appearing over pinned advice shows Get ready")
        void appearedWithPinnedFields() {
            respond("ACTION: WAITING\nHAND: Ah Kd");

            UiState ready = service.controlAppeared(sessionId).block(TIMEOUT);

            assertEquals(UiPhase.READY, ready.phase());
            assertEquals("Get ready", ready.display());
        }

        @Test
        @DisplayName("explicit disappearance from ACTING returns to WAITING")
        void explicitDisappeared() {
            service.submitPixelSignal(sessionId, HIGH).block(TIMEOUT);
            respond("ACTION: CHECK");

            UiState state = service.controlDisappeared(sessionId).block(TIMEOUT);

            assertEquals(UiPhase.WAITING, state.phase());
            assertNull(state.actingKind());
        }
    }

    // ── emission stream ──────────────────────────────────────────────────

    @Nested
    @DisplayName("stream()")
    class StreamTests {

        @Test
        @DisplayName("late subscribers receive the latest committed state first")
        void replaysLatest() {
            service.submitPixelSignal(sessionId, HIGH).block(TIMEOUT);
            respond("ACTION: RAISE 120\nPOT: 80");

            StepVerifier.create(service.stream(sessionId).block(TIMEOUT))
                .assertNext(state -> {
                    assertEquals(UiPhase.ACTING, state.phase());
                    assertEquals("Raise 120", state.display());
                })
                .thenCancel()
                .verify(TIMEOUT);
        }

        @Test
        @DisplayName("commits are pushed to subscribers that are already connected")
        void pushesCommits() {
            service.submitPixelSignal(sessionId, HIGH).block(TIMEOUT);

            StepVerifier.create(service.stream(sessionId).block(TIMEOUT))
                .assertNext(state -> assertEquals(UiPhase.WAITING, state.phase()))
                .then(() -> service.submitResponse(sessionId, "ACTION: CALL").subscribe())
                .assertNext(state -> {
                    assertEquals(UiPhase.ACTING, state.phase());
                    assertEquals(ActingKind.CALL, state.actingKind());
                })
                .thenCancel()
                .verify(TIMEOUT);
        }

        @Test
        @DisplayName("stopping a session completes its stream")
        void stopCompletes() {
            StepVerifier.create(service.stream(sessionId).block(TIMEOUT))
                .expectNextCount(1)
                .then(() -> service.stopSession(sessionId).subscribe())
                .expectComplete()
                .verify(TIMEOUT);
        }
    }
}
