package com.lanewatch.backend.service.signal;

import com.lanewatch.backend.config.TrafficProperties;
import com.lanewatch.backend.model.report.PhaseAdjustment;
import com.lanewatch.backend.model.report.SignalPhase;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class SignalPrioritySchedulerTest {

    private final TrafficProperties.Signal config = new TrafficProperties.Signal();
    private final SignalPriorityScheduler scheduler = new SignalPriorityScheduler(config);

    private static LaneDemand demand(int... occupancy) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (int i = 0; i < occupancy.length; i++) {
            counts.put(i + 1, occupancy[i]);
        }
        return new LaneDemand(counts, Map.of());
    }

    @Test
    void phaseDurationIsClampedOccupancyPlusTrend() {
        assertThat(scheduler.phaseDurationSeconds(demand(0), 1)).isEqualTo(15);
        assertThat(scheduler.phaseDurationSeconds(demand(9), 1)).isEqualTo(27);
        assertThat(scheduler.phaseDurationSeconds(demand(40), 1)).isEqualTo(90);
        assertThat(scheduler.phaseDurationSeconds(new LaneDemand(Map.of(1, 10), Map.of(1, 0.5)), 1)).isEqualTo(32);
        assertThat(scheduler.phaseDurationSeconds(new LaneDemand(Map.of(1, 6), Map.of(1, -2.0)), 1)).isEqualTo(15);
    }

    @Test
    void startsOnLaneOneAndAdvancesToBestWaitingLane() {
        SignalPhaseState state = new SignalPhaseState(3);
        LaneDemand demand = demand(9, 2, 0);

        SignalPhase first = scheduler.update(state, demand, null, 0);
        assertThat(first.getActiveLane()).isEqualTo(1);
        assertThat(first.getRemainingSeconds()).isEqualTo(27);
        // remaining green plus each phase up to and including the waiting lane's own
        assertThat(first.getEstimatedWaitSeconds()).containsEntry(2, 42).containsEntry(3, 57);

        for (long t = 1_000; t < 27_000; t += 1_000) {
            SignalPhase phase = scheduler.update(state, demand, null, t);
            assertThat(phase.getActiveLane()).isEqualTo(1);
            assertThat(phase.isAdvanced()).isFalse();
        }

        SignalPhase next = scheduler.update(state, demand, null, 27_000);
        assertThat(next.isAdvanced()).isTrue();
        assertThat(next.getActiveLane()).isEqualTo(2);
        assertThat(next.getRemainingSeconds()).isEqualTo(15);
        assertThat(state.getLastGreenMillis(2)).isEqualTo(27_000L);
    }

    @Test
    void twoLanesAlternateOnDemand() {
        SignalPhaseState state = new SignalPhaseState(2);
        LaneDemand demand = demand(9, 2);

        SignalPhase first = scheduler.update(state, demand, null, 0);
        assertThat(first.getActiveLane()).isEqualTo(1);
        assertThat(first.getRemainingSeconds()).isEqualTo(27);
        assertThat(first.getEstimatedWaitSeconds()).containsOnly(entry(2, 42));

        SignalPhase before = scheduler.update(state, demand, null, 26_999);
        assertThat(before.getActiveLane()).isEqualTo(1);
        assertThat(before.isAdvanced()).isFalse();

        SignalPhase next = scheduler.update(state, demand, null, 27_000);
        assertThat(next.isAdvanced()).isTrue();
        assertThat(next.getActiveLane()).isEqualTo(2);
        assertThat(next.getRemainingSeconds()).isEqualTo(15);
        assertThat(next.getEstimatedWaitSeconds()).containsOnly(entry(1, 42));
    }

    @Test
    void singleLaneStaysGreen() {
        SignalPhaseState state = new SignalPhaseState(1);
        scheduler.update(state, demand(3), null, 0);

        SignalPhase phase = scheduler.update(state, demand(3), null, 15_000);

        assertThat(phase.getActiveLane()).isEqualTo(1);
        assertThat(phase.isAdvanced()).isTrue();
        assertThat(phase.getEstimatedWaitSeconds()).isEmpty();
    }

    @Test
    void scoreFavoursOccupancyTrendAndWaiting() {
        SignalPhaseState state = new SignalPhaseState(3);
        state.startPhase(2, 15, 0);
        state.startPhase(3, 15, 10_000);
        state.startPhase(1, 15, 20_000);
        LaneDemand demand = new LaneDemand(Map.of(2, 4, 3, 4), Map.of(2, 0.5));

        PriorityScore lane2 = scheduler.score(state, demand, 2, 30_000);
        PriorityScore lane3 = scheduler.score(state, demand, 3, 30_000);

        // 4 + 2 * 0.5 + 30 / 5 vs 4 + 20 / 5
        assertThat(lane2.getValue()).isEqualTo(11.0);
        assertThat(lane3.getValue()).isEqualTo(8.0);
        assertThat(scheduler.nextLane(state, demand, 30_000)).isEqualTo(2);
    }

    @Test
    void tiesGoToLowestLane() {
        SignalPhaseState state = new SignalPhaseState(3);
        state.startPhase(2, 15, 0);
        state.startPhase(3, 15, 0);
        state.startPhase(1, 15, 0);

        assertThat(scheduler.nextLane(state, demand(0, 5, 5), 10_000)).isEqualTo(2);
    }

    @Test
    void starvedLaneBeatsAnyNumericScore() {
        SignalPhaseState state = new SignalPhaseState(3);
        state.startPhase(2, 15, 0);
        state.startPhase(3, 90, 100_000);
        state.startPhase(1, 90, 110_000);

        PriorityScore starved = scheduler.score(state, demand(0, 0, 500), 2, 120_000);
        assertThat(starved.isForced()).isTrue();
        assertThat(starved).isGreaterThan(PriorityScore.of(1_000_000));
        assertThat(scheduler.nextLane(state, demand(0, 0, 500), 120_000)).isEqualTo(2);
    }

    @Test
    void neverGreenLaneWaitsSinceControllerStart() {
        SignalPhaseState state = new SignalPhaseState(3);
        scheduler.update(state, demand(30, 0, 0), null, 0);

        assertThat(scheduler.score(state, demand(30, 0, 0), 3, 10_000).getValue()).isEqualTo(120.0);
        assertThat(scheduler.score(state, demand(30, 0, 0), 3, 200_000).getValue()).isEqualTo(200.0);
    }

    @Test
    void emergencyTrimShortensGreenDownToFloor() {
        SignalPhaseState state = new SignalPhaseState(3);
        SignalPhase phase = scheduler.update(state, demand(30, 0, 0), 2, 0);

        assertThat(phase.getAdjustment()).isEqualTo(PhaseAdjustment.EMERGENCY);
        assertThat(phase.getRemainingSeconds()).isEqualTo(70);
        assertThat(phase.getAdjustmentBanner()).isEqualTo("EMERGENCY DETECTED | Green shortened");

        SignalPhaseState shortPhase = new SignalPhaseState(2);
        SignalPhase floored = scheduler.update(shortPhase, demand(0, 0), 2, 0);
        assertThat(floored.getRemainingSeconds()).isEqualTo(10);
    }

    @Test
    void emergencyInActiveLaneDoesNothing() {
        SignalPhaseState state = new SignalPhaseState(2);
        SignalPhase phase = scheduler.update(state, demand(30, 0), 1, 0);

        assertThat(phase.getAdjustment()).isNull();
        assertThat(phase.getRemainingSeconds()).isEqualTo(90);
        assertThat(phase.getAdjustmentBanner()).isNull();
    }

    @Test
    void trimsRespectSharedCooldown() {
        SignalPhaseState state = new SignalPhaseState(3);
        scheduler.update(state, demand(30, 0, 0), 2, 0);

        SignalPhase blocked = scheduler.update(state, demand(30, 0, 0), 2, 1_000);
        assertThat(blocked.getAdjustment()).isNull();
        assertThat(blocked.getRemainingSeconds()).isEqualTo(69);

        SignalPhase again = scheduler.update(state, demand(30, 0, 0), 2, 25_000);
        assertThat(again.getAdjustment()).isEqualTo(PhaseAdjustment.EMERGENCY);
        assertThat(again.getRemainingSeconds()).isEqualTo(25);
    }

    @Test
    void congestionTrimNeedsMinimumHold() {
        SignalPhaseState state = new SignalPhaseState(2);
        scheduler.update(state, demand(30, 0), null, 0);

        SignalPhase early = scheduler.update(state, demand(1, 12), null, 5_000);
        assertThat(early.getAdjustment()).isNull();

        SignalPhase trimmed = scheduler.update(state, demand(1, 12), null, 10_000);
        assertThat(trimmed.getAdjustment()).isEqualTo(PhaseAdjustment.CONGESTION);
        assertThat(trimmed.getRemainingSeconds()).isEqualTo(70);

        SignalPhase cooling = scheduler.update(state, demand(1, 12), null, 11_000);
        assertThat(cooling.getAdjustment()).isNull();
        assertThat(cooling.getRemainingSeconds()).isEqualTo(69);
    }

    @Test
    void congestionTrimNeedsClearedGreenAndCongestedWaitingLane() {
        SignalPhaseState state = new SignalPhaseState(2);
        scheduler.update(state, demand(30, 0), null, 0);

        assertThat(scheduler.update(state, demand(3, 12), null, 10_000).getAdjustment()).isNull();
        assertThat(scheduler.update(state, demand(2, 9), null, 11_000).getAdjustment()).isNull();
        assertThat(scheduler.update(state, demand(2, 10), null, 12_000).getAdjustment())
                .isEqualTo(PhaseAdjustment.CONGESTION);
    }

    @Test
    void cooldownClearsWhenPhaseAdvances() {
        SignalPhaseState state = new SignalPhaseState(3);
        scheduler.update(state, demand(0, 0, 0), 2, 0);
        assertThat(state.getLastAdjustmentMillis()).isEqualTo(0L);

        SignalPhase advanced = scheduler.update(state, demand(0, 0, 30), null, 10_000);
        assertThat(advanced.isAdvanced()).isTrue();
        assertThat(state.getLastAdjustmentMillis()).isNull();

        SignalPhase trimmed = scheduler.update(state, demand(0, 0, 30), 3, 11_000);
        assertThat(trimmed.getAdjustment()).isEqualTo(PhaseAdjustment.EMERGENCY);
    }

    @Test
    void trimsNeverExtendOrBreakFloors() {
        Random random = new Random(42);
        SignalPhaseState state = new SignalPhaseState(4);
        Long lastFire = null;
        int previousRemaining = Integer.MAX_VALUE;
        int previousLane = -1;

        for (long t = 0; t < 3_600_000; t += 500) {
            LaneDemand demand = demand(random.nextInt(25), random.nextInt(25), random.nextInt(3), random.nextInt(25));
            Integer emergency = random.nextInt(20) == 0 ? 1 + random.nextInt(4) : null;

            SignalPhase phase = scheduler.update(state, demand, emergency, t);

            if (!phase.isAdvanced() && phase.getActiveLane() == previousLane) {
                assertThat(phase.getRemainingSeconds()).isLessThanOrEqualTo(previousRemaining);
            }
            if (phase.getAdjustment() != null) {
                int floor = phase.getAdjustment() == PhaseAdjustment.EMERGENCY
                        ? config.getEmergencyFloorSeconds()
                        : config.getCongestionFloorSeconds();
                assertThat(phase.getRemainingSeconds()).isGreaterThanOrEqualTo(floor);
                if (lastFire != null) {
                    assertThat(t - lastFire).isGreaterThanOrEqualTo(config.getCooldownSeconds() * 1000L);
                }
                lastFire = t;
            }
            if (phase.isAdvanced()) {
                lastFire = null;
            }
            previousRemaining = phase.getRemainingSeconds();
            previousLane = phase.getActiveLane();
        }
    }

    @Test
    void heavyLaneCannotStarveTheOthers() {
        long worst = maxWaitMillis(3, new Random(1), true, 6 * 3_600);

        assertThat(worst).isLessThanOrEqualTo((config.getStarvationCeilingSeconds() + config.getMaxPhaseSeconds()) * 1000L + 1_000);
    }

    @Test
    void twoLanesWaitAtMostCeilingPlusOnePhase() {
        long worst = maxWaitMillis(2, new Random(7), false, 6 * 3_600);

        assertThat(worst).isLessThanOrEqualTo((config.getStarvationCeilingSeconds() + config.getMaxPhaseSeconds()) * 1000L + 1_000);
    }

    @Test
    void everyLaneIsServedUnderArbitraryLoad() {
        for (int lanes = 3; lanes <= 6; lanes++) {
            long worst = maxWaitMillis(lanes, new Random(lanes), false, 6 * 3_600);

            long bound = (config.getStarvationCeilingSeconds() + (long) (lanes - 1) * config.getMaxPhaseSeconds()) * 1000L;
            assertThat(worst).as("%d lanes", lanes).isLessThanOrEqualTo(bound + 1_000);
        }
    }

    /**
     * Runs the controller once per second and returns the longest time any lane spent
     * waiting since its last green (or since the start, for a lane not yet served).
     */
    private long maxWaitMillis(int laneCount, Random random, boolean oneHeavyLane, int seconds) {
        SignalPhaseState state = new SignalPhaseState(laneCount);
        int[] occupancy = new int[laneCount];
        int[] choices = {0, 0, 1, 5, 12, 30, 40};
        long worst = 0;

        for (int s = 0; s < seconds; s++) {
            long now = s * 1000L;
            if (oneHeavyLane) {
                occupancy[0] = 30;
            } else if (s % 7 == 0) {
                for (int i = 0; i < laneCount; i++) {
                    occupancy[i] = choices[random.nextInt(choices.length)];
                }
            }
            if (state.isStarted()) {
                for (int lane = 1; lane <= laneCount; lane++) {
                    if (lane == state.getActiveLane()) {
                        continue;
                    }
                    Long lastGreen = state.getLastGreenMillis(lane);
                    worst = Math.max(worst, now - (lastGreen == null ? 0 : lastGreen));
                }
            }
            scheduler.update(state, demand(occupancy), null, now);
        }
        return worst;
    }
}
