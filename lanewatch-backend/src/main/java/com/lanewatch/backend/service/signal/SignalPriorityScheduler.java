package com.lanewatch.backend.service.signal;

import com.lanewatch.backend.config.TrafficProperties;
import com.lanewatch.backend.model.report.PhaseAdjustment;
import com.lanewatch.backend.model.report.SignalPhase;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adaptive green-phase controller.
 * <p>
 * Exactly one lane is green at a time. A phase lasts
 * {@code clamp(occupancy * 3 + round(slope * 4), 15, 90)} seconds, computed when it
 * starts. When it expires the waiting lane with the best {@link PriorityScore} takes
 * over:
 * <pre>
 *   score = occupancy + 2 * slope + waited / WAIT_SCALE
 * </pre>
 * and any lane that has waited the starvation ceiling is forced to the front.
 * Ties keep the first lane in ascending order.
 * <p>
 * While a phase runs it can be trimmed (never extended):
 * <ul>
 *   <li>emergency: an emergency candidate waits in another lane</li>
 *   <li>congestion: the green lane has cleared while a waiting lane overflows</li>
 * </ul>
 * Both share one cooldown, which is cleared when a new phase starts.
 */
@Slf4j
public class SignalPriorityScheduler {

    private final TrafficProperties.Signal config;

    public SignalPriorityScheduler(TrafficProperties.Signal config) {
        this.config = config;
    }

    /**
     * Runs one controller step for the current frame.
     *
     * @param emergencyLane lane holding an emergency candidate this frame, or null
     */
    public SignalPhase update(SignalPhaseState state, LaneDemand demand, Integer emergencyLane, long nowMillis) {
        if (!state.isStarted()) {
            int lane = state.getActiveLane();
            int duration = phaseDurationSeconds(demand, lane);
            state.startPhase(lane, duration, nowMillis);
            log.info("🚦 Signal started: lane {} green for {}s", lane, duration);
        }

        PhaseAdjustment adjustment = applyTrims(state, demand, emergencyLane, nowMillis);

        boolean advanced = false;
        if (nowMillis >= state.getPhaseDeadlineMillis()) {
            int previous = state.getActiveLane();
            int next = nextLane(state, demand, nowMillis);
            int duration = phaseDurationSeconds(demand, next);
            state.startPhase(next, duration, nowMillis);
            advanced = true;
            log.info("🚦 Phase advance: lane {} -> lane {} green for {}s", previous, next, duration);
        }

        checkInvariants(state);
        return snapshot(state, demand, nowMillis, adjustment, advanced);
    }

    private PhaseAdjustment applyTrims(SignalPhaseState state, LaneDemand demand, Integer emergencyLane,
                                       long nowMillis) {
        int active = state.getActiveLane();
        long elapsedMillis = nowMillis - state.getPhaseStartMillis();
        int remaining = remainingSeconds(state, nowMillis);
        boolean cooledDown = cooldownElapsed(state, nowMillis);

        // Emergency: shorten the current green, don't hard-switch, so the lane ahead stops safely
        if (emergencyLane != null && emergencyLane != active && cooledDown) {
            int trimmed = Math.max(config.getEmergencyFloorSeconds(), remaining - config.getEmergencyTrimSeconds());
            if (trimmed < remaining) {
                state.trimDeadline(nowMillis + trimmed * 1000L, nowMillis);
                log.info("🚨 Emergency in lane {}: lane {} green shortened {}s -> {}s",
                        emergencyLane, active, remaining, trimmed);
                return PhaseAdjustment.EMERGENCY;
            }
            return null;
        }

        if (cooledDown
                && elapsedMillis >= config.getMinHoldSeconds() * 1000L
                && remaining > config.getCongestionFloorSeconds()) {
            int waitingMax = demand.maxOccupancyExcept(active, state.getLaneCount());
            if (demand.occupancy(active) <= config.getClearedOccupancy()
                    && waitingMax >= config.getCongestedOccupancy()) {
                int trimmed = Math.max(config.getCongestionFloorSeconds(),
                        remaining - config.getCongestionTrimSeconds());
                if (trimmed < remaining) {
                    state.trimDeadline(nowMillis + trimmed * 1000L, nowMillis);
                    log.info("Congestion: lane {} cleared while a waiting lane holds {} vehicles, green {}s -> {}s",
                            active, waitingMax, remaining, trimmed);
                    return PhaseAdjustment.CONGESTION;
                }
            }
        }
        return null;
    }

    private boolean cooldownElapsed(SignalPhaseState state, long nowMillis) {
        Long last = state.getLastAdjustmentMillis();
        return last == null || nowMillis - last >= config.getCooldownSeconds() * 1000L;
    }

    /**
     * Highest-priority waiting lane. With a single lane configured it stays green.
     */
    int nextLane(SignalPhaseState state, LaneDemand demand, long nowMillis) {
        int active = state.getActiveLane();
        int best = active;
        PriorityScore bestScore = null;
        for (int lane = 1; lane <= state.getLaneCount(); lane++) {
            if (lane == active) {
                continue;
            }
            PriorityScore score = score(state, demand, lane, nowMillis);
            if (bestScore == null || score.compareTo(bestScore) > 0) {
                best = lane;
                bestScore = score;
            }
        }
        if (bestScore != null && bestScore.isForced()) {
            log.info("Lane {} reached the starvation ceiling, forcing green ({})", best, bestScore);
        }
        return best;
    }

    public PriorityScore score(SignalPhaseState state, LaneDemand demand, int lane, long nowMillis) {
        Long lastGreen = state.getLastGreenMillis(lane);
        // A lane that has never been green has waited since the controller started, and at least the ceiling
        double waited = lastGreen == null
                ? Math.max(config.getStarvationCeilingSeconds(), (nowMillis - state.getControllerStartMillis()) / 1000.0)
                : (nowMillis - lastGreen) / 1000.0;
        if (waited >= config.getStarvationCeilingSeconds()) {
            return PriorityScore.forced(waited);
        }
        return PriorityScore.of(demand.occupancy(lane)
                + 2 * demand.slope(lane)
                + waited / config.getWaitScaleSeconds());
    }

    public int phaseDurationSeconds(LaneDemand demand, int lane) {
        long raw = (long) demand.occupancy(lane) * config.getSecondsPerVehicle()
                + Math.round(demand.slope(lane) * config.getSecondsPerSlopeUnit());
        return (int) Math.min(config.getMaxPhaseSeconds(), Math.max(config.getMinPhaseSeconds(), raw));
    }

    public static int remainingSeconds(SignalPhaseState state, long nowMillis) {
        return (int) Math.max(0, (state.getPhaseDeadlineMillis() - nowMillis) / 1000);
    }

    /**
     * Wait estimate walks the lanes in cyclic order from the green one up to and including
     * the target, adding the phase each would get now. It ignores priority reordering.
     */
    private SignalPhase snapshot(SignalPhaseState state, LaneDemand demand, long nowMillis,
                                 PhaseAdjustment adjustment, boolean advanced) {
        int active = state.getActiveLane();
        int laneCount = state.getLaneCount();
        int remaining = remainingSeconds(state, nowMillis);
        Map<Integer, Integer> waits = new LinkedHashMap<>();
        for (int lane = 1; lane <= laneCount; lane++) {
            if (lane == active) {
                continue;
            }
            int wait = remaining;
            int check = active;
            while (check != lane) {
                check = check % laneCount + 1;
                wait += phaseDurationSeconds(demand, check);
            }
            waits.put(lane, wait);
        }
        return new SignalPhase(active, remaining, waits, adjustment, advanced);
    }

    private void checkInvariants(SignalPhaseState state) {
        int active = state.getActiveLane();
        if (active < 1 || active > state.getLaneCount()) {
            throw new IllegalStateException("Active lane " + active + " outside 1.." + state.getLaneCount());
        }
        int duration = state.getPhaseDurationSeconds();
        if (duration < config.getMinPhaseSeconds() || duration > config.getMaxPhaseSeconds()) {
            throw new IllegalStateException("Phase duration " + duration + "s outside ["
                    + config.getMinPhaseSeconds() + ", " + config.getMaxPhaseSeconds() + "]");
        }
        long span = state.getPhaseDeadlineMillis() - state.getPhaseStartMillis();
        if (span < 0 || span > duration * 1000L) {
            throw new IllegalStateException("Phase deadline " + span + "ms after start exceeds the "
                    + duration + "s phase");
        }
    }
}
