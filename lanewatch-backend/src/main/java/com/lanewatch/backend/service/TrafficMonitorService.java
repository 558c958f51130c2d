package com.lanewatch.backend.service;

import com.lanewatch.backend.config.TrafficProperties;
import com.lanewatch.backend.config.WebSocketConfig;
import com.lanewatch.backend.model.report.FrameAnalysis;
import com.lanewatch.backend.model.report.HistorySample;
import com.lanewatch.backend.model.report.LaneReport;
import com.lanewatch.backend.model.report.SessionSummary;
import com.lanewatch.backend.model.report.SpeedViolation;
import com.lanewatch.backend.model.report.TrafficSnapshot;
import com.lanewatch.backend.model.vehicle.VehicleObservation;
import com.lanewatch.backend.service.analytics.Timestamps;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Feeds frames to the {@link TrafficAnalysisEngine} and publishes one immutable
 * {@link TrafficSnapshot} per frame, both to REST readers and to /topic/traffic.
 */
@Slf4j
@Service
public class TrafficMonitorService {

    private final TrafficAnalysisEngine engine;
    private final TrafficProperties.Reporting reporting;
    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    private final Deque<SpeedViolation> recentViolations = new ArrayDeque<>();
    private final Deque<HistorySample> history = new ArrayDeque<>();
    private final AtomicReference<TrafficSnapshot> latest = new AtomicReference<>();
    private final SessionSummary emptySession;

    public TrafficMonitorService(TrafficAnalysisEngine engine, TrafficProperties properties,
                                 SimpMessagingTemplate messagingTemplate, Clock clock) {
        this.engine = engine;
        this.reporting = properties.getReporting();
        this.messagingTemplate = messagingTemplate;
        this.clock = clock;
        this.emptySession = engine.sessionSummary(clock.millis());
    }

    /**
     * Analyses one frame stamped with the current wall clock.
     */
    public FrameAnalysis submitFrame(List<VehicleObservation> observations) {
        return submitFrame(observations, clock.millis());
    }

    public synchronized FrameAnalysis submitFrame(List<VehicleObservation> observations, long nowMillis) {
        FrameAnalysis frame = engine.processFrame(observations, nowMillis);

        for (SpeedViolation violation : frame.getViolations()) {
            recentViolations.addLast(violation);
            while (recentViolations.size() > reporting.getRecentViolations()) {
                recentViolations.removeFirst();
            }
        }

        long frameId = frame.getFrameId();
        if (frameId % reporting.getHistoryEveryFrames() == 0) {
            Map<Integer, Integer> totals = new LinkedHashMap<>();
            for (LaneReport lane : frame.getLanes()) {
                totals.put(lane.getLaneId(), lane.getTotal());
            }
            history.addLast(new HistorySample(Timestamps.iso(nowMillis), totals));
            while (history.size() > reporting.getHistorySize()) {
                history.removeFirst();
            }
        }

        if (frameId % reporting.getLogEveryFrames() == 0) {
            logLaneSummary(frame);
        }

        TrafficSnapshot snapshot = new TrafficSnapshot(frame, new ArrayList<>(recentViolations),
                new ArrayList<>(history), engine.sessionSummary(nowMillis));
        latest.set(snapshot);
        messagingTemplate.convertAndSend(WebSocketConfig.TRAFFIC_TOPIC, snapshot);
        return frame;
    }

    private void logLaneSummary(FrameAnalysis frame) {
        StringBuilder line = new StringBuilder();
        for (LaneReport lane : frame.getLanes()) {
            if (line.length() > 0) {
                line.append(" | ");
            }
            line.append("L").append(lane.getLaneId())
                    .append(' ').append(lane.getTotal())
                    .append(' ').append(lane.los().name())
                    .append(' ').append(lane.trend().getAscii())
                    .append(' ').append(lane.getFlowPerMinute()).append("/min");
        }
        log.info("📊 Frame {}: {} | green lane {} ({}s)", frame.getFrameId(), line,
                frame.getSignal().getActiveLane(), frame.getSignal().getRemainingSeconds());
    }

    /** Null until the first frame has been processed. */
    public TrafficSnapshot getLatestSnapshot() {
        return latest.get();
    }

    public List<HistorySample> getHistory() {
        TrafficSnapshot snapshot = latest.get();
        return snapshot == null ? List.of() : snapshot.getHistory();
    }

    /**
     * Session totals as of the last published frame. Never waits for a frame in progress.
     */
    public SessionSummary getSessionSummary() {
        TrafficSnapshot snapshot = latest.get();
        return snapshot == null ? emptySession : snapshot.getSession();
    }

    @PreDestroy
    public synchronized void logSessionSummary() {
        SessionSummary summary = engine.sessionSummary(clock.millis());
        log.info("🏁 Session {} ended after {}s: {} vehicles, peak {} at {}, {} incidents, {} violations",
                summary.getSessionStart(), summary.getDurationSeconds(), summary.getUniqueVehicles(),
                summary.getPeakOccupancy(), summary.getPeakTime(), summary.getTotalIncidents(),
                summary.getTotalViolations());
    }
}
