package com.lanewatch.backend.controller;

import com.lanewatch.backend.model.lane.Lane;
import com.lanewatch.backend.model.report.FrameAnalysis;
import com.lanewatch.backend.model.report.HistorySample;
import com.lanewatch.backend.model.report.SessionSummary;
import com.lanewatch.backend.model.report.TrafficSnapshot;
import com.lanewatch.backend.model.vehicle.VehicleClass;
import com.lanewatch.backend.model.vehicle.VehicleObservation;
import com.lanewatch.backend.service.LaneLayoutService;
import com.lanewatch.backend.service.TrafficMonitorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/traffic")
@CrossOrigin(origins = "*")
public class TrafficController {

    private final TrafficMonitorService monitorService;
    private final LaneLayoutService laneLayoutService;

    public TrafficController(TrafficMonitorService monitorService, LaneLayoutService laneLayoutService) {
        this.monitorService = monitorService;
        this.laneLayoutService = laneLayoutService;
    }

    /**
     * Submit the tracked vehicles of one video frame.
     * Returns the per-lane analysis and the signal state after this frame.
     */
    @PostMapping("/frames")
    public FrameAnalysis submitFrame(@RequestBody List<ObservationDTO> body) {
        List<VehicleObservation> observations = new ArrayList<>(body.size());
        for (ObservationDTO dto : body) {
            observations.add(new VehicleObservation(dto.getTrackId(), VehicleClass.fromLabel(dto.getVehicleClass()),
                    dto.getX1(), dto.getY1(), dto.getX2(), dto.getY2()));
        }
        return monitorService.submitFrame(observations);
    }

    /**
     * Get the latest published snapshot
     */
    @GetMapping("/stats")
    public ResponseEntity<TrafficSnapshot> getStats() {
        TrafficSnapshot snapshot = monitorService.getLatestSnapshot();
        if (snapshot == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(snapshot);
    }

    /**
     * Get periodic per-lane occupancy samples
     */
    @GetMapping("/history")
    public List<HistorySample> getHistory() {
        return monitorService.getHistory();
    }

    @GetMapping("/session")
    public SessionSummary getSession() {
        return monitorService.getSessionSummary();
    }

    /**
     * Get the configured lane rectangles
     */
    @GetMapping("/lanes")
    public List<Lane> getLanes() {
        return laneLayoutService.getLanes();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadFrame(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    public static class ObservationDTO {
        private int trackId;
        private String vehicleClass;
        private double x1;
        private double y1;
        private double x2;
        private double y2;

        public int getTrackId() { return trackId; }
        public void setTrackId(int trackId) { this.trackId = trackId; }
        public String getVehicleClass() { return vehicleClass; }
        public void setVehicleClass(String vehicleClass) { this.vehicleClass = vehicleClass; }
        public double getX1() { return x1; }
        public void setX1(double x1) { this.x1 = x1; }
        public double getY1() { return y1; }
        public void setY1(double y1) { this.y1 = y1; }
        public double getX2() { return x2; }
        public void setX2(double x2) { this.x2 = x2; }
        public double getY2() { return y2; }
        public void setY2(double y2) { this.y2 = y2; }
    }
}
