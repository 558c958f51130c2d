package com.lanewatch.backend.model.vehicle;

/**
 * One tracked vehicle as seen in a single frame. Coordinates are frame pixels.
 */
public class VehicleObservation {
    private final int trackId;
    private final VehicleClass vehicleClass;
    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    public VehicleObservation(int trackId, VehicleClass vehicleClass, double x1, double y1, double x2, double y2) {
        if (vehicleClass == null) {
            throw new IllegalArgumentException("Vehicle class is required for track " + trackId);
        }
        this.trackId = trackId;
        this.vehicleClass = vehicleClass;
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public double getCentroidX() { return (x1 + x2) / 2.0; }
    public double getCentroidY() { return (y1 + y2) / 2.0; }

    public int getTrackId() { return trackId; }
    public VehicleClass getVehicleClass() { return vehicleClass; }
    public double getX1() { return x1; }
    public double getY1() { return y1; }
    public double getX2() { return x2; }
    public double getY2() { return y2; }

    @Override
    public String toString() {
        return "VehicleObservation{id=" + trackId + ", class=" + vehicleClass.getLabel()
                + ", centroid=[" + getCentroidX() + ", " + getCentroidY() + "]}";
    }
}
