package com.phillippitts.vani.domain;

/**
 * Snapshot reported by the desktop collaborator.
 *
 * @param cpuPercent     CPU utilisation, 0-100
 * @param memoryPercent  memory utilisation, 0-100
 * @param batteryPercent battery charge, or null when the machine has no battery
 * @param charging       whether the battery is charging (ignored without a battery)
 */
public record SystemStatus(double cpuPercent, double memoryPercent, Integer batteryPercent, boolean charging) {

    public boolean hasBattery() {
        return batteryPercent != null;
    }
}
