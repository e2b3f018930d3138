package hw;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import oshi.SystemInfo;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.hardware.PowerSource;

/**
 * Power policy for optional GPU work. {@code -DforceOnAC} and {@code -DforceBatteryLevel}
 * override what OSHI reports.
 */
public final class BatteryMonitor {
    private static final Logger log = LoggerFactory.getLogger(BatteryMonitor.class);

    public static final int GPU_MIN_BATTERY_PERCENT = 30;

    private static HardwareAbstractionLayer hal;

    private BatteryMonitor() {
    }

    private static synchronized HardwareAbstractionLayer hal() {
        if (hal == null)
            hal = new SystemInfo().getHardware();
        return hal;
    }

    public static boolean onAC() {
        String override = System.getProperty("forceOnAC");
        if (override != null)
            return Boolean.parseBoolean(override);

        try {
            PowerSource[] ps = hal().getPowerSources().toArray(new PowerSource[0]);
            if (ps.length == 0)
                return true; // assume desktop/AC

            for (PowerSource p : ps) {
                if (p.isPowerOnLine())
                    return true;
            }
            return false;
        } catch (Throwable t) {
            log.debug("Power source query failed, assuming AC: {}", t.toString());
            return true;
        }
    }

    public static int levelOrGuess() {
        String lvl = System.getProperty("forceBatteryLevel");
        if (lvl != null) {
            try {
                int v = Integer.parseInt(lvl.trim());
                return Math.max(0, Math.min(100, v));
            } catch (NumberFormatException e) {
                log.warn("Ignoring forceBatteryLevel={}: not a number", lvl);
            }
        }

        try {
            PowerSource[] ps = hal().getPowerSources().toArray(new PowerSource[0]);
            if (ps.length == 0)
                return 100;

            double sum = 0;
            int n = 0;
            for (PowerSource p : ps) {
                double pct = p.getRemainingCapacityPercent();
                if (!Double.isNaN(pct)) {
                    sum += pct;
                    n++;
                }
            }
            if (n == 0)
                return 100;
            return (int) Math.round((sum / n) * 100.0);
        } catch (Throwable t) {
            log.debug("Battery level query failed, assuming full: {}", t.toString());
            return 100;
        }
    }

    /** GPU filtering needs the user's opt-in, and AC power or more than 30% battery. */
    public static boolean gpuAllowed(boolean userWantsGpu) {
        if (!userWantsGpu)
            return false;
        if (onAC())
            return true;
        int level = levelOrGuess();
        if (level <= GPU_MIN_BATTERY_PERCENT) {
            log.info("Battery at {}%, keeping bilateral filtering on the CPU", level);
            return false;
        }
        return true;
    }
}
