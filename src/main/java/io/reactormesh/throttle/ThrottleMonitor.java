package io.reactormesh.throttle;

import io.reactormesh.config.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-interval admission budget. Above the throttle threshold the budget shrinks to
 * {@code max * (1 - pressure)}, never below one slot. Above the emergency threshold
 * only critical units are admitted.
 */
public final class ThrottleMonitor {
    private static final Logger logger = LoggerFactory.getLogger(ThrottleMonitor.class);

    private final List<PressureProbe> probes = new CopyOnWriteArrayList<>();
    private final AtomicLong mutationsTotal = new AtomicLong(0L);
    private final AtomicLong deferredTotal = new AtomicLong(0L);
    private final Object windowLock = new Object();
    private volatile double externalPressure;
    private volatile long sampleIntervalMs;
    private volatile int maxMutationsPerInterval;
    private volatile double throttleThreshold;
    private volatile double emergencyThreshold;
    private volatile double mutationRatePerSecond;
    private volatile Mode lastMode = Mode.NORMAL;
    private long windowStartMs = Long.MIN_VALUE;
    private long mutationsAtWindowStart;
    private int admittedInWindow;

    public ThrottleMonitor(EngineSettings settings) {
        applySettings(settings);
    }

    public void applySettings(EngineSettings settings) {
        this.sampleIntervalMs = settings.throttleSampleIntervalMs();
        this.maxMutationsPerInterval = settings.maxMutationsPerInterval();
        this.throttleThreshold = settings.throttleThreshold();
        this.emergencyThreshold = settings.emergencyThreshold();
    }

    public void addProbe(PressureProbe probe) {
        probes.add(probe);
    }

    public void setExternalPressure(double pressure) {
        if (Double.isNaN(pressure)) {
            throw new IllegalArgumentException("pressure must be a number");
        }
        this.externalPressure = clamp(pressure);
    }

    public double externalPressure() {
        return externalPressure;
    }

    public void recordMutations(int count) {
        mutationsTotal.addAndGet(Math.max(0, count));
    }

    public double pressure() {
        double pressure = externalPressure;
        for (PressureProbe probe : probes) {
            try {
                pressure = Math.max(pressure, clamp(probe.pressure()));
            } catch (RuntimeException e) {
                logger.warn("Pressure probe {} failed", probe.name(), e);
            }
        }
        return pressure;
    }

    public Map<String, Double> probeReadings() {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("external", externalPressure);
        for (PressureProbe probe : probes) {
            try {
                out.put(probe.name(), clamp(probe.pressure()));
            } catch (RuntimeException e) {
                logger.warn("Pressure probe {} failed", probe.name(), e);
            }
        }
        return out;
    }

    public Mode mode() {
        return modeFor(pressure());
    }

    public Mode beginCycle(long nowMs) {
        synchronized (windowLock) {
            if (windowStartMs == Long.MIN_VALUE) {
                windowStartMs = nowMs;
                mutationsAtWindowStart = mutationsTotal.get();
            } else if (nowMs - windowStartMs >= sampleIntervalMs) {
                long total = mutationsTotal.get();
                long elapsed = Math.max(1L, nowMs - windowStartMs);
                mutationRatePerSecond = (total - mutationsAtWindowStart) * 1000.0d / elapsed;
                windowStartMs = nowMs;
                mutationsAtWindowStart = total;
                admittedInWindow = 0;
            }
        }
        Mode mode = mode();
        if (mode != lastMode) {
            logger.info("Throttle mode {} -> {} (pressure={})", lastMode, mode, String.format("%.3f", pressure()));
            lastMode = mode;
        }
        return mode;
    }

    public Decision tryAdmit(boolean critical) {
        double pressure = pressure();
        Mode mode = modeFor(pressure);
        if (mode == Mode.EMERGENCY && !critical) {
            deferredTotal.incrementAndGet();
            return Decision.DEFERRED_EMERGENCY;
        }
        synchronized (windowLock) {
            if (admittedInWindow >= budgetFor(pressure, mode)) {
                deferredTotal.incrementAndGet();
                return Decision.DEFERRED_BUDGET;
            }
            admittedInWindow++;
        }
        return Decision.ADMIT;
    }

    public int currentBudget() {
        double pressure = pressure();
        return budgetFor(pressure, modeFor(pressure));
    }

    public int admittedInWindow() {
        synchronized (windowLock) {
            return admittedInWindow;
        }
    }

    public double mutationRatePerSecond() {
        return mutationRatePerSecond;
    }

    public long mutationsTotal() {
        return mutationsTotal.get();
    }

    public long deferredTotal() {
        return deferredTotal.get();
    }

    private int budgetFor(double pressure, Mode mode) {
        if (mode == Mode.NORMAL) {
            return maxMutationsPerInterval;
        }
        return Math.max(1, (int) Math.floor(maxMutationsPerInterval * (1.0d - pressure)));
    }

    private Mode modeFor(double pressure) {
        if (pressure > emergencyThreshold) {
            return Mode.EMERGENCY;
        }
        if (pressure > throttleThreshold) {
            return Mode.THROTTLED;
        }
        return Mode.NORMAL;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, value));
    }

    public enum Mode {
        NORMAL,
        THROTTLED,
        EMERGENCY
    }

    public enum Decision {
        ADMIT,
        DEFERRED_BUDGET,
        DEFERRED_EMERGENCY
    }
}
