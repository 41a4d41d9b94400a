package org.lanegraph.kernel;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import org.lanegraph.network.NetworkTopology;
import org.lanegraph.position.EdgeStartHints;
import org.lanegraph.vehicle.SimulationSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Synthetic backend that replays a scripted sequence of snapshots.
 *
 * <p>{@link #reset()} returns the initial snapshot and rewinds the script; each
 * {@link #advance()} returns the next scripted snapshot. Advancing past the end either
 * repeats the last snapshot or fails, depending on {@code loopLast}.</p>
 */
public final class ReplaySimulationBackend implements SimulationBackend {
    private static final Logger log = LoggerFactory.getLogger(ReplaySimulationBackend.class);

    private final NetworkTopology topology;
    private final EdgeStartHints hints;
    private final SimulationSnapshot initial;
    private final List<SimulationSnapshot> steps;
    private final double stepLength;
    private final boolean loopLast;

    private int cursor;
    private boolean closed;

    @Builder
    private ReplaySimulationBackend(
            @NonNull NetworkTopology topology,
            EdgeStartHints hints,
            SimulationSnapshot initial,
            @Singular List<SimulationSnapshot> steps,
            Double stepLength,
            boolean loopLast
    ) {
        this.topology = topology;
        this.hints = hints == null ? EdgeStartHints.none() : hints;
        this.initial = initial == null ? SimulationSnapshot.empty() : initial;
        this.steps = steps;
        this.stepLength = stepLength == null ? 0.1d : stepLength;
        this.loopLast = loopLast;
        if (!(this.stepLength > 0.0d)) {
            throw new IllegalArgumentException("stepLength must be > 0, got " + this.stepLength);
        }
    }

    @Override
    public NetworkTopology topology() {
        return topology;
    }

    @Override
    public EdgeStartHints edgeStartHints() {
        return hints;
    }

    @Override
    public SimulationSnapshot advance() {
        ensureOpen();
        if (cursor >= steps.size()) {
            if (loopLast && !steps.isEmpty()) {
                return steps.get(steps.size() - 1);
            }
            throw new IllegalStateException("replay exhausted after " + steps.size() + " step(s)");
        }
        return steps.get(cursor++);
    }

    @Override
    public SimulationSnapshot reset() {
        ensureOpen();
        cursor = 0;
        log.debug("Replay rewound ({} scripted step(s))", steps.size());
        return initial;
    }

    @Override
    public double stepLength() {
        return stepLength;
    }

    /**
     * Number of scripted steps not yet replayed.
     */
    public int remaining() {
        return steps.size() - cursor;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("replay backend is closed");
        }
    }
}
