package org.lanegraph.observation;

import org.lanegraph.core.sentinel.Sentinels;
import org.lanegraph.neighbor.LaneNeighborQueryEngine;
import org.lanegraph.network.NetworkTopology;
import org.lanegraph.vehicle.VehicleStateTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the five-feature merge observation for every RL vehicle.
 * <ol>
 * <li>own speed / max speed</li>
 * <li>(leader speed - own speed) / max speed</li>
 * <li>leader headway / network length</li>
 * <li>(own speed - follower speed) / max speed</li>
 * <li>follower tailway / network length</li>
 * </ol>
 * A missing leader counts as driving at max speed one network length ahead; a missing
 * follower as standing still one network length behind. Leaders and followers that
 * contribute are marked observed in the table.
 */
public final class MergeObservationBuilder {
    public static final int FEATURES = 5;

    private final LaneNeighborQueryEngine engine;
    private final double maxSpeed;
    private final double networkLength;
    private final int maxRlVehicles;

    /**
     * @param engine neighbor queries on the session's network.
     * @param topology network supplying the normalizers.
     * @param maxRlVehicles fixed row count ({@code 0} means one row per RL vehicle, no padding).
     */
    public MergeObservationBuilder(LaneNeighborQueryEngine engine, NetworkTopology topology, int maxRlVehicles) {
        this.engine = Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(topology, "topology");
        if (maxRlVehicles < 0) {
            throw new IllegalArgumentException("maxRlVehicles must be >= 0, got " + maxRlVehicles);
        }
        if (!(topology.maxSpeed() > 0.0d) || !(topology.totalLength() > 0.0d)) {
            throw new IllegalArgumentException("network needs a positive max speed and length to normalize observations");
        }
        this.maxSpeed = topology.maxSpeed();
        this.networkLength = topology.totalLength();
        this.maxRlVehicles = maxRlVehicles;
    }

    public MergeObservation build(VehicleStateTable table) {
        List<String> rlIds = table.getRlIds();
        if (maxRlVehicles > 0 && rlIds.size() > maxRlVehicles) {
            rlIds = rlIds.subList(0, maxRlVehicles);
        }
        int rows = maxRlVehicles > 0 ? maxRlVehicles : rlIds.size();
        double[][] features = new double[rows][FEATURES];
        List<String> leaders = new ArrayList<>();
        List<String> followers = new ArrayList<>();

        for (int i = 0; i < rlIds.size(); i++) {
            String rlId = rlIds.get(i);
            double speed = table.getSpeed(rlId, 0.0d);
            String leader = engine.getLeader(table, rlId, Sentinels.NO_VEHICLE);
            String follower = engine.getFollower(table, rlId, Sentinels.NO_VEHICLE);

            double leadSpeed = maxSpeed;
            double leadGap = networkLength;
            if (!Sentinels.isMissing(leader)) {
                leaders.add(leader);
                leadSpeed = table.getSpeed(leader, maxSpeed);
                leadGap = engine.getHeadway(table, rlId, networkLength);
            }

            double followSpeed = 0.0d;
            double followGap = networkLength;
            if (!Sentinels.isMissing(follower)) {
                followers.add(follower);
                followSpeed = table.getSpeed(follower, 0.0d);
                followGap = engine.getTailway(table, rlId, networkLength);
            }

            double[] row = features[i];
            row[0] = speed / maxSpeed;
            row[1] = (leadSpeed - speed) / maxSpeed;
            row[2] = leadGap / networkLength;
            row[3] = (speed - followSpeed) / maxSpeed;
            row[4] = followGap / networkLength;
        }

        for (String id : leaders) {
            table.setObserved(id);
        }
        for (String id : followers) {
            table.setObserved(id);
        }
        return new MergeObservation(rlIds, features, leaders, followers);
    }
}
