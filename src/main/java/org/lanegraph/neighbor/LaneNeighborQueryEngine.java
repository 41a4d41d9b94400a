package org.lanegraph.neighbor;

import org.lanegraph.core.sentinel.Sentinels;
import org.lanegraph.network.LaneRef;
import org.lanegraph.network.NetworkTopology;
import org.lanegraph.position.GlobalPositionMap;
import org.lanegraph.vehicle.VehicleRecord;
import org.lanegraph.vehicle.VehicleStateTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Leader/follower queries over a {@link VehicleStateTable}.
 * <p>
 * Two query families:
 * </p>
 * <ul>
 * <li><b>Same lane</b> ({@link #getLeader}, {@link #getFollower}, {@link #getHeadway},
 * {@link #getTailway}): nearest vehicle in the query vehicle's own lane. When the local edge
 * holds no candidate the search continues through every successor (predecessor) lane, hop by
 * hop up to {@link NeighborQueryConfig#getHopLimit()}, keeping the candidate nearest along
 * the path.</li>
 * <li><b>Per lane</b> ({@link #getLaneLeaders}, {@link #getLaneFollowers},
 * {@link #getLaneHeadways}, {@link #getLaneTailways}, {@link #laneNeighborhood}): one entry
 * for each lane of the query vehicle's edge. Cross-edge search in lane {@code l} only follows
 * the first connection that keeps lane index {@code l}.</li>
 * </ul>
 * <p>
 * "Ahead" and "behind" are strict: a vehicle at exactly the query position is neither. Equal
 * candidate positions resolve to the lexicographically smaller id. Distances on the query
 * vehicle's edge are differences of global positions; across edges they are path lengths
 * through the traversed edges, which also holds across the seam of a closed loop.
 * </p>
 * <p>
 * Headway is {@code distance - leader length}; tailway is {@code distance - own length}.
 * Neither is clamped, so a negative value signals overlapping vehicles. A lane without a
 * neighbor reports {@link Sentinels#NO_VEHICLE} and {@link #fallbackDistance()}. An unknown
 * query vehicle, or one on an edge the topology does not know, gets the caller default.
 * </p>
 * <p>
 * The engine holds no per-step state and may be shared across sessions.
 * </p>
 */
public final class LaneNeighborQueryEngine {
    private static final Logger log = LoggerFactory.getLogger(LaneNeighborQueryEngine.class);

    private final NetworkTopology topology;
    private final GlobalPositionMap positionMap;
    private final NeighborQueryConfig config;
    private final double fallbackDistance;

    public LaneNeighborQueryEngine(GlobalPositionMap positionMap) {
        this(positionMap, NeighborQueryConfig.defaults());
    }

    public LaneNeighborQueryEngine(GlobalPositionMap positionMap, NeighborQueryConfig config) {
        this.positionMap = Objects.requireNonNull(positionMap, "positionMap");
        this.topology = positionMap.topology();
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        this.fallbackDistance = config.getFallbackPolicy() == FallbackDistancePolicy.FIXED
                ? config.getFixedFallbackDistance()
                : topology.totalLength();
        log.info("Neighbor engine ready: hopLimit={}, fallback={} ({})",
                config.getHopLimit(), fallbackDistance, config.getFallbackPolicy());
    }

    /**
     * Distance reported for a lane with no leader or follower.
     */
    public double fallbackDistance() {
        return fallbackDistance;
    }

    public NeighborQueryConfig config() {
        return config;
    }

    // ========================================================================
    // SAME LANE
    // ========================================================================

    /**
     * Nearest vehicle ahead in the same lane, or {@link Sentinels#NO_VEHICLE}.
     */
    public String getLeader(VehicleStateTable table, String vehicleId, String error) {
        VehicleRecord self = resolve(table, vehicleId);
        if (self == null) {
            return error;
        }
        Hit hit = sameLaneAhead(table, self);
        return hit == null ? Sentinels.NO_VEHICLE : hit.vehicle().id();
    }

    public List<String> getLeader(VehicleStateTable table, List<String> vehicleIds, String error) {
        List<String> out = new ArrayList<>(vehicleIds.size());
        for (String id : vehicleIds) {
            out.add(getLeader(table, id, error));
        }
        return out;
    }

    /**
     * Nearest vehicle behind in the same lane, or {@link Sentinels#NO_VEHICLE}.
     */
    public String getFollower(VehicleStateTable table, String vehicleId, String error) {
        VehicleRecord self = resolve(table, vehicleId);
        if (self == null) {
            return error;
        }
        Hit hit = sameLaneBehind(table, self);
        return hit == null ? Sentinels.NO_VEHICLE : hit.vehicle().id();
    }

    public List<String> getFollower(VehicleStateTable table, List<String> vehicleIds, String error) {
        List<String> out = new ArrayList<>(vehicleIds.size());
        for (String id : vehicleIds) {
            out.add(getFollower(table, id, error));
        }
        return out;
    }

    /**
     * Gap to the same-lane leader, or {@link #fallbackDistance()} without one.
     */
    public double getHeadway(VehicleStateTable table, String vehicleId, double error) {
        VehicleRecord self = resolve(table, vehicleId);
        if (self == null) {
            return error;
        }
        return headway(sameLaneAhead(table, self));
    }

    public double[] getHeadway(VehicleStateTable table, List<String> vehicleIds, double error) {
        double[] out = new double[vehicleIds.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getHeadway(table, vehicleIds.get(i), error);
        }
        return out;
    }

    /**
     * Gap to the same-lane follower, or {@link #fallbackDistance()} without one.
     */
    public double getTailway(VehicleStateTable table, String vehicleId, double error) {
        VehicleRecord self = resolve(table, vehicleId);
        if (self == null) {
            return error;
        }
        return tailway(self, sameLaneBehind(table, self));
    }

    public double[] getTailway(VehicleStateTable table, List<String> vehicleIds, double error) {
        double[] out = new double[vehicleIds.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getTailway(table, vehicleIds.get(i), error);
        }
        return out;
    }

    // ========================================================================
    // PER LANE
    // ========================================================================

    /**
     * Leader in every lane of the vehicle's edge, lane 0 first.
     */
    public List<String> getLaneLeaders(VehicleStateTable table, String vehicleId, List<String> error) {
        VehicleRecord self = resolve(table, vehicleId);
        if (self == null) {
            return error;
        }
        int lanes = topology.numLanes(self.edgeId());
        List<String> out = new ArrayList<>(lanes);
        for (int lane = 0; lane < lanes; lane++) {
            Hit hit = laneAhead(table, self, lane);
            out.add(hit == null ? Sentinels.NO_VEHICLE : hit.vehicle().id());
        }
        return out;
    }

    public List<List<String>> getLaneLeaders(VehicleStateTable table, List<String> vehicleIds, List<String> error) {
        List<List<String>> out = new ArrayList<>(vehicleIds.size());
        for (String id : vehicleIds) {
            out.add(getLaneLeaders(table, id, error));
        }
        return out;
    }

    /**
     * Follower in every lane of the vehicle's edge, lane 0 first.
     */
    public List<String> getLaneFollowers(VehicleStateTable table, String vehicleId, List<String> error) {
        VehicleRecord self = resolve(table, vehicleId);
        if (self == null) {
            return error;
        }
        int lanes = topology.numLanes(self.edgeId());
        List<String> out = new ArrayList<>(lanes);
        for (int lane = 0; lane < lanes; lane++) {
            Hit hit = laneBehind(table, self, lane);
            out.add(hit == null ? Sentinels.NO_VEHICLE : hit.vehicle().id());
        }
        return out;
    }

    public List<List<String>> getLaneFollowers(VehicleStateTable table, List<String> vehicleIds, List<String> error) {
        List<List<String>> out = new ArrayList<>(vehicleIds.size());
        for (String id : vehicleIds) {
            out.add(getLaneFollowers(table, id, error));
        }
        return out;
    }

    /**
     * Headway in every lane of the vehicle's edge.
     */
    public double[] getLaneHeadways(VehicleStateTable table, String vehicleId, double[] error) {
        VehicleRecord self = resolve(table, vehicleId);
        if (self == null) {
            return error;
        }
        int lanes = topology.numLanes(self.edgeId());
        double[] out = new double[lanes];
        for (int lane = 0; lane < lanes; lane++) {
            out[lane] = headway(laneAhead(table, self, lane));
        }
        return out;
    }

    public List<double[]> getLaneHeadways(VehicleStateTable table, List<String> vehicleIds, double[] error) {
        List<double[]> out = new ArrayList<>(vehicleIds.size());
        for (String id : vehicleIds) {
            out.add(getLaneHeadways(table, id, error));
        }
        return out;
    }

    /**
     * Tailway in every lane of the vehicle's edge.
     */
    public double[] getLaneTailways(VehicleStateTable table, String vehicleId, double[] error) {
        VehicleRecord self = resolve(table, vehicleId);
        if (self == null) {
            return error;
        }
        int lanes = topology.numLanes(self.edgeId());
        double[] out = new double[lanes];
        for (int lane = 0; lane < lanes; lane++) {
            out[lane] = tailway(self, laneBehind(table, self, lane));
        }
        return out;
    }

    public List<double[]> getLaneTailways(VehicleStateTable table, List<String> vehicleIds, double[] error) {
        List<double[]> out = new ArrayList<>(vehicleIds.size());
        for (String id : vehicleIds) {
            out.add(getLaneTailways(table, id, error));
        }
        return out;
    }

    /**
     * All four per-lane vectors from a single pass over the lanes.
     */
    public LaneNeighborhood laneNeighborhood(VehicleStateTable table, String vehicleId, LaneNeighborhood error) {
        VehicleRecord self = resolve(table, vehicleId);
        if (self == null) {
            return error;
        }
        int lanes = topology.numLanes(self.edgeId());
        List<String> leaders = new ArrayList<>(lanes);
        List<String> followers = new ArrayList<>(lanes);
        double[] headways = new double[lanes];
        double[] tailways = new double[lanes];
        for (int lane = 0; lane < lanes; lane++) {
            Hit ahead = laneAhead(table, self, lane);
            Hit behind = laneBehind(table, self, lane);
            leaders.add(ahead == null ? Sentinels.NO_VEHICLE : ahead.vehicle().id());
            followers.add(behind == null ? Sentinels.NO_VEHICLE : behind.vehicle().id());
            headways[lane] = headway(ahead);
            tailways[lane] = tailway(self, behind);
        }
        return new LaneNeighborhood(leaders, followers, headways, tailways);
    }

    // ========================================================================
    // SEARCH
    // ========================================================================

    private record Hit(VehicleRecord vehicle, double distance) {
    }

    /**
     * One lane reached during traversal, with the path length from the query vehicle to
     * the start (successor search) or end (predecessor search) of that lane's edge.
     */
    private record Step(String edgeId, int lane, double pathLength) {
    }

    private VehicleRecord resolve(VehicleStateTable table, String vehicleId) {
        Objects.requireNonNull(table, "table");
        VehicleRecord self = table.get(vehicleId);
        if (self == null) {
            return null;
        }
        if (!topology.containsEdge(self.edgeId())) {
            log.trace("Vehicle {} is on unknown edge '{}'", vehicleId, self.edgeId());
            return null;
        }
        return self;
    }

    private double headway(Hit leader) {
        return leader == null ? fallbackDistance : leader.distance() - leader.vehicle().length();
    }

    private double tailway(VehicleRecord self, Hit follower) {
        return follower == null ? fallbackDistance : follower.distance() - self.length();
    }

    private Hit sameLaneAhead(VehicleStateTable table, VehicleRecord self) {
        Hit local = localAhead(table, self, self.lane());
        if (local != null) {
            return local;
        }
        double remaining = topology.edgeLength(self.edgeId()) - self.position();
        return searchForward(table, self, topology.nextEdge(self.edgeId(), self.lane()), remaining, false);
    }

    private Hit sameLaneBehind(VehicleStateTable table, VehicleRecord self) {
        Hit local = localBehind(table, self, self.lane());
        if (local != null) {
            return local;
        }
        return searchBackward(table, self, topology.prevEdge(self.edgeId(), self.lane()), self.position(), false);
    }

    private Hit laneAhead(VehicleStateTable table, VehicleRecord self, int lane) {
        Hit local = localAhead(table, self, lane);
        if (local != null) {
            return local;
        }
        double remaining = topology.edgeLength(self.edgeId()) - self.position();
        return searchForward(table, self, lanePreserving(topology.nextEdge(self.edgeId(), lane), lane), remaining, true);
    }

    private Hit laneBehind(VehicleStateTable table, VehicleRecord self, int lane) {
        Hit local = localBehind(table, self, lane);
        if (local != null) {
            return local;
        }
        return searchBackward(table, self, lanePreserving(topology.prevEdge(self.edgeId(), lane), lane),
                self.position(), true);
    }

    /**
     * Candidate on the query vehicle's edge strictly ahead, measured on the global axis.
     */
    private Hit localAhead(VehicleStateTable table, VehicleRecord self, int lane) {
        VehicleRecord best = null;
        for (VehicleRecord candidate : table.recordsOnEdge(self.edgeId())) {
            if (candidate == self || candidate.lane() != lane || candidate.position() <= self.position()) {
                continue;
            }
            if (best == null || closerAhead(candidate, best)) {
                best = candidate;
            }
        }
        return best == null ? null : new Hit(best, globalGap(self, best));
    }

    private Hit localBehind(VehicleStateTable table, VehicleRecord self, int lane) {
        VehicleRecord best = null;
        for (VehicleRecord candidate : table.recordsOnEdge(self.edgeId())) {
            if (candidate == self || candidate.lane() != lane || candidate.position() >= self.position()) {
                continue;
            }
            if (best == null || closerBehind(candidate, best)) {
                best = candidate;
            }
        }
        return best == null ? null : new Hit(best, globalGap(best, self));
    }

    private double globalGap(VehicleRecord back, VehicleRecord front) {
        if (!positionMap.hasStart(front.edgeId()) || !positionMap.hasStart(back.edgeId())) {
            // edge without a start offset: same edge, so the local difference is exact
            return front.position() - back.position();
        }
        return positionMap.toGlobal(front.edgeId(), front.position())
                - positionMap.toGlobal(back.edgeId(), back.position());
    }

    /**
     * Breadth-first walk over successor lanes. Each hop inspects every lane of the frontier
     * and stops at the first hop that yields a candidate, keeping the one nearest along
     * the path.
     */
    private Hit searchForward(
            VehicleStateTable table,
            VehicleRecord self,
            List<LaneRef> firstHop,
            double remaining,
            boolean lanePreserving
    ) {
        List<Step> frontier = new ArrayList<>(firstHop.size());
        for (LaneRef ref : firstHop) {
            frontier.add(new Step(ref.edgeId(), ref.lane(), remaining));
        }
        Set<LaneRef> visited = new HashSet<>();
        for (int hop = 1; hop <= config.getHopLimit() && !frontier.isEmpty(); hop++) {
            Hit best = null;
            List<Step> next = new ArrayList<>();
            for (Step step : frontier) {
                if (!visited.add(LaneRef.of(step.edgeId(), step.lane()))) {
                    continue;
                }
                VehicleRecord candidate = firstOnLane(table, self, step.edgeId(), step.lane());
                if (candidate != null) {
                    Hit hit = new Hit(candidate, step.pathLength() + candidate.position());
                    if (best == null || nearer(hit, best)) {
                        best = hit;
                    }
                }
                double through = step.pathLength() + topology.edgeLength(step.edgeId());
                List<LaneRef> successors = topology.nextEdge(step.edgeId(), step.lane());
                for (LaneRef ref : lanePreserving ? lanePreserving(successors, step.lane()) : successors) {
                    next.add(new Step(ref.edgeId(), ref.lane(), through));
                }
            }
            if (best != null) {
                return best;
            }
            frontier = next;
        }
        return null;
    }

    private Hit searchBackward(
            VehicleStateTable table,
            VehicleRecord self,
            List<LaneRef> firstHop,
            double travelled,
            boolean lanePreserving
    ) {
        List<Step> frontier = new ArrayList<>(firstHop.size());
        for (LaneRef ref : firstHop) {
            frontier.add(new Step(ref.edgeId(), ref.lane(), travelled));
        }
        Set<LaneRef> visited = new HashSet<>();
        for (int hop = 1; hop <= config.getHopLimit() && !frontier.isEmpty(); hop++) {
            Hit best = null;
            List<Step> next = new ArrayList<>();
            for (Step step : frontier) {
                if (!visited.add(LaneRef.of(step.edgeId(), step.lane()))) {
                    continue;
                }
                double edgeLength = topology.edgeLength(step.edgeId());
                VehicleRecord candidate = lastOnLane(table, self, step.edgeId(), step.lane());
                if (candidate != null) {
                    Hit hit = new Hit(candidate, step.pathLength() + edgeLength - candidate.position());
                    if (best == null || nearer(hit, best)) {
                        best = hit;
                    }
                }
                List<LaneRef> predecessors = topology.prevEdge(step.edgeId(), step.lane());
                for (LaneRef ref : lanePreserving ? lanePreserving(predecessors, step.lane()) : predecessors) {
                    next.add(new Step(ref.edgeId(), ref.lane(), step.pathLength() + edgeLength));
                }
            }
            if (best != null) {
                return best;
            }
            frontier = next;
        }
        return null;
    }

    private static VehicleRecord firstOnLane(VehicleStateTable table, VehicleRecord self, String edgeId, int lane) {
        VehicleRecord best = null;
        for (VehicleRecord candidate : table.recordsOnEdge(edgeId)) {
            if (candidate != self && candidate.lane() == lane && (best == null || closerAhead(candidate, best))) {
                best = candidate;
            }
        }
        return best;
    }

    private static VehicleRecord lastOnLane(VehicleStateTable table, VehicleRecord self, String edgeId, int lane) {
        VehicleRecord best = null;
        for (VehicleRecord candidate : table.recordsOnEdge(edgeId)) {
            if (candidate != self && candidate.lane() == lane && (best == null || closerBehind(candidate, best))) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * First connection that keeps the lane index, as a zero- or one-element list.
     */
    private static List<LaneRef> lanePreserving(List<LaneRef> refs, int lane) {
        for (LaneRef ref : refs) {
            if (ref.lane() == lane) {
                return List.of(ref);
            }
        }
        return List.of();
    }

    // smaller position wins; equal positions fall back to the smaller id
    private static boolean closerAhead(VehicleRecord candidate, VehicleRecord best) {
        int cmp = Double.compare(candidate.position(), best.position());
        return cmp < 0 || (cmp == 0 && candidate.id().compareTo(best.id()) < 0);
    }

    private static boolean closerBehind(VehicleRecord candidate, VehicleRecord best) {
        int cmp = Double.compare(candidate.position(), best.position());
        return cmp > 0 || (cmp == 0 && candidate.id().compareTo(best.id()) < 0);
    }

    private static boolean nearer(Hit candidate, Hit best) {
        int cmp = Double.compare(candidate.distance(), best.distance());
        return cmp < 0 || (cmp == 0 && candidate.vehicle().id().compareTo(best.vehicle().id()) < 0);
    }
}
