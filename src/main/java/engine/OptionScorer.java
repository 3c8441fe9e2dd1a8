package engine;

import common.consts.RouteActionEnum;
import model.bo.LocationGraph;
import model.entity.CargoMission;

/**
 * 候选动作评分
 * 分数越高越优先。权重为固定常量，修改会改变输出路线。
 *
 * 装货：-距离 + 效率×10000 + (1-载货率)×2000 + 同地卸货奖励 5000 + 可装载 3000
 * 卸货：-距离 + 效率×10000 + 载货率×3000 + 本次卸货量/载货量×4000 + 同地装货奖励 3000
 */
public class OptionScorer {

    static final double EFFICIENCY_WEIGHT = 10_000;
    static final double PICKUP_CARGO_WEIGHT = 2_000;
    static final double PICKUP_DROPOFF_BONUS = 5_000;
    static final double PICKUP_CAPACITY_WEIGHT = 3_000;
    static final double DROPOFF_CARGO_WEIGHT = 3_000;
    static final double DROPOFF_URGENCY_WEIGHT = 4_000;
    static final double DROPOFF_PICKUP_BONUS = 3_000;

    private final LocationGraph graph;
    private final MissionLedger ledger;
    private final double[] efficiency;

    public OptionScorer(LocationGraph graph, MissionLedger ledger) {
        this.graph = graph;
        this.ledger = ledger;
        this.efficiency = new double[ledger.size()];
        for (int i = 0; i < ledger.size(); i++) {
            efficiency[i] = efficiencyOf(ledger.getMission(i));
        }
    }

    /**
     * 报酬 / max(1, 装货点到各卸货点距离之和)
     * 只看任务自身的距离，与实际走出的路线无关
     */
    double efficiencyOf(CargoMission mission) {
        double sum = 0;
        for (String dropoff : mission.getDropoffs()) {
            sum += graph.distance(mission.getPickup(), dropoff);
        }
        return mission.getPayout() / Math.max(1, sum);
    }

    public double getEfficiency(int missionIndex) {
        return efficiency[missionIndex];
    }

    /**
     * 装货评分，调用方保证该任务能装下
     */
    public RouteOption scorePickup(RouteState state, int missionIndex) {
        String target = ledger.getMission(missionIndex).getPickup();
        double capacity = state.getShipCapacity();

        double cargoFactor = 1 - state.getCurrentCargo() / capacity;
        double dropoffBonus = ledger.hasNextDropoffAt(target) ? PICKUP_DROPOFF_BONUS : 0;
        double score = distanceScore(state, target)
                + efficiency[missionIndex] * EFFICIENCY_WEIGHT
                + cargoFactor * PICKUP_CARGO_WEIGHT
                + dropoffBonus
                + PICKUP_CAPACITY_WEIGHT;
        return new RouteOption(RouteActionEnum.PICKUP, missionIndex, target, score);
    }

    /**
     * 卸货评分，针对该任务的下一个卸货点
     */
    public RouteOption scoreDropoff(RouteState state, int missionIndex) {
        String target = ledger.nextDropoff(missionIndex);
        double capacity = state.getShipCapacity();

        double cargoFactor = state.getCurrentCargo() / capacity;
        double cargoUrgency = ledger.currentDropoffAmount(missionIndex) / capacity;
        double pickupBonus = ledger.hasPendingPickupAt(target) ? DROPOFF_PICKUP_BONUS : 0;
        double score = distanceScore(state, target)
                + efficiency[missionIndex] * EFFICIENCY_WEIGHT
                + cargoFactor * DROPOFF_CARGO_WEIGHT
                + cargoUrgency * DROPOFF_URGENCY_WEIGHT
                + pickupBonus;
        return new RouteOption(RouteActionEnum.DROPOFF, missionIndex, target, score);
    }

    private double distanceScore(RouteState state, String target) {
        double distance = graph.distance(state.getCurrentLocation(), target);
        return distance == 0 ? 0 : -distance;
    }
}
