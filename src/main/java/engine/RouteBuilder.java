package engine;

import common.consts.ErrorCodes;
import common.consts.RouteActionEnum;
import common.consts.RouteErrorTypeEnum;
import lombok.extern.slf4j.Slf4j;
import model.bo.LocationGraph;
import model.dto.response.RouteError;
import model.dto.response.RouteOutcome;
import model.dto.response.RouteResult;
import model.entity.CargoMission;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 贪心路线构建
 *
 * 每一轮先处理当前地点的零距离动作 (卸货优先于装货)，
 * 没有零距离动作时对所有可行候选评分，前往得分最高者并执行。
 * 候选按 pending (请求顺序) 的装货、再 inProgress (装货顺序) 的卸货依次扫描，
 * 只有严格更高的分数才会替换当前最优，因此同分时先扫描到的候选胜出。
 *
 * 一个 RouteBuilder 可以多次调用 build，每次调用使用独立的 MissionLedger 与 RouteState。
 */
@Slf4j
public class RouteBuilder {

    private final LocationGraph graph;
    private final double shipCapacity;
    private final int maxSteps;

    public RouteBuilder(LocationGraph graph, double shipCapacity) {
        this(graph, shipCapacity, Integer.MAX_VALUE);
    }

    /**
     * @param maxSteps 单次规划允许提交的最大动作数
     */
    public RouteBuilder(LocationGraph graph, double shipCapacity, int maxSteps) {
        this.graph = graph;
        this.shipCapacity = shipCapacity;
        this.maxSteps = maxSteps;
    }

    public RouteOutcome build(List<CargoMission> missions, String startLocation) {
        if (missions == null || missions.isEmpty()) {
            return RouteOutcome.failure(RouteError.of(RouteErrorTypeEnum.NO_MISSIONS, ErrorCodes.NO_MISSIONS));
        }
        List<String> invalid = findUnknownLocations(missions, startLocation);
        if (!invalid.isEmpty()) {
            return RouteOutcome.failure(RouteError.invalidLocations(invalid, graph.getLocationNames()));
        }

        MissionLedger ledger = new MissionLedger(missions);
        RouteState state = new RouteState(startLocation, shipCapacity);
        OptionScorer scorer = new OptionScorer(graph, ledger);

        while (ledger.hasOutstanding()) {
            if (state.getStepCount() >= maxSteps) {
                log.warn("路线规划超出最大步数 {}，已完成任务 {} 个", maxSteps, ledger.completedIndices().size());
                RouteError error = partialFailure(RouteErrorTypeEnum.STEP_LIMIT_EXCEEDED,
                        ErrorCodes.STEP_LIMIT_EXCEEDED, ledger, state);
                return RouteOutcome.failure(error);
            }
            if (executeLocalAction(ledger, state)) {
                continue;
            }

            RouteOption best = selectBest(ledger, state, scorer);
            if (best == null) {
                return RouteOutcome.failure(partialFailure(RouteErrorTypeEnum.INFEASIBLE,
                        ErrorCodes.INFEASIBLE, ledger, state));
            }
            state.travelTo(best.getTarget(), graph.distance(state.getCurrentLocation(), best.getTarget()));
            log.debug("前往 {} 执行 {} {}，得分 {}", best.getTarget(), best.getAction(),
                    ledger.getMission(best.getMissionIndex()).getMissionId(), best.getScore());
            if (best.getAction() == RouteActionEnum.PICKUP) {
                pickUp(ledger, state, best.getMissionIndex());
            } else {
                dropOff(ledger, state, best.getMissionIndex());
            }
        }

        return RouteOutcome.success(toResult(ledger, state));
    }

    /**
     * 当前地点的零距离动作，卸货优先以先腾出舱位
     *
     * @return 是否执行了动作
     */
    private boolean executeLocalAction(MissionLedger ledger, RouteState state) {
        String here = state.getCurrentLocation();
        for (int i : ledger.inProgressIndices()) {
            if (here.equals(ledger.nextDropoff(i))) {
                dropOff(ledger, state, i);
                return true;
            }
        }
        for (int i : ledger.pendingIndices()) {
            CargoMission mission = ledger.getMission(i);
            if (here.equals(mission.getPickup()) && state.fits(mission.getCargoScu())) {
                pickUp(ledger, state, i);
                return true;
            }
        }
        return false;
    }

    private RouteOption selectBest(MissionLedger ledger, RouteState state, OptionScorer scorer) {
        RouteOption best = null;
        for (int i : ledger.pendingIndices()) {
            if (!state.fits(ledger.getMission(i).getCargoScu())) {
                continue;
            }
            RouteOption option = scorer.scorePickup(state, i);
            if (best == null || option.getScore() > best.getScore()) {
                best = option;
            }
        }
        for (int i : ledger.inProgressIndices()) {
            RouteOption option = scorer.scoreDropoff(state, i);
            if (best == null || option.getScore() > best.getScore()) {
                best = option;
            }
        }
        return best;
    }

    private void pickUp(MissionLedger ledger, RouteState state, int index) {
        CargoMission mission = ledger.getMission(index);
        double loaded = ledger.pickUp(index);
        state.load(mission.getCargoType(), loaded);
        state.record(RouteActionEnum.PICKUP.getLabel() + " " + mission.getMissionId() + " - " + mission.getCargoType());
    }

    private void dropOff(MissionLedger ledger, RouteState state, int index) {
        CargoMission mission = ledger.getMission(index);
        String location = ledger.nextDropoff(index);
        String cargoType = ledger.currentDropoffCargoType(index);
        double delivered = ledger.dropOff(index);
        state.unload(cargoType, delivered);
        state.record(RouteActionEnum.DROPOFF.getLabel() + " " + mission.getMissionId()
                + " at " + location + " - " + cargoType);
        // 报酬只在最后一个卸货点完成时入账
        if (ledger.isComplete(index)) {
            state.credit(mission.getPayout());
        }
    }

    private List<String> findUnknownLocations(List<CargoMission> missions, String startLocation) {
        Set<String> unknown = new LinkedHashSet<>();
        if (!graph.contains(startLocation)) {
            unknown.add(String.valueOf(startLocation));
        }
        for (CargoMission mission : missions) {
            if (!graph.contains(mission.getPickup())) {
                unknown.add(mission.getPickup());
            }
            for (String dropoff : mission.getDropoffs()) {
                if (!graph.contains(dropoff)) {
                    unknown.add(dropoff);
                }
            }
        }
        return new ArrayList<>(unknown);
    }

    private RouteError partialFailure(RouteErrorTypeEnum type, String message,
                                      MissionLedger ledger, RouteState state) {
        List<String> remaining = new ArrayList<>();
        for (int i : ledger.pendingIndices()) {
            remaining.add(ledger.getMission(i).getMissionId());
        }
        for (int i : ledger.inProgressIndices()) {
            remaining.add(ledger.getMission(i).getMissionId());
        }
        return RouteError.partial(type, message, new ArrayList<>(state.getRoute()), completedIds(ledger), remaining);
    }

    private List<String> completedIds(MissionLedger ledger) {
        List<String> ids = new ArrayList<>();
        for (int i : ledger.completedIndices()) {
            ids.add(ledger.getMission(i).getMissionId());
        }
        return ids;
    }

    private RouteResult toResult(MissionLedger ledger, RouteState state) {
        RouteResult result = new RouteResult();
        result.setRoute(new ArrayList<>(state.getRoute()));
        result.setMissionOrder(new ArrayList<>(state.getActionLog()));
        result.setCargoAtEachStep(new ArrayList<>(state.getCargoTrace()));
        result.setCargoTypesAtSteps(new ArrayList<>(state.getCompositionTrace()));
        result.setTotalDistance(state.getTotalDistance());
        result.setTotalPayout(state.getTotalPayout());
        result.setCompletedMissions(completedIds(ledger));
        return result;
    }
}
