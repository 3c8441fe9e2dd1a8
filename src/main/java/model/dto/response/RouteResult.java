package model.dto.response;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 规划成功的路线
 * route / cargoAtEachStep / cargoTypesAtSteps 一一对应，首项为出发状态；missionOrder 比它们少一项
 */
@Data
public class RouteResult {
    private List<String> route;
    private List<String> missionOrder;
    private List<Double> cargoAtEachStep;
    private List<Map<String, Double>> cargoTypesAtSteps;
    private double totalDistance;
    private double totalPayout;
    private List<String> completedMissions;
}
