package engine;

import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次规划的工作状态，只由 RouteBuilder 修改，不在规划之间共享
 */
@Getter
public class RouteState {

    // 平分货量产生的浮点残差
    private static final double RESIDUE = 1e-9;

    private final double shipCapacity;

    private String currentLocation;
    private double currentCargo;
    // 按首次装载顺序排列，保证输出稳定
    private final Map<String, Double> cargoComposition = new LinkedHashMap<>();

    private final List<String> route = new ArrayList<>();
    private final List<String> actionLog = new ArrayList<>();
    private final List<Double> cargoTrace = new ArrayList<>();
    private final List<Map<String, Double>> compositionTrace = new ArrayList<>();

    private double totalDistance;
    private double totalPayout;

    public RouteState(String startLocation, double shipCapacity) {
        this.shipCapacity = shipCapacity;
        this.currentLocation = startLocation;
        route.add(startLocation);
        cargoTrace.add(0.0);
        compositionTrace.add(new LinkedHashMap<>());
    }

    public boolean fits(double quantity) {
        return currentCargo + quantity <= shipCapacity;
    }

    public void travelTo(String location, double distance) {
        this.currentLocation = location;
        this.totalDistance += distance;
    }

    public void load(String cargoType, double quantity) {
        currentCargo += quantity;
        cargoComposition.merge(cargoType, quantity, Double::sum);
    }

    /**
     * 卸货，货量不会小于 0；该类型剩余量为 0 时移除
     * 小于 1e-9 的残差按 0 处理
     */
    public void unload(String cargoType, double quantity) {
        currentCargo = currentCargo - quantity < RESIDUE ? 0 : currentCargo - quantity;
        Double onBoard = cargoComposition.get(cargoType);
        if (onBoard != null) {
            double left = onBoard - quantity;
            if (left < RESIDUE) {
                cargoComposition.remove(cargoType);
            } else {
                cargoComposition.put(cargoType, left);
            }
        }
    }

    public void credit(double payout) {
        totalPayout += payout;
    }

    /**
     * 记录一次已提交的动作
     */
    public void record(String action) {
        route.add(currentLocation);
        actionLog.add(action);
        cargoTrace.add(currentCargo);
        compositionTrace.add(new LinkedHashMap<>(cargoComposition));
    }

    public int getStepCount() {
        return actionLog.size();
    }
}
