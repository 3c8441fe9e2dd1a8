package model.entity;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 货运任务描述
 * 一次装货，按固定顺序依次卸货；创建后不可变，卸货进度由规划过程单独记录
 */
@Getter
public final class CargoMission {
    public static final String DEFAULT_CARGO_TYPE = "General";

    private final String missionId;
    private final String pickup;
    private final List<String> dropoffs;
    private final double cargoScu;
    private final String cargoType;
    private final List<String> dropoffCargoTypes;
    private final List<Double> dropoffCargoAmounts;
    private final double payout;
    private final String description;

    private CargoMission(String missionId, String pickup, List<String> dropoffs, double cargoScu,
                         String cargoType, List<String> dropoffCargoTypes, List<Double> dropoffCargoAmounts,
                         double payout, String description) {
        this.missionId = missionId;
        this.pickup = pickup;
        this.dropoffs = dropoffs;
        this.cargoScu = cargoScu;
        this.cargoType = cargoType;
        this.dropoffCargoTypes = dropoffCargoTypes;
        this.dropoffCargoAmounts = dropoffCargoAmounts;
        this.payout = payout;
        this.description = description;
    }

    /**
     * 创建任务，并补齐每个卸货点的货物类型与数量
     *
     * @param dropoffCargoTypes   可为空或不足，缺少的位置使用任务级货物类型，多余的截断
     * @param dropoffCargoAmounts 可为空或不足，缺少的位置平分剩余货量 max(0, 总量 - 已指定之和)，多余的截断
     * @throws IllegalArgumentException 没有卸货点，或货量、报酬为负数
     */
    public static CargoMission of(String missionId, String pickup, List<String> dropoffs, double cargoScu,
                                  String cargoType, List<String> dropoffCargoTypes,
                                  List<Double> dropoffCargoAmounts, double payout, String description) {
        Objects.requireNonNull(missionId, "missionId");
        Objects.requireNonNull(pickup, "pickup");
        if (dropoffs == null || dropoffs.isEmpty()) {
            throw new IllegalArgumentException("任务 " + missionId + " 至少需要一个卸货点");
        }
        if (cargoScu < 0 || payout < 0) {
            throw new IllegalArgumentException("任务 " + missionId + " 的货量与报酬不能为负数");
        }
        if (dropoffCargoAmounts != null) {
            for (Double amount : dropoffCargoAmounts) {
                if (amount == null || amount < 0) {
                    throw new IllegalArgumentException("任务 " + missionId + " 的卸货量不能为空或负数");
                }
            }
        }
        String type = cargoType != null ? cargoType : DEFAULT_CARGO_TYPE;
        int count = dropoffs.size();

        return new CargoMission(missionId, pickup,
                Collections.unmodifiableList(new ArrayList<>(dropoffs)),
                cargoScu, type,
                Collections.unmodifiableList(fillTypes(dropoffCargoTypes, type, count)),
                Collections.unmodifiableList(fillAmounts(dropoffCargoAmounts, cargoScu, count)),
                payout,
                description != null ? description : "");
    }

    private static List<String> fillTypes(List<String> specified, String defaultType, int count) {
        List<String> types = new ArrayList<>(count);
        if (specified != null) {
            for (int i = 0; i < specified.size() && i < count; i++) {
                types.add(specified.get(i));
            }
        }
        while (types.size() < count) {
            types.add(defaultType);
        }
        return types;
    }

    private static List<Double> fillAmounts(List<Double> specified, double total, int count) {
        List<Double> amounts = new ArrayList<>(count);
        double specifiedSum = 0;
        if (specified != null) {
            for (int i = 0; i < specified.size() && i < count; i++) {
                amounts.add(specified.get(i));
                specifiedSum += specified.get(i);
            }
        }
        int remainingDropoffs = count - amounts.size();
        if (remainingDropoffs > 0) {
            double remaining = Math.max(0, total - specifiedSum);
            double perDropoff = remaining / remainingDropoffs;
            for (int i = 0; i < remainingDropoffs; i++) {
                amounts.add(perDropoff);
            }
        }
        return amounts;
    }

    public int getDropoffCount() {
        return dropoffs.size();
    }

    public String getDropoff(int index) {
        return dropoffs.get(index);
    }

    public String getDropoffCargoType(int index) {
        return dropoffCargoTypes.get(index);
    }

    public double getDropoffCargoAmount(int index) {
        return dropoffCargoAmounts.get(index);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < dropoffs.size(); i++) {
            if (i > 0) {
                sb.append(" -> ");
            }
            sb.append(dropoffs.get(i)).append(" (").append(dropoffCargoTypes.get(i))
                    .append(", ").append(dropoffCargoAmounts.get(i)).append(" SCU)");
        }
        return "Mission(" + missionId + ": " + pickup + " -> [" + sb + "], "
                + cargoScu + " SCU total, " + payout + " aUEC)";
    }
}
