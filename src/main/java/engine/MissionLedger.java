package engine;

import common.consts.MissionStatusEnum;
import model.entity.CargoMission;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 任务状态机
 * 任务描述不可变，卸货进度、状态与在船货量由本类按规划过程单独记录，
 * 同一批任务可以安全地用于多个互不相关的规划。
 *
 * 每个任务在任意时刻只属于 pending / inProgress / completed 其中之一，
 * pending 保持请求顺序，inProgress 保持装货顺序。
 */
public class MissionLedger {

    private final List<CargoMission> missions;
    private final MissionStatusEnum[] status;
    private final int[] cursors;
    private final double[] aboard;

    private final Set<Integer> pending = new LinkedHashSet<>();
    private final Set<Integer> inProgress = new LinkedHashSet<>();
    private final List<Integer> completed = new ArrayList<>();

    public MissionLedger(List<CargoMission> missions) {
        this.missions = Collections.unmodifiableList(new ArrayList<>(missions));
        int n = this.missions.size();
        this.status = new MissionStatusEnum[n];
        this.cursors = new int[n];
        this.aboard = new double[n];
        for (int i = 0; i < n; i++) {
            status[i] = MissionStatusEnum.PENDING;
            pending.add(i);
        }
    }

    public int size() {
        return missions.size();
    }

    public CargoMission getMission(int index) {
        return missions.get(index);
    }

    public MissionStatusEnum getStatus(int index) {
        return status[index];
    }

    /**
     * 已完成的卸货点数量
     */
    public int getCursor(int index) {
        return cursors[index];
    }

    /**
     * 该任务当前仍在船上的货量
     */
    public double getAboard(int index) {
        return aboard[index];
    }

    public List<Integer> pendingIndices() {
        return new ArrayList<>(pending);
    }

    public List<Integer> inProgressIndices() {
        return new ArrayList<>(inProgress);
    }

    public List<Integer> completedIndices() {
        return Collections.unmodifiableList(completed);
    }

    /**
     * 是否有进行中的任务下一个卸货点就是该地点，不复制分区
     */
    public boolean hasNextDropoffAt(String location) {
        for (int i : inProgress) {
            if (location.equals(missions.get(i).getDropoff(cursors[i]))) {
                return true;
            }
        }
        return false;
    }

    /**
     * 是否有待装货的任务在该地点装货
     */
    public boolean hasPendingPickupAt(String location) {
        for (int i : pending) {
            if (location.equals(missions.get(i).getPickup())) {
                return true;
            }
        }
        return false;
    }

    public boolean hasOutstanding() {
        return !pending.isEmpty() || !inProgress.isEmpty();
    }

    /**
     * @return 下一个卸货点，任务未在进行中时返回 null
     */
    public String nextDropoff(int index) {
        if (status[index] != MissionStatusEnum.IN_PROGRESS) {
            return null;
        }
        return missions.get(index).getDropoff(cursors[index]);
    }

    public String currentDropoffCargoType(int index) {
        return missions.get(index).getDropoffCargoType(cursors[index]);
    }

    /**
     * 下一次卸货实际卸下的货量
     * 最后一个卸货点卸下该任务剩余的全部货物，其余卸货点不超过剩余货量
     */
    public double currentDropoffAmount(int index) {
        CargoMission mission = missions.get(index);
        if (cursors[index] == mission.getDropoffCount() - 1) {
            return aboard[index];
        }
        return Math.min(mission.getDropoffCargoAmount(cursors[index]), aboard[index]);
    }

    /**
     * PENDING -> IN_PROGRESS
     * 载货量校验由调用方负责
     *
     * @return 装上船的货量
     */
    public double pickUp(int index) {
        requireStatus(index, MissionStatusEnum.PENDING);
        pending.remove(index);
        inProgress.add(index);
        status[index] = MissionStatusEnum.IN_PROGRESS;
        aboard[index] = missions.get(index).getCargoScu();
        return aboard[index];
    }

    /**
     * 执行下一个卸货点：IN_PROGRESS -> IN_PROGRESS 或 IN_PROGRESS -> COMPLETED
     *
     * @return 卸下的货量
     */
    public double dropOff(int index) {
        requireStatus(index, MissionStatusEnum.IN_PROGRESS);
        double delivered = currentDropoffAmount(index);
        aboard[index] = Math.max(0, aboard[index] - delivered);
        cursors[index]++;
        if (cursors[index] >= missions.get(index).getDropoffCount()) {
            inProgress.remove(index);
            completed.add(index);
            status[index] = MissionStatusEnum.COMPLETED;
            aboard[index] = 0;
        }
        return delivered;
    }

    public boolean isComplete(int index) {
        return status[index] == MissionStatusEnum.COMPLETED;
    }

    private void requireStatus(int index, MissionStatusEnum expected) {
        if (status[index] != expected) {
            throw new IllegalStateException("任务 " + missions.get(index).getMissionId()
                    + " 当前状态为 " + status[index] + "，期望 " + expected);
        }
    }
}
