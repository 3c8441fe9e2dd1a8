package service.route;

import model.dto.response.RouteOutcome;
import model.entity.CargoMission;

import java.util.List;

/**
 * 路线规划算法接口
 * 替换实现即可接管规划逻辑，调用方只依赖结构化的 RouteOutcome
 */
public interface RouteOptimizer {
    /**
     * 执行规划
     * @param missions      已完成格式校验的任务
     * @param startLocation 出发地点
     * @param shipCapacity  载货量 (SCU)
     * @return 成功路线或失败详情，不抛出异常
     */
    RouteOutcome optimize(List<CargoMission> missions, String startLocation, double shipCapacity);
}
