package service.route.impl;

import common.config.RouteConfig;
import common.consts.ErrorCodes;
import common.consts.RouteErrorTypeEnum;
import common.exception.LocationDataUnavailableException;
import engine.RouteBuilder;
import lombok.extern.slf4j.Slf4j;
import model.bo.LocationCatalog;
import model.dto.response.RouteError;
import model.dto.response.RouteOutcome;
import model.entity.CargoMission;
import org.springframework.stereotype.Component;
import service.location.LocationDataService;
import service.route.RouteOptimizer;

import java.util.List;

/**
 * 默认实现：单船单次贪心构建
 */
@Slf4j
@Component
public class GreedyRouteOptimizer implements RouteOptimizer {

    private final LocationDataService locationDataService;
    private final RouteConfig routeConfig;

    public GreedyRouteOptimizer(LocationDataService locationDataService, RouteConfig routeConfig) {
        this.locationDataService = locationDataService;
        this.routeConfig = routeConfig;
    }

    @Override
    public RouteOutcome optimize(List<CargoMission> missions, String startLocation, double shipCapacity) {
        if (missions == null || missions.isEmpty()) {
            return RouteOutcome.failure(RouteError.of(RouteErrorTypeEnum.NO_MISSIONS, ErrorCodes.NO_MISSIONS));
        }

        LocationCatalog catalog;
        try {
            catalog = locationDataService.getCatalog();
        } catch (LocationDataUnavailableException e) {
            log.error("地点数据不可用，无法规划: {}", e.getMessage());
            return RouteOutcome.failure(RouteError.of(RouteErrorTypeEnum.LOCATION_DATA_UNAVAILABLE,
                    ErrorCodes.LOCATION_DATA_UNAVAILABLE));
        }

        long start = System.currentTimeMillis();
        RouteBuilder builder = new RouteBuilder(catalog.getGraph(), shipCapacity, routeConfig.getMaxSteps());
        RouteOutcome outcome = builder.build(missions, startLocation);
        long cost = System.currentTimeMillis() - start;

        if (outcome.isSuccess()) {
            log.info("路线规划完成! 耗时:{}ms. 任务[{}], 起点[{}], 载货量[{}], 距离[{}], 报酬[{}]",
                    cost, missions.size(), startLocation, shipCapacity,
                    outcome.getResult().getTotalDistance(), outcome.getResult().getTotalPayout());
        } else {
            log.warn("路线规划失败: {} ({}). 任务[{}], 起点[{}], 载货量[{}]",
                    outcome.getError().getType(), outcome.getError().getError(),
                    missions.size(), startLocation, shipCapacity);
        }
        return outcome;
    }
}
