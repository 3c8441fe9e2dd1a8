package service.route;

import common.Result;
import common.consts.ErrorCodes;
import common.consts.RouteErrorTypeEnum;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.OptimizeRouteReq;
import model.dto.response.RouteError;
import model.dto.response.RouteOutcome;
import model.entity.CargoMission;
import org.springframework.stereotype.Service;
import service.fleet.ShipCatalogService;
import service.route.impl.RouteErrorLog;

import java.util.List;

/**
 * 路线规划服务
 * 负责连接 Controller 和 规划算法：请求校验、任务转换、船型查询，失败统一转为 Result
 */
@Service
@Slf4j
public class RouteService {

    private final RouteOptimizer routeOptimizer;
    private final MissionAssembler missionAssembler;
    private final ShipCatalogService shipCatalogService;
    private final RouteErrorLog errorLog;

    public RouteService(RouteOptimizer routeOptimizer, MissionAssembler missionAssembler,
                        ShipCatalogService shipCatalogService, RouteErrorLog errorLog) {
        this.routeOptimizer = routeOptimizer;
        this.missionAssembler = missionAssembler;
        this.shipCatalogService = shipCatalogService;
        this.errorLog = errorLog;
    }

    public Result optimize(OptimizeRouteReq req) {
        if (req == null) {
            return reject(RouteError.of(RouteErrorTypeEnum.INVALID_REQUEST, ErrorCodes.EMPTY_REQUEST), null, 0);
        }
        int missionCount = req.getMissions() == null ? 0 : req.getMissions().size();
        if (missionCount == 0) {
            return reject(RouteError.of(RouteErrorTypeEnum.NO_MISSIONS, ErrorCodes.NO_MISSIONS),
                    req.getStartLocation(), 0);
        }
        if (req.getStartLocation() == null || req.getStartLocation().isBlank()) {
            return reject(RouteError.of(RouteErrorTypeEnum.INVALID_REQUEST, ErrorCodes.NO_START_LOCATION),
                    null, missionCount);
        }

        List<CargoMission> missions;
        try {
            missions = missionAssembler.assemble(req.getMissions());
        } catch (BusinessException e) {
            return reject(RouteError.of(RouteErrorTypeEnum.INVALID_REQUEST, e.getMessage()),
                    req.getStartLocation(), missionCount);
        }

        double capacity = shipCatalogService.resolveCapacity(req.getShipId());
        RouteOutcome outcome = routeOptimizer.optimize(missions, req.getStartLocation(), capacity);
        if (outcome.isSuccess()) {
            return Result.success(outcome.getResult());
        }
        return reject(outcome.getError(), req.getStartLocation(), missionCount);
    }

    private Result reject(RouteError error, String startLocation, int missionCount) {
        if (error.getType() == RouteErrorTypeEnum.INVALID_REQUEST || error.getType() == RouteErrorTypeEnum.NO_MISSIONS) {
            log.warn("拒绝路线规划请求: {}", error.getError());
        }
        errorLog.recordRouteFailure(error, startLocation, missionCount);
        return Result.error(error.getType().getCode(), error.getError(), error);
    }
}
