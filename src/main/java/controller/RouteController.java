package controller;

import common.Result;
import common.consts.ErrorCodes;
import common.exception.LocationDataUnavailableException;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.OptimizeRouteReq;
import model.dto.snapshot.LocationSnapshotDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import service.fleet.ShipCatalogService;
import service.location.LocationDataService;
import service.route.RouteService;

import java.util.List;

/**
 * 路线规划接口
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class RouteController {

    private final RouteService routeService;
    private final LocationDataService locationDataService;
    private final ShipCatalogService shipCatalogService;

    public RouteController(RouteService routeService, LocationDataService locationDataService,
                           ShipCatalogService shipCatalogService) {
        this.routeService = routeService;
        this.locationDataService = locationDataService;
        this.shipCatalogService = shipCatalogService;
    }

    // 规划路线: POST /api/optimize
    @PostMapping("/optimize")
    public Result optimize(@RequestBody(required = false) OptimizeRouteReq req) {
        return routeService.optimize(req);
    }

    /**
     * 可选地点列表，数据缺失时先重新生成
     */
    @GetMapping("/locations")
    public Result listLocations() {
        try {
            List<LocationSnapshotDto> locations = locationDataService.getSimplifiedLocations();
            return Result.success(locations);
        } catch (LocationDataUnavailableException e) {
            log.error("地点数据生成失败: {}", e.getMessage());
            return Result.error(503, ErrorCodes.LOCATION_DATA_GENERATION_FAILED);
        }
    }

    // 船型与载货量
    @GetMapping("/ships")
    public Result listShips() {
        return Result.success(shipCatalogService.listShips());
    }
}
