package service.fleet;

import common.config.FleetConfig;
import common.config.RouteConfig;
import lombok.extern.slf4j.Slf4j;
import model.entity.Ship;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 船型载货量查询
 */
@Service
@Slf4j
public class ShipCatalogService {

    private final FleetConfig fleetConfig;
    private final RouteConfig routeConfig;

    public ShipCatalogService(FleetConfig fleetConfig, RouteConfig routeConfig) {
        this.fleetConfig = fleetConfig;
        this.routeConfig = routeConfig;
    }

    public List<Ship> listShips() {
        return new ArrayList<>(fleetConfig.getShips());
    }

    /**
     * 按船型ID查载货量；未指定时使用默认船型，未知船型使用默认载货量
     */
    public double resolveCapacity(String shipId) {
        String id = shipId == null || shipId.isBlank() ? routeConfig.getDefaultShipId() : shipId;
        for (Ship ship : fleetConfig.getShips()) {
            if (ship.getId().equals(id)) {
                return ship.getCargoCapacity();
            }
        }
        log.warn("未知船型 [{}]，使用默认载货量 {} SCU", id, routeConfig.getDefaultShipCapacity());
        return routeConfig.getDefaultShipCapacity();
    }
}
