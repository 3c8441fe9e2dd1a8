package common.config;

import lombok.Data;
import model.entity.Ship;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 船型载货量目录
 * 由 cargo.fleet.ships 配置，请求层按船型ID查询载货量后再调用规划核心
 */
@ConfigurationProperties(prefix = "cargo.fleet")
@Data
public class FleetConfig {

    private List<Ship> ships = new ArrayList<>();
}
