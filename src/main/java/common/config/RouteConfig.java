package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 路线规划配置
 * 参数有合理的缺省值，可以通过 Spring 配置文件覆盖：
 *
 * cargo.route.default-ship-id
 * cargo.route.default-ship-capacity
 * cargo.route.max-steps
 */
@ConfigurationProperties(prefix = "cargo.route")
@Data
public class RouteConfig {

    /**
     * 请求未指定船型时使用的船型ID
     */
    private String defaultShipId = "taurus";

    /**
     * 船型未知时使用的载货量 (SCU)，Constellation Taurus
     */
    private double defaultShipCapacity = 168;

    /**
     * 单次规划允许提交的最大动作数
     */
    private int maxSteps = 10_000;
}
