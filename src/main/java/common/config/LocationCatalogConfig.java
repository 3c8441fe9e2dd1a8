package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 地点目录配置
 *
 * cargo.location.catalog-path 地点目录文件位置，支持 classpath: 与 file: 前缀
 */
@ConfigurationProperties(prefix = "cargo.location")
@Data
public class LocationCatalogConfig {

    private String catalogPath = "classpath:data/stanton-locations.json";
}
