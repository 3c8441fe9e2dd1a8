package service.location.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import common.config.LocationCatalogConfig;
import common.consts.ErrorCodes;
import common.exception.LocationDataUnavailableException;
import common.util.GisUtil;
import lombok.extern.slf4j.Slf4j;
import model.bo.LocationCatalog;
import model.dto.snapshot.LocationSnapshotDto;
import model.entity.Location;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import service.location.LocationDataService;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class LocationDataServiceImpl implements LocationDataService, InitializingBean {

    private final LocationCatalogConfig config;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    // 整体替换，读取方拿到的永远是完整快照
    private volatile LocationCatalog catalog;

    public LocationDataServiceImpl(LocationCatalogConfig config, ResourceLoader resourceLoader,
                                   ObjectMapper objectMapper) {
        this.config = config;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterPropertiesSet() {
        // 启动时加载失败不阻止服务启动，请求到来时会再尝试一次
        try {
            reload();
        } catch (LocationDataUnavailableException e) {
            log.error("启动时加载地点目录失败: {}", e.getMessage());
        }
    }

    @Override
    public LocationCatalog getCatalog() {
        LocationCatalog current = catalog;
        if (current != null) {
            return current;
        }
        log.warn("地点数据不存在，重新生成...");
        reload();
        return catalog;
    }

    @Override
    public List<LocationSnapshotDto> getSimplifiedLocations() {
        List<LocationSnapshotDto> result = new ArrayList<>();
        for (Location location : getCatalog().getLocations()) {
            result.add(new LocationSnapshotDto(location.getName(), location.getType(),
                    GisUtil.toPlanarMillions(location)));
        }
        return result;
    }

    @Override
    public synchronized void reload() {
        String path = config.getCatalogPath();
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new LocationDataUnavailableException(ErrorCodes.LOCATION_DATA_UNAVAILABLE + ": " + path);
        }

        List<Location> locations;
        try (InputStream in = resource.getInputStream()) {
            locations = objectMapper.readValue(in, new TypeReference<List<Location>>() {});
        } catch (IOException e) {
            throw new LocationDataUnavailableException("地点目录解析失败: " + path, e);
        }
        if (locations == null || locations.isEmpty()) {
            throw new LocationDataUnavailableException("地点目录为空: " + path);
        }

        try {
            catalog = new LocationCatalog(new ArrayList<>(locations));
        } catch (IllegalArgumentException e) {
            throw new LocationDataUnavailableException("地点目录数据不合法: " + e.getMessage(), e);
        }
        log.info("已加载 {} 个地点并生成距离矩阵 ({})", locations.size(), path);
    }
}
