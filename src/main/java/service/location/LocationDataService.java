package service.location;

import model.bo.LocationCatalog;
import model.dto.snapshot.LocationSnapshotDto;

import java.util.List;

/**
 * 地点目录与距离数据服务
 * 负责加载地点目录、生成距离索引，并在数据缺失时重新生成
 */
public interface LocationDataService {

    /**
     * 获取当前地点目录，未加载时重新生成一次
     * @return 地点目录快照 (只读，可跨请求共享)
     * @throws common.exception.LocationDataUnavailableException 重新生成后仍不可用时抛出
     */
    LocationCatalog getCatalog();

    /**
     * 前端展示用的简化地点列表
     * @throws common.exception.LocationDataUnavailableException 同 getCatalog
     */
    List<LocationSnapshotDto> getSimplifiedLocations();

    /**
     * 重新读取地点目录并生成距离索引
     * @throws common.exception.LocationDataUnavailableException 读取或解析失败时抛出
     */
    void reload();
}
