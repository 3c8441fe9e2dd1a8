package model.bo;

import lombok.Getter;
import model.entity.Location;

import java.util.Collections;
import java.util.List;

/**
 * 一次加载得到的地点目录快照：地点列表、距离索引与距离查询
 */
@Getter
public class LocationCatalog {
    private final List<Location> locations;
    private final DistanceIndex distanceIndex;
    private final LocationGraph graph;

    public LocationCatalog(List<Location> locations) {
        this.locations = Collections.unmodifiableList(locations);
        this.distanceIndex = DistanceIndex.fromLocations(this.locations);
        this.graph = new LocationGraph(distanceIndex);
    }
}
