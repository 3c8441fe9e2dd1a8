package model.bo;

import common.exception.UnknownLocationException;

import java.util.List;

/**
 * 地点距离查询
 * 构建后只读，可被多个并发的规划过程共享
 */
public class LocationGraph {

    private final DistanceIndex index;

    public LocationGraph(DistanceIndex index) {
        this.index = index;
    }

    /**
     * 两地之间的距离，同一地点为 0
     *
     * @throws UnknownLocationException 任一地点不在距离索引中
     */
    public double distance(String from, String to) {
        Integer i = index.indexOf(from);
        if (i == null) throw new UnknownLocationException(from);
        Integer j = index.indexOf(to);
        if (j == null) throw new UnknownLocationException(to);
        if (from.equals(to)) {
            return 0;
        }
        return index.distance(i, j);
    }

    public boolean contains(String name) {
        return name != null && index.contains(name);
    }

    public List<String> getLocationNames() {
        return index.getNames();
    }
}
