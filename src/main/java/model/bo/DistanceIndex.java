package model.bo;

import common.util.GisUtil;
import model.entity.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 距离索引
 * 地点名称 -> 行号，以及对应的距离方阵 (对角线为 0)；构建后只读
 */
public final class DistanceIndex {

    private final Map<String, Integer> indexByName;
    private final List<String> names;
    private final double[][] matrix;

    private DistanceIndex(Map<String, Integer> indexByName, List<String> names, double[][] matrix) {
        this.indexByName = indexByName;
        this.names = names;
        this.matrix = matrix;
    }

    /**
     * 按地点坐标计算三维欧氏距离矩阵，行号即地点在列表中的顺序
     */
    public static DistanceIndex fromLocations(List<Location> locations) {
        int n = locations.size();
        Map<String, Integer> indexByName = new LinkedHashMap<>(n * 2);
        List<String> names = new ArrayList<>(n);
        for (Location location : locations) {
            if (indexByName.putIfAbsent(location.getName(), names.size()) != null) {
                throw new IllegalArgumentException("地点名称重复: " + location.getName());
            }
            names.add(location.getName());
        }

        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    matrix[i][j] = GisUtil.getDistance(locations.get(i), locations.get(j));
                }
            }
        }
        return new DistanceIndex(indexByName, Collections.unmodifiableList(names), matrix);
    }

    /**
     * 直接使用外部提供的距离表，不校验对称性
     */
    public static DistanceIndex fromTable(List<String> names, double[][] table) {
        if (table.length != names.size()) {
            throw new IllegalArgumentException("距离表行数与地点数量不一致");
        }
        Map<String, Integer> indexByName = new LinkedHashMap<>(names.size() * 2);
        double[][] matrix = new double[names.size()][];
        for (int i = 0; i < names.size(); i++) {
            if (table[i].length != names.size()) {
                throw new IllegalArgumentException("距离表第 " + i + " 行长度不一致");
            }
            indexByName.put(names.get(i), i);
            matrix[i] = table[i].clone();
        }
        return new DistanceIndex(indexByName, Collections.unmodifiableList(new ArrayList<>(names)), matrix);
    }

    /**
     * @return 行号，不存在时返回 null
     */
    public Integer indexOf(String name) {
        return indexByName.get(name);
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    public double distance(int from, int to) {
        return matrix[from][to];
    }

    public List<String> getNames() {
        return names;
    }

    public int size() {
        return names.size();
    }
}
