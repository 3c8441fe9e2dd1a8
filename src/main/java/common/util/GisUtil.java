package common.util;

import model.entity.Location;

public class GisUtil {

    private static final double MILLION = 1_000_000.0;

    private GisUtil() {}

    /**
     * 计算两个地点间的三维欧氏距离
     */
    public static double getDistance(Location a, Location b) {
        double dx = a.getX() - b.getX();
        double dy = a.getY() - b.getY();
        double dz = a.getZ() - b.getZ();
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * 投影到 x-z 平面，单位为百万公里，供前端绘图
     */
    public static double[] toPlanarMillions(Location location) {
        return new double[]{location.getX() / MILLION, location.getZ() / MILLION};
    }
}
