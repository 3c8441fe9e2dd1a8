package model.dto.request;

import lombok.Data;

import java.util.List;

/**
 * 路线规划请求
 */
@Data
public class OptimizeRouteReq {

    /**
     * 待规划的货运任务
     */
    private List<MissionReq> missions;

    /**
     * 出发地点
     */
    private String startLocation;

    /**
     * 船型ID，缺省为配置中的默认船型
     */
    private String shipId;
}
