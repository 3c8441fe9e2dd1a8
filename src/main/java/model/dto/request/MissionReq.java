package model.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.List;

/**
 * 单个货运任务的请求格式
 * 数值字段保持宽松类型 (数字或数字字符串均可)，由 MissionAssembler 统一解析
 */
@Data
public class MissionReq {
    private String id;                      // 任务编号，缺省为 M<序号>
    private String pickup;                  // 装货地点
    private Object dropoffs;                // 卸货地点列表 (必须是数组)
    private String dropoff;                 // 旧格式：单个卸货地点
    private Object cargoScu;                // 总货量
    private String cargoType;               // 任务级货物类型，缺省 General
    private List<String> dropoffCargoTypes; // 每个卸货点的货物类型
    private Object dropoffCargoAmounts;     // 每个卸货点的货量
    private Object payout;                  // 报酬，缺省 0
    private String description;

    // 区分字段缺失与显式 null
    @JsonIgnore
    private boolean cargoScuPresent;
    @JsonIgnore
    private boolean dropoffsPresent;

    public void setCargoScu(Object cargoScu) {
        this.cargoScu = cargoScu;
        this.cargoScuPresent = true;
    }

    public void setDropoffs(Object dropoffs) {
        this.dropoffs = dropoffs;
        this.dropoffsPresent = true;
    }
}
