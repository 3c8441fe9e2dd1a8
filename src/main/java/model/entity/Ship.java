package model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 船型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Ship {
    private String id;             // 船型ID (Key)
    private String name;           // 展示名称
    private double cargoCapacity;  // 载货量 (SCU)
}
