package model.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("货运任务描述测试")
class CargoMissionTest {

    private static final List<String> THREE_STOPS = Arrays.asList("Area18", "Lorville", "Orison");

    @Test
    @DisplayName("未指定卸货量时按卸货点平分")
    void testEvenSplit() {
        CargoMission m = CargoMission.of("1", "Port Olisar", Arrays.asList("Area18", "Lorville"), 90,
                "Ore", null, null, 0, null);
        assertEquals(Arrays.asList(45.0, 45.0), m.getDropoffCargoAmounts());
        assertEquals(Arrays.asList("Ore", "Ore"), m.getDropoffCargoTypes());
    }

    @Test
    @DisplayName("部分指定卸货量时剩余货量平分给未指定的卸货点")
    void testPartialAmounts() {
        CargoMission m = CargoMission.of("1", "Port Olisar", THREE_STOPS, 100,
                "Ore", null, List.of(40.0), 0, null);
        assertEquals(Arrays.asList(40.0, 30.0, 30.0), m.getDropoffCargoAmounts());
        double sum = m.getDropoffCargoAmounts().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(m.getCargoScu(), sum, 1e-9);
    }

    @Test
    @DisplayName("指定量超过总量时剩余部分按 0 计算")
    void testOverSpecifiedAmountsClampRemainder() {
        CargoMission m = CargoMission.of("1", "Port Olisar", THREE_STOPS, 50,
                "Ore", null, Arrays.asList(40.0, 30.0), 0, null);
        assertEquals(Arrays.asList(40.0, 30.0, 0.0), m.getDropoffCargoAmounts());
    }

    @Test
    @DisplayName("多余的卸货量与货物类型被截断")
    void testExtraEntriesTruncated() {
        CargoMission m = CargoMission.of("1", "Port Olisar", List.of("Area18"), 10, "Ore",
                Arrays.asList("Stims", "Medpens"), Arrays.asList(10.0, 5.0), 0, null);
        assertEquals(List.of("Stims"), m.getDropoffCargoTypes());
        assertEquals(List.of(10.0), m.getDropoffCargoAmounts());
    }

    @Test
    @DisplayName("货物类型不足时用任务级类型补齐，缺省类型为 General")
    void testCargoTypeDefaults() {
        CargoMission typed = CargoMission.of("1", "Port Olisar", THREE_STOPS, 30, "Medical Supplies",
                List.of("Stims"), null, 0, null);
        assertEquals(Arrays.asList("Stims", "Medical Supplies", "Medical Supplies"), typed.getDropoffCargoTypes());

        CargoMission untyped = CargoMission.of("2", "Port Olisar", List.of("Area18"), 30, null,
                Collections.emptyList(), Collections.emptyList(), 0, null);
        assertEquals(CargoMission.DEFAULT_CARGO_TYPE, untyped.getCargoType());
        assertEquals(List.of("General"), untyped.getDropoffCargoTypes());
        assertEquals(List.of(30.0), untyped.getDropoffCargoAmounts());
        assertEquals("", untyped.getDescription());
    }

    @Test
    @DisplayName("卸货点不能为空，数量不能为负，且创建后不可修改")
    void testValidationAndImmutability() {
        assertThrows(IllegalArgumentException.class, () -> CargoMission.of("1", "Port Olisar",
                Collections.emptyList(), 10, "Ore", null, null, 0, null));

        assertThrows(IllegalArgumentException.class, () -> CargoMission.of("1", "Port Olisar",
                List.of("Area18"), -40, "Ore", null, null, 0, null));
        assertThrows(IllegalArgumentException.class, () -> CargoMission.of("1", "Port Olisar",
                List.of("Area18"), 40, "Ore", null, List.of(-1.0), 0, null));
        assertThrows(IllegalArgumentException.class, () -> CargoMission.of("1", "Port Olisar",
                List.of("Area18"), 40, "Ore", null, null, -5, null));

        CargoMission m = CargoMission.of("1", "Port Olisar", List.of("Area18"), 10, "Ore", null, null, 0, null);
        assertThrows(UnsupportedOperationException.class, () -> m.getDropoffs().add("Lorville"));
        assertThrows(UnsupportedOperationException.class, () -> m.getDropoffCargoAmounts().set(0, 1.0));
    }
}
